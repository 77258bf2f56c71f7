package build.tokenbuddy.ast;

import java.util.ArrayList;

public final class ReferenceResolver {

    private ReferenceResolver() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static void resolve(TokenAst ast) {
        for (Reference reference : ast.references()) {
            Token token = ast.tokens().get(reference.from());
            if (reference.to() == null) {
                reference.reject();
                ast.unresolved().add(reference.from());
                token.invalidate("Malformed reference without target");
            } else if (reference.isExternal()) {
                reference.resolve(reference.to());
                token.warn("External reference: " + reference.to());
            } else {
                String target = ReferenceNotation.toPath(reference.to());
                if (ast.tokens().containsKey(target)) {
                    reference.resolve(target);
                    ast.referencedBy().computeIfAbsent(target, key -> new ArrayList<>()).add(reference.from());
                } else {
                    reference.reject();
                    ast.unresolved().add(reference.from());
                    token.invalidate("Reference to non-existent token: " + reference.to());
                }
            }
        }
    }
}
