package build.tokenbuddy.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class TokenAst {

    private final String file;
    private final Object document;
    private final Group root;
    private final Map<String, Token> tokens;
    private final Map<String, Group> groups;
    private final List<Reference> references;
    private final List<String> warnings;

    private final Map<String, List<String>> referencedBy = new LinkedHashMap<>();
    private final List<List<String>> cycles = new ArrayList<>();
    private final List<String> unresolved = new ArrayList<>();
    private final Map<String, String> typeInference = new LinkedHashMap<>();

    TokenAst(String file,
             Object document,
             Group root,
             Map<String, Token> tokens,
             Map<String, Group> groups,
             List<Reference> references,
             List<String> warnings) {
        this.file = file;
        this.document = document;
        this.root = root;
        this.tokens = tokens;
        this.groups = groups;
        this.references = references;
        this.warnings = warnings;
    }

    public String file() {
        return file;
    }

    public Object document() {
        return document;
    }

    public Group root() {
        return root;
    }

    public Map<String, Token> tokens() {
        return tokens;
    }

    public Optional<Token> token(String path) {
        return Optional.ofNullable(tokens.get(path));
    }

    public Map<String, Group> groups() {
        return groups;
    }

    public List<Reference> references() {
        return references;
    }

    public Map<String, List<String>> referencedBy() {
        return referencedBy;
    }

    public List<List<String>> cycles() {
        return cycles;
    }

    public List<String> unresolved() {
        return unresolved;
    }

    public Map<String, String> typeInference() {
        return typeInference;
    }

    public List<String> warnings() {
        return warnings;
    }

    public AstStatistics statistics() {
        int valid = 0, invalid = 0, circular = 0, external = 0, depth = 0;
        for (Reference reference : references) {
            if (reference.isValid()) {
                valid++;
            } else {
                invalid++;
            }
            if (reference.isCircular()) {
                circular++;
            }
            if (reference.isExternal()) {
                external++;
            }
        }
        for (Token token : tokens.values()) {
            depth = Math.max(depth, token.referenceDepth());
        }
        return new AstStatistics(tokens.size(),
                groups.size(),
                references.size(),
                valid,
                invalid,
                circular,
                external,
                depth,
                typeInference.size());
    }

    @Override
    public String toString() {
        return "TokenAst{" + file + ", " + tokens.size() + " tokens}";
    }
}
