package build.tokenbuddy.ast;

public final class TokenAnalysis {

    private TokenAnalysis() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static TokenAst analyze(String file, Object document) {
        TokenAst ast = TokenAstBuilder.build(file, document);
        ReferenceResolver.resolve(ast);
        CycleDetector.detect(ast);
        TypeInference.infer(ast);
        ReferenceDepth.compute(ast);
        return ast;
    }
}
