package build.tokenbuddy.ast;

public record AstStatistics(int totalTokens,
                            int totalGroups,
                            int totalReferences,
                            int validReferences,
                            int invalidReferences,
                            int circularReferences,
                            int externalReferences,
                            int maxReferenceDepth,
                            int tokensWithInferredTypes) {
}
