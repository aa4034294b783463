package ai.proofkit.extractor.structure;

/**
 * Raised when the parser is entered with a depth counter above its ceiling.
 */
public class RecursionLimitExceededException extends RuntimeException {

    private final int depth;
    private final int maxDepth;

    public RecursionLimitExceededException(int depth, int maxDepth) {
        super("Maximum recursion depth exceeded: depth " + depth + " > " + maxDepth);
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    public int depth() {
        return depth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
