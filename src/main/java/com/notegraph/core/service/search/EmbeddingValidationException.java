package com.notegraph.core.service.search;

/**
 * Thrown when a vector retrieval is requested without a usable embedding.
 * Raised before the retrieval index is queried.
 */
public class EmbeddingValidationException extends IllegalArgumentException {

    private final int expectedDimension;
    private final int actualDimension;

    private EmbeddingValidationException(String message, int expectedDimension, int actualDimension) {
        super(message);
        this.expectedDimension = expectedDimension;
        this.actualDimension = actualDimension;
    }

    public static EmbeddingValidationException missing(RetrievalMode mode) {
        return new EmbeddingValidationException(
                "Embedding is required for " + mode + " search", -1, -1);
    }

    public static EmbeddingValidationException dimensionMismatch(int expected, int actual) {
        return new EmbeddingValidationException(
                "Embedding dimension mismatch: expected %d, got %d".formatted(expected, actual), expected, actual);
    }

    public int getExpectedDimension() {
        return expectedDimension;
    }

    public int getActualDimension() {
        return actualDimension;
    }
}
