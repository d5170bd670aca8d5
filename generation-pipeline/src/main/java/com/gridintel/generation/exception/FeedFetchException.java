package com.gridintel.generation.exception;

/**
 * The live generation feed could not be fetched or did not have the expected
 * top-level shape. Fatal to the current run.
 */
public class FeedFetchException extends RuntimeException {
    public FeedFetchException(String message) {
        super(message);
    }

    public FeedFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
