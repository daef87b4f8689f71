package com.scratchodds.domain.exception;

/**
 * The games-index page could not be fetched or yielded no games. Fatal to a snapshot run.
 */
public class ListingFailureException extends RuntimeException {

    public ListingFailureException(String message) {
        super(message);
    }

    public ListingFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
