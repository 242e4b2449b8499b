package com.hookintel.hook.service.fetch;

/**
 * Navigation or network failure while fetching a profile's posts.
 * Fails the profile, never the run.
 */
public class FetchException extends RuntimeException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
