package com.hookintel.hook.store;

/**
 * Registry or post store could not be read or written. Fatal for a scrape run.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
