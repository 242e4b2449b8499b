package com.hookintel.hook.service;

/**
 * A fetched post lacks a required field or carries an impossible value.
 * Only that post is skipped.
 */
public class MalformedPostException extends RuntimeException {

    public MalformedPostException(String message) {
        super(message);
    }
}
