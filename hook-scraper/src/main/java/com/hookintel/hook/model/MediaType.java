package com.hookintel.hook.model;

/**
 * Media-type marker attached to a post by the fetcher.
 */
public enum MediaType {
    /** Multi-image carousel post */
    SLIDESHOW,
    VIDEO,
    UNKNOWN
}
