package com.hookintel.hook.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A tracked social-media profile and its scrape state.
 * Persisted as one entry of profiles.json, keyed by the normalised handle.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Profile {

    /** Normalised handle: no leading @, lower case */
    private String id;

    private String url;

    private ProfileStatus status;

    private LocalDateTime addedAt;

    /** Set when a scrape completes */
    private LocalDateTime lastScrapedAt;

    /** Slideshow posts retained by the last completed scrape */
    private int postCount;

    /** Posts fetched by the last completed scrape, slideshows or not */
    private int totalPosts;

    /** Null unless status is FAILED */
    private String failureReason;

    /** Failed attempts since the last reset */
    private int errorCount;

    private LocalDateTime lastErrorAt;

    public Profile copy() {
        return toBuilder().build();
    }
}
