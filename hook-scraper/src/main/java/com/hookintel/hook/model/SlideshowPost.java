package com.hookintel.hook.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Validated slideshow post ready for the post store.
 *
 * Only posts accepted by the SlideshowFilter are stored. Everything except the
 * cached hook annotation is immutable once written.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SlideshowPost {

    // ── Identity ─────────────────────────────────────────────────────────────
    /** Unique within the owning profile */
    private String postId;

    private String profileId;

    // ── Content ──────────────────────────────────────────────────────────────
    private String caption;

    private MediaType mediaType;

    private List<String> imageUrls;

    private List<String> hashtags;

    private List<String> mentions;

    // ── Metrics ──────────────────────────────────────────────────────────────
    private Engagement engagement;

    // ── Time ─────────────────────────────────────────────────────────────────
    private LocalDateTime postedAt;

    private LocalDateTime capturedAt;

    // ── Annotation ───────────────────────────────────────────────────────────
    /** Annotation from the scrape that stored the post. The aggregator recomputes it */
    private Hook hook;
}
