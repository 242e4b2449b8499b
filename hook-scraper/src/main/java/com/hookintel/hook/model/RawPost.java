package com.hookintel.hook.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Post as returned by a PageFetcher, before validation.
 * Every field may be missing; RawPostMapper decides what is usable.
 * Kept separate from SlideshowPost to isolate the scraping layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawPost {

    private String postId;

    private String caption;

    private MediaType mediaType;

    /** Number of images in the carousel, null when the page did not expose them */
    private Integer imageCount;

    private Long likes;

    private Long views;

    private Long comments;

    private Long shares;

    /** When the creator published the post */
    private LocalDateTime postedAt;

    /** When the fetcher read the post */
    private LocalDateTime capturedAt;

    private List<String> imageUrls;
}
