package com.hookintel.hook.service;

import com.hookintel.hook.model.MediaType;
import com.hookintel.hook.model.RawPost;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlideshowFilterTest {

    private final SlideshowFilter filter = new SlideshowFilter(1000, 5000);

    @Test
    void accepts_slideshowMeetingBothThresholds() {
        assertTrue(filter.accepts(post(MediaType.SLIDESHOW, 1000L, 5000L)));
    }

    @Test
    void accepts_rejectsNonSlideshows() {
        assertFalse(filter.accepts(post(MediaType.VIDEO, 90_000L, 900_000L)));
        assertFalse(filter.accepts(post(MediaType.UNKNOWN, 90_000L, 900_000L)));
        assertFalse(filter.accepts(null));
    }

    @Test
    void accepts_rejectsBelowEitherThreshold() {
        assertFalse(filter.accepts(post(MediaType.SLIDESHOW, 999L, 50_000L)));
        assertFalse(filter.accepts(post(MediaType.SLIDESHOW, 5000L, 4999L)));
    }

    @Test
    void accepts_missingMetricCountsAsZero() {
        assertFalse(filter.accepts(post(MediaType.SLIDESHOW, null, 50_000L)));
        assertTrue(new SlideshowFilter(0, 0).accepts(post(MediaType.SLIDESHOW, null, null)));
    }

    private static RawPost post(MediaType type, Long likes, Long views) {
        return RawPost.builder().postId("1").mediaType(type).likes(likes).views(views).build();
    }
}
