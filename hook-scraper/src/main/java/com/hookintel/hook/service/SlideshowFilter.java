package com.hookintel.hook.service;

import com.hookintel.hook.config.HookScraperProperties;
import com.hookintel.hook.model.MediaType;
import com.hookintel.hook.model.RawPost;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Keeps carousel posts with enough engagement. Most fetched posts are expected to fail
 * this check; a rejection is a normal outcome, not an error.
 */
@Component
@Slf4j
public class SlideshowFilter {

    private final long minLikes;
    private final long minViews;

    @Autowired
    public SlideshowFilter(HookScraperProperties properties) {
        this(properties.getFilter().getMinLikes(), properties.getFilter().getMinViews());
    }

    public SlideshowFilter(long minLikes, long minViews) {
        this.minLikes = minLikes;
        this.minViews = minViews;
    }

    public boolean accepts(RawPost post) {
        if (post == null || post.getMediaType() != MediaType.SLIDESHOW) {
            return false;
        }
        long likes = orZero(post.getLikes());
        long views = orZero(post.getViews());
        boolean accepted = likes >= minLikes && views >= minViews;
        if (!accepted) {
            log.debug("Rejected post {}: likes={} views={}", post.getPostId(), likes, views);
        }
        return accepted;
    }

    private static long orZero(Long value) {
        return value == null ? 0 : value;
    }
}
