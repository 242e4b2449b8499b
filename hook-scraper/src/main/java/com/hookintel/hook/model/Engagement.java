package com.hookintel.hook.model;

/**
 * Engagement counters of a post. Unknown values are stored as 0.
 */
public record Engagement(long likes, long views, long comments, long shares) {

    public static final Engagement NONE = new Engagement(0, 0, 0, 0);

    public long combined() {
        return likes + views;
    }
}
