package com.hookintel.hook.model;

import java.util.List;

/**
 * One dataset row per retained post.
 */
public record TrainingRecord(
        String hook,
        HookCategory category,
        double qualityScore,
        Engagement engagement,
        String profileId,
        String postId,
        int wordCount,
        List<String> hashtags) {
}
