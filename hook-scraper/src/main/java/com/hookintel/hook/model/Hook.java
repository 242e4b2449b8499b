package com.hookintel.hook.model;

/**
 * Hook derived from a post caption. Always recomputable from the caption and engagement.
 */
public record Hook(String text, HookCategory category, double qualityScore) {

    public int length() {
        return text.length();
    }
}
