package com.hookintel.hook.service;

import com.hookintel.hook.model.Engagement;
import com.hookintel.hook.model.MediaType;
import com.hookintel.hook.model.RawPost;
import com.hookintel.hook.model.SlideshowPost;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates fetcher output and maps it to the stored SlideshowPost model.
 */
@Component
public class RawPostMapper {

    private static final Pattern HASHTAG = Pattern.compile("#(\\w+)", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern MENTION = Pattern.compile("@([\\w.]+)", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Reject posts the rest of the pipeline cannot handle.
     *
     * @throws MalformedPostException when the id or media type is missing or a counter is negative
     */
    public void validate(RawPost raw) {
        if (raw == null) {
            throw new MalformedPostException("Post is null");
        }
        if (raw.getPostId() == null || raw.getPostId().isBlank()) {
            throw new MalformedPostException("Post has no id");
        }
        if (raw.getMediaType() == null) {
            throw new MalformedPostException("Post " + raw.getPostId() + " has no media type");
        }
        requireNonNegative(raw, "likes", raw.getLikes());
        requireNonNegative(raw, "views", raw.getViews());
        requireNonNegative(raw, "comments", raw.getComments());
        requireNonNegative(raw, "shares", raw.getShares());
    }

    /**
     * @param raw       validated fetcher output
     * @param profileId owning profile
     */
    public SlideshowPost map(RawPost raw, String profileId) {
        validate(raw);
        String caption = raw.getCaption() == null ? "" : raw.getCaption().strip();

        return SlideshowPost.builder()
                .postId(raw.getPostId().strip())
                .profileId(profileId)
                .caption(caption)
                .mediaType(raw.getMediaType() == null ? MediaType.UNKNOWN : raw.getMediaType())
                .imageUrls(raw.getImageUrls() == null ? List.of() : List.copyOf(raw.getImageUrls()))
                .hashtags(findAll(HASHTAG, caption))
                .mentions(findAll(MENTION, caption))
                .engagement(new Engagement(
                        orZero(raw.getLikes()),
                        orZero(raw.getViews()),
                        orZero(raw.getComments()),
                        orZero(raw.getShares())))
                .postedAt(raw.getPostedAt())
                .capturedAt(raw.getCapturedAt() != null ? raw.getCapturedAt() : LocalDateTime.now())
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void requireNonNegative(RawPost raw, String field, Long value) {
        if (value != null && value < 0) {
            throw new MalformedPostException("Post " + raw.getPostId() + " has negative " + field + ": " + value);
        }
    }

    private long orZero(Long value) {
        return value == null ? 0 : value;
    }

    private List<String> findAll(Pattern pattern, String text) {
        LinkedHashSet<String> found = new LinkedHashSet<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            found.add(m.group(1).toLowerCase());
        }
        return new ArrayList<>(found);
    }
}
