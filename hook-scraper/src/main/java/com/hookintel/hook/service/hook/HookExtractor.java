package com.hookintel.hook.service.hook;

import com.hookintel.hook.config.HookScraperProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Derives the hook of a caption: its first meaningful sentence or line.
 *
 * Captions are split on runs of sentence-terminal punctuation (. ! ?) and on line
 * breaks. A trailing period is dropped from a segment; ! and ? stay attached, since
 * they carry meaning for classification. When no segment is long enough the whole
 * caption is used. Hooks never exceed the configured maximum length.
 */
@Component
public class HookExtractor {

    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[\\h\\x0B\\f]+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?|\\u2028|\\u2029");

    private final int maxLength;
    private final int minSegmentLength;

    @Autowired
    public HookExtractor(HookScraperProperties properties) {
        this(properties.getHook().getMaxLength(), properties.getHook().getMinSegmentLength());
    }

    public HookExtractor(int maxLength, int minSegmentLength) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive");
        }
        this.maxLength = maxLength;
        this.minSegmentLength = minSegmentLength;
    }

    public String extract(String caption) {
        if (caption == null || caption.isBlank()) {
            return "";
        }
        String normalized = normalize(caption);

        for (String segment : segments(normalized)) {
            if (segment.length() >= minSegmentLength) {
                return truncate(segment);
            }
        }
        return truncate(normalized.replace('\n', ' ').strip());
    }

    List<String> segments(String text) {
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n') {
                segments.add(current.toString().strip());
                current.setLength(0);
                i++;
            } else if (isTerminal(c)) {
                int end = i;
                while (end < text.length() && isTerminal(text.charAt(end))) {
                    end++;
                }
                current.append(text.substring(i, end).replace(".", ""));
                segments.add(current.toString().strip());
                current.setLength(0);
                i = end;
            } else {
                current.append(c);
                i++;
            }
        }
        if (current.length() > 0) {
            segments.add(current.toString().strip());
        }
        segments.removeIf(String::isEmpty);
        return segments;
    }

    private String normalize(String caption) {
        String unified = LINE_BREAK.matcher(caption).replaceAll("\n");
        return HORIZONTAL_SPACE.matcher(unified).replaceAll(" ").strip();
    }

    private static boolean isTerminal(char c) {
        return c == '.' || c == '!' || c == '?';
    }

    private String truncate(String text) {
        if (text.length() <= maxLength) {
            return text;
        }
        int end = maxLength;
        // keep surrogate pairs (emoji) whole
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end).strip();
    }
}
