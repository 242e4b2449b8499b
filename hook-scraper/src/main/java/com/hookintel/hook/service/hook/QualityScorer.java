package com.hookintel.hook.service.hook;

import com.hookintel.hook.config.HookScraperProperties;
import com.hookintel.hook.model.Engagement;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Scores a hook in [0, 1] as a weighted sum of a clarity and an engagement sub-score.
 *
 * Clarity starts at 1.0, loses lengthPenaltyPerChar for every character outside the
 * ideal length band (never below 0.1), and loses noWordsPenalty when the hook holds no
 * word at all. Engagement is log10(1 + likes + views) against log10(1 + ceiling).
 */
@Component
public class QualityScorer {

    private static final double CLARITY_FLOOR = 0.1;
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]{2,}");

    private final HookScraperProperties.HookSettings settings;

    @Autowired
    public QualityScorer(HookScraperProperties properties) {
        this(properties.getHook());
    }

    public QualityScorer(HookScraperProperties.HookSettings settings) {
        if (settings.getEngagementCeiling() < 1) {
            throw new IllegalArgumentException("engagementCeiling must be at least 1");
        }
        this.settings = settings;
    }

    public double score(String hook, Engagement engagement) {
        if (hook == null || hook.isBlank()) {
            return 0.0;
        }
        double score = settings.getClarityWeight() * clarity(hook)
                + settings.getEngagementWeight() * engagement(engagement);
        return round(clamp(score));
    }

    double clarity(String hook) {
        int length = hook.codePointCount(0, hook.length());
        int outside = 0;
        if (length < settings.getIdealMinLength()) {
            outside = settings.getIdealMinLength() - length;
        } else if (length > settings.getIdealMaxLength()) {
            outside = length - settings.getIdealMaxLength();
        }
        double clarity = Math.max(CLARITY_FLOOR, 1.0 - outside * settings.getLengthPenaltyPerChar());
        if (!WORD.matcher(hook).find()) {
            clarity -= settings.getNoWordsPenalty();
        }
        return clamp(clarity);
    }

    double engagement(Engagement engagement) {
        if (engagement == null) {
            return 0.0;
        }
        long combined = Math.max(0, engagement.likes()) + Math.max(0, engagement.views());
        return clamp(Math.log10(1.0 + combined) / Math.log10(1.0 + settings.getEngagementCeiling()));
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }
}
