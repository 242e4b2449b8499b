package com.hookintel.hook.service.hook;

import com.hookintel.hook.config.HookScraperProperties;
import com.hookintel.hook.model.Engagement;
import com.hookintel.hook.model.Hook;
import com.hookintel.hook.model.HookCategory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HookAnalyzerTest {

    private final HookScraperProperties properties = new HookScraperProperties();
    private final HookAnalyzer analyzer = new HookAnalyzer(
            new HookExtractor(properties),
            new HookClassifier(),
            new QualityScorer(properties));

    @Test
    void analyze_povCaptionEndToEnd() {
        Hook hook = analyzer.analyze("POV: you just landed your dream job. Here's how.",
                new Engagement(12_000, 80_000, 300, 40));

        assertEquals("POV: you just landed your dream job", hook.text());
        assertEquals(HookCategory.STORY, hook.category());
        assertTrue(hook.qualityScore() > 0.0 && hook.qualityScore() <= 1.0);
    }

    @Test
    void analyze_emptyCaptionIsZeroScoreStatement() {
        Hook hook = analyzer.analyze("   ", new Engagement(50_000, 50_000, 0, 0));

        assertEquals("", hook.text());
        assertEquals(HookCategory.STATEMENT, hook.category());
        assertEquals(0.0, hook.qualityScore());
    }
}
