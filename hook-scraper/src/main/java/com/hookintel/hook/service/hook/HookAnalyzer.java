package com.hookintel.hook.service.hook;

import com.hookintel.hook.model.Engagement;
import com.hookintel.hook.model.Hook;
import com.hookintel.hook.model.HookCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Extract → classify → score in one call.
 */
@Component
@RequiredArgsConstructor
public class HookAnalyzer {

    private final HookExtractor extractor;
    private final HookClassifier classifier;
    private final QualityScorer scorer;

    public Hook analyze(String caption, Engagement engagement) {
        String text = extractor.extract(caption);
        if (text.isEmpty()) {
            return new Hook("", HookCategory.STATEMENT, 0.0);
        }
        return new Hook(text, classifier.classify(text), scorer.score(text, engagement));
    }
}
