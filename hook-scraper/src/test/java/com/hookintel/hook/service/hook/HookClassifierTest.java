package com.hookintel.hook.service.hook;

import com.hookintel.hook.model.HookCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HookClassifierTest {

    private final HookClassifier classifier = new HookClassifier();

    @Test
    void classify_questionWinsOverList() {
        assertEquals(HookCategory.QUESTION, classifier.classify("How many of these 5 tips do you know?"));
    }

    @Test
    void classify_povCaptionIsStory() {
        assertEquals(HookCategory.STORY, classifier.classify("POV: you just landed your dream job"));
        assertEquals(HookCategory.STORY, classifier.classify("Story time: I quit my job"));
    }

    @Test
    void classify_questionByLeadingInterrogativeOrTrailingMark() {
        assertEquals(HookCategory.QUESTION, classifier.classify("Why nobody tells you this"));
        assertEquals(HookCategory.QUESTION, classifier.classify("Would you wear this?"));
        assertEquals(HookCategory.QUESTION, classifier.classify("\"Do you even lift\""));
    }

    @Test
    void classify_list() {
        assertEquals(HookCategory.LIST, classifier.classify("3 ways to save money"));
        assertEquals(HookCategory.LIST, classifier.classify("Top 5 cafes in Paris"));
        assertEquals(HookCategory.LIST, classifier.classify("#1 mistake beginners make"));
        assertEquals(HookCategory.LIST, classifier.classify("The best budget laptops"));
    }

    @Test
    void classify_challenge() {
        assertEquals(HookCategory.CHALLENGE, classifier.classify("Try this trick with your phone"));
        assertEquals(HookCategory.CHALLENGE, classifier.classify("Bet you can’t do this"));
    }

    @Test
    void classify_emotionalNeedsAffectAndUrgency() {
        assertEquals(HookCategory.EMOTIONAL, classifier.classify("OMG you need to see this now"));
        assertEquals(HookCategory.EMOTIONAL, classifier.classify("Watch this today!! Seriously!"));
        assertEquals(HookCategory.STATEMENT, classifier.classify("OMG this is amazing"));
    }

    @Test
    void classify_educationalAndControversial() {
        assertEquals(HookCategory.EDUCATIONAL, classifier.classify("Learn Spanish in 30 days"));
        assertEquals(HookCategory.CONTROVERSIAL, classifier.classify("Unpopular opinion: pineapple belongs on pizza"));
    }

    @Test
    void classify_isTotalWithStatementFallback() {
        assertEquals(HookCategory.STATEMENT, classifier.classify("I painted my kitchen green"));
        assertEquals(HookCategory.STATEMENT, classifier.classify(""));
        assertEquals(HookCategory.STATEMENT, classifier.classify(null));
        assertEquals(HookCategory.STATEMENT, classifier.classify("🔥🔥🔥"));
    }

    @Test
    void classify_isDeterministic() {
        String hook = "Hot take: the best pasta is homemade";
        HookCategory first = classifier.classify(hook);

        for (int i = 0; i < 5; i++) {
            assertEquals(first, classifier.classify(hook));
        }
    }

    @Test
    void classify_respectsCustomRuleOrder() {
        HookClassifier storyFirst = new HookClassifier(List.of(
                new HookRule(HookCategory.STORY, h -> h.contains("pov")),
                new HookRule(HookCategory.QUESTION, HookRules::isQuestion)));

        assertEquals(HookCategory.STORY, storyFirst.classify("POV: why did I do this?"));
        assertEquals(HookCategory.QUESTION, classifier.classify("POV: why did I do this?"));
    }

    @Test
    void markers_matchAnywhereInTheHook() {
        assertTrue(HookRules.containsAny("now").test("i know the answer"));
        assertEquals(HookCategory.EMOTIONAL, classifier.classify("omg i know it"));
        assertEquals(HookCategory.EDUCATIONAL, classifier.classify("unlearn these habits"));
    }

    @Test
    void interrogative_mustBeTheWholeFirstWord() {
        assertFalse(HookRules.isQuestion("whoever said this was right"));
        assertFalse(HookRules.isQuestion("island life is underrated"));
        assertTrue(HookRules.isQuestion("who said this"));
    }
}
