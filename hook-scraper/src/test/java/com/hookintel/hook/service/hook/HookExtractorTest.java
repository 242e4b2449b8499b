package com.hookintel.hook.service.hook;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HookExtractorTest {

    private final HookExtractor extractor = new HookExtractor(200, 3);

    @Test
    void extract_returnsFirstSentence() {
        assertEquals("POV: you just landed your dream job",
                extractor.extract("POV: you just landed your dream job. Here's how."));
    }

    @Test
    void extract_blankCaptionYieldsEmptyHook() {
        assertEquals("", extractor.extract(null));
        assertEquals("", extractor.extract(""));
        assertEquals("", extractor.extract("  \n\t \r\n "));
    }

    @Test
    void extract_keepsQuestionAndExclamationMarks() {
        assertEquals("How many of these 5 tips do you know?",
                extractor.extract("How many of these 5 tips do you know? Swipe to find out"));
        assertEquals("Stop scrolling!!", extractor.extract("Stop scrolling!! You need this"));
    }

    @Test
    void extract_splitsOnLineBreaks() {
        assertEquals("Top 5 habits", extractor.extract("Top 5 habits\r\nthat changed my life #habits"));
    }

    @Test
    void extract_skipsSegmentsShorterThanMinimum() {
        assertEquals("This is the real hook", extractor.extract("Ok. This is the real hook. More text"));
    }

    @Test
    void extract_usesWholeCaptionWhenNoSegmentQualifies() {
        assertEquals("Hi. Yo", extractor.extract("Hi.\nYo"));
    }

    @Test
    void extract_normalisesWhitespace() {
        assertEquals("Wait for it!!", extractor.extract("  Wait   for\tit!!  "));
    }

    @Test
    void extract_neverExceedsMaxLength() {
        HookExtractor shortExtractor = new HookExtractor(10, 3);
        List<String> captions = List.of(
                "a".repeat(500),
                "This sentence is clearly longer than ten characters. Second one.",
                "Hi.\nYo",
                "no punctuation at all just words and more words",
                "🔥🔥🔥🔥🔥🔥🔥🔥🔥🔥🔥🔥");

        for (String caption : captions) {
            assertTrue(shortExtractor.extract(caption).length() <= 10, caption);
        }
        assertEquals(200, extractor.extract("a".repeat(500)).length());
    }

    @Test
    void extract_doesNotSplitSurrogatePairs() {
        HookExtractor five = new HookExtractor(5, 3);

        assertEquals("abcd", five.extract("abcd😀xyz"));
    }

    @Test
    void segments_preserveOrder() {
        assertEquals(List.of("One line", "Two!", "Three?"), extractor.segments("One line.\nTwo! Three?"));
    }
}
