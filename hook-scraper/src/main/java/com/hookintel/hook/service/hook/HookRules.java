package com.hookintel.hook.service.hook;

import com.hookintel.hook.model.HookCategory;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The default ordered rule set. Earlier rules win; STATEMENT is never listed because it
 * is the classifier's fallback.
 *
 * All predicates receive the hook lower-cased with curly apostrophes straightened.
 * Markers are plain substrings, so "now" also matches inside "know". Only the leading
 * interrogative of a question is compared as a whole word.
 */
public final class HookRules {

    static final Set<String> INTERROGATIVES = Set.of(
            "how", "why", "what", "when", "where", "who", "which",
            "is", "are", "do", "does", "can", "will");

    private static final Pattern FIRST_WORD = Pattern.compile("^[^\\p{L}\\p{N}]*(\\p{L}+)");

    private static final Pattern LEADING_NUMERAL = Pattern.compile(
            "^[^\\p{L}\\p{N}#]*(?:#\\d+|top\\s+\\d+|\\d+\\s+[\\p{L}])");

    private static final Pattern BEST_WORST = Pattern.compile(
            "\\b(?:best|worst)\\s+(?!(?:the|a|an|and|or|of|to|in|on|is|are|was|it|for|ever|one)\\b)\\p{L}[\\p{L}'-]{2,}");

    private HookRules() {
    }

    public static List<HookRule> defaults() {
        return List.of(
                new HookRule(HookCategory.QUESTION, HookRules::isQuestion),
                new HookRule(HookCategory.STORY, containsAny("pov", "story time", "when i", "that time")),
                new HookRule(HookCategory.LIST, HookRules::isList),
                new HookRule(HookCategory.CHALLENGE, containsAny("challenge", "dare", "try this", "bet you can't")),
                new HookRule(HookCategory.EMOTIONAL, HookRules::isEmotional),
                new HookRule(HookCategory.EDUCATIONAL, containsAny("learn", "tutorial", "how to", "guide", "tips")),
                new HookRule(HookCategory.CONTROVERSIAL,
                        containsAny("unpopular opinion", "hot take", "nobody talks about", "controversial"))
        );
    }

    static boolean isQuestion(String hook) {
        if (hook.strip().endsWith("?")) {
            return true;
        }
        Matcher m = FIRST_WORD.matcher(hook);
        return m.find() && INTERROGATIVES.contains(m.group(1));
    }

    static boolean isList(String hook) {
        return LEADING_NUMERAL.matcher(hook).find() || BEST_WORST.matcher(hook).find();
    }

    static boolean isEmotional(String hook) {
        boolean affect = containsAny("omg", "shocking", "can't believe").test(hook)
                || hook.chars().filter(c -> c == '!').count() >= 2;
        boolean urgency = containsAny("now", "today", "before it's too late").test(hook);
        return affect && urgency;
    }

    static Predicate<String> containsAny(String... markers) {
        return hook -> {
            for (String marker : markers) {
                if (hook.contains(marker)) {
                    return true;
                }
            }
            return false;
        };
    }
}
