package com.hookintel.hook.service;

import com.hookintel.hook.config.HookScraperProperties;
import com.hookintel.hook.model.Dataset;
import com.hookintel.hook.model.DatasetStatistics;
import com.hookintel.hook.model.Hook;
import com.hookintel.hook.model.HookCategory;
import com.hookintel.hook.model.Profile;
import com.hookintel.hook.model.SlideshowPost;
import com.hookintel.hook.model.TrainingRecord;
import com.hookintel.hook.service.hook.HookAnalyzer;
import com.hookintel.hook.store.PostStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rebuilds the training dataset from the post store.
 *
 * Hooks are always recomputed from the stored captions, so the same store contents give
 * the same dataset no matter which rules annotated the posts when they were scraped.
 * Read-only over the store; callers must not run it while a scrape is writing.
 */
@Service
@Slf4j
public class DatasetAggregator {

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "is", "are", "was", "were");

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}']+");
    private static final int FREQUENT_WORDS = 20;
    private static final int TOP_PATTERNS = 10;

    private final PostStore postStore;
    private final HookAnalyzer analyzer;
    private final int topOpeningWords;

    public DatasetAggregator(PostStore postStore, HookAnalyzer analyzer, HookScraperProperties properties) {
        this.postStore = postStore;
        this.analyzer = analyzer;
        this.topOpeningWords = properties.getHook().getTopOpeningWords();
    }

    public Dataset build(List<Profile> profiles) {
        return build(profiles, postStore);
    }

    /**
     * @param profiles registry profiles, in insertion order
     * @param store    store to read posts from
     */
    public Dataset build(List<Profile> profiles, PostStore store) {
        List<TrainingRecord> records = new ArrayList<>();
        Set<String> profileIds = new LinkedHashSet<>();

        for (String profileId : orderedProfileIds(profiles, store)) {
            List<SlideshowPost> posts = new ArrayList<>(store.load(profileId));
            posts.sort(Comparator.comparing(SlideshowPost::getCapturedAt,
                    Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder())));
            for (SlideshowPost post : posts) {
                records.add(toRecord(post, profileId));
                profileIds.add(profileId);
            }
        }

        log.info("Built dataset: {} records from {} profiles", records.size(), profileIds.size());
        return new Dataset(records, statistics(records, profileIds.size()));
    }

    /**
     * Registry order first, then profiles that still have stored posts but are no longer
     * tracked, by name.
     */
    List<String> orderedProfileIds(List<Profile> profiles, PostStore store) {
        Set<String> ids = new LinkedHashSet<>();
        for (Profile profile : profiles) {
            ids.add(profile.getId());
        }
        ids.addAll(store.profileIds());
        return new ArrayList<>(ids);
    }

    private TrainingRecord toRecord(SlideshowPost post, String profileId) {
        Hook hook = analyzer.analyze(post.getCaption(), post.getEngagement());
        return new TrainingRecord(
                hook.text(),
                hook.category(),
                hook.qualityScore(),
                post.getEngagement(),
                profileId,
                post.getPostId(),
                wordCount(hook.text()),
                post.getHashtags() == null ? List.of() : List.copyOf(post.getHashtags()));
    }

    // ── Statistics ───────────────────────────────────────────────────────────

    private DatasetStatistics statistics(List<TrainingRecord> records, int profileCount) {
        Map<HookCategory, Integer> categoryCounts = new EnumMap<>(HookCategory.class);
        for (HookCategory category : HookCategory.values()) {
            categoryCounts.put(category, 0);
        }
        Map<String, Integer> lengthBuckets = new LinkedHashMap<>();
        for (String bucket : List.of("0-20", "21-40", "41-60", "61-80", "81+")) {
            lengthBuckets.put(bucket, 0);
        }

        if (records.isEmpty()) {
            return DatasetStatistics.builder()
                    .categoryCounts(categoryCounts)
                    .topOpeningWords(Map.of())
                    .frequentWords(Map.of())
                    .commonEndings(Map.of())
                    .emojiUsage(Map.of())
                    .lengthDistribution(lengthBuckets)
                    .build();
        }

        Map<String, Integer> openings = new HashMap<>();
        Map<String, Integer> words = new HashMap<>();
        Map<String, Integer> endings = new HashMap<>();
        Map<String, Integer> emoji = new HashMap<>();
        long totalLength = 0;
        long totalWords = 0;
        double totalQuality = 0;
        double minQuality = Double.MAX_VALUE;
        double maxQuality = 0;

        for (TrainingRecord record : records) {
            categoryCounts.merge(record.category(), 1, Integer::sum);
            int length = record.hook().length();
            totalLength += length;
            totalWords += record.wordCount();
            totalQuality += record.qualityScore();
            minQuality = Math.min(minQuality, record.qualityScore());
            maxQuality = Math.max(maxQuality, record.qualityScore());
            lengthBuckets.merge(bucketOf(length), 1, Integer::sum);

            List<String> hookWords = words(record.hook());
            if (!hookWords.isEmpty()) {
                openings.merge(hookWords.get(0), 1, Integer::sum);
            }
            for (String word : hookWords) {
                if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                    words.merge(word, 1, Integer::sum);
                }
            }

            String[] tokens = record.hook().strip().toLowerCase(Locale.ROOT).split("\\s+");
            if (tokens.length > 2) {
                endings.merge(tokens[tokens.length - 2] + " " + tokens[tokens.length - 1], 1, Integer::sum);
            }
            record.hook().codePoints()
                    .filter(DatasetAggregator::isEmoji)
                    .forEach(cp -> emoji.merge(new String(Character.toChars(cp)), 1, Integer::sum));
        }

        int n = records.size();
        return DatasetStatistics.builder()
                .totalRecords(n)
                .totalProfiles(profileCount)
                .categoryCounts(categoryCounts)
                .meanHookLength(round((double) totalLength / n))
                .meanWordCount(round((double) totalWords / n))
                .meanQualityScore(round(totalQuality / n))
                .minQualityScore(minQuality)
                .maxQualityScore(maxQuality)
                .topOpeningWords(top(openings, topOpeningWords))
                .frequentWords(top(words, FREQUENT_WORDS))
                .commonEndings(top(endings, TOP_PATTERNS))
                .emojiUsage(top(emoji, TOP_PATTERNS))
                .lengthDistribution(lengthBuckets)
                .build();
    }

    private static String bucketOf(int length) {
        if (length <= 20) return "0-20";
        if (length <= 40) return "21-40";
        if (length <= 60) return "41-60";
        if (length <= 80) return "61-80";
        return "81+";
    }

    /**
     * Highest counts first, ties broken alphabetically.
     */
    private static Map<String, Integer> top(Map<String, Integer> counts, int n) {
        Map<String, Integer> top = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(Math.max(0, n))
                .forEach(e -> top.put(e.getKey(), e.getValue()));
        return top;
    }

    private static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT).replace('’', '\''));
        while (m.find()) {
            words.add(m.group());
        }
        return words;
    }

    /**
     * Emoticons, pictographs, transport symbols and regional indicators.
     */
    static boolean isEmoji(int codePoint) {
        return (codePoint >= 0x1F600 && codePoint <= 0x1F64F)
                || (codePoint >= 0x1F300 && codePoint <= 0x1F5FF)
                || (codePoint >= 0x1F680 && codePoint <= 0x1F6FF)
                || (codePoint >= 0x1F1E0 && codePoint <= 0x1F1FF);
    }

    static int wordCount(String text) {
        String stripped = text == null ? "" : text.strip();
        return stripped.isEmpty() ? 0 : stripped.split("\\s+").length;
    }

    private static double round(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }
}
