package com.hookintel.hook.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Corpus-level statistics over all training records.
 * Maps are insertion ordered so serialisation is stable between runs.
 */
@Value
@Builder
public class DatasetStatistics {

    int totalRecords;
    int totalProfiles;

    /** Every taxonomy value is present, zero when unused */
    Map<HookCategory, Integer> categoryCounts;

    double meanHookLength;
    double meanWordCount;
    double meanQualityScore;
    double minQualityScore;
    double maxQualityScore;

    /** Most frequent first words, most frequent first */
    Map<String, Integer> topOpeningWords;

    /** Most frequent words with stop words removed */
    Map<String, Integer> frequentWords;

    /** Most frequent last two words of hooks longer than two words */
    Map<String, Integer> commonEndings;

    /** Most used emoji */
    Map<String, Integer> emojiUsage;

    /** Hook length buckets: 0-20, 21-40, 41-60, 61-80, 81+ */
    Map<String, Integer> lengthDistribution;
}
