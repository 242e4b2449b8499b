package com.hookintel.hook.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Training dataset rebuilt from the post store on every aggregation.
 */
public record Dataset(List<TrainingRecord> records, DatasetStatistics statistics) {

    @JsonIgnore
    public boolean isEmpty() {
        return records.isEmpty();
    }
}
