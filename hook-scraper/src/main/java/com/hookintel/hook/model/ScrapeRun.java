package com.hookintel.hook.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks one scrape attempt of one profile.
 * Appended to scrape_runs.jsonl and folded into the RunSummary.
 */
@Data
@Builder
public class ScrapeRun {

    private String runId;           // UUID
    private String profileId;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private ProfileStatus outcome;  // COMPLETED | FAILED
    private int postsFetched;
    private int postsAccepted;
    private int postsRejected;
    private int postsMalformed;
    private String errorMessage;    // null on success
}
