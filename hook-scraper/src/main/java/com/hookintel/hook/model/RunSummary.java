package com.hookintel.hook.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What a scrape run did, for the user.
 */
@Value
@Builder
public class RunSummary {

    int profilesCompleted;

    /** Profile id → failure reason, in completion order */
    @Singular("failure")
    Map<String, String> failures;

    /** Requested profiles that were not claimable (completed, skipped or claimed elsewhere) */
    @Singular
    List<String> unclaimedProfiles;

    int postsAccepted;
    int postsRejected;
    int postsMalformed;

    public int getProfilesFailed() {
        return failures.size();
    }

    public static RunSummary of(List<ScrapeRun> runs, List<String> unclaimed) {
        RunSummaryBuilder builder = RunSummary.builder().unclaimedProfiles(unclaimed);
        int completed = 0;
        int accepted = 0;
        int rejected = 0;
        int malformed = 0;
        for (ScrapeRun run : runs) {
            if (run.getOutcome() == ProfileStatus.COMPLETED) {
                completed++;
            } else {
                builder.failure(run.getProfileId(), run.getErrorMessage());
            }
            accepted += run.getPostsAccepted();
            rejected += run.getPostsRejected();
            malformed += run.getPostsMalformed();
        }
        return builder
                .profilesCompleted(completed)
                .postsAccepted(accepted)
                .postsRejected(rejected)
                .postsMalformed(malformed)
                .build();
    }
}
