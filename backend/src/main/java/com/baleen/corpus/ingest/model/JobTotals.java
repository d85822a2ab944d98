package com.baleen.corpus.ingest.model;

import java.util.Collection;

/**
 * Aggregated per-feed counts. {@link #plus} is commutative and associative so outcomes can be
 * folded in any completion order.
 */
public record JobTotals(
    int feedsProcessed,
    int feedsFailed,
    int newCount,
    int duplicateCount,
    int failedCount
) {
    public static final JobTotals EMPTY = new JobTotals(0, 0, 0, 0, 0);

    public static JobTotals of(FeedOutcome outcome) {
        boolean processed = outcome.status() != FeedOutcomeStatus.CANCELLED
            && outcome.status() != FeedOutcomeStatus.SKIPPED;
        return new JobTotals(
            processed ? 1 : 0,
            outcome.status() == FeedOutcomeStatus.FAILED ? 1 : 0,
            outcome.newCount(),
            outcome.duplicateCount(),
            outcome.failedCount()
        );
    }

    public static JobTotals sum(Collection<FeedOutcome> outcomes) {
        JobTotals totals = EMPTY;
        for (FeedOutcome outcome : outcomes) {
            totals = totals.plus(of(outcome));
        }
        return totals;
    }

    public JobTotals plus(JobTotals other) {
        return new JobTotals(
            feedsProcessed + other.feedsProcessed,
            feedsFailed + other.feedsFailed,
            newCount + other.newCount,
            duplicateCount + other.duplicateCount,
            failedCount + other.failedCount
        );
    }
}
