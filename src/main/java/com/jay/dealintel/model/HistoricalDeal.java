package com.jay.dealintel.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A deal that has been through (part of) the pipeline, with its stage entry timestamps.
 * The history is kept sorted by timestamp; entries without a stage or time are dropped.
 */
public record HistoricalDeal(String dealId, List<StageHistoryEntry> stageHistory) {

    public HistoricalDeal {
        stageHistory = stageHistory == null ? List.of() : stageHistory.stream()
            .filter(Objects::nonNull)
            .filter(e -> e.stage() != null && e.timestamp() != null)
            .sorted(Comparator.comparing(StageHistoryEntry::timestamp))
            .toList();
    }

    /** Days from the first recorded stage entry to the last. */
    public double cycleDays() {
        if (stageHistory.size() < 2) return 0;
        return days(stageHistory.get(0).timestamp(), stageHistory.get(stageHistory.size() - 1).timestamp());
    }

    public LocalDateTime completedAt() {
        return stageHistory.isEmpty() ? null : stageHistory.get(stageHistory.size() - 1).timestamp();
    }

    /** Fractional days between two instants. */
    public static double days(LocalDateTime from, LocalDateTime to) {
        return Duration.between(from, to).getSeconds() / 86_400.0;
    }
}
