package dev.badgersnacks.buildsync.sync;

import dev.badgersnacks.buildsync.model.ContentCategory;
import dev.badgersnacks.buildsync.model.FetchOutcome;
import dev.badgersnacks.buildsync.model.FetchTarget;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of a completed sync run. Target-level problems are listed here; a run that produced a
 * report always counts as successful.
 */
public record RunReport(
        Path outputPath,
        Map<ContentCategory, CategoryCounts> counts,
        List<TargetFailure> failures,
        int clearedEntries,
        int previousPeriodHits,
        int managedEntries,
        Duration duration
) {

    public RunReport {
        counts = Collections.unmodifiableMap(new EnumMap<>(counts));
        failures = List.copyOf(failures);
    }

    static RunReport from(Path outputPath,
                          List<TargetResult> results,
                          int clearedEntries,
                          int managedEntries,
                          Duration duration) {
        Map<ContentCategory, int[]> tallies = new EnumMap<>(ContentCategory.class);
        for (ContentCategory category : ContentCategory.values()) {
            tallies.put(category, new int[3]);
        }
        List<TargetFailure> failures = new ArrayList<>();
        int previousPeriodHits = 0;
        for (TargetResult result : results) {
            int[] tally = tallies.get(result.target().category());
            FetchOutcome outcome = result.outcome();
            if (outcome instanceof FetchOutcome.Found) {
                tally[0]++;
                if (result.fromPreviousPeriod()) {
                    previousPeriodHits++;
                }
            } else if (outcome instanceof FetchOutcome.TransportError error) {
                tally[2]++;
                failures.add(new TargetFailure(result.target(), error.reason(), false));
            } else {
                tally[1]++;
                failures.add(new TargetFailure(result.target(), "no build published", true));
            }
        }
        Map<ContentCategory, CategoryCounts> counts = new EnumMap<>(ContentCategory.class);
        tallies.forEach((category, tally) -> counts.put(category, new CategoryCounts(tally[0], tally[1], tally[2])));
        return new RunReport(outputPath, counts, failures, clearedEntries, previousPeriodHits, managedEntries, duration);
    }

    public CategoryCounts countsFor(ContentCategory category) {
        return counts.getOrDefault(category, CategoryCounts.EMPTY);
    }

    public int found() {
        return counts.values().stream().mapToInt(CategoryCounts::found).sum();
    }

    public int notAvailable() {
        return counts.values().stream().mapToInt(CategoryCounts::notAvailable).sum();
    }

    public int errors() {
        return counts.values().stream().mapToInt(CategoryCounts::errors).sum();
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Updated %s: %d found, %d not available, %d errors (%d ms)%n",
                outputPath, found(), notAvailable(), errors(), duration.toMillis()));
        counts.forEach((category, c) -> {
            if (c.total() > 0) {
                sb.append(String.format("  %s: %d found, %d not available, %d errors%n",
                        category.label(), c.found(), c.notAvailable(), c.errors()));
            }
        });
        if (previousPeriodHits > 0) {
            sb.append(String.format("  %d dungeon build(s) taken from last week's data%n", previousPeriodHits));
        }
        if (clearedEntries > 0) {
            sb.append(String.format("  Cleared %d previous build(s)%n", clearedEntries));
        }
        sb.append(String.format("  %d managed build(s) now in file%n", managedEntries));
        for (TargetFailure failure : failures) {
            sb.append(String.format("  - %s: %s%n", failure.target().describe(), failure.reason()));
        }
        return sb.toString();
    }

    public record CategoryCounts(int found, int notAvailable, int errors) {
        static final CategoryCounts EMPTY = new CategoryCounts(0, 0, 0);

        public int total() {
            return found + notAvailable + errors;
        }
    }

    public record TargetFailure(FetchTarget target, String reason, boolean notAvailable) {
    }
}
