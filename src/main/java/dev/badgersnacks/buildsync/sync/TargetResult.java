package dev.badgersnacks.buildsync.sync;

import dev.badgersnacks.buildsync.model.FetchOutcome;
import dev.badgersnacks.buildsync.model.FetchTarget;

import java.time.Duration;

/**
 * Final outcome for one primary target. {@code fromPreviousPeriod} is set when a dungeon's
 * current-period lookup had no data and the previous-period lookup was used instead.
 */
public record TargetResult(FetchTarget target, FetchOutcome outcome, boolean fromPreviousPeriod, Duration duration) {
}
