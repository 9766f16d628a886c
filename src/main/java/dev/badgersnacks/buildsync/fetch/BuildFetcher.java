package dev.badgersnacks.buildsync.fetch;

import dev.badgersnacks.buildsync.model.FetchOutcome;
import dev.badgersnacks.buildsync.model.FetchTarget;

/**
 * Looks up the recommended build for one target. Implementations report failures as
 * {@link FetchOutcome} values and must be safe to call from several threads at once.
 */
public interface BuildFetcher {
    FetchOutcome fetch(FetchTarget target);
}
