package dev.badgersnacks.buildsync.sync;

import dev.badgersnacks.buildsync.config.UpdaterSettings;
import dev.badgersnacks.buildsync.fetch.ArchonBuildFetcher;
import dev.badgersnacks.buildsync.fetch.BuildFetcher;
import dev.badgersnacks.buildsync.mapping.IdentifierMapper;
import dev.badgersnacks.buildsync.mapping.SelectionValidationException;
import dev.badgersnacks.buildsync.model.DungeonRun;
import dev.badgersnacks.buildsync.model.FetchOutcome;
import dev.badgersnacks.buildsync.model.FetchTarget;
import dev.badgersnacks.buildsync.model.PlayerCharacter;
import dev.badgersnacks.buildsync.model.RaidEncounter;
import dev.badgersnacks.buildsync.model.Selection;
import dev.badgersnacks.buildsync.persistence.SavedVariablesDocument;
import dev.badgersnacks.buildsync.persistence.SavedVariablesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs one sync: validates the selection, expands it into fetch targets, fetches them on a bounded
 * worker pool and commits every build found to the SavedVariables file in a single write.
 */
public class BuildSyncOrchestrator implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BuildSyncOrchestrator.class);

    private final IdentifierMapper mapper;
    private final BuildFetcher fetcher;
    private final SavedVariablesStore store;
    private final ExecutorService executorService;

    public BuildSyncOrchestrator(UpdaterSettings settings) {
        this(new IdentifierMapper(), settings);
    }

    private BuildSyncOrchestrator(IdentifierMapper mapper, UpdaterSettings settings) {
        this(mapper,
                new ArchonBuildFetcher(settings, mapper),
                new SavedVariablesStore(settings),
                settings.maxConcurrentRequests());
    }

    public BuildSyncOrchestrator(IdentifierMapper mapper,
                                 BuildFetcher fetcher,
                                 SavedVariablesStore store,
                                 int maxConcurrentRequests) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.store = Objects.requireNonNull(store, "store");
        this.executorService = Executors.newFixedThreadPool(Math.max(1, maxConcurrentRequests), new WorkerThreadFactory());
    }

    /**
     * @throws SelectionValidationException before any I/O when the selection cannot be mapped
     * @throws IOException                  when the file cannot be loaded, has the wrong shape or
     *                                      cannot be written; the file is then left untouched
     */
    public RunReport run(Selection selection) throws SelectionValidationException, IOException {
        Objects.requireNonNull(selection, "selection");
        Instant start = Instant.now();
        mapper.validate(selection);

        SavedVariablesDocument document = store.load(selection.outputPath());
        int cleared = 0;
        if (selection.clearPreviousBuilds()) {
            cleared = store.clearManaged(document);
            LOGGER.info("Cleared {} previous managed build(s) from {}", cleared, selection.outputPath());
        }

        List<FetchTarget> work = expand(selection);
        LOGGER.info("Fetching {} build target(s) for {} character(s)", work.size(), selection.characters().size());
        List<TargetResult> results = dispatch(work);

        for (TargetResult result : results) {
            if (result.outcome() instanceof FetchOutcome.Found found) {
                FetchTarget target = result.target();
                store.upsert(document, store.newEntry(
                        target.key(),
                        mapper.classToken(target.character().className()),
                        mapper.displayLabel(target),
                        found.buildCode()));
            }
        }

        store.write(document, selection.outputPath());
        RunReport report = RunReport.from(selection.outputPath(), results, cleared,
                document.managedEntries().size(), Duration.between(start, Instant.now()));
        LOGGER.info("Sync finished: {} found, {} not available, {} errors",
                report.found(), report.notAvailable(), report.errors());
        return report;
    }

    /**
     * Every character × specialization × (boss × difficulty) raid target, then every
     * character × specialization × dungeon target for the current period. Duplicates collapse.
     */
    List<FetchTarget> expand(Selection selection) {
        Set<FetchTarget> targets = new LinkedHashSet<>();
        for (PlayerCharacter character : selection.characters()) {
            for (String rawSpec : character.specializations()) {
                String spec = mapper.specToken(character.className(), rawSpec);
                for (String boss : selection.raidBosses()) {
                    for (String difficulty : selection.raidDifficulties()) {
                        RaidEncounter encounter = new RaidEncounter(
                                mapper.bossToken(boss), mapper.difficultyToken(difficulty));
                        targets.add(FetchTarget.raid(character, spec, encounter));
                    }
                }
                for (String dungeon : selection.dungeons()) {
                    targets.add(FetchTarget.dungeon(character, spec, new DungeonRun(dungeon)));
                }
            }
        }
        return new ArrayList<>(targets);
    }

    private List<TargetResult> dispatch(List<FetchTarget> work) {
        List<CompletableFuture<TargetResult>> futures = work.stream()
                .map(target -> CompletableFuture.supplyAsync(() -> execute(target), executorService))
                .collect(Collectors.toList());
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
        return futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
    }

    private TargetResult execute(FetchTarget target) {
        Instant start = Instant.now();
        FetchOutcome outcome = fetchSafely(target);
        boolean fromPreviousPeriod = false;
        Optional<FetchTarget> fallback = target.fallback();
        if (outcome instanceof FetchOutcome.NotAvailable && fallback.isPresent()) {
            LOGGER.debug("No current data for {}, trying previous period", target.describe());
            outcome = fetchSafely(fallback.get());
            fromPreviousPeriod = true;
        }
        return new TargetResult(target, outcome, fromPreviousPeriod, Duration.between(start, Instant.now()));
    }

    private FetchOutcome fetchSafely(FetchTarget target) {
        try {
            return fetcher.fetch(target);
        } catch (RuntimeException e) {
            LOGGER.warn("Fetcher failed unexpectedly for {}", target.describe(), e);
            return FetchOutcome.transportError(e.toString());
        }
    }

    @Override
    public void close() {
        executorService.shutdownNow();
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "build-sync-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
