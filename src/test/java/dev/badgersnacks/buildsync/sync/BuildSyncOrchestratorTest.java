package dev.badgersnacks.buildsync.sync;

import dev.badgersnacks.buildsync.fetch.BuildFetcher;
import dev.badgersnacks.buildsync.mapping.IdentifierMapper;
import dev.badgersnacks.buildsync.mapping.SelectionValidationException;
import dev.badgersnacks.buildsync.model.BuildKey;
import dev.badgersnacks.buildsync.model.ContentCategory;
import dev.badgersnacks.buildsync.model.FetchOutcome;
import dev.badgersnacks.buildsync.model.FetchTarget;
import dev.badgersnacks.buildsync.model.PlayerCharacter;
import dev.badgersnacks.buildsync.model.RotationPeriod;
import dev.badgersnacks.buildsync.model.Selection;
import dev.badgersnacks.buildsync.persistence.DocumentParseException;
import dev.badgersnacks.buildsync.persistence.OpaqueEntry;
import dev.badgersnacks.buildsync.persistence.SavedVariablesDocument;
import dev.badgersnacks.buildsync.persistence.SavedVariablesStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuildSyncOrchestratorTest {

    private static final String USER_FILE = """
            ArchonTalentBuilds = {
            \t["My own build"] = {
            \t\t["code"] = "USERCODE",
            \t},
            \t["Thrall - Arms - Broodtwister (Heroic) [Archon]"] = {
            \t\t["code"] = "STALE",
            \t\t["character"] = "Thrall",
            \t\t["class"] = "warrior",
            \t\t["spec"] = "arms",
            \t\t["content"] = "raid/broodtwister/heroic",
            \t},
            \t["Raid night"] = { ["code"] = "USER2" },
            }
            """;

    private final PlayerCharacter thrall = new PlayerCharacter("Thrall", "Warrior", List.of("Arms"));
    private final IdentifierMapper mapper = new IdentifierMapper();
    private final SavedVariablesStore store = new SavedVariablesStore("ArchonTalentBuilds", " [Archon]", false);

    @TempDir
    Path tempDir;

    private BuildSyncOrchestrator orchestrator;

    @AfterEach
    void shutdown() {
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    @Test
    void foundRaidBuildIsWritten() throws Exception {
        ScriptedFetcher fetcher = new ScriptedFetcher(target -> FetchOutcome.found("C4tAA"));
        Path output = tempDir.resolve("TalentBuilds.lua");

        RunReport report = orchestrator(fetcher, 2).run(raidSelection(output, false));

        assertEquals(1, report.found());
        assertEquals(0, report.notAvailable());
        assertEquals(0, report.errors());
        assertEquals(1, report.countsFor(ContentCategory.RAID).found());
        assertEquals(1, report.managedEntries());
        SavedVariablesDocument document = store.load(output);
        assertEquals(1, document.managedEntries().size());
        assertEquals("C4tAA", document.find(new BuildKey("Thrall", "arms", "raid/broodtwister/heroic"))
                .orElseThrow().buildCode());
        assertEquals("Thrall - Arms - Broodtwister (Heroic) [Archon]", document.managedEntries().get(0).label());
    }

    @Test
    void missingBuildLeavesFileContentUnchanged() throws Exception {
        Path output = write(USER_FILE);
        ScriptedFetcher fetcher = new ScriptedFetcher(target -> FetchOutcome.notAvailable());

        RunReport report = orchestrator(fetcher, 2).run(raidSelection(output, false));

        assertEquals(0, report.found());
        assertEquals(1, report.notAvailable());
        assertEquals(1, report.failures().size());
        assertTrue(report.failures().get(0).notAvailable());
        assertEquals(USER_FILE, Files.readString(output));
    }

    @Test
    void dungeonFallsBackToPreviousWeek() throws Exception {
        ScriptedFetcher fetcher = new ScriptedFetcher(target -> target.period() == RotationPeriod.CURRENT
                ? FetchOutcome.notAvailable()
                : FetchOutcome.found("LASTWEEK"));
        Path output = tempDir.resolve("TalentBuilds.lua");

        RunReport report = orchestrator(fetcher, 2).run(dungeonSelection(output, "ara-kara"));

        assertEquals(2, fetcher.calls().size());
        assertEquals(1, fetcher.callsFor(RotationPeriod.PREVIOUS));
        assertEquals(1, report.countsFor(ContentCategory.DUNGEON).found());
        assertEquals(1, report.previousPeriodHits());
        assertEquals("LASTWEEK", store.load(output)
                .find(new BuildKey("Thrall", "arms", "dungeon/ara-kara")).orElseThrow().buildCode());
    }

    @Test
    void noFallbackAfterFoundOrTransportError() throws Exception {
        ScriptedFetcher fetcher = new ScriptedFetcher(target -> {
            String dungeon = target.content().contentId();
            return dungeon.endsWith("grim-batol")
                    ? FetchOutcome.found("CURRENT")
                    : FetchOutcome.transportError("HTTP 503");
        });
        Path output = tempDir.resolve("TalentBuilds.lua");

        RunReport report = orchestrator(fetcher, 2).run(dungeonSelection(output, "grim-batol", "stonevault"));

        assertEquals(2, fetcher.calls().size());
        assertEquals(0, fetcher.callsFor(RotationPeriod.PREVIOUS));
        assertEquals(1, report.found());
        assertEquals(1, report.errors());
        assertEquals("HTTP 503", report.failures().get(0).reason());
        assertFalse(report.failures().get(0).notAvailable());
    }

    @Test
    void oneFailingTargetDoesNotAffectOthers() throws Exception {
        ScriptedFetcher fetcher = new ScriptedFetcher(target -> {
            if (target.specialization().equals("fury")) {
                throw new IllegalStateException("boom");
            }
            return FetchOutcome.found(target.specialization().toUpperCase() + "CODE");
        });
        PlayerCharacter warrior = new PlayerCharacter("Thrall", "Warrior", List.of("arms", "fury", "protection"));
        Path output = tempDir.resolve("TalentBuilds.lua");
        Selection selection = new Selection(List.of(warrior), List.of("heroic"), List.of("broodtwister"),
                List.of(), false, output);

        RunReport report = orchestrator(fetcher, 3).run(selection);

        assertEquals(2, report.found());
        assertEquals(1, report.errors());
        assertTrue(report.failures().get(0).reason().contains("boom"));
        assertEquals(2, store.load(output).managedEntries().size());
    }

    @Test
    void repeatedRunsProduceIdenticalFile() throws Exception {
        Path output = write(USER_FILE);
        ScriptedFetcher fetcher = new ScriptedFetcher(target -> FetchOutcome.found("FRESH"));
        BuildSyncOrchestrator sync = orchestrator(fetcher, 2);
        Selection selection = new Selection(List.of(thrall), List.of("heroic"), List.of("broodtwister"),
                List.of("grim-batol"), false, output);

        RunReport first = sync.run(selection);
        byte[] afterFirst = Files.readAllBytes(output);
        RunReport second = sync.run(selection);

        assertArrayEquals(afterFirst, Files.readAllBytes(output));
        assertEquals(first.managedEntries(), second.managedEntries());
        assertEquals(2, second.managedEntries());
    }

    @Test
    void clearingKeepsUserEntries() throws Exception {
        Path output = write(USER_FILE);
        SavedVariablesDocument before = store.load(output);
        ScriptedFetcher fetcher = new ScriptedFetcher(target -> FetchOutcome.notAvailable());

        RunReport report = orchestrator(fetcher, 2).run(raidSelection(output, true));

        assertEquals(1, report.clearedEntries());
        assertEquals(0, report.managedEntries());
        SavedVariablesDocument after = store.load(output);
        assertEquals(before.opaqueEntries(), after.opaqueEntries());
        assertTrue(after.managedEntries().isEmpty());
        assertFalse(Files.readString(output).contains("STALE"));
    }

    @Test
    void clearingThenRefetchingReplacesOnlyManagedEntries() throws Exception {
        Path output = write(USER_FILE);
        List<OpaqueEntry> userEntries = store.load(output).opaqueEntries();
        ScriptedFetcher fetcher = new ScriptedFetcher(target ->
                FetchOutcome.found("FRESH:" + target.content().contentId()));
        Selection selection = new Selection(List.of(thrall), List.of("heroic"), List.of("broodtwister", "sikran"),
                List.of(), true, output);

        RunReport report = orchestrator(fetcher, 2).run(selection);

        assertEquals(1, report.clearedEntries());
        assertEquals(2, report.found());
        assertEquals(2, report.managedEntries());
        SavedVariablesDocument after = store.load(output);
        assertEquals(2, userEntries.size());
        assertEquals(userEntries, after.opaqueEntries());
        assertEquals("FRESH:raid/broodtwister/heroic",
                after.find(new BuildKey("Thrall", "arms", "raid/broodtwister/heroic")).orElseThrow().buildCode());
        assertEquals("FRESH:raid/sikran/heroic",
                after.find(new BuildKey("Thrall", "arms", "raid/sikran/heroic")).orElseThrow().buildCode());
        assertFalse(Files.readString(output).contains("STALE"));
    }

    @Test
    void invalidSelectionStopsBeforeAnyWork() {
        ScriptedFetcher fetcher = new ScriptedFetcher(target -> FetchOutcome.found("X"));
        Path output = tempDir.resolve("TalentBuilds.lua");
        PlayerCharacter paladin = new PlayerCharacter("Uther", "Paladin", List.of("frost"));
        Selection selection = new Selection(List.of(paladin), List.of("heroic"), List.of("broodtwister"),
                List.of(), false, output);

        SelectionValidationException error = assertThrows(SelectionValidationException.class,
                () -> orchestrator(fetcher, 2).run(selection));

        assertTrue(error.getMessage().contains("frost"));
        assertTrue(fetcher.calls().isEmpty());
        assertFalse(Files.exists(output));
    }

    @Test
    void unreadableFileIsLeftAloneAndNothingIsFetched() throws Exception {
        String broken = "ArchonTalentBuilds = {\n\t[\"a\"] = \n";
        Path output = write(broken);
        ScriptedFetcher fetcher = new ScriptedFetcher(target -> FetchOutcome.found("X"));

        assertThrows(DocumentParseException.class, () -> orchestrator(fetcher, 2).run(raidSelection(output, false)));

        assertTrue(fetcher.calls().isEmpty());
        assertEquals(broken, Files.readString(output));
    }

    @Test
    void concurrentFetchesStayWithinLimit() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        ScriptedFetcher fetcher = new ScriptedFetcher(target -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            return FetchOutcome.found("C");
        });
        Path output = tempDir.resolve("TalentBuilds.lua");
        List<String> bosses = List.of("ulgrax-the-devourer", "the-bloodbound-horror", "sikran", "rashanan",
                "broodtwister", "nexus-princess-kyveza");
        Selection selection = new Selection(List.of(thrall), List.of("heroic", "mythic"), bosses,
                List.of(), false, output);

        RunReport report = orchestrator(fetcher, 3).run(selection);

        assertEquals(12, report.found());
        assertEquals(12, fetcher.calls().size());
        assertTrue(peak.get() <= 3, "peak " + peak.get());
    }

    @Test
    void expansionCollapsesDuplicates() {
        orchestrator = new BuildSyncOrchestrator(mapper, new ScriptedFetcher(target -> FetchOutcome.notAvailable()),
                store, 1);
        PlayerCharacter twice = new PlayerCharacter("Thrall", "Warrior", List.of("arms", "Arms"));
        Selection selection = new Selection(List.of(twice), List.of("heroic"), List.of("sikran", "sikran"),
                List.of("grim-batol"), false, tempDir.resolve("x.lua"));

        List<FetchTarget> targets = orchestrator.expand(selection);

        assertEquals(2, targets.size());
        assertEquals(ContentCategory.RAID, targets.get(0).category());
        assertEquals(ContentCategory.DUNGEON, targets.get(1).category());
    }

    private BuildSyncOrchestrator orchestrator(BuildFetcher fetcher, int concurrency) {
        orchestrator = new BuildSyncOrchestrator(mapper, fetcher, store, concurrency);
        return orchestrator;
    }

    private Selection raidSelection(Path output, boolean clear) {
        return new Selection(List.of(thrall), List.of("heroic"), List.of("broodtwister"), List.of(), clear, output);
    }

    private Selection dungeonSelection(Path output, String... dungeons) {
        return new Selection(List.of(thrall), List.of(), List.of(), List.of(dungeons), false, output);
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("TalentBuilds.lua");
        Files.writeString(file, content);
        return file;
    }

    private static final class ScriptedFetcher implements BuildFetcher {
        private final Function<FetchTarget, FetchOutcome> script;
        private final List<FetchTarget> calls = new CopyOnWriteArrayList<>();
        private final Map<RotationPeriod, AtomicInteger> periods = new ConcurrentHashMap<>();

        ScriptedFetcher(Function<FetchTarget, FetchOutcome> script) {
            this.script = script;
        }

        @Override
        public FetchOutcome fetch(FetchTarget target) {
            calls.add(target);
            if (target.period() != null) {
                periods.computeIfAbsent(target.period(), p -> new AtomicInteger()).incrementAndGet();
            }
            return script.apply(target);
        }

        List<FetchTarget> calls() {
            return calls;
        }

        int callsFor(RotationPeriod period) {
            AtomicInteger count = periods.get(period);
            return count == null ? 0 : count.get();
        }
    }
}
