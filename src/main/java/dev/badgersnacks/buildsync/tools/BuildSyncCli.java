package dev.badgersnacks.buildsync.tools;

import dev.badgersnacks.buildsync.config.SelectionLoader;
import dev.badgersnacks.buildsync.config.SettingsLoader;
import dev.badgersnacks.buildsync.config.UpdaterSettings;
import dev.badgersnacks.buildsync.mapping.SelectionValidationException;
import dev.badgersnacks.buildsync.model.Selection;
import dev.badgersnacks.buildsync.sync.BuildSyncOrchestrator;
import dev.badgersnacks.buildsync.sync.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Headless entry point: reads a selection file, runs one sync and prints the report.
 */
public final class BuildSyncCli {

    private static final Logger LOGGER = LoggerFactory.getLogger(BuildSyncCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILED = 2;

    private BuildSyncCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 1 || args.length > 2) {
            System.err.println("""
                    Usage: BuildSyncCli <selection.json> [settings.json]

                    <selection.json> Characters, specializations, raid bosses, difficulties, dungeons and the
                                     SavedVariables file to update.
                    [settings.json]  Optional overrides for request rate, concurrency, timeouts and table name.
                    """);
            return EXIT_USAGE;
        }

        Path selectionFile = Paths.get(args[0]).toAbsolutePath().normalize();
        UpdaterSettings settings = new SettingsLoader()
                .load(args.length > 1 ? Paths.get(args[1]).toAbsolutePath().normalize() : null);

        Selection selection;
        try {
            selection = new SelectionLoader().load(selectionFile);
        } catch (IOException e) {
            System.err.printf("Failed to read selection %s: %s%n", selectionFile, e.getMessage());
            return EXIT_USAGE;
        }

        try (BuildSyncOrchestrator orchestrator = new BuildSyncOrchestrator(settings)) {
            RunReport report = orchestrator.run(selection);
            System.out.print(report.summary());
            return EXIT_OK;
        } catch (SelectionValidationException e) {
            System.err.println(e.getMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            LOGGER.error("Sync aborted", e);
            System.err.println("Sync failed, " + selection.outputPath() + " was not modified: " + e.getMessage());
            return EXIT_FAILED;
        }
    }
}
