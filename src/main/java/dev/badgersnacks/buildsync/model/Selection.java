package dev.badgersnacks.buildsync.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Everything one sync run should do. Built once by the caller and never mutated.
 */
public record Selection(
        List<PlayerCharacter> characters,
        List<String> raidDifficulties,
        List<String> raidBosses,
        List<String> dungeons,
        boolean clearPreviousBuilds,
        Path outputPath
) {

    public Selection {
        characters = copyOrEmpty(characters);
        raidDifficulties = copyOrEmpty(raidDifficulties);
        raidBosses = copyOrEmpty(raidBosses);
        dungeons = copyOrEmpty(dungeons);
        Objects.requireNonNull(outputPath, "outputPath");
    }

    private static <T> List<T> copyOrEmpty(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
