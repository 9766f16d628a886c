package dev.badgersnacks.buildsync.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.badgersnacks.buildsync.model.PlayerCharacter;
import dev.badgersnacks.buildsync.model.Selection;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Binds the user's selection JSON onto a {@link Selection}. Class and specialization names are
 * passed through untouched; checking them is the mapper's job.
 */
public final class SelectionLoader {

    private final ObjectMapper mapper;

    public SelectionLoader() {
        this(new ObjectMapper());
    }

    public SelectionLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Selection load(Path file) throws IOException {
        SelectionFile raw = mapper.readValue(file.toFile(), SelectionFile.class);
        if (raw == null) {
            throw new IOException("Selection file is empty: " + file);
        }
        return toSelection(raw);
    }

    public Selection parse(String json) throws IOException {
        return toSelection(mapper.readValue(json, SelectionFile.class));
    }

    private Selection toSelection(SelectionFile raw) throws IOException {
        if (raw.outputPath() == null || raw.outputPath().isBlank()) {
            throw new IOException("outputPath is required");
        }
        List<PlayerCharacter> characters = new ArrayList<>();
        List<CharacterEntry> entries = raw.characters() == null ? List.of() : raw.characters();
        for (int i = 0; i < entries.size(); i++) {
            CharacterEntry c = entries.get(i);
            if (c == null) {
                throw new IOException("characters[" + i + "] is null");
            }
            characters.add(new PlayerCharacter(Objects.toString(c.name(), ""), Objects.toString(c.className(), ""),
                    requireElements(c.specializations(), "characters[" + i + "].specializations")));
        }
        return new Selection(
                characters,
                requireElements(raw.raidDifficulties(), "raidDifficulties"),
                requireElements(raw.raidBosses(), "raidBosses"),
                requireElements(raw.dungeons(), "dungeons"),
                Boolean.TRUE.equals(raw.clearPreviousBuilds()),
                Path.of(raw.outputPath()));
    }

    private static List<String> requireElements(List<String> values, String field) throws IOException {
        if (values == null) {
            return List.of();
        }
        int idx = values.indexOf(null);
        if (idx >= 0) {
            throw new IOException(field + "[" + idx + "] is null");
        }
        return values;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SelectionFile(
            @JsonProperty("characters") List<CharacterEntry> characters,
            @JsonProperty("raidDifficulties") List<String> raidDifficulties,
            @JsonProperty("raidBosses") List<String> raidBosses,
            @JsonProperty("dungeons") List<String> dungeons,
            @JsonProperty("clearPreviousBuilds") Boolean clearPreviousBuilds,
            @JsonProperty("outputPath") String outputPath) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record CharacterEntry(
            @JsonProperty("name") String name,
            @JsonProperty("class") String className,
            @JsonProperty("specializations") List<String> specializations) {
    }
}
