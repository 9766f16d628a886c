package dev.badgersnacks.buildsync.mapping;

import dev.badgersnacks.buildsync.model.ContentItem;
import dev.badgersnacks.buildsync.model.DungeonRun;
import dev.badgersnacks.buildsync.model.FetchTarget;
import dev.badgersnacks.buildsync.model.PlayerCharacter;
import dev.badgersnacks.buildsync.model.RaidEncounter;
import dev.badgersnacks.buildsync.model.Selection;
import dev.badgersnacks.buildsync.model.WowClass;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps user-facing class, specialization and content names onto the slugs used by the remote
 * build pages. Every lookup is a pure function over fixed tables.
 */
public final class IdentifierMapper {

    private static final Pattern SLUG = Pattern.compile("[a-z0-9]+(?:-[a-z0-9]+)*");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s_]+");
    private static final Set<String> DIFFICULTIES = Set.of("normal", "heroic", "mythic");

    // Short names people actually type, mapped to the slug the remote pages use.
    private static final Map<String, String> DUNGEON_ALIASES = Map.of(
            "ara-kara", "ara-kara-city-of-echoes",
            "mists", "mists-of-tirna-scithe",
            "necrotic-wake", "the-necrotic-wake",
            "siege", "siege-of-boralus",
            "stonevault", "the-stonevault",
            "dawnbreaker", "the-dawnbreaker",
            "threads", "city-of-threads");

    public String classToken(String className) {
        return resolveClass(className)
                .map(WowClass::slug)
                .orElseThrow(() -> new IllegalArgumentException("Unknown class: " + className));
    }

    public String specToken(String className, String specialization) {
        WowClass wowClass = resolveClass(className)
                .orElseThrow(() -> new IllegalArgumentException("Unknown class: " + className));
        String spec = normalize(specialization);
        if (!wowClass.hasSpecialization(spec)) {
            throw new IllegalArgumentException(
                    "Specialization " + specialization + " is not valid for " + wowClass);
        }
        return spec;
    }

    public String bossToken(String name) {
        return requireSlug(name, "boss");
    }

    public String dungeonToken(String name) {
        String slug = requireSlug(name, "dungeon");
        return DUNGEON_ALIASES.getOrDefault(slug, slug);
    }

    public String difficultyToken(String difficulty) {
        String token = normalize(difficulty);
        if (!DIFFICULTIES.contains(token)) {
            throw new IllegalArgumentException("Unknown raid difficulty: " + difficulty);
        }
        return token;
    }

    public Optional<WowClass> resolveClass(String className) {
        if (className == null) {
            return Optional.empty();
        }
        String slug = normalize(className);
        return Arrays.stream(WowClass.values())
                .filter(candidate -> candidate.slug().equals(slug))
                .findFirst();
    }

    /**
     * Checks every class/specialization pair and content name in the selection at once.
     *
     * @throws SelectionValidationException listing each offending character and content name
     */
    public void validate(Selection selection) throws SelectionValidationException {
        List<String> problems = new ArrayList<>();
        if (selection.characters().isEmpty()) {
            problems.add("No characters declared");
        }
        Set<String> seenNames = new HashSet<>();
        for (PlayerCharacter character : selection.characters()) {
            if (!character.name().isBlank() && !seenNames.add(character.name())) {
                problems.add(character.name() + ": declared more than once");
            }
            if (character.name().isBlank()) {
                problems.add("A character with class '" + character.className() + "' has no name");
                continue;
            }
            Optional<WowClass> wowClass = resolveClass(character.className());
            if (wowClass.isEmpty()) {
                problems.add(character.name() + ": unknown class '" + character.className() + "'");
                continue;
            }
            if (character.specializations().isEmpty()) {
                problems.add(character.name() + ": no specializations declared");
            }
            List<String> invalid = character.specializations().stream()
                    .filter(spec -> !wowClass.get().hasSpecialization(normalize(spec)))
                    .collect(Collectors.toList());
            if (!invalid.isEmpty()) {
                problems.add(character.name() + ": specialization(s) " + invalid
                        + " not valid for " + wowClass.get() + " (expected one of "
                        + wowClass.get().specializations() + ")");
            }
        }
        if (!selection.raidBosses().isEmpty() && selection.raidDifficulties().isEmpty()) {
            problems.add("Raid bosses declared without any raid difficulty");
        }
        for (String difficulty : selection.raidDifficulties()) {
            if (difficulty == null || !DIFFICULTIES.contains(normalize(difficulty))) {
                problems.add("Unknown raid difficulty '" + difficulty + "'");
            }
        }
        for (String boss : selection.raidBosses()) {
            if (!isSlug(boss)) {
                problems.add("Boss name '" + boss + "' is not a lowercase-hyphenated slug");
            }
        }
        for (String dungeon : selection.dungeons()) {
            if (!isSlug(dungeon)) {
                problems.add("Dungeon name '" + dungeon + "' is not a lowercase-hyphenated slug");
            }
        }
        if (!problems.isEmpty()) {
            throw new SelectionValidationException(problems);
        }
    }

    /**
     * Human-readable label for a target, e.g. {@code Thrall - Arms - Broodtwister (Heroic)}.
     */
    public String displayLabel(FetchTarget target) {
        return target.character().name()
                + " - " + titleCase(target.specialization())
                + " - " + contentLabel(target.content());
    }

    public String contentLabel(ContentItem content) {
        if (content instanceof RaidEncounter raid) {
            return titleCase(raid.boss()) + " (" + titleCase(raid.difficulty()) + ")";
        }
        if (content instanceof DungeonRun run) {
            return titleCase(run.dungeon()) + " (M+)";
        }
        return content.contentId();
    }

    private String requireSlug(String name, String kind) {
        if (!isSlug(name)) {
            throw new IllegalArgumentException("Invalid " + kind + " slug: " + name);
        }
        return name;
    }

    private static boolean isSlug(String value) {
        return value != null && SLUG.matcher(value).matches();
    }

    static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return SEPARATORS.matcher(raw.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
    }

    static String titleCase(String slug) {
        return Arrays.stream(slug.split("-"))
                .filter(part -> !part.isEmpty())
                .map(part -> part.substring(0, 1).toUpperCase(Locale.ROOT) + part.substring(1))
                .collect(Collectors.joining(" "));
    }
}
