package dev.badgersnacks.buildsync.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One concrete remote lookup. {@code period} is only set for dungeon content.
 */
public record FetchTarget(PlayerCharacter character, String specialization, ContentItem content, RotationPeriod period) {

    public FetchTarget {
        Objects.requireNonNull(character, "character");
        Objects.requireNonNull(specialization, "specialization");
        Objects.requireNonNull(content, "content");
        if (content instanceof DungeonRun && period == null) {
            period = RotationPeriod.CURRENT;
        }
        if (content instanceof RaidEncounter && period != null) {
            throw new IllegalArgumentException("Raid targets have no rotation period");
        }
    }

    public static FetchTarget raid(PlayerCharacter character, String specialization, RaidEncounter encounter) {
        return new FetchTarget(character, specialization, encounter, null);
    }

    public static FetchTarget dungeon(PlayerCharacter character, String specialization, DungeonRun run) {
        return new FetchTarget(character, specialization, run, RotationPeriod.CURRENT);
    }

    public ContentCategory category() {
        return content.category();
    }

    /**
     * The previous-period variant of a current-period dungeon target, empty for anything else.
     */
    public Optional<FetchTarget> fallback() {
        if (period == RotationPeriod.CURRENT) {
            return Optional.of(new FetchTarget(character, specialization, content, RotationPeriod.PREVIOUS));
        }
        return Optional.empty();
    }

    public BuildKey key() {
        return new BuildKey(character.name(), specialization, content.contentId());
    }

    public String describe() {
        String base = character.name() + " " + specialization + " " + content.contentId();
        return period == null ? base : base + " (" + period.slug() + ")";
    }
}
