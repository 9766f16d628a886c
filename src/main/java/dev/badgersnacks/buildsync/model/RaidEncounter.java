package dev.badgersnacks.buildsync.model;

import java.util.Objects;

public record RaidEncounter(String boss, String difficulty) implements ContentItem {
    public RaidEncounter {
        Objects.requireNonNull(boss, "boss");
        Objects.requireNonNull(difficulty, "difficulty");
    }

    @Override
    public ContentCategory category() {
        return ContentCategory.RAID;
    }

    @Override
    public String contentId() {
        return "raid/" + boss + "/" + difficulty;
    }
}
