package dev.badgersnacks.buildsync.model;

import java.util.Objects;

public record DungeonRun(String dungeon) implements ContentItem {
    public DungeonRun {
        Objects.requireNonNull(dungeon, "dungeon");
    }

    @Override
    public ContentCategory category() {
        return ContentCategory.DUNGEON;
    }

    @Override
    public String contentId() {
        return "dungeon/" + dungeon;
    }
}
