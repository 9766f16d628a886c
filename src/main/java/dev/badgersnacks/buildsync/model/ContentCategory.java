package dev.badgersnacks.buildsync.model;

public enum ContentCategory {
    RAID("Raid"),
    DUNGEON("Mythic+");

    private final String label;

    ContentCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
