package dev.badgersnacks.buildsync.model;

/**
 * Which weekly snapshot of dungeon data a request targets.
 */
public enum RotationPeriod {
    CURRENT("this-week"),
    PREVIOUS("last-week");

    private final String slug;

    RotationPeriod(String slug) {
        this.slug = slug;
    }

    public String slug() {
        return slug;
    }
}
