package dev.badgersnacks.buildsync.model;

import java.util.Objects;

/**
 * Identity of a managed build: who it is for and which content it targets.
 */
public record BuildKey(String character, String specialization, String contentId) {
    public BuildKey {
        Objects.requireNonNull(character, "character");
        Objects.requireNonNull(specialization, "specialization");
        Objects.requireNonNull(contentId, "contentId");
    }
}
