package dev.badgersnacks.buildsync.persistence;

import java.util.Objects;

/**
 * A field the tool does not own, kept as the exact text it was read from, including the whitespace
 * and comments in front of it.
 */
public record OpaqueEntry(String text, boolean separated) implements DocumentEntry {
    public OpaqueEntry {
        Objects.requireNonNull(text, "text");
    }
}
