package dev.badgersnacks.buildsync.persistence;

import dev.badgersnacks.buildsync.model.BuildKey;

import java.util.Objects;

/**
 * A build entry written by this tool. Entries read from disk remember their original text so an
 * untouched entry is written back exactly as it was; entries created in memory have no source
 * text and are rendered fresh.
 */
public record ManagedEntry(
        BuildKey key,
        String className,
        String label,
        String buildCode,
        String sourceText,
        boolean separated
) implements DocumentEntry {

    public ManagedEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(buildCode, "buildCode");
        className = className == null ? "" : className;
    }

    public static ManagedEntry create(BuildKey key, String className, String label, String buildCode) {
        return new ManagedEntry(key, className, label, buildCode, null, true);
    }

    public boolean fromSource() {
        return sourceText != null;
    }
}
