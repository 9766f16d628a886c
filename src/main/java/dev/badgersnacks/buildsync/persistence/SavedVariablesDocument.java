package dev.badgersnacks.buildsync.persistence;

import dev.badgersnacks.buildsync.model.BuildKey;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory view of a SavedVariables file: the text before the builds table's entries, the
 * entries themselves, and the text after them. Only {@link ManagedEntry} values are ever
 * re-rendered; everything else is written back byte for byte.
 */
public final class SavedVariablesDocument {

    private final Path path;
    private final String tableName;
    private final boolean tablePresent;
    private final String prefix;
    private final String suffix;
    private final String indent;
    private final String newline;
    private final List<DocumentEntry> entries;

    SavedVariablesDocument(Path path,
                           String tableName,
                           boolean tablePresent,
                           String prefix,
                           List<DocumentEntry> entries,
                           String suffix,
                           String indent,
                           String newline) {
        this.path = path;
        this.tableName = tableName;
        this.tablePresent = tablePresent;
        this.prefix = prefix;
        this.entries = new ArrayList<>(entries);
        this.suffix = suffix;
        this.indent = indent;
        this.newline = newline;
    }

    public Path path() {
        return path;
    }

    public String tableName() {
        return tableName;
    }

    /**
     * False when the file had no builds table yet; one is appended on write if needed.
     */
    public boolean tablePresent() {
        return tablePresent;
    }

    public List<DocumentEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<ManagedEntry> managedEntries() {
        return entries.stream()
                .filter(ManagedEntry.class::isInstance)
                .map(ManagedEntry.class::cast)
                .collect(Collectors.toList());
    }

    public List<OpaqueEntry> opaqueEntries() {
        return entries.stream()
                .filter(OpaqueEntry.class::isInstance)
                .map(OpaqueEntry.class::cast)
                .collect(Collectors.toList());
    }

    public Optional<ManagedEntry> find(BuildKey key) {
        return managedEntries().stream()
                .filter(entry -> entry.key().equals(key))
                .findFirst();
    }

    String prefix() {
        return prefix;
    }

    String suffix() {
        return suffix;
    }

    String indent() {
        return indent;
    }

    String newline() {
        return newline;
    }

    int removeManaged() {
        int before = entries.size();
        entries.removeIf(ManagedEntry.class::isInstance);
        return before - entries.size();
    }

    /**
     * Replaces the managed entry with the same key in place, or appends the entry.
     */
    boolean upsert(ManagedEntry entry) {
        for (int i = 0; i < entries.size(); i++) {
            DocumentEntry existing = entries.get(i);
            if (existing instanceof ManagedEntry managed && managed.key().equals(entry.key())) {
                entries.set(i, entry);
                return true;
            }
        }
        entries.add(entry);
        return false;
    }
}
