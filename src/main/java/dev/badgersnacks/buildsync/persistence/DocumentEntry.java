package dev.badgersnacks.buildsync.persistence;

/**
 * One field of the builds table: either a {@link ManagedEntry} this tool owns or an
 * {@link OpaqueEntry} it must carry through untouched.
 */
public interface DocumentEntry {

    /**
     * Whether the entry's source text already ends with a field separator.
     */
    boolean separated();
}
