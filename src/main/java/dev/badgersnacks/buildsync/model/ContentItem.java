package dev.badgersnacks.buildsync.model;

/**
 * A piece of content a build can be recommended for.
 */
public interface ContentItem {

    ContentCategory category();

    /**
     * Stable identity used in managed entry keys, e.g. {@code raid/broodtwister/heroic}.
     */
    String contentId();
}
