package dev.badgersnacks.buildsync.fetch;

import dev.badgersnacks.buildsync.mapping.IdentifierMapper;
import dev.badgersnacks.buildsync.model.DungeonRun;
import dev.badgersnacks.buildsync.model.FetchTarget;
import dev.badgersnacks.buildsync.model.RaidEncounter;

import java.net.URI;
import java.util.Objects;

/**
 * Centralizes the URL layout of the remote build pages.
 */
public final class ArchonUrls {
    private static final String RAID_SEGMENT = "raid/talents";
    private static final String DUNGEON_SEGMENT = "mythic-plus/talents/high-keys";

    private final String baseUrl;
    private final IdentifierMapper mapper;

    public ArchonUrls(String baseUrl, IdentifierMapper mapper) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public URI targetUri(FetchTarget target) {
        String classToken = mapper.classToken(target.character().className());
        String specToken = mapper.specToken(target.character().className(), target.specialization());
        String prefix = baseUrl + "/" + specToken + "/" + classToken + "/";
        if (target.content() instanceof RaidEncounter raid) {
            return URI.create(prefix + RAID_SEGMENT
                    + "/" + mapper.difficultyToken(raid.difficulty())
                    + "/" + mapper.bossToken(raid.boss()));
        }
        if (target.content() instanceof DungeonRun run) {
            return URI.create(prefix + DUNGEON_SEGMENT
                    + "/" + mapper.dungeonToken(run.dungeon())
                    + "/" + target.period().slug());
        }
        throw new IllegalArgumentException("Unsupported content: " + target.content());
    }
}
