package dev.badgersnacks.buildsync.persistence;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writing the updated file failed. The previous file on disk is left as it was.
 */
public class DocumentWriteException extends IOException {

    private final Path path;

    public DocumentWriteException(Path path, IOException cause) {
        super("Failed to write " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
