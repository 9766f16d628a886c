package dev.badgersnacks.buildsync.persistence;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The file is valid Lua but its builds table does not have the expected shape.
 */
public class DocumentSchemaException extends IOException {

    private final Path path;

    public DocumentSchemaException(Path path, String reason) {
        super("Unexpected structure in " + path + ": " + reason);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
