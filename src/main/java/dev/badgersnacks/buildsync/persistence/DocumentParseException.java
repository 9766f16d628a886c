package dev.badgersnacks.buildsync.persistence;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The SavedVariables file is not valid Lua (or not valid UTF-8). Nothing from it can be used.
 */
public class DocumentParseException extends IOException {

    private final Path path;
    private final int line;
    private final int column;

    public DocumentParseException(Path path, int line, int column, String reason) {
        super("Cannot parse " + path + " at line " + line + ", column " + column + ": " + reason);
        this.path = path;
        this.line = line;
        this.column = column;
    }

    public DocumentParseException(Path path, String reason, Throwable cause) {
        super("Cannot parse " + path + ": " + reason, cause);
        this.path = path;
        this.line = -1;
        this.column = -1;
    }

    public Path path() {
        return path;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
