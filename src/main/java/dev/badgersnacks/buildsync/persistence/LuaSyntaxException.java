package dev.badgersnacks.buildsync.persistence;

/**
 * Syntax error at a character offset of the source being read.
 */
class LuaSyntaxException extends Exception {

    private final int offset;

    LuaSyntaxException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    int offset() {
        return offset;
    }
}
