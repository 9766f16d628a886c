package dev.badgersnacks.buildsync.persistence;

import dev.badgersnacks.buildsync.persistence.LuaValue.Assignment;
import dev.badgersnacks.buildsync.persistence.LuaValue.Field;
import dev.badgersnacks.buildsync.persistence.LuaValue.LuaBoolean;
import dev.badgersnacks.buildsync.persistence.LuaValue.LuaNil;
import dev.badgersnacks.buildsync.persistence.LuaValue.LuaNumber;
import dev.badgersnacks.buildsync.persistence.LuaValue.LuaString;
import dev.badgersnacks.buildsync.persistence.LuaValue.LuaTable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the subset of Lua that SavedVariables files are made of: a sequence of
 * {@code Name = literal} statements where literals are strings, numbers, booleans, nil and nested
 * table constructors. Every table field keeps its exact source span so callers can copy untouched
 * regions back out verbatim.
 */
final class LuaReader {

    private static final Pattern NUMBER = Pattern.compile(
            "-?\\s*(?:0[xX](?:[0-9a-fA-F]+(?:\\.[0-9a-fA-F]*)?|\\.[0-9a-fA-F]+)(?:[pP][+-]?\\d+)?"
                    + "|(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?)");

    private final String src;
    private int pos;

    LuaReader(String src) {
        this.src = src;
    }

    List<Assignment> readChunk() throws LuaSyntaxException {
        List<Assignment> assignments = new ArrayList<>();
        while (true) {
            skipTrivia();
            if (eof()) {
                return assignments;
            }
            if (peek() == ';') {
                pos++;
                continue;
            }
            int start = pos;
            if (!isNameStart(peek())) {
                throw error("Expected a variable name");
            }
            String name = readName();
            skipTrivia();
            expect('=');
            skipTrivia();
            int valueStart = pos;
            LuaValue value = readValue();
            assignments.add(new Assignment(name, start, valueStart, pos, value));
        }
    }

    private LuaValue readValue() throws LuaSyntaxException {
        if (eof()) {
            throw error("Unexpected end of input, expected a value");
        }
        char c = peek();
        if (c == '{') {
            return readTable();
        }
        if (c == '"' || c == '\'') {
            return new LuaString(readQuoted());
        }
        if (c == '[') {
            if (longBracketLevel(pos) < 0) {
                throw error("Unexpected '['");
            }
            return new LuaString(readLongBracket());
        }
        if (c == '-' || c == '.' || isAsciiDigit(c)) {
            return readNumber();
        }
        if (isNameStart(c)) {
            int start = pos;
            String word = readName();
            switch (word) {
                case "true":
                    return new LuaBoolean(true);
                case "false":
                    return new LuaBoolean(false);
                case "nil":
                    return new LuaNil();
                default:
                    pos = start;
                    throw error("Unsupported expression '" + word + "'");
            }
        }
        throw error("Unexpected character '" + c + "'");
    }

    private LuaTable readTable() throws LuaSyntaxException {
        int open = pos;
        expect('{');
        List<Field> fields = new ArrayList<>();
        boolean expectClose = false;
        while (true) {
            int fieldStart = pos;
            skipTrivia();
            if (eof()) {
                throw new LuaSyntaxException("Unterminated table", open);
            }
            if (peek() == '}') {
                int close = pos;
                pos++;
                return new LuaTable(fields, open, close);
            }
            if (expectClose) {
                throw error("Expected ',' or '}'");
            }

            LuaValue key = null;
            LuaValue value;
            if (peek() == '[' && longBracketLevel(pos) < 0) {
                pos++;
                skipTrivia();
                key = readValue();
                skipTrivia();
                expect(']');
                skipTrivia();
                expect('=');
                skipTrivia();
                value = readValue();
            } else if (isNameStart(peek())) {
                int nameStart = pos;
                String name = readName();
                skipTrivia();
                if (!eof() && peek() == '=' && charAt(pos + 1) != '=') {
                    pos++;
                    skipTrivia();
                    key = new LuaString(name);
                    value = readValue();
                } else {
                    pos = nameStart;
                    value = readValue();
                }
            } else {
                value = readValue();
            }

            int afterValue = pos;
            skipTrivia();
            if (!eof() && (peek() == ',' || peek() == ';')) {
                pos++;
                fields.add(new Field(key, value, fieldStart, pos, true));
            } else {
                pos = afterValue;
                fields.add(new Field(key, value, fieldStart, afterValue, false));
                expectClose = true;
            }
        }
    }

    private String readQuoted() throws LuaSyntaxException {
        int start = pos;
        char quote = src.charAt(pos++);
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (eof()) {
                throw new LuaSyntaxException("Unterminated string", start);
            }
            char c = src.charAt(pos++);
            if (c == quote) {
                return sb.toString();
            }
            if (c == '\n' || c == '\r') {
                throw new LuaSyntaxException("Unfinished string", start);
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (eof()) {
                throw new LuaSyntaxException("Unterminated string", start);
            }
            char e = src.charAt(pos++);
            switch (e) {
                case 'n':
                    sb.append('\n');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                case 'a':
                    sb.append('\u0007');
                    break;
                case 'b':
                    sb.append('\b');
                    break;
                case 'f':
                    sb.append('\f');
                    break;
                case 'v':
                    sb.append('\u000B');
                    break;
                case '\\':
                case '"':
                case '\'':
                    sb.append(e);
                    break;
                case '\n':
                case '\r':
                    sb.append('\n');
                    if (!eof() && (peek() == '\n' || peek() == '\r') && peek() != e) {
                        pos++;
                    }
                    break;
                case 'x':
                    sb.append((char) parseHex(2, start));
                    break;
                case 'z':
                    while (!eof() && Character.isWhitespace(peek())) {
                        pos++;
                    }
                    break;
                case 'u':
                    expect('{');
                    int codePointStart = pos;
                    while (!eof() && peek() != '}') {
                        pos++;
                    }
                    expect('}');
                    try {
                        sb.appendCodePoint(Integer.parseInt(src.substring(codePointStart, pos - 1), 16));
                    } catch (IllegalArgumentException ex) {
                        throw new LuaSyntaxException("Invalid \\u escape", codePointStart);
                    }
                    break;
                default:
                    if (!isAsciiDigit(e)) {
                        throw new LuaSyntaxException("Invalid escape sequence '\\" + e + "'", pos - 2);
                    }
                    int value = e - '0';
                    for (int i = 0; i < 2 && !eof() && isAsciiDigit(peek()); i++) {
                        value = value * 10 + (src.charAt(pos++) - '0');
                    }
                    if (value > 255) {
                        throw new LuaSyntaxException("Decimal escape too large", pos);
                    }
                    sb.append((char) value);
            }
        }
    }

    private int parseHex(int digits, int stringStart) throws LuaSyntaxException {
        if (pos + digits > src.length()) {
            throw new LuaSyntaxException("Unterminated string", stringStart);
        }
        try {
            int value = Integer.parseInt(src.substring(pos, pos + digits), 16);
            pos += digits;
            return value;
        } catch (NumberFormatException e) {
            throw new LuaSyntaxException("Invalid \\x escape", pos);
        }
    }

    private String readLongBracket() throws LuaSyntaxException {
        int start = pos;
        int level = longBracketLevel(pos);
        pos += level + 2;
        if (!eof() && peek() == '\r') {
            pos++;
        }
        if (!eof() && peek() == '\n') {
            pos++;
        }
        String closing = "]" + "=".repeat(level) + "]";
        int end = src.indexOf(closing, pos);
        if (end < 0) {
            throw new LuaSyntaxException("Unterminated long string", start);
        }
        String content = src.substring(pos, end);
        pos = end + closing.length();
        return content;
    }

    /**
     * Level of a long bracket opening at {@code index} ({@code [[} is 0, {@code [==[} is 2), or -1.
     */
    private int longBracketLevel(int index) {
        if (charAt(index) != '[') {
            return -1;
        }
        int i = index + 1;
        while (charAt(i) == '=') {
            i++;
        }
        return charAt(i) == '[' ? i - index - 1 : -1;
    }

    private LuaNumber readNumber() throws LuaSyntaxException {
        Matcher matcher = NUMBER.matcher(src);
        matcher.region(pos, src.length());
        if (!matcher.lookingAt()) {
            throw error("Malformed number");
        }
        int end = matcher.end();
        if (end < src.length() && (isNameStart(src.charAt(end)) || isAsciiDigit(src.charAt(end)))) {
            throw error("Malformed number");
        }
        String raw = src.substring(pos, end);
        pos = end;
        return new LuaNumber(raw);
    }

    private String readName() {
        int start = pos;
        while (!eof() && (isNameStart(peek()) || isAsciiDigit(peek()))) {
            pos++;
        }
        return src.substring(start, pos);
    }

    private void skipTrivia() throws LuaSyntaxException {
        while (!eof()) {
            char c = peek();
            if (Character.isWhitespace(c) || c == '\uFEFF') {
                pos++;
            } else if (c == '-' && charAt(pos + 1) == '-') {
                skipComment();
            } else {
                return;
            }
        }
    }

    private void skipComment() throws LuaSyntaxException {
        int start = pos;
        pos += 2;
        int level = longBracketLevel(pos);
        if (level >= 0) {
            String closing = "]" + "=".repeat(level) + "]";
            int end = src.indexOf(closing, pos);
            if (end < 0) {
                throw new LuaSyntaxException("Unterminated block comment", start);
            }
            pos = end + closing.length();
            return;
        }
        while (!eof() && peek() != '\n') {
            pos++;
        }
    }

    private void expect(char expected) throws LuaSyntaxException {
        if (eof() || peek() != expected) {
            throw error("Expected '" + expected + "'");
        }
        pos++;
    }

    private LuaSyntaxException error(String message) {
        return new LuaSyntaxException(message, pos);
    }

    private boolean eof() {
        return pos >= src.length();
    }

    private char peek() {
        return src.charAt(pos);
    }

    private char charAt(int index) {
        return index < src.length() ? src.charAt(index) : '\0';
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNameStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
