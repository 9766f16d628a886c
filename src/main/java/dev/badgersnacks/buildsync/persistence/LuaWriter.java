package dev.badgersnacks.buildsync.persistence;

/**
 * Emits managed entries in the layout the game client itself uses for SavedVariables.
 */
final class LuaWriter {

    static final String CODE = "code";
    static final String CHARACTER = "character";
    static final String CLASS = "class";
    static final String SPEC = "spec";
    static final String CONTENT = "content";

    private LuaWriter() {
    }

    static String renderEntry(ManagedEntry entry, String indent, String newline) {
        String inner = indent + indent;
        StringBuilder sb = new StringBuilder();
        sb.append(newline).append(indent).append('[').append(quote(entry.label())).append("] = {").append(newline);
        appendField(sb, inner, CODE, entry.buildCode(), newline);
        appendField(sb, inner, CHARACTER, entry.key().character(), newline);
        if (!entry.className().isEmpty()) {
            appendField(sb, inner, CLASS, entry.className(), newline);
        }
        appendField(sb, inner, SPEC, entry.key().specialization(), newline);
        appendField(sb, inner, CONTENT, entry.key().contentId(), newline);
        sb.append(indent).append("},");
        return sb.toString();
    }

    private static void appendField(StringBuilder sb, String indent, String name, String value, String newline) {
        sb.append(indent).append('[').append(quote(name)).append("] = ").append(quote(value)).append(',').append(newline);
    }

    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c < 0x20 || c == 0x7F) {
                        sb.append(String.format("\\%03d", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }
}
