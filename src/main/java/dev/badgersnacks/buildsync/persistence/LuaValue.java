package dev.badgersnacks.buildsync.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Literal values that can appear in a SavedVariables file.
 */
interface LuaValue {

    record LuaString(String value) implements LuaValue {
    }

    record LuaNumber(String raw) implements LuaValue {
    }

    record LuaBoolean(boolean value) implements LuaValue {
    }

    record LuaNil() implements LuaValue {
    }

    /**
     * A table constructor. {@code openIndex} and {@code closeIndex} point at its braces in the
     * source text.
     */
    record LuaTable(List<Field> fields, int openIndex, int closeIndex) implements LuaValue {
        public LuaTable {
            fields = List.copyOf(fields);
        }

        Optional<String> stringField(String name) {
            for (Field field : fields) {
                if (field.key() instanceof LuaString key
                        && key.value().equals(name)
                        && field.value() instanceof LuaString value) {
                    return Optional.of(value.value());
                }
            }
            return Optional.empty();
        }
    }

    /**
     * One table field. {@code start} includes the whitespace and comments that precede it and
     * {@code end} is just past its separator when it has one. Positional fields have no key.
     */
    record Field(LuaValue key, LuaValue value, int start, int end, boolean separated) {
    }

    /**
     * A top-level {@code Name = value} statement.
     */
    record Assignment(String name, int start, int valueStart, int end, LuaValue value) {
    }
}
