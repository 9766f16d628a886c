package dev.badgersnacks.buildsync.model;

import java.util.List;
import java.util.Objects;

/**
 * A user-declared character. The class and specialization names are kept exactly as the user
 * wrote them; {@code IdentifierMapper} decides whether they are valid.
 */
public record PlayerCharacter(String name, String className, List<String> specializations) {
    public PlayerCharacter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(className, "className");
        specializations = specializations == null ? List.of() : List.copyOf(specializations);
    }
}
