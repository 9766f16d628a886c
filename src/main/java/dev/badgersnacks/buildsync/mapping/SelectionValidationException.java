package dev.badgersnacks.buildsync.mapping;

import java.util.List;

/**
 * Raised before any I/O when a selection names classes, specializations or content that cannot be
 * mapped to remote identifiers.
 */
public class SelectionValidationException extends Exception {

    private final List<String> problems;

    public SelectionValidationException(List<String> problems) {
        super(buildMessage(problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }

    private static String buildMessage(List<String> problems) {
        StringBuilder sb = new StringBuilder("Invalid selection (")
                .append(problems.size())
                .append(problems.size() == 1 ? " problem):" : " problems):");
        for (String problem : problems) {
            sb.append(System.lineSeparator()).append("  - ").append(problem);
        }
        return sb.toString();
    }
}
