package org.namix.validation;

import java.util.List;

/**
 * Raised when a finalized model maps several schema elements to the same physical name.
 */
public class ModelValidationException extends RuntimeException {

    private final List<String> problems;

    public ModelValidationException(List<String> problems) {
        super("Model validation failed with " + problems.size() + " problem(s): " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
