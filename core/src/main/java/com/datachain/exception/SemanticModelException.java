package com.datachain.exception;

import java.util.List;

/**
 * Exception thrown when a semantic model fails its structural checks.
 *
 * <p>All violations found during construction are collected and reported
 * together, so a model author can fix every problem in one pass.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       SemanticModel model = SemanticModel.builder()...build();
 *   } catch (SemanticModelException e) {
 *       e.violations().forEach(System.err::println);
 *   }
 * </pre>
 *
 * @see com.datachain.semantic.SemanticModel
 */
public class SemanticModelException extends RuntimeException {

    private final List<String> violations;

    /**
     * Creates an exception for the given violations.
     *
     * @param violations every problem found, in discovery order
     */
    public SemanticModelException(List<String> violations) {
        super(buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * Returns the individual violations.
     *
     * @return unmodifiable list of violation messages
     */
    public List<String> violations() {
        return violations;
    }

    private static String buildMessage(List<String> violations) {
        StringBuilder sb = new StringBuilder("Invalid semantic model (")
            .append(violations.size())
            .append(violations.size() == 1 ? " violation" : " violations")
            .append("):");
        for (String violation : violations) {
            sb.append("\n  - ").append(violation);
        }
        return sb.toString();
    }
}
