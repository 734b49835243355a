package com.relationalizer.exception;

import java.util.List;

/**
 * Holds every syntax error found in a transformation rules file.
 */
public class RuleConfigurationException extends RelationalizerException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public RuleConfigurationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
