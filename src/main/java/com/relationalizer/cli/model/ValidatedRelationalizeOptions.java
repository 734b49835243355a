package com.relationalizer.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps RelationalizeCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedRelationalizeOptions {
    Mode mode;
    List<Path> inputs;
    Path outputDatabase;
    Path sqlScript;

    public enum Mode {
        ANALYZE,
        CONVERT
    }

    public boolean isScriptOutput() {
        return sqlScript != null;
    }
}
