package com.relationalizer;

import com.relationalizer.cli.RelationalizeCommand;

import picocli.CommandLine;

/**
 * Main entry point for the JSON relationalizer.
 * Infers a relational schema from nested listing documents and loads them into SQLite.
 */
public class RelationalizerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RelationalizeCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
