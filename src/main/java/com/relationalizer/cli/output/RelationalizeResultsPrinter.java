package com.relationalizer.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.relationalizer.cli.model.RelationalizeOptions;
import com.relationalizer.cli.model.ValidatedRelationalizeOptions;
import com.relationalizer.pipeline.DocumentFailure;
import com.relationalizer.pipeline.PipelineResult;
import com.relationalizer.pipeline.SchemaAnalysis;

/**
 * Responsible only for printing CLI progress and summaries.
 * No validation, no execution.
 */
public class RelationalizeResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(RelationalizeResultsPrinter.class);

    private static final int MAX_LISTED_FAILURES = 20;

    public void printBanner(RelationalizeOptions o, ValidatedRelationalizeOptions v) {
        log.info("=================================================");
        log.info("JSON Relationalizer");
        log.info("=================================================");
        log.info("Mode: {}", v.getMode());
        v.getInputs().forEach(input -> log.info("Input: {}", input));
        log.info("Rules File: {}", o.getRulesFile() != null ? o.getRulesFile().toAbsolutePath() : "None");
        log.info("Root Table: {}", o.getRootTable());
        log.info("Collapse Threshold: {}", o.getCollapseThreshold());
        log.info("Type Policy: {}", o.getTypePolicy());
        log.info("Reference Format: {}", o.getReferenceFormat());
        log.info("Parallelism: {}", o.getParallelism());

        if (v.getMode() == ValidatedRelationalizeOptions.Mode.CONVERT) {
            log.info("-------------------------------------------------");
            if (v.isScriptOutput()) {
                log.info("SQL Script: {}", v.getSqlScript());
            } else {
                log.info("Output Database: {}", v.getOutputDatabase());
            }
            log.info("  Update Existing Tables: {}", o.isUpdateOutputDb());
            log.info("  Skip Existing: {}", o.isSkipExisting());
            log.info("  Minimal: {}", o.isMinimal());
            log.info("  Computed Columns: {}", o.isComputedColumns());
            log.info("  Price History: {}", o.isPriceHistory() ? o.getPriceHistoryKey() : "off");
        }

        log.info("=================================================");
    }

    public void printAnalysis(SchemaAnalysis analysis) {
        log.info("");
        log.info("=================================================");
        log.info("ANALYSIS COMPLETE");
        log.info("=================================================");
        log.info("Documents Read: {}", analysis.getDocumentsRead());
        log.info("Documents Profiled: {}", analysis.getDocumentsProfiled());
        log.info("Tables Derived: {}", analysis.getTableGraph().size());
        log.info("Shape Conflicts: {}", analysis.getAggregate().shapeConflicts().size());
        printFailures(analysis.getFailures());
        log.info("=================================================");
    }

    public void printSuccess(ValidatedRelationalizeOptions v, PipelineResult result) {
        log.info("");
        log.info("=================================================");
        log.info("CONVERSION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output: {}", v.isScriptOutput() ? v.getSqlScript() : v.getOutputDatabase());
        log.info("Tables Created: {}", result.getTablesCreated());
        log.info("Documents Read: {}", result.getDocumentsRead());
        log.info("Documents Written: {}", result.getDocumentsWritten());
        log.info("Documents Skipped (not newer): {}", result.getDocumentsSkipped());
        log.info("Statements Written: {}", result.getStatementsWritten());
        printFailures(result.getFailures());
        log.info("=================================================");
    }

    public void printFailure(PipelineResult result) {
        log.error("Conversion failed: {}", result.getErrorMessage());
    }

    private void printFailures(List<DocumentFailure> failures) {
        if (failures.isEmpty()) {
            return;
        }
        log.info("");
        log.warn("Documents Rejected: {}", failures.size());
        failures.stream()
                .limit(MAX_LISTED_FAILURES)
                .forEach(f -> log.warn("  [{}] {}", f.getStage(), f.getMessage()));
        if (failures.size() > MAX_LISTED_FAILURES) {
            log.warn("  ... and {} more", failures.size() - MAX_LISTED_FAILURES);
        }
    }
}
