package com.relationalizer.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.relationalizer.pipeline.RelationalizerConfig;
import com.relationalizer.sql.ReferenceFormat;
import com.relationalizer.sql.TypeInferencePolicy;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the relationalize command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class RelationalizeOptions {

	@Parameters(paramLabel = "INPUT", arity = "1..*", description = "Raw document stores: SQLite databases with a listings table, or JSON Lines files (.jsonl, .ndjson, .json)")
	private List<Path> inputs;

	@Option(names = { "--analyze", "-a" }, description = "Profile the documents and print the schema report")
	private boolean analyze;

	@Option(names = { "--convert", "-c" }, description = "Create the tables and insert every document")
	private boolean convert;

	@Option(names = { "--print-sql", "-p" }, description = "Print the CREATE TABLE statements")
	private boolean printSql;

	@Option(names = { "--report" }, description = "Also write the schema report to this file")
	private Path reportFile;

	@Option(names = { "--rules", "-r" }, description = "Transformation rules file")
	private Path rulesFile;

	@Option(names = { "--root-table",
			"-t" }, defaultValue = RelationalizerConfig.DEFAULT_ROOT_TABLE, description = "Name of the table with one row per document (default: ${DEFAULT-VALUE})")
	private String rootTable;

	@Option(names = {
			"--collapse-threshold" }, defaultValue = "3", description = "Scalar lists up to this size are stored as one delimited string (default: ${DEFAULT-VALUE})")
	private int collapseThreshold;

	@Option(names = { "--delimiter" }, defaultValue = RelationalizerConfig.DEFAULT_DELIMITER, description = "Delimiter for collapsed lists (default: ${DEFAULT-VALUE})")
	private String delimiter;

	@Option(names = {
			"--type-policy" }, defaultValue = "TEXT_DEFAULT", description = "Column typing: TEXT_DEFAULT or AUTOMATIC (default: ${DEFAULT-VALUE})")
	private TypeInferencePolicy typePolicy;

	@Option(names = {
			"--reference-format" }, defaultValue = "JSON_ARRAY", description = "Child keys in reference columns: JSON_ARRAY or DELIMITED (default: ${DEFAULT-VALUE})")
	private ReferenceFormat referenceFormat;

	@Option(names = { "--parallelism" }, defaultValue = "1", description = "Threads used to profile documents (default: ${DEFAULT-VALUE})")
	private int parallelism;

	@Option(names = { "--output-database",
			"-o" }, defaultValue = "output.sqlite", description = "SQLite database to write (default: ${DEFAULT-VALUE})")
	private Path outputDatabase;

	@Option(names = { "--sql-script" }, description = "Write a SQL script instead of a database")
	private Path sqlScript;

	@Option(names = { "--update-output-db",
			"-u" }, description = "Insert into the existing tables of the output database without creating them")
	private boolean updateOutputDb;

	@Option(names = { "--skip-existing",
			"-s" }, description = "Skip documents not newer than the last document written to the output database")
	private boolean skipExisting;

	@Option(names = { "--minimal", "-m" }, description = "Root table only, with the columns marked MINIMAL in the rules file")
	private boolean minimal;

	@Option(names = { "--computed-columns" }, description = "Add ComputedSQFT, ComputedPricePerSQFT, ComputedLastUpdated and ComputedNewBuild to the root table")
	private boolean computedColumns;

	@Option(names = { "--price-history" }, description = "Record a PriceHistory row whenever a listing's price changes")
	private boolean priceHistory;

	@Option(names = {
			"--interior-size-path" }, defaultValue = RelationalizerConfig.DEFAULT_INTERIOR_SIZE_PATH, description = "Interior size field, e.g. \"1200 sqft\" (default: ${DEFAULT-VALUE})")
	private String interiorSizePath;

	@Option(names = { "--price-path" }, defaultValue = RelationalizerConfig.DEFAULT_PRICE_PATH, description = "Numeric price field (default: ${DEFAULT-VALUE})")
	private String pricePath;

	@Option(names = {
			"--price-text-path" }, defaultValue = RelationalizerConfig.DEFAULT_PRICE_TEXT_PATH, description = "Advertised price text, checked for new build sales tax (default: ${DEFAULT-VALUE})")
	private String priceTextPath;

	@Option(names = {
			"--price-history-key" }, defaultValue = RelationalizerConfig.DEFAULT_PRICE_HISTORY_KEY_PATH, description = "Field identifying a listing in PriceHistory (default: ${DEFAULT-VALUE})")
	private String priceHistoryKey;

}
