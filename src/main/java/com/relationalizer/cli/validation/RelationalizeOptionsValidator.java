package com.relationalizer.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.relationalizer.cli.exception.OptionsValidationException;
import com.relationalizer.cli.model.RelationalizeOptions;
import com.relationalizer.cli.model.ValidatedRelationalizeOptions;
import com.relationalizer.cli.model.ValidatedRelationalizeOptions.Mode;
import com.relationalizer.normalize.DocumentPaths;

public class RelationalizeOptionsValidator {

	private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	public ValidatedRelationalizeOptions validate(RelationalizeOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.isAnalyze() == o.isConvert()) {
			errors.add("Exactly one of --analyze or --convert is required.");
		}

		List<Path> inputs = o.getInputs() == null ? List.of() : o.getInputs();
		if (inputs.isEmpty()) {
			errors.add("At least one input file is required.");
		}
		for (Path input : inputs) {
			if (!Files.isRegularFile(input)) {
				errors.add("Input does not exist or is not a file: " + input);
			}
		}

		if (o.getRulesFile() != null && !Files.isRegularFile(o.getRulesFile())) {
			errors.add("Rules file does not exist: " + o.getRulesFile());
		}

		if (o.getRootTable() == null || !TABLE_NAME.matcher(o.getRootTable()).matches()) {
			errors.add("Root table name must be a plain identifier. Got: " + o.getRootTable());
		}
		if (o.getCollapseThreshold() < 0) {
			errors.add("Collapse threshold must be >= 0. Got: " + o.getCollapseThreshold());
		}
		if (o.getDelimiter() == null || o.getDelimiter().isEmpty()) {
			errors.add("Delimiter must not be empty.");
		}
		if (o.getParallelism() < 1) {
			errors.add("Parallelism must be >= 1. Got: " + o.getParallelism());
		}

		checkValuePath(errors, "--interior-size-path", o.getInteriorSizePath());
		checkValuePath(errors, "--price-path", o.getPricePath());
		checkValuePath(errors, "--price-text-path", o.getPriceTextPath());
		checkValuePath(errors, "--price-history-key", o.getPriceHistoryKey());

		Path outputDatabase = o.getOutputDatabase().toAbsolutePath().normalize();
		Path sqlScript = o.getSqlScript() == null ? null : o.getSqlScript().toAbsolutePath().normalize();

		if (!o.isConvert()) {
			if (sqlScript != null) {
				errors.add("--sql-script requires --convert.");
			}
			if (o.isUpdateOutputDb()) {
				errors.add("--update-output-db requires --convert.");
			}
			if (o.isSkipExisting()) {
				errors.add("--skip-existing requires --convert.");
			}
		} else {
			if (o.isSkipExisting() && sqlScript != null) {
				errors.add("--skip-existing needs an output database and cannot be combined with --sql-script.");
			}
			if (o.isUpdateOutputDb() && sqlScript == null && !Files.isRegularFile(outputDatabase)) {
				errors.add("Output database does not exist: " + outputDatabase + ". Drop --update-output-db to create it.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		List<Path> normalizedInputs = inputs.stream().map(p -> p.toAbsolutePath().normalize()).toList();
		Mode mode = o.isAnalyze() ? Mode.ANALYZE : Mode.CONVERT;
		return new ValidatedRelationalizeOptions(mode, normalizedInputs, outputDatabase, sqlScript);
	}

	private static void checkValuePath(List<String> errors, String option, String path) {
		if (path == null || !DocumentPaths.isValuePath(path)) {
			errors.add(option + " must be a path such as $.Property.Price. Got: " + path);
		}
	}
}
