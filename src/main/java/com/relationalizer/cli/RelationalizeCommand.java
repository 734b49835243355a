package com.relationalizer.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.relationalizer.cli.exception.OptionsValidationException;
import com.relationalizer.cli.model.RelationalizeOptions;
import com.relationalizer.cli.model.ValidatedRelationalizeOptions;
import com.relationalizer.cli.model.ValidatedRelationalizeOptions.Mode;
import com.relationalizer.cli.output.RelationalizeResultsPrinter;
import com.relationalizer.cli.validation.RelationalizeOptionsValidator;
import com.relationalizer.exception.RelationalizerException;
import com.relationalizer.exception.RuleConfigurationException;
import com.relationalizer.pipeline.PipelineResult;
import com.relationalizer.pipeline.RelationalizerConfig;
import com.relationalizer.pipeline.RelationalizerPipeline;
import com.relationalizer.pipeline.SchemaAnalysis;
import com.relationalizer.report.SchemaReportGenerator;
import com.relationalizer.rules.TransformRuleParser;
import com.relationalizer.rules.TransformRules;
import com.relationalizer.store.RawDocumentSource;
import com.relationalizer.store.RawDocumentSources;
import com.relationalizer.store.SqlScriptSink;
import com.relationalizer.store.SqlSink;
import com.relationalizer.store.SqliteSqlSink;
import com.relationalizer.util.FileWriteUtil;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command for analyzing listing documents and converting them into relational tables.
 */
@Command(
        name = "relationalize",
        mixinStandardHelpOptions = true,
        version = "json-relationalizer 1.0.0",
        description = "Infers a relational schema from nested JSON listing documents and writes them to SQLite."
)
public class RelationalizeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RelationalizeCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_BAD_CONFIGURATION = 2;

    @Mixin
    private RelationalizeOptions options = new RelationalizeOptions();

    @Spec
    private CommandSpec spec;

    private final RelationalizeOptionsValidator validator = new RelationalizeOptionsValidator();
    private final RelationalizeResultsPrinter printer = new RelationalizeResultsPrinter();

    @Override
    public Integer call() {
        ValidatedRelationalizeOptions validated;
        TransformRules rules;
        try {
            validated = validator.validate(options);
            rules = loadRules(options.getRulesFile());
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return EXIT_BAD_CONFIGURATION;
        } catch (RuleConfigurationException e) {
            log.error("Invalid rules file {}:", options.getRulesFile());
            e.getErrors().forEach(log::error);
            return EXIT_BAD_CONFIGURATION;
        } catch (IOException e) {
            log.error("Failed to read rules file {}", options.getRulesFile(), e);
            return EXIT_BAD_CONFIGURATION;
        }
        rules.getWarnings().forEach(log::warn);

        printer.printBanner(options, validated);

        RelationalizerPipeline pipeline = new RelationalizerPipeline(buildConfig(rules));
        List<RawDocumentSource> sources = validated.getInputs().stream()
                .map(input -> RawDocumentSources.open(input, pipeline.getMapper()))
                .toList();

        try {
            return validated.getMode() == Mode.ANALYZE
                    ? analyze(pipeline, sources)
                    : convert(pipeline, sources, validated);
        } catch (RelationalizerException e) {
            log.error("Run failed: {}", e.getMessage(), e);
            return EXIT_FAILED;
        } catch (IOException e) {
            log.error("Failed to write output", e);
            return EXIT_FAILED;
        }
    }

    private int analyze(RelationalizerPipeline pipeline, List<RawDocumentSource> sources) throws IOException {
        SchemaAnalysis analysis = pipeline.analyze(sources);
        String report = new SchemaReportGenerator().generate(analysis);

        PrintWriter out = spec.commandLine().getOut();
        out.print(report);
        if (options.isPrintSql()) {
            printDdl(out, analysis.getDdl());
        }
        out.flush();

        if (options.getReportFile() != null) {
            Path reportFile = options.getReportFile().toAbsolutePath().normalize();
            FileWriteUtil.safeWriteString(reportFile, report);
            log.info("Schema report written to {}", reportFile);
        }
        printer.printAnalysis(analysis);
        return EXIT_OK;
    }

    private int convert(RelationalizerPipeline pipeline, List<RawDocumentSource> sources,
                        ValidatedRelationalizeOptions validated) {
        PipelineResult result;
        try (SqlSink sink = openSink(validated)) {
            result = pipeline.run(sources, sink);
        }
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return EXIT_FAILED;
        }
        if (options.isPrintSql()) {
            PrintWriter out = spec.commandLine().getOut();
            printDdl(out, result.getAnalysis().getDdl());
            out.flush();
        }
        printer.printSuccess(validated, result);
        return EXIT_OK;
    }

    private RelationalizerConfig buildConfig(TransformRules rules) {
        return RelationalizerConfig.builder()
                .rootTableName(options.getRootTable())
                .collapseThreshold(options.getCollapseThreshold())
                .delimiter(options.getDelimiter())
                .rules(rules)
                .typePolicy(options.getTypePolicy())
                .referenceFormat(options.getReferenceFormat())
                .parallelism(options.getParallelism())
                .createTables(!options.isUpdateOutputDb())
                .minimal(options.isMinimal())
                .incremental(options.isSkipExisting())
                .computedColumns(options.isComputedColumns())
                .priceHistory(options.isPriceHistory())
                .interiorSizePath(options.getInteriorSizePath())
                .pricePath(options.getPricePath())
                .priceTextPath(options.getPriceTextPath())
                .priceHistoryKeyPath(options.getPriceHistoryKey())
                .build();
    }

    private static TransformRules loadRules(Path rulesFile) throws IOException {
        if (rulesFile == null) {
            return TransformRules.empty();
        }
        return new TransformRuleParser().parseStrict(rulesFile);
    }

    private static SqlSink openSink(ValidatedRelationalizeOptions validated) {
        return validated.isScriptOutput()
                ? new SqlScriptSink(validated.getSqlScript())
                : new SqliteSqlSink(validated.getOutputDatabase());
    }

    private static void printDdl(PrintWriter out, List<String> ddl) {
        out.println();
        ddl.forEach(out::println);
    }
}
