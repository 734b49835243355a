package com.relationalizer.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for RelationalizeCommand.
 */
class RelationalizeCommandTest {

    @TempDir
    Path tempDir;

    private Path input;
    private StringWriter out;

    @BeforeEach
    void setUp() throws Exception {
        input = tempDir.resolve("listings.jsonl");
        Files.write(input, List.of(
                "{\"Id\": \"A\", \"Distance\": 3, \"Phones\": [{\"PhoneNumber\": \"555\"}]}",
                "{\"Id\": \"B\", \"Distance\": 4, \"Phones\": []}"));
        out = new StringWriter();
    }

    private int execute(String... args) {
        CommandLine cmd = new CommandLine(new RelationalizeCommand()).setCaseInsensitiveEnumValuesAllowed(true);
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(new StringWriter()));
        return cmd.execute(args);
    }

    private long count(Path db, String sql) throws Exception {
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + db);
             Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Test
    void testAnalyzePrintsReportAndDdl() throws Exception {
        Path report = tempDir.resolve("reports/schema.txt");

        int exit = execute("--analyze", "--print-sql", "--report", report.toString(), input.toString());

        assertThat(exit).isEqualTo(RelationalizeCommand.EXIT_OK);
        assertThat(out.toString())
                .contains("Schema Report")
                .contains("$.Distance  [int: 2]")
                .contains("CREATE TABLE IF NOT EXISTS Phones (PhoneNumber TEXT, PhonesGeneratedId INTEGER PRIMARY KEY);");
        assertThat(Files.readString(report)).contains("Schema Report").doesNotContain("CREATE TABLE");
    }

    @Test
    void testConvertAppliesRulesAndWritesDatabase() throws Exception {
        Path rules = Files.writeString(tempDir.resolve("listing.rules"), "Distance = DROP\n");
        Path db = tempDir.resolve("out.sqlite");

        int exit = execute("--convert", "-r", rules.toString(), "-o", db.toString(), input.toString());

        assertThat(exit).isEqualTo(RelationalizeCommand.EXIT_OK);
        assertThat(count(db, "SELECT COUNT(*) FROM Listings")).isEqualTo(2);
        assertThat(count(db, "SELECT COUNT(*) FROM Phones")).isEqualTo(1);
        assertThat(count(db, "SELECT COUNT(*) FROM pragma_table_info('Listings') WHERE name = 'Distance'")).isZero();
    }

    @Test
    void testConvertToScriptWithDelimitedReferences() throws Exception {
        Path script = tempDir.resolve("load.sql");

        int exit = execute("-c", "--sql-script", script.toString(), "--reference-format", "delimited", input.toString());

        assertThat(exit).isEqualTo(RelationalizeCommand.EXIT_OK);
        String sql = Files.readString(script);
        assertThat(sql).contains("CREATE TABLE IF NOT EXISTS Listings (Distance TEXT NOT NULL, Id TEXT PRIMARY KEY NOT NULL, Phones TEXT NOT NULL);");
        assertThat(sql).contains("INSERT OR IGNORE INTO Listings (Distance, Id, Phones) VALUES (4, 'B', '');");
    }

    @Test
    void testAutomaticTypePolicy() throws Exception {
        Path script = tempDir.resolve("load.sql");

        int exit = execute("-c", "--sql-script", script.toString(), "--type-policy", "automatic", input.toString());

        assertThat(exit).isEqualTo(RelationalizeCommand.EXIT_OK);
        assertThat(Files.readString(script)).contains("Distance INTEGER NOT NULL");
    }

    @Test
    void testInvalidOptionsExitWithConfigurationError() {
        assertThat(execute(input.toString())).isEqualTo(RelationalizeCommand.EXIT_BAD_CONFIGURATION);
        assertThat(execute("-a", tempDir.resolve("missing.jsonl").toString()))
                .isEqualTo(RelationalizeCommand.EXIT_BAD_CONFIGURATION);
    }

    @Test
    void testInvalidRulesFileExitsWithConfigurationError() throws Exception {
        Path rules = Files.writeString(tempDir.resolve("bad.rules"), "Distance = EXPLODE\n");

        assertThat(execute("-a", "-r", rules.toString(), input.toString()))
                .isEqualTo(RelationalizeCommand.EXIT_BAD_CONFIGURATION);
    }

    @Test
    void testCollisionExitsWithFailure() throws Exception {
        Path clash = Files.writeString(tempDir.resolve("clash.jsonl"),
                "{\"Id\": 1, \"a_b\": 1, \"a__b\": 2, \"Listings__a__b\": 3, \"a\": {\"b\": 4}}\n");

        assertThat(execute("-a", clash.toString())).isEqualTo(RelationalizeCommand.EXIT_FAILED);
        assertThat(execute("-c", "--sql-script", tempDir.resolve("x.sql").toString(), clash.toString()))
                .isEqualTo(RelationalizeCommand.EXIT_FAILED);
    }
}
