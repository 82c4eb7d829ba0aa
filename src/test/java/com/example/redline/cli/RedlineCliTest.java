package com.example.redline.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.example.redline.support.OoxmlFixtures.docx;
import static com.example.redline.support.OoxmlFixtures.xlsx;
import static org.assertj.core.api.Assertions.assertThat;

class RedlineCliTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = RedlineCli.commandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path file(String name, byte[] bytes) throws Exception {
        Path path = tempDir.resolve(name);
        Files.write(path, bytes);
        return path;
    }

    @Test
    void compareWritesRedline() throws Exception {
        Path older = file("old.docx", docx("The lazy dog."));
        Path newer = file("new.docx", docx("The active cat."));
        Path output = tempDir.resolve("out/redline.docx");

        int code = run("compare", "--old", older.toString(), "--new", newer.toString(), "--out", output.toString(),
                "--author", "Cli");

        assertThat(code).isEqualTo(RedlineCli.EXIT_OK);
        assertThat(output).exists();
        assertThat(out.toString()).startsWith("revisions: ");
    }

    @Test
    void changesListsItemsAndTotal() throws Exception {
        Path older = file("old.xlsx", xlsx().sheet("Sheet1", "A1=100").build());
        Path newer = file("new.xlsx", xlsx().sheet("Sheet1", "A1=200").build());

        int code = run("changes", "--old", older.toString(), "--new", newer.toString());

        assertThat(code).isEqualTo(RedlineCli.EXIT_OK);
        assertThat(out.toString()).contains("[change-1] Cell Sheet1!A1 value changed from '100' to '200'")
                .contains("total: 1");
    }

    @Test
    void jsonChangesFeedApply() throws Exception {
        Path older = file("old.xlsx", xlsx().sheet("Sheet1", "A1=100").build());
        Path newer = file("new.xlsx", xlsx().sheet("Sheet1", "A1=200").build());
        assertThat(run("changes", "--old", older.toString(), "--new", newer.toString(), "--json"))
                .isEqualTo(RedlineCli.EXIT_OK);
        Path changes = file("changes.json", out.toString().getBytes(StandardCharsets.UTF_8));
        Path applied = tempDir.resolve("applied.xlsx");

        int code = run("apply", "--base", older.toString(), "--changes", changes.toString(), "--out", applied.toString());

        assertThat(code).isEqualTo(RedlineCli.EXIT_OK);
        assertThat(applied).exists();
    }

    @Test
    void missingOptionIsUsageError() {
        assertThat(run("compare", "--old", "a.docx")).isEqualTo(RedlineCli.EXIT_USAGE);
        assertThat(err.toString()).contains("--new");
    }

    @Test
    void noSubcommandIsUsageError() {
        assertThat(run()).isEqualTo(RedlineCli.EXIT_USAGE);
    }

    @Test
    void unsupportedExtensionIsUsageError() throws Exception {
        Path older = file("old.txt", new byte[]{1});
        Path newer = file("new.txt", new byte[]{1});

        assertThat(run("changes", "--old", older.toString(), "--new", newer.toString())).isEqualTo(RedlineCli.EXIT_USAGE);
    }

    @Test
    void thresholdOutOfRangeIsUsageError() throws Exception {
        Path older = file("old.docx", docx("a"));
        Path newer = file("new.docx", docx("b"));

        int code = run("compare", "--old", older.toString(), "--new", newer.toString(),
                "--out", tempDir.resolve("x.docx").toString(), "--detail-threshold", "1.5");

        assertThat(code).isEqualTo(RedlineCli.EXIT_USAGE);
    }

    @Test
    void corruptDocumentIsParseError() throws Exception {
        Path older = file("old.docx", "garbage".getBytes(StandardCharsets.UTF_8));
        Path newer = file("new.docx", docx("b"));

        int code = run("compare", "--old", older.toString(), "--new", newer.toString(),
                "--out", tempDir.resolve("x.docx").toString());

        assertThat(code).isEqualTo(RedlineCli.EXIT_PARSE);
        assertThat(err.toString()).contains("PACKAGE");
    }

    @Test
    void missingInputFileIsParseError() {
        int code = run("changes", "--old", tempDir.resolve("nope.docx").toString(),
                "--new", tempDir.resolve("nope2.docx").toString());

        assertThat(code).isEqualTo(RedlineCli.EXIT_PARSE);
    }
}
