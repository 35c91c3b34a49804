package com.dtsxarchitect.cli;

import com.dtsxarchitect.core.report.ReportFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("report command")
class ReportCommandTest extends CliTestBase {

    @Test
    @DisplayName("prints the text report by default")
    void report_withoutOptions_printsTextReport() {
        int exitCode = run("report", salesLoad.toString());

        assertThat(exitCode).isZero();
        assertThat(output())
            .contains("DTSX PACKAGE ANALYSIS REPORT")
            .contains(" Package: SalesLoad")
            .contains(" 7. CRITICAL THRESHOLDS AND ALERTS");
    }

    @Test
    @DisplayName("fails with exit code 1 for a missing file")
    void report_withMissingFile_returnsOne() {
        int exitCode = run("report", tempDir.resolve("missing.dtsx").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("✗ File not found");
        assertThat(output()).isEmpty();
    }

    @Test
    @DisplayName("reports a malformed package on stderr")
    void report_withMalformedPackage_returnsOne() throws IOException {
        Path broken = Files.writeString(tempDir.resolve("Broken.dtsx"), "<DTS:Executable");

        int exitCode = run("report", broken.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("✗ report failed:");
    }

    @Test
    @DisplayName("adds the format extension to the output file")
    void report_withOutputFile_writesFileWithExtension() throws IOException {
        Path target = tempDir.resolve("out/report");

        int exitCode = run("report", salesLoad.toString(), "-f", "json", "-o", target.toString());

        Path written = tempDir.resolve("out/report.json");
        assertThat(exitCode).isZero();
        assertThat(written).exists();
        assertThat(Files.readString(written)).contains("\"name\" : \"SalesLoad\"");
        assertThat(output()).contains("Report saved to: " + written);
    }

    @Test
    @DisplayName("writes every format with --all-formats")
    void report_withAllFormats_writesThreeFiles() {
        Path directory = tempDir.resolve("reports");

        int exitCode = run("report", salesLoad.toString(), "--all-formats", "-d", directory.toString());

        assertThat(exitCode).isZero();
        assertThat(directory.resolve("SalesLoad_report.txt")).exists();
        assertThat(directory.resolve("SalesLoad_report.md")).exists();
        assertThat(directory.resolve("SalesLoad_report.json")).exists();
    }

    @Test
    @DisplayName("falls back to text for an unknown format")
    void report_withUnknownFormat_usesText() {
        int exitCode = run("report", salesLoad.toString(), "-f", "pdf");

        assertThat(exitCode).isZero();
        assertThat(output()).contains("DTSX PACKAGE ANALYSIS REPORT");
    }

    @Test
    @DisplayName("takes the default format from the configuration file")
    void report_withConfig_usesConfiguredFormat() throws IOException {
        Path config = Files.writeString(tempDir.resolve("dtsx-architect.yaml"), "report:\n  defaultFormat: markdown\n");

        int exitCode = run("report", salesLoad.toString(), "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(output()).startsWith("# DTSX Package Analysis: SalesLoad");
    }

    @Test
    void withExtension_keepsExistingExtension() {
        assertThat(ReportCommand.withExtension(Path.of("a/report.txt"), ReportFormat.JSON))
            .isEqualTo(Path.of("a/report.txt"));
        assertThat(ReportCommand.withExtension(Path.of("a/report"), ReportFormat.MARKDOWN))
            .isEqualTo(Path.of("a/report.md"));
    }

    @Test
    void resolveFormat_prefersRequestedThenConfigured() {
        assertThat(ReportCommand.resolveFormat("md", "json")).isEqualTo(ReportFormat.MARKDOWN);
        assertThat(ReportCommand.resolveFormat(null, "json")).isEqualTo(ReportFormat.JSON);
        assertThat(ReportCommand.resolveFormat("pdf", "nonsense")).isEqualTo(ReportFormat.TEXT);
    }
}
