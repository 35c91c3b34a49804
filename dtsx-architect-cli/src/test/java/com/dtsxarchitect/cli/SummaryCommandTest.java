package com.dtsxarchitect.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("summary command")
class SummaryCommandTest extends CliTestBase {

    @Test
    @DisplayName("prints counts, stages and connections")
    void summary_printsOverview() {
        int exitCode = run("-v", "summary", salesLoad.toString());

        assertThat(exitCode).isZero();
        assertThat(output())
            .contains(" PACKAGE SUMMARY: SalesLoad")
            .contains("  Creator:     CORP\\etl")
            .contains("    Control Flow Stages:  4")
            .contains("    Alerts:               2")
            .contains("    4. Notify Finance (SendMailTask) [Conditional]")
            .contains("      Sources: 1, Transforms: 3, Destinations: 3")
            .contains("    - SalesDB (OLEDB) -> Sales");
    }

    @Test
    @DisplayName("fails for a missing file")
    void summary_withMissingFile_returnsOne() {
        int exitCode = run("summary", tempDir.resolve("nope.dtsx").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("✗ File not found");
    }
}
