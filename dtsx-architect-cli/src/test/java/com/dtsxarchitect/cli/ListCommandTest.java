package com.dtsxarchitect.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("list command and root command")
class ListCommandTest extends CliTestBase {

    @Test
    @DisplayName("lists discovered diagram generators")
    void list_generators_printsBothGenerators() {
        int exitCode = run("list", "generators");

        assertThat(exitCode).isZero();
        assertThat(output())
            .contains("Mermaid Flowchart Generator (ID: mermaid)")
            .contains("ASCII Diagram Generator (ID: ascii)")
            .contains("File Extension: .md");
    }

    @Test
    @DisplayName("lists report formats")
    void list_formats_printsAllFormats() {
        int exitCode = run("list", "formats");

        assertThat(exitCode).isZero();
        assertThat(output())
            .contains("(ID: text)")
            .contains("(ID: markdown)")
            .contains("application/json (ID: json)");
    }

    @Test
    @DisplayName("lists renderers")
    void list_renderers_printsRenderers() {
        int exitCode = run("list", "renderers");

        assertThat(exitCode).isZero();
        assertThat(output())
            .contains("filesystem (FileSystemRenderer)")
            .contains("console (ConsoleRenderer)");
    }

    @Test
    @DisplayName("rejects an unknown type")
    void list_unknownType_returnsOne() {
        int exitCode = run("list", "widgets");

        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("✗ Unknown type: widgets");
    }

    @Test
    @DisplayName("prints usage hints without a command")
    void root_withoutCommand_printsHints() {
        int exitCode = run();

        assertThat(exitCode).isZero();
        assertThat(output()).contains("dtsx-architect - DTSX package analyzer");
    }

    @Test
    @DisplayName("prints nothing in quiet mode")
    void root_quiet_printsNothing() {
        int exitCode = run("-q");

        assertThat(exitCode).isZero();
        assertThat(output()).isEmpty();
    }
}
