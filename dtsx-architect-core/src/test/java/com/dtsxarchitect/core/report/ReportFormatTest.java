package com.dtsxarchitect.core.report;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class ReportFormatTest {

    @ParameterizedTest
    @CsvSource({
        "text, TEXT",
        "txt, TEXT",
        "' Markdown ', MARKDOWN",
        "md, MARKDOWN",
        "JSON, JSON"
    })
    void find_acceptsIdOrExtensionIgnoringCase(String input, ReportFormat expected) {
        assertThat(ReportFormat.find(input)).contains(expected);
    }

    @Test
    void find_withUnknownOrNull_returnsEmpty() {
        assertThat(ReportFormat.find("xml")).isEmpty();
        assertThat(ReportFormat.find(null)).isEmpty();
    }

    @Test
    void parse_withUnknownFormat_throwsException() {
        assertThatThrownBy(() -> ReportFormat.parse("pdf"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("Unknown report format: pdf");
    }

    @Test
    void contentType_matchesFormat() {
        assertThat(ReportFormat.JSON.contentType()).isEqualTo("application/json");
        assertThat(ReportFormat.MARKDOWN.fileExtension()).isEqualTo("md");
    }
}
