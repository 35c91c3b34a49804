package com.dtsxarchitect.core.report;

import com.dtsxarchitect.core.report.impl.JsonReportGenerator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ReportGenerators}.
 */
class ReportGeneratorsTest {

    @Test
    void all_discoversEveryFormat() {
        assertThat(ReportGenerators.all())
            .extracting(ReportGenerator::getId)
            .containsExactly("text", "markdown", "json");
    }

    @Test
    void forFormat_returnsMatchingGenerator() {
        assertThat(ReportGenerators.forFormat(ReportFormat.JSON)).isInstanceOf(JsonReportGenerator.class);
    }

    @Test
    void fileName_usesPackageNameAndExtension() {
        assertThat(ReportGenerators.fileName("SalesLoad", ReportFormat.TEXT)).isEqualTo("SalesLoad_report.txt");
        assertThat(ReportGenerators.fileName(" Sales  Load ", ReportFormat.MARKDOWN)).isEqualTo("Sales_Load_report.md");
    }
}
