package com.dtsxarchitect.core.report.impl;

import com.dtsxarchitect.core.PackageFixtures;
import com.dtsxarchitect.core.generator.GeneratorConfig;
import com.dtsxarchitect.core.model.DtsxPackage;
import com.dtsxarchitect.core.parser.DtsxPackageParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link MarkdownReportGenerator}.
 */
class MarkdownReportGeneratorTest {

    private MarkdownReportGenerator generator;
    private String report;

    @BeforeEach
    void setUp() {
        generator = new MarkdownReportGenerator(ReportTestSupport.FIXED_CLOCK);
        report = generator.generate(PackageFixtures.salesLoad(), GeneratorConfig.defaults());
    }

    @Test
    void generate_startsWithTitleAndTableOfContents() {
        assertThat(report)
            .startsWith("# DTSX Package Analysis: SalesLoad\n\n*Generated on: "
                + ReportTestSupport.FIXED_TIMESTAMP + "*\n\n## Table of Contents\n\n")
            .contains("1. [Package Configuration](#package-configuration)\n")
            .contains("7. [Critical Thresholds and Alerts](#critical-thresholds-and-alerts)\n");
    }

    @Test
    void generate_writesConfigurationTables() {
        assertThat(report)
            .contains("| Property | Value |\n|----------|-------|\n| Package Name | SalesLoad |\n")
            .contains("| SalesDB | OLEDB | SRV01 | Sales |\n")
            .contains("### Package Parameters\n")
            .contains("| Environment | 18 | PROD | No |\n");
    }

    @Test
    void generate_writesStagesAndTransforms() {
        assertThat(report)
            .contains("#### Stage 4: Notify Finance\n\n- **Type:** SendMailTask\n")
            .contains("- **Condition:** `@[User::RunMode] == \"Full\"`\n")
            .contains("- **Executes After:** Extract Orders\n")
            .contains("| OLE DB Source | Source | OLEDBSource |  |\n")
            .contains("**Route By Risk** (ConditionalSplit)\n")
            .contains("- `HighRisk`: `RiskFlag == TRUE`\n")
            .contains("- `Default`: Default (unmatched rows)\n")
            .contains("- `RiskFlag`: `Score > 70`\n");
    }

    @Test
    void generate_embedsFlowchartsWithCollapsibleAscii() {
        assertThat(report)
            .contains("### Control Flow\n\n```mermaid\n---\ntitle: Control Flow\n")
            .contains("### Load Orders\n\n```mermaid\n---\ntitle: Load Orders\n")
            .contains("<details>\n<summary>ASCII Diagram</summary>\n\n```\n")
            .contains("### Execution Order Diagram\n")
            .contains("### Data Routing Logic\n");
    }

    @Test
    void generate_writesInventoryAndAlerts() {
        assertThat(report)
            .contains("### Stored Procedures\n")
            .contains("| dbo | usp_CleanupStaging | Execute |\n")
            .contains("| Alert On Failure | OnError | Error | High | oncall@corp.local |\n")
            .contains("**Max Error Count:** 3\n");
    }

    @Test
    void generate_withEmptyPackage_keepsTablesSectionOnly() {
        DtsxPackage empty = new DtsxPackageParser().parseString(PackageFixtures.packageXml("Empty", ""));

        String emptyReport = generator.generate(empty, GeneratorConfig.defaults());

        assertThat(emptyReport)
            .contains("### Tables\n")
            .contains("| DTSID | N/A |\n")
            .doesNotContain("### Stored Procedures")
            .doesNotContain("### Alerts")
            .doesNotContain("### Package Parameters");
    }

    @Test
    void anchor_dropsPunctuationAndHyphenatesBlanks() {
        assertThat(MarkdownReportGenerator.anchor("Data Flow Diagrams")).isEqualTo("data-flow-diagrams");
        assertThat(MarkdownReportGenerator.anchor("Errors & Alerts")).isEqualTo("errors--alerts");
    }
}
