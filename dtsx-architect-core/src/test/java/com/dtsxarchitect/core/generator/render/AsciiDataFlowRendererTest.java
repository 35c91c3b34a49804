package com.dtsxarchitect.core.generator.render;

import com.dtsxarchitect.core.PackageFixtures;
import com.dtsxarchitect.core.generator.GeneratorConfig;
import com.dtsxarchitect.core.model.ComponentCategory;
import com.dtsxarchitect.core.model.DataFlowComponent;
import com.dtsxarchitect.core.model.DataFlowPath;
import com.dtsxarchitect.core.model.DataFlowTask;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AsciiDataFlowRenderer}.
 */
class AsciiDataFlowRendererTest {

    @Test
    void render_groupsComponentsByCategory() {
        // Given
        DataFlowTask task = PackageFixtures.salesLoad().dataFlowTasks().get(0);

        // When
        String diagram = new AsciiDataFlowRenderer(GeneratorConfig.defaults()).render(task);

        // Then
        assertThat(diagram)
            .startsWith("=".repeat(70) + "\n DATA FLOW: Load Orders\n" + "=".repeat(70) + "\n\n")
            .containsSubsequence("SOURCES:\n", "TRANSFORMATIONS:\n", "DESTINATIONS:\n", "DATA PATHS:\n")
            .contains("    [(OLE DB Source)]\n        SQL: SELECT OrderId, Amount, Score FROM staging.Orders\n")
            .contains("    {DER} Add Risk Flag\n          -> RiskFlag: Score > 70\n")
            .contains("    {SPLIT} Route By Risk\n")
            .contains("          |-> [Default]: (Default)\n")
            .contains("    {LKP} Customer Lookup\n")
            .contains("    [[Fraud Review]]\n        -> [dbo].[FraudReview]\n")
            .contains("    Route By Risk --> Fraud Review\n")
            .contains("    Customer Lookup --> Unmatched Orders\n");
    }

    @Test
    void render_truncatesLongSqlAndMarksUnresolvedEnds() {
        // Given
        GeneratorConfig config = new GeneratorConfig("TB", true, 3, 40, 10);
        DataFlowComponent source = new DataFlowComponent("Src", "Package\\Flow\\Src", ComponentCategory.SOURCE,
            "Microsoft.OLEDBSource", null, null, null, null, null,
            "SELECT *\n  FROM dbo.Orders", null, null, false);
        DataFlowComponent sink = new DataFlowComponent("Sink", "Package\\Flow\\Sink", ComponentCategory.DESTINATION,
            "Microsoft.FlatFileDestination", null, null, null, null, null, null, null, null, false);
        DataFlowTask task = new DataFlowTask("Flow", "Package\\Flow", "", null, List.of(source, sink), List.of(
            new DataFlowPath("Out", "", "Package\\Flow\\Src.Outputs[Out]", "Package\\Elsewhere\\Gone.Inputs[In]")));

        // When
        String diagram = new AsciiDataFlowRenderer(config).render(task);

        // Then
        assertThat(diagram)
            .contains("        SQL: SELECT * F...\n")
            .contains("    [[Sink]]\n        -> Unknown Table\n")
            .contains("    Src --> ?\n")
            .doesNotContain("TRANSFORMATIONS:");
    }
}
