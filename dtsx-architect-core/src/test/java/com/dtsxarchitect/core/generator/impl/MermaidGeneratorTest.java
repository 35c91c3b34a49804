package com.dtsxarchitect.core.generator.impl;

import com.dtsxarchitect.core.PackageFixtures;
import com.dtsxarchitect.core.generator.DiagramType;
import com.dtsxarchitect.core.generator.GeneratedDiagram;
import com.dtsxarchitect.core.generator.GeneratorConfig;
import com.dtsxarchitect.core.model.DtsxPackage;
import com.dtsxarchitect.core.parser.DtsxPackageParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link MermaidGenerator}.
 */
class MermaidGeneratorTest {

    private MermaidGenerator generator;
    private GeneratorConfig config;

    @BeforeEach
    void setUp() {
        generator = new MermaidGenerator();
        config = GeneratorConfig.defaults();
    }

    @Test
    void getId_returnsCorrectId() {
        assertThat(generator.getId()).isEqualTo("mermaid");
    }

    @Test
    void getFileExtension_returnsMd() {
        assertThat(generator.getFileExtension()).isEqualTo("md");
    }

    @Test
    void getSupportedDiagramTypes_returnsFlowcharts() {
        assertThat(generator.getSupportedDiagramTypes())
            .containsExactlyInAnyOrder(DiagramType.CONTROL_FLOW, DiagramType.DATA_FLOW);
    }

    @Test
    void generate_withNullPackage_throwsException() {
        assertThatThrownBy(() -> generator.generate(null, DiagramType.CONTROL_FLOW, config))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void generate_withUnsupportedType_throwsException() {
        DtsxPackage pkg = PackageFixtures.salesLoad();

        assertThatThrownBy(() -> generator.generate(pkg, DiagramType.ROUTING_LOGIC, config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unsupported diagram type");
    }

    @Test
    void generate_controlFlow_drawsStagesAndLabelledConstraints() {
        // Given
        DtsxPackage pkg = PackageFixtures.salesLoad();

        // When
        GeneratedDiagram diagram = generator.generate(pkg, DiagramType.CONTROL_FLOW, config);

        // Then
        assertThat(diagram.fileName()).isEqualTo("control-flow.md");
        assertThat(diagram.content())
            .startsWith("# SalesLoad - Control Flow\n\n```mermaid\n---\ntitle: Control Flow\n---\nflowchart TB\n")
            .contains("    subgraph Control_Flow[\"Control Flow\"]\n")
            .contains("        Extract_Orders[\"Extract Orders\"]\n")
            .contains("    Extract_Orders --> Load_Orders\n")
            .contains("    Load_Orders --> Cleanup_Staging\n")
            .contains("    Cleanup_Staging -->|RunMode = 'Full'| Notify_Finance\n")
            .endsWith("```\n");
    }

    @Test
    void generate_dataFlow_drawsComponentsByCategory() {
        // Given
        DtsxPackage pkg = PackageFixtures.salesLoad();

        // When
        GeneratedDiagram diagram = generator.generate(pkg, DiagramType.DATA_FLOW, config);

        // Then
        assertThat(diagram.content())
            .startsWith("# SalesLoad - Data Flows\n\n## Load Orders\n\n```mermaid\n")
            .contains("    subgraph Load_Orders[\"Load Orders\"]\n")
            .contains("        OLE_DB_Source[(\"OLE DB Source\")]\n")
            .contains("        Route_By_Risk{\"Route By Risk\"}\n")
            .contains("        Fraud_Review[[\"Fraud Review\"]]\n")
            .contains("    Route_By_Risk -->|HighRisk| Fraud_Review\n")
            .contains("    Customer_Lookup -->|Lookup No Match Output| Unmatched_Orders\n")
            .contains("    class OLE_DB_Source source\n")
            .contains("    class Orders_Table destination\n");
    }

    @Test
    void generate_dataFlowWithoutTasks_writesPlaceholder() {
        DtsxPackage pkg = new DtsxPackageParser().parseString(PackageFixtures.packageXml("Empty", ""));

        GeneratedDiagram diagram = generator.generate(pkg, DiagramType.DATA_FLOW, config);

        assertThat(diagram.content()).isEqualTo("# Empty - Data Flows\n\n_No data flow tasks found._\n");
    }

    @Test
    void generate_withoutStyling_omitsClassDefinitions() {
        GeneratorConfig plain = new GeneratorConfig("LR", false, 3, 40, 50);

        GeneratedDiagram diagram = generator.generate(PackageFixtures.salesLoad(), DiagramType.DATA_FLOW, plain);

        assertThat(diagram.content())
            .contains("flowchart LR\n")
            .doesNotContain("classDef");
    }
}
