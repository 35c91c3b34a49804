package com.dtsxarchitect.core.generator;

import com.dtsxarchitect.core.PackageFixtures;
import com.dtsxarchitect.core.model.ComponentCategory;
import com.dtsxarchitect.core.model.DataFlowComponent;
import com.dtsxarchitect.core.model.DataFlowPath;
import com.dtsxarchitect.core.model.DataFlowTask;
import com.dtsxarchitect.core.model.DtsxPackage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PackageDiagrams}.
 */
class PackageDiagramsTest {

    private PackageDiagrams diagrams;

    @BeforeEach
    void setUp() {
        diagrams = new PackageDiagrams(GeneratorConfig.defaults());
    }

    @Test
    void all_returnsControlFlowThenOneBundlePerDataFlow() {
        List<DiagramBundle> bundles = diagrams.all(PackageFixtures.salesLoad());

        assertThat(bundles).extracting(DiagramBundle::name).containsExactly("Control Flow", "Load Orders");
    }

    @Test
    void controlFlow_namesEdgesByLastReferenceSegment() {
        // When
        DiagramBundle bundle = diagrams.controlFlow(PackageFixtures.salesLoad());

        // Then
        assertThat(bundle.components())
            .containsExactly("Extract Orders", "Load Orders", "Cleanup Staging", "Notify Finance");
        assertThat(bundle.edges()).containsExactly(
            new DiagramEdge("Extract Orders", "Load Orders", ""),
            new DiagramEdge("Load Orders", "Cleanup Staging", ""),
            new DiagramEdge("Cleanup Staging", "Notify Finance", "RunMode = \"Full\""));
        assertThat(bundle.ascii()).contains(" CONTROL FLOW DIAGRAM");
    }

    @Test
    void dataFlow_leavesOutPathsWithUnresolvedEndpoints() {
        // Given
        DataFlowComponent source = new DataFlowComponent("Src", "Package\\Flow\\Src", ComponentCategory.SOURCE,
            "Microsoft.OLEDBSource", null, null, null, null, null, null, null, null, false);
        DataFlowComponent sink = new DataFlowComponent("Sink", "Package\\Flow\\Sink", ComponentCategory.DESTINATION,
            "Microsoft.OLEDBDestination", null, null, null, null, null, null, null, null, false);
        DataFlowTask task = new DataFlowTask("Flow", "Package\\Flow", "", null, List.of(source, sink), List.of(
            new DataFlowPath("Good", "", "Package\\Flow\\Src.Outputs[Out]", "Package\\Flow\\Sink.Inputs[In]"),
            new DataFlowPath("Lost", "", "Package\\Flow\\Src.Outputs[Err]", "Package\\Other\\Gone.Inputs[In]")));

        // When
        DiagramBundle bundle = diagrams.dataFlow(task);

        // Then
        assertThat(bundle.edges()).containsExactly(new DiagramEdge("Src", "Sink", "Good"));
        assertThat(bundle.flowchart()).doesNotContain("Lost");
        assertThat(bundle.ascii()).contains("    Src --> ?\n");
    }

    @Test
    void dataFlow_isPureFunctionOfInput() {
        DtsxPackage pkg = PackageFixtures.salesLoad();

        DiagramBundle first = diagrams.dataFlow(pkg.dataFlowTasks().get(0));
        DiagramBundle second = diagrams.dataFlow(pkg.dataFlowTasks().get(0));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void constructor_withNullConfig_throwsException() {
        assertThatThrownBy(() -> new PackageDiagrams(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("config must not be null");
    }
}
