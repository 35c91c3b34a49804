package com.dtsxarchitect.core.generator;

import com.dtsxarchitect.core.generator.render.AsciiControlFlowRenderer;
import com.dtsxarchitect.core.generator.render.AsciiDataFlowRenderer;
import com.dtsxarchitect.core.generator.render.ExecutionOrderListing;
import com.dtsxarchitect.core.generator.render.FlowchartRenderer;
import com.dtsxarchitect.core.generator.render.LabelText;
import com.dtsxarchitect.core.generator.render.RoutingLogicListing;
import com.dtsxarchitect.core.graph.ComponentResolver;
import com.dtsxarchitect.core.graph.ReferencePaths;
import com.dtsxarchitect.core.model.ComponentCategory;
import com.dtsxarchitect.core.model.ControlFlowStage;
import com.dtsxarchitect.core.model.DataFlowComponent;
import com.dtsxarchitect.core.model.DataFlowPath;
import com.dtsxarchitect.core.model.DataFlowTask;
import com.dtsxarchitect.core.model.DtsxPackage;
import com.dtsxarchitect.core.model.PrecedenceConstraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds diagram bundles and listings for a parsed package.
 *
 * <p>Every method is a pure function of the package and the configuration, so calls may
 * be repeated or run concurrently.
 */
public class PackageDiagrams {

    public static final String CONTROL_FLOW_TITLE = "Control Flow";

    private static final Logger log = LoggerFactory.getLogger(PackageDiagrams.class);

    private final GeneratorConfig config;
    private final FlowchartRenderer flowcharts;

    public PackageDiagrams(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.flowcharts = new FlowchartRenderer(config.direction(), config.includeStyling());
    }

    /**
     * Builds the control-flow bundle followed by one bundle per data-flow task.
     *
     * @param dtsxPackage parsed package
     * @return bundles in that order
     */
    public List<DiagramBundle> all(DtsxPackage dtsxPackage) {
        List<DiagramBundle> bundles = new ArrayList<>();
        bundles.add(controlFlow(dtsxPackage));
        for (DataFlowTask task : dtsxPackage.dataFlowTasks()) {
            bundles.add(dataFlow(task));
        }
        log.debug("Built {} diagram bundles for '{}'", bundles.size(), dtsxPackage.metadata().name());
        return bundles;
    }

    /**
     * Builds the control-flow bundle. Edges come from the raw top-level constraints and are
     * named by the last segment of each endpoint reference.
     *
     * @param dtsxPackage parsed package
     * @return control-flow bundle
     */
    public DiagramBundle controlFlow(DtsxPackage dtsxPackage) {
        List<String> components = dtsxPackage.controlFlowStages().stream().map(ControlFlowStage::name).toList();
        List<DiagramEdge> edges = new ArrayList<>();
        for (PrecedenceConstraint constraint : dtsxPackage.precedenceConstraints()) {
            String label = constraint.hasExpression() ? LabelText.conditionLabel(constraint.expression()) : "";
            edges.add(new DiagramEdge(
                ReferencePaths.lastSegment(constraint.fromRef()),
                ReferencePaths.lastSegment(constraint.toRef()),
                label));
        }
        String flowchart = flowcharts.render(CONTROL_FLOW_TITLE, components, Map.of(), edges);
        String ascii = new AsciiControlFlowRenderer().render(dtsxPackage.controlFlowStages());
        return new DiagramBundle(CONTROL_FLOW_TITLE, components, edges, flowchart, ascii);
    }

    /**
     * Builds the bundle of one data-flow task. Paths whose endpoints do not both resolve
     * to components are left out of the flowchart.
     *
     * @param task data-flow task
     * @return data-flow bundle
     */
    public DiagramBundle dataFlow(DataFlowTask task) {
        ComponentResolver resolver = new ComponentResolver(task);
        List<String> components = task.components().stream().map(DataFlowComponent::name).toList();
        Map<String, ComponentCategory> categories = new LinkedHashMap<>();
        for (DataFlowComponent component : task.components()) {
            categories.putIfAbsent(component.name(), component.category());
        }

        List<DiagramEdge> edges = new ArrayList<>();
        for (DataFlowPath path : task.paths()) {
            Optional<String> source = resolver.resolveName(path.sourceRef());
            Optional<String> destination = resolver.resolveName(path.destinationRef());
            if (source.isPresent() && destination.isPresent()) {
                edges.add(new DiagramEdge(source.get(), destination.get(), path.name()));
            } else {
                log.debug("Path '{}' in '{}' left out: unresolved endpoint", path.name(), task.name());
            }
        }

        String flowchart = flowcharts.render(task.name(), components, categories, edges);
        String ascii = new AsciiDataFlowRenderer(config).render(task);
        return new DiagramBundle(task.name(), components, edges, flowchart, ascii);
    }

    public String executionOrder(DtsxPackage dtsxPackage) {
        return new ExecutionOrderListing().render(dtsxPackage.controlFlowStages());
    }

    public String routingLogic(DtsxPackage dtsxPackage) {
        return new RoutingLogicListing().render(dtsxPackage.dataFlowTasks());
    }
}
