package com.dtsxarchitect.core.parser;

import com.dtsxarchitect.core.analysis.AlertDetector;
import com.dtsxarchitect.core.analysis.DatabaseObjectMiner;
import com.dtsxarchitect.core.analysis.ThresholdDetector;
import com.dtsxarchitect.core.graph.PrecedenceGraphLinker;
import com.dtsxarchitect.core.model.Alert;
import com.dtsxarchitect.core.model.Annotation;
import com.dtsxarchitect.core.model.ConnectionManager;
import com.dtsxarchitect.core.model.ControlFlowStage;
import com.dtsxarchitect.core.model.DataFlowTask;
import com.dtsxarchitect.core.model.DatabaseObject;
import com.dtsxarchitect.core.model.DtsxPackage;
import com.dtsxarchitect.core.model.ErrorHandlingStrategy;
import com.dtsxarchitect.core.model.PackageMetadata;
import com.dtsxarchitect.core.model.Parameter;
import com.dtsxarchitect.core.model.PrecedenceConstraint;
import com.dtsxarchitect.core.model.Threshold;
import com.dtsxarchitect.core.model.Variable;
import com.dtsxarchitect.core.parser.impl.AnnotationExtractor;
import com.dtsxarchitect.core.parser.impl.ConnectionManagerExtractor;
import com.dtsxarchitect.core.parser.impl.ControlFlowExtractor;
import com.dtsxarchitect.core.parser.impl.DataFlowExtractor;
import com.dtsxarchitect.core.parser.impl.ErrorHandlingExtractor;
import com.dtsxarchitect.core.parser.impl.MetadataExtractor;
import com.dtsxarchitect.core.parser.impl.ParameterExtractor;
import com.dtsxarchitect.core.parser.impl.PrecedenceConstraintExtractor;
import com.dtsxarchitect.core.parser.impl.VariableExtractor;
import com.dtsxarchitect.core.parser.task.SendMailTaskDetailParser;
import com.dtsxarchitect.core.parser.task.SqlTaskDetailParser;
import com.dtsxarchitect.core.parser.task.TaskDescriptorExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Parses a package document into an immutable {@link DtsxPackage}.
 *
 * <p>Parsing runs as explicit passes, each fed the outputs of the previous ones:
 * <ol>
 *   <li>load the document</li>
 *   <li>extract entities</li>
 *   <li>link stages with precedence constraints</li>
 *   <li>mine database objects from the linked stages and data-flow tasks</li>
 *   <li>detect thresholds from variables</li>
 *   <li>detect alerts from event handlers and stages</li>
 *   <li>assemble the package</li>
 * </ol>
 *
 * <p>Instances hold no per-parse state and may be reused.
 */
public class DtsxPackageParser {

    private static final Logger log = LoggerFactory.getLogger(DtsxPackageParser.class);

    private final DtsxDocumentLoader loader = new DtsxDocumentLoader();
    private final MetadataExtractor metadataExtractor;
    private final AnnotationExtractor annotationExtractor;
    private final ConnectionManagerExtractor connectionExtractor;
    private final VariableExtractor variableExtractor;
    private final ParameterExtractor parameterExtractor;
    private final ControlFlowExtractor controlFlowExtractor;
    private final PrecedenceConstraintExtractor constraintExtractor;
    private final DataFlowExtractor dataFlowExtractor;
    private final ErrorHandlingExtractor errorHandlingExtractor;
    private final PrecedenceGraphLinker linker = new PrecedenceGraphLinker();
    private final DatabaseObjectMiner miner = new DatabaseObjectMiner();
    private final ThresholdDetector thresholdDetector = new ThresholdDetector();
    private final AlertDetector alertDetector = new AlertDetector();

    public DtsxPackageParser() {
        this(DtsxNamespaces.defaults());
    }

    public DtsxPackageParser(DtsxNamespaces namespaces) {
        Objects.requireNonNull(namespaces, "namespaces must not be null");
        AttributeResolver dts = new AttributeResolver(namespaces.dts());
        TaskDescriptorExtractor tasks = new TaskDescriptorExtractor(dts, List.of(
            new SqlTaskDetailParser(new AttributeResolver(namespaces.sqlTask())),
            new SendMailTaskDetailParser(new AttributeResolver(namespaces.sendMailTask()))));

        this.metadataExtractor = new MetadataExtractor(dts);
        this.annotationExtractor = new AnnotationExtractor(dts);
        this.connectionExtractor = new ConnectionManagerExtractor(dts);
        this.variableExtractor = new VariableExtractor(dts);
        this.parameterExtractor = new ParameterExtractor(dts);
        this.controlFlowExtractor = new ControlFlowExtractor(dts, tasks);
        this.constraintExtractor = new PrecedenceConstraintExtractor(dts);
        this.dataFlowExtractor = new DataFlowExtractor(dts);
        this.errorHandlingExtractor = new ErrorHandlingExtractor(dts, tasks, constraintExtractor);
    }

    /**
     * Parses a package file.
     *
     * @param file {@code .dtsx} file
     * @return parsed package
     * @throws DtsxParseException if the file cannot be read or is not well-formed XML
     */
    public DtsxPackage parse(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        log.info("Parsing package {}", file);
        return parse(loader.load(file));
    }

    /**
     * Parses a package from a stream; the stream is not closed.
     *
     * @param input document stream
     * @param sourceName name used in messages
     * @return parsed package
     */
    public DtsxPackage parse(InputStream input, String sourceName) {
        Objects.requireNonNull(input, "input must not be null");
        return parse(loader.load(input, sourceName));
    }

    /**
     * Parses a package document held in memory.
     *
     * @param xml document text
     * @return parsed package
     */
    public DtsxPackage parseString(String xml) {
        Objects.requireNonNull(xml, "xml must not be null");
        return parse(loader.parse(xml));
    }

    /**
     * Parses an already loaded document.
     *
     * @param document DOM document whose root is the package executable
     * @return parsed package
     */
    public DtsxPackage parse(Document document) {
        Element root = document.getDocumentElement();

        PackageMetadata metadata = metadataExtractor.extract(root);
        List<Annotation> annotations = annotationExtractor.extract(root);
        List<ConnectionManager> connections = connectionExtractor.extract(root);
        List<Variable> variables = variableExtractor.extract(root);
        List<Parameter> parameters = parameterExtractor.extract(root);
        List<ControlFlowStage> unlinkedStages = controlFlowExtractor.extract(root);
        List<PrecedenceConstraint> constraints = constraintExtractor.extract(root);
        List<DataFlowTask> dataFlowTasks = dataFlowExtractor.extract(root);
        ErrorHandlingStrategy errorHandling = errorHandlingExtractor.extract(root);

        List<ControlFlowStage> stages = linker.link(unlinkedStages, constraints);

        List<DatabaseObject> databaseObjects = miner.mine(stages, dataFlowTasks, connections);
        List<Threshold> thresholds = thresholdDetector.detect(variables);
        List<Alert> alerts = alertDetector.detect(errorHandling, stages);

        DtsxPackage dtsxPackage = new DtsxPackage(
            metadata,
            annotations,
            connections,
            variables,
            parameters,
            stages,
            dataFlowTasks,
            constraints,
            errorHandling,
            databaseObjects,
            thresholds,
            alerts
        );
        log.info("Parsed package '{}': {} stages, {} data flows, {} connections, {} variables, {} event handlers",
            metadata.name(), stages.size(), dataFlowTasks.size(), connections.size(), variables.size(),
            errorHandling.eventHandlers().size());
        return dtsxPackage;
    }
}
