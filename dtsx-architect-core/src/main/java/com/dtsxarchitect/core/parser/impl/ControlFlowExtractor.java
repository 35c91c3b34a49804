package com.dtsxarchitect.core.parser.impl;

import com.dtsxarchitect.core.model.ControlFlowStage;
import com.dtsxarchitect.core.model.StageKind;
import com.dtsxarchitect.core.parser.AttributeResolver;
import com.dtsxarchitect.core.parser.XmlElements;
import com.dtsxarchitect.core.parser.base.AbstractExtractor;
import com.dtsxarchitect.core.parser.task.TaskDescriptorExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the top-level executables of the package as control-flow stages.
 *
 * <p>Only {@code Executables} containers directly under the package root are walked.
 * Stages are numbered from 1 in the order they are encountered. The returned stages carry
 * no precedence links yet.
 */
public class ControlFlowExtractor extends AbstractExtractor<List<ControlFlowStage>> {

    private final TaskDescriptorExtractor tasks;

    public ControlFlowExtractor(AttributeResolver attributes, TaskDescriptorExtractor tasks) {
        super(attributes);
        this.tasks = tasks;
    }

    @Override
    public List<ControlFlowStage> extract(Element root) {
        List<ControlFlowStage> stages = new ArrayList<>();
        for (Element group : XmlElements.children(root, e -> XmlElements.nameContains(e, "Executables"))) {
            for (Element executable : XmlElements.childrenNamed(group, "Executable")) {
                stages.add(toStage(executable, stages.size() + 1));
            }
        }
        log.debug("Extracted {} control-flow stages", stages.size());
        return stages;
    }

    private ControlFlowStage toStage(Element executable, int order) {
        String stageType = StageKind.classify(attr(executable, "ExecutableType"), attr(executable, "CreationName"));
        return new ControlFlowStage(
            order,
            attr(executable, "ObjectName", "Stage_" + order),
            attr(executable, "refId", ""),
            stageType,
            attr(executable, "Description"),
            tasks.extract(executable),
            tasks.extractChildren(executable),
            List.of(),
            List.of(),
            null
        );
    }
}
