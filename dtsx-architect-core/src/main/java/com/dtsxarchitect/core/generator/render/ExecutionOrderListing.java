package com.dtsxarchitect.core.generator.render;

import com.dtsxarchitect.core.model.ControlFlowStage;
import com.dtsxarchitect.core.model.TaskDescriptor;

import java.util.List;

/**
 * Lists stages in stage order, which is document order rather than a precedence sort.
 */
public class ExecutionOrderListing {

    private static final int RULE_WIDTH = 60;
    private static final String DETAIL_INDENT = "         ";

    public String render(List<ControlFlowStage> stages) {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(RULE_WIDTH)).append("\n");
        sb.append(" EXECUTION ORDER\n");
        sb.append("=".repeat(RULE_WIDTH)).append("\n");
        sb.append("\n");

        int step = 1;
        for (ControlFlowStage stage : stages) {
            sb.append("Step ").append(step++).append(": ").append(stage.name()).append("\n");
            sb.append(DETAIL_INDENT).append("Type: ").append(stage.stageType()).append("\n");
            if (stage.description() != null && !stage.description().isEmpty()) {
                sb.append(DETAIL_INDENT).append("Description: ").append(stage.description()).append("\n");
            }
            if (stage.hasCondition()) {
                sb.append(DETAIL_INDENT).append("Condition: ")
                    .append(LabelText.stripVariableDecoration(stage.condition())).append("\n");
            }
            if (!stage.tasks().isEmpty()) {
                sb.append(DETAIL_INDENT).append("Tasks:\n");
                for (TaskDescriptor task : stage.tasks()) {
                    sb.append(DETAIL_INDENT).append("  - ").append(task.name()).append("\n");
                }
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
