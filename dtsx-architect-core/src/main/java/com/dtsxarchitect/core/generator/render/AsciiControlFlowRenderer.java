package com.dtsxarchitect.core.generator.render;

import com.dtsxarchitect.core.model.ControlFlowStage;

import java.util.List;

/**
 * Draws control-flow stages as a vertical chain of boxes in stage order.
 *
 * <p>Boxes are as wide as the longest stage name plus four. When the next stage carries an
 * inherited condition, it is printed on the arrow leading to it.
 */
public class AsciiControlFlowRenderer {

    private static final int RULE_WIDTH = 60;
    private static final String MARGIN = "    ";

    public String render(List<ControlFlowStage> stages) {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(RULE_WIDTH)).append("\n");
        sb.append(" CONTROL FLOW DIAGRAM\n");
        sb.append("=".repeat(RULE_WIDTH)).append("\n");
        sb.append("\n");

        int boxWidth = stages.stream().mapToInt(s -> s.name().length()).max().orElse(20) + 4;
        String border = MARGIN + "+" + "-".repeat(boxWidth) + "+\n";
        String arrowIndent = MARGIN + " ".repeat(boxWidth / 2 + 1);

        for (int i = 0; i < stages.size(); i++) {
            ControlFlowStage stage = stages.get(i);
            sb.append(border);
            sb.append(MARGIN).append("|").append(LabelText.center(stage.name(), boxWidth)).append("|\n");
            sb.append(MARGIN).append("|").append(LabelText.center("(" + stage.stageType() + ")", boxWidth)).append("|\n");
            sb.append(border);

            if (i < stages.size() - 1) {
                ControlFlowStage next = stages.get(i + 1);
                sb.append(arrowIndent).append("|\n");
                if (next.hasCondition()) {
                    sb.append(MARGIN).append("    [").append(LabelText.conditionLabel(next.condition())).append("]\n");
                }
                sb.append(arrowIndent).append("V\n");
                sb.append("\n");
            }
        }
        return sb.toString();
    }
}
