package com.dtsxarchitect.core.graph;

import com.dtsxarchitect.core.model.ControlFlowStage;
import com.dtsxarchitect.core.model.PrecedenceConstraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Attaches predecessor and successor references to stages and propagates guard conditions.
 *
 * <p>For every constraint whose two endpoints resolve to stages, the target reference is
 * added to the source stage's successors and the source reference to the target stage's
 * predecessors, each at most once. A constraint expression becomes the target stage's
 * condition; when several guarded constraints enter one stage, the last one wins.
 * Constraints with an unresolved endpoint are skipped.
 *
 * <p>Linking never mutates its inputs and is idempotent.
 */
public class PrecedenceGraphLinker {

    private static final Logger log = LoggerFactory.getLogger(PrecedenceGraphLinker.class);

    /**
     * Links stages with constraints.
     *
     * @param stages unlinked or linked stages in document order
     * @param constraints precedence constraints
     * @return new stages carrying links and conditions, same order
     */
    public List<ControlFlowStage> link(List<ControlFlowStage> stages, List<PrecedenceConstraint> constraints) {
        StageResolver resolver = new StageResolver(stages);

        List<List<String>> from = new ArrayList<>();
        List<List<String>> to = new ArrayList<>();
        List<String> conditions = new ArrayList<>();
        for (ControlFlowStage stage : stages) {
            from.add(new ArrayList<>(stage.precedenceFrom()));
            to.add(new ArrayList<>(stage.precedenceTo()));
            conditions.add(stage.condition());
        }

        int linked = 0;
        for (PrecedenceConstraint constraint : constraints) {
            Optional<Integer> source = resolver.resolve(constraint.fromRef());
            Optional<Integer> target = resolver.resolve(constraint.toRef());
            if (source.isEmpty() || target.isEmpty()) {
                log.warn("Precedence constraint '{}' not linked: cannot resolve {} -> {}",
                    constraint.name(), constraint.fromRef(), constraint.toRef());
                continue;
            }
            addOnce(to.get(source.get()), constraint.toRef());
            addOnce(from.get(target.get()), constraint.fromRef());
            if (constraint.hasExpression()) {
                conditions.set(target.get(), constraint.expression());
            }
            linked++;
        }
        log.debug("Linked {} of {} precedence constraints", linked, constraints.size());

        List<ControlFlowStage> result = new ArrayList<>(stages.size());
        for (int i = 0; i < stages.size(); i++) {
            result.add(stages.get(i).withLinks(from.get(i), to.get(i), conditions.get(i)));
        }
        return result;
    }

    private static void addOnce(List<String> references, String reference) {
        if (!references.contains(reference)) {
            references.add(reference);
        }
    }
}
