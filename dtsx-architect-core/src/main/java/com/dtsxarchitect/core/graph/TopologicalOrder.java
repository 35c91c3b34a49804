package com.dtsxarchitect.core.graph;

import com.dtsxarchitect.core.model.ControlFlowStage;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Precedence-aware ordering of linked stages.
 *
 * <p>This is not the order used by the execution-order listing, which follows document
 * order. Kahn's algorithm runs over the successor links; among ready stages the one
 * earliest in the document goes first. Stages left on a cycle are appended in document order.
 */
public final class TopologicalOrder {

    private TopologicalOrder() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Orders linked stages so that every stage follows its resolvable predecessors.
     *
     * @param stages linked stages in document order
     * @return stages in precedence order
     */
    public static List<ControlFlowStage> sort(List<ControlFlowStage> stages) {
        StageResolver resolver = new StageResolver(stages);
        int size = stages.size();
        List<List<Integer>> successors = new ArrayList<>();
        int[] inDegree = new int[size];
        for (int i = 0; i < size; i++) {
            successors.add(new ArrayList<>());
        }
        for (int i = 0; i < size; i++) {
            for (String reference : stages.get(i).precedenceTo()) {
                Optional<Integer> target = resolver.resolve(reference);
                if (target.isPresent() && target.get() != i && !successors.get(i).contains(target.get())) {
                    successors.get(i).add(target.get());
                    inDegree[target.get()]++;
                }
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < size; i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }
        boolean[] placed = new boolean[size];
        List<ControlFlowStage> result = new ArrayList<>(size);
        while (!ready.isEmpty()) {
            int next = ready.poll();
            placed[next] = true;
            result.add(stages.get(next));
            for (int successor : successors.get(next)) {
                if (--inDegree[successor] == 0) {
                    ready.add(successor);
                }
            }
        }
        for (int i = 0; i < size; i++) {
            if (!placed[i]) {
                result.add(stages.get(i));
            }
        }
        return result;
    }
}
