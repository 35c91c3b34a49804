package com.dtsxarchitect.core.graph;

import com.dtsxarchitect.core.model.ControlFlowStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Resolves precedence-constraint endpoints to control-flow stages.
 *
 * <p>Strategies are tried in order and are individually callable:
 * <ol>
 *   <li>{@link #byRefId(String)}: exact match against the stage executable's ref id</li>
 *   <li>{@link #byLastSegment(String)}: the last reference segment equals the stage name</li>
 *   <li>{@link #byContainment(String)}: the stage name occurs in the reference; the longest
 *       such name wins, ties go to the earliest stage</li>
 * </ol>
 * The containment tier can mis-link a stage whose name is a substring of another stage's
 * name; it only runs when the exact tiers find nothing.
 */
public class StageResolver {

    private static final Logger log = LoggerFactory.getLogger(StageResolver.class);

    private final List<ControlFlowStage> stages;

    public StageResolver(List<ControlFlowStage> stages) {
        this.stages = List.copyOf(stages);
    }

    /**
     * Resolves a reference using the tiers in order.
     *
     * @param reference constraint endpoint
     * @return index of the matching stage in the stage list, or empty
     */
    public Optional<Integer> resolve(String reference) {
        if (reference == null || reference.isEmpty()) {
            return Optional.empty();
        }
        Optional<Integer> index = byRefId(reference);
        if (index.isEmpty()) {
            index = byLastSegment(reference);
        }
        if (index.isEmpty()) {
            index = byContainment(reference);
            index.ifPresent(i -> log.debug("Reference '{}' resolved to stage '{}' by name containment",
                reference, stages.get(i).name()));
        }
        return index;
    }

    public Optional<Integer> byRefId(String reference) {
        for (int i = 0; i < stages.size(); i++) {
            String refId = stages.get(i).refId();
            if (!refId.isEmpty() && refId.equals(reference)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }

    public Optional<Integer> byLastSegment(String reference) {
        String last = ReferencePaths.lastSegment(reference);
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i).name().equals(last)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }

    public Optional<Integer> byContainment(String reference) {
        int best = -1;
        for (int i = 0; i < stages.size(); i++) {
            String name = stages.get(i).name();
            if (!name.isEmpty() && reference.contains(name)
                && (best < 0 || name.length() > stages.get(best).name().length())) {
                best = i;
            }
        }
        return best < 0 ? Optional.empty() : Optional.of(best);
    }
}
