package com.dtsxarchitect.core.graph;

import com.dtsxarchitect.core.model.DataFlowComponent;
import com.dtsxarchitect.core.model.DataFlowTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves data-flow path endpoints to the components of one task.
 *
 * <p>Strategies, each individually callable:
 * <ol>
 *   <li>{@link #byRefIdPrefix(String)}: the reference equals a component ref id or starts with
 *       {@code refId + "."} (as in {@code ...\Split.Outputs[High]}); longest ref id wins</li>
 *   <li>{@link #bySubstring(String)}: a component's ref id or name occurs in the reference,
 *       first component in document order wins</li>
 *   <li>{@link #byLastSegment(String)}: the last reference segment up to its first dot equals
 *       a component name or occurs in a component ref id</li>
 * </ol>
 * Resolution is a pure function of the task and the reference.
 */
public class ComponentResolver {

    private static final Logger log = LoggerFactory.getLogger(ComponentResolver.class);

    private final List<DataFlowComponent> components;

    public ComponentResolver(DataFlowTask task) {
        this.components = Objects.requireNonNull(task, "task must not be null").components();
    }

    /**
     * Resolves a reference using the tiers in order.
     *
     * @param reference path endpoint, may be null
     * @return owning component, or empty
     */
    public Optional<DataFlowComponent> resolve(String reference) {
        if (reference == null || reference.isEmpty()) {
            return Optional.empty();
        }
        Optional<DataFlowComponent> component = byRefIdPrefix(reference);
        if (component.isEmpty()) {
            component = bySubstring(reference);
            component.ifPresent(c -> log.debug("Reference '{}' resolved to '{}' by substring", reference, c.name()));
        }
        if (component.isEmpty()) {
            component = byLastSegment(reference);
            component.ifPresent(c -> log.debug("Reference '{}' resolved to '{}' by last segment", reference, c.name()));
        }
        return component;
    }

    /**
     * Resolves a reference to a component display name.
     *
     * @param reference path endpoint
     * @return component name, or empty when unresolved
     */
    public Optional<String> resolveName(String reference) {
        return resolve(reference).map(DataFlowComponent::name);
    }

    public Optional<DataFlowComponent> byRefIdPrefix(String reference) {
        DataFlowComponent best = null;
        for (DataFlowComponent component : components) {
            String refId = component.refId();
            if (refId.isEmpty()) {
                continue;
            }
            if ((reference.equals(refId) || reference.startsWith(refId + "."))
                && (best == null || refId.length() > best.refId().length())) {
                best = component;
            }
        }
        return Optional.ofNullable(best);
    }

    public Optional<DataFlowComponent> bySubstring(String reference) {
        for (DataFlowComponent component : components) {
            boolean refIdMatch = !component.refId().isEmpty() && reference.contains(component.refId());
            boolean nameMatch = !component.name().isEmpty() && reference.contains(component.name());
            if (refIdMatch || nameMatch) {
                return Optional.of(component);
            }
        }
        return Optional.empty();
    }

    public Optional<DataFlowComponent> byLastSegment(String reference) {
        if (ReferencePaths.segments(reference).size() < 2) {
            return Optional.empty();
        }
        String part = ReferencePaths.componentPart(reference);
        if (part.isEmpty()) {
            return Optional.empty();
        }
        for (DataFlowComponent component : components) {
            if (part.equals(component.name()) || component.refId().contains(part)) {
                return Optional.of(component);
            }
        }
        return Optional.empty();
    }
}
