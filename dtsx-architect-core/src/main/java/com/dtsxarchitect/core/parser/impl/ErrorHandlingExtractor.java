package com.dtsxarchitect.core.parser.impl;

import com.dtsxarchitect.core.model.ErrorHandlingStrategy;
import com.dtsxarchitect.core.model.EventHandler;
import com.dtsxarchitect.core.parser.AttributeResolver;
import com.dtsxarchitect.core.parser.XmlElements;
import com.dtsxarchitect.core.parser.base.AbstractExtractor;
import com.dtsxarchitect.core.parser.task.TaskDescriptorExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Extracts event handlers, failure settings and logging options.
 */
public class ErrorHandlingExtractor extends AbstractExtractor<ErrorHandlingStrategy> {

    private final TaskDescriptorExtractor tasks;
    private final PrecedenceConstraintExtractor constraints;

    public ErrorHandlingExtractor(AttributeResolver attributes,
                                  TaskDescriptorExtractor tasks,
                                  PrecedenceConstraintExtractor constraints) {
        super(attributes);
        this.tasks = tasks;
        this.constraints = constraints;
    }

    @Override
    public ErrorHandlingStrategy extract(Element root) {
        List<EventHandler> handlers = itemsOf(root, "EventHandlers", "EventHandler").stream()
            .map(this::toHandler)
            .toList();

        String loggingMode = null;
        List<String> loggedEvents = new ArrayList<>();
        Optional<Element> loggingOptions = loggingOptions(root);
        if (loggingOptions.isPresent()) {
            Element options = loggingOptions.get();
            loggingMode = attr(options, "LoggingMode");
            for (Element child : XmlElements.children(options)) {
                if (XmlElements.nameContains(child, "LoggingMode")) {
                    loggingMode = XmlElements.text(child);
                } else if (XmlElements.nameContains(child, "EventFilter")) {
                    XmlElements.children(child, e -> XmlElements.nameContains(e, "EventToLog")).stream()
                        .map(XmlElements::text)
                        .filter(Objects::nonNull)
                        .forEach(loggedEvents::add);
                }
            }
        }

        log.debug("Extracted {} event handlers, logging mode {}", handlers.size(), loggingMode);
        return new ErrorHandlingStrategy(
            handlers,
            attributes.resolveFlag(root, "FailPackageOnFailure", "True", true),
            attributes.resolveInt(root, "MaxErrorCount", 1),
            loggingMode,
            loggedEvents
        );
    }

    private Optional<Element> loggingOptions(Element root) {
        Optional<Element> own = XmlElements.children(root, e -> XmlElements.nameContains(e, "LoggingOptions"))
            .stream().findFirst();
        if (own.isPresent()) {
            return own;
        }
        return XmlElements.firstDescendant(root, e -> XmlElements.nameContains(e, "LoggingOptions"));
    }

    private EventHandler toHandler(Element element) {
        return new EventHandler(
            attr(element, "ObjectName", ""),
            attr(element, "refId", ""),
            attr(element, "DTSID", ""),
            attr(element, "EventName", ""),
            tasks.extractChildren(element),
            constraints.extract(element)
        );
    }
}
