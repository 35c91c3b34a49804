package com.dtsxarchitect.core.parser.task;

import com.dtsxarchitect.core.model.SendMailTask;
import com.dtsxarchitect.core.model.TaskDescriptor;
import com.dtsxarchitect.core.parser.AttributeResolver;
import com.dtsxarchitect.core.parser.XmlElements;
import org.w3c.dom.Element;

/**
 * Reads {@code SendMailTaskData}. The message body is the {@code MessageSource} attribute or,
 * when absent, the text of a {@code MessageSource} child.
 */
public class SendMailTaskDetailParser implements TaskDetailParser {

    private final AttributeResolver attributes;

    public SendMailTaskDetailParser(AttributeResolver sendMailAttributes) {
        this.attributes = sendMailAttributes;
    }

    @Override
    public String marker() {
        return "SendMailTask";
    }

    @Override
    public TaskDescriptor parse(Element executable, TaskHeader header) {
        Element data = XmlElements.firstDescendant(executable,
            e -> XmlElements.nameContains(e, "SendMailTaskData")).orElse(null);

        String messageSource = attributes.resolve(data, "MessageSource");
        if (messageSource == null && data != null) {
            messageSource = XmlElements.children(data, e -> XmlElements.nameContains(e, "MessageSource")).stream()
                .findFirst()
                .map(XmlElements::text)
                .orElse(null);
        }

        return new SendMailTask(
            header.name(),
            header.refId(),
            header.dtsid(),
            header.type(),
            header.description(),
            attributes.resolve(data, "SMTPServer"),
            attributes.resolve(data, "From"),
            attributes.resolve(data, "To"),
            attributes.resolve(data, "CC"),
            attributes.resolve(data, "BCC"),
            attributes.resolve(data, "Subject"),
            messageSource,
            attributes.resolve(data, "Priority")
        );
    }
}
