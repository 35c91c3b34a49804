package com.dtsxarchitect.core.model;

import java.util.Objects;

/**
 * Send-mail task.
 *
 * @param name task name
 * @param refId reference id
 * @param dtsid unique identifier
 * @param type executable type
 * @param description optional description
 * @param smtpConnection SMTP connection manager id
 * @param from sender
 * @param to recipients
 * @param cc carbon-copy recipients
 * @param bcc blind carbon-copy recipients
 * @param subject subject line
 * @param messageSource message body
 * @param priority priority, {@code Normal} when absent
 */
public record SendMailTask(
    String name,
    String refId,
    String dtsid,
    String type,
    String description,
    String smtpConnection,
    String from,
    String to,
    String cc,
    String bcc,
    String subject,
    String messageSource,
    String priority
) implements TaskDescriptor {
    /**
     * Compact constructor with validation.
     */
    public SendMailTask {
        Objects.requireNonNull(name, "name must not be null");
        if (priority == null || priority.isEmpty()) {
            priority = "Normal";
        }
    }

    @Override
    public String kind() {
        return "SendMailTask";
    }
}
