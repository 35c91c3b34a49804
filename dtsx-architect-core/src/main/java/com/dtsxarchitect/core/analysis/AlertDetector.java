package com.dtsxarchitect.core.analysis;

import com.dtsxarchitect.core.model.Alert;
import com.dtsxarchitect.core.model.ControlFlowStage;
import com.dtsxarchitect.core.model.ErrorHandlingStrategy;
import com.dtsxarchitect.core.model.EventHandler;
import com.dtsxarchitect.core.model.SendMailTask;
import com.dtsxarchitect.core.model.TaskDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds notifications: mail tasks in event handlers and mail tasks in the control flow.
 */
public class AlertDetector {

    public List<Alert> detect(ErrorHandlingStrategy errorHandling, List<ControlFlowStage> stages) {
        List<Alert> alerts = new ArrayList<>();

        for (EventHandler handler : errorHandling.eventHandlers()) {
            boolean onError = handler.eventName().contains("Error");
            for (TaskDescriptor task : handler.tasks()) {
                if (task instanceof SendMailTask mail) {
                    alerts.add(new Alert(
                        mail.name(),
                        handler.eventName(),
                        null,
                        mail.to(),
                        onError ? "High" : "Normal",
                        onError ? "Error" : "Warning"));
                }
            }
        }

        for (ControlFlowStage stage : stages) {
            List<TaskDescriptor> tasks = new ArrayList<>();
            if (stage.detail() != null) {
                tasks.add(stage.detail());
            }
            tasks.addAll(stage.tasks());
            for (TaskDescriptor task : tasks) {
                if (task instanceof SendMailTask mail) {
                    alerts.add(new Alert(mail.name(), "Completion", stage.condition(), mail.to(), "Normal",
                        "Notification"));
                }
            }
        }
        return alerts;
    }
}
