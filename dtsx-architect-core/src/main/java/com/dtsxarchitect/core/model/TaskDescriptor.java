package com.dtsxarchitect.core.model;

/**
 * Task embedded in a stage or event handler. One variant per task kind, each carrying
 * only its own fields.
 */
public sealed interface TaskDescriptor permits GenericTask, SqlTask, SendMailTask {

    String name();

    String refId();

    String dtsid();

    /**
     * Raw executable type of the task.
     */
    String type();

    String description();

    /**
     * Short kind tag used by reports ({@code Generic}, {@code SqlTask}, {@code SendMailTask}).
     */
    String kind();
}
