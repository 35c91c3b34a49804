package com.dtsxarchitect.core.parser;

import java.util.Objects;

/**
 * Attribute namespaces understood by the parser.
 *
 * @param dts core package namespace
 * @param sqlTask Execute-SQL task data namespace
 * @param sendMailTask Send-Mail task data namespace
 */
public record DtsxNamespaces(XmlNamespace dts, XmlNamespace sqlTask, XmlNamespace sendMailTask) {

    public static final XmlNamespace DTS = new XmlNamespace("www.microsoft.com/SqlServer/Dts", "DTS");
    public static final XmlNamespace SQL_TASK =
        new XmlNamespace("www.microsoft.com/sqlserver/dts/tasks/sqltask", "SQLTask");
    public static final XmlNamespace SEND_MAIL_TASK =
        new XmlNamespace("www.microsoft.com/sqlserver/dts/tasks/sendmailtask", "SendMailTask");

    public DtsxNamespaces {
        Objects.requireNonNull(dts, "dts must not be null");
        Objects.requireNonNull(sqlTask, "sqlTask must not be null");
        Objects.requireNonNull(sendMailTask, "sendMailTask must not be null");
    }

    public static DtsxNamespaces defaults() {
        return new DtsxNamespaces(DTS, SQL_TASK, SEND_MAIL_TASK);
    }
}
