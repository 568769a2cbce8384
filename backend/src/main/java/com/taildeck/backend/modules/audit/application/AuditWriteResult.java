package com.taildeck.backend.modules.audit.application;

public record AuditWriteResult(Status status, Long auditLogId) {

    public enum Status {
        WRITTEN,
        FAILED
    }

    public static AuditWriteResult written(Long auditLogId) {
        return new AuditWriteResult(Status.WRITTEN, auditLogId);
    }

    public static AuditWriteResult failed() {
        return new AuditWriteResult(Status.FAILED, null);
    }

    public boolean written() {
        return status == Status.WRITTEN;
    }
}
