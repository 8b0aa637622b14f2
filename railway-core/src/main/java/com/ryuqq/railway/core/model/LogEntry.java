package com.ryuqq.railway.core.model;

/**
 * Workflow 실행에 연결된 로그 행.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LogEntry implements Entity<LogEntry> {

    private Long id;
    private Long metadataId;
    private int eventId;
    private String level;
    private String message;
    private String category;
    private String exception;
    private String stackTrace;

    public static LogEntry of(long metadataId, String level, String category, String message) {
        LogEntry entry = new LogEntry();
        entry.metadataId = metadataId;
        entry.level = level;
        entry.category = category;
        entry.message = message;
        return entry;
    }

    @Override
    public LogEntry copy() {
        LogEntry copy = new LogEntry();
        copy.id = id;
        copy.metadataId = metadataId;
        copy.eventId = eventId;
        copy.level = level;
        copy.message = message;
        copy.category = category;
        copy.exception = exception;
        copy.stackTrace = stackTrace;
        return copy;
    }

    @Override
    public Long getId() {
        return id;
    }

    @Override
    public void setId(Long id) {
        this.id = id;
    }

    public Long getMetadataId() {
        return metadataId;
    }

    public int getEventId() {
        return eventId;
    }

    public void setEventId(int eventId) {
        this.eventId = eventId;
    }

    public String getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getCategory() {
        return category;
    }

    public String getException() {
        return exception;
    }

    public void setException(String exception) {
        this.exception = exception;
    }

    public String getStackTrace() {
        return stackTrace;
    }

    public void setStackTrace(String stackTrace) {
        this.stackTrace = stackTrace;
    }
}
