package com.entity.reconciliation.core.model;

import java.util.Objects;

/**
 * One status transition or comment in an entity's history.
 */
public class HistoryRecord {
    private String from;
    private String to;
    private String by;
    private String comment;
    private String updated;

    protected HistoryRecord() {
    }

    public HistoryRecord(String from, String to, String by, String comment, String updated) {
        this.from = from;
        this.to = to;
        this.by = by;
        this.comment = comment;
        this.updated = updated;
    }

    HistoryRecord(HistoryRecord other) {
        this(other.from, other.to, other.by, other.comment, other.updated);
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    /**
     * Source or user that made the change.
     */
    public String getBy() {
        return by;
    }

    public String getComment() {
        return comment;
    }

    public String getUpdated() {
        return updated;
    }

    void clearComment() {
        this.comment = null;
    }

    /**
     * True when the record describes a status change rather than a bare comment.
     */
    public boolean isTransition() {
        return to != null && !to.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HistoryRecord that = (HistoryRecord) o;
        return Objects.equals(from, that.from) && Objects.equals(to, that.to)
                && Objects.equals(by, that.by) && Objects.equals(comment, that.comment)
                && Objects.equals(updated, that.updated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, by, comment, updated);
    }

    @Override
    public String toString() {
        return "HistoryRecord{from='" + from + "', to='" + to + "', by='" + by + "', updated='" + updated + "'}";
    }
}
