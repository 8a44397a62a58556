package com.entity.reconciliation.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only list of status transitions and comments.
 *
 * <p>An incoming {@code remove} index is an edit request: it clears the comment of that
 * record and drops the record entirely when it carried only a comment.</p>
 */
public class History {
    private List<HistoryRecord> history;
    private Integer remove;

    public History() {
    }

    History(History other) {
        if (other.history != null) {
            this.history = new ArrayList<>(other.history.size());
            for (HistoryRecord record : other.history) {
                this.history.add(new HistoryRecord(record));
            }
        }
        this.remove = other.remove;
    }

    public List<HistoryRecord> getRecords() {
        return history == null ? List.of() : Collections.unmodifiableList(history);
    }

    public int size() {
        return history == null ? 0 : history.size();
    }

    public Integer getRemove() {
        return remove;
    }

    public void setRemove(Integer remove) {
        this.remove = remove;
    }

    /**
     * Folds an update into the history.
     *
     * @param from    current status
     * @param to      requested status, empty when the update carries no status change
     * @param by      source of the update
     * @param comment optional comment
     * @param other   history carried by the update, consulted for a removal request
     * @return true when a status transition was recorded and the caller should apply {@code to}
     */
    public boolean update(String from, String to, String by, String comment, History other) {
        if (other != null && other.remove != null && other.remove >= 0 && other.remove < size()) {
            int index = other.remove;
            HistoryRecord target = history.get(index);
            target.clearComment();
            if (!target.isTransition()) {
                history.remove(index);
            }
            return false;
        }
        if (to != null && !to.isEmpty() && !to.equals(from)) {
            append(new HistoryRecord(from, to, by, comment, Timestamps.now()));
            return true;
        }
        if (comment != null && !comment.isEmpty()) {
            append(new HistoryRecord(null, null, by, comment, Timestamps.now()));
        }
        return false;
    }

    /**
     * Appends a record unconditionally.
     */
    public void append(HistoryRecord record) {
        if (history == null) {
            history = new ArrayList<>();
        }
        history.add(record);
    }
}
