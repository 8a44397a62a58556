package com.entity.reconciliation.merge;

import com.entity.reconciliation.core.model.GraphModel;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of folding an observation into an entity.
 *
 * @param entity         the reconciled entity (the existing instance, mutated)
 * @param mode           merge or visit; null for an entity stored for the first time
 * @param statusBefore   status before reconciliation
 * @param statusAfter    status after reconciliation
 * @param historyAdded   number of history records appended
 * @param pendingLabel   label addition the graph store still has to apply, or null
 * @param created        true when there was no stored entity and the incoming one was taken as is
 */
public record ReconciliationResult<T extends GraphModel>(
        T entity,
        ReconciliationMode mode,
        String statusBefore,
        String statusAfter,
        int historyAdded,
        String pendingLabel,
        boolean created
) {

    /**
     * Result for an entity that had no stored counterpart.
     */
    public static <T extends GraphModel> ReconciliationResult<T> created(T entity, String status, String pendingLabel) {
        return new ReconciliationResult<>(entity, null, null, status, 0, pendingLabel, true);
    }

    /**
     * True when reconciliation moved the stored status. Always false for a created result.
     */
    public boolean statusChanged() {
        return !created && statusAfter != null && !statusAfter.equals(statusBefore);
    }

    public boolean hasPendingLabel() {
        return pendingLabel != null && !pendingLabel.isEmpty();
    }

    /**
     * Labels the graph store should write: the entity's labels plus any pending addition.
     */
    public List<String> labelsToWrite() {
        List<String> labels = new ArrayList<>(entity.getLabels());
        if (hasPendingLabel() && !labels.contains(pendingLabel)) {
            labels.add(pendingLabel);
        }
        return labels;
    }
}
