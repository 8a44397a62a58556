package com.entity.reconciliation.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered set of free-form tags.
 */
public class Tags {
    private List<String> tags;

    public Tags() {
    }

    Tags(Tags other) {
        this.tags = other.tags == null ? null : new ArrayList<>(other.tags);
    }

    public List<String> getTags() {
        return tags == null ? List.of() : Collections.unmodifiableList(tags);
    }

    /**
     * Replaces the tags. A null list means "unspecified" and leaves them untouched.
     */
    public void merge(Tags other) {
        if (other.tags != null) {
            tags = new ArrayList<>(other.tags);
        }
    }

    /**
     * Adds the tags not yet present, keeping the existing order.
     */
    public void visit(Tags other) {
        if (other.tags == null) {
            return;
        }
        for (String tag : other.tags) {
            add(tag);
        }
    }

    public void add(String... values) {
        for (String value : values) {
            if (tags == null) {
                tags = new ArrayList<>();
            }
            if (!tags.contains(value)) {
                tags.add(value);
            }
        }
    }

    public void set(List<String> values) {
        this.tags = values == null ? null : new ArrayList<>(values);
    }

    public boolean contains(String tag) {
        return tags != null && tags.contains(tag);
    }
}
