package com.countrycache.domain.model;

import lombok.Value;

import java.util.List;

/**
 * Reconciled candidates split by whether a record with the same name is already stored
 */
@Value
public class RefreshPlan {
    List<Country> inserts;
    List<Country> updates;

    public int total() {
        return inserts.size() + updates.size();
    }
}
