package com.countrycache.application.service;

import com.countrycache.domain.model.Country;
import com.countrycache.domain.model.RefreshPlan;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Splits reconciled candidates into inserts and updates by case-insensitive name
 * match against the stored names. An update keeps the stored spelling of the name.
 * Stored countries missing from the candidates are not touched.
 */
@Slf4j
public class CountryDiffClassifier {

    public RefreshPlan classify(List<Country> candidates, Set<String> existingNames) {
        Map<String, String> storedByKey = new HashMap<>();
        for (String name : existingNames) {
            storedByKey.put(key(name), name);
        }

        List<Country> inserts = new ArrayList<>();
        List<Country> updates = new ArrayList<>();

        for (Country candidate : candidates) {
            String storedName = storedByKey.get(key(candidate.getName()));
            if (storedName == null) {
                inserts.add(candidate);
            } else if (storedName.equals(candidate.getName())) {
                updates.add(candidate);
            } else {
                log.debug("Country {} matches stored {}, keeping stored name", candidate.getName(), storedName);
                updates.add(candidate.toBuilder().name(storedName).build());
            }
        }

        log.info("Prepared {} new countries for creation and {} existing countries for update",
                inserts.size(), updates.size());
        return new RefreshPlan(List.copyOf(inserts), List.copyOf(updates));
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
