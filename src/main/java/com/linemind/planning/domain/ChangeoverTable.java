package com.linemind.planning.domain;

import lombok.Value;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Changeover costs keyed by (from, to). Pairs are directional; a symmetric cost needs both rows.
 */
public final class ChangeoverTable {

    @Value
    private static class Key {
        String from;
        String to;
    }

    private final Map<Key, ChangeoverCost> costs = new HashMap<>();

    public ChangeoverTable(List<ChangeoverCost> rows) {
        if (rows != null) {
            for (ChangeoverCost row : rows) {
                costs.put(new Key(row.getFromProduct(), row.getToProduct()), row);
            }
        }
    }

    public Optional<ChangeoverCost> find(String from, String to) {
        return Optional.ofNullable(costs.get(new Key(from, to)));
    }

    public boolean contains(String from, String to) {
        return costs.containsKey(new Key(from, to));
    }
}
