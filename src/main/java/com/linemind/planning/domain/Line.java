package com.linemind.planning.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

@Value
@Builder
public class Line {
    String lineId;

    @Singular
    Set<String> eligibleProducts;

    // Units per day
    int dailyCapacity;

    public int weeklyCapacity() {
        return dailyCapacity * 7;
    }

    public boolean canProduce(String product) {
        return eligibleProducts.contains(product);
    }

    /**
     * Parses the comma-delimited form used by the lines table, e.g. {@code "ModelA, ModelB"}.
     */
    public static Set<String> parseEligibleProducts(String column) {
        if (column == null || column.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(column.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
