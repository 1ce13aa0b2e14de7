package com.tradedesk.invoicer.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a product: its name together with its weight/size variant.
 * <p>
 * Both parts are trimmed and a missing weight is stored as an empty string, so
 * {@code ("Rice", null)} and {@code ("Rice ", "")} name the same product.
 */
public record ProductKey(String name, String weight) implements Comparable<ProductKey> {

    private static final Comparator<ProductKey> ORDER = Comparator.comparing(ProductKey::name)
            .thenComparing(ProductKey::weight);

    public ProductKey {
        name = name == null ? "" : name.trim();
        weight = weight == null ? "" : weight.trim();
    }

    public static ProductKey of(String name, String weight) {
        return new ProductKey(name, weight);
    }

    public boolean hasWeight() {
        return !weight.isEmpty();
    }

    // "Rice (5kg)" or just "Rice"
    public String fullProductName() {
        return hasWeight() ? name + " (" + weight + ")" : name;
    }

    @Override
    public int compareTo(ProductKey other) {
        return ORDER.compare(this, Objects.requireNonNull(other));
    }

    @Override
    public String toString() {
        return fullProductName();
    }
}
