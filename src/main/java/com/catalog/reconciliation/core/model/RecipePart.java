package com.catalog.reconciliation.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Comparator;
import java.util.Locale;

/**
 * One ingredient or output of a recipe.
 *
 * @param itemId provider item id of the part, may be null
 * @param name   display name of the part, may be null
 * @param amount positive quantity, defaults to 1
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecipePart(String itemId, String name, double amount) {

    /**
     * Orders parts by {@link #key()} ascending, then amount, then name and item id, so that
     * parts sharing a key sort the same whatever order they were listed in.
     */
    public static final Comparator<RecipePart> BY_KEY = Comparator.comparing(RecipePart::key)
            .thenComparingDouble(RecipePart::amount)
            .thenComparing(RecipePart::name, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(RecipePart::itemId, Comparator.nullsFirst(Comparator.naturalOrder()));

    public RecipePart {
        if (!(amount > 0) || Double.isInfinite(amount)) {
            amount = 1;
        }
    }

    public static RecipePart of(String itemId, String name, double amount) {
        return new RecipePart(itemId, name, amount);
    }

    /**
     * Comparison key: item id, else name, lowercased.
     */
    @JsonIgnore
    public String key() {
        String base = itemId != null ? itemId : (name != null ? name : "");
        return base.toLowerCase(Locale.ROOT);
    }
}
