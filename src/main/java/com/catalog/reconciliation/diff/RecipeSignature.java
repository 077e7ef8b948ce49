package com.catalog.reconciliation.diff;

import com.catalog.reconciliation.core.model.RecipePart;
import com.catalog.reconciliation.core.model.SourceItem;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Canonical, order-independent rendering of an item's recipe, used for recipe comparison.
 *
 * <pre>
 * in[key1:amount1|key2:amount2]out[key3:amount3]
 * </pre>
 */
public final class RecipeSignature {

    /**
     * Signature of an item the provider does not have.
     */
    public static final String MISSING = "__missing__";

    private RecipeSignature() {
    }

    /**
     * Computes the signature of a provider entry. Null items yield {@link #MISSING};
     * items without inputs and outputs yield an empty string.
     */
    public static String of(SourceItem item) {
        if (item == null) {
            return MISSING;
        }
        String inputs = render(item.inputs());
        String outputs = render(item.outputs());
        if (inputs.isEmpty() && outputs.isEmpty()) {
            return "";
        }
        return "in[" + inputs + "]out[" + outputs + "]";
    }

    private static String render(List<RecipePart> parts) {
        if (parts == null || parts.isEmpty()) {
            return "";
        }
        List<RecipePart> sorted = new ArrayList<>(parts);
        sorted.sort(RecipePart.BY_KEY);
        return sorted.stream()
                .map(part -> part.key() + ":" + formatNumber(part.amount()))
                .collect(Collectors.joining("|"));
    }

    /**
     * Renders integral values without a fractional part ({@code 2} rather than {@code 2.0}).
     */
    static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
