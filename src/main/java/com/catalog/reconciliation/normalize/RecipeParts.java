package com.catalog.reconciliation.normalize;

import com.catalog.reconciliation.core.model.RecipePart;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.catalog.reconciliation.normalize.RawValues.field;
import static com.catalog.reconciliation.normalize.RawValues.firstNumber;
import static com.catalog.reconciliation.normalize.RawValues.firstText;
import static com.catalog.reconciliation.normalize.RawValues.localizedName;
import static com.catalog.reconciliation.normalize.RawValues.number;
import static com.catalog.reconciliation.normalize.RawValues.object;

/**
 * Extracts recipe parts from the two raw shapes providers use:
 * <ul>
 *   <li>an array of entries, each optionally nesting an {@code item} or {@code component}
 *       object, with the quantity under {@code amount}, {@code quantity} or {@code count}</li>
 *   <li>a map of item id to numeric amount</li>
 * </ul>
 * Results are deduplicated and sorted by {@link RecipePart#key()}.
 */
public final class RecipeParts {

    private RecipeParts() {
    }

    /**
     * Returns the parts found in {@code node}, or null when there are none.
     */
    public static List<RecipePart> extract(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            return finish(fromArray(node));
        }
        if (node.isObject()) {
            return finish(fromMap(node));
        }
        return null;
    }

    private static List<RecipePart> fromArray(JsonNode array) {
        List<RecipePart> parts = new ArrayList<>();
        for (JsonNode entry : array) {
            if (entry == null || !entry.isObject()) {
                continue;
            }
            JsonNode item = object(entry, "item");
            JsonNode component = object(entry, "component");

            Double amount = firstNumber(entry.get("amount"), entry.get("quantity"), entry.get("count"));
            String itemId = firstText(entry.get("itemId"), entry.get("id"),
                    field(item, "id"), field(component, "id"));
            String name = firstName(entry.get("name"), entry.get("itemName"),
                    field(item, "name"), field(component, "name"));

            if (itemId == null && name == null) {
                continue;
            }
            parts.add(RecipePart.of(itemId, name, amount != null ? amount : 1));
        }
        return parts;
    }

    private static List<RecipePart> fromMap(JsonNode map) {
        List<RecipePart> parts = new ArrayList<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = map.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            Double amount = number(entry.getValue());
            if (amount == null || amount <= 0) {
                continue;
            }
            parts.add(RecipePart.of(entry.getKey(), null, amount));
        }
        return parts;
    }

    private static String firstName(JsonNode... nodes) {
        for (JsonNode node : nodes) {
            String value = localizedName(node);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static List<RecipePart> finish(List<RecipePart> parts) {
        if (parts.isEmpty()) {
            return null;
        }
        // Identical entries listed twice collapse to one.
        Set<RecipePart> unique = new LinkedHashSet<>(parts);
        List<RecipePart> sorted = new ArrayList<>(unique);
        sorted.sort(RecipePart.BY_KEY);
        return List.copyOf(sorted);
    }
}
