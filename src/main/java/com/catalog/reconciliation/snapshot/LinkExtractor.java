package com.catalog.reconciliation.snapshot;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

import static com.catalog.reconciliation.normalize.RawValues.field;
import static com.catalog.reconciliation.normalize.RawValues.firstNumber;
import static com.catalog.reconciliation.normalize.RawValues.firstText;
import static com.catalog.reconciliation.normalize.RawValues.object;
import static com.catalog.reconciliation.normalize.RawValues.text;

/**
 * Reads the relation arrays of a raw item into {@link ItemLink} rows.
 */
public final class LinkExtractor {

    private static final double DEFAULT_QUANTITY = 1.0;

    private LinkExtractor() {
    }

    /**
     * Extracts links in relation order, then array order. Returns an empty list when the
     * item has no usable id.
     */
    public static List<ItemLink> extract(JsonNode item) {
        String itemId = text(field(item, "id"));
        List<ItemLink> links = new ArrayList<>();
        if (itemId == null) {
            return links;
        }

        for (LinkRelation relation : LinkRelation.values()) {
            JsonNode entries = field(item, relation.column());
            if (entries == null || !entries.isArray()) {
                continue;
            }
            for (JsonNode entry : entries) {
                links.add(relation == LinkRelation.SOLD_BY
                        ? vendorLink(itemId, entry)
                        : itemLink(itemId, relation, entry));
            }
        }
        return links;
    }

    private static ItemLink itemLink(String itemId, LinkRelation relation, JsonNode entry) {
        JsonNode nested = object(entry, relation.nestedObject());
        Double quantity = firstNumber(field(entry, "quantity"), field(entry, "amount"), field(entry, "count"));
        return new ItemLink(
                itemId,
                relation,
                firstText(field(nested, "id"), field(entry, "id")),
                firstText(field(nested, "name"), field(entry, "name")),
                quantity != null ? quantity : DEFAULT_QUANTITY,
                entry.toString());
    }

    private static ItemLink vendorLink(String itemId, JsonNode entry) {
        return new ItemLink(
                itemId,
                LinkRelation.SOLD_BY,
                null,
                firstText(field(entry, "trader_name"), field(entry, "vendor")),
                firstNumber(field(entry, "price")),
                entry.toString());
    }
}
