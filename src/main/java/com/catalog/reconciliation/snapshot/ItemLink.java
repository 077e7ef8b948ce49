package com.catalog.reconciliation.snapshot;

/**
 * One denormalized relation row of a snapshot item.
 *
 * @param itemId        id of the owning item
 * @param relation      relation kind
 * @param relatedItemId id of the related item, null when unknown or for vendors
 * @param relatedName   name of the related item or vendor
 * @param quantity      amount for item relations (default 1), price for vendors (nullable)
 * @param rawFragment   JSON text of the array entry the link was read from
 */
public record ItemLink(
        String itemId,
        LinkRelation relation,
        String relatedItemId,
        String relatedName,
        Double quantity,
        String rawFragment
) {}
