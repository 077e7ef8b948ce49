package com.catalog.reconciliation.snapshot;

import java.util.Optional;

/**
 * Relation kinds denormalized from an item's nested arrays. The column value equals the
 * name of the array it is read from.
 */
public enum LinkRelation {
    COMPONENTS("components", "component"),
    RECYCLE_COMPONENTS("recycle_components", "component"),
    RECYCLE_FROM("recycle_from", "item"),
    USED_IN("used_in", "item"),
    SOLD_BY("sold_by", null);

    private final String column;
    private final String nestedObject;

    LinkRelation(String column, String nestedObject) {
        this.column = column;
        this.nestedObject = nestedObject;
    }

    /**
     * Stored value, also the source array name.
     */
    public String column() {
        return column;
    }

    /**
     * Name of the nested object carrying the related item's id and name, null for vendors.
     */
    String nestedObject() {
        return nestedObject;
    }

    public static Optional<LinkRelation> fromColumn(String column) {
        for (LinkRelation relation : values()) {
            if (relation.column.equals(column)) {
                return Optional.of(relation);
            }
        }
        return Optional.empty();
    }
}
