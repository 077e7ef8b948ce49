package com.catalog.reconciliation.core.model;

/**
 * Per-field disagreement flags of a {@link DiffReport}.
 */
public record FieldDiffers(boolean name, boolean type, boolean rarity, boolean value, boolean weight) {

    public static FieldDiffers none() {
        return new FieldDiffers(false, false, false, false, false);
    }
}
