package com.catalog.reconciliation.core.model;

import java.util.List;

/**
 * Structured difference report for one canonical item.
 *
 * @param missingIn     active providers that have no entry for the item
 * @param fieldDiffers  scalar field disagreement flags
 * @param recipeDiffers whether recipe signatures disagree
 * @param severity      weighted disagreement score, 0 to 100
 * @param explanation   human-readable lines, one per triggered condition
 */
public record DiffReport(
        List<Provider> missingIn,
        FieldDiffers fieldDiffers,
        boolean recipeDiffers,
        int severity,
        List<String> explanation
) {
    public DiffReport {
        missingIn = missingIn != null ? List.copyOf(missingIn) : List.of();
        fieldDiffers = fieldDiffers != null ? fieldDiffers : FieldDiffers.none();
        explanation = explanation != null ? List.copyOf(explanation) : List.of();
        if (severity < 0 || severity > 100) {
            throw new IllegalArgumentException("Severity must be between 0 and 100");
        }
    }

    /**
     * Report placeholder used until the diff engine has run.
     */
    public static DiffReport empty() {
        return new DiffReport(List.of(), FieldDiffers.none(), false, 0, List.of());
    }
}
