package com.catalog.reconciliation.diff;

import com.catalog.reconciliation.core.model.CanonicalItem;
import com.catalog.reconciliation.core.model.DiffReport;
import com.catalog.reconciliation.core.model.FieldDiffers;
import com.catalog.reconciliation.core.model.Provider;
import com.catalog.reconciliation.core.model.SourceItem;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Computes field-level and recipe-level differences between the provider entries of one
 * canonical item.
 *
 * <p>A field differs when the providers holding the item disagree on its normalized value,
 * or when some of them publish the field and others leave it out. Severity weights:</p>
 * <ul>
 *   <li>18 per provider missing the item</li>
 *   <li>10 name, 8 type, 8 rarity, 12 value, 12 weight, 20 recipe</li>
 * </ul>
 * The sum is clamped to 100. The engine is stateless.
 */
public class DiffEngine {

    static final int MISSING_WEIGHT = 18;
    static final int NAME_WEIGHT = 10;
    static final int TYPE_WEIGHT = 8;
    static final int RARITY_WEIGHT = 8;
    static final int VALUE_WEIGHT = 12;
    static final int WEIGHT_WEIGHT = 12;
    static final int RECIPE_WEIGHT = 20;
    static final int MAX_SEVERITY = 100;

    /**
     * Builds the diff report of {@code item} against the given active providers.
     */
    public DiffReport diff(CanonicalItem item, List<Provider> activeProviders) {
        List<Provider> present = new ArrayList<>();
        List<Provider> missingIn = new ArrayList<>();
        for (Provider provider : activeProviders) {
            if (item.hasSource(provider)) {
                present.add(provider);
            } else {
                missingIn.add(provider);
            }
        }

        FieldDiffers fieldDiffers = new FieldDiffers(
                differs(item, present, SourceItem::name, DiffEngine::normalizeText),
                differs(item, present, SourceItem::type, DiffEngine::normalizeText),
                differs(item, present, SourceItem::rarity, DiffEngine::normalizeText),
                differs(item, present, SourceItem::value, DiffEngine::normalizeNumber),
                differs(item, present, SourceItem::weight, DiffEngine::normalizeNumber));

        boolean recipeDiffers = differs(item, present, RecipeSignature::of,
                signature -> signature.isEmpty() ? null : signature);

        int severity = missingIn.size() * MISSING_WEIGHT
                + (fieldDiffers.name() ? NAME_WEIGHT : 0)
                + (fieldDiffers.type() ? TYPE_WEIGHT : 0)
                + (fieldDiffers.rarity() ? RARITY_WEIGHT : 0)
                + (fieldDiffers.value() ? VALUE_WEIGHT : 0)
                + (fieldDiffers.weight() ? WEIGHT_WEIGHT : 0)
                + (recipeDiffers ? RECIPE_WEIGHT : 0);
        severity = Math.min(MAX_SEVERITY, severity);

        List<String> explanation = new ArrayList<>();
        if (!missingIn.isEmpty()) {
            explanation.add("Missing in: " + missingIn.stream().map(Provider::id).collect(Collectors.joining(", ")));
        }
        if (fieldDiffers.name()) {
            explanation.add(describe("Name", item, activeProviders, SourceItem::name));
        }
        if (fieldDiffers.type()) {
            explanation.add(describe("Type", item, activeProviders, SourceItem::type));
        }
        if (fieldDiffers.rarity()) {
            explanation.add(describe("Rarity", item, activeProviders, SourceItem::rarity));
        }
        if (fieldDiffers.value()) {
            explanation.add(describe("Value", item, activeProviders, SourceItem::value));
        }
        if (fieldDiffers.weight()) {
            explanation.add(describe("Weight", item, activeProviders, SourceItem::weight));
        }
        if (recipeDiffers) {
            explanation.add("Recipe differs (inputs/outputs are not equivalent).");
        }

        return new DiffReport(missingIn, fieldDiffers, recipeDiffers, severity, explanation);
    }

    private static <T, N> boolean differs(CanonicalItem item, List<Provider> present,
                                          Function<SourceItem, T> accessor,
                                          Function<T, N> normalizer) {
        Set<N> distinct = new HashSet<>();
        int defined = 0;
        for (Provider provider : present) {
            T raw = accessor.apply(item.source(provider));
            N normalized = raw == null ? null : normalizer.apply(raw);
            if (normalized != null) {
                defined++;
                distinct.add(normalized);
            }
        }
        if (defined == 0) {
            return false;
        }
        if (distinct.size() > 1) {
            return true;
        }
        // Agreement among publishers, but some providers holding the item omit the field.
        return defined != present.size();
    }

    private static String describe(String label, CanonicalItem item, List<Provider> activeProviders,
                                   Function<SourceItem, ?> accessor) {
        String values = activeProviders.stream()
                .map(provider -> {
                    SourceItem source = item.source(provider);
                    Object value = source == null ? null : accessor.apply(source);
                    return provider.id() + "=" + formatValue(value);
                })
                .collect(Collectors.joining(", "));
        return label + " differs: " + values;
    }

    private static String formatValue(Object value) {
        if (value == null) {
            return "-";
        }
        if (value instanceof Double number) {
            return RecipeSignature.formatNumber(number);
        }
        String text = Objects.toString(value);
        return text.isEmpty() ? "-" : text;
    }

    static String normalizeText(String value) {
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }

    static Double normalizeNumber(Double value) {
        if (value.isNaN()) {
            return null;
        }
        return Math.round(value * 10_000) / 10_000.0;
    }
}
