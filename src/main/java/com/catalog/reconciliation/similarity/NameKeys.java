package com.catalog.reconciliation.similarity;

import com.catalog.reconciliation.core.model.SourceItem;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds the name keys used as primary matching keys.
 *
 * <p>A name key is the item name lowercased, Unicode-decomposed (NFKD) and reduced to
 * space-separated runs of {@code [a-z0-9]}. When the name yields an empty key the item
 * gets an id-key of the form {@code id:<provider>:<sourceItemId|index>}, which only ever
 * matches exactly.</p>
 */
public final class NameKeys {

    public static final String ID_KEY_PREFIX = "id:";

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NameKeys() {
    }

    /**
     * Normalizes a display name for matching. Returns an empty string for null input.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(name.toLowerCase(Locale.ROOT), Normalizer.Form.NFKD);
        String stripped = NON_ALPHANUMERIC.matcher(decomposed).replaceAll(" ").trim();
        return WHITESPACE.matcher(stripped).replaceAll(" ");
    }

    /**
     * Returns the name key of an item at {@code index} within its provider's list.
     */
    public static String nameKey(SourceItem item, int index) {
        String normalized = normalize(item.name());
        if (!normalized.isEmpty()) {
            return normalized;
        }
        String provider = item.sourceId().id();
        if (item.sourceItemId() != null) {
            return ID_KEY_PREFIX + provider + ":" + item.sourceItemId().toLowerCase(Locale.ROOT);
        }
        return ID_KEY_PREFIX + provider + ":" + index;
    }

    /**
     * Id-keys are never eligible for fuzzy matching.
     */
    public static boolean isIdKey(String nameKey) {
        return nameKey.startsWith(ID_KEY_PREFIX);
    }
}
