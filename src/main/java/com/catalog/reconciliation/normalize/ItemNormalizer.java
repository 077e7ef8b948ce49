package com.catalog.reconciliation.normalize;

import com.catalog.reconciliation.core.model.Provider;
import com.catalog.reconciliation.core.model.RecipePart;
import com.catalog.reconciliation.core.model.SourceItem;
import com.catalog.reconciliation.provider.FetchResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.catalog.reconciliation.normalize.RawValues.field;
import static com.catalog.reconciliation.normalize.RawValues.firstNumber;
import static com.catalog.reconciliation.normalize.RawValues.firstText;
import static com.catalog.reconciliation.normalize.RawValues.localizedName;
import static com.catalog.reconciliation.normalize.RawValues.number;
import static com.catalog.reconciliation.normalize.RawValues.object;
import static com.catalog.reconciliation.normalize.RawValues.text;

/**
 * Maps raw provider payloads onto {@link SourceItem}.
 *
 * <p>Each provider has one fixed, hand-written mapping selected by its {@link Provider} tag.
 * Normalization is pure and never throws: fields that are missing or malformed are left null.</p>
 *
 * <h2>Field aliases</h2>
 * <ul>
 *   <li>{@code ardb}: inputs from {@code craftingRequirement.requiredItems} or {@code recipe};
 *       output synthesized from {@code craftingRequirement.outputAmount}</li>
 *   <li>{@code metaforge}: type from {@code item_type}, weight from {@code stat_block.weight},
 *       inputs from {@code components}, {@code recipe} or {@code ingredients}</li>
 *   <li>{@code raidtheory}, {@code mahcks}: weight from {@code weightKg}, inputs from {@code recipe}</li>
 * </ul>
 */
public class ItemNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ItemNormalizer.class);

    /**
     * Normalizes every object entry of a fetch result, in order. Non-object entries are dropped.
     */
    public List<SourceItem> normalizeAll(FetchResult result) {
        List<SourceItem> items = new ArrayList<>(result.itemsRaw().size());
        int skipped = 0;
        for (JsonNode raw : result.itemsRaw()) {
            if (raw == null || !raw.isObject()) {
                skipped++;
                continue;
            }
            items.add(normalize(result.sourceId(), raw));
        }
        if (skipped > 0) {
            log.debug("normalize.skipped provider={} count={}", result.sourceId(), skipped);
        }
        return items;
    }

    /**
     * Normalizes one raw record of the given provider.
     */
    public SourceItem normalize(Provider provider, JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return SourceItem.builder(provider).raw(raw).build();
        }
        return switch (provider) {
            case ARDB -> normalizeArdb(raw);
            case METAFORGE -> normalizeMetaForge(raw);
            case RAIDTHEORY, MAHCKS -> normalizeRecipeFileItem(provider, raw);
        };
    }

    private SourceItem normalizeArdb(JsonNode raw) {
        String id = text(raw.get("id"));
        String name = localizedName(raw.get("name"));
        JsonNode crafting = object(raw, "craftingRequirement");

        JsonNode requiredItems = field(crafting, "requiredItems");
        List<RecipePart> inputs = requiredItems != null && requiredItems.isArray()
                ? RecipeParts.extract(requiredItems) : null;
        if (inputs == null) {
            inputs = RecipeParts.extract(raw.get("recipe"));
        }

        List<RecipePart> outputs = null;
        if (id != null && crafting != null) {
            Double outputAmount = number(crafting.get("outputAmount"));
            outputs = List.of(RecipePart.of(id, name, outputAmount != null ? outputAmount : 1));
        }

        return SourceItem.builder(Provider.ARDB)
                .sourceItemId(id)
                .name(name)
                .type(text(raw.get("type")))
                .rarity(text(raw.get("rarity")))
                .value(number(raw.get("value")))
                .weight(number(raw.get("weight")))
                .inputs(inputs)
                .outputs(outputs)
                .raw(raw)
                .build();
    }

    private SourceItem normalizeMetaForge(JsonNode raw) {
        String id = text(raw.get("id"));
        String name = localizedName(raw.get("name"));
        JsonNode statBlock = object(raw, "stat_block");

        List<RecipePart> inputs = firstParts(raw.get("components"), raw.get("recipe"), raw.get("ingredients"));
        List<RecipePart> outputs = firstParts(raw.get("outputs"), raw.get("output"));
        if (outputs == null && id != null && inputs != null) {
            outputs = List.of(RecipePart.of(id, name, 1));
        }

        return SourceItem.builder(Provider.METAFORGE)
                .sourceItemId(id)
                .name(name)
                .type(firstText(raw.get("item_type"), raw.get("type")))
                .rarity(text(raw.get("rarity")))
                .value(number(raw.get("value")))
                .weight(firstNumber(field(statBlock, "weight"), raw.get("weight")))
                .inputs(inputs)
                .outputs(outputs)
                .raw(raw)
                .build();
    }

    private SourceItem normalizeRecipeFileItem(Provider provider, JsonNode raw) {
        String id = text(raw.get("id"));
        String name = localizedName(raw.get("name"));

        List<RecipePart> inputs = RecipeParts.extract(raw.get("recipe"));
        List<RecipePart> outputs = inputs != null && id != null
                ? List.of(RecipePart.of(id, name, 1)) : null;

        return SourceItem.builder(provider)
                .sourceItemId(id)
                .name(name)
                .type(text(raw.get("type")))
                .rarity(text(raw.get("rarity")))
                .value(number(raw.get("value")))
                .weight(firstNumber(raw.get("weightKg"), raw.get("weight")))
                .inputs(inputs)
                .outputs(outputs)
                .raw(raw)
                .build();
    }

    private static List<RecipePart> firstParts(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            List<RecipePart> parts = RecipeParts.extract(candidate);
            if (parts != null) {
                return parts;
            }
        }
        return null;
    }
}
