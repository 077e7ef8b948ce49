package com.catalog.reconciliation.normalize;

import com.catalog.reconciliation.core.model.Provider;
import com.catalog.reconciliation.core.model.RecipePart;
import com.catalog.reconciliation.core.model.SourceItem;
import com.catalog.reconciliation.provider.FetchResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ItemNormalizerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ItemNormalizer normalizer = new ItemNormalizer();

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    @Nested
    @DisplayName("ardb")
    class ArdbTests {

        @Test
        @DisplayName("Should map fields, crafting inputs and synthesized output")
        void testFullRecord() {
            SourceItem item = normalizer.normalize(Provider.ARDB, json("""
                    {"id": "battery", "name": {"de": "Batterie", "en": "Battery"},
                     "type": "Material", "rarity": "Common", "value": "120", "weight": 0.5,
                     "craftingRequirement": {
                       "requiredItems": [
                         {"itemId": "wires", "amount": 2},
                         {"item": {"id": "metal", "name": "Metal"}, "quantity": "3"}
                       ],
                       "outputAmount": 2
                     }}
                    """));

            assertEquals(Provider.ARDB, item.sourceId());
            assertEquals("battery", item.sourceItemId());
            assertEquals("Battery", item.name());
            assertEquals("Material", item.type());
            assertEquals("Common", item.rarity());
            assertEquals(120.0, item.value());
            assertEquals(0.5, item.weight());
            assertEquals(List.of(
                    RecipePart.of("metal", "Metal", 3),
                    RecipePart.of("wires", null, 2)), item.inputs());
            assertEquals(List.of(RecipePart.of("battery", "Battery", 2)), item.outputs());
        }

        @Test
        @DisplayName("Should fall back to recipe map when there is no crafting requirement")
        void testRecipeFallback() {
            SourceItem item = normalizer.normalize(Provider.ARDB, json("""
                    {"id": "fuse", "name": "Fuse", "recipe": {"wires": 1}}
                    """));

            assertEquals(List.of(RecipePart.of("wires", null, 1)), item.inputs());
            assertNull(item.outputs());
        }
    }

    @Nested
    @DisplayName("metaforge")
    class MetaForgeTests {

        @Test
        @DisplayName("Should prefer stat_block weight and item_type")
        void testStatBlock() {
            SourceItem item = normalizer.normalize(Provider.METAFORGE, json("""
                    {"id": "mf-1", "name": "Battery", "item_type": "Material", "type": "Other",
                     "stat_block": {"weight": 0.4}, "weight": 9,
                     "components": [{"component": {"id": "wires", "name": "Wires"}, "quantity": 2}]}
                    """));

            assertEquals("Material", item.type());
            assertEquals(0.4, item.weight());
            assertEquals(List.of(RecipePart.of("wires", "Wires", 2)), item.inputs());
            assertEquals(List.of(RecipePart.of("mf-1", "Battery", 1)), item.outputs());
        }

        @Test
        @DisplayName("Should leave outputs empty for items without a recipe")
        void testNoRecipe() {
            SourceItem item = normalizer.normalize(Provider.METAFORGE, json("""
                    {"id": "mf-2", "name": "Scrap", "weight": "1.5"}
                    """));

            assertEquals(1.5, item.weight());
            assertNull(item.inputs());
            assertNull(item.outputs());
        }
    }

    @Nested
    @DisplayName("raidtheory and mahcks")
    class RecipeFileTests {

        @Test
        @DisplayName("Should read weightKg and skip unusable recipe amounts")
        void testRecipeMap() {
            SourceItem item = normalizer.normalize(Provider.RAIDTHEORY, json("""
                    {"id": "battery", "name": {"en": "Battery"}, "weightKg": 0.5,
                     "recipe": {"wires": 2, "metal": 0, "scrap": "x"}}
                    """));

            assertEquals(0.5, item.weight());
            assertEquals(List.of(RecipePart.of("wires", null, 2)), item.inputs());
            assertEquals(List.of(RecipePart.of("battery", "Battery", 1)), item.outputs());
        }

        @Test
        @DisplayName("Should order recipe entries sharing an id the same way for every provider")
        void testSharedKeyOrder() {
            SourceItem raidTheory = normalizer.normalize(Provider.RAIDTHEORY, json("""
                    {"id": "x", "name": "X", "recipe": [{"id": "wires", "amount": 1}, {"id": "wires", "amount": 2}]}
                    """));
            SourceItem mahcks = normalizer.normalize(Provider.MAHCKS, json("""
                    {"id": "x", "name": "X", "recipe": [{"id": "wires", "amount": 2}, {"id": "wires", "amount": 1}]}
                    """));

            assertEquals(List.of(RecipePart.of("wires", null, 1), RecipePart.of("wires", null, 2)),
                    raidTheory.inputs());
            assertEquals(raidTheory.inputs(), mahcks.inputs());
        }

        @Test
        @DisplayName("Should tag mahcks items with their own provider")
        void testMahcksProvider() {
            SourceItem item = normalizer.normalize(Provider.MAHCKS, json("""
                    {"id": "battery", "name": "Battery", "weight": 0.7}
                    """));

            assertEquals(Provider.MAHCKS, item.sourceId());
            assertEquals(0.7, item.weight());
        }
    }

    @Nested
    @DisplayName("Lenient parsing")
    class LenientTests {

        @Test
        @DisplayName("Should treat blank strings and non-numeric text as absent")
        void testBlankValues() {
            SourceItem item = normalizer.normalize(Provider.ARDB, json("""
                    {"id": "  ", "name": "   ", "type": "", "value": "  ", "weight": "heavy"}
                    """));

            assertNull(item.sourceItemId());
            assertNull(item.name());
            assertNull(item.type());
            assertNull(item.value());
            assertNull(item.weight());
        }

        @Test
        @DisplayName("Should read plain decimal strings and reject Java-only number forms")
        void testNumericStrings() {
            SourceItem plain = normalizer.normalize(Provider.ARDB, json("""
                    {"id": "a", "value": " 12.5 ", "weight": "1e-1"}
                    """));
            SourceItem javaForms = normalizer.normalize(Provider.ARDB, json("""
                    {"id": "b", "value": "10d", "weight": "0x1p3"}
                    """));
            SourceItem signed = normalizer.normalize(Provider.ARDB, json("""
                    {"id": "c", "value": "-.5", "weight": "Infinity"}
                    """));

            assertEquals(12.5, plain.value());
            assertEquals(0.1, plain.weight());
            assertNull(javaForms.value());
            assertNull(javaForms.weight());
            assertEquals(-0.5, signed.value());
            assertNull(signed.weight());
        }

        @Test
        @DisplayName("Should collapse identical recipe entries and default amounts to 1")
        void testDuplicateEntries() {
            SourceItem item = normalizer.normalize(Provider.ARDB, json("""
                    {"id": "x", "name": "X", "recipe": [
                      {"itemId": "wires", "amount": 2},
                      {"itemId": "wires", "amount": 2},
                      {"name": "Glue", "amount": 0},
                      {"note": "no id or name"}
                    ]}
                    """));

            assertEquals(List.of(
                    RecipePart.of(null, "Glue", 1),
                    RecipePart.of("wires", null, 2)), item.inputs());
        }

        @Test
        @DisplayName("Should not throw on non-object input")
        void testNonObject() {
            SourceItem item = normalizer.normalize(Provider.METAFORGE, TextNode.valueOf("oops"));

            assertEquals(Provider.METAFORGE, item.sourceId());
            assertNull(item.name());
            assertNull(item.sourceItemId());
        }

        @Test
        @DisplayName("normalizeAll should drop non-object entries and keep order")
        void testNormalizeAll() {
            FetchResult result = new FetchResult(Provider.ARDB, "2026-01-01T00:00:00Z", "v1", List.of(
                    json("{\"id\": \"b\", \"name\": \"B\"}"),
                    json("42"),
                    json("{\"id\": \"a\", \"name\": \"A\"}")));

            List<SourceItem> items = normalizer.normalizeAll(result);

            assertEquals(2, items.size());
            assertEquals("B", items.get(0).name());
            assertEquals("A", items.get(1).name());
        }
    }
}
