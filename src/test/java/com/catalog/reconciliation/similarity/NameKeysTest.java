package com.catalog.reconciliation.similarity;

import com.catalog.reconciliation.core.model.Provider;
import com.catalog.reconciliation.core.model.SourceItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class NameKeysTest {

    @ParameterizedTest(name = "''{0}'' -> ''{1}''")
    @CsvSource({
            "'Battery', 'battery'",
            "'  Advanced   ARC-Powercell ', 'advanced arc powercell'",
            "'Café', 'cafe'",
            "'Mk. II (Blue)', 'mk ii blue'",
            "'!!!', ''"
    })
    @DisplayName("Should lowercase, strip accents and collapse non-alphanumerics")
    void testNormalize(String input, String expected) {
        assertEquals(expected, NameKeys.normalize(input));
    }

    @Test
    @DisplayName("Null name normalizes to empty")
    void testNull() {
        assertEquals("", NameKeys.normalize(null));
    }

    @Test
    @DisplayName("Should fall back to an id-key built from provider and item id")
    void testIdKey() {
        SourceItem item = SourceItem.builder(Provider.ARDB).sourceItemId("Item-42").name("???").build();

        String key = NameKeys.nameKey(item, 3);

        assertEquals("id:ardb:item-42", key);
        assertTrue(NameKeys.isIdKey(key));
    }

    @Test
    @DisplayName("Should fall back to the list index when there is no id either")
    void testIndexKey() {
        SourceItem item = SourceItem.builder(Provider.MAHCKS).build();

        assertEquals("id:mahcks:7", NameKeys.nameKey(item, 7));
    }

    @Test
    @DisplayName("Name keys are not id-keys")
    void testNameKey() {
        SourceItem item = SourceItem.builder(Provider.ARDB).sourceItemId("x").name("Battery").build();

        assertEquals("battery", NameKeys.nameKey(item, 0));
        assertFalse(NameKeys.isIdKey("battery"));
    }
}
