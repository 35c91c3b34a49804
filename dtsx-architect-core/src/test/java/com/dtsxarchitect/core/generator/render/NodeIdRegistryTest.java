package com.dtsxarchitect.core.generator.render;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link NodeIdRegistry}.
 */
class NodeIdRegistryTest {

    @Test
    void sanitize_replacesSeparatorsAndDropsOtherCharacters() {
        assertThat(NodeIdRegistry.sanitize("OLE DB Source")).isEqualTo("OLE_DB_Source");
        assertThat(NodeIdRegistry.sanitize("Derived-Column.v2")).isEqualTo("Derived_Column_v2");
        assertThat(NodeIdRegistry.sanitize("Lookup (Customers)!")).isEqualTo("Lookup_Customers");
        assertThat(NodeIdRegistry.sanitize("Größe")).isEqualTo("Gre");
    }

    @Test
    void sanitize_withNothingLeft_returnsPlaceholder() {
        assertThat(NodeIdRegistry.sanitize("???")).isEqualTo("node");
        assertThat(NodeIdRegistry.sanitize("")).isEqualTo("node");
        assertThat(NodeIdRegistry.sanitize(null)).isEqualTo("node");
    }

    @Test
    void sanitize_isDeterministicAndAsciiOnly() {
        String name = "Sales: Q1 / Q2 - Ünïcode.Mix";

        String first = NodeIdRegistry.sanitize(name);
        String second = NodeIdRegistry.sanitize(name);

        assertThat(first).isEqualTo(second).matches("[A-Za-z0-9_]+");
    }

    @Test
    void idFor_withCollidingNames_appendsCounter() {
        // Given
        NodeIdRegistry ids = new NodeIdRegistry();

        // When
        String dash = ids.idFor("Load-Orders");
        String space = ids.idFor("Load Orders");
        String dot = ids.idFor("Load.Orders");

        // Then
        assertThat(dash).isEqualTo("Load_Orders");
        assertThat(space).isEqualTo("Load_Orders_2");
        assertThat(dot).isEqualTo("Load_Orders_3");
    }

    @Test
    void idFor_withSameName_returnsSameId() {
        NodeIdRegistry ids = new NodeIdRegistry();

        assertThat(ids.idFor("Sink")).isEqualTo(ids.idFor("Sink"));
    }

    @Test
    void reserve_afterComponents_takesNextFreeId() {
        // Given
        NodeIdRegistry ids = new NodeIdRegistry();
        String component = ids.idFor("Load Orders");

        // When
        String title = ids.reserve("Load Orders");

        // Then
        assertThat(component).isEqualTo("Load_Orders");
        assertThat(title).isEqualTo("Load_Orders_2");
        assertThat(ids.idFor("Load Orders")).isEqualTo("Load_Orders");
    }
}
