package org.Aayush.slicecache.context;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ContextDefinitions Tests")
class ContextDefinitionsTest {

    @Test
    @DisplayName("Builder keeps definition order and defaults to the explicit policy")
    void testBuilderOrderAndDefaultPolicy() {
        ContextDefinitions definitions = ContextDefinitions.builder()
                .dimension("device", "ios", "android")
                .dimension("channel", List.of("meta", "google", "other"))
                .build();

        assertEquals(List.of("device", "channel"), List.copyOf(definitions.dimensionKeys()));
        assertEquals(List.of("ios", "android"), List.copyOf(definitions.expectedValues("device")));
        assertEquals(Set.of("meta", "google", "other"), definitions.expectedValues("channel"));
        assertEquals(OtherPolicy.EXPLICIT, definitions.otherPolicy("channel"));
        assertEquals(OtherPolicy.EXPLICIT, ContextDefinitions.of(Map.of("device", List.of("ios"))).otherPolicy("device"));
        assertTrue(definitions.defines("channel"));
    }

    @Test
    @DisplayName("Ids are kept verbatim so padded and unpadded values stay distinct")
    void testIdsAreNotTrimmed() {
        ContextDefinitions definitions = ContextDefinitions.builder()
                .dimension("device", " ios ", "android")
                .dimension("channel", "google", "google ")
                .build();

        assertEquals(Set.of(" ios ", "android"), definitions.expectedValues("device"));
        assertFalse(definitions.expectedValues("device").contains("ios"));
        assertEquals(2, definitions.expectedValues("channel").size());
        assertFalse(definitions.defines(" device"));
    }

    @Test
    @DisplayName("Null and undefined policies drop other from the expected values")
    void testNullAndUndefinedDropOther() {
        ContextDefinitions definitions = ContextDefinitions.builder()
                .dimension("channel", OtherPolicy.NULL, "google", "meta", "other")
                .dimension("region", OtherPolicy.UNDEFINED, "uk", "other", "us")
                .build();

        assertEquals(List.of("google", "meta"), List.copyOf(definitions.expectedValues("channel")));
        assertEquals(List.of("uk", "us"), List.copyOf(definitions.expectedValues("region")));
        assertTrue(OtherPolicy.NULL.reducible());
        assertFalse(OtherPolicy.UNDEFINED.reducible());
    }

    @Test
    @DisplayName("Computed policy always expects other, appending it when not listed")
    void testComputedAddsOther() {
        ContextDefinitions definitions = ContextDefinitions.builder()
                .dimension("channel", OtherPolicy.COMPUTED, "google", "meta")
                .dimension("device", OtherPolicy.COMPUTED, "other", "ios")
                .build();

        assertEquals(List.of("google", "meta", "other"), List.copyOf(definitions.expectedValues("channel")));
        assertEquals(List.of("other", "ios"), List.copyOf(definitions.expectedValues("device")));
        assertEquals(OtherPolicy.COMPUTED, definitions.otherPolicy("channel"));
    }

    @Test
    @DisplayName("Unknown or null dimension lookups return null")
    void testUnknownDimension() {
        ContextDefinitions definitions = ContextDefinitions.of(Map.of("channel", List.of("google")));

        assertFalse(definitions.defines("region"));
        assertFalse(definitions.defines(null));
        assertNull(definitions.expectedValues("region"));
        assertNull(definitions.expectedValues(null));
        assertNull(definitions.otherPolicy("region"));
        assertTrue(ContextDefinitions.empty().dimensionKeys().isEmpty());
    }

    @Test
    @DisplayName("Invalid definitions are rejected")
    void testInvalidDefinitionsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> ContextDefinitions.builder().dimension(" ", "a").build());
        assertThrows(IllegalArgumentException.class,
                () -> ContextDefinitions.builder().dimension("channel", "google", " ").build());
        assertThrows(IllegalArgumentException.class,
                () -> ContextDefinitions.builder().dimension("channel", "google", "google").build());
        assertThrows(IllegalArgumentException.class,
                () -> ContextDefinitions.builder().dimension("channel", List.of()).build());
        assertThrows(IllegalArgumentException.class,
                () -> ContextDefinitions.builder().dimension("channel", OtherPolicy.NULL, "other").build());
        assertThrows(NullPointerException.class,
                () -> ContextDefinitions.builder().dimension("channel", (OtherPolicy) null, "google").build());
    }

    @Test
    @DisplayName("Exposed collections are immutable")
    void testImmutable() {
        ContextDefinitions definitions = ContextDefinitions.builder().dimension("channel", "google").build();

        assertThrows(UnsupportedOperationException.class, () -> definitions.expectedValues("channel").add("meta"));
        assertThrows(UnsupportedOperationException.class, () -> definitions.dimensionKeys().remove("channel"));
    }
}
