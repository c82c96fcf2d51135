package com.example.feedpipeline.generator;

import com.example.feedpipeline.exception.FeedConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldResolverTest {

    private final FieldResolver resolver = new FieldResolver();

    @Test
    void testResolvesMapKey() {
        Map<String, Object> record = Map.of("sku", "A1", "name", "Bolt");

        assertEquals("A1", resolver.resolve(record, "sku", null));
        assertNull(resolver.resolve(record, "price", null));
    }

    @Test
    void testCustomMappingFollowsDottedPath() {
        Map<String, Object> record = Map.of("brand", Map.of("name", "Acme", "code", "AC"));
        Map<String, String> mapping = Map.of("brand_name", "brand.name");

        assertEquals("Acme", resolver.resolve(record, "brand_name", mapping));
        assertNull(resolver.resolve(Map.of("sku", "A1"), "brand_name", mapping));
    }

    @Test
    void testResolvesBeanProperties() {
        Part part = new Part("A1", new Dimensions(12.5));

        assertEquals("A1", resolver.resolve(part, "sku", null));
        assertEquals(12.5, resolver.resolve(part, "dimensions.length", null));
        assertNull(resolver.resolve(part, "dimensions.width", null));
        assertNull(resolver.resolve(part, "class", null));
    }

    @Test
    void testCollectionsBecomeStringLists() {
        Map<String, Object> record = Map.of(
                "categories", new LinkedHashSet<>(List.of("Brakes", "Pads")),
                "years", new int[]{2019, 2020});

        assertEquals(List.of("Brakes", "Pads"), resolver.resolve(record, "categories", null));
        assertEquals(List.of("2019", "2020"), resolver.resolve(record, "years", null));
    }

    @Test
    void testRejectsExpressionLikeMappings() {
        Map<String, Object> record = Map.of("sku", "A1");

        assertThrows(FeedConfigurationException.class,
                () -> resolver.resolve(record, "sku", Map.of("sku", "getClass().getName()")));
        assertThrows(FeedConfigurationException.class,
                () -> resolver.validateMapping(Map.of("sku", "sku; drop")));
        assertThrows(FeedConfigurationException.class,
                () -> resolver.validateMapping(Map.of("sku", "brand..name")));
        assertDoesNotThrow(() -> resolver.validateMapping(Map.of("brand_name", "brand.name")));
    }

    public static class Part {
        private final String sku;
        private final Dimensions dimensions;

        public Part(String sku, Dimensions dimensions) {
            this.sku = sku;
            this.dimensions = dimensions;
        }

        public String getSku() {
            return sku;
        }

        public Dimensions getDimensions() {
            return dimensions;
        }
    }

    public static class Dimensions {
        private final double length;

        public Dimensions(double length) {
            this.length = length;
        }

        public double getLength() {
            return length;
        }
    }
}
