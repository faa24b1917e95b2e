package com.place.conflation.rules;

import com.place.conflation.PlaceFixtures;
import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.PlaceRecord;
import com.place.conflation.core.model.Provider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = PlaceFixtures.engine();
    }

    @Test
    @DisplayName("Should handle null and blank inputs")
    void testNullAndBlankInputs() {
        for (AttributeKind kind : AttributeKind.values()) {
            assertEquals("", engine.normalize(null, kind));
            assertEquals("", engine.normalize("", kind));
            assertEquals("", engine.normalize("   ", kind));
        }
    }

    @Nested
    @DisplayName("Names")
    class Names {

        @ParameterizedTest
        @DisplayName("Should clean names and strip trailing business suffixes")
        @CsvSource(delimiter = '|', value = {
                "Tony's Pizzeria|tony s pizzeria",
                "Tonys Pizzeria Inc|tonys pizzeria",
                "Tonys Pizzeria, Inc.|tonys pizzeria",
                "ACME Hardware Co. LLC|acme hardware",
                "  Harbor    Books  |harbor books",
                "Café Olé|cafe ole",
                "Crème Brûlée Corp|creme brulee"
        })
        void testNameNormalization(String input, String expected) {
            assertEquals(expected, engine.normalize(input, AttributeKind.NAME));
        }

        @Test
        @DisplayName("Should never strip a name down to nothing")
        void testSuffixOnlyName() {
            assertEquals("llc", engine.normalize("LLC", AttributeKind.NAME));
            assertEquals("co", engine.normalize("Co.", AttributeKind.NAME));
        }

        @Test
        @DisplayName("Should map brand aliases to the canonical brand")
        void testBrandAliases() {
            assertEquals("walmart", engine.normalize("Wal-Mart", AttributeKind.NAME));
            assertEquals("walmart", engine.normalize("Walmart Supercenter Inc", AttributeKind.NAME));
            assertEquals("joe s pizza", engine.normalize("Joes Pizza NYC", AttributeKind.NAME));
            assertEquals("joe s pizza", engine.normalize("Joe's Pizza LLC", AttributeKind.NAME));
        }

        @Test
        @DisplayName("Should recognise canonical brand entries only without suffixes")
        void testCanonicalBrand() {
            assertTrue(engine.isCanonicalBrand("Joe's Pizza"));
            assertTrue(engine.isCanonicalBrand("JOE'S PIZZA"));
            assertFalse(engine.isCanonicalBrand("Joe's Pizza LLC"));
            assertFalse(engine.isCanonicalBrand("Joes Pizza NYC"));
            assertFalse(engine.isCanonicalBrand(null));
        }

        @Test
        @DisplayName("Should detect trailing business suffixes")
        void testBusinessSuffix() {
            assertTrue(engine.hasBusinessSuffix("Joe's Pizza LLC"));
            assertTrue(engine.hasBusinessSuffix("Tonys Pizzeria, Inc."));
            assertFalse(engine.hasBusinessSuffix("Tony's Pizzeria"));
            assertFalse(engine.hasBusinessSuffix("Inc"));
            assertFalse(engine.hasBusinessSuffix("Incense Shop"));
        }

        @Test
        @DisplayName("Should reject a brand table where one alias maps to two brands")
        void testConflictingBrandTable() {
            ReferenceData conflicting = new ReferenceData(
                    Map.of("Alpha", List.of("Shared Name"), "Beta", List.of("Shared Name")),
                    List.of());
            assertThrows(IllegalArgumentException.class,
                    () -> DefaultNormalizationRules.createEngine(conflicting));
        }
    }

    @Nested
    @DisplayName("Other attributes")
    class OtherAttributes {

        @ParameterizedTest
        @DisplayName("Should reduce phone numbers to their last ten digits")
        @CsvSource(delimiter = '|', value = {
                "+1 (212) 555-0100|2125550100",
                "212.555.0100|2125550100",
                "555-0100|5550100",
                "n/a|''"
        })
        void testPhoneNormalization(String input, String expected) {
            assertEquals(expected, engine.normalize(input, AttributeKind.PHONE));
        }

        @ParameterizedTest
        @DisplayName("Should reduce websites to their host")
        @CsvSource(delimiter = '|', value = {
                "https://www.Joes-Pizza.com/menu?x=1|joes-pizza.com",
                "http://tonyspizzeria.com|tonyspizzeria.com",
                "tonyspizzeria.com:8080/|tonyspizzeria.com",
                "WWW.Example.ORG.|example.org"
        })
        void testWebsiteNormalization(String input, String expected) {
            assertEquals(expected, engine.normalize(input, AttributeKind.WEBSITE));
        }

        @Test
        @DisplayName("Should not strip business suffixes from addresses")
        void testAddressKeepsCoTokens() {
            assertEquals("8 birch rd denver co 80202",
                    engine.normalize("8 Birch Rd, Denver, CO 80202", AttributeKind.ADDRESS));
        }

        @Test
        @DisplayName("Should normalize categories with the shared cleanup")
        void testCategory() {
            assertEquals("pizza italian restaurant",
                    engine.normalize("Pizza, Italian; Restaurant", AttributeKind.CATEGORY));
        }
    }

    @ParameterizedTest
    @DisplayName("Normalization should be idempotent")
    @CsvSource(delimiter = '|', value = {
            "NAME|Tonys Pizzeria, Inc. Co",
            "NAME|Wal-Mart Supercenter",
            "NAME|Joe's Pizza LLC",
            "NAME|  Ünïcödé   Bistro  ",
            "ADDRESS|12 Main St., Springfield, IL 62704",
            "PHONE|+1 (212) 555-0100 ext. 12",
            "WEBSITE|https://www.-example.com-./path",
            "WEBSITE|ftp://.www.www.example.com:21",
            "CATEGORY|Café; Bakery & Pastry"
    })
    void testIdempotence(AttributeKind kind, String input) {
        String once = engine.normalize(input, kind);
        assertEquals(once, engine.normalize(once, kind));
    }

    @Test
    @DisplayName("Should join address components in fixed order before cleanup")
    void testNormalizeRecordWithAddressComponents() {
        PlaceRecord record = PlaceRecord.builder()
                .recordId("a-1")
                .provider(Provider.PROVIDER_A)
                .name("Tony's Pizzeria")
                .address("12 Main St.", "Springfield", "IL", "62704")
                .phone("(217) 555-0101")
                .build();

        PlaceRecord normalized = engine.normalizeRecord(record);

        assertEquals("12 Main St., Springfield, IL, 62704", record.rawValue(AttributeKind.ADDRESS));
        assertEquals("12 main st springfield il 62704", normalized.normalized(AttributeKind.ADDRESS));
        assertEquals("tony s pizzeria", normalized.normalized(AttributeKind.NAME));
        assertEquals("2175550101", normalized.normalized(AttributeKind.PHONE));
        assertEquals("", normalized.normalized(AttributeKind.WEBSITE));
        assertTrue(record.getNormalizedAttributes().isEmpty());
    }
}
