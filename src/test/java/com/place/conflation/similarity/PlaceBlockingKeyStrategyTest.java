package com.place.conflation.similarity;

import com.place.conflation.PlaceFixtures;
import com.place.conflation.core.model.PlaceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PlaceBlockingKeyStrategyTest {

    private final PlaceBlockingKeyStrategy strategy = new PlaceBlockingKeyStrategy();

    private PlaceRecord normalized(String name, String address) {
        return PlaceFixtures.engine().normalizeRecord(PlaceFixtures.a("a-1", name, address));
    }

    @Test
    @DisplayName("Should key by first name token and postal code")
    void testKeys() {
        Set<String> keys = strategy.generateKeys(normalized("Tony's Pizzeria", "12 Main St, Springfield, IL 62704"));
        assertEquals(Set.of("tok:tony", "zip:62704"), keys);
    }

    @Test
    @DisplayName("Should use the last five-digit token as postal code")
    void testLastPostalToken() {
        Set<String> keys = strategy.generateKeys(normalized("Deli", "10001 Broadway, Springfield, IL 62704-1234"));
        assertTrue(keys.contains("zip:62704"));
        assertFalse(keys.contains("zip:10001"));
        assertEquals("62704", PlaceBlockingKeyStrategy.postalCode("10001 broadway 62704 1234"));
        assertNull(PlaceBlockingKeyStrategy.postalCode("no postal code here"));
    }

    @Test
    @DisplayName("Should return no keys for a record without name or address")
    void testEmpty() {
        assertTrue(strategy.generateKeys(normalized(null, null)).isEmpty());
    }

    @Test
    @DisplayName("NONE should put every record in one bucket")
    void testNone() {
        assertEquals(Set.of("all"), BlockingKeyStrategy.NONE.generateKeys(normalized("A", "B")));
    }
}
