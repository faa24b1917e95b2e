package com.place.conflation.conflation;

import com.place.conflation.PlaceFixtures;
import com.place.conflation.core.model.AttributeCandidate;
import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.MatchedPair;
import com.place.conflation.core.model.PlaceRecord;
import com.place.conflation.core.model.Provider;
import com.place.conflation.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CandidateAggregatorTest {

    @Mock
    private MetricsService metrics;

    private CandidateAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new CandidateAggregator(PlaceFixtures.engine(), metrics);
    }

    private static MatchedPair pair(PlaceRecord a, PlaceRecord b) {
        return MatchedPair.exact(a, b);
    }

    private static PlaceRecord.Builder recordA() {
        return PlaceRecord.builder().recordId("a-1").provider(Provider.PROVIDER_A)
                .name("Joe's Pizza LLC").address("7 Carmine St, New York, NY 10014");
    }

    private static PlaceRecord.Builder recordB() {
        return PlaceRecord.builder().recordId("b-1").provider(Provider.PROVIDER_B)
                .name("Joe's Pizza").address("7 Carmine St, New York, NY 10014");
    }

    @Test
    @DisplayName("Should build one candidate set per attribute kind")
    void testOneSetPerKind() {
        Map<AttributeKind, CandidateSet> sets = aggregator.aggregate(pair(recordA().build(), recordB().build()));

        assertEquals(AttributeKind.values().length, sets.size());
        assertTrue(sets.get(AttributeKind.PHONE).bothMissing());
        assertNotNull(sets.get(AttributeKind.NAME).candidateA());
        assertNotNull(sets.get(AttributeKind.NAME).candidateB());
    }

    @Test
    @DisplayName("Should derive name flags from the raw value")
    void testNameFlags() {
        CandidateSet names = aggregator.aggregate(pair(recordA().build(), recordB().build())).get(AttributeKind.NAME);

        AttributeCandidate a = names.candidateA();
        assertEquals("joe s pizza", a.value());
        assertEquals("Joe's Pizza LLC", a.rawValue());
        assertTrue(a.businessSuffix());
        assertFalse(a.canonicalBrand());
        assertEquals(3, a.tokenCount());

        AttributeCandidate b = names.candidateB();
        assertTrue(b.canonicalBrand());
        assertFalse(b.businessSuffix());
        assertEquals(2, b.tokenCount());
    }

    @Test
    @DisplayName("Should parse a valid confidence")
    void testValidConfidence() {
        CandidateSet names = aggregator.aggregate(pair(recordA().confidence("0.85").build(), recordB().build()))
                .get(AttributeKind.NAME);

        assertEquals(0.85, names.candidateA().sourceConfidence());
        assertFalse(names.candidateA().confidenceMalformed());
        assertNull(names.candidateB().sourceConfidence());
        assertFalse(names.candidateB().confidenceMalformed());
        verifyNoInteractions(metrics);
    }

    @ParameterizedTest
    @DisplayName("Should treat malformed confidence as absent and flag it")
    @ValueSource(strings = {"abc", "NaN", "Infinity", "-0.1", "1.5"})
    void testMalformedConfidence(String confidence) {
        CandidateSet names = aggregator.aggregate(pair(recordA().confidence(confidence).build(), recordB().build()))
                .get(AttributeKind.NAME);

        assertNull(names.candidateA().sourceConfidence());
        assertTrue(names.candidateA().confidenceMalformed());
        verify(metrics, times(1)).incrementMalformedConfidence(Provider.PROVIDER_A);
    }

    @Test
    @DisplayName("Should keep a present but unusable value as an unusable candidate")
    void testUnusableValue() {
        PlaceRecord a = recordA().phone("n/a").build();
        CandidateSet phones = aggregator.aggregate(pair(a, recordB().build())).get(AttributeKind.PHONE);

        assertNotNull(phones.candidateA());
        assertFalse(phones.candidateA().isUsable());
        assertNull(phones.candidateB());
        assertFalse(phones.anyUsable());
    }

    @Test
    @DisplayName("Should use normalized attributes already on the record")
    void testUsesNormalizedRecord() {
        PlaceRecord a = PlaceFixtures.engine().normalizeRecord(recordA().website("https://www.joespizzanyc.com/").build());
        CandidateSet websites = aggregator.aggregate(pair(a, recordB().build())).get(AttributeKind.WEBSITE);

        assertEquals("joespizzanyc.com", websites.candidateA().value());
        assertEquals("https://www.joespizzanyc.com/", websites.candidateA().rawValue());
    }
}
