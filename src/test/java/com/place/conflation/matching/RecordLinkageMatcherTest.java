package com.place.conflation.matching;

import com.place.conflation.PlaceFixtures;
import com.place.conflation.api.ConflationOptions;
import com.place.conflation.bulk.ProgressCallback;
import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.ExcludedRecord;
import com.place.conflation.core.model.ExclusionReason;
import com.place.conflation.core.model.MatchKind;
import com.place.conflation.core.model.MatchedPair;
import com.place.conflation.core.model.PlaceRecord;
import com.place.conflation.metrics.MetricsService;
import com.place.conflation.rules.NormalizationEngine;
import com.place.conflation.similarity.BlockingKeyStrategy;
import com.place.conflation.similarity.PlaceBlockingKeyStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RecordLinkageMatcherTest {

    private NormalizationEngine engine;
    private List<PlaceRecord> corpus;

    @BeforeEach
    void setUp() {
        engine = PlaceFixtures.engine();
        corpus = new ArrayList<>();
        PlaceFixtures.corpusA().forEach(r -> corpus.add(engine.normalizeRecord(r)));
        PlaceFixtures.corpusB().forEach(r -> corpus.add(engine.normalizeRecord(r)));
    }

    private static ConflationOptions.Builder options() {
        return ConflationOptions.builder().referenceData(PlaceFixtures.referenceData());
    }

    private static List<String> placeKeys(LinkageResult result) {
        return result.pairs().stream().map(MatchedPair::placeKey).toList();
    }

    private static List<String> ids(List<PlaceRecord> records) {
        return records.stream().map(PlaceRecord::getRecordId).toList();
    }

    @Nested
    @DisplayName("Corpus")
    class Corpus {

        private LinkageResult result;

        @BeforeEach
        void match() {
            result = new RecordLinkageMatcher(options().build()).match(corpus, ProgressCallback.NOOP);
        }

        @Test
        @DisplayName("Should find exact and fuzzy pairs ordered by ProviderA record id")
        void testPairs() {
            assertEquals(List.of("a-1|b-1", "a-2|b-2", "a-3|b-3", "a-6|b-6"), placeKeys(result));
            assertEquals(List.of(MatchKind.FUZZY, MatchKind.EXACT, MatchKind.FUZZY, MatchKind.FUZZY),
                    result.pairs().stream().map(MatchedPair::matchKind).toList());
            assertEquals(1, result.countOf(MatchKind.EXACT));
            assertEquals(3, result.countOf(MatchKind.FUZZY));
        }

        @Test
        @DisplayName("Should report excluded records with reasons")
        void testExclusions() {
            List<ExcludedRecord> excluded = result.excluded();
            assertEquals(2, excluded.size());
            assertEquals("a-4", excluded.get(0).record().getRecordId());
            assertEquals(ExclusionReason.MISSING_NAME, excluded.get(0).reason());
            assertEquals("b-4", excluded.get(1).record().getRecordId());
            assertEquals(ExclusionReason.MISSING_NAME_AND_ADDRESS, excluded.get(1).reason());
            assertEquals(1L, result.exclusionCounts().get(ExclusionReason.MISSING_NAME));
        }

        @Test
        @DisplayName("Should report valid records left without a counterpart")
        void testUnmatched() {
            assertEquals(List.of("a-5", "a-7"), ids(result.unmatchedA()));
            assertEquals(List.of("b-5", "b-7"), ids(result.unmatchedB()));
        }

        @Test
        @DisplayName("Each record should appear in at most one pair")
        void testOneToOne() {
            Set<PlaceRecord> seen = new HashSet<>();
            for (MatchedPair pair : result.pairs()) {
                assertTrue(seen.add(pair.recordA()), "duplicate " + pair.recordA());
                assertTrue(seen.add(pair.recordB()), "duplicate " + pair.recordB());
            }
            for (PlaceRecord record : result.unmatchedA()) {
                assertFalse(seen.contains(record));
            }
        }

        @Test
        @DisplayName("Exact pairs should have equal normalized name and address")
        void testExactSoundness() {
            for (MatchedPair pair : result.pairsOfKind(MatchKind.EXACT)) {
                assertEquals(pair.recordA().normalized(AttributeKind.NAME), pair.recordB().normalized(AttributeKind.NAME));
                assertEquals(pair.recordA().normalized(AttributeKind.ADDRESS),
                        pair.recordB().normalized(AttributeKind.ADDRESS));
            }
        }

        @Test
        @DisplayName("Fuzzy pairs should clear the threshold on name and address")
        void testFuzzyThreshold() {
            for (MatchedPair pair : result.pairsOfKind(MatchKind.FUZZY)) {
                assertTrue(pair.nameSimilarity() >= 85.0);
                assertTrue(pair.addressSimilarity() >= 85.0);
            }
            MatchedPair tonys = result.pairs().get(0);
            assertEquals(89.655, tonys.nameSimilarity(), 0.001);
            assertEquals(100.0, tonys.addressSimilarity());
        }

        @Test
        @DisplayName("A duplicated listing should fall through to fuzzy and go to the lowest record id")
        void testAmbiguousExactGroup() {
            MatchedPair harbor = result.pairs().get(3);
            assertEquals(MatchKind.FUZZY, harbor.matchKind());
            assertEquals("a-6", harbor.recordA().getRecordId());
            assertEquals(200.0, harbor.combinedSimilarity());
        }
    }

    @Test
    @DisplayName("Output should not depend on input order")
    void testDeterministicUnderReordering() {
        RecordLinkageMatcher matcher = new RecordLinkageMatcher(options().build());
        LinkageResult expected = matcher.match(corpus, ProgressCallback.NOOP);

        Random random = new Random(42);
        for (int i = 0; i < 10; i++) {
            List<PlaceRecord> shuffled = new ArrayList<>(corpus);
            Collections.shuffle(shuffled, random);
            LinkageResult actual = matcher.match(shuffled, ProgressCallback.NOOP);

            assertEquals(expected.pairs(), actual.pairs());
            assertEquals(expected.excluded(), actual.excluded());
            assertEquals(expected.unmatchedA(), actual.unmatchedA());
            assertEquals(expected.unmatchedB(), actual.unmatchedB());
        }
    }

    @Test
    @DisplayName("Key blocking should agree with the unblocked scan when every record has a postcode")
    void testBlockedEqualsUnblocked() {
        LinkageResult blocked = new RecordLinkageMatcher(options().blockingStrategy(new PlaceBlockingKeyStrategy()).build())
                .match(corpus, ProgressCallback.NOOP);
        LinkageResult unblocked = new RecordLinkageMatcher(options().blockingStrategy(BlockingKeyStrategy.NONE).build())
                .match(corpus, ProgressCallback.NOOP);

        assertEquals(blocked.pairs(), unblocked.pairs());
        assertEquals(blocked.unmatchedA(), unblocked.unmatchedA());
        assertEquals(blocked.unmatchedB(), unblocked.unmatchedB());
    }

    @Nested
    @DisplayName("Records without a postcode")
    class WithoutPostcode {

        private List<PlaceRecord> records;

        @BeforeEach
        void normalize() {
            records = List.of(
                    engine.normalizeRecord(PlaceFixtures.a("a-1", "Tony's Pizzeria", "12 Main St, Springfield")),
                    engine.normalizeRecord(PlaceFixtures.b("b-1", "Tonys Pizzeria Inc", "12 Main St, Springfield")));
        }

        @Test
        @DisplayName("Default options should link names whose first tokens differ")
        void testDefaultFindsPair() {
            LinkageResult result = new RecordLinkageMatcher(options().build()).match(records, ProgressCallback.NOOP);

            assertEquals(List.of("a-1|b-1"), placeKeys(result));
            assertEquals(MatchKind.FUZZY, result.pairs().get(0).matchKind());
            assertTrue(result.unmatchedA().isEmpty());
        }

        @Test
        @DisplayName("Key blocking may miss a pair that shares no key")
        void testKeyBlockingIsLossy() {
            LinkageResult result = new RecordLinkageMatcher(options().blockingStrategy(new PlaceBlockingKeyStrategy()).build())
                    .match(records, ProgressCallback.NOOP);

            assertTrue(result.pairs().isEmpty());
            assertEquals(List.of("a-1"), ids(result.unmatchedA()));
        }
    }

    @ParameterizedTest
    @DisplayName("Results should not depend on parallelism")
    @ValueSource(ints = {1, 2, 8})
    void testParallelism(int parallelism) {
        LinkageResult sequential = new RecordLinkageMatcher(options().parallelism(1).build())
                .match(corpus, ProgressCallback.NOOP);
        LinkageResult parallel = new RecordLinkageMatcher(options().parallelism(parallelism).build())
                .match(corpus, ProgressCallback.NOOP);

        assertEquals(sequential.pairs(), parallel.pairs());
    }

    @Test
    @DisplayName("Lowering the threshold should admit weaker name matches")
    void testThreshold() {
        LinkageResult result = new RecordLinkageMatcher(options().fuzzyThreshold(70.0).build())
                .match(corpus, ProgressCallback.NOOP);

        assertTrue(placeKeys(result).contains("a-5|b-5"));
        assertFalse(ids(result.unmatchedA()).contains("a-5"));
    }

    @Test
    @DisplayName("Records sharing an id within a provider should be excluded")
    void testDuplicateRecordIds() {
        List<PlaceRecord> records = List.of(
                engine.normalizeRecord(PlaceFixtures.a("a-1", "Corner Deli", "1 First Ave, Boston, MA 02108")),
                engine.normalizeRecord(PlaceFixtures.a("a-1", "Corner Deli Two", "2 First Ave, Boston, MA 02108")),
                engine.normalizeRecord(PlaceFixtures.b("a-1", "Corner Deli", "1 First Ave, Boston, MA 02108")));

        LinkageResult result = new RecordLinkageMatcher(options().build()).match(records, ProgressCallback.NOOP);

        assertTrue(result.pairs().isEmpty());
        assertEquals(2, result.excluded().size());
        assertTrue(result.excluded().stream().allMatch(e -> e.reason() == ExclusionReason.DUPLICATE_RECORD_ID));
        assertEquals(List.of("a-1"), ids(result.unmatchedB()));
    }

    @Test
    @DisplayName("Should handle empty input")
    void testEmptyInput() {
        LinkageResult result = new RecordLinkageMatcher(options().build()).match(List.of(), List.of());

        assertTrue(result.pairs().isEmpty());
        assertTrue(result.excluded().isEmpty());
    }

    @Test
    @DisplayName("Should record metrics for pairs and exclusions")
    void testMetrics() {
        MetricsService metrics = mock(MetricsService.class);

        new RecordLinkageMatcher(options().build(), metrics).match(corpus, ProgressCallback.NOOP);

        verify(metrics).incrementMatchedPairs(MatchKind.EXACT, 1);
        verify(metrics).incrementMatchedPairs(MatchKind.FUZZY, 3);
        verify(metrics).incrementExcludedRecord(ExclusionReason.MISSING_NAME);
        verify(metrics).incrementExcludedRecord(ExclusionReason.MISSING_NAME_AND_ADDRESS);
        verify(metrics, times(3)).recordFuzzySimilarity(anyDouble(), anyDouble());
        verify(metrics).recordStageDuration(eq("match.exact"), any());
        verify(metrics).recordStageDuration(eq("match.fuzzy"), any());
    }
}
