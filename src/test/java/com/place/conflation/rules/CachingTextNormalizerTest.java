package com.place.conflation.rules;

import com.place.conflation.PlaceFixtures;
import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CachingTextNormalizerTest {

    @Mock
    private TextNormalizer delegate;

    @Mock
    private MetricsService metrics;

    private CachingTextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new CachingTextNormalizer(delegate, 100, metrics);
    }

    @Test
    @DisplayName("Should call the delegate once per distinct value and kind")
    void testMemoizes() {
        when(delegate.normalize("Tony's Pizzeria", AttributeKind.NAME)).thenReturn("tony s pizzeria");

        assertEquals("tony s pizzeria", normalizer.normalize("Tony's Pizzeria", AttributeKind.NAME));
        assertEquals("tony s pizzeria", normalizer.normalize("Tony's Pizzeria", AttributeKind.NAME));

        verify(delegate, times(1)).normalize("Tony's Pizzeria", AttributeKind.NAME);
        verify(metrics, times(1)).recordNormalizationCacheMiss();
        verify(metrics, times(1)).recordNormalizationCacheHit();
        assertEquals(1, normalizer.hitCount());
    }

    @Test
    @DisplayName("Should key the cache by attribute kind")
    void testKeyedByKind() {
        when(delegate.normalize("12", AttributeKind.NAME)).thenReturn("12");
        when(delegate.normalize("12", AttributeKind.PHONE)).thenReturn("12");

        normalizer.normalize("12", AttributeKind.NAME);
        normalizer.normalize("12", AttributeKind.PHONE);

        verify(delegate).normalize("12", AttributeKind.NAME);
        verify(delegate).normalize("12", AttributeKind.PHONE);
        verify(metrics, times(2)).recordNormalizationCacheMiss();
    }

    @Test
    @DisplayName("Should pass brand and suffix checks through")
    void testDelegatesFlags() {
        when(delegate.isCanonicalBrand("Joe's Pizza")).thenReturn(true);
        when(delegate.hasBusinessSuffix("Joe's Pizza LLC")).thenReturn(true);

        assertTrue(normalizer.isCanonicalBrand("Joe's Pizza"));
        assertTrue(normalizer.hasBusinessSuffix("Joe's Pizza LLC"));
    }

    @Test
    @DisplayName("Should give the same results as the undecorated engine")
    void testSameResultsAsEngine() {
        NormalizationEngine engine = PlaceFixtures.engine();
        CachingTextNormalizer cached = new CachingTextNormalizer(engine, 10);
        String[] names = {"Tonys Pizzeria Inc", "Wal-Mart", "Café Olé", "Tonys Pizzeria Inc"};
        for (String name : names) {
            assertEquals(engine.normalize(name, AttributeKind.NAME), cached.normalize(name, AttributeKind.NAME));
        }
        assertEquals(1, cached.hitCount());
        assertEquals(3, cached.missCount());
    }

    @Test
    @DisplayName("Should reject a non-positive size")
    void testInvalidSize() {
        assertThrows(IllegalArgumentException.class, () -> new CachingTextNormalizer(delegate, 0));
    }
}
