package com.domain.correlation.api;

import com.domain.correlation.rules.NoiseFilter;
import com.domain.correlation.rules.PlatformDenylist;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CorrelationOptions Tests")
class CorrelationOptionsTest {

    @Nested
    @DisplayName("Presets")
    class Presets {

        @Test
        void defaults() {
            CorrelationOptions options = CorrelationOptions.defaults();

            assertEquals(50, options.getGroupSizeCap());
            assertEquals(2, options.getMinClusterSize());
            assertEquals(20, options.getHubTopN());
            assertEquals(0.90, options.getHubPercentile());
            assertEquals(10, options.getMaxLoggedWarnings());
            assertFalse(options.getNoiseFilter().getRules().isEmpty());
            assertTrue(options.getDenylist().isEmpty());
        }

        @Test
        void strict() {
            CorrelationOptions options = CorrelationOptions.strict();

            assertEquals(20, options.getGroupSizeCap());
            assertEquals(3, options.getMinClusterSize());
        }

        @Test
        void permissive() {
            CorrelationOptions options = CorrelationOptions.permissive();

            assertEquals(200, options.getGroupSizeCap());
            assertSame(NoiseFilter.none(), options.getNoiseFilter());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void groupSizeCapBelowTwo() {
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder().groupSizeCap(1));
        }

        @Test
        void minClusterSizeBelowOne() {
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder().minClusterSize(0));
        }

        @Test
        void hubTopNBelowOne() {
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder().hubTopN(0));
        }

        @Test
        void percentileOutOfRange() {
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder().hubPercentile(-0.1));
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder().hubPercentile(1.01));
        }

        @Test
        void negativeWarnings() {
            assertThrows(IllegalArgumentException.class, () -> CorrelationOptions.builder().maxLoggedWarnings(-1));
        }

        @Test
        void nullCollaborators() {
            assertThrows(NullPointerException.class, () -> CorrelationOptions.builder().noiseFilter(null));
            assertThrows(NullPointerException.class, () -> CorrelationOptions.builder().denylist(null));
            assertThrows(NullPointerException.class, () -> CorrelationOptions.builder().tierTable(null));
        }
    }

    @Test
    @DisplayName("toBuilder copies every setting")
    void toBuilderCopies() {
        CorrelationOptions original = CorrelationOptions.builder()
                .groupSizeCap(30)
                .hubTopN(5)
                .denylist(PlatformDenylist.of("UA-00000-1"))
                .build();

        CorrelationOptions copy = original.toBuilder().minClusterSize(4).build();

        assertEquals(30, copy.getGroupSizeCap());
        assertEquals(5, copy.getHubTopN());
        assertEquals(4, copy.getMinClusterSize());
        assertEquals(1, copy.getDenylist().size());
        assertEquals(2, original.getMinClusterSize());
    }

    @Test
    void toStringListsSettings() {
        assertTrue(CorrelationOptions.defaults().toString().contains("groupSizeCap=50"));
    }
}
