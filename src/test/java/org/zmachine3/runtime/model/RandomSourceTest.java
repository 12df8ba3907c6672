package org.zmachine3.runtime.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.zmachine3.junit.extensions.logging.LogWatchExtension;
import org.zmachine3.runtime.spi.IRandomProvider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the random and predictable modes of {@link RandomSource}.
 */
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
public class RandomSourceTest {

    @Mock
    private IRandomProvider provider;

    private RandomSource random;

    @BeforeEach
    void setUp() {
        random = new RandomSource(provider);
    }

    /**
     * Verifies that a positive range maps the provider's 0-based value into [1, range].
     */
    @Test
    @Tag("unit")
    void testPositiveRangeUsesProvider() {
        when(provider.nextInt(6)).thenReturn(0, 5);

        assertThat(random.random(6)).isEqualTo(1);
        assertThat(random.random(6)).isEqualTo(6);
        assertThat(random.isPredictable()).isFalse();
    }

    /**
     * Verifies that a small negative range switches to the counting sequence.
     */
    @Test
    @Tag("unit")
    void testSmallSeedSelectsPredictableMode() {
        assertThat(random.random(-3)).isZero();
        assertThat(random.isPredictable()).isTrue();

        int[] values = new int[7];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.random(100);
        }
        assertThat(values).containsExactly(1, 2, 3, 1, 2, 3, 1);
        verify(provider, never()).nextInt(anyInt());
    }

    @Test
    @Tag("unit")
    void testPredictableValuesStayInRange() {
        random.seed(10);
        int[] values = new int[5];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.random(3);
        }
        assertThat(values).containsExactly(1, 2, 3, 1, 2);
    }

    @Test
    @Tag("unit")
    void testLargeSeedReseedsProvider() {
        assertThat(random.random(-2000)).isZero();
        assertThat(random.isPredictable()).isFalse();
        verify(provider).reseed(2000);
    }

    /**
     * Verifies that range 0 leaves predictable mode and reseeds from an unpredictable source.
     */
    @Test
    @Tag("unit")
    void testZeroReseedsUnpredictably() {
        random.seed(5);

        assertThat(random.random(0)).isZero();

        assertThat(random.isPredictable()).isFalse();
        verify(provider).reseedUnpredictably();
    }
}
