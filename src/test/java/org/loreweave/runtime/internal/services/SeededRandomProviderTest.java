package org.loreweave.runtime.internal.services;

import org.loreweave.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Contains unit tests for the {@link SeededRandomProvider}: reproducibility, derived streams and
 * state snapshots.
 */
@Tag("unit")
class SeededRandomProviderTest {

    /**
     * Two providers with the same seed produce the same sequence.
     */
    @Test
    void sameSeed_sameSequence() {
        assertThat(draw(new SeededRandomProvider(99L), 20)).isEqualTo(draw(new SeededRandomProvider(99L), 20));
        assertThat(draw(new SeededRandomProvider(99L), 20)).isNotEqualTo(draw(new SeededRandomProvider(100L), 20));
    }

    /**
     * Derived streams depend only on the seed, scope and key, not on how far the parent has advanced.
     */
    @Test
    void deriveFor_isIndependentOfParentState() {
        SeededRandomProvider parent = new SeededRandomProvider(5L);
        List<Double> before = draw(parent.deriveFor("system", 3), 10);
        draw(parent, 50);

        assertThat(draw(parent.deriveFor("system", 3), 10)).isEqualTo(before);
        assertThat(draw(parent.deriveFor("system", 4), 10)).isNotEqualTo(before);
        assertThat(draw(parent.deriveFor("template", 3), 10)).isNotEqualTo(before);
    }

    /**
     * A restored state replays the sequence from the snapshot point.
     */
    @Test
    void saveAndLoadState_replaysSequence() {
        SeededRandomProvider random = new SeededRandomProvider(11L);
        draw(random, 7);
        byte[] state = random.saveState();
        List<Double> expected = draw(random, 15);

        random.loadState(state);

        assertThat(draw(random, 15)).isEqualTo(expected);
        assertThatThrownBy(() -> random.loadState(new byte[8])).isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * The {@link java.util.Random} view draws from the provider's own stream, so snapshots cover shuffles too.
     */
    @Test
    void asJavaRandom_sharesTheStream() {
        SeededRandomProvider viaView = new SeededRandomProvider(21L);
        SeededRandomProvider direct = new SeededRandomProvider(21L);

        int fromView = viaView.asJavaRandom().nextInt(1000);

        assertThat(fromView).isEqualTo(direct.nextInt(1000));
        assertThat(draw(viaView, 5)).isEqualTo(draw(direct, 5));
        assertThat(SeededRandomProvider.childSeed(21L, "system", 0))
                .isEqualTo(SeededRandomProvider.childSeed(21L, "system", 0))
                .isNotEqualTo(SeededRandomProvider.childSeed(21L, null, 0));
    }

    /**
     * Era modifiers scale probabilities in odds space and keep the bounds.
     */
    @Test
    void scaleProbability_oddsPower() {
        assertThat(Probabilities.scaleProbability(0.3, 1.0)).isCloseTo(0.3, within(1e-12));
        assertThat(Probabilities.scaleProbability(0.5, 3.0)).isCloseTo(0.5, within(1e-12));
        assertThat(Probabilities.scaleProbability(0.0, 2.0)).isZero();
        assertThat(Probabilities.scaleProbability(1.0, 0.5)).isEqualTo(1.0);
        assertThat(Probabilities.scaleProbability(0.4, 0.0)).isZero();
        assertThat(Probabilities.scaleProbability(0.8, 2.0)).isGreaterThan(0.8);
    }

    private static List<Double> draw(IRandomProvider random, int count) {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            values.add(random.nextDouble());
        }
        return values;
    }
}
