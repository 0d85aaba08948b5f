package io.hustle.sim.test;

import io.hustle.sim.api.GameTime;
import io.hustle.sim.core.ManualGameClock;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class GameTimeTest {

    @Test
    void unitsConvert() {
        GameTime t = GameTime.ofDays(1.5);
        assertThat(t.hours()).isEqualTo(36.0);
        assertThat(t.minutes()).isEqualTo(2160.0);
        assertThat(GameTime.ofHours(36)).isEqualTo(t);
    }

    @Test
    void differencesAreSigned() {
        GameTime a = GameTime.ofHours(6);
        GameTime b = GameTime.ofDays(2);
        assertThat(b.daysSince(a)).isCloseTo(1.75, within(1e-9));
        assertThat(a.hoursSince(b)).isCloseTo(-42.0, within(1e-9));
        assertThat(a.isBefore(b)).isTrue();
        assertThat(b.isAtOrAfter(b)).isTrue();
        assertThat(a.compareTo(b)).isNegative();
    }

    @Test
    void nonFiniteInstantsAreRejected() {
        assertThatThrownBy(() -> GameTime.ofMinutes(Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GameTime.ofHours(Double.POSITIVE_INFINITY))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formatsAsDayAndClock() {
        assertThat(GameTime.EPOCH.toString()).isEqualTo("day 0 00:00");
        assertThat(GameTime.ofDays(3).plusHours(2).plusMinutes(30).toString())
            .isEqualTo("day 3 02:30");
    }

    @Test
    void manualClockOnlyMovesForward() {
        ManualGameClock clock = new ManualGameClock();
        clock.advance(-10);
        clock.advance(Double.NaN);
        clock.advance(Double.POSITIVE_INFINITY);
        assertThat(clock.now()).isEqualTo(GameTime.EPOCH);

        clock.advanceHours(2);
        clock.advanceDays(1);
        assertThat(clock.now()).isEqualTo(GameTime.ofHours(26));
    }

    @Test
    void manualClockCanBeRestored() {
        ManualGameClock clock = new ManualGameClock(GameTime.ofDays(10));
        clock.set(GameTime.ofDays(4));
        assertThat(clock.now().days()).isEqualTo(4.0);
        assertThatThrownBy(() -> clock.set(null)).isInstanceOf(NullPointerException.class);
    }
}
