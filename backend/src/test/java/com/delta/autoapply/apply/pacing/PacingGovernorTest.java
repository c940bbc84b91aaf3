package com.delta.autoapply.apply.pacing;

import com.delta.autoapply.apply.flow.ApplicationCancelledException;
import com.delta.autoapply.apply.flow.CancellationSignal;
import com.delta.autoapply.config.AutoApplyProperties;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PacingGovernorTest {

    @Test
    void actionDelaysStayInsideConfiguredBoundsAndVary() {
        AutoApplyProperties.Pacing settings = new AutoApplyProperties.Pacing();
        settings.setHesitationProbability(0.0);
        PacingGovernor pacing = new PacingGovernor(settings, millis -> { }, new Random(7));

        Set<Long> distinct = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            long delay = pacing.nextActionDelayMs();
            assertThat(delay).isBetween(1500L, 4000L);
            distinct.add(delay);
        }
        assertThat(distinct).hasSizeGreaterThan(20);
    }

    @Test
    void hesitationAddsOnTopOfTheBaseDelay() {
        AutoApplyProperties.Pacing settings = new AutoApplyProperties.Pacing();
        settings.setHesitationProbability(1.0);
        PacingGovernor pacing = new PacingGovernor(settings, millis -> { }, new Random(11));

        for (int i = 0; i < 100; i++) {
            assertThat(pacing.nextDelayMs(100, 200)).isBetween(600L, 1700L);
        }
    }

    @Test
    void keystrokeDelaysStayInsideBounds() {
        PacingGovernor pacing = new PacingGovernor(new AutoApplyProperties.Pacing(), millis -> { }, new Random(3));
        for (int i = 0; i < 100; i++) {
            assertThat(pacing.nextKeystrokeDelayMs()).isBetween(30L, 100L);
        }
    }

    @Test
    void typesOneCodePointAtATime() {
        List<Long> sleeps = new ArrayList<>();
        PacingGovernor pacing = new PacingGovernor(new AutoApplyProperties.Pacing(), sleeps::add, new Random(5));
        List<String> keys = new ArrayList<>();

        pacing.type("Hi 😀", keys::add, CancellationSignal.none());

        assertThat(keys).containsExactly("H", "i", " ", "😀");
        // settle delay may take two slices
        assertThat(sleeps).hasSizeBetween(5, 6);
    }

    @Test
    void longSleepsAreSlicedAndStopOnCancellation() {
        CancellationSignal cancel = CancellationSignal.create();
        List<Long> slices = new ArrayList<>();
        PacingGovernor pacing = new PacingGovernor(new AutoApplyProperties.Pacing(), millis -> {
            slices.add(millis);
            if (slices.size() == 2) {
                cancel.cancel();
            }
        }, new Random(1));

        assertThatThrownBy(() -> pacing.sleep(1000, cancel)).isInstanceOf(ApplicationCancelledException.class);
        assertThat(slices).containsExactly(200L, 200L);
    }

    @Test
    void interruptedSleepBecomesCancellation() {
        PacingGovernor pacing = new PacingGovernor(new AutoApplyProperties.Pacing(), millis -> {
            throw new InterruptedException("stop");
        }, new Random(1));

        assertThatThrownBy(() -> pacing.sleep(50, CancellationSignal.create()))
            .isInstanceOf(ApplicationCancelledException.class);
        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void noneSignalIgnoresCancel() {
        CancellationSignal none = CancellationSignal.none();
        none.cancel();
        assertThat(none.isCancelled()).isFalse();
    }
}
