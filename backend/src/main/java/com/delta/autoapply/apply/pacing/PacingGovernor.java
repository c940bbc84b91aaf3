package com.delta.autoapply.apply.pacing;

import com.delta.autoapply.apply.flow.ApplicationCancelledException;
import com.delta.autoapply.apply.flow.CancellationSignal;
import com.delta.autoapply.config.AutoApplyProperties;

import java.util.Random;
import java.util.function.Consumer;

/**
 * Randomized delays between browser interactions. Every sleep is taken in short slices so a
 * cancelled flow wakes up promptly.
 */
public class PacingGovernor {
    private static final long SLICE_MS = 200;
    private static final int MIN_SETTLE_MS = 100;
    private static final int MAX_SETTLE_MS = 300;

    private final AutoApplyProperties.Pacing settings;
    private final Sleeper sleeper;
    private final Random random;

    public PacingGovernor(AutoApplyProperties.Pacing settings, Sleeper sleeper, Random random) {
        this.settings = settings;
        this.sleeper = sleeper;
        this.random = random;
    }

    public long nextActionDelayMs() {
        return nextDelayMs(settings.getMinActionDelayMs(), settings.getMaxActionDelayMs());
    }

    /**
     * Draws from [minMs, maxMs] and occasionally adds a hesitation on top.
     */
    public long nextDelayMs(int minMs, int maxMs) {
        long delay = uniform(minMs, maxMs);
        if (random.nextDouble() < settings.getHesitationProbability()) {
            delay += uniform(settings.getMinHesitationMs(), settings.getMaxHesitationMs());
        }
        return delay;
    }

    public long nextKeystrokeDelayMs() {
        return uniform(settings.getMinKeystrokeDelayMs(), settings.getMaxKeystrokeDelayMs());
    }

    public void pause(CancellationSignal cancel) {
        sleep(nextActionDelayMs(), cancel);
    }

    public void pause(int minMs, int maxMs, CancellationSignal cancel) {
        sleep(nextDelayMs(minMs, maxMs), cancel);
    }

    /**
     * Emits the text one character at a time with a keystroke delay after each character.
     */
    public void type(String text, Consumer<String> keystroke, CancellationSignal cancel) {
        if (text == null || text.isEmpty()) {
            return;
        }
        sleep(uniform(MIN_SETTLE_MS, MAX_SETTLE_MS), cancel);
        int offset = 0;
        while (offset < text.length()) {
            int codePoint = text.codePointAt(offset);
            keystroke.accept(new String(Character.toChars(codePoint)));
            offset += Character.charCount(codePoint);
            sleep(nextKeystrokeDelayMs(), cancel);
        }
    }

    public void sleep(long millis, CancellationSignal cancel) {
        CancellationSignal signal = cancel == null ? CancellationSignal.none() : cancel;
        signal.throwIfCancelled();
        long remaining = Math.max(0, millis);
        try {
            while (remaining > 0) {
                long slice = Math.min(SLICE_MS, remaining);
                sleeper.sleep(slice);
                remaining -= slice;
                signal.throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApplicationCancelledException("Interrupted while pacing");
        }
    }

    private long uniform(int minMs, int maxMs) {
        int low = Math.min(minMs, maxMs);
        int high = Math.max(minMs, maxMs);
        if (high == low) {
            return low;
        }
        return low + (long) random.nextInt(high - low + 1);
    }
}
