package dev.mars.packsync.transfer;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.packsync.config.PackSyncConfiguration;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalDouble;

/**
 * Smooths cumulative byte samples into a transfer rate and derives an ETA from it.
 *
 * <p>Samples are {@code (elapsedSeconds, cumulativeBytes)} pairs recorded when an item settles.
 * The instantaneous rate is taken between the newest two samples in a small rolling window and
 * blended into the running value with an exponential moving average:
 * {@code smoothed = alpha * instant + (1 - alpha) * smoothed}. The first instantaneous rate seeds
 * the smoothed value directly.</p>
 *
 * <p>A sample that adds no bytes (a zero-byte item, a failed item) does not create a new point.
 * It moves the newest point's timestamp forward instead, so the time spent on it is not counted as
 * transfer time and the next rate is measured from there.</p>
 *
 * <p>Not thread-safe. A runner confines its estimator to its own context.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public class RateEstimator {

    private final int windowSize;
    private final double alpha;
    private final Deque<Sample> window;

    private double smoothedRate;
    private boolean rateKnown;

    public RateEstimator(int windowSize, double alpha) {
        if (windowSize < 2) {
            throw new IllegalArgumentException("Window size must be at least 2: " + windowSize);
        }
        if (alpha <= 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("Smoothing alpha must be in (0, 1]: " + alpha);
        }
        this.windowSize = windowSize;
        this.alpha = alpha;
        this.window = new ArrayDeque<>(windowSize);
        reset();
    }

    public static RateEstimator fromConfiguration(PackSyncConfiguration configuration) {
        return new RateEstimator(configuration.getRateWindowSize(), configuration.getRateSmoothingAlpha());
    }

    /**
     * Forget all samples; the rate becomes unknown again and the baseline is {@code (0s, 0 bytes)}.
     */
    public void reset() {
        window.clear();
        window.addLast(new Sample(0.0, 0L));
        smoothedRate = 0.0;
        rateKnown = false;
    }

    public void record(double elapsedSeconds, long cumulativeBytes) {
        Sample newest = window.peekLast();
        if (cumulativeBytes < newest.bytes) {
            throw new IllegalArgumentException(String.format(
                    "Cumulative bytes went backwards: %d < %d", cumulativeBytes, newest.bytes));
        }
        double elapsed = Math.max(elapsedSeconds, newest.elapsedSeconds);

        if (cumulativeBytes == newest.bytes) {
            window.pollLast();
            window.addLast(new Sample(elapsed, cumulativeBytes));
            return;
        }

        window.addLast(new Sample(elapsed, cumulativeBytes));
        while (window.size() > windowSize) {
            window.pollFirst();
        }
        updateRate();
    }

    private void updateRate() {
        Sample newest = window.peekLast();
        Sample previous = secondNewest();

        double timeDiff = newest.elapsedSeconds - previous.elapsedSeconds;
        long bytesDiff = newest.bytes - previous.bytes;
        if (timeDiff <= 0.0) {
            // Same timestamp: widen to the whole window
            Sample oldest = window.peekFirst();
            timeDiff = newest.elapsedSeconds - oldest.elapsedSeconds;
            bytesDiff = newest.bytes - oldest.bytes;
        }
        if (timeDiff <= 0.0) {
            return;
        }

        double instantRate = bytesDiff / timeDiff;
        smoothedRate = rateKnown ? alpha * instantRate + (1.0 - alpha) * smoothedRate : instantRate;
        rateKnown = true;
    }

    private Sample secondNewest() {
        var iterator = window.descendingIterator();
        iterator.next();
        return iterator.next();
    }

    /**
     * Smoothed rate, or empty while no rate has been measured since the last reset.
     */
    public OptionalDouble getRate() {
        return rateKnown ? OptionalDouble.of(smoothedRate) : OptionalDouble.empty();
    }

    /**
     * Smoothed rate for display; {@code 0.0} while unknown.
     */
    public double getBytesPerSecond() {
        return rateKnown ? smoothedRate : 0.0;
    }

    /**
     * Seconds until {@code remainingBytes} are done at the smoothed rate. Empty when the rate is
     * unknown or not positive: an unknown ETA must never read as "0s remaining".
     */
    public OptionalDouble estimateEtaSeconds(long remainingBytes) {
        if (!rateKnown || smoothedRate <= 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.max(0L, remainingBytes) / smoothedRate);
    }

    public int getSampleCount() {
        return window.size();
    }

    public int getWindowSize() {
        return windowSize;
    }

    public double getAlpha() {
        return alpha;
    }

    private static final class Sample {
        private final double elapsedSeconds;
        private final long bytes;

        private Sample(double elapsedSeconds, long bytes) {
            this.elapsedSeconds = elapsedSeconds;
            this.bytes = bytes;
        }
    }

    @Override
    public String toString() {
        return String.format("RateEstimator{window=%d/%d, alpha=%.2f, rate=%s}",
                window.size(), windowSize, alpha,
                rateKnown ? String.format("%.1f B/s", smoothedRate) : "unknown");
    }
}
