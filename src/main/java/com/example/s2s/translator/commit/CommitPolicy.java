/*
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package com.example.s2s.translator.commit;

import com.example.s2s.translator.exception.ConfigurationException;

/**
 * Tunables of the adaptive commit scheduler.
 */
public final class CommitPolicy {

    public static final long DEFAULT_INITIAL_INTERVAL_MS = 2000;
    public static final long DEFAULT_MIN_INTERVAL_MS = 1000;
    public static final long DEFAULT_MAX_INTERVAL_MS = 5000;
    public static final long DEFAULT_ADJUSTMENT_MS = 500;
    public static final int DEFAULT_MAX_PENDING_RESPONSES = 2;
    public static final long DEFAULT_SILENCE_THRESHOLD_MS = 3000;
    public static final long DEFAULT_MIN_AUDIO_MS = 50;
    /** 50ms at 16kHz, 16-bit mono. */
    public static final int DEFAULT_MIN_AUDIO_BYTES = 1600;

    private static final double SLOW_FACTOR = 1.2;
    private static final double FAST_FACTOR = 0.8;

    private final long initialIntervalMs;
    private final long minIntervalMs;
    private final long maxIntervalMs;
    private final long adjustmentMs;
    private final int maxPendingResponses;
    private final long silenceThresholdMs;
    private final int minAudioBytes;

    public CommitPolicy(long initialIntervalMs, long minIntervalMs, long maxIntervalMs, long adjustmentMs,
                        int maxPendingResponses, long silenceThresholdMs, int minAudioBytes) {
        if (minIntervalMs <= 0 || minIntervalMs > maxIntervalMs) {
            throw new ConfigurationException("Commit interval bounds must satisfy 0 < min <= max");
        }
        if (initialIntervalMs < minIntervalMs || initialIntervalMs > maxIntervalMs) {
            throw new ConfigurationException("Initial commit interval must lie within [min, max]");
        }
        if (adjustmentMs <= 0 || maxPendingResponses <= 0 || silenceThresholdMs <= 0 || minAudioBytes <= 0) {
            throw new ConfigurationException("Commit policy values must be positive");
        }
        this.initialIntervalMs = initialIntervalMs;
        this.minIntervalMs = minIntervalMs;
        this.maxIntervalMs = maxIntervalMs;
        this.adjustmentMs = adjustmentMs;
        this.maxPendingResponses = maxPendingResponses;
        this.silenceThresholdMs = silenceThresholdMs;
        this.minAudioBytes = minAudioBytes;
    }

    public static CommitPolicy defaults() {
        return new CommitPolicy(DEFAULT_INITIAL_INTERVAL_MS, DEFAULT_MIN_INTERVAL_MS, DEFAULT_MAX_INTERVAL_MS,
            DEFAULT_ADJUSTMENT_MS, DEFAULT_MAX_PENDING_RESPONSES, DEFAULT_SILENCE_THRESHOLD_MS,
            DEFAULT_MIN_AUDIO_BYTES);
    }

    /**
     * Default policy with the minimum commit size set to 50ms of PCM16 audio in the capture format.
     */
    public static CommitPolicy forCaptureFormat(int sampleRate, int channels) {
        int frameSize = 2 * channels;
        int bytes = (int) ((long) sampleRate * frameSize * DEFAULT_MIN_AUDIO_MS / 1000);
        bytes -= bytes % frameSize;
        return defaults().withMinAudioBytes(Math.max(frameSize, bytes));
    }

    public CommitPolicy withMinAudioBytes(int minAudioBytes) {
        return new CommitPolicy(initialIntervalMs, minIntervalMs, maxIntervalMs, adjustmentMs,
            maxPendingResponses, silenceThresholdMs, minAudioBytes);
    }

    /**
     * The interval after a response that took {@code latencyMs}: one step slower when the latency
     * is above 120% of the interval, one step faster below 80%, otherwise unchanged.
     */
    long adjust(long intervalMs, long latencyMs) {
        if (latencyMs > intervalMs * SLOW_FACTOR) {
            return Math.min(intervalMs + adjustmentMs, maxIntervalMs);
        }
        if (latencyMs < intervalMs * FAST_FACTOR) {
            return Math.max(intervalMs - adjustmentMs, minIntervalMs);
        }
        return intervalMs;
    }

    public long getInitialIntervalMs() {
        return initialIntervalMs;
    }

    public long getMinIntervalMs() {
        return minIntervalMs;
    }

    public long getMaxIntervalMs() {
        return maxIntervalMs;
    }

    public long getAdjustmentMs() {
        return adjustmentMs;
    }

    public int getMaxPendingResponses() {
        return maxPendingResponses;
    }

    public long getSilenceThresholdMs() {
        return silenceThresholdMs;
    }

    public int getMinAudioBytes() {
        return minAudioBytes;
    }

    @Override
    public String toString() {
        return "CommitPolicy{interval=" + initialIntervalMs + "ms [" + minIntervalMs + ".." + maxIntervalMs
            + "], step=" + adjustmentMs + "ms, maxPending=" + maxPendingResponses
            + ", silence=" + silenceThresholdMs + "ms, minAudio=" + minAudioBytes + "B}";
    }
}
