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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Decides when buffered audio is committed for translation.
 *
 * A single loop thread sleeps for the current interval, runs one {@link #tick()}, and then reads
 * the interval again, so a tick never overlaps the next one and interval changes apply to the
 * following sleep. Response completions stretch or shrink the interval according to how long the
 * service took; too many outstanding responses make ticks clear the server buffer instead of
 * committing.
 */
public class AdaptiveCommitScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(AdaptiveCommitScheduler.class);

    private static final long STOP_JOIN_TIMEOUT_MS = 2000;

    private final CommitTarget target;
    private final CommitState state;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private volatile boolean running = false;
    private Thread loopThread;

    public AdaptiveCommitScheduler(CommitTarget target, CommitPolicy policy) {
        this(target, policy, Clock.systemUTC());
    }

    public AdaptiveCommitScheduler(CommitTarget target, CommitPolicy policy, Clock clock) {
        this.target = Objects.requireNonNull(target);
        this.clock = Objects.requireNonNull(clock);
        this.state = new CommitState(Objects.requireNonNull(policy), clock.millis());
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                LOG.warn("Commit scheduler is already running");
                return;
            }
            state.reset(clock.millis());
            running = true;
            Thread t = new Thread(this::runLoop, "commit-scheduler");
            t.setDaemon(true);
            loopThread = t;
            t.start();
            LOG.info("Started adaptive commit scheduler: {}", state.getPolicy());
        }
    }

    private void runLoop() {
        while (running) {
            try {
                Thread.sleep(state.getCurrentCommitIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!running) {
                break;
            }
            try {
                tick();
            } catch (RuntimeException e) {
                // Keep the loop alive; the next tick retries with the current interval
                LOG.error("Error in commit scheduler tick", e);
            }
        }
        LOG.debug("Commit scheduler loop finished");
    }

    /**
     * Runs one scheduling decision now. The loop thread calls this once per interval.
     */
    public CommitDecision tick() {
        long now = clock.millis();
        CommitDecision decision = state.decide(now);
        switch (decision) {
            case OVERLOADED:
                LOG.warn("⚠ Skipping commit - {} responses pending (max: {}), clearing input buffer",
                    state.getPendingResponseCount(), state.getPolicy().getMaxPendingResponses());
                try {
                    target.clearInputBuffer();
                } catch (RuntimeException e) {
                    LOG.error("Failed to clear input buffer", e);
                }
                break;
            case COMMIT:
                try {
                    target.commit();
                    target.requestResponse();
                    LOG.debug("→ Committed audio (pending: {}, interval: {}ms)",
                        state.getPendingResponseCount(), state.getCurrentCommitIntervalMs());
                } catch (RuntimeException e) {
                    state.rollbackCommit();
                    LOG.error("Failed to commit audio", e);
                }
                break;
            case SILENT:
                LOG.debug("Skipping commit - no audio activity (last audio {}ms ago)",
                    now - state.getLastAudioReceivedAt());
                break;
            case DEFERRED:
                LOG.debug("Deferring commit - {} bytes buffered, waiting for more",
                    state.getAudioBytesSinceLastCommit());
                break;
            default:
                throw new IllegalStateException("Unknown decision " + decision);
        }
        return decision;
    }

    /**
     * Records captured audio. Called from the capture thread for every chunk.
     */
    public void onAudioCaptured(int bytes) {
        state.recordAudio(bytes, clock.millis());
    }

    /**
     * A response finished; adapts the interval to its latency.
     */
    public void onResponseCompleted() {
        long before = state.getCurrentCommitIntervalMs();
        long latency = state.resolveResponse(clock.millis());
        long after = state.getCurrentCommitIntervalMs();
        if (after != before) {
            LOG.info("Translation completed in {}ms, commit interval {}ms → {}ms (pending: {})",
                latency, before, after, state.getPendingResponseCount());
        } else {
            LOG.info("Translation completed in {}ms (pending: {}, interval: {}ms)",
                latency, state.getPendingResponseCount(), after);
        }
    }

    /**
     * A request failed on the server; frees its pending slot.
     */
    public void onResponseFailed() {
        state.resolveError();
        LOG.debug("Response failed (pending: {})", state.getPendingResponseCount());
    }

    /**
     * Stops the loop and waits for an in-flight tick to finish. Idempotent.
     */
    public void stop() {
        Thread thread;
        synchronized (lifecycleLock) {
            if (!running && loopThread == null) {
                return;
            }
            running = false;
            thread = loopThread;
            loopThread = null;
        }
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
            try {
                thread.join(STOP_JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for commit scheduler to stop");
            }
        }
        LOG.info("Stopped adaptive commit scheduler");
    }

    public boolean isRunning() {
        return running;
    }

    public CommitState getState() {
        return state;
    }
}
