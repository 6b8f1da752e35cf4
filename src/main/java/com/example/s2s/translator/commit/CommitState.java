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

/**
 * Audio activity and response bookkeeping shared by the capture thread, the scheduler thread and
 * the receive thread.
 *
 * Every operation is atomic under this object's monitor and never does I/O while holding it.
 * The pending count never drops below zero and the interval always stays inside the policy bounds.
 */
public class CommitState {

    private final CommitPolicy policy;

    private boolean hasNewAudioSinceLastCommit;
    private long audioBytesSinceLastCommit;
    private long lastAudioReceivedAt;
    private int pendingResponseCount;
    private long currentCommitIntervalMs;
    private boolean committed;
    private long lastCommitAt;
    private long lastResponseAt;

    public CommitState(CommitPolicy policy, long nowMillis) {
        this.policy = policy;
        reset(nowMillis);
    }

    /**
     * Back to the initial interval with no audio and nothing pending.
     */
    public synchronized void reset(long nowMillis) {
        hasNewAudioSinceLastCommit = false;
        audioBytesSinceLastCommit = 0;
        lastAudioReceivedAt = nowMillis;
        pendingResponseCount = 0;
        currentCommitIntervalMs = policy.getInitialIntervalMs();
        committed = false;
        lastCommitAt = nowMillis;
        lastResponseAt = nowMillis;
    }

    /**
     * Called for every captured chunk.
     */
    public synchronized void recordAudio(int bytes, long nowMillis) {
        if (bytes <= 0) {
            return;
        }
        hasNewAudioSinceLastCommit = true;
        audioBytesSinceLastCommit += bytes;
        lastAudioReceivedAt = nowMillis;
    }

    /**
     * Decides what this tick does and applies the state change that goes with it.
     *
     * OVERLOADED resets the activity counters. COMMIT also counts one more pending response and
     * records the commit time. SILENT and DEFERRED change nothing.
     */
    public synchronized CommitDecision decide(long nowMillis) {
        if (pendingResponseCount >= policy.getMaxPendingResponses()) {
            clearActivity();
            return CommitDecision.OVERLOADED;
        }
        if (hasNewAudioSinceLastCommit && audioBytesSinceLastCommit >= policy.getMinAudioBytes()) {
            clearActivity();
            pendingResponseCount++;
            committed = true;
            lastCommitAt = nowMillis;
            return CommitDecision.COMMIT;
        }
        if (!hasNewAudioSinceLastCommit || nowMillis - lastAudioReceivedAt > policy.getSilenceThresholdMs()) {
            return CommitDecision.SILENT;
        }
        return CommitDecision.DEFERRED;
    }

    /**
     * Undoes the pending count of a COMMIT whose messages could not be sent.
     */
    public synchronized void rollbackCommit() {
        decrementPending();
    }

    /**
     * A response completed. Adjusts the interval by the latency since the last commit.
     *
     * @return the latency in milliseconds, or -1 if nothing was ever committed
     */
    public synchronized long resolveResponse(long nowMillis) {
        decrementPending();
        lastResponseAt = nowMillis;
        if (!committed) {
            return -1;
        }
        long latency = lastResponseAt - lastCommitAt;
        currentCommitIntervalMs = policy.adjust(currentCommitIntervalMs, latency);
        return latency;
    }

    /**
     * A request failed. Frees its pending slot without touching the interval.
     */
    public synchronized void resolveError() {
        decrementPending();
    }

    private void decrementPending() {
        pendingResponseCount = Math.max(0, pendingResponseCount - 1);
    }

    private void clearActivity() {
        hasNewAudioSinceLastCommit = false;
        audioBytesSinceLastCommit = 0;
    }

    public synchronized boolean hasNewAudioSinceLastCommit() {
        return hasNewAudioSinceLastCommit;
    }

    public synchronized long getAudioBytesSinceLastCommit() {
        return audioBytesSinceLastCommit;
    }

    public synchronized long getLastAudioReceivedAt() {
        return lastAudioReceivedAt;
    }

    public synchronized int getPendingResponseCount() {
        return pendingResponseCount;
    }

    public synchronized long getCurrentCommitIntervalMs() {
        return currentCommitIntervalMs;
    }

    public synchronized long getLastCommitAt() {
        return lastCommitAt;
    }

    public synchronized long getLastResponseAt() {
        return lastResponseAt;
    }

    public CommitPolicy getPolicy() {
        return policy;
    }

    @Override
    public synchronized String toString() {
        return "CommitState{pending=" + pendingResponseCount
            + ", interval=" + currentCommitIntervalMs + "ms"
            + ", newAudio=" + hasNewAudioSinceLastCommit
            + ", bytes=" + audioBytesSinceLastCommit + "}";
    }
}
