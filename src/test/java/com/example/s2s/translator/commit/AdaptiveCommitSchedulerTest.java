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

import com.example.s2s.translator.exception.ConnectionException;
import com.example.s2s.translator.testutil.MutableClock;
import com.example.s2s.translator.testutil.RecordingCommitTarget;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AdaptiveCommitSchedulerTest {

    // 60ms of 16kHz 16-bit mono
    private static final int SIXTY_MS = 1920;

    private MutableClock clock;
    private RecordingCommitTarget target;
    private AdaptiveCommitScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(0);
        target = new RecordingCommitTarget();
        scheduler = new AdaptiveCommitScheduler(target, CommitPolicy.forCaptureFormat(16000, 1), clock);
    }

    @Test
    void activityAboveMinimumCommitsAndRequestsResponse() {
        scheduler.onAudioCaptured(SIXTY_MS);
        clock.advance(100);

        CommitDecision decision = scheduler.tick();

        assertThat(decision).isEqualTo(CommitDecision.COMMIT);
        assertThat(target.calls).containsExactly("commit", "requestResponse");
        assertThat(scheduler.getState().getPendingResponseCount()).isEqualTo(1);
        assertThat(scheduler.getState().hasNewAudioSinceLastCommit()).isFalse();
        assertThat(scheduler.getState().getAudioBytesSinceLastCommit()).isZero();
        assertThat(scheduler.getState().getLastCommitAt()).isEqualTo(100);
    }

    @Test
    void silenceMakesNoNetworkCalls() {
        clock.advance(4000);

        CommitDecision decision = scheduler.tick();

        assertThat(decision).isEqualTo(CommitDecision.SILENT);
        assertThat(target.calls).isEmpty();
        assertThat(scheduler.getState().getPendingResponseCount()).isZero();
    }

    @Test
    void staleSmallAudioCountsAsSilence() {
        scheduler.onAudioCaptured(800);
        clock.advance(3001);

        assertThat(scheduler.tick()).isEqualTo(CommitDecision.SILENT);
        assertThat(target.calls).isEmpty();
    }

    @Test
    void recentSmallAudioIsDeferredUntilEnoughArrives() {
        scheduler.onAudioCaptured(800);
        clock.advance(100);

        assertThat(scheduler.tick()).isEqualTo(CommitDecision.DEFERRED);
        assertThat(target.calls).isEmpty();

        scheduler.onAudioCaptured(800);
        assertThat(scheduler.tick()).isEqualTo(CommitDecision.COMMIT);
        assertThat(target.count("commit")).isEqualTo(1);
    }

    @Test
    void overloadClearsBufferInsteadOfCommitting() {
        commitOnce();
        commitOnce();
        assertThat(scheduler.getState().getPendingResponseCount()).isEqualTo(2);
        target.clear();

        scheduler.onAudioCaptured(SIXTY_MS);
        CommitDecision decision = scheduler.tick();

        assertThat(decision).isEqualTo(CommitDecision.OVERLOADED);
        assertThat(target.calls).containsExactly("clearInputBuffer");
        assertThat(scheduler.getState().hasNewAudioSinceLastCommit()).isFalse();
        assertThat(scheduler.getState().getAudioBytesSinceLastCommit()).isZero();
        assertThat(scheduler.getState().getPendingResponseCount()).isEqualTo(2);
    }

    @Test
    void overloadPersistsUntilAResponseResolves() {
        commitOnce();
        commitOnce();
        target.clear();

        for (int i = 0; i < 3; i++) {
            scheduler.onAudioCaptured(SIXTY_MS);
            assertThat(scheduler.tick()).isEqualTo(CommitDecision.OVERLOADED);
        }
        assertThat(target.count("commit")).isZero();
        assertThat(target.count("clearInputBuffer")).isEqualTo(3);

        scheduler.onResponseFailed();
        scheduler.onAudioCaptured(SIXTY_MS);
        assertThat(scheduler.tick()).isEqualTo(CommitDecision.COMMIT);
    }

    @Test
    void slowResponseBacksOffByOneStep() {
        commitOnce();
        assertThat(scheduler.getState().getCurrentCommitIntervalMs()).isEqualTo(2000);

        clock.advance(2900);
        scheduler.onResponseCompleted();

        assertThat(scheduler.getState().getCurrentCommitIntervalMs()).isEqualTo(2500);
        assertThat(scheduler.getState().getPendingResponseCount()).isZero();
    }

    @Test
    void fastResponseTightensByOneStep() {
        commitOnce();

        clock.advance(1200);
        scheduler.onResponseCompleted();

        assertThat(scheduler.getState().getCurrentCommitIntervalMs()).isEqualTo(1500);
    }

    @Test
    void latencyInsideHysteresisBandKeepsInterval() {
        commitOnce();

        clock.advance(2000);
        scheduler.onResponseCompleted();

        assertThat(scheduler.getState().getCurrentCommitIntervalMs()).isEqualTo(2000);
    }

    @Test
    void intervalNeverLeavesBounds() {
        for (int i = 0; i < 10; i++) {
            commitOnce();
            clock.advance(60_000);
            scheduler.onResponseCompleted();
        }
        assertThat(scheduler.getState().getCurrentCommitIntervalMs()).isEqualTo(CommitPolicy.DEFAULT_MAX_INTERVAL_MS);

        for (int i = 0; i < 10; i++) {
            commitOnce();
            clock.advance(10);
            scheduler.onResponseCompleted();
        }
        assertThat(scheduler.getState().getCurrentCommitIntervalMs()).isEqualTo(CommitPolicy.DEFAULT_MIN_INTERVAL_MS);
    }

    @Test
    void errorsFreePendingSlotWithoutAdjustingInterval() {
        commitOnce();
        clock.advance(4000);

        scheduler.onResponseFailed();

        assertThat(scheduler.getState().getPendingResponseCount()).isZero();
        assertThat(scheduler.getState().getCurrentCommitIntervalMs()).isEqualTo(2000);
    }

    @Test
    void pendingCountNeverDropsBelowZero() {
        scheduler.onResponseFailed();
        scheduler.onResponseCompleted();

        assertThat(scheduler.getState().getPendingResponseCount()).isZero();
    }

    @Test
    void failedCommitIsRolledBack() {
        target.failCommitWith = new ConnectionException("Realtime session is not active");
        scheduler.onAudioCaptured(SIXTY_MS);

        scheduler.tick();

        assertThat(scheduler.getState().getPendingResponseCount()).isZero();
        assertThat(target.calls).isEmpty();
    }

    @Test
    void invariantsHoldUnderRandomActivity() {
        Random random = new Random(42);
        CommitState state = scheduler.getState();
        for (int i = 0; i < 2000; i++) {
            switch (random.nextInt(5)) {
                case 0:
                    scheduler.onAudioCaptured(random.nextInt(4000));
                    break;
                case 1:
                    scheduler.tick();
                    break;
                case 2:
                    scheduler.onResponseCompleted();
                    break;
                case 3:
                    scheduler.onResponseFailed();
                    break;
                default:
                    clock.advance(random.nextInt(5000));
                    break;
            }
            assertThat(state.getPendingResponseCount()).isBetween(0, CommitPolicy.DEFAULT_MAX_PENDING_RESPONSES);
            assertThat(state.getCurrentCommitIntervalMs())
                .isBetween(CommitPolicy.DEFAULT_MIN_INTERVAL_MS, CommitPolicy.DEFAULT_MAX_INTERVAL_MS);
        }
    }

    @Test
    void loopCommitsOnItsOwnAndStopsCleanly() {
        RecordingCommitTarget loopTarget = new RecordingCommitTarget();
        CommitPolicy fast = new CommitPolicy(50, 50, 500, 50, 2, 3000, 1600);
        AdaptiveCommitScheduler loop = new AdaptiveCommitScheduler(loopTarget, fast, Clock.systemUTC());

        loop.start();
        try {
            loop.onAudioCaptured(SIXTY_MS);
            Awaitility.await().atMost(2, TimeUnit.SECONDS).until(() -> loopTarget.count("commit") == 1);
        } finally {
            loop.stop();
        }

        assertThat(loop.isRunning()).isFalse();
        List<String> afterStop = List.copyOf(loopTarget.calls);
        loop.onAudioCaptured(SIXTY_MS);
        assertThat(loopTarget.calls).isEqualTo(afterStop);
    }

    private void commitOnce() {
        scheduler.onAudioCaptured(SIXTY_MS);
        assertThat(scheduler.tick()).isEqualTo(CommitDecision.COMMIT);
    }
}
