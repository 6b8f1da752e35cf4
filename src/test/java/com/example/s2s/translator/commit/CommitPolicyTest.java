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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommitPolicyTest {

    @Test
    void defaultsMatchDocumentedValues() {
        CommitPolicy policy = CommitPolicy.defaults();

        assertThat(policy.getInitialIntervalMs()).isEqualTo(2000);
        assertThat(policy.getMinIntervalMs()).isEqualTo(1000);
        assertThat(policy.getMaxIntervalMs()).isEqualTo(5000);
        assertThat(policy.getAdjustmentMs()).isEqualTo(500);
        assertThat(policy.getMaxPendingResponses()).isEqualTo(2);
        assertThat(policy.getSilenceThresholdMs()).isEqualTo(3000);
        assertThat(policy.getMinAudioBytes()).isEqualTo(1600);
    }

    @Test
    void minimumAudioIsFiftyMillisecondsOfCaptureFormat() {
        assertThat(CommitPolicy.forCaptureFormat(16000, 1).getMinAudioBytes()).isEqualTo(1600);
        assertThat(CommitPolicy.forCaptureFormat(48000, 2).getMinAudioBytes()).isEqualTo(9600);
        assertThat(CommitPolicy.forCaptureFormat(24000, 1).getMinAudioBytes()).isEqualTo(2400);
    }

    @Test
    void adjustUsesHysteresisBand() {
        CommitPolicy policy = CommitPolicy.defaults();

        assertThat(policy.adjust(2000, 2450)).isEqualTo(2500);
        assertThat(policy.adjust(2000, 2350)).isEqualTo(2000);
        assertThat(policy.adjust(2000, 1650)).isEqualTo(2000);
        assertThat(policy.adjust(2000, 1550)).isEqualTo(1500);
        assertThat(policy.adjust(4800, 10_000)).isEqualTo(5000);
        assertThat(policy.adjust(1200, 0)).isEqualTo(1000);
    }

    @Test
    void rejectsInitialIntervalOutsideBounds() {
        assertThatThrownBy(() -> new CommitPolicy(6000, 1000, 5000, 500, 2, 3000, 1600))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Initial commit interval");
    }

    @Test
    void rejectsInvertedBounds() {
        assertThatThrownBy(() -> new CommitPolicy(2000, 5000, 1000, 500, 2, 3000, 1600))
            .isInstanceOf(ConfigurationException.class);
    }
}
