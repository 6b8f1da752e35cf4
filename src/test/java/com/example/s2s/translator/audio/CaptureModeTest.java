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

package com.example.s2s.translator.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaptureModeTest {

    @Test
    void blankMeansMicrophone() {
        assertThat(CaptureMode.parse(null)).isEqualTo(CaptureMode.MICROPHONE);
        assertThat(CaptureMode.parse("  ")).isEqualTo(CaptureMode.MICROPHONE);
    }

    @Test
    void parsesIgnoringCase() {
        assertThat(CaptureMode.parse(" application_playback ")).isEqualTo(CaptureMode.APPLICATION_PLAYBACK);
        assertThat(CaptureMode.parse("Microphone")).isEqualTo(CaptureMode.MICROPHONE);
    }

    @Test
    void rejectsUnknownModes() {
        assertThatThrownBy(() -> CaptureMode.parse("speakers"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void loopbackHintsCoverCommonDevices() {
        assertThat(CaptureMode.LOOPBACK_HINTS).contains("stereo mix", "blackhole", "monitor of");
    }
}
