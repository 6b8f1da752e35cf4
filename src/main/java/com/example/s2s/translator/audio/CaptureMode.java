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

import java.util.Locale;

/**
 * Where captured audio comes from. Chosen when the source is built, never switched at runtime.
 */
public enum CaptureMode {

    /** Live input device (default or named microphone). */
    MICROPHONE,

    /**
     * Mixed playback of other applications, read through a loopback mixer such as
     * "Stereo Mix", "Monitor of ..." or "BlackHole". System sounds routed elsewhere are not captured.
     */
    APPLICATION_PLAYBACK;

    /**
     * Mixer name fragments that identify a loopback capture device.
     */
    static final String[] LOOPBACK_HINTS = {"stereo mix", "monitor of", "loopback", "blackhole", "what u hear", "wave out"};

    public static CaptureMode parse(String value) {
        if (value == null || value.isBlank()) {
            return MICROPHONE;
        }
        return CaptureMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
