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

import com.example.s2s.translator.exception.CaptureException;

/**
 * Continuous audio capture.
 *
 * Contract:
 * - {@link #start()} opens the device and begins delivering chunks to the listener
 * - a device that cannot be opened fails {@code start()} with {@link CaptureException}
 * - failures after start are delivered to {@link AudioSourceListener#onCaptureError}
 * - {@link #stop()} releases the device and is a no-op when already stopped
 */
public interface AudioSource {

    void setListener(AudioSourceListener listener);

    void start() throws CaptureException;

    void stop();

    boolean isCapturing();

    CaptureMode getMode();
}
