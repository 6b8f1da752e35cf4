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

import java.util.Arrays;

/**
 * Immutable block of raw PCM16 little-endian audio.
 * The bytes are copied on the way in and on the way out, so a chunk never changes after creation.
 */
public final class AudioChunk {

    private final byte[] data;
    private final long capturedAtMillis;

    public AudioChunk(byte[] data, long capturedAtMillis) {
        this(data, 0, data.length, capturedAtMillis);
    }

    public AudioChunk(byte[] source, int offset, int length, long capturedAtMillis) {
        if (source == null) {
            throw new IllegalArgumentException("audio data cannot be null");
        }
        this.data = Arrays.copyOfRange(source, offset, offset + length);
        this.capturedAtMillis = capturedAtMillis;
    }

    /**
     * Returns a copy of the audio bytes.
     */
    public byte[] toByteArray() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    public long getCapturedAtMillis() {
        return capturedAtMillis;
    }

    @Override
    public String toString() {
        return "AudioChunk{" + data.length + " bytes}";
    }
}
