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

package com.example.s2s.translator.testutil;

import com.example.s2s.translator.audio.AudioChunk;
import com.example.s2s.translator.audio.AudioSource;
import com.example.s2s.translator.audio.AudioSourceListener;
import com.example.s2s.translator.audio.CaptureMode;
import com.example.s2s.translator.exception.CaptureException;

/**
 * Test double for AudioSource; the test pushes chunks with {@link #emit(AudioChunk)}.
 */
public class FakeAudioSource implements AudioSource {

    public volatile CaptureException failStartWith;
    public volatile boolean capturing;
    public volatile int stopCount;
    public volatile RuntimeException failStopWith;
    /** Delivered to the listener from inside {@link #start()}. */
    public volatile AudioChunk emitOnStart;
    public volatile Runnable onStop;
    private volatile AudioSourceListener listener;

    @Override
    public void setListener(AudioSourceListener listener) {
        this.listener = listener;
    }

    @Override
    public void start() throws CaptureException {
        if (failStartWith != null) {
            throw failStartWith;
        }
        capturing = true;
        if (emitOnStart != null) {
            emit(emitOnStart);
        }
    }

    @Override
    public void stop() {
        stopCount++;
        capturing = false;
        if (onStop != null) {
            onStop.run();
        }
        if (failStopWith != null) {
            throw failStopWith;
        }
    }

    @Override
    public boolean isCapturing() {
        return capturing;
    }

    @Override
    public CaptureMode getMode() {
        return CaptureMode.MICROPHONE;
    }

    public void emit(AudioChunk chunk) {
        listener.onAudio(chunk);
    }

    public void fail(CaptureException error) {
        listener.onCaptureError(error);
    }
}
