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
import com.example.s2s.translator.audio.AudioSink;
import com.example.s2s.translator.exception.PlaybackException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Test double for AudioSink that keeps every enqueued chunk.
 */
public class RecordingAudioSink implements AudioSink {

    public final List<AudioChunk> played = new CopyOnWriteArrayList<>();
    public volatile PlaybackException failStartWith;
    public volatile boolean playing;
    public volatile int stopCount;
    public volatile RuntimeException failStopWith;
    public volatile Runnable onStop;
    private volatile Consumer<PlaybackException> errorHandler;

    @Override
    public void start() throws PlaybackException {
        if (failStartWith != null) {
            throw failStartWith;
        }
        playing = true;
    }

    @Override
    public void enqueue(AudioChunk chunk) {
        if (playing) {
            played.add(chunk);
        }
    }

    @Override
    public void stop() {
        stopCount++;
        playing = false;
        if (onStop != null) {
            onStop.run();
        }
        if (failStopWith != null) {
            throw failStopWith;
        }
    }

    @Override
    public boolean isPlaying() {
        return playing;
    }

    @Override
    public int getQueueSize() {
        return 0;
    }

    @Override
    public void setErrorHandler(Consumer<PlaybackException> errorHandler) {
        this.errorHandler = errorHandler;
    }

    public void fail(PlaybackException error) {
        errorHandler.accept(error);
    }
}
