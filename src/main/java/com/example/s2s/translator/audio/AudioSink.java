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

import com.example.s2s.translator.exception.PlaybackException;

import java.util.function.Consumer;

/**
 * Plays audio chunks in arrival order.
 *
 * Contract:
 * - {@link #enqueue(AudioChunk)} never blocks and may be called from any thread
 * - chunks enqueued before {@link #start()} are dropped with a warning
 * - {@link #stop()} discards whatever is still queued and releases the device
 * - the queue is unbounded; producers are paced by the commit scheduler, not by the sink
 */
public interface AudioSink {

    void start() throws PlaybackException;

    void enqueue(AudioChunk chunk);

    void stop();

    boolean isPlaying();

    /**
     * Number of chunks waiting to be played.
     */
    int getQueueSize();

    /**
     * Receives device failures that happen after {@link #start()}.
     */
    void setErrorHandler(Consumer<PlaybackException> errorHandler);
}
