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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Java Sound playback of translated audio.
 *
 * Audio flow: enqueue() → unbounded queue → playback thread → output line
 *
 * The remote service produces PCM16 24kHz mono, which is what this sink plays by default.
 */
public class JavaSoundAudioSink implements AudioSink {

    private static final Logger LOG = LoggerFactory.getLogger(JavaSoundAudioSink.class);

    /** Sample rate of the realtime service's pcm16 output. */
    public static final int OUTPUT_SAMPLE_RATE = 24000;

    private static final long POLL_TIMEOUT_MS = 50;
    private static final long STOP_JOIN_TIMEOUT_MS = 2000;

    /** Opens the output line (replaced in tests). */
    public interface LineProvider {
        SourceDataLine open(AudioFormat format, int bufferBytes) throws LineUnavailableException;
    }

    private final AudioFormat format;
    private final LineProvider provider;
    private final BlockingQueue<AudioChunk> queue = new LinkedBlockingQueue<>();

    private final Object lock = new Object();
    private volatile boolean playing = false;
    private volatile Consumer<PlaybackException> errorHandler;
    private SourceDataLine line;
    private Thread playbackThread;

    public JavaSoundAudioSink() {
        this(OUTPUT_SAMPLE_RATE, 1, defaultProvider());
    }

    JavaSoundAudioSink(int sampleRate, int channels, LineProvider provider) {
        this.format = JavaSoundAudioSource.pcm16(sampleRate, channels);
        this.provider = Objects.requireNonNull(provider);
    }

    @Override
    public void setErrorHandler(Consumer<PlaybackException> errorHandler) {
        this.errorHandler = errorHandler;
    }

    @Override
    public void start() throws PlaybackException {
        synchronized (lock) {
            if (playing) {
                LOG.warn("Audio playback is already active");
                return;
            }

            // Double the 100ms minimum for smoother playback
            int bufferBytes = (int) (format.getSampleRate() * format.getFrameSize() / 10) * 2;
            LOG.info("Starting audio playback: {}Hz, buffer size: {} bytes", (int) format.getSampleRate(), bufferBytes);

            SourceDataLine opened;
            try {
                opened = provider.open(format, bufferBytes);
            } catch (LineUnavailableException | IllegalArgumentException e) {
                throw new PlaybackException("Audio output device unavailable: " + e.getMessage(), e);
            } catch (SecurityException e) {
                throw new PlaybackException("Audio output permission denied: " + e.getMessage(), e);
            }

            opened.start();
            line = opened;
            playing = true;

            Thread t = new Thread(() -> playbackLoop(opened), "audio-playback");
            t.setDaemon(true);
            playbackThread = t;
            t.start();
            LOG.info("✓ Audio playback started");
        }
    }

    @Override
    public void enqueue(AudioChunk chunk) {
        if (!playing) {
            LOG.warn("Cannot enqueue audio: playback not started");
            return;
        }
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        queue.offer(chunk);
        LOG.debug("← Queued audio chunk: {} bytes (queue size: {})", chunk.size(), queue.size());
    }

    private void playbackLoop(SourceDataLine target) {
        try {
            while (playing) {
                AudioChunk chunk = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (chunk == null) {
                    continue;
                }
                byte[] data = chunk.toByteArray();
                int written = 0;
                while (written < data.length && playing) {
                    written += target.write(data, written, data.length - written);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            if (playing) {
                LOG.error("Error in audio playback loop", e);
                playing = false;
                Consumer<PlaybackException> handler = errorHandler;
                if (handler != null) {
                    handler.accept(new PlaybackException("Audio playback failed: " + e.getMessage(), e));
                }
            }
        }
        LOG.info("Audio playback loop finished");
    }

    @Override
    public void stop() {
        Thread thread;
        SourceDataLine target;
        synchronized (lock) {
            if (!playing && playbackThread == null) {
                return;
            }
            LOG.info("Stopping audio playback");
            playing = false;
            thread = playbackThread;
            target = line;
            playbackThread = null;
            line = null;
        }

        if (target != null) {
            try {
                // Unblocks a pending write()
                target.stop();
                target.flush();
            } catch (RuntimeException e) {
                LOG.debug("Error stopping output line: {}", e.toString());
            }
        }
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(STOP_JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for playback thread to terminate");
            }
        }
        if (target != null) {
            try {
                target.close();
            } catch (RuntimeException e) {
                LOG.debug("Error closing output line: {}", e.toString());
            }
        }

        int discarded = queue.size();
        queue.clear();
        LOG.info("✓ Audio playback stopped ({} queued chunks discarded)", discarded);
    }

    @Override
    public boolean isPlaying() {
        return playing;
    }

    @Override
    public int getQueueSize() {
        return queue.size();
    }

    static LineProvider defaultProvider() {
        return (format, bufferBytes) -> {
            SourceDataLine line = (SourceDataLine) AudioSystem.getLine(new DataLine.Info(SourceDataLine.class, format));
            line.open(format, bufferBytes);
            return line;
        };
    }
}
