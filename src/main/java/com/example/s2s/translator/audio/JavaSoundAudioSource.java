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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;

/**
 * Java Sound capture producing fixed-size PCM16 little-endian chunks.
 *
 * Audio flow: input line (microphone or loopback mixer) → capture thread → listener
 *
 * The capture mode is fixed at construction. In {@link CaptureMode#APPLICATION_PLAYBACK} mode the
 * source reads from a loopback mixer; when none is present {@link #start()} fails synchronously.
 */
public class JavaSoundAudioSource implements AudioSource {

    private static final Logger LOG = LoggerFactory.getLogger(JavaSoundAudioSource.class);

    private static final long STOP_JOIN_TIMEOUT_MS = 2000;

    /** Opens the capture line (replaced in tests). */
    public interface LineProvider {
        TargetDataLine open(AudioFormat format, int bufferBytes) throws LineUnavailableException;
    }

    private final CaptureMode mode;
    private final AudioFormat format;
    private final int chunkBytes;
    private final LineProvider provider;
    private final Clock clock;

    private final Object lock = new Object();
    private volatile AudioSourceListener listener;
    private volatile boolean capturing = false;
    private TargetDataLine line;
    private Thread captureThread;

    /**
     * Creates a source for the given mode.
     *
     * @param mode       microphone or application playback
     * @param deviceName mixer name to prefer, or null for the default device
     * @param sampleRate capture sample rate in Hz
     * @param channels   channel count
     * @param chunkBytes size of each delivered chunk (3200 bytes = 100ms at 16kHz mono)
     */
    public JavaSoundAudioSource(CaptureMode mode, String deviceName, int sampleRate, int channels, int chunkBytes) {
        this(mode, sampleRate, channels, chunkBytes, defaultProvider(mode, deviceName), Clock.systemUTC());
    }

    JavaSoundAudioSource(CaptureMode mode, int sampleRate, int channels, int chunkBytes,
                         LineProvider provider, Clock clock) {
        if (chunkBytes <= 0 || chunkBytes % (2 * channels) != 0) {
            throw new IllegalArgumentException("chunkBytes must be a positive multiple of the frame size");
        }
        this.mode = Objects.requireNonNull(mode);
        this.format = pcm16(sampleRate, channels);
        this.chunkBytes = chunkBytes;
        this.provider = Objects.requireNonNull(provider);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * PCM16 signed little-endian format used on both sides of the engine.
     */
    public static AudioFormat pcm16(int sampleRate, int channels) {
        return new AudioFormat(AudioFormat.Encoding.PCM_SIGNED, sampleRate, 16, channels,
            channels * 2, sampleRate, false);
    }

    @Override
    public void setListener(AudioSourceListener listener) {
        this.listener = listener;
    }

    @Override
    public void start() throws CaptureException {
        synchronized (lock) {
            if (capturing) {
                LOG.warn("Audio capture is already active");
                return;
            }

            LOG.info("Starting audio capture ({}): {}Hz, {} channel(s), chunk {} bytes",
                mode, (int) format.getSampleRate(), format.getChannels(), chunkBytes);

            TargetDataLine opened;
            try {
                opened = provider.open(format, chunkBytes * 4);
            } catch (LineUnavailableException e) {
                throw new CaptureException("Audio capture device unavailable: " + e.getMessage(), e);
            } catch (SecurityException e) {
                throw new CaptureException("Audio capture permission denied: " + e.getMessage(), e);
            } catch (IllegalArgumentException e) {
                throw new CaptureException("Audio capture format not supported: " + format, e);
            }

            opened.start();
            line = opened;
            capturing = true;

            Thread t = new Thread(() -> captureLoop(opened), "audio-capture");
            t.setDaemon(true);
            captureThread = t;
            t.start();
            LOG.info("✓ Audio capture started");
        }
    }

    private void captureLoop(TargetDataLine source) {
        byte[] buffer = new byte[chunkBytes];
        long total = 0;
        try {
            while (capturing) {
                int read = source.read(buffer, 0, buffer.length);
                if (read <= 0) {
                    continue;
                }
                total += read;
                deliver(new AudioChunk(buffer, 0, read, clock.millis()));
            }
        } catch (RuntimeException e) {
            if (capturing) {
                LOG.error("Error in audio capture loop", e);
                capturing = false;
                AudioSourceListener l = listener;
                if (l != null) {
                    l.onCaptureError(new CaptureException("Audio capture failed: " + e.getMessage(), e));
                }
            }
        } finally {
            closeLine(source);
            LOG.info("Audio capture loop finished: {} bytes captured", total);
        }
    }

    private void deliver(AudioChunk chunk) {
        AudioSourceListener l = listener;
        if (l == null) {
            return;
        }
        try {
            l.onAudio(chunk);
        } catch (RuntimeException e) {
            // A failing consumer must not kill the device thread
            LOG.error("Audio listener failed for {}", chunk, e);
        }
    }

    @Override
    public void stop() {
        Thread thread;
        synchronized (lock) {
            if (!capturing && captureThread == null) {
                return;
            }
            LOG.info("Stopping audio capture");
            capturing = false;
            thread = captureThread;
            captureThread = null;
            if (line != null) {
                // Unblocks a pending read()
                try {
                    line.stop();
                } catch (RuntimeException e) {
                    LOG.debug("Error stopping capture line: {}", e.toString());
                }
            }
            line = null;
        }
        // Join outside the lock so the capture thread can finish its last delivery
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(STOP_JOIN_TIMEOUT_MS);
                if (thread.isAlive()) {
                    LOG.warn("Capture thread did not terminate within {}ms", STOP_JOIN_TIMEOUT_MS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for capture thread to terminate");
            }
        }
        LOG.info("✓ Audio capture stopped");
    }

    @Override
    public boolean isCapturing() {
        return capturing;
    }

    @Override
    public CaptureMode getMode() {
        return mode;
    }

    private static void closeLine(TargetDataLine source) {
        try {
            source.stop();
        } catch (RuntimeException e) {
            LOG.debug("Error stopping capture line: {}", e.toString());
        }
        try {
            source.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing capture line: {}", e.toString());
        }
    }

    static LineProvider defaultProvider(CaptureMode mode, String deviceName) {
        return (format, bufferBytes) -> {
            DataLine.Info info = new DataLine.Info(TargetDataLine.class, format);
            Mixer mixer = findMixer(mode, deviceName, info);
            TargetDataLine line;
            if (mixer != null) {
                LOG.info("Using capture mixer: {}", mixer.getMixerInfo().getName());
                line = (TargetDataLine) mixer.getLine(info);
            } else if (mode == CaptureMode.APPLICATION_PLAYBACK) {
                throw new CaptureException("No loopback capture device available for application playback"
                    + (deviceName != null ? " (requested: " + deviceName + ")" : ""));
            } else {
                line = (TargetDataLine) AudioSystem.getLine(info);
            }
            line.open(format, bufferBytes);
            return line;
        };
    }

    private static Mixer findMixer(CaptureMode mode, String deviceName, DataLine.Info info) {
        for (Mixer.Info mixerInfo : AudioSystem.getMixerInfo()) {
            Mixer mixer = AudioSystem.getMixer(mixerInfo);
            if (!mixer.isLineSupported(info)) {
                continue;
            }
            String name = mixerInfo.getName().toLowerCase(Locale.ROOT);
            if (deviceName != null && !deviceName.isBlank()) {
                if (name.contains(deviceName.toLowerCase(Locale.ROOT))) {
                    return mixer;
                }
            } else if (mode == CaptureMode.APPLICATION_PLAYBACK) {
                for (String hint : CaptureMode.LOOPBACK_HINTS) {
                    if (name.contains(hint)) {
                        return mixer;
                    }
                }
            }
        }
        return null;
    }
}
