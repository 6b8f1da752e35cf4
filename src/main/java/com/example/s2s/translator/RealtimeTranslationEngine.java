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

package com.example.s2s.translator;

import com.example.s2s.translator.audio.AudioChunk;
import com.example.s2s.translator.audio.AudioSink;
import com.example.s2s.translator.audio.AudioSource;
import com.example.s2s.translator.audio.AudioSourceListener;
import com.example.s2s.translator.audio.JavaSoundAudioSink;
import com.example.s2s.translator.audio.JavaSoundAudioSource;
import com.example.s2s.translator.commit.AdaptiveCommitScheduler;
import com.example.s2s.translator.commit.CommitPolicy;
import com.example.s2s.translator.exception.CaptureException;
import com.example.s2s.translator.exception.ConfigurationException;
import com.example.s2s.translator.exception.ConnectionException;
import com.example.s2s.translator.exception.PlaybackException;
import com.example.s2s.translator.exception.RealtimeProtocolException;
import com.example.s2s.translator.exception.TranslatorException;
import com.example.s2s.translator.realtime.RealtimeConfig;
import com.example.s2s.translator.realtime.RealtimeSession;
import com.example.s2s.translator.realtime.SessionConfig;
import com.example.s2s.translator.realtime.SessionState;
import com.example.s2s.translator.realtime.SettingsProvider;
import com.example.s2s.translator.realtime.TranslationEvent;
import com.example.s2s.translator.realtime.transport.ReactorNettyWebSocketConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Entry point of the translation engine: wires capture, the realtime session, the adaptive commit
 * scheduler and playback into one start/stop lifecycle.
 *
 * Audio flow: capture → session (append) + scheduler (activity) → commit/response → session
 *             session → translated text/audio → listeners + playback
 *
 * One engine serves one session at a time. Stopping tears everything down best-effort: a failing
 * step is logged and the remaining steps still run.
 */
public class RealtimeTranslationEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RealtimeTranslationEngine.class);

    /** Creates the session for one start. */
    @FunctionalInterface
    public interface SessionFactory {
        RealtimeSession create(RealtimeConfig config);
    }

    /** Creates the capture device for one start. */
    @FunctionalInterface
    public interface AudioSourceFactory {
        AudioSource create(RealtimeConfig config);
    }

    private final SettingsProvider settings;
    private final SessionFactory sessionFactory;
    private final AudioSourceFactory sourceFactory;
    private final Supplier<AudioSink> sinkFactory;
    private final Clock clock;
    private final List<TranslationListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lifecycleLock = new Object();
    private volatile RealtimeConfig config;
    private volatile boolean active = false;
    private volatile RealtimeSession session;
    private volatile AdaptiveCommitScheduler scheduler;
    private AudioSource source;
    private volatile AudioSink sink;

    /**
     * Engine with Java Sound devices and the Reactor Netty WebSocket client.
     */
    public RealtimeTranslationEngine(SettingsProvider settings) {
        this(settings,
            config -> new RealtimeSession(config, new ReactorNettyWebSocketConnector()),
            config -> new JavaSoundAudioSource(config.getCaptureMode(), config.getCaptureDevice(),
                config.getSampleRate(), config.getChannels(), config.getBufferSizeBytes()),
            JavaSoundAudioSink::new,
            Clock.systemUTC());
    }

    public RealtimeTranslationEngine(SettingsProvider settings, SessionFactory sessionFactory,
                                     AudioSourceFactory sourceFactory, Supplier<AudioSink> sinkFactory,
                                     Clock clock) {
        this.settings = Objects.requireNonNull(settings);
        this.sessionFactory = Objects.requireNonNull(sessionFactory);
        this.sourceFactory = Objects.requireNonNull(sourceFactory);
        this.sinkFactory = Objects.requireNonNull(sinkFactory);
        this.clock = Objects.requireNonNull(clock);
        this.config = settings.load();
        LOG.info("Translation engine created: {}", config);
    }

    public void addListener(TranslationListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(TranslationListener listener) {
        listeners.remove(listener);
    }

    /**
     * True when the settings name an endpoint, a key, a deployment and a target language.
     */
    public boolean isConfigured() {
        return config.isValid();
    }

    /**
     * Starts translating with the settings' default languages.
     */
    public void start() {
        start(config.getSourceLanguage(), config.getTargetLanguage());
    }

    /**
     * Connects, starts playback and the commit scheduler, then starts capture.
     *
     * @param sourceLanguage spoken language, or null to auto-detect
     * @param targetLanguage language to translate into; null uses the settings' default
     * @throws ConfigurationException if the settings are incomplete
     * @throws ConnectionException    if the realtime API cannot be reached
     * @throws CaptureException       if the capture device cannot be opened
     * @throws PlaybackException      if the output device cannot be opened
     */
    public void start(String sourceLanguage, String targetLanguage) {
        synchronized (lifecycleLock) {
            if (active) {
                LOG.warn("Translation is already active");
                return;
            }

            RealtimeConfig current = config;
            List<String> problems = current.validate();
            if (!problems.isEmpty()) {
                throw new ConfigurationException("Realtime translation is not configured: "
                    + String.join(", ", problems));
            }

            String target = targetLanguage != null && !targetLanguage.isBlank()
                ? targetLanguage : current.getTargetLanguage();
            SessionConfig sessionConfig = SessionConfig.from(current, sourceLanguage, target);
            LOG.info("Starting realtime translation: {}", sessionConfig);

            RealtimeSession newSession = sessionFactory.create(current);
            newSession.addListener(this::onSessionEvent);
            AdaptiveCommitScheduler newScheduler = new AdaptiveCommitScheduler(newSession,
                CommitPolicy.forCaptureFormat(current.getSampleRate(), current.getChannels()), clock);

            session = newSession;
            scheduler = newScheduler;
            try {
                newSession.connect(sessionConfig);

                AudioSink newSink = sinkFactory.get();
                newSink.setErrorHandler(this::onPlaybackError);
                sink = newSink;
                newSink.start();

                // Scheduler first: starting it resets the activity counters capture feeds
                newScheduler.start();

                AudioSource newSource = sourceFactory.create(current);
                newSource.setListener(new CaptureListener(newSession, newScheduler));
                source = newSource;
                newSource.start();
                active = true;
            } catch (TranslatorException e) {
                LOG.error("❌ Failed to start realtime translation: {}", e.getMessage());
                teardown();
                fireError(e);
                throw e;
            }

            if (newSession.getState() == SessionState.FAILED) {
                // Connection dropped while the devices were starting
                ConnectionException lost = connectionLost(newSession);
                teardown();
                fireError(lost);
                throw lost;
            }
            LOG.info("✓ Realtime translation started ({} → {})",
                sessionConfig.getSourceLanguage() != null ? sessionConfig.getSourceLanguage() : "auto",
                sessionConfig.getTargetLanguage());
        }
    }

    /**
     * Stops the scheduler and the receive loop, then capture, playback and the connection, in
     * that order. Each step runs even if an earlier one fails. Idempotent.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (session == null) {
                return;
            }
            LOG.info("Stopping realtime translation");
            teardown();
            LOG.info("✓ Realtime translation stopped");
        }
    }

    private void teardown() {
        active = false;

        AdaptiveCommitScheduler currentScheduler = scheduler;
        AudioSource currentSource = source;
        AudioSink currentSink = sink;
        RealtimeSession currentSession = session;
        scheduler = null;
        source = null;
        sink = null;
        session = null;

        if (currentScheduler != null) {
            try {
                currentScheduler.stop();
            } catch (RuntimeException e) {
                LOG.error("Error stopping commit scheduler", e);
            }
        }
        if (currentSession != null) {
            try {
                currentSession.stopReceiving();
            } catch (RuntimeException e) {
                LOG.error("Error stopping realtime receive loop", e);
            }
        }
        if (currentSource != null) {
            try {
                currentSource.stop();
            } catch (RuntimeException e) {
                LOG.error("Error stopping audio capture", e);
            }
        }
        if (currentSink != null) {
            try {
                currentSink.stop();
            } catch (RuntimeException e) {
                LOG.error("Error stopping audio playback", e);
            }
        }
        if (currentSession != null) {
            try {
                currentSession.disconnect();
            } catch (RuntimeException e) {
                LOG.error("Error disconnecting realtime session", e);
            }
        }
    }

    /**
     * Reloads settings. An active session keeps its settings; the next start uses the new ones.
     */
    public void reinitialize() {
        synchronized (lifecycleLock) {
            config = settings.load();
            if (active) {
                LOG.info("Settings reloaded; they apply from the next session");
            } else {
                LOG.info("Settings reloaded: {} (configured: {})", config, config.isValid());
            }
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isActive() {
        RealtimeSession current = session;
        return active && current != null && current.isActive();
    }

    public SessionState getState() {
        RealtimeSession current = session;
        return current != null ? current.getState() : SessionState.IDLE;
    }

    public RealtimeConfig getConfig() {
        return config;
    }

    /**
     * Current adaptive commit interval, or -1 when not running.
     */
    public long getCommitIntervalMs() {
        AdaptiveCommitScheduler current = scheduler;
        return current != null ? current.getState().getCurrentCommitIntervalMs() : -1;
    }

    // Session receive thread

    private void onSessionEvent(TranslationEvent event) {
        switch (event.getType()) {
            case TEXT_DELTA: {
                String text = ((TranslationEvent.TextDelta) event).getText();
                for (TranslationListener listener : listeners) {
                    try {
                        listener.onTranslatedText(text);
                    } catch (RuntimeException e) {
                        LOG.error("Translated text listener failed", e);
                    }
                }
                break;
            }
            case AUDIO_DELTA: {
                AudioChunk chunk = new AudioChunk(((TranslationEvent.AudioDelta) event).getAudio(), clock.millis());
                AudioSink currentSink = sink;
                if (currentSink != null) {
                    currentSink.enqueue(chunk);
                }
                for (TranslationListener listener : listeners) {
                    try {
                        listener.onTranslatedAudio(chunk);
                    } catch (RuntimeException e) {
                        LOG.error("Translated audio listener failed", e);
                    }
                }
                break;
            }
            case RESPONSE_COMPLETED: {
                AdaptiveCommitScheduler current = scheduler;
                if (current != null) {
                    current.onResponseCompleted();
                }
                break;
            }
            case PROTOCOL_ERROR: {
                TranslationEvent.ProtocolError error = (TranslationEvent.ProtocolError) event;
                AdaptiveCommitScheduler current = scheduler;
                if (current != null) {
                    current.onResponseFailed();
                }
                fireError(new RealtimeProtocolException(error.getCode(), error.getMessage()));
                break;
            }
            case SESSION_LIFECYCLE:
                if (SessionState.FAILED.name().equals(((TranslationEvent.SessionLifecycle) event).getStateName())) {
                    onConnectionLost();
                }
                break;
            default:
                break;
        }
    }

    private void onConnectionLost() {
        RealtimeSession failed = session;
        if (!active || failed == null) {
            // start() reports failures that happen while it runs
            return;
        }
        ConnectionException lost = connectionLost(failed);
        LOG.error("❌ Realtime connection lost, stopping translation");
        // Off the receive thread: teardown waits for that thread to exit
        Thread t = new Thread(() -> {
            stop();
            fireError(lost);
        }, "engine-teardown");
        t.setDaemon(true);
        t.start();
    }

    private static ConnectionException connectionLost(RealtimeSession failed) {
        Throwable cause = failed.getFailureCause();
        if (cause instanceof ConnectionException) {
            return (ConnectionException) cause;
        }
        return new ConnectionException("Realtime connection lost", cause);
    }

    private void onPlaybackError(PlaybackException error) {
        LOG.error("❌ Audio playback error: {}", error.getMessage());
        fireError(error);
    }

    private void fireError(TranslatorException error) {
        for (TranslationListener listener : listeners) {
            try {
                listener.onError(error);
            } catch (RuntimeException e) {
                LOG.error("Error listener failed", e);
            }
        }
    }

    /**
     * Forwards captured audio to the session, then records it for the scheduler so a commit never
     * precedes the append it covers.
     */
    private final class CaptureListener implements AudioSourceListener {

        private final RealtimeSession target;
        private final AdaptiveCommitScheduler activity;

        CaptureListener(RealtimeSession target, AdaptiveCommitScheduler activity) {
            this.target = target;
            this.activity = activity;
        }

        @Override
        public void onAudio(AudioChunk chunk) {
            target.sendAudio(chunk);
            activity.onAudioCaptured(chunk.size());
        }

        @Override
        public void onCaptureError(CaptureException error) {
            LOG.error("❌ Audio capture error: {}", error.getMessage());
            fireError(error);
        }
    }
}
