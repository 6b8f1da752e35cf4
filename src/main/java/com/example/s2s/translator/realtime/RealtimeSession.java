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

package com.example.s2s.translator.realtime;

import com.example.s2s.translator.audio.AudioChunk;
import com.example.s2s.translator.audio.PcmResampler;
import com.example.s2s.translator.commit.CommitTarget;
import com.example.s2s.translator.exception.ConnectionException;
import com.example.s2s.translator.exception.RealtimeProtocolException;
import com.example.s2s.translator.realtime.transport.Frame;
import com.example.s2s.translator.realtime.transport.WebSocketChannel;
import com.example.s2s.translator.realtime.transport.WebSocketConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One connection to the Azure OpenAI realtime API.
 *
 * Audio flow: sendAudio() → resample to 24kHz mono → outbound queue → WebSocket
 *             WebSocket → receive thread → reassemble → decode → listeners
 *
 * All writes go through a single sender thread and all events are dispatched on a single receive
 * thread, in the order they arrived. A connection lost while active is terminal: the session moves
 * to {@link SessionState#FAILED} and reports it to its listeners; it never reconnects.
 */
public class RealtimeSession implements CommitTarget, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RealtimeSession.class);

    /** The service's pcm16 format is 24kHz mono. */
    public static final int WIRE_SAMPLE_RATE = 24000;

    static final String USER_AGENT = "realtime-translator/1.0";
    private static final long RECEIVE_STOP_TIMEOUT_MS = 5000;

    private final RealtimeConfig config;
    private final WebSocketConnector connector;
    private final Clock clock;
    private final RealtimeMessageCodec codec = new RealtimeMessageCodec();
    private final MessageAssembler assembler = new MessageAssembler();
    private final List<TranslationEventListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lifecycleLock = new Object();
    private final Object stateLock = new Object();
    private volatile SessionState state = SessionState.IDLE;
    private volatile SessionConfig sessionConfig;
    private volatile Throwable failureCause;
    private volatile long lastCommitSentAt = -1;

    private WebSocketChannel channel;
    private OutboundMessageQueue outbound;
    private ExecutorService receiveExecutor;
    private volatile Thread receiveThread;
    private volatile boolean receiving;
    private Disposable receiveSubscription;

    public RealtimeSession(RealtimeConfig config, WebSocketConnector connector) {
        this(config, connector, Clock.systemUTC());
    }

    public RealtimeSession(RealtimeConfig config, WebSocketConnector connector, Clock clock) {
        this.config = Objects.requireNonNull(config);
        this.connector = Objects.requireNonNull(connector);
        this.clock = Objects.requireNonNull(clock);
    }

    public void addListener(TranslationEventListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(TranslationEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Opens the connection and sends the session configuration.
     *
     * Blocks until {@code session.update} has been written, or the configured connect timeout
     * (30s by default) expires.
     *
     * @throws ConnectionException on timeout, a rejected upgrade or any transport failure; the
     *                             session is then {@link SessionState#FAILED} and holds no resources
     */
    public void connect(SessionConfig sessionConfig) throws ConnectionException {
        synchronized (lifecycleLock) {
            if (state != SessionState.IDLE) {
                throw new IllegalStateException("Session can only connect once (state: " + state + ")");
            }
            this.sessionConfig = Objects.requireNonNull(sessionConfig);
            transition(SessionState.CONNECTING);

            URI uri = config.buildWebSocketUrl();
            LOG.info("Connecting to realtime API: {} ({})", uri.getHost(), sessionConfig);

            try {
                channel = openChannel(uri);
                transition(SessionState.CONFIGURING);
                startReceiving(channel);

                // Written before the outbound queue exists, so nothing can overtake it
                channel.send(codec.encodeSessionUpdate(sessionConfig));
                LOG.info("→ Sent session configuration (turn detection disabled, manual commits)");

                outbound = new OutboundMessageQueue(channel, "realtime-sender");
                if (!transition(SessionState.ACTIVE)) {
                    throw connectionLostDuringSetup();
                }
                LOG.info("✓ Realtime session active");
            } catch (RuntimeException e) {
                ConnectionException failure = e instanceof ConnectionException
                    ? (ConnectionException) e
                    : new ConnectionException("Failed to connect to realtime API: " + e.getMessage(), e);
                failureCause = failure;
                releaseResources();
                transition(SessionState.FAILED);
                LOG.error("❌ Failed to start realtime session: {}", failure.getMessage());
                throw failure;
            }
        }
    }

    private ConnectionException connectionLostDuringSetup() {
        Throwable cause = failureCause;
        if (cause instanceof ConnectionException) {
            return (ConnectionException) cause;
        }
        return new ConnectionException("Realtime connection lost while configuring session", cause);
    }

    private WebSocketChannel openChannel(URI uri) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("api-key", config.getCredential().getKey());
        headers.put("OpenAI-Beta", "realtime=v1");
        headers.put("User-Agent", USER_AGENT);

        try {
            WebSocketChannel opened = connector.connect(uri, headers)
                .timeout(config.getConnectTimeout())
                .block();
            if (opened == null) {
                throw new ConnectionException("WebSocket connection completed without a channel");
            }
            return opened;
        } catch (ConnectionException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new ConnectionException("Timed out after " + config.getConnectTimeout().getSeconds()
                    + "s connecting to realtime API", cause);
            }
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new ConnectionException("Interrupted while connecting to realtime API", cause);
            }
            if (cause instanceof ConnectionException) {
                throw (ConnectionException) cause;
            }
            throw new ConnectionException("Failed to connect to realtime API: " + cause.getMessage(), cause);
        }
    }

    private void startReceiving(WebSocketChannel source) {
        receiveExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread t = new Thread(runnable, "realtime-receive");
            t.setDaemon(true);
            receiveThread = t;
            return t;
        });
        Scheduler scheduler = Schedulers.fromExecutorService(receiveExecutor, "realtime-receive");
        receiving = true;
        receiveSubscription = source.receive()
            .publishOn(scheduler)
            .subscribe(this::onFrame, this::onReceiveError, this::onReceiveComplete);
    }

    // Receive thread

    private void onFrame(Frame frame) {
        if (!receiving) {
            return;
        }
        String message;
        try {
            message = assembler.accept(frame).orElse(null);
        } catch (RealtimeProtocolException e) {
            LOG.error("Dropping malformed frame sequence: {}", e.getMessage());
            return;
        }
        if (message != null) {
            onMessage(message);
        }
    }

    private void onMessage(String json) {
        TranslationEvent event;
        try {
            event = codec.decode(json).orElse(null);
        } catch (RealtimeProtocolException e) {
            LOG.error("Error handling realtime message: {}", e.getMessage());
            return;
        }
        if (event == null) {
            return;
        }

        switch (event.getType()) {
            case RESPONSE_COMPLETED: {
                long commitAt = lastCommitSentAt;
                event = TranslationEvent.responseCompleted(commitAt < 0 ? -1 : clock.millis() - commitAt);
                break;
            }
            case PROTOCOL_ERROR: {
                TranslationEvent.ProtocolError error = (TranslationEvent.ProtocolError) event;
                LOG.error("❌ Realtime API error [{}]: {}", error.getCode(), error.getMessage());
                break;
            }
            case SESSION_LIFECYCLE:
                LOG.info("✓ Realtime session acknowledged: {}",
                    ((TranslationEvent.SessionLifecycle) event).getStateName());
                break;
            case INPUT_TRANSCRIPT:
                LOG.info("Input transcription: {}", ((TranslationEvent.InputTranscript) event).getText());
                break;
            default:
                LOG.debug("← {}", event);
                break;
        }
        dispatch(event);
    }

    private void onReceiveError(Throwable error) {
        connectionLost(error);
    }

    private void onReceiveComplete() {
        connectionLost(null);
    }

    private void connectionLost(Throwable error) {
        SessionState previous;
        synchronized (stateLock) {
            previous = state;
            if (!receiving || previous == SessionState.STOPPING || previous.isTerminal()) {
                LOG.debug("Receive loop ended ({})", previous);
                return;
            }
            failureCause = error != null
                ? new ConnectionException("Realtime connection lost: " + error.getMessage(), error)
                : new ConnectionException("Realtime connection closed by server");
            state = SessionState.FAILED;
        }
        if (error != null) {
            LOG.error("❌ Realtime connection lost", error);
        } else {
            LOG.error("❌ Realtime connection closed by server");
        }
        LOG.debug("Session state {} → {}", previous, SessionState.FAILED);
        dispatch(TranslationEvent.lifecycle(SessionState.FAILED.name()));
    }

    private void dispatch(TranslationEvent event) {
        for (TranslationEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOG.error("Translation event listener failed for {}", event, e);
            }
        }
    }

    /**
     * Moves to {@code next} unless already there or in a terminal state.
     *
     * @return whether the state changed
     */
    private boolean transition(SessionState next) {
        SessionState previous;
        synchronized (stateLock) {
            previous = state;
            if (previous == next || previous.isTerminal()) {
                return false;
            }
            state = next;
        }
        LOG.debug("Session state {} → {}", previous, next);
        dispatch(TranslationEvent.lifecycle(next.name()));
        return true;
    }

    // Outbound

    /**
     * Queues one chunk of captured audio, converted to the service's 24kHz mono format.
     * Dropped when the session is not active.
     */
    public void sendAudio(AudioChunk chunk) {
        OutboundMessageQueue queue = activeQueue();
        if (queue == null) {
            LOG.debug("Session not active, skipping audio");
            return;
        }
        SessionConfig format = sessionConfig;
        byte[] pcm = PcmResampler.toMono(chunk.toByteArray(), format.getSampleRate(), format.getChannels(),
            WIRE_SAMPLE_RATE);
        if (!queue.offer(codec.encodeAudioAppend(pcm))) {
            LOG.debug("Outbound queue stopped, skipping audio");
        }
    }

    @Override
    public void commit() {
        enqueue(requireActive(), codec.encodeCommit());
        lastCommitSentAt = clock.millis();
    }

    @Override
    public void requestResponse() {
        enqueue(requireActive(), codec.encodeResponseCreate());
    }

    @Override
    public void clearInputBuffer() {
        enqueue(requireActive(), codec.encodeClear());
    }

    private static void enqueue(OutboundMessageQueue queue, String message) {
        if (!queue.offer(message)) {
            throw new ConnectionException("Realtime connection stopped sending");
        }
    }

    private OutboundMessageQueue activeQueue() {
        return state == SessionState.ACTIVE ? outbound : null;
    }

    private OutboundMessageQueue requireActive() {
        OutboundMessageQueue queue = activeQueue();
        if (queue == null) {
            throw new ConnectionException("Realtime session is not active (state: " + state + ")");
        }
        return queue;
    }

    /**
     * Cancels the receive loop. Once this returns no further inbound events reach listeners; an
     * event already being dispatched is waited for, unless called from the receive thread itself.
     * The connection stays open until {@link #disconnect()}.
     */
    public void stopReceiving() {
        ExecutorService executor;
        synchronized (lifecycleLock) {
            receiving = false;
            if (receiveSubscription != null) {
                receiveSubscription.dispose();
                receiveSubscription = null;
            }
            executor = receiveExecutor;
        }
        if (executor == null || Thread.currentThread() == receiveThread) {
            return;
        }
        try {
            executor.submit(() -> { }).get(RECEIVE_STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Receive loop already shut down");
        } catch (ExecutionException | TimeoutException e) {
            LOG.warn("Receive loop did not go idle within {}ms", RECEIVE_STOP_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for receive loop to go idle");
        }
        LOG.debug("Receive loop stopped");
    }

    /**
     * Flushes queued messages, stops the receive loop, closes the connection and waits for the
     * receive thread to exit. Idempotent; a failed session stays {@link SessionState#FAILED}.
     */
    public void disconnect() {
        synchronized (lifecycleLock) {
            SessionState current = state;
            if (current == SessionState.IDLE || current == SessionState.CLOSED) {
                return;
            }
            if (current != SessionState.FAILED) {
                transition(SessionState.STOPPING);
            }
            LOG.info("Disconnecting realtime session");
            releaseResources();
            if (current != SessionState.FAILED) {
                transition(SessionState.CLOSED);
            }
            LOG.info("✓ Realtime session disconnected");
        }
    }

    private void releaseResources() {
        if (outbound != null) {
            outbound.stop();
            outbound = null;
        }
        receiving = false;
        if (receiveSubscription != null) {
            receiveSubscription.dispose();
            receiveSubscription = null;
        }
        if (channel != null) {
            try {
                channel.close();
            } catch (RuntimeException e) {
                LOG.debug("Error closing WebSocket: {}", e.toString());
            }
            channel = null;
        }
        if (receiveExecutor != null) {
            receiveExecutor.shutdown();
            if (Thread.currentThread() != receiveThread) {
                try {
                    if (!receiveExecutor.awaitTermination(RECEIVE_STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                        LOG.warn("Receive loop did not exit within {}ms", RECEIVE_STOP_TIMEOUT_MS);
                        receiveExecutor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Interrupted while waiting for receive loop to exit");
                }
            }
            receiveExecutor = null;
        }
        assembler.reset();
    }

    @Override
    public void close() {
        disconnect();
    }

    public SessionState getState() {
        return state;
    }

    public boolean isActive() {
        return state == SessionState.ACTIVE;
    }

    /**
     * @return why the session failed, or null
     */
    public Throwable getFailureCause() {
        return failureCause;
    }

    public SessionConfig getSessionConfig() {
        return sessionConfig;
    }
}
