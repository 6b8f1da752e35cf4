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

package com.example.s2s.translator.realtime.transport;

import com.example.s2s.translator.exception.ConnectionException;
import io.netty.buffer.ByteBufUtil;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.ContinuationWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.publisher.Sinks;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.WebsocketClientSpec;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WebSocket client on Reactor Netty.
 *
 * Frames are read raw (no aggregation) and copied out of Netty's buffers before they are
 * published, so the session sees continuation frames and reassembles messages itself.
 */
public class ReactorNettyWebSocketConnector implements WebSocketConnector {

    private static final Logger LOG = LoggerFactory.getLogger(ReactorNettyWebSocketConnector.class);

    /** Audio deltas can be large; Netty's default limit is 64 KiB. */
    public static final int MAX_FRAME_PAYLOAD_BYTES = 1024 * 1024;

    private static final Sinks.EmitFailureHandler RETRY_NON_SERIALIZED =
        Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(200));

    private final HttpClient httpClient;

    public ReactorNettyWebSocketConnector() {
        this(HttpClient.create());
    }

    public ReactorNettyWebSocketConnector(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public Mono<WebSocketChannel> connect(URI uri, Map<String, String> headers) {
        return Mono.create(sink -> {
            NettyChannel channel = new NettyChannel();
            AtomicBoolean opened = new AtomicBoolean(false);

            LOG.info("→ Opening WebSocket to {}://{}{}", uri.getScheme(), uri.getHost(), uri.getPath());

            Disposable connection = httpClient
                .headers(h -> headers.forEach(h::set))
                .websocket(WebsocketClientSpec.builder()
                    .maxFramePayloadLength(MAX_FRAME_PAYLOAD_BYTES)
                    .build())
                .uri(uri)
                .handle((inbound, outbound) -> {
                    channel.attach(outbound);
                    opened.set(true);
                    sink.success(channel);

                    Mono<Void> receiving = inbound.receiveFrames()
                        .map(ReactorNettyWebSocketConnector::copy)
                        .doOnNext(channel::onFrame)
                        .then()
                        .doFinally(signal -> {
                            if (signal != SignalType.ON_ERROR) {
                                channel.onInboundClosed();
                            }
                        });
                    Mono<Void> sending = outbound.sendString(channel.outgoing()).then();
                    return Mono.when(receiving, sending);
                })
                .then()
                .subscribe(
                    v -> { },
                    error -> {
                        if (opened.get()) {
                            channel.onError(error);
                        } else if (error instanceof WebSocketClientHandshakeException) {
                            sink.error(new ConnectionException(
                                "WebSocket upgrade rejected: " + error.getMessage(), error));
                        } else {
                            sink.error(new ConnectionException(
                                "WebSocket connection failed: " + error.getMessage(), error));
                        }
                    },
                    () -> {
                        if (!opened.get()) {
                            sink.error(new ConnectionException("WebSocket closed during handshake"));
                        }
                    });

            channel.setConnection(connection);
            sink.onCancel(connection);
        });
    }

    static Frame copy(WebSocketFrame frame) {
        byte[] payload = ByteBufUtil.getBytes(frame.content());
        return new Frame(kindOf(frame), payload, frame.isFinalFragment());
    }

    private static Frame.Kind kindOf(WebSocketFrame frame) {
        if (frame instanceof ContinuationWebSocketFrame) {
            return Frame.Kind.CONTINUATION;
        } else if (frame instanceof BinaryWebSocketFrame) {
            return Frame.Kind.BINARY;
        } else if (frame instanceof CloseWebSocketFrame) {
            return Frame.Kind.CLOSE;
        } else if (frame instanceof PingWebSocketFrame) {
            return Frame.Kind.PING;
        } else if (frame instanceof PongWebSocketFrame) {
            return Frame.Kind.PONG;
        }
        return Frame.Kind.TEXT;
    }

    /**
     * Bridges one Reactor Netty connection to the blocking-style {@link WebSocketChannel}.
     */
    static final class NettyChannel implements WebSocketChannel {

        private final Sinks.Many<Frame> inbound = Sinks.many().unicast().onBackpressureBuffer();
        private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        private final AtomicBoolean open = new AtomicBoolean(false);
        private volatile WebsocketOutbound websocketOutbound;
        private volatile Disposable connection;

        void attach(WebsocketOutbound websocketOutbound) {
            this.websocketOutbound = websocketOutbound;
            open.set(true);
        }

        void setConnection(Disposable connection) {
            this.connection = connection;
        }

        Flux<String> outgoing() {
            return outbound.asFlux();
        }

        void onFrame(Frame frame) {
            inbound.emitNext(frame, RETRY_NON_SERIALIZED);
        }

        void onInboundClosed() {
            boolean wasOpen = open.getAndSet(false);
            outbound.emitComplete(RETRY_NON_SERIALIZED);
            inbound.emitComplete(RETRY_NON_SERIALIZED);
            if (wasOpen) {
                LOG.info("WebSocket closed by server");
            }
        }

        void onError(Throwable error) {
            open.set(false);
            outbound.emitComplete(RETRY_NON_SERIALIZED);
            inbound.emitError(error, RETRY_NON_SERIALIZED);
        }

        @Override
        public Flux<Frame> receive() {
            return inbound.asFlux();
        }

        @Override
        public void send(String text) {
            if (!open.get()) {
                throw new ConnectionException("WebSocket is closed");
            }
            outbound.emitNext(text, RETRY_NON_SERIALIZED);
        }

        @Override
        public void close() {
            if (!open.getAndSet(false)) {
                return;
            }
            WebsocketOutbound out = websocketOutbound;
            outbound.emitComplete(RETRY_NON_SERIALIZED);
            if (out != null) {
                out.sendClose()
                    .timeout(Duration.ofSeconds(5))
                    .doOnError(e -> LOG.debug("Close frame not sent: {}", e.toString()))
                    .onErrorResume(e -> Mono.empty())
                    .doFinally(signal -> disposeConnection())
                    .subscribe();
            } else {
                disposeConnection();
            }
        }

        private void disposeConnection() {
            Disposable c = connection;
            if (c != null && !c.isDisposed()) {
                c.dispose();
            }
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }
    }
}
