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
import com.example.s2s.translator.realtime.MessageAssembler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;
import reactor.test.StepVerifier;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReactorNettyWebSocketConnectorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final ReactorNettyWebSocketConnector connector = new ReactorNettyWebSocketConnector();
    private DisposableServer server;
    private WebSocketChannel channel;

    @AfterEach
    void tearDown() {
        if (channel != null) {
            channel.close();
        }
        if (server != null) {
            server.disposeNow();
        }
    }

    private void startServer(BiFunction<? super WebsocketInbound, ? super WebsocketOutbound,
        ? extends Publisher<Void>> handler) {
        server = HttpServer.create()
            .host("localhost")
            .port(0)
            .route(routes -> routes.ws("/openai/realtime", handler))
            .bindNow();
    }

    private URI uri(String path) {
        return URI.create("ws://localhost:" + server.port() + path);
    }

    private WebSocketChannel connect(Map<String, String> headers) {
        channel = connector.connect(uri("/openai/realtime"), headers).block(TIMEOUT);
        return channel;
    }

    private static String text(Frame frame) {
        return new String(frame.getPayload(), StandardCharsets.UTF_8);
    }

    @Test
    void sendsTextAndReceivesReplies() {
        AtomicReference<String> apiKey = new AtomicReference<>();
        startServer((in, out) -> {
            apiKey.set(in.headers().get("api-key"));
            return out.sendString(in.receive().asString().map(s -> "echo:" + s));
        });

        WebSocketChannel opened = connect(Map.of("api-key", "secret-key", "OpenAI-Beta", "realtime=v1"));
        assertThat(opened.isOpen()).isTrue();

        opened.send("hello");

        StepVerifier.create(opened.receive()
                .filter(f -> f.getKind() == Frame.Kind.TEXT)
                .map(ReactorNettyWebSocketConnectorTest::text)
                .take(1))
            .expectNext("echo:hello")
            .expectComplete()
            .verify(TIMEOUT);
        assertThat(apiKey.get()).isEqualTo("secret-key");
    }

    @Test
    void acceptsFramesLargerThanNettyDefault() {
        String big = "x".repeat(200 * 1024);
        startServer((in, out) -> out.sendString(Mono.just(big)).then(in.receive().then()));

        WebSocketChannel opened = connect(Collections.emptyMap());
        MessageAssembler assembler = new MessageAssembler();

        StepVerifier.create(opened.receive()
                .map(assembler::accept)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .take(1))
            .assertNext(message -> assertThat(message).hasSize(big.length()))
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void serverCloseCompletesInbound() {
        startServer((in, out) -> out.sendString(Mono.just("bye")));

        WebSocketChannel opened = connect(Collections.emptyMap());

        StepVerifier.create(opened.receive()
                .filter(f -> f.getKind() == Frame.Kind.TEXT)
                .map(ReactorNettyWebSocketConnectorTest::text))
            .expectNext("bye")
            .expectComplete()
            .verify(TIMEOUT);
        assertThat(opened.isOpen()).isFalse();
        assertThatThrownBy(() -> opened.send("late")).isInstanceOf(ConnectionException.class);
    }

    @Test
    void closeSendsCloseFrameToServer() throws Exception {
        CountDownLatch serverSawClose = new CountDownLatch(1);
        startServer((in, out) -> in.receive().then().doFinally(signal -> serverSawClose.countDown()));

        WebSocketChannel opened = connect(Collections.emptyMap());
        opened.close();

        assertThat(opened.isOpen()).isFalse();
        assertThat(serverSawClose.await(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();
        assertThatThrownBy(() -> opened.send("after close")).isInstanceOf(ConnectionException.class);
    }

    @Test
    void rejectedUpgradeIsAConnectionException() {
        startServer((in, out) -> out.neverComplete());

        assertThatThrownBy(() -> connector.connect(uri("/not-a-websocket"), Collections.emptyMap()).block(TIMEOUT))
            .isInstanceOf(ConnectionException.class)
            .hasMessageContaining("rejected");
    }

    @Test
    void unreachableHostIsAConnectionException() {
        startServer((in, out) -> out.neverComplete());
        URI closed = uri("/openai/realtime");
        server.disposeNow();
        server = null;

        assertThatThrownBy(() -> connector.connect(closed, Collections.emptyMap()).block(TIMEOUT))
            .isInstanceOf(ConnectionException.class)
            .hasMessageContaining("failed");
    }
}
