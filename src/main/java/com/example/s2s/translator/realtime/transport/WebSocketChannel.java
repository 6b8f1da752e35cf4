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

import reactor.core.publisher.Flux;

/**
 * An open WebSocket connection.
 */
public interface WebSocketChannel {

    /**
     * Raw inbound frames in arrival order. Completes when the connection closes normally and
     * errors when it is lost. Subscribe once.
     */
    Flux<Frame> receive();

    /**
     * Writes one text message. Callers serialize their writes; see
     * {@link com.example.s2s.translator.realtime.OutboundMessageQueue}.
     *
     * @throws com.example.s2s.translator.exception.ConnectionException if the connection is closed
     */
    void send(String text);

    /**
     * Sends a close frame if the connection is still open. Idempotent.
     */
    void close();

    boolean isOpen();
}
