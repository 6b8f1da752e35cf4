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

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One raw WebSocket frame as read off the connection, before messages are reassembled.
 */
public final class Frame {

    public enum Kind {
        TEXT,
        BINARY,
        CONTINUATION,
        CLOSE,
        PING,
        PONG
    }

    private final Kind kind;
    private final byte[] payload;
    private final boolean finalFragment;

    public Frame(Kind kind, byte[] payload, boolean finalFragment) {
        this.kind = Objects.requireNonNull(kind);
        this.payload = payload != null ? payload.clone() : new byte[0];
        this.finalFragment = finalFragment;
    }

    public static Frame text(String text) {
        return new Frame(Kind.TEXT, text.getBytes(StandardCharsets.UTF_8), true);
    }

    public Kind getKind() {
        return kind;
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    public int length() {
        return payload.length;
    }

    /**
     * True when this frame ends a message (the FIN bit).
     */
    public boolean isFinalFragment() {
        return finalFragment;
    }

    @Override
    public String toString() {
        return "Frame{" + kind + ", " + payload.length + " bytes" + (finalFragment ? ", final" : "") + "}";
    }
}
