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

import com.example.s2s.translator.exception.RealtimeProtocolException;
import com.example.s2s.translator.realtime.transport.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Rebuilds complete messages from raw frames.
 *
 * A message starts with a TEXT or BINARY frame and runs through CONTINUATION frames until one
 * carries the final-fragment flag. Control frames may arrive in between and are ignored. Only
 * text messages are returned; the realtime protocol has no binary messages.
 *
 * Not thread-safe: one assembler per receive loop.
 */
public class MessageAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(MessageAssembler.class);

    public static final int DEFAULT_MAX_MESSAGE_BYTES = 16 * 1024 * 1024;

    private final int maxMessageBytes;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private Frame.Kind currentKind;

    public MessageAssembler() {
        this(DEFAULT_MAX_MESSAGE_BYTES);
    }

    public MessageAssembler(int maxMessageBytes) {
        this.maxMessageBytes = maxMessageBytes;
    }

    /**
     * Adds one frame.
     * A TEXT or BINARY frame arriving mid-message discards the unfinished one and starts over.
     *
     * @return the complete text message when this frame ends one
     * @throws RealtimeProtocolException on a continuation without a message or an oversized message
     */
    public Optional<String> accept(Frame frame) {
        switch (frame.getKind()) {
            case PING:
            case PONG:
            case CLOSE:
                return Optional.empty();
            case TEXT:
            case BINARY:
                if (currentKind != null) {
                    LOG.warn("⚠ Discarding incomplete message ({} bytes): a new message started", buffer.size());
                    reset();
                }
                currentKind = frame.getKind();
                break;
            case CONTINUATION:
                if (currentKind == null) {
                    throw new RealtimeProtocolException("fragmentation", "Continuation frame without a message");
                }
                break;
            default:
                throw new IllegalStateException("Unknown frame kind " + frame.getKind());
        }

        if (buffer.size() + frame.length() > maxMessageBytes) {
            reset();
            throw new RealtimeProtocolException("message_too_large",
                "Message exceeds " + maxMessageBytes + " bytes");
        }
        byte[] payload = frame.getPayload();
        buffer.write(payload, 0, payload.length);

        if (!frame.isFinalFragment()) {
            return Optional.empty();
        }

        Frame.Kind kind = currentKind;
        String text = buffer.toString(StandardCharsets.UTF_8);
        int size = buffer.size();
        reset();
        if (kind == Frame.Kind.BINARY) {
            LOG.debug("Ignoring binary message ({} bytes)", size);
            return Optional.empty();
        }
        return Optional.of(text);
    }

    /**
     * True while a fragmented message is being collected.
     */
    public boolean isAssembling() {
        return currentKind != null;
    }

    public void reset() {
        buffer.reset();
        currentKind = null;
    }
}
