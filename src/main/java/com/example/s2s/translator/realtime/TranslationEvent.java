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

import java.util.Objects;

/**
 * One decoded message from the realtime service.
 *
 * Consumers switch on {@link #getType()} and cast to the matching nested class.
 */
public abstract class TranslationEvent {

    public enum Type {
        TEXT_DELTA,
        AUDIO_DELTA,
        INPUT_TRANSCRIPT,
        RESPONSE_COMPLETED,
        PROTOCOL_ERROR,
        SESSION_LIFECYCLE
    }

    private final Type type;

    private TranslationEvent(Type type) {
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    public static TextDelta textDelta(String text) {
        return new TextDelta(text);
    }

    public static AudioDelta audioDelta(byte[] audio) {
        return new AudioDelta(audio);
    }

    public static InputTranscript inputTranscript(String text) {
        return new InputTranscript(text);
    }

    public static ResponseCompleted responseCompleted(long latencyMs) {
        return new ResponseCompleted(latencyMs);
    }

    public static ProtocolError protocolError(String code, String message) {
        return new ProtocolError(code, message);
    }

    public static SessionLifecycle lifecycle(String stateName) {
        return new SessionLifecycle(stateName);
    }

    /** Fragment of translated text. */
    public static final class TextDelta extends TranslationEvent {
        private final String text;

        private TextDelta(String text) {
            super(Type.TEXT_DELTA);
            this.text = Objects.requireNonNull(text);
        }

        public String getText() {
            return text;
        }

        @Override
        public String toString() {
            return "TextDelta{" + text + "}";
        }
    }

    /** Fragment of translated speech, PCM16 24kHz mono. */
    public static final class AudioDelta extends TranslationEvent {
        private final byte[] audio;

        private AudioDelta(byte[] audio) {
            super(Type.AUDIO_DELTA);
            this.audio = audio.clone();
        }

        public byte[] getAudio() {
            return audio.clone();
        }

        public int size() {
            return audio.length;
        }

        @Override
        public String toString() {
            return "AudioDelta{" + audio.length + " bytes}";
        }
    }

    /** What the service heard in the source language. Informational. */
    public static final class InputTranscript extends TranslationEvent {
        private final String text;

        private InputTranscript(String text) {
            super(Type.INPUT_TRANSCRIPT);
            this.text = Objects.requireNonNull(text);
        }

        public String getText() {
            return text;
        }

        @Override
        public String toString() {
            return "InputTranscript{" + text + "}";
        }
    }

    /** One outstanding response finished; latency is measured from the last commit, -1 if unknown. */
    public static final class ResponseCompleted extends TranslationEvent {
        private final long latencyMs;

        private ResponseCompleted(long latencyMs) {
            super(Type.RESPONSE_COMPLETED);
            this.latencyMs = latencyMs;
        }

        public long getLatencyMs() {
            return latencyMs;
        }

        @Override
        public String toString() {
            return "ResponseCompleted{" + latencyMs + "ms}";
        }
    }

    /** Error reported by the service. The session stays usable. */
    public static final class ProtocolError extends TranslationEvent {
        private final String code;
        private final String message;

        private ProtocolError(String code, String message) {
            super(Type.PROTOCOL_ERROR);
            this.code = code != null ? code : "unknown";
            this.message = message != null ? message : "";
        }

        public String getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return "ProtocolError{[" + code + "] " + message + "}";
        }
    }

    /** Session acknowledgement from the service, or a local state change. */
    public static final class SessionLifecycle extends TranslationEvent {
        private final String stateName;

        private SessionLifecycle(String stateName) {
            super(Type.SESSION_LIFECYCLE);
            this.stateName = Objects.requireNonNull(stateName);
        }

        public String getStateName() {
            return stateName;
        }

        @Override
        public String toString() {
            return "SessionLifecycle{" + stateName + "}";
        }
    }
}
