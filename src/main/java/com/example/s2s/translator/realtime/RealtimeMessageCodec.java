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
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Base64;
import java.util.Optional;

/**
 * JSON encoding of the realtime wire protocol.
 *
 * Every message is a UTF-8 JSON object with a {@code type} discriminator. Outbound messages are
 * built as Gson trees; inbound messages are decoded into {@link TranslationEvent}s, and the ones
 * the engine does not act on are logged and dropped.
 */
public class RealtimeMessageCodec {

    private static final Logger LOG = LoggerFactory.getLogger(RealtimeMessageCodec.class);

    // Outbound
    static final String SESSION_UPDATE = "session.update";
    static final String INPUT_AUDIO_BUFFER_APPEND = "input_audio_buffer.append";
    static final String INPUT_AUDIO_BUFFER_COMMIT = "input_audio_buffer.commit";
    static final String INPUT_AUDIO_BUFFER_CLEAR = "input_audio_buffer.clear";
    static final String RESPONSE_CREATE = "response.create";

    // Inbound
    static final String SESSION_CREATED = "session.created";
    static final String SESSION_UPDATED = "session.updated";
    static final String RESPONSE_TEXT_DELTA = "response.text.delta";
    static final String RESPONSE_AUDIO_DELTA = "response.audio.delta";
    static final String INPUT_TRANSCRIPTION_COMPLETED = "conversation.item.input_audio_transcription.completed";
    static final String RESPONSE_DONE = "response.done";
    static final String ERROR = "error";

    /** Lifecycle names reported for the service's session acknowledgements. */
    public static final String SESSION_CREATED_STATE = "SESSION_CREATED";
    public static final String SESSION_UPDATED_STATE = "SESSION_UPDATED";

    // turn_detection must be written as an explicit null to disable server-side turn detection
    private final Gson gson = new GsonBuilder()
        .serializeNulls()
        .disableHtmlEscaping()
        .create();

    /**
     * Builds the one-time session configuration message.
     */
    public String encodeSessionUpdate(SessionConfig config) {
        JsonObject transcription = new JsonObject();
        transcription.addProperty("model", config.getTranscriptionModel());

        JsonObject session = new JsonObject();
        session.add("modalities", modalities());
        session.addProperty("instructions", config.instructions());
        session.addProperty("voice", config.getVoice());
        session.addProperty("input_audio_format", "pcm16");
        session.addProperty("output_audio_format", "pcm16");
        session.add("input_audio_transcription", transcription);
        session.addProperty("max_response_output_tokens", config.getMaxResponseOutputTokens());
        session.addProperty("temperature", config.getTemperature());
        session.add("turn_detection", JsonNull.INSTANCE);

        JsonObject message = message(SESSION_UPDATE);
        message.add("session", session);
        return gson.toJson(message);
    }

    /**
     * Builds an {@code input_audio_buffer.append} message carrying base64 PCM16.
     */
    public String encodeAudioAppend(byte[] pcm16) {
        JsonObject message = message(INPUT_AUDIO_BUFFER_APPEND);
        message.addProperty("audio", Base64.getEncoder().encodeToString(pcm16));
        return gson.toJson(message);
    }

    public String encodeCommit() {
        return gson.toJson(message(INPUT_AUDIO_BUFFER_COMMIT));
    }

    public String encodeClear() {
        return gson.toJson(message(INPUT_AUDIO_BUFFER_CLEAR));
    }

    public String encodeResponseCreate() {
        JsonObject response = new JsonObject();
        response.add("modalities", modalities());

        JsonObject message = message(RESPONSE_CREATE);
        message.add("response", response);
        return gson.toJson(message);
    }

    /**
     * Decodes one complete inbound message.
     *
     * @return the event, or empty for messages the engine ignores (including ones without a type)
     * @throws RealtimeProtocolException if the text is not a JSON object or a field is malformed
     */
    public Optional<TranslationEvent> decode(String json) {
        JsonObject root;
        try {
            JsonElement element = JsonParser.parseString(json);
            if (!element.isJsonObject()) {
                throw new RealtimeProtocolException("invalid_message", "Expected a JSON object");
            }
            root = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new RealtimeProtocolException("invalid_message", "Malformed JSON: " + e.getMessage());
        }

        String type = getString(root, "type");
        if (type == null) {
            LOG.debug("Dropping message without type");
            return Optional.empty();
        }

        switch (type) {
            case SESSION_CREATED:
                return Optional.of(TranslationEvent.lifecycle(SESSION_CREATED_STATE));
            case SESSION_UPDATED:
                return Optional.of(TranslationEvent.lifecycle(SESSION_UPDATED_STATE));
            case RESPONSE_TEXT_DELTA: {
                String delta = getString(root, "delta");
                return delta == null || delta.isEmpty()
                    ? Optional.empty()
                    : Optional.of(TranslationEvent.textDelta(delta));
            }
            case RESPONSE_AUDIO_DELTA: {
                String delta = getString(root, "delta");
                if (delta == null || delta.isEmpty()) {
                    return Optional.empty();
                }
                try {
                    return Optional.of(TranslationEvent.audioDelta(Base64.getDecoder().decode(delta)));
                } catch (IllegalArgumentException e) {
                    throw new RealtimeProtocolException("invalid_audio", "Audio delta is not valid base64");
                }
            }
            case INPUT_TRANSCRIPTION_COMPLETED: {
                String transcript = getString(root, "transcript");
                return transcript == null
                    ? Optional.empty()
                    : Optional.of(TranslationEvent.inputTranscript(transcript));
            }
            case RESPONSE_DONE:
                // Latency is filled in by the session, which knows when it last committed
                return Optional.of(TranslationEvent.responseCompleted(-1));
            case ERROR: {
                JsonObject error = root.has("error") && root.get("error").isJsonObject()
                    ? root.getAsJsonObject("error")
                    : new JsonObject();
                String code = getString(error, "code");
                String message = getString(error, "message");
                return Optional.of(TranslationEvent.protocolError(code != null ? code : "unknown", message));
            }
            case "rate_limits.updated":
                LOG.debug("Rate limits updated: {}", json);
                return Optional.empty();
            default:
                LOG.debug("Unhandled message type: {}", type);
                return Optional.empty();
        }
    }

    private static JsonObject message(String type) {
        JsonObject message = new JsonObject();
        message.addProperty("type", type);
        return message;
    }

    private static JsonArray modalities() {
        JsonArray modalities = new JsonArray();
        modalities.add("text");
        modalities.add("audio");
        return modalities;
    }

    private static String getString(JsonObject object, String field) {
        JsonElement value = object.get(field);
        if (value == null || value.isJsonNull() || !value.isJsonPrimitive()) {
            return null;
        }
        return value.getAsString();
    }
}
