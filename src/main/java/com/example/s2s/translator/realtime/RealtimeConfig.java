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

import com.azure.core.credential.KeyCredential;
import com.azure.core.util.UrlBuilder;
import com.example.s2s.translator.audio.CaptureMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Settings for the Azure OpenAI realtime translation endpoint and the local audio devices.
 *
 * Unlike {@link SessionConfig}, which is fixed for one session, these values can be reloaded
 * between sessions. Reading settings never throws: use {@link #validate()} / {@link #isValid()}.
 */
public class RealtimeConfig {

    private static final Logger LOG = LoggerFactory.getLogger(RealtimeConfig.class);

    public static final String DEFAULT_API_VERSION = "2024-10-01-preview";
    public static final String DEFAULT_VOICE = "alloy";
    public static final String DEFAULT_TRANSCRIPTION_MODEL = "whisper-1";
    public static final String DEFAULT_TARGET_LANGUAGE = "ro";
    public static final int DEFAULT_MAX_RESPONSE_OUTPUT_TOKENS = 150;
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_SAMPLE_RATE = 16000;
    public static final int DEFAULT_CHANNELS = 1;
    public static final int DEFAULT_BUFFER_SIZE_BYTES = 3200; // 100ms at 16kHz, 16-bit mono
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private final String endpoint;
    private final KeyCredential credential;
    private final String deployment;
    private final String apiVersion;
    private final String voice;
    private final String transcriptionModel;
    private final String sourceLanguage;
    private final String targetLanguage;
    private final int maxResponseOutputTokens;
    private final double temperature;
    private final int sampleRate;
    private final int channels;
    private final int bufferSizeBytes;
    private final CaptureMode captureMode;
    private final String captureDevice;
    private final Duration connectTimeout;

    private RealtimeConfig(Builder builder) {
        this.endpoint = trimToNull(builder.endpoint);
        String key = trimToNull(builder.apiKey);
        this.credential = key != null ? new KeyCredential(key) : null;
        this.deployment = trimToNull(builder.deployment);
        this.apiVersion = builder.apiVersion != null ? builder.apiVersion : DEFAULT_API_VERSION;
        this.voice = builder.voice != null ? builder.voice : DEFAULT_VOICE;
        this.transcriptionModel = builder.transcriptionModel != null ? builder.transcriptionModel : DEFAULT_TRANSCRIPTION_MODEL;
        this.sourceLanguage = trimToNull(builder.sourceLanguage);
        this.targetLanguage = trimToNull(builder.targetLanguage);
        this.maxResponseOutputTokens = builder.maxResponseOutputTokens;
        this.temperature = builder.temperature;
        this.sampleRate = builder.sampleRate;
        this.channels = builder.channels;
        this.bufferSizeBytes = builder.bufferSizeBytes;
        this.captureMode = builder.captureMode != null ? builder.captureMode : CaptureMode.MICROPHONE;
        this.captureDevice = trimToNull(builder.captureDevice);
        this.connectTimeout = builder.connectTimeout != null ? builder.connectTimeout : DEFAULT_CONNECT_TIMEOUT;
    }

    /**
     * Creates a RealtimeConfig from the process environment.
     *
     * Required environment variables:
     * - TRANSLATOR_ENDPOINT: Azure OpenAI endpoint (e.g., https://your-resource.cognitiveservices.azure.com)
     * - TRANSLATOR_API_KEY: API key for authentication
     * - TRANSLATOR_DEPLOYMENT: realtime model deployment (e.g., gpt-4o-mini-realtime-preview)
     *
     * Optional:
     * - TRANSLATOR_TARGET_LANGUAGE (default: ro), TRANSLATOR_SOURCE_LANGUAGE (default: auto-detect)
     * - TRANSLATOR_API_VERSION, TRANSLATOR_VOICE, TRANSLATOR_TRANSCRIPTION_MODEL
     * - TRANSLATOR_MAX_RESPONSE_OUTPUT_TOKENS, TRANSLATOR_TEMPERATURE
     * - TRANSLATOR_SAMPLE_RATE, TRANSLATOR_CHANNELS, TRANSLATOR_BUFFER_SIZE
     * - TRANSLATOR_CAPTURE_MODE (MICROPHONE | APPLICATION_PLAYBACK), TRANSLATOR_CAPTURE_DEVICE
     * - TRANSLATOR_CONNECT_TIMEOUT_SECONDS
     */
    public static RealtimeConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static RealtimeConfig fromEnvironment(Map<String, String> env) {
        Builder builder = builder()
            .endpoint(env.get("TRANSLATOR_ENDPOINT"))
            .apiKey(env.get("TRANSLATOR_API_KEY"))
            .deployment(env.get("TRANSLATOR_DEPLOYMENT"))
            .apiVersion(env.getOrDefault("TRANSLATOR_API_VERSION", DEFAULT_API_VERSION))
            .voice(env.getOrDefault("TRANSLATOR_VOICE", DEFAULT_VOICE))
            .transcriptionModel(env.getOrDefault("TRANSLATOR_TRANSCRIPTION_MODEL", DEFAULT_TRANSCRIPTION_MODEL))
            .sourceLanguage(env.get("TRANSLATOR_SOURCE_LANGUAGE"))
            .targetLanguage(env.getOrDefault("TRANSLATOR_TARGET_LANGUAGE", DEFAULT_TARGET_LANGUAGE))
            .maxResponseOutputTokens(parseInt(env, "TRANSLATOR_MAX_RESPONSE_OUTPUT_TOKENS", DEFAULT_MAX_RESPONSE_OUTPUT_TOKENS))
            .temperature(parseDouble(env, "TRANSLATOR_TEMPERATURE", DEFAULT_TEMPERATURE))
            .sampleRate(parseInt(env, "TRANSLATOR_SAMPLE_RATE", DEFAULT_SAMPLE_RATE))
            .channels(parseInt(env, "TRANSLATOR_CHANNELS", DEFAULT_CHANNELS))
            .bufferSizeBytes(parseInt(env, "TRANSLATOR_BUFFER_SIZE", DEFAULT_BUFFER_SIZE_BYTES))
            .captureDevice(env.get("TRANSLATOR_CAPTURE_DEVICE"))
            .connectTimeout(Duration.ofSeconds(parseInt(env, "TRANSLATOR_CONNECT_TIMEOUT_SECONDS",
                (int) DEFAULT_CONNECT_TIMEOUT.getSeconds())));

        String mode = env.get("TRANSLATOR_CAPTURE_MODE");
        try {
            builder.captureMode(CaptureMode.parse(mode));
        } catch (IllegalArgumentException e) {
            LOG.warn("Ignoring unknown TRANSLATOR_CAPTURE_MODE '{}', using MICROPHONE", mode);
            builder.captureMode(CaptureMode.MICROPHONE);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the list of configuration problems; empty when the settings are usable.
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (endpoint == null) {
            problems.add("endpoint is required");
        } else if (!endpoint.startsWith("https://") && !endpoint.startsWith("wss://")) {
            problems.add("endpoint must start with https:// or wss://");
        }
        if (credential == null) {
            problems.add("API key is required");
        }
        if (deployment == null) {
            problems.add("deployment is required");
        }
        if (targetLanguage == null) {
            problems.add("target language is required");
        }
        if (sampleRate <= 0) {
            problems.add("sample rate must be positive");
        }
        if (channels <= 0) {
            problems.add("channel count must be positive");
        }
        if (bufferSizeBytes <= 0) {
            problems.add("buffer size must be positive");
        } else if (channels > 0 && bufferSizeBytes % (2 * channels) != 0) {
            problems.add("buffer size must be a whole number of PCM16 frames");
        }
        if (maxResponseOutputTokens <= 0) {
            problems.add("max response output tokens must be positive");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            problems.add("temperature must be between 0.0 and 2.0");
        }
        if (connectTimeout.isZero() || connectTimeout.isNegative()) {
            problems.add("connect timeout must be positive");
        }
        return problems;
    }

    public boolean isValid() {
        return validate().isEmpty();
    }

    /**
     * Builds the WebSocket URL for the realtime API connection.
     * Format: wss://&lt;resource&gt;/openai/realtime?api-version=2024-10-01-preview&amp;deployment=&lt;deployment&gt;
     *
     * The API key is not part of the URL; it is sent in the {@code api-key} header.
     */
    public URI buildWebSocketUrl() {
        String baseUrl = endpoint;

        // Convert https:// to wss://
        if (baseUrl.startsWith("https://")) {
            baseUrl = "wss://" + baseUrl.substring(8);
        }

        // Remove trailing slash
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }

        UrlBuilder url = UrlBuilder.parse(baseUrl);
        String basePath = url.getPath() != null ? url.getPath() : "";
        url.setPath(basePath + "/openai/realtime");
        url.setQueryParameter("api-version", encode(apiVersion));
        url.setQueryParameter("deployment", encode(deployment));
        return URI.create(url.toString());
    }

    public String getEndpoint() {
        return endpoint;
    }

    public KeyCredential getCredential() {
        return credential;
    }

    public String getDeployment() {
        return deployment;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public String getVoice() {
        return voice;
    }

    public String getTranscriptionModel() {
        return transcriptionModel;
    }

    public String getSourceLanguage() {
        return sourceLanguage;
    }

    public String getTargetLanguage() {
        return targetLanguage;
    }

    public int getMaxResponseOutputTokens() {
        return maxResponseOutputTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public int getChannels() {
        return channels;
    }

    public int getBufferSizeBytes() {
        return bufferSizeBytes;
    }

    public CaptureMode getCaptureMode() {
        return captureMode;
    }

    public String getCaptureDevice() {
        return captureDevice;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static int parseInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring invalid {}='{}', using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static double parseDouble(Map<String, String> env, String key, double defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring invalid {}='{}', using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "RealtimeConfig{" +
               "endpoint='" + endpoint + '\'' +
               ", deployment='" + deployment + '\'' +
               ", apiVersion='" + apiVersion + '\'' +
               ", targetLanguage='" + targetLanguage + '\'' +
               ", captureMode=" + captureMode +
               ", apiKey='***'" +
               '}';
    }

    /**
     * Builder for explicit, programmatic configuration.
     */
    public static final class Builder {
        private String endpoint;
        private String apiKey;
        private String deployment;
        private String apiVersion;
        private String voice;
        private String transcriptionModel;
        private String sourceLanguage;
        private String targetLanguage = DEFAULT_TARGET_LANGUAGE;
        private int maxResponseOutputTokens = DEFAULT_MAX_RESPONSE_OUTPUT_TOKENS;
        private double temperature = DEFAULT_TEMPERATURE;
        private int sampleRate = DEFAULT_SAMPLE_RATE;
        private int channels = DEFAULT_CHANNELS;
        private int bufferSizeBytes = DEFAULT_BUFFER_SIZE_BYTES;
        private CaptureMode captureMode;
        private String captureDevice;
        private Duration connectTimeout;

        private Builder() {
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder deployment(String deployment) {
            this.deployment = deployment;
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder voice(String voice) {
            this.voice = voice;
            return this;
        }

        public Builder transcriptionModel(String transcriptionModel) {
            this.transcriptionModel = transcriptionModel;
            return this;
        }

        public Builder sourceLanguage(String sourceLanguage) {
            this.sourceLanguage = sourceLanguage;
            return this;
        }

        public Builder targetLanguage(String targetLanguage) {
            this.targetLanguage = targetLanguage;
            return this;
        }

        public Builder maxResponseOutputTokens(int maxResponseOutputTokens) {
            this.maxResponseOutputTokens = maxResponseOutputTokens;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder sampleRate(int sampleRate) {
            this.sampleRate = sampleRate;
            return this;
        }

        public Builder channels(int channels) {
            this.channels = channels;
            return this;
        }

        public Builder bufferSizeBytes(int bufferSizeBytes) {
            this.bufferSizeBytes = bufferSizeBytes;
            return this;
        }

        public Builder captureMode(CaptureMode captureMode) {
            this.captureMode = captureMode;
            return this;
        }

        public Builder captureDevice(String captureDevice) {
            this.captureDevice = captureDevice;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public RealtimeConfig build() {
            return new RealtimeConfig(this);
        }
    }
}
