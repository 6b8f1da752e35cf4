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
import com.example.s2s.translator.exception.ConnectionException;
import com.example.s2s.translator.exception.TranslatorException;
import com.example.s2s.translator.realtime.RealtimeConfig;
import com.example.s2s.translator.realtime.SettingsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Command-line host: translates the microphone (or application playback) until interrupted.
 *
 * Usage: {@code RealtimeTranslatorApp [targetLanguage [sourceLanguage]]}
 *
 * Settings come from {@code TRANSLATOR_*} environment variables, see {@link RealtimeConfig#fromEnvironment()}.
 */
public class RealtimeTranslatorApp {

    private static final Logger LOG = LoggerFactory.getLogger(RealtimeTranslatorApp.class);

    /**
     * The main method.
     */
    public static void main(String[] args) {
        LOG.info("Starting realtime audio translator");

        RealtimeTranslationEngine engine = new RealtimeTranslationEngine(SettingsProvider.environment());
        RealtimeConfig config = engine.getConfig();
        if (!engine.isConfigured()) {
            LOG.error("❌ Missing or invalid configuration:");
            config.validate().forEach(problem -> LOG.error("  - {}", problem));
            LOG.error("Set TRANSLATOR_ENDPOINT, TRANSLATOR_API_KEY and TRANSLATOR_DEPLOYMENT");
            System.exit(1);
            return;
        }

        String targetLanguage = args.length > 0 ? args[0] : config.getTargetLanguage();
        String sourceLanguage = args.length > 1 ? args[1] : config.getSourceLanguage();

        LOG.info("Realtime configuration:");
        LOG.info("  Endpoint: {}", config.getEndpoint());
        LOG.info("  Deployment: {}", config.getDeployment());
        LOG.info("  Capture: {}{}", config.getCaptureMode(),
            config.getCaptureDevice() != null ? " (" + config.getCaptureDevice() + ")" : "");

        CountDownLatch finished = new CountDownLatch(1);
        engine.addListener(new TranslationListener() {
            @Override
            public void onTranslatedText(String text) {
                System.out.print(text);
                System.out.flush();
            }

            @Override
            public void onTranslatedAudio(AudioChunk audio) {
                LOG.debug("← Translated audio: {}", audio);
            }

            @Override
            public void onError(TranslatorException error) {
                LOG.error("❌ {}", error.getMessage());
                if (error instanceof ConnectionException) {
                    finished.countDown();
                }
            }
        });

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down...");
            engine.close();
            finished.countDown();
        }, "shutdown"));

        try {
            engine.start(sourceLanguage, targetLanguage);
        } catch (TranslatorException e) {
            LOG.error("❌ Failed to start translation: {}", e.getMessage());
            System.exit(1);
            return;
        }

        LOG.info("✓ Translating {} → {}. Press Ctrl+C to stop.",
            sourceLanguage != null ? sourceLanguage : "auto", targetLanguage);
        try {
            finished.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        engine.close();
    }
}
