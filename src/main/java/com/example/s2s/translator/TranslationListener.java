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
import com.example.s2s.translator.exception.TranslatorException;

/**
 * The engine's three event streams. Callbacks arrive on engine threads and must not block.
 */
public interface TranslationListener {

    /** A fragment of translated text, in arrival order. */
    void onTranslatedText(String text);

    /** A chunk of translated speech (PCM16 24kHz mono), already queued for playback. */
    default void onTranslatedAudio(AudioChunk audio) {
    }

    /** Capture, playback, protocol or connection errors. */
    void onError(TranslatorException error);
}
