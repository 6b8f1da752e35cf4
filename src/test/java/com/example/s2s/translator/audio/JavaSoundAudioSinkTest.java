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

package com.example.s2s.translator.audio;

import com.example.s2s.translator.exception.PlaybackException;
import com.example.s2s.translator.testutil.FakeSourceDataLine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import javax.sound.sampled.LineUnavailableException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class JavaSoundAudioSinkTest {

    private final FakeSourceDataLine line =
        new FakeSourceDataLine(JavaSoundAudioSource.pcm16(JavaSoundAudioSink.OUTPUT_SAMPLE_RATE, 1));
    private final List<PlaybackException> errors = new CopyOnWriteArrayList<>();
    private final JavaSoundAudioSink sink =
        new JavaSoundAudioSink(JavaSoundAudioSink.OUTPUT_SAMPLE_RATE, 1, (format, bufferBytes) -> line);

    @AfterEach
    void tearDown() {
        sink.stop();
    }

    @Test
    void playsChunksInArrivalOrder() {
        sink.setErrorHandler(errors::add);
        sink.start();

        sink.enqueue(new AudioChunk(new byte[]{1, 2}, 0));
        sink.enqueue(new AudioChunk(new byte[]{3, 4}, 0));
        sink.enqueue(new AudioChunk(new byte[]{5, 6}, 0));

        await().until(() -> line.written().length == 6);
        assertThat(line.written()).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(errors).isEmpty();
    }

    @Test
    void audioBeforeStartIsDropped() {
        sink.enqueue(new AudioChunk(new byte[]{1, 2}, 0));

        assertThat(sink.getQueueSize()).isZero();
        assertThat(sink.isPlaying()).isFalse();
    }

    @Test
    void emptyChunksAreIgnored() {
        sink.start();

        sink.enqueue(new AudioChunk(new byte[0], 0));
        sink.enqueue(new AudioChunk(new byte[]{9, 9}, 0));

        await().until(() -> line.written().length == 2);
    }

    @Test
    void unavailableOutputIsAPlaybackException() {
        JavaSoundAudioSink broken = new JavaSoundAudioSink(24000, 1, (format, bufferBytes) -> {
            throw new LineUnavailableException("no speakers");
        });

        assertThatThrownBy(broken::start)
            .isInstanceOf(PlaybackException.class)
            .hasMessageContaining("no speakers");
        assertThat(broken.isPlaying()).isFalse();
    }

    @Test
    void stopClosesTheLineAndDropsLaterAudio() {
        sink.start();

        sink.stop();
        sink.stop();
        sink.enqueue(new AudioChunk(new byte[]{1, 2}, 0));

        assertThat(sink.isPlaying()).isFalse();
        assertThat(line.closeCount).isEqualTo(1);
        assertThat(sink.getQueueSize()).isZero();
    }

    @Test
    void writeFailureIsReportedToErrorHandler() {
        sink.setErrorHandler(errors::add);
        sink.start();
        line.failWriteWith = new IllegalStateException("device removed");

        sink.enqueue(new AudioChunk(new byte[]{1, 2}, 0));

        await().until(() -> errors.size() == 1);
        assertThat(errors.get(0)).hasMessageContaining("device removed");
        assertThat(sink.isPlaying()).isFalse();
    }
}
