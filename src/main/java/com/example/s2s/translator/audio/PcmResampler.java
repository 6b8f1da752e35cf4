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

/**
 * Converts captured PCM16 (16-bit little-endian) audio to the realtime service's input format.
 *
 * The service expects 24kHz mono, while capture devices usually run at 16kHz or 48kHz and
 * sometimes in stereo. Channels are averaged down to mono and the rate is changed with
 * linear interpolation.
 */
public final class PcmResampler {

    private PcmResampler() {
    }

    /**
     * Converts interleaved PCM16 to mono and resamples it.
     *
     * @param pcm      interleaved PCM16 data
     * @param fromRate source sample rate in Hz
     * @param channels source channel count
     * @param toRate   target sample rate in Hz
     * @return mono PCM16 at {@code toRate}; the input array itself when nothing needs converting
     */
    public static byte[] toMono(byte[] pcm, int fromRate, int channels, int toRate) {
        byte[] mono = channels > 1 ? downmix(pcm, channels) : pcm;
        return resample(mono, fromRate, toRate);
    }

    /**
     * Resamples mono PCM16 audio with linear interpolation between neighbouring samples.
     */
    public static byte[] resample(byte[] pcm, int fromRate, int toRate) {
        if (pcm == null || pcm.length == 0) {
            return new byte[0];
        }
        if (fromRate <= 0 || toRate <= 0) {
            throw new IllegalArgumentException("sample rates must be positive");
        }
        if (fromRate == toRate) {
            return pcm;
        }

        // Ensure we have complete samples (2 bytes per sample)
        int inSamples = pcm.length / 2;
        int outSamples = (int) ((long) inSamples * toRate / fromRate);
        byte[] out = new byte[outSamples * 2];

        double step = (double) fromRate / toRate;
        for (int i = 0; i < outSamples; i++) {
            double position = i * step;
            int index = (int) position;
            double fraction = position - index;

            short current = readSample(pcm, index);
            short next = index + 1 < inSamples ? readSample(pcm, index + 1) : current;
            short value = (short) Math.round(current + (next - current) * fraction);
            writeSample(out, i, value);
        }
        return out;
    }

    /**
     * Averages interleaved channels into one.
     */
    public static byte[] downmix(byte[] pcm, int channels) {
        if (channels <= 1) {
            return pcm;
        }
        int frames = pcm.length / (2 * channels);
        byte[] mono = new byte[frames * 2];
        for (int frame = 0; frame < frames; frame++) {
            int sum = 0;
            for (int ch = 0; ch < channels; ch++) {
                sum += readSample(pcm, frame * channels + ch);
            }
            writeSample(mono, frame, (short) (sum / channels));
        }
        return mono;
    }

    /**
     * Read a 16-bit sample from byte array (little-endian)
     */
    static short readSample(byte[] data, int sampleIndex) {
        int byteIndex = sampleIndex * 2;
        if (byteIndex + 1 >= data.length) {
            return 0; // Return silence if out of bounds
        }
        return (short) ((data[byteIndex] & 0xFF) | ((data[byteIndex + 1] & 0xFF) << 8));
    }

    /**
     * Write a 16-bit sample to byte array (little-endian)
     */
    static void writeSample(byte[] data, int sampleIndex, short sample) {
        int byteIndex = sampleIndex * 2;
        if (byteIndex + 1 < data.length) {
            data[byteIndex] = (byte) (sample & 0xFF);
            data[byteIndex + 1] = (byte) ((sample >> 8) & 0xFF);
        }
    }
}
