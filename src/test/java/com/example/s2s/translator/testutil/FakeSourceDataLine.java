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

package com.example.s2s.translator.testutil;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.SourceDataLine;
import java.io.ByteArrayOutputStream;

/**
 * Output line that records everything written to it.
 */
public class FakeSourceDataLine extends FakeDataLine implements SourceDataLine {

    private final ByteArrayOutputStream written = new ByteArrayOutputStream();
    public volatile RuntimeException failWriteWith;

    public FakeSourceDataLine(AudioFormat format) {
        super(format);
    }

    public synchronized byte[] written() {
        return written.toByteArray();
    }

    @Override
    public void open(AudioFormat format, int bufferSize) {
        open = true;
    }

    @Override
    public void open(AudioFormat format) {
        open = true;
    }

    @Override
    public int write(byte[] b, int off, int len) {
        RuntimeException failure = failWriteWith;
        if (failure != null) {
            throw failure;
        }
        synchronized (this) {
            written.write(b, off, len);
        }
        return len;
    }
}
