/*
 * ASCII85DecodeFilter.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of Rook, a PDF object model and resolution engine.
 *
 * Rook is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Rook is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Rook.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.rook;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * ASCII85Decode: each group of five characters from {@code !} to
 * {@code u} encodes four bytes, {@code z} stands for four zero bytes and
 * {@code ~>} ends the data. A final partial group of n characters
 * yields n-1 bytes.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ASCII85DecodeFilter extends StreamFilter {

    private long group;
    private int count;
    private boolean tilde;
    private boolean ended;

    @Override
    public int write(ByteBuffer src) throws IOException {
        int consumed = src.remaining();
        byte[] out = new byte[(consumed / 5 + 1) * 4 + consumed * 4];
        int n = 0;
        while (src.hasRemaining() && !ended) {
            int c = src.get() & 0xff;
            if (tilde) {
                tilde = false;
                if (c == '>') {
                    ended = true;
                    break;
                }
            }
            if (c == '~') {
                tilde = true;
            } else if (c == 'z' && count == 0) {
                n += 4;
            } else if (c >= '!' && c <= 'u') {
                group = group * 85 + (c - '!');
                if (++count == 5) {
                    n = put(out, n, group, 4);
                    group = 0;
                    count = 0;
                }
            } else if (!PDFSource.isWhitespace(c)) {
                throw new IOException("ASCII85Decode: invalid character " + c);
            }
        }
        src.position(src.limit());
        emit(out, 0, n);
        return consumed;
    }

    @Override
    protected void finish() throws IOException {
        if (count > 1) {
            int bytes = count - 1;
            long value = group;
            for (int i = count; i < 5; i++) {
                value = value * 85 + 84;
            }
            byte[] out = new byte[4];
            put(out, 0, value, 4);
            emit(out, 0, bytes);
        }
        group = 0;
        count = 0;
    }

    private static int put(byte[] out, int n, long value, int len) {
        for (int shift = 24; len > 0; shift -= 8, len--) {
            out[n++] = (byte) (value >>> shift);
        }
        return n;
    }

    @Override
    public void reset() {
        super.reset();
        group = 0;
        count = 0;
        tilde = false;
        ended = false;
    }

}
