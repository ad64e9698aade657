/*
 * LZWDecodeFilter.java
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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * LZWDecode, with codes from 9 to 12 bits. The {@code /EarlyChange}
 * parameter (default 1) selects whether the code width grows one code
 * early, as most PDF producers write it.
 * <p>
 * The string table is held as prefix links: entry i is the string of
 * entry {@code prefix[i]} followed by the byte {@code suffix[i]}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LZWDecodeFilter extends StreamFilter {

    private static final int CLEAR = 256;
    private static final int EOD = 257;
    private static final int TABLE_SIZE = 4096;

    private final int[] prefix = new int[TABLE_SIZE];
    private final byte[] suffix = new byte[TABLE_SIZE];
    private final int[] length = new int[TABLE_SIZE];
    private final byte[] scratch = new byte[TABLE_SIZE];
    private int early = 1;
    private int nextCode;
    private int width;
    private int previous;
    private int bits;
    private int bitCount;
    private boolean ended;

    public LZWDecodeFilter() {
        for (int i = 0; i < 256; i++) {
            prefix[i] = -1;
            suffix[i] = (byte) i;
            length[i] = 1;
        }
        clearTable();
    }

    @Override
    public void setParams(PDFDictionary params) {
        super.setParams(params);
        if (params != null) {
            early = params.getInteger("EarlyChange", 1) != 0 ? 1 : 0;
        }
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        int consumed = src.remaining();
        ByteArrayOutputStream out = new ByteArrayOutputStream(consumed * 3);
        while (!ended) {
            while (bitCount < width && src.hasRemaining()) {
                bits = (bits << 8) | (src.get() & 0xff);
                bitCount += 8;
            }
            if (bitCount < width) {
                break;
            }
            int code = (bits >>> (bitCount - width)) & ((1 << width) - 1);
            bitCount -= width;
            bits &= (1 << bitCount) - 1;
            decode(code, out);
        }
        src.position(src.limit());
        byte[] data = out.toByteArray();
        emit(data, 0, data.length);
        return consumed;
    }

    private void decode(int code, ByteArrayOutputStream out) throws IOException {
        if (code == EOD) {
            ended = true;
            return;
        }
        if (code == CLEAR) {
            clearTable();
            return;
        }
        int first;
        if (code < nextCode) {
            first = writeString(code, out);
        } else if (code == nextCode && previous >= 0) {
            first = writeString(previous, out);
            out.write(first);
        } else {
            throw new IOException("LZWDecode: invalid code " + code);
        }
        if (previous >= 0 && nextCode < TABLE_SIZE) {
            prefix[nextCode] = previous;
            suffix[nextCode] = (byte) first;
            length[nextCode] = length[previous] + 1;
            nextCode++;
            if (nextCode + early >= (1 << width) && width < 12) {
                width++;
            }
        }
        previous = code;
    }

    /**
     * Writes the string for a code and returns its first byte.
     */
    private int writeString(int code, ByteArrayOutputStream out) {
        int len = length[code];
        for (int i = len - 1, c = code; i >= 0; i--, c = prefix[c]) {
            scratch[i] = suffix[c];
        }
        out.write(scratch, 0, len);
        return scratch[0] & 0xff;
    }

    private void clearTable() {
        nextCode = 258;
        width = 9;
        previous = -1;
    }

    @Override
    public void reset() {
        super.reset();
        clearTable();
        bits = 0;
        bitCount = 0;
        ended = false;
    }

}
