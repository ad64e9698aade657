/*
 * ASCIIHexDecodeFilter.java
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
 * ASCIIHexDecode: pairs of hexadecimal digits, whitespace ignored,
 * terminated by {@code >}. A final odd digit is the high nibble of the
 * last byte.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ASCIIHexDecodeFilter extends StreamFilter {

    private int high = -1;
    private boolean ended;

    @Override
    public int write(ByteBuffer src) throws IOException {
        int consumed = src.remaining();
        byte[] out = new byte[consumed / 2 + 1];
        int n = 0;
        while (src.hasRemaining() && !ended) {
            int c = src.get() & 0xff;
            if (c == '>') {
                ended = true;
                break;
            }
            int v = PDFTokenReader.hexValue(c);
            if (v < 0) {
                continue;
            }
            if (high < 0) {
                high = v;
            } else {
                out[n++] = (byte) ((high << 4) | v);
                high = -1;
            }
        }
        src.position(src.limit());
        emit(out, 0, n);
        return consumed;
    }

    @Override
    protected void finish() throws IOException {
        if (high >= 0) {
            emit(new byte[] { (byte) (high << 4) }, 0, 1);
            high = -1;
        }
    }

    @Override
    public void reset() {
        super.reset();
        high = -1;
        ended = false;
    }

}
