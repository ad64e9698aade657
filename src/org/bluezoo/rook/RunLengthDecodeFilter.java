/*
 * RunLengthDecodeFilter.java
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
 * RunLengthDecode. A length byte n of 0 to 127 is followed by n+1
 * literal bytes; 129 to 255 by one byte repeated 257-n times; 128 ends
 * the data.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RunLengthDecodeFilter extends StreamFilter {

    private int literal;
    private int repeat;
    private boolean ended;

    @Override
    public int write(ByteBuffer src) throws IOException {
        int consumed = src.remaining();
        ByteArrayOutputStream out = new ByteArrayOutputStream(consumed * 2);
        while (src.hasRemaining() && !ended) {
            int b = src.get() & 0xff;
            if (literal > 0) {
                out.write(b);
                literal--;
            } else if (repeat > 0) {
                for (int i = 0; i < repeat; i++) {
                    out.write(b);
                }
                repeat = 0;
            } else if (b < 128) {
                literal = b + 1;
            } else if (b > 128) {
                repeat = 257 - b;
            } else {
                ended = true;
            }
        }
        src.position(src.limit());
        byte[] data = out.toByteArray();
        emit(data, 0, data.length);
        return consumed;
    }

    @Override
    public void reset() {
        super.reset();
        literal = 0;
        repeat = 0;
        ended = false;
    }

}
