/*
 * ByteBufferCollector.java
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

import java.nio.ByteBuffer;

/**
 * Final pipeline stage collecting decoded data in a growable heap buffer.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ByteBufferCollector implements StreamConsumer {

    private ByteBuffer buffer;
    private final int initialCapacity;
    private boolean open = true;

    public ByteBufferCollector() {
        this(8192);
    }

    /**
     * @param initialCapacity the expected decoded size
     */
    public ByteBufferCollector(int initialCapacity) {
        this.initialCapacity = Math.max(initialCapacity, 16);
        this.buffer = ByteBuffer.allocate(this.initialCapacity);
    }

    @Override
    public int write(ByteBuffer src) {
        int n = src.remaining();
        if (buffer.remaining() < n) {
            long needed = (long) buffer.position() + n;
            long capacity = Math.max(needed, buffer.capacity() * 2L);
            if (capacity > Integer.MAX_VALUE - 8) {
                throw new PDFRangeCheckException("Decoded stream too large");
            }
            ByteBuffer grown = ByteBuffer.allocate((int) capacity);
            buffer.flip();
            grown.put(buffer);
            buffer = grown;
        }
        buffer.put(src);
        return n;
    }

    @Override
    public void close() {
        open = false;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void reset() {
        buffer = ByteBuffer.allocate(initialCapacity);
        open = true;
    }

    /**
     * Returns a read-only view of the data collected so far, positioned
     * at its start.
     *
     * @return the collected data
     */
    public ByteBuffer toByteBuffer() {
        ByteBuffer out = buffer.duplicate();
        out.flip();
        return out.asReadOnlyBuffer();
    }

}
