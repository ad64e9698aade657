/*
 * StreamFilter.java
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
import java.nio.channels.WritableByteChannel;

/**
 * Base class of the decoding filters.
 * <p>
 * A filter decodes whatever it is given, passes the result to the next
 * stage and keeps any incomplete input for the next write. Closing a
 * filter flushes it and closes the next stage.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class StreamFilter implements StreamConsumer {

    /** The next stage. */
    protected WritableByteChannel next;

    /** The filter's /DecodeParms entry, or null. */
    protected PDFDictionary params;

    private boolean open = true;

    public void setNext(WritableByteChannel next) {
        this.next = next;
    }

    /**
     * Sets the decode parameters. Subclasses read the entries they
     * understand.
     *
     * @param params the parameters dictionary, or null
     */
    public void setParams(PDFDictionary params) {
        this.params = params;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() throws IOException {
        if (!open) {
            return;
        }
        open = false;
        finish();
        if (next != null) {
            next.close();
        }
    }

    @Override
    public void reset() {
        open = true;
    }

    /**
     * Flushes buffered state at end of data. The default does nothing.
     *
     * @throws IOException if the remaining data cannot be decoded
     */
    protected void finish() throws IOException {
    }

    protected void emit(byte[] data, int off, int len) throws IOException {
        if (next != null && len > 0) {
            ByteBuffer buf = ByteBuffer.wrap(data, off, len);
            while (buf.hasRemaining()) {
                next.write(buf);
            }
        }
    }

    /**
     * Creates a filter by name, full or abbreviated.
     *
     * @param name the filter name, without a solidus
     * @return a new filter, or null if the filter is not supported
     */
    public static StreamFilter create(String name) {
        switch (name) {
            case "FlateDecode":
            case "Fl":
                return new FlateDecodeFilter();
            case "ASCIIHexDecode":
            case "AHx":
                return new ASCIIHexDecodeFilter();
            case "ASCII85Decode":
            case "A85":
                return new ASCII85DecodeFilter();
            case "LZWDecode":
            case "LZW":
                return new LZWDecodeFilter();
            case "RunLengthDecode":
            case "RL":
                return new RunLengthDecodeFilter();
            default:
                return null;
        }
    }

}
