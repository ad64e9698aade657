/*
 * PDFSource.java
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

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;

/**
 * Buffered, seekable byte input for the token reader.
 * <p>
 * A source reads either from a {@link SeekableByteChannel}, through an
 * internal buffer, or directly from a byte buffer already in memory
 * (the decoded data of an object stream). Single bytes can be pushed
 * back with {@link #unread}, which is how the lexer disambiguates
 * {@code <} from {@code <<} and finds the end of a token.
 * <p>
 * All positions are absolute offsets from the start of the input.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFSource implements Closeable {

    private static final int BUFFER_SIZE = 8192;

    private final SeekableByteChannel channel;
    private final long size;
    private ByteBuffer buffer;
    private long bufferOffset;

    private PDFSource(SeekableByteChannel channel) throws IOException {
        this.channel = channel;
        this.size = channel.size();
        this.buffer = ByteBuffer.allocate(BUFFER_SIZE);
        buffer.limit(0);
        this.bufferOffset = 0L;
    }

    private PDFSource(ByteBuffer data) {
        this.channel = null;
        this.buffer = data.slice();
        this.size = buffer.limit();
        this.bufferOffset = 0L;
    }

    /**
     * Creates a source reading from a channel. The channel is closed
     * when the source is closed.
     *
     * @param channel the channel
     * @return the source
     * @throws IOException if the channel size cannot be determined
     */
    public static PDFSource open(SeekableByteChannel channel) throws IOException {
        return new PDFSource(channel);
    }

    /**
     * Creates a source over the remaining bytes of a buffer. Offset 0 of
     * the source is the buffer's current position.
     *
     * @param data the data
     * @return the source
     */
    public static PDFSource wrap(ByteBuffer data) {
        return new PDFSource(data);
    }

    public long size() {
        return size;
    }

    public long position() {
        return bufferOffset + buffer.position();
    }

    /**
     * Moves to an absolute position. Positions past the end are allowed
     * and read as end of input.
     *
     * @param pos the new position
     */
    public void seek(long pos) {
        if (pos < 0L) {
            throw new PDFRangeCheckException("Negative seek position " + pos);
        }
        if (pos >= bufferOffset && pos <= bufferOffset + buffer.limit()) {
            buffer.position((int) (pos - bufferOffset));
        } else if (channel == null) {
            buffer.position(buffer.limit());
        } else {
            bufferOffset = pos;
            buffer.clear();
            buffer.limit(0);
        }
    }

    /**
     * Reads one byte.
     *
     * @return the byte, or -1 at end of input
     * @throws IOException if the channel cannot be read
     */
    public int read() throws IOException {
        if (!buffer.hasRemaining() && !refill()) {
            return -1;
        }
        return buffer.get() & 0xff;
    }

    /**
     * Returns the next byte without consuming it.
     *
     * @return the byte, or -1 at end of input
     * @throws IOException if the channel cannot be read
     */
    public int peek() throws IOException {
        if (!buffer.hasRemaining() && !refill()) {
            return -1;
        }
        return buffer.get(buffer.position()) & 0xff;
    }

    /**
     * Steps back one byte.
     */
    public void unread() {
        long pos = position();
        if (pos == 0L) {
            throw new IllegalStateException("Unread at start of input");
        }
        if (buffer.position() > 0) {
            buffer.position(buffer.position() - 1);
        } else {
            seek(pos - 1);
        }
    }

    /**
     * Reads up to {@code len} bytes.
     *
     * @param dst the destination
     * @param off the offset in dst
     * @param len the maximum number of bytes
     * @return the number of bytes read, or -1 at end of input
     * @throws IOException if the channel cannot be read
     */
    public int read(byte[] dst, int off, int len) throws IOException {
        int total = 0;
        while (total < len) {
            if (!buffer.hasRemaining() && !refill()) {
                break;
            }
            int n = Math.min(buffer.remaining(), len - total);
            buffer.get(dst, off + total, n);
            total += n;
        }
        return (total == 0 && len > 0) ? -1 : total;
    }

    /**
     * Skips PDF whitespace.
     *
     * @throws IOException if the channel cannot be read
     */
    public void skipWhitespace() throws IOException {
        int c;
        while ((c = peek()) != -1 && isWhitespace(c)) {
            read();
        }
    }

    /**
     * Consumes the given bytes if they come next. On a mismatch the
     * position is left unchanged.
     *
     * @param expected the bytes to match
     * @return true if matched and consumed
     * @throws IOException if the channel cannot be read
     */
    public boolean matches(byte[] expected) throws IOException {
        long start = position();
        for (byte b : expected) {
            if (read() != (b & 0xff)) {
                seek(start);
                return false;
            }
        }
        return true;
    }

    /**
     * Searches forward for a byte pattern, from the current position up
     * to {@code limit}. On success the position is left just after the
     * match; otherwise at {@code limit} or the end of input.
     *
     * @param pattern the bytes to find
     * @param limit the position at which to stop searching
     * @return the offset of the first byte of the match, or -1
     * @throws IOException if the channel cannot be read
     */
    public long find(byte[] pattern, long limit) throws IOException {
        int[] failure = failureTable(pattern);
        int matched = 0;
        while (position() < limit) {
            int c = read();
            if (c == -1) {
                break;
            }
            while (matched > 0 && (pattern[matched] & 0xff) != c) {
                matched = failure[matched - 1];
            }
            if ((pattern[matched] & 0xff) == c) {
                matched++;
            }
            if (matched == pattern.length) {
                return position() - pattern.length;
            }
        }
        return -1L;
    }

    private static int[] failureTable(byte[] pattern) {
        int[] failure = new int[pattern.length];
        int k = 0;
        for (int i = 1; i < pattern.length; i++) {
            while (k > 0 && pattern[k] != pattern[i]) {
                k = failure[k - 1];
            }
            if (pattern[k] == pattern[i]) {
                k++;
            }
            failure[i] = k;
        }
        return failure;
    }

    private boolean refill() throws IOException {
        if (channel == null) {
            return false;
        }
        bufferOffset += buffer.limit();
        if (bufferOffset >= size) {
            buffer.clear();
            buffer.limit(0);
            return false;
        }
        buffer.clear();
        channel.position(bufferOffset);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) <= 0) {
                break;
            }
        }
        buffer.flip();
        return buffer.hasRemaining();
    }

    @Override
    public void close() throws IOException {
        if (channel != null) {
            channel.close();
        }
    }

    /**
     * PDF whitespace: NUL, tab, line feed, form feed, carriage return
     * and space.
     */
    public static boolean isWhitespace(int c) {
        return c == 0 || c == 9 || c == 10 || c == 12 || c == 13 || c == 32;
    }

    public static boolean isDelimiter(int c) {
        switch (c) {
            case '(':
            case ')':
            case '<':
            case '>':
            case '[':
            case ']':
            case '{':
            case '}':
            case '/':
            case '%':
                return true;
            default:
                return false;
        }
    }

    public static boolean isRegular(int c) {
        return c != -1 && !isWhitespace(c) && !isDelimiter(c);
    }

}
