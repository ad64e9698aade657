/*
 * RepairScanner.java
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
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans a file from front to back for {@code n g obj} headers.
 * <p>
 * This is used when the cross-reference data cannot be trusted. The
 * scanner works on whitespace-separated words without building objects,
 * remembering the last two numeric words so that when {@code obj} is
 * seen the object number, generation and start offset are known.
 * Strings, hex strings and comments are skipped so that text inside
 * them cannot look like a header, and stream data is skipped by
 * searching for {@code endstream}. The offset following each
 * {@code trailer} keyword is remembered as well.
 * <p>
 * The scanner keeps its own position and seeks the source before each
 * step, so it may be interleaved with other reads of the same source.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class RepairScanner implements Iterator<RepairScanner.Discovery> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RepairScanner.class);

    private static final int MAX_WORD = 16;

    enum State {
        SEEK_OBJ,
        IN_OBJECT,
        IN_STREAM,
        SEEK_ENDOBJ,
        DONE
    }

    /**
     * An object header found by the scanner.
     */
    static final class Discovery {

        private final int objectNumber;
        private final int generation;
        private final long offset;

        Discovery(int objectNumber, int generation, long offset) {
            this.objectNumber = objectNumber;
            this.generation = generation;
            this.offset = offset;
        }

        int getObjectNumber() {
            return objectNumber;
        }

        int getGeneration() {
            return generation;
        }

        long getOffset() {
            return offset;
        }

        @Override
        public String toString() {
            return objectNumber + " " + generation + " obj @" + offset;
        }

    }

    private final PDFSource source;
    private final List<Long> trailerOffsets = new ArrayList<>();
    private final byte[] word = new byte[MAX_WORD];
    private State state = State.SEEK_OBJ;
    private long position;
    private Discovery pending;

    // the two most recent numeric words, older first
    private long olderValue = -1L;
    private long olderOffset = -1L;
    private long newerValue = -1L;
    private long newerOffset = -1L;
    private long wordOffset;

    RepairScanner(PDFSource source, long start) {
        this.source = source;
        this.position = start;
    }

    State getState() {
        return state;
    }

    /**
     * Returns the offsets just past each {@code trailer} keyword seen
     * so far, in file order.
     */
    List<Long> getTrailerOffsets() {
        return Collections.unmodifiableList(trailerOffsets);
    }

    @Override
    public boolean hasNext() {
        try {
            scan();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return pending != null;
    }

    @Override
    public Discovery next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Discovery d = pending;
        pending = null;
        return d;
    }

    private void scan() throws IOException {
        while (pending == null && state != State.DONE) {
            if (state == State.IN_STREAM) {
                source.seek(position);
                long end = source.find(ObjectParser.ENDSTREAM, source.size());
                if (end < 0L) {
                    state = State.DONE;
                } else {
                    position = source.position();
                    state = State.SEEK_ENDOBJ;
                }
                forgetNumbers();
                continue;
            }
            int length = nextWord();
            if (length < 0) {
                state = State.DONE;
                continue;
            }
            if (length == 0) {
                forgetNumbers();
                continue;
            }
            long value = numberValue(length);
            if (value >= 0L) {
                olderValue = newerValue;
                olderOffset = newerOffset;
                newerValue = value;
                newerOffset = wordOffset;
                continue;
            }
            if (isWord(length, "obj")) {
                if (olderValue > 0L && olderValue <= PDFDocument.MAX_OBJECT_NUMBER
                        && newerValue >= 0L && newerValue <= 65535L) {
                    if (state == State.IN_OBJECT) {
                        LOGGER.debug("Object before {} has no endobj", olderValue);
                    }
                    pending = new Discovery((int) olderValue, (int) newerValue, olderOffset);
                    state = State.IN_OBJECT;
                }
            } else if (isWord(length, "endobj")) {
                state = State.SEEK_OBJ;
            } else if (isWord(length, "stream")) {
                state = State.IN_STREAM;
            } else if (isWord(length, "trailer")) {
                trailerOffsets.add(position);
                state = State.SEEK_OBJ;
            }
            forgetNumbers();
        }
    }

    private void forgetNumbers() {
        olderValue = -1L;
        olderOffset = -1L;
        newerValue = -1L;
        newerOffset = -1L;
    }

    /**
     * Reads the next regular word into the buffer.
     *
     * @return the word length, 0 if a delimited construct was skipped,
     *         or -1 at end of file
     */
    private int nextWord() throws IOException {
        source.seek(position);
        try {
            source.skipWhitespace();
            wordOffset = source.position();
            int c = source.read();
            switch (c) {
                case -1:
                    return -1;
                case '%':
                    while ((c = source.read()) != -1 && c != '\n' && c != '\r') {
                        // comment
                    }
                    return 0;
                case '(':
                    skipLiteralString();
                    return 0;
                case '<':
                    if (source.peek() == '<') {
                        source.read();
                    } else {
                        while ((c = source.read()) != -1 && c != '>') {
                            // hex string
                        }
                    }
                    return 0;
                case '/':
                    while (PDFSource.isRegular(source.peek())) {
                        source.read();
                    }
                    return 0;
                default:
                    if (!PDFSource.isRegular(c)) {
                        return 0;
                    }
            }
            int length = 0;
            word[length++] = (byte) c;
            while (PDFSource.isRegular(source.peek())) {
                c = source.read();
                if (length < MAX_WORD) {
                    word[length] = (byte) c;
                }
                length++;
            }
            return length;
        } finally {
            position = source.position();
        }
    }

    private void skipLiteralString() throws IOException {
        int depth = 1;
        int c;
        while ((c = source.read()) != -1) {
            if (c == '\\') {
                source.read();
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return;
            }
        }
    }

    private long numberValue(int length) {
        if (length > 10) {
            return -1L;
        }
        long value = 0L;
        for (int i = 0; i < length; i++) {
            int c = word[i];
            if (c < '0' || c > '9') {
                return -1L;
            }
            value = value * 10 + (c - '0');
        }
        return value;
    }

    private boolean isWord(int length, String text) {
        if (length != text.length()) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (word[i] != text.charAt(i)) {
                return false;
            }
        }
        return true;
    }

}
