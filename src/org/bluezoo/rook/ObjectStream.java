/*
 * ObjectStream.java
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
 * The decoded contents of an object stream.
 * <p>
 * An object stream holds N objects stored back to back. Its data starts
 * with N pairs of integers, each giving a member's object number and its
 * offset relative to the first object (the {@code /First} value).
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class ObjectStream {

    private final int streamNumber;
    private final ByteBuffer decoded;
    private final int first;
    private final int[] objectNumbers;
    private final int[] offsets;

    /**
     * @param streamNumber the object number of the stream
     * @param decoded the decoded data
     * @param first the /First value
     * @param objectNumbers member object numbers, by index
     * @param offsets member offsets relative to first, by index
     */
    ObjectStream(int streamNumber, ByteBuffer decoded, int first, int[] objectNumbers, int[] offsets) {
        this.streamNumber = streamNumber;
        this.decoded = decoded.duplicate();
        this.first = first;
        this.objectNumbers = objectNumbers;
        this.offsets = offsets;
    }

    int getStreamNumber() {
        return streamNumber;
    }

    int getObjectCount() {
        return objectNumbers.length;
    }

    int getObjectNumber(int index) {
        checkIndex(index);
        return objectNumbers[index];
    }

    /**
     * Returns the index of a member by object number.
     *
     * @return the index, or -1
     */
    int indexOf(int objectNumber) {
        for (int i = 0; i < objectNumbers.length; i++) {
            if (objectNumbers[i] == objectNumber) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the offset in the decoded data at which a member starts.
     */
    long getObjectStartOffset(int index) {
        checkIndex(index);
        return (long) first + offsets[index];
    }

    /**
     * Returns a new source over the decoded data.
     */
    PDFSource open() {
        return PDFSource.wrap(decoded.duplicate());
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= objectNumbers.length) {
            throw new PDFRangeCheckException("Index " + index + " not in object stream "
                    + streamNumber + " of " + objectNumbers.length + " objects");
        }
    }

}
