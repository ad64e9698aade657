/*
 * ObjectAllocator.java
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

import java.nio.charset.StandardCharsets;

/**
 * Creates objects for one document.
 * <p>
 * Every object is created with a reference count of zero and must be
 * retained by whoever keeps it. The allocator counts objects created and
 * freed, so a caller can check that an object graph was fully released:
 * {@link #liveCount} returns to its earlier value once every reference
 * taken has been dropped.
 * <p>
 * The allocator owns one shared {@link PDFNull}. It holds a permanent
 * reference to it and does not include it in the live count.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ObjectAllocator {

    private final PDFNull nullObject;
    private long allocated;
    private long freed;

    public ObjectAllocator() {
        nullObject = new PDFNull(this);
        nullObject.retain();
    }

    /**
     * Returns the number of objects created and not yet freed.
     *
     * @return the live object count
     */
    public long liveCount() {
        return allocated - freed;
    }

    /**
     * Returns the shared null object, uncounted.
     *
     * @return the null object
     */
    public PDFNull getNull() {
        return nullObject;
    }

    public PDFBoolean allocBoolean(boolean value) {
        return track(new PDFBoolean(this, value));
    }

    public PDFInteger allocInteger(long value) {
        return track(new PDFInteger(this, value));
    }

    public PDFReal allocReal(double value) {
        return track(new PDFReal(this, value));
    }

    public PDFName allocName(byte[] bytes) {
        return track(new PDFName(this, bytes));
    }

    public PDFName allocName(String value) {
        return allocName(value.getBytes(StandardCharsets.ISO_8859_1));
    }

    public PDFString allocString(byte[] bytes) {
        return track(new PDFString(this, bytes));
    }

    /**
     * Creates an array of the given size with every slot holding null.
     *
     * @param size the number of slots
     * @return the array
     */
    public PDFArray allocArray(int size) {
        return track(new PDFArray(this, size));
    }

    /**
     * Creates an empty dictionary.
     *
     * @param capacity the expected number of entries
     * @return the dictionary
     */
    public PDFDictionary allocDictionary(int capacity) {
        return track(new PDFDictionary(this, capacity));
    }

    public PDFIndirectReference allocReference(int objectNumber, int generation) {
        return track(new PDFIndirectReference(this, objectNumber, generation));
    }

    public PDFKeyword allocKeyword(PDFKeyword.Keyword keyword, byte[] text) {
        return track(new PDFKeyword(this, keyword, text));
    }

    /**
     * Creates an empty cross-reference table.
     *
     * @param size the initial number of object slots
     * @return the table
     */
    public CrossReferenceTable allocXRef(int size) {
        return track(new CrossReferenceTable(this, size));
    }

    PDFMark allocMark(PDFObjectType type) {
        return track(new PDFMark(this, type));
    }

    private <T extends PDFObject> T track(T obj) {
        allocated++;
        return obj;
    }

    void freed(PDFObject obj) {
        if (obj != nullObject) {
            freed++;
        }
    }

}
