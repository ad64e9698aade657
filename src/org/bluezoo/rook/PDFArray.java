/*
 * PDFArray.java
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

/**
 * An array object.
 * <p>
 * Every slot always holds a counted reference to a valid object: a new
 * array is filled with the allocator's shared null, and {@link #put}
 * releases the previous occupant. Elements are returned without being
 * resolved; use {@link PDFDocument#arrayGet} to dereference an element.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFArray extends PDFObject {

    private PDFObject[] values;
    private int size;

    PDFArray(ObjectAllocator allocator, int size) {
        super(allocator);
        values = new PDFObject[Math.max(size, 4)];
        PDFNull nul = allocator.getNull();
        for (int i = 0; i < size; i++) {
            values[i] = nul.retain();
        }
        this.size = size;
    }

    @Override
    public PDFObjectType getType() {
        return PDFObjectType.ARRAY;
    }

    public int size() {
        return size;
    }

    /**
     * Replaces the element at the given index. The new value is retained
     * by the array and the old one released.
     *
     * @param index the slot to replace
     * @param value the new element
     * @throws PDFRangeCheckException if index is out of range
     */
    public void put(int index, PDFObject value) {
        checkIndex(index);
        value.retain();
        PDFObject old = values[index];
        values[index] = value;
        old.release();
    }

    /**
     * Appends an element, retaining it.
     *
     * @param value the element to append
     */
    public void add(PDFObject value) {
        if (size == values.length) {
            PDFObject[] grown = new PDFObject[values.length * 2];
            System.arraycopy(values, 0, grown, 0, size);
            values = grown;
        }
        values[size++] = value.retain();
    }

    /**
     * Returns the element at the given index without resolving it.
     * The caller does not receive a counted reference.
     *
     * @param index the element index
     * @return the element, possibly an indirect reference
     * @throws PDFRangeCheckException if index is out of range
     */
    public PDFObject getNoDeref(int index) {
        checkIndex(index);
        return values[index];
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new PDFRangeCheckException("Array index " + index + " not in [0, " + size + ")");
        }
    }

    @Override
    void deallocate() {
        for (int i = 0; i < size; i++) {
            PDFObject value = values[i];
            values[i] = null;
            value.release();
        }
        size = 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PDFArray)) {
            return false;
        }
        PDFArray other = (PDFArray) obj;
        if (size != other.size) {
            return false;
        }
        for (int i = 0; i < size; i++) {
            if (!values[i].equals(other.values[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (int i = 0; i < size; i++) {
            h = 31 * h + values[i].hashCode();
        }
        return h;
    }

}
