/*
 * CrossReferenceTable.java
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
 * The cross-reference table of a document.
 * <p>
 * Entries are kept in a flat array indexed by object number. A slot that
 * no xref section or repair scan has defined holds null. Every access is
 * checked against the table size; an object number outside it raises
 * {@link PDFRangeCheckException}.
 * <p>
 * The table is itself a counted object so that it shares the lifetime
 * rules of everything else the document holds.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CrossReferenceTable extends PDFObject {

    private CrossReferenceEntry[] entries;
    private int size;

    CrossReferenceTable(ObjectAllocator allocator, int size) {
        super(allocator);
        this.entries = new CrossReferenceEntry[Math.max(size, 1)];
        this.size = size;
    }

    @Override
    public PDFObjectType getType() {
        return PDFObjectType.XREF_TABLE;
    }

    public int size() {
        return size;
    }

    /**
     * Returns the entry for an object number.
     *
     * @param objectNumber the object number
     * @return the entry, or null if the slot was never defined
     * @throws PDFRangeCheckException if the number is outside the table
     */
    public CrossReferenceEntry lookup(int objectNumber) {
        checkRange(objectNumber);
        return entries[objectNumber];
    }

    /**
     * Enlarges the table. Shrinking is ignored.
     *
     * @param newSize the new number of slots
     */
    public void grow(int newSize) {
        if (newSize <= size) {
            return;
        }
        if (newSize > entries.length) {
            int capacity = Math.max(newSize, (int) Math.min(Integer.MAX_VALUE - 8L, entries.length * 2L));
            CrossReferenceEntry[] grown = new CrossReferenceEntry[capacity];
            System.arraycopy(entries, 0, grown, 0, size);
            entries = grown;
        }
        size = newSize;
    }

    /**
     * Sets the entry for its object number, replacing any existing one.
     *
     * @param entry the entry
     * @throws PDFRangeCheckException if the number is outside the table
     */
    public void setEntry(CrossReferenceEntry entry) {
        int objectNumber = entry.getObjectNumber();
        checkRange(objectNumber);
        CrossReferenceEntry old = entries[objectNumber];
        if (old != null && old.getCacheSlot() >= 0) {
            entry.setCacheSlot(old.getCacheSlot());
        }
        entries[objectNumber] = entry;
    }

    /**
     * Sets an entry only if its slot is undefined, growing the table if
     * needed. Sections are read newest first, so an older section must
     * not override what a newer one defined.
     *
     * @param entry the entry
     * @return true if the entry was stored
     */
    boolean setEntryIfAbsent(CrossReferenceEntry entry) {
        int objectNumber = entry.getObjectNumber();
        if (objectNumber >= size) {
            grow(objectNumber + 1);
        }
        if (entries[objectNumber] != null) {
            return false;
        }
        entries[objectNumber] = entry;
        return true;
    }

    private void checkRange(int objectNumber) {
        if (objectNumber < 0 || objectNumber >= size) {
            throw new PDFRangeCheckException("Unknown object " + objectNumber
                    + " (table size " + size + ")");
        }
    }

    @Override
    void deallocate() {
        entries = new CrossReferenceEntry[1];
        size = 0;
    }

}
