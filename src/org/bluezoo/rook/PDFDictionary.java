/*
 * PDFDictionary.java
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

import java.util.ArrayList;
import java.util.List;

/**
 * A dictionary object, mapping names to objects.
 * <p>
 * Keys are matched byte for byte. Entries are kept in parallel arrays
 * and looked up linearly, which suits the small dictionaries typical of
 * PDF. Unused value slots hold a counted reference to the shared null,
 * as array slots do.
 * <p>
 * A dictionary followed by {@code stream} in the file is a stream: its
 * {@link #getStreamOffset stream offset} is the file position of the
 * first data byte and its {@link #getStreamLength stream length} the
 * number of data bytes, once verified against {@code endstream}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFDictionary extends PDFObject {

    private PDFName[] keys;
    private PDFObject[] values;
    private int size;
    private long streamOffset = -1L;
    private long streamLength = -1L;

    PDFDictionary(ObjectAllocator allocator, int capacity) {
        super(allocator);
        capacity = Math.max(capacity, 4);
        keys = new PDFName[capacity];
        values = new PDFObject[capacity];
        fillNull(0, capacity);
    }

    @Override
    public PDFObjectType getType() {
        return PDFObjectType.DICTIONARY;
    }

    public int size() {
        return size;
    }

    /**
     * Stores a value under a key, replacing any existing entry.
     * Both key and value are retained by the dictionary.
     *
     * @param key the key
     * @param value the value
     */
    public void put(PDFName key, PDFObject value) {
        value.retain();
        int i = indexOf(key);
        if (i >= 0) {
            PDFObject old = values[i];
            values[i] = value;
            old.release();
            return;
        }
        if (size == keys.length) {
            grow();
        }
        key.retain();
        PDFObject old = values[size];
        keys[size] = key;
        values[size] = value;
        size++;
        old.release();
    }

    /**
     * Stores a value under a key given as a string.
     *
     * @param key the key, without a solidus
     * @param value the value
     */
    public void put(String key, PDFObject value) {
        PDFName name = allocator.allocName(key);
        name.retain();
        try {
            put(name, value);
        } finally {
            name.release();
        }
    }

    /**
     * Returns the value stored under a key without resolving it.
     * The caller does not receive a counted reference.
     *
     * @param key the key, without a solidus
     * @return the value, or null if the key is absent
     */
    public PDFObject getNoDeref(String key) {
        int i = indexOf(key);
        return i < 0 ? null : values[i];
    }

    public PDFObject getNoDeref(PDFName key) {
        int i = indexOf(key);
        return i < 0 ? null : values[i];
    }

    public boolean knownNoDeref(String key) {
        return indexOf(key) >= 0;
    }

    /**
     * Removes an entry.
     *
     * @param key the key, without a solidus
     * @return true if an entry was removed
     */
    public boolean remove(String key) {
        int i = indexOf(key);
        if (i < 0) {
            return false;
        }
        PDFName oldKey = keys[i];
        PDFObject oldValue = values[i];
        System.arraycopy(keys, i + 1, keys, i, size - i - 1);
        System.arraycopy(values, i + 1, values, i, size - i - 1);
        size--;
        keys[size] = null;
        values[size] = allocator.getNull().retain();
        oldKey.release();
        oldValue.release();
        return true;
    }

    /**
     * Returns the keys in storage order. The caller does not receive
     * counted references.
     *
     * @return the keys
     */
    public List<PDFName> keys() {
        List<PDFName> list = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            list.add(keys[i]);
        }
        return list;
    }

    /**
     * Returns a direct integer entry, for parameter dictionaries whose
     * values are never indirect.
     *
     * @param key the key
     * @param defaultValue returned if the entry is absent or not a number
     * @return the integer value
     */
    public long getInteger(String key, long defaultValue) {
        PDFObject value = getNoDeref(key);
        if (value instanceof PDFNumber) {
            return ((PDFNumber) value).longValue();
        }
        return defaultValue;
    }

    /**
     * Returns whether a direct name entry has the given value.
     *
     * @param key the key
     * @param name the expected name
     * @return true if the entry is a name equal to {@code name}
     */
    public boolean isName(String key, String name) {
        PDFObject value = getNoDeref(key);
        return value instanceof PDFName && ((PDFName) value).is(name);
    }

    public boolean isStream() {
        return streamOffset >= 0L;
    }

    public long getStreamOffset() {
        return streamOffset;
    }

    void setStreamOffset(long streamOffset) {
        this.streamOffset = streamOffset;
    }

    public long getStreamLength() {
        return streamLength;
    }

    void setStreamLength(long streamLength) {
        this.streamLength = streamLength;
    }

    private int indexOf(String key) {
        for (int i = 0; i < size; i++) {
            if (PDFName.matches(keys[i].rawBytes(), key)) {
                return i;
            }
        }
        return -1;
    }

    private int indexOf(PDFName key) {
        for (int i = 0; i < size; i++) {
            if (keys[i].equals(key)) {
                return i;
            }
        }
        return -1;
    }

    private void grow() {
        int capacity = keys.length * 2;
        PDFName[] newKeys = new PDFName[capacity];
        PDFObject[] newValues = new PDFObject[capacity];
        System.arraycopy(keys, 0, newKeys, 0, size);
        System.arraycopy(values, 0, newValues, 0, keys.length);
        int oldCapacity = keys.length;
        keys = newKeys;
        values = newValues;
        fillNull(oldCapacity, capacity);
    }

    private void fillNull(int from, int to) {
        PDFNull nul = allocator.getNull();
        for (int i = from; i < to; i++) {
            values[i] = nul.retain();
        }
    }

    @Override
    void deallocate() {
        for (int i = 0; i < values.length; i++) {
            if (i < size) {
                keys[i].release();
                keys[i] = null;
            }
            PDFObject value = values[i];
            values[i] = null;
            value.release();
        }
        size = 0;
    }

    /**
     * Dictionaries compare structurally: the same keys bound to equal
     * values, in any order. Stream data is not compared.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PDFDictionary)) {
            return false;
        }
        PDFDictionary other = (PDFDictionary) obj;
        if (size != other.size) {
            return false;
        }
        for (int i = 0; i < size; i++) {
            PDFObject value = other.getNoDeref(keys[i]);
            if (value == null || !values[i].equals(value)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (int i = 0; i < size; i++) {
            h += keys[i].hashCode() ^ values[i].hashCode();
        }
        return h;
    }

}
