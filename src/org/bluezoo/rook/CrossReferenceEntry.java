/*
 * CrossReferenceEntry.java
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
 * An entry in the cross-reference table.
 * <p>
 * Each entry describes where an indirect object lives. Entries are one of
 * three types:
 * <ul>
 *   <li><b>Free</b> - the object has been deleted or is not in use</li>
 *   <li><b>In-use</b> - the object is at a byte offset in the file</li>
 *   <li><b>Compressed</b> - the object is a member of an object stream</li>
 * </ul>
 * An entry also remembers the cache slot holding its resolved object,
 * or -1 if it is not cached.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CrossReferenceEntry {

    public static final int TYPE_FREE = 0;
    public static final int TYPE_IN_USE = 1;
    public static final int TYPE_COMPRESSED = 2;

    private final int type;
    private final int objectNumber;
    private final long offsetOrStream;
    private final int generationOrIndex;
    private int cacheSlot = -1;

    public static CrossReferenceEntry free(int objectNumber, int generation) {
        return new CrossReferenceEntry(TYPE_FREE, objectNumber, 0L, generation);
    }

    /**
     * Creates an in-use entry.
     *
     * @param objectNumber the object number
     * @param offset the byte offset of {@code n g obj} in the file
     * @param generation the generation number
     * @return the entry
     */
    public static CrossReferenceEntry inUse(int objectNumber, long offset, int generation) {
        return new CrossReferenceEntry(TYPE_IN_USE, objectNumber, offset, generation);
    }

    /**
     * Creates a compressed entry.
     *
     * @param objectNumber the object number
     * @param streamNumber the object number of the containing object stream
     * @param index the index of the object within that stream
     * @return the entry
     */
    public static CrossReferenceEntry compressed(int objectNumber, int streamNumber, int index) {
        return new CrossReferenceEntry(TYPE_COMPRESSED, objectNumber, streamNumber, index);
    }

    private CrossReferenceEntry(int type, int objectNumber, long offsetOrStream, int generationOrIndex) {
        this.type = type;
        this.objectNumber = objectNumber;
        this.offsetOrStream = offsetOrStream;
        this.generationOrIndex = generationOrIndex;
    }

    public int getType() {
        return type;
    }

    public int getObjectNumber() {
        return objectNumber;
    }

    public boolean isFree() {
        return type == TYPE_FREE;
    }

    public boolean isInUse() {
        return type == TYPE_IN_USE;
    }

    public boolean isCompressed() {
        return type == TYPE_COMPRESSED;
    }

    /**
     * Returns the byte offset of the object.
     *
     * @return the byte offset
     * @throws IllegalStateException if not an in-use entry
     */
    public long getOffset() {
        if (type != TYPE_IN_USE) {
            throw new IllegalStateException("Not an in-use entry");
        }
        return offsetOrStream;
    }

    /**
     * Returns the generation number. Compressed objects always have
     * generation 0.
     *
     * @return the generation number
     */
    public int getGeneration() {
        return type == TYPE_COMPRESSED ? 0 : generationOrIndex;
    }

    /**
     * Returns the object number of the containing object stream.
     *
     * @return the object stream number
     * @throws IllegalStateException if not a compressed entry
     */
    public int getObjectStreamNumber() {
        if (type != TYPE_COMPRESSED) {
            throw new IllegalStateException("Not a compressed entry");
        }
        return (int) offsetOrStream;
    }

    /**
     * Returns the index of this object within its object stream.
     *
     * @return the index in the stream
     * @throws IllegalStateException if not a compressed entry
     */
    public int getIndexInStream() {
        if (type != TYPE_COMPRESSED) {
            throw new IllegalStateException("Not a compressed entry");
        }
        return generationOrIndex;
    }

    int getCacheSlot() {
        return cacheSlot;
    }

    void setCacheSlot(int cacheSlot) {
        this.cacheSlot = cacheSlot;
    }

    @Override
    public String toString() {
        switch (type) {
            case TYPE_FREE:
                return objectNumber + ": free(gen=" + generationOrIndex + ")";
            case TYPE_IN_USE:
                return objectNumber + ": inUse(offset=" + offsetOrStream + ", gen=" + generationOrIndex + ")";
            default:
                return objectNumber + ": compressed(stream=" + offsetOrStream + ", index=" + generationOrIndex + ")";
        }
    }

}
