/*
 * PDFObject.java
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
 * Base class of every object in the document model.
 * <p>
 * Objects are reference counted. An object is created by an
 * {@link ObjectAllocator} with a count of zero; whoever keeps it must
 * {@link #retain} it, and every retain is balanced by exactly one
 * {@link #release}. When the count returns to zero the object is freed
 * and any children it owns are released in turn. Releasing an object
 * that is already free is a programming error and raises
 * {@link IllegalStateException}, as does retaining one.
 * <p>
 * {@link #close} is equivalent to {@link #release}, so a counted
 * reference can be held in a try-with-resources block:
 * <pre>
 * try (PDFObject obj = document.dereference(5, 0)) {
 *     ...
 * }
 * </pre>
 * <p>
 * The object and generation numbers are zero unless the object was read
 * from a numbered location in the file.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class PDFObject implements AutoCloseable {

    final ObjectAllocator allocator;
    private int refCount;
    private boolean freed;
    private int objectNumber;
    private int generationNumber;

    PDFObject(ObjectAllocator allocator) {
        this.allocator = allocator;
    }

    /**
     * Returns the variant of this object.
     *
     * @return the object type
     */
    public abstract PDFObjectType getType();

    /**
     * Adds a counted reference to this object.
     *
     * @return this object
     * @throws IllegalStateException if the object has been freed
     */
    public PDFObject retain() {
        if (freed) {
            throw new IllegalStateException("Retain of freed " + getType() + " object");
        }
        refCount++;
        return this;
    }

    /**
     * Drops a counted reference to this object, freeing it when no
     * references remain.
     *
     * @throws IllegalStateException if the object holds no references
     */
    public void release() {
        if (freed || refCount <= 0) {
            throw new IllegalStateException("Release of unreferenced " + getType() + " object");
        }
        if (--refCount == 0) {
            freed = true;
            allocator.freed(this);
            deallocate();
        }
    }

    @Override
    public void close() {
        release();
    }

    /**
     * Returns the current reference count.
     *
     * @return the number of counted references
     */
    public int refCount() {
        return refCount;
    }

    /**
     * Returns whether this object has been freed.
     *
     * @return true once the reference count has returned to zero
     */
    public boolean isFreed() {
        return freed;
    }

    /**
     * Releases owned children. Called exactly once, when the count
     * reaches zero.
     */
    void deallocate() {
    }

    public int getObjectNumber() {
        return objectNumber;
    }

    public int getGenerationNumber() {
        return generationNumber;
    }

    /**
     * Binds this object to an xref location.
     */
    void bind(int objectNumber, int generationNumber) {
        this.objectNumber = objectNumber;
        this.generationNumber = generationNumber;
    }

    /**
     * Returns the serialized PDF form of this object.
     *
     * @return the object in PDF token syntax
     */
    @Override
    public String toString() {
        return PDFObjectWriter.toString(this);
    }

}
