/*
 * PDFIndirectReference.java
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
 * An indirect reference, {@code n g R}.
 * <p>
 * Every indirect object in a document is identified by a pair of
 * integers, the object number and the generation number. A reference
 * does not own the object it points to: it is a descriptor resolved on
 * demand through {@link PDFDocument#dereference}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFIndirectReference extends PDFObject {

    private final int targetNumber;
    private final int targetGeneration;

    PDFIndirectReference(ObjectAllocator allocator, int targetNumber, int targetGeneration) {
        super(allocator);
        this.targetNumber = targetNumber;
        this.targetGeneration = targetGeneration;
    }

    @Override
    public PDFObjectType getType() {
        return PDFObjectType.INDIRECT;
    }

    /**
     * Returns the object number of the referenced object.
     *
     * @return the target object number
     */
    public int getTargetNumber() {
        return targetNumber;
    }

    /**
     * Returns the generation number of the referenced object.
     *
     * @return the target generation number
     */
    public int getTargetGeneration() {
        return targetGeneration;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof PDFIndirectReference) {
            PDFIndirectReference other = (PDFIndirectReference) obj;
            return targetNumber == other.targetNumber
                && targetGeneration == other.targetGeneration;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * targetNumber + targetGeneration;
    }

}
