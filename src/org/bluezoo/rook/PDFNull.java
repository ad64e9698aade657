/*
 * PDFNull.java
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
 * The null object.
 * <p>
 * Each allocator owns a single shared instance. Containers fill empty
 * slots with it, each slot holding its own counted reference.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFNull extends PDFObject {

    PDFNull(ObjectAllocator allocator) {
        super(allocator);
    }

    @Override
    public PDFObjectType getType() {
        return PDFObjectType.NULL;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof PDFNull;
    }

    @Override
    public int hashCode() {
        return 0;
    }

}
