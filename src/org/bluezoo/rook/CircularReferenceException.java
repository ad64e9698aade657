/*
 * CircularReferenceException.java
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
 * Resolving a reference led back to an object already being resolved.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CircularReferenceException extends PDFParseException {

    private static final long serialVersionUID = 1L;

    public CircularReferenceException(String message) {
        super(message);
    }

    public CircularReferenceException(String message, long offset) {
        super(message, offset);
    }

}
