/*
 * PDFParseException.java
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
 * Exception thrown when a PDF document is malformed or cannot be parsed.
 * <p>
 * This is the base of the typed conditions raised by the object model:
 * syntax errors, type checks, undefined or out-of-range objects and
 * circular references.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final long offset;

    /**
     * Creates a new exception with the specified message.
     *
     * @param message the error message
     */
    public PDFParseException(String message) {
        super(message);
        this.offset = -1;
    }

    /**
     * Creates a new exception with the specified message and byte offset.
     *
     * @param message the error message
     * @param offset the byte offset in the file where the error occurred
     */
    public PDFParseException(String message, long offset) {
        super(offset < 0 ? message : message + " at offset " + offset);
        this.offset = offset;
    }

    /**
     * Creates a new exception with the specified message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public PDFParseException(String message, Throwable cause) {
        super(message, cause);
        this.offset = -1;
    }

    /**
     * Returns the byte offset in the file where the error occurred.
     *
     * @return the offset, or -1 if not available
     */
    public long getOffset() {
        return offset;
    }

}
