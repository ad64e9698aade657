/*
 * PDFErrorHandler.java
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
 * Receives notice of recoverable conditions as they are recorded.
 * <p>
 * Each method is called the first time a kind of condition is seen in a
 * document. An implementation may throw a {@link PDFParseException} to
 * abandon processing.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface PDFErrorHandler {

    /**
     * Receives notice of an error that was recovered from.
     *
     * @param kind the kind of condition
     * @param detail a description of this occurrence
     * @param offset the byte offset concerned, or -1
     */
    void error(PDFErrorKind kind, String detail, long offset);

    /**
     * Receives notice of a warning.
     *
     * @param kind the kind of condition
     * @param detail a description of this occurrence
     * @param offset the byte offset concerned, or -1
     */
    void warning(PDFErrorKind kind, String detail, long offset);

}
