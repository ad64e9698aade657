/*
 * ContentStreamInterpreter.java
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

import java.io.IOException;

/**
 * Receives the content streams of pages as they are processed.
 * <p>
 * This is the boundary between the object layer and whatever gives a
 * page's content stream meaning. The document locates the page,
 * resolves its {@code /Contents} and hands each stream over in order;
 * the data can be obtained with {@link PDFDocument#readStream}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see PDFDocument#processPages
 */
public interface ContentStreamInterpreter {

    /**
     * Interprets one content stream of a page.
     *
     * @param document the document the stream belongs to
     * @param stream the stream dictionary
     * @param page the page dictionary, with inherited attributes merged in
     * @throws PDFParseException if the content cannot be interpreted
     * @throws IOException if the stream cannot be read
     */
    void interpretContentStream(PDFDocument document, PDFDictionary stream, PDFDictionary page)
            throws IOException;

}
