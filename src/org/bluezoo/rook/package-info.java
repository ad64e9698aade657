/*
 * package-info.java
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

/**
 * Rook PDF object model and resolution engine.
 * <p>
 * Rook reads the object structure of a PDF file lazily: opening a
 * document reads the cross-reference data, trailer, catalog and page
 * tree root, and every other object is read when it is first
 * dereferenced. Damaged files are repaired by scanning for object
 * headers.
 * <p>
 * The main entry points are:
 * <ul>
 *   <li>{@link org.bluezoo.rook.PDFDocument} - An open document</li>
 *   <li>{@link org.bluezoo.rook.PDFObject} - The reference counted object model</li>
 *   <li>{@link org.bluezoo.rook.PDFTokenReader} - The tokenizer</li>
 *   <li>{@link org.bluezoo.rook.ContentStreamInterpreter} - Consumer of page content</li>
 * </ul>
 * <p>
 * Conditions found while reading are collected in
 * {@link org.bluezoo.rook.PDFDiagnostics} and reported when the document
 * is closed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.rook;
