/*
 * PDFErrorKind.java
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
 * The distinct conditions recorded while reading a document.
 * <p>
 * Each kind is reported at most once per document, however often it
 * occurs. Errors are problems the file should not have; warnings are
 * sloppiness that was silently tolerated.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum PDFErrorKind {

    NO_HEADER(true, "The file does not start with a %PDF header"),
    NO_HEADER_VERSION(true, "The %PDF header does not contain a valid version number"),
    NO_STARTXREF(true, "The startxref keyword could not be found"),
    BAD_STARTXREF(true, "The startxref offset does not point to a cross-reference table"),
    BAD_XREF_STREAM(true, "A cross-reference stream could not be read"),
    BAD_XREF(true, "A cross-reference table could not be read"),
    SHORT_XREF(true, "A cross-reference subsection has fewer entries than it declares"),
    MISSING_ENDSTREAM(true, "A stream is not terminated by endstream"),
    MISSING_ENDOBJ(true, "An object is not terminated by endobj"),
    UNKNOWN_FILTER(true, "A stream uses a filter that is not supported"),
    MISSING_WHITESPACE(true, "Tokens are not separated by whitespace"),
    MALFORMED_NUMBER(true, "A number is malformed and was read as 0"),
    UNTERMINATED_STRING(true, "A string is not terminated"),
    BAD_OBJECT_NUMBER(true, "An object number is outside the cross-reference table"),
    TOKEN_ERROR(true, "An invalid token was found and ignored"),
    KEYWORD_TOO_LONG(true, "A keyword exceeds the maximum keyword length"),
    BAD_DICTIONARY(true, "A dictionary has an unpaired or non-name key, which was dropped"),
    BAD_PAGE_TYPE(true, "A page tree node has a missing or wrong /Type"),
    CIRCULAR_REFERENCE(true, "A circular reference was found"),
    BAD_STREAM_LENGTH(false, "A stream /Length does not match the position of endstream"),
    MISSING_LENGTH(false, "A stream has no usable /Length"),
    XREF_STARTS_AT_ONE(false, "A cross-reference table starts at object 1 instead of 0"),
    BAD_INFO(false, "The /Info dictionary could not be read"),
    PAGE_ERROR(false, "A page could not be processed"),
    REPAIRED(false, "The cross-reference table was rebuilt by scanning the file");

    private final boolean error;
    private final String message;

    PDFErrorKind(boolean error, String message) {
        this.error = error;
        this.message = message;
    }

    /**
     * Returns whether this kind is an error rather than a warning.
     *
     * @return true for errors
     */
    public boolean isError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

}
