/*
 * PDFObjectType.java
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
 * The closed set of object variants.
 * <p>
 * The three mark types never escape the interpreter stack; they bracket
 * the start of an array, a dictionary or a procedure while its members
 * are being read.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum PDFObjectType {

    NULL,
    BOOLEAN,
    INTEGER,
    REAL,
    NAME,
    STRING,
    ARRAY,
    DICTIONARY,
    INDIRECT,
    KEYWORD,
    XREF_TABLE,
    ARRAY_MARK,
    DICT_MARK,
    PROC_MARK;

    /**
     * Returns whether this type is one of the stack marks.
     *
     * @return true for array, dictionary and procedure marks
     */
    public boolean isMark() {
        return this == ARRAY_MARK || this == DICT_MARK || this == PROC_MARK;
    }

}
