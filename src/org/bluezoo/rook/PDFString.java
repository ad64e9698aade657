/*
 * PDFString.java
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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A string object, holding the decoded bytes of a literal or
 * hexadecimal string.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFString extends PDFObject {

    private final byte[] bytes;

    PDFString(ObjectAllocator allocator, byte[] bytes) {
        super(allocator);
        this.bytes = bytes;
    }

    @Override
    public PDFObjectType getType() {
        return PDFObjectType.STRING;
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    /**
     * Returns the string as text. Strings starting with a UTF-16 byte
     * order mark are decoded as UTF-16, anything else as Latin-1.
     *
     * @return the decoded text
     */
    public String getText() {
        if (bytes.length >= 2 && (bytes[0] & 0xff) == 0xfe && (bytes[1] & 0xff) == 0xff) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16BE);
        }
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    byte[] rawBytes() {
        return bytes;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof PDFString && Arrays.equals(bytes, ((PDFString) obj).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

}
