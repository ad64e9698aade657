/*
 * PDFName.java
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
 * A name object.
 * <p>
 * A name is an atomic symbol made of any 8-bit characters except NUL.
 * Names are case-sensitive and compared byte for byte. In PDF syntax a
 * name begins with a solidus, which is not part of the name; any
 * character may be written as a number sign followed by two hexadecimal
 * digits. The bytes held here are the decoded form.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFName extends PDFObject {

    private final byte[] bytes;
    private final int hashCode;

    PDFName(ObjectAllocator allocator, byte[] bytes) {
        super(allocator);
        this.bytes = bytes;
        this.hashCode = Arrays.hashCode(bytes);
    }

    @Override
    public PDFObjectType getType() {
        return PDFObjectType.NAME;
    }

    /**
     * Returns a copy of the decoded name bytes.
     *
     * @return the name bytes, without the leading solidus
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * Returns the name as a Latin-1 string.
     *
     * @return the name value, without the leading solidus
     */
    public String getValue() {
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    /**
     * Returns whether this name has the given value.
     *
     * @param value the name to compare with, without a solidus
     * @return true if the bytes are identical
     */
    public boolean is(String value) {
        return matches(bytes, value);
    }

    byte[] rawBytes() {
        return bytes;
    }

    static boolean matches(byte[] bytes, String value) {
        if (bytes.length != value.length()) {
            return false;
        }
        for (int i = 0; i < bytes.length; i++) {
            if ((bytes[i] & 0xff) != value.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof PDFName) {
            PDFName other = (PDFName) obj;
            return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

}
