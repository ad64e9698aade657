/*
 * PDFKeyword.java
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

/**
 * A bare keyword that has been read but not yet interpreted.
 * <p>
 * The structural keywords are classified on reading; everything else is
 * {@link Keyword#UNRECOGNIZED}. A keyword longer than
 * {@link #MAX_LENGTH} bytes is classified as {@link Keyword#TOO_LONG}
 * and keeps only its first {@code MAX_LENGTH} bytes.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFKeyword extends PDFObject {

    /**
     * Longest keyword accepted.
     */
    public static final int MAX_LENGTH = 255;

    /**
     * Recognized keywords.
     */
    public enum Keyword {
        OBJ("obj"),
        ENDOBJ("endobj"),
        STREAM("stream"),
        ENDSTREAM("endstream"),
        XREF("xref"),
        TRAILER("trailer"),
        STARTXREF("startxref"),
        UNRECOGNIZED(null),
        TOO_LONG(null);

        private final String text;

        Keyword(String text) {
            this.text = text;
        }

        public String getText() {
            return text;
        }

        static Keyword classify(byte[] buf, int len) {
            if (len > MAX_LENGTH) {
                return TOO_LONG;
            }
            for (Keyword k : values()) {
                if (k.text != null && k.text.length() == len && matches(buf, k.text)) {
                    return k;
                }
            }
            return UNRECOGNIZED;
        }

        private static boolean matches(byte[] buf, String text) {
            for (int i = 0; i < text.length(); i++) {
                if ((buf[i] & 0xff) != text.charAt(i)) {
                    return false;
                }
            }
            return true;
        }
    }

    private final Keyword keyword;
    private final byte[] text;

    PDFKeyword(ObjectAllocator allocator, Keyword keyword, byte[] text) {
        super(allocator);
        this.keyword = keyword;
        this.text = text;
    }

    @Override
    public PDFObjectType getType() {
        return PDFObjectType.KEYWORD;
    }

    public Keyword getKeyword() {
        return keyword;
    }

    public boolean is(Keyword keyword) {
        return this.keyword == keyword;
    }

    public String getText() {
        return new String(text, StandardCharsets.ISO_8859_1);
    }

}
