/*
 * PDFObjectWriter.java
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

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Serializes objects back to PDF token syntax.
 * <p>
 * The output reads back to an equal object: names escape delimiters and
 * non-printing bytes as {@code #XX}, literal strings escape parentheses,
 * backslashes and non-printing bytes, and reals always carry a decimal
 * point.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFObjectWriter {

    private static final byte[] HEX = "0123456789ABCDEF".getBytes(StandardCharsets.US_ASCII);

    private PDFObjectWriter() {
    }

    /**
     * Serializes an object as bytes.
     *
     * @param obj the object
     * @return the serialized form
     */
    public static byte[] write(PDFObject obj) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(obj, out);
        return out.toByteArray();
    }

    /**
     * Serializes an object as a string, one character per byte.
     *
     * @param obj the object
     * @return the serialized form
     */
    public static String toString(PDFObject obj) {
        return new String(write(obj), StandardCharsets.ISO_8859_1);
    }

    private static void write(PDFObject obj, ByteArrayOutputStream out) {
        if (obj.isFreed()) {
            ascii(out, "%freed " + obj.getType());
            return;
        }
        switch (obj.getType()) {
            case NULL:
                ascii(out, "null");
                break;
            case BOOLEAN:
                ascii(out, ((PDFBoolean) obj).booleanValue() ? "true" : "false");
                break;
            case INTEGER:
                ascii(out, Long.toString(((PDFInteger) obj).longValue()));
                break;
            case REAL:
                ascii(out, formatReal(((PDFReal) obj).doubleValue()));
                break;
            case NAME:
                writeName(((PDFName) obj).rawBytes(), out);
                break;
            case STRING:
                writeString(((PDFString) obj).rawBytes(), out);
                break;
            case ARRAY:
                PDFArray array = (PDFArray) obj;
                out.write('[');
                for (int i = 0; i < array.size(); i++) {
                    if (i > 0) {
                        out.write(' ');
                    }
                    write(array.getNoDeref(i), out);
                }
                out.write(']');
                break;
            case DICTIONARY:
                PDFDictionary dict = (PDFDictionary) obj;
                out.write('<');
                out.write('<');
                List<PDFName> keys = dict.keys();
                for (int i = 0; i < keys.size(); i++) {
                    if (i > 0) {
                        out.write(' ');
                    }
                    PDFName key = keys.get(i);
                    writeName(key.rawBytes(), out);
                    out.write(' ');
                    write(dict.getNoDeref(key), out);
                }
                out.write('>');
                out.write('>');
                break;
            case INDIRECT:
                PDFIndirectReference ref = (PDFIndirectReference) obj;
                ascii(out, ref.getTargetNumber() + " " + ref.getTargetGeneration() + " R");
                break;
            case KEYWORD:
                ascii(out, ((PDFKeyword) obj).getText());
                break;
            case XREF_TABLE:
                ascii(out, "%xref " + ((CrossReferenceTable) obj).size());
                break;
            default:
                ascii(out, "%mark");
        }
    }

    static String formatReal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "0.0";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return (long) value + ".0";
        }
        String s = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return s.indexOf('.') < 0 ? s + ".0" : s;
    }

    private static void writeName(byte[] bytes, ByteArrayOutputStream out) {
        out.write('/');
        for (byte b : bytes) {
            int c = b & 0xff;
            if (c < 0x21 || c > 0x7e || c == '#' || PDFSource.isDelimiter(c)) {
                out.write('#');
                out.write(HEX[c >> 4]);
                out.write(HEX[c & 0x0f]);
            } else {
                out.write(c);
            }
        }
    }

    private static void writeString(byte[] bytes, ByteArrayOutputStream out) {
        out.write('(');
        for (byte b : bytes) {
            int c = b & 0xff;
            switch (c) {
                case '(':
                case ')':
                case '\\':
                    out.write('\\');
                    out.write(c);
                    break;
                case '\n':
                    ascii(out, "\\n");
                    break;
                case '\r':
                    ascii(out, "\\r");
                    break;
                case '\t':
                    ascii(out, "\\t");
                    break;
                case '\b':
                    ascii(out, "\\b");
                    break;
                case '\f':
                    ascii(out, "\\f");
                    break;
                default:
                    if (c < 0x20 || c > 0x7e) {
                        out.write('\\');
                        out.write('0' + (c >> 6));
                        out.write('0' + ((c >> 3) & 7));
                        out.write('0' + (c & 7));
                    } else {
                        out.write(c);
                    }
            }
        }
        out.write(')');
    }

    private static void ascii(ByteArrayOutputStream out, String s) {
        byte[] bytes = s.getBytes(StandardCharsets.ISO_8859_1);
        out.write(bytes, 0, bytes.length);
    }

}
