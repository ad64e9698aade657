/*
 * PDFTokenReader.java
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
import java.io.IOException;
import java.util.Arrays;

/**
 * Lexes PDF tokens from a source onto an interpreter stack.
 * <p>
 * Each call to {@link #readToken} consumes one logical token and leaves
 * the source positioned immediately after it. Simple values are pushed as
 * objects; {@code [}, {@code <<} and <code>{</code> push marks; and the
 * matching closing delimiters collapse the marked span into an array or
 * dictionary. The keywords {@code true}, {@code false} and {@code null}
 * become objects, {@code R} turns the two integers below it into an
 * indirect reference, and any other bare word is pushed as a
 * {@link PDFKeyword}.
 * <p>
 * Malformed input is recorded in the document diagnostics and read as
 * something sensible: a malformed number is read as 0, a dictionary's
 * unpaired trailing key or non-name key is dropped, a stray closing
 * delimiter is skipped. In stop-on-error mode each of these throws
 * instead.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFTokenReader {

    private final ObjectAllocator allocator;
    private final PDFDiagnostics diagnostics;

    public PDFTokenReader(ObjectAllocator allocator, PDFDiagnostics diagnostics) {
        this.allocator = allocator;
        this.diagnostics = diagnostics;
    }

    /**
     * Reads one token, pushing the result onto the stack.
     *
     * @param src the source
     * @param stack the interpreter stack
     * @return false at end of input, true otherwise
     * @throws IOException if the source cannot be read
     */
    public boolean readToken(PDFSource src, ObjectStack stack) throws IOException {
        while (true) {
            src.skipWhitespace();
            long start = src.position();
            int c = src.read();
            switch (c) {
                case -1:
                    return false;
                case '%':
                    skipComment(src);
                    continue;
                case '/':
                    stack.push(readName(src));
                    return true;
                case '(':
                    stack.push(readString(src, start));
                    return true;
                case '<':
                    src.skipWhitespace();
                    if (src.peek() == '<') {
                        src.read();
                        stack.markStack(PDFObjectType.DICT_MARK);
                    } else {
                        stack.push(readHexString(src, start));
                    }
                    return true;
                case '>':
                    if (src.peek() == '>') {
                        src.read();
                        if (closeDictionary(stack, start)) {
                            return true;
                        }
                    } else {
                        diagnostics.record(PDFErrorKind.TOKEN_ERROR, "Unexpected '>'", start);
                    }
                    continue;
                case '[':
                    stack.markStack(PDFObjectType.ARRAY_MARK);
                    return true;
                case ']':
                    if (closeArray(stack, PDFObjectType.ARRAY_MARK, start)) {
                        return true;
                    }
                    continue;
                case '{':
                    stack.markStack(PDFObjectType.PROC_MARK);
                    return true;
                case '}':
                    if (closeArray(stack, PDFObjectType.PROC_MARK, start)) {
                        return true;
                    }
                    continue;
                case ')':
                    diagnostics.record(PDFErrorKind.TOKEN_ERROR, "Unexpected ')'", start);
                    continue;
                default:
                    src.unread();
                    if ((c >= '0' && c <= '9') || c == '+' || c == '-' || c == '.') {
                        stack.push(readNumber(src, start));
                    } else {
                        readKeyword(src, stack, start);
                    }
                    return true;
            }
        }
    }

    private static void skipComment(PDFSource src) throws IOException {
        int c;
        while ((c = src.read()) != -1) {
            if (c == '\r' || c == '\n') {
                break;
            }
        }
    }

    /**
     * Reads a number. Accepts an optional leading sign, digits and at most
     * one decimal point. A regular character that cannot be part of a
     * number ends it.
     */
    private PDFNumber readNumber(PDFSource src, long start) throws IOException {
        StringBuilder buf = new StringBuilder();
        boolean real = false;
        boolean digits = false;
        boolean malformed = false;
        int c;
        while ((c = src.read()) != -1) {
            if (!PDFSource.isRegular(c)) {
                src.unread();
                break;
            }
            if (c >= '0' && c <= '9') {
                digits = true;
            } else if (c == '.') {
                if (real) {
                    malformed = true;
                }
                real = true;
            } else if (c == '+' || c == '-') {
                if (buf.length() > 0) {
                    malformed = true;
                }
            } else {
                diagnostics.record(PDFErrorKind.MISSING_WHITESPACE,
                        "Number " + buf + " followed by '" + (char) c + "'", src.position() - 1);
                src.unread();
                break;
            }
            buf.append((char) c);
        }
        if (!digits) {
            malformed = true;
        }
        if (malformed) {
            diagnostics.record(PDFErrorKind.MALFORMED_NUMBER, "Malformed number " + buf, start);
            return allocator.allocInteger(0L);
        }
        String text = buf.toString();
        if (real) {
            return allocator.allocReal(Double.parseDouble(text));
        }
        try {
            return allocator.allocInteger(Long.parseLong(text));
        } catch (NumberFormatException e) {
            // too large for a long
            return allocator.allocReal(Double.parseDouble(text));
        }
    }

    private PDFName readName(PDFSource src) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        int c;
        while ((c = src.read()) != -1) {
            if (!PDFSource.isRegular(c)) {
                src.unread();
                break;
            }
            if (c == '#') {
                int h1 = src.peek();
                if (hexValue(h1) >= 0) {
                    src.read();
                    int h2 = src.peek();
                    if (hexValue(h2) >= 0) {
                        src.read();
                        buf.write((hexValue(h1) << 4) | hexValue(h2));
                        continue;
                    }
                    buf.write('#');
                    buf.write(h1);
                    continue;
                }
            }
            buf.write(c);
        }
        return allocator.allocName(buf.toByteArray());
    }

    /**
     * Reads a literal string after its opening parenthesis. Balanced
     * parentheses nest; an end of line, escaped or not, is read as a
     * single line feed unless escaped by a backslash, in which case it
     * is a continuation and produces nothing.
     */
    private PDFString readString(PDFSource src, long start) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        int depth = 1;
        while (true) {
            int c = src.read();
            if (c == -1) {
                diagnostics.record(PDFErrorKind.UNTERMINATED_STRING, "End of input in string", start);
                break;
            }
            if (c == '\\') {
                c = src.read();
                switch (c) {
                    case -1:
                        continue;
                    case 'n':
                        buf.write('\n');
                        break;
                    case 'r':
                        buf.write('\r');
                        break;
                    case 't':
                        buf.write('\t');
                        break;
                    case 'b':
                        buf.write('\b');
                        break;
                    case 'f':
                        buf.write('\f');
                        break;
                    case '\r':
                        if (src.peek() == '\n') {
                            src.read();
                        }
                        break;
                    case '\n':
                        break;
                    default:
                        if (c >= '0' && c <= '7') {
                            int value = c - '0';
                            for (int i = 0; i < 2; i++) {
                                int d = src.peek();
                                if (d < '0' || d > '7') {
                                    break;
                                }
                                src.read();
                                value = (value << 3) | (d - '0');
                            }
                            buf.write(value & 0xff);
                        } else {
                            // unknown escape: the backslash is ignored
                            buf.write(c);
                        }
                }
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (--depth == 0) {
                    break;
                }
            } else if (c == '\r') {
                if (src.peek() == '\n') {
                    src.read();
                }
                c = '\n';
            }
            buf.write(c);
        }
        return allocator.allocString(buf.toByteArray());
    }

    private PDFString readHexString(PDFSource src, long start) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        int high = -1;
        while (true) {
            int c = src.read();
            if (c == -1) {
                diagnostics.record(PDFErrorKind.UNTERMINATED_STRING, "End of input in hex string", start);
                break;
            }
            if (c == '>') {
                break;
            }
            if (PDFSource.isWhitespace(c)) {
                continue;
            }
            int v = hexValue(c);
            if (v < 0) {
                diagnostics.record(PDFErrorKind.TOKEN_ERROR,
                        "Invalid hex digit '" + (char) c + "'", src.position() - 1);
                continue;
            }
            if (high < 0) {
                high = v;
            } else {
                buf.write((high << 4) | v);
                high = -1;
            }
        }
        if (high >= 0) {
            buf.write(high << 4);
        }
        return allocator.allocString(buf.toByteArray());
    }

    private void readKeyword(PDFSource src, ObjectStack stack, long start) throws IOException {
        byte[] buf = new byte[PDFKeyword.MAX_LENGTH];
        int len = 0;
        int c;
        while ((c = src.read()) != -1) {
            if (!PDFSource.isRegular(c)) {
                src.unread();
                break;
            }
            if (len < buf.length) {
                buf[len] = (byte) c;
            }
            len++;
        }
        if (len > PDFKeyword.MAX_LENGTH) {
            diagnostics.record(PDFErrorKind.KEYWORD_TOO_LONG, len + " byte keyword", start);
            stack.push(allocator.allocKeyword(PDFKeyword.Keyword.TOO_LONG, buf));
            return;
        }
        byte[] text = Arrays.copyOf(buf, len);
        if (PDFName.matches(text, "true")) {
            stack.push(allocator.allocBoolean(true));
        } else if (PDFName.matches(text, "false")) {
            stack.push(allocator.allocBoolean(false));
        } else if (PDFName.matches(text, "null")) {
            stack.push(allocator.getNull());
        } else if (PDFName.matches(text, "R")) {
            readReference(stack, text, start);
        } else {
            PDFKeyword.Keyword keyword = PDFKeyword.Keyword.classify(text, len);
            if (keyword == PDFKeyword.Keyword.STREAM) {
                skipStreamEol(src);
            }
            stack.push(allocator.allocKeyword(keyword, text));
        }
    }

    private void readReference(ObjectStack stack, byte[] text, long start) {
        if (stack.size() >= 2
                && stack.peek(0) instanceof PDFInteger
                && stack.peek(1) instanceof PDFInteger) {
            long gen = ((PDFInteger) stack.peek(0)).longValue();
            long num = ((PDFInteger) stack.peek(1)).longValue();
            if (num >= 0 && num <= Integer.MAX_VALUE && gen >= 0 && gen <= Integer.MAX_VALUE) {
                stack.pop(2);
                stack.push(allocator.allocReference((int) num, (int) gen));
                return;
            }
        }
        diagnostics.record(PDFErrorKind.TOKEN_ERROR, "R not preceded by object and generation numbers", start);
        stack.push(allocator.allocKeyword(PDFKeyword.Keyword.UNRECOGNIZED, text));
    }

    /**
     * The stream keyword is followed by CRLF or LF; a lone CR is
     * tolerated.
     */
    private static void skipStreamEol(PDFSource src) throws IOException {
        int c = src.read();
        if (c == '\r') {
            if (src.peek() == '\n') {
                src.read();
            }
        } else if (c != '\n' && c != -1) {
            src.unread();
        }
    }

    private boolean closeArray(ObjectStack stack, PDFObjectType markType, long start) {
        if (stack.nearestMarkType() != markType) {
            diagnostics.record(PDFErrorKind.TOKEN_ERROR,
                    "Unmatched " + (markType == PDFObjectType.ARRAY_MARK ? "']'" : "'}'"), start);
            return false;
        }
        stack.arrayFromStack(markType);
        return true;
    }

    private boolean closeDictionary(ObjectStack stack, long start) {
        if (stack.nearestMarkType() != PDFObjectType.DICT_MARK) {
            diagnostics.record(PDFErrorKind.TOKEN_ERROR, "Unmatched '>>'", start);
            return false;
        }
        int count = stack.countToMark();
        if ((count & 1) != 0) {
            diagnostics.record(PDFErrorKind.BAD_DICTIONARY, "Dictionary key with no value", start);
            stack.pop();
            count--;
        }
        boolean keysValid = true;
        for (int i = 1; i < count; i += 2) {
            if (!(stack.peek(i) instanceof PDFName)) {
                keysValid = false;
                break;
            }
        }
        if (keysValid) {
            stack.dictionaryFromStack();
            return true;
        }
        diagnostics.record(PDFErrorKind.BAD_DICTIONARY, "Dictionary key is not a name", start);
        PDFDictionary dict = allocator.allocDictionary(count / 2);
        dict.retain();
        try {
            for (int i = count - 1; i > 0; i -= 2) {
                PDFObject key = stack.peek(i);
                if (key instanceof PDFName) {
                    dict.put((PDFName) key, stack.peek(i - 1));
                }
            }
            stack.clearToMark();
            stack.push(dict);
        } finally {
            dict.release();
        }
        return true;
    }

    static int hexValue(int c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

}
