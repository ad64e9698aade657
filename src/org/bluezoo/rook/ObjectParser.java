/*
 * ObjectParser.java
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
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads complete values and indirect objects with the token reader.
 * <p>
 * {@link #readObject} reads {@code n g obj ... endobj}, including the
 * stream case, where the declared {@code /Length} is checked against
 * the position of {@code endstream}. A wrong length is a warning: the
 * data extent is then found by scanning for {@code endstream}.
 * {@link #readValue} reads exactly one value, consuming a whole array
 * or dictionary if that is what starts; it serves object stream members
 * and trailers, which have no {@code obj} framing.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class ObjectParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ObjectParser.class);

    static final byte[] ENDSTREAM = "endstream".getBytes(StandardCharsets.US_ASCII);

    private final PDFDocument document;
    private final PDFTokenReader tokenReader;
    private final ObjectStack stack;
    private final PDFDiagnostics diagnostics;

    ObjectParser(PDFDocument document, PDFTokenReader tokenReader, ObjectStack stack,
                 PDFDiagnostics diagnostics) {
        this.document = document;
        this.tokenReader = tokenReader;
        this.stack = stack;
        this.diagnostics = diagnostics;
    }

    /**
     * Reads the indirect object starting at the source position.
     *
     * @param src the source, positioned at the object number
     * @param expectedNumber the object number the header must carry, or -1
     * @return the object, bound to its number and counted for the caller
     * @throws PDFSyntaxException if there is no {@code n g obj} header
     * @throws PDFUndefinedException if the header names another object
     * @throws IOException if the source cannot be read
     */
    PDFObject readObject(PDFSource src, int expectedNumber) throws IOException {
        long offset = src.position();
        int base = stack.size();
        try {
            int num = readHeaderInteger(src, "object number", offset);
            if (expectedNumber >= 0 && num != expectedNumber) {
                throw new PDFUndefinedException("Expected object " + expectedNumber
                        + ", found object " + num, offset);
            }
            int gen = readHeaderInteger(src, "generation number", offset);
            if (!tokenReader.readToken(src, stack) || !isKeyword(stack.peek(0), PDFKeyword.Keyword.OBJ)) {
                throw new PDFSyntaxException("Expected 'obj' for object " + num, offset);
            }
            stack.pop();
            while (true) {
                if (!tokenReader.readToken(src, stack)) {
                    diagnostics.record(PDFErrorKind.MISSING_ENDOBJ, "End of input in object " + num, offset);
                    return finish(num, gen, base, offset);
                }
                PDFObject top = stack.peek(0);
                if (!(top instanceof PDFKeyword)) {
                    continue;
                }
                PDFKeyword keyword = (PDFKeyword) top;
                switch (keyword.getKeyword()) {
                    case ENDOBJ:
                        stack.pop();
                        return finish(num, gen, base, offset);
                    case STREAM:
                        long dataStart = src.position();
                        stack.pop();
                        return finishStream(src, num, gen, base, offset, dataStart);
                    case OBJ:
                        // ran into the header of the next object
                        diagnostics.record(PDFErrorKind.MISSING_ENDOBJ, "Object " + num, offset);
                        stack.pop();
                        if (stack.size() - base >= 3
                                && stack.peek(0) instanceof PDFInteger
                                && stack.peek(1) instanceof PDFInteger) {
                            stack.pop(2);
                        }
                        return finish(num, gen, base, offset);
                    case ENDSTREAM:
                    case XREF:
                    case TRAILER:
                    case STARTXREF:
                        diagnostics.record(PDFErrorKind.MISSING_ENDOBJ, "Object " + num, offset);
                        stack.pop();
                        return finish(num, gen, base, offset);
                    default:
                        diagnostics.record(PDFErrorKind.TOKEN_ERROR,
                                "Unexpected keyword '" + keyword.getText() + "' in object " + num, offset);
                        stack.pop();
                }
            }
        } finally {
            stack.popTo(base);
        }
    }

    /**
     * Reads exactly one value.
     *
     * @param src the source, positioned before the value
     * @return the value, counted for the caller
     * @throws PDFSyntaxException at end of input or on a keyword
     * @throws IOException if the source cannot be read
     */
    PDFObject readValue(PDFSource src) throws IOException {
        long offset = src.position();
        int base = stack.size();
        try {
            do {
                if (!tokenReader.readToken(src, stack)) {
                    throw new PDFSyntaxException("Unexpected end of input reading value", offset);
                }
                PDFObject top = stack.peek(0);
                if (top instanceof PDFKeyword) {
                    throw new PDFSyntaxException("Unexpected keyword '"
                            + ((PDFKeyword) top).getText() + "' reading value", offset);
                }
            } while (stack.size() > base + 1 || stack.peek(0).getType().isMark());
            return stack.peek(0).retain();
        } finally {
            stack.popTo(base);
        }
    }

    private int readHeaderInteger(PDFSource src, String what, long offset) throws IOException {
        if (!tokenReader.readToken(src, stack) || !(stack.peek(0) instanceof PDFInteger)) {
            throw new PDFSyntaxException("Expected " + what, offset);
        }
        long value = ((PDFInteger) stack.peek(0)).longValue();
        stack.pop();
        if (value < 0 || value > Integer.MAX_VALUE) {
            throw new PDFSyntaxException("Invalid " + what + " " + value, offset);
        }
        return (int) value;
    }

    /**
     * Takes the value of an object. Anything other than a single value
     * above the base is recorded; an empty body reads as null.
     */
    private PDFObject finish(int num, int gen, int base, long offset) {
        int count = stack.size() - base;
        PDFObject value = null;
        for (int i = 0; i < count; i++) {
            PDFObject candidate = stack.peek(i);
            if (!candidate.getType().isMark()) {
                value = candidate;
                break;
            }
        }
        if (count != 1 || value != stack.peek(0)) {
            diagnostics.record(PDFErrorKind.TOKEN_ERROR,
                    "Object " + num + " does not contain exactly one value", offset);
        }
        if (value == null) {
            return document.getAllocator().getNull().retain();
        }
        if (!(value instanceof PDFNull)) {
            value.bind(num, gen);
        }
        return value.retain();
    }

    private PDFObject finishStream(PDFSource src, int num, int gen, int base, long offset,
                                   long dataStart) throws IOException {
        if (stack.size() - base != 1 || !(stack.peek(0) instanceof PDFDictionary)) {
            throw new PDFSyntaxException("stream not preceded by a dictionary in object " + num, offset);
        }
        PDFDictionary dict = (PDFDictionary) stack.peek(0);
        dict.bind(num, gen);
        dict.setStreamOffset(dataStart);
        long length = resolveLength(dict, offset);
        long dataLength = -1L;
        if (length >= 0L && dataStart + length <= src.size()) {
            src.seek(dataStart + length);
            src.skipWhitespace();
            if (src.matches(ENDSTREAM)) {
                dataLength = length;
            } else {
                diagnostics.record(PDFErrorKind.BAD_STREAM_LENGTH,
                        "Object " + num + " /Length " + length, offset);
            }
        } else if (length >= 0L) {
            diagnostics.record(PDFErrorKind.BAD_STREAM_LENGTH,
                    "Object " + num + " /Length " + length + " extends past end of file", offset);
        }
        if (dataLength < 0L) {
            src.seek(dataStart);
            long end = src.find(ENDSTREAM, src.size());
            if (end < 0L) {
                diagnostics.record(PDFErrorKind.MISSING_ENDSTREAM, "Object " + num, offset);
                dataLength = src.size() - dataStart;
                src.seek(src.size());
            } else {
                dataLength = trimEol(src, dataStart, end) - dataStart;
                src.seek(end + ENDSTREAM.length);
                LOGGER.debug("Object {} stream length found by scanning: {}", num, dataLength);
            }
        }
        dict.setStreamLength(dataLength);
        int depth = stack.size();
        if (!tokenReader.readToken(src, stack) || !isKeyword(stack.peek(0), PDFKeyword.Keyword.ENDOBJ)) {
            diagnostics.record(PDFErrorKind.MISSING_ENDOBJ, "Object " + num, offset);
        }
        stack.popTo(depth);
        return dict.retain();
    }

    /**
     * Returns the declared stream length, or -1 if it is missing or
     * cannot be resolved. A circular /Length is not tolerated.
     */
    private long resolveLength(PDFDictionary dict, long offset) throws IOException {
        PDFObject value = dict.getNoDeref("Length");
        if (value == null) {
            diagnostics.record(PDFErrorKind.MISSING_LENGTH, "Object " + dict.getObjectNumber(), offset);
            return -1L;
        }
        PDFObject resolved;
        try {
            resolved = document.resolve(value, dict.getObjectNumber());
        } catch (CircularReferenceException e) {
            throw e;
        } catch (PDFParseException e) {
            diagnostics.record(PDFErrorKind.MISSING_LENGTH,
                    "Object " + dict.getObjectNumber() + ": " + e.getMessage(), offset);
            return -1L;
        }
        try {
            if (resolved instanceof PDFNumber && ((PDFNumber) resolved).isIntegral()
                    && ((PDFNumber) resolved).longValue() >= 0L) {
                return ((PDFNumber) resolved).longValue();
            }
            diagnostics.record(PDFErrorKind.MISSING_LENGTH,
                    "Object " + dict.getObjectNumber() + " /Length is not a length", offset);
            return -1L;
        } finally {
            resolved.release();
        }
    }

    /**
     * Returns the end of stream data given the offset of endstream,
     * excluding the end-of-line marker before it.
     */
    private static long trimEol(PDFSource src, long dataStart, long end) throws IOException {
        long pos = end;
        if (pos - 1 >= dataStart) {
            src.seek(pos - 1);
            if (src.read() == '\n') {
                pos--;
            }
        }
        if (pos - 1 >= dataStart) {
            src.seek(pos - 1);
            if (src.read() == '\r') {
                pos--;
            }
        }
        return pos;
    }

    static boolean isKeyword(PDFObject obj, PDFKeyword.Keyword keyword) {
        return obj instanceof PDFKeyword && ((PDFKeyword) obj).is(keyword);
    }

}
