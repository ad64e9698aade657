/*
 * XRefReader.java
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
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the chain of cross-reference sections into a table.
 * <p>
 * Reading starts at the section named by startxref and follows
 * {@code /Prev} links to older sections. Sections are read newest first,
 * so an entry is only stored if no newer section defined it. A section
 * is either a classic table ({@code xref}, subsections, {@code trailer})
 * or a cross-reference stream. A classic section whose trailer has
 * {@code /XRefStm} belongs to a hybrid file: when the stream is
 * preferred it is read before the classic entries of the same section,
 * so its entries win.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class XRefReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(XRefReader.class);

    private static final byte[] XREF = "xref".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] TRAILER = "trailer".getBytes(StandardCharsets.US_ASCII);

    private final PDFDocument document;
    private final PDFSource source;
    private final CrossReferenceTable xref;
    private final PDFDiagnostics diagnostics;
    private final boolean preferXRefStream;
    private PDFDictionary trailer;
    private boolean hybrid;

    XRefReader(PDFDocument document, CrossReferenceTable xref, boolean preferXRefStream) {
        this.document = document;
        this.source = document.getSource();
        this.xref = xref;
        this.diagnostics = document.getDiagnostics();
        this.preferXRefStream = preferXRefStream;
    }

    /**
     * Reads the section at the given offset and all older sections.
     *
     * @param offset the startxref offset
     * @throws PDFParseException if a section cannot be read
     * @throws IOException if the file cannot be read
     */
    void read(long offset) throws IOException {
        Set<Long> visited = new HashSet<>();
        while (offset >= 0L) {
            if (!visited.add(offset)) {
                diagnostics.record(PDFErrorKind.BAD_XREF, "/Prev chain loops", offset);
                break;
            }
            if (offset >= source.size()) {
                throw new PDFSyntaxException("Cross-reference offset past end of file", offset);
            }
            PDFDictionary sectionTrailer = readSection(offset);
            try {
                long size = sectionTrailer.getInteger("Size", 0L);
                if (size > xref.size() && size <= PDFDocument.MAX_OBJECT_NUMBER) {
                    xref.grow((int) size);
                }
                PDFObject prev = sectionTrailer.getNoDeref("Prev");
                offset = prev instanceof PDFNumber ? ((PDFNumber) prev).longValue() : -1L;
                if (trailer == null) {
                    trailer = (PDFDictionary) sectionTrailer.retain();
                }
            } finally {
                sectionTrailer.release();
            }
        }
    }

    /**
     * Hands the newest trailer to the caller.
     *
     * @return the trailer, counted, or null if no section was read
     */
    PDFDictionary takeTrailer() {
        PDFDictionary t = trailer;
        trailer = null;
        return t;
    }

    boolean isHybrid() {
        return hybrid;
    }

    private PDFDictionary readSection(long offset) throws IOException {
        source.seek(offset);
        source.skipWhitespace();
        if (source.matches(XREF)) {
            return readClassicSection(offset);
        }
        int c = source.peek();
        if (c >= '0' && c <= '9') {
            return readXRefStream(offset);
        }
        throw new PDFSyntaxException("No cross-reference section", offset);
    }

    private PDFDictionary readClassicSection(long offset) throws IOException {
        List<CrossReferenceEntry> entries = new ArrayList<>();
        boolean firstSubsection = true;
        while (true) {
            source.skipWhitespace();
            int c = source.peek();
            if (c < '0' || c > '9') {
                break;
            }
            long first = readLong();
            source.skipWhitespace();
            long count = readLong();
            if (first + count > PDFDocument.MAX_OBJECT_NUMBER) {
                throw new PDFRangeCheckException("Cross-reference subsection too large", offset);
            }
            for (int i = 0; i < count; i++) {
                source.skipWhitespace();
                c = source.peek();
                if (c < '0' || c > '9') {
                    diagnostics.record(PDFErrorKind.SHORT_XREF,
                            "Subsection " + first + " has " + i + " of " + count + " entries", offset);
                    break;
                }
                long entryOffset = readLong();
                source.skipWhitespace();
                long generation = readLong();
                source.skipWhitespace();
                int type = source.read();
                if (firstSubsection && i == 0 && first == 1 && type == 'f'
                        && entryOffset == 0 && generation == 65535) {
                    diagnostics.record(PDFErrorKind.XREF_STARTS_AT_ONE, "Renumbered from 0", offset);
                    first = 0;
                }
                int num = (int) (first + i);
                if (type == 'n' && entryOffset > 0) {
                    entries.add(CrossReferenceEntry.inUse(num, entryOffset, (int) generation));
                } else if (type == 'n' || type == 'f') {
                    entries.add(CrossReferenceEntry.free(num, (int) generation));
                } else {
                    throw new PDFSyntaxException("Invalid cross-reference entry type", source.position() - 1);
                }
            }
            firstSubsection = false;
        }
        source.skipWhitespace();
        if (!source.matches(TRAILER)) {
            throw new PDFSyntaxException("Expected 'trailer'", source.position());
        }
        PDFObject value = document.getObjectParser().readValue(source);
        if (!(value instanceof PDFDictionary)) {
            value.release();
            throw new PDFTypeCheckException("Trailer is not a dictionary", offset);
        }
        PDFDictionary sectionTrailer = (PDFDictionary) value;
        try {
            PDFObject xrefStm = sectionTrailer.getNoDeref("XRefStm");
            if (xrefStm instanceof PDFNumber) {
                hybrid = true;
                if (preferXRefStream) {
                    readHybridStream(((PDFNumber) xrefStm).longValue());
                }
            }
            for (CrossReferenceEntry entry : entries) {
                xref.setEntryIfAbsent(entry);
            }
        } catch (RuntimeException e) {
            sectionTrailer.release();
            throw e;
        }
        LOGGER.debug("Read classic cross-reference section at {} with {} entries", offset, entries.size());
        return sectionTrailer;
    }

    private void readHybridStream(long offset) throws IOException {
        if (offset <= 0L || offset >= source.size()) {
            diagnostics.record(PDFErrorKind.BAD_XREF_STREAM, "/XRefStm offset " + offset, offset);
            return;
        }
        try {
            readXRefStream(offset).release();
        } catch (PDFParseException e) {
            if (diagnostics.isStopOnError()) {
                throw e;
            }
            diagnostics.record(PDFErrorKind.BAD_XREF_STREAM, e.getMessage(), offset);
        }
    }

    /**
     * Reads a cross-reference stream and stores its entries.
     *
     * @return the stream dictionary, counted
     */
    private PDFDictionary readXRefStream(long offset) throws IOException {
        source.seek(offset);
        PDFObject obj = document.getObjectParser().readObject(source, -1);
        try {
            if (!(obj instanceof PDFDictionary) || !((PDFDictionary) obj).isStream()) {
                throw new PDFSyntaxException("Cross-reference stream is not a stream", offset);
            }
            PDFDictionary dict = (PDFDictionary) obj;
            if (!dict.isName("Type", "XRef")) {
                throw new PDFSyntaxException("Cross-reference stream is not /Type /XRef", offset);
            }
            int[] widths = readWidths(dict, offset);
            long size = dict.getInteger("Size", -1L);
            long[] index = readIndex(dict, size, offset);
            ByteBuffer data = document.readStream(dict);
            int entryWidth = widths[0] + widths[1] + widths[2];
            int stored = 0;
            outer:
            for (int i = 0; i < index.length; i += 2) {
                long start = index[i];
                long count = index[i + 1];
                for (long j = 0; j < count; j++) {
                    if (data.remaining() < entryWidth) {
                        diagnostics.record(PDFErrorKind.SHORT_XREF,
                                "Cross-reference stream data ends early", offset);
                        break outer;
                    }
                    long type = widths[0] == 0 ? 1L : field(data, widths[0]);
                    long f2 = field(data, widths[1]);
                    long f3 = field(data, widths[2]);
                    int num = (int) (start + j);
                    CrossReferenceEntry entry;
                    if (type == 0L) {
                        entry = CrossReferenceEntry.free(num, (int) f3);
                    } else if (type == 1L) {
                        entry = CrossReferenceEntry.inUse(num, f2, (int) f3);
                    } else if (type == 2L) {
                        entry = CrossReferenceEntry.compressed(num, (int) f2, (int) f3);
                    } else {
                        // unknown types are references to null
                        continue;
                    }
                    if (xref.setEntryIfAbsent(entry)) {
                        stored++;
                    }
                }
            }
            LOGGER.debug("Read cross-reference stream at {}: {} entries stored", offset, stored);
            return (PDFDictionary) dict.retain();
        } finally {
            obj.release();
        }
    }

    private static int[] readWidths(PDFDictionary dict, long offset) {
        PDFObject w = dict.getNoDeref("W");
        if (!(w instanceof PDFArray) || ((PDFArray) w).size() < 3) {
            throw new PDFSyntaxException("Cross-reference stream has no valid /W", offset);
        }
        int[] widths = new int[3];
        for (int i = 0; i < 3; i++) {
            PDFObject value = ((PDFArray) w).getNoDeref(i);
            if (!(value instanceof PDFInteger)) {
                throw new PDFTypeCheckException("/W entry is not an integer", offset);
            }
            long width = ((PDFInteger) value).longValue();
            if (width < 0 || width > 8) {
                throw new PDFRangeCheckException("/W entry " + width + " out of range", offset);
            }
            widths[i] = (int) width;
        }
        return widths;
    }

    private static long[] readIndex(PDFDictionary dict, long size, long offset) {
        PDFObject index = dict.getNoDeref("Index");
        if (index == null) {
            if (size < 0) {
                throw new PDFSyntaxException("Cross-reference stream has neither /Index nor /Size", offset);
            }
            return new long[] { 0L, size };
        }
        if (!(index instanceof PDFArray) || (((PDFArray) index).size() & 1) != 0) {
            throw new PDFSyntaxException("Invalid cross-reference stream /Index", offset);
        }
        PDFArray array = (PDFArray) index;
        long[] pairs = new long[array.size()];
        for (int i = 0; i < pairs.length; i++) {
            PDFObject value = array.getNoDeref(i);
            if (!(value instanceof PDFInteger) || ((PDFInteger) value).longValue() < 0) {
                throw new PDFTypeCheckException("/Index entry is not a non-negative integer", offset);
            }
            pairs[i] = ((PDFInteger) value).longValue();
        }
        for (int i = 0; i < pairs.length; i += 2) {
            if (pairs[i] + pairs[i + 1] > PDFDocument.MAX_OBJECT_NUMBER) {
                throw new PDFRangeCheckException("/Index subsection too large", offset);
            }
        }
        return pairs;
    }

    private static long field(ByteBuffer data, int width) {
        long value = 0L;
        for (int i = 0; i < width; i++) {
            value = (value << 8) | (data.get() & 0xff);
        }
        return value;
    }

    private long readLong() throws IOException {
        long start = source.position();
        long value = 0L;
        int digits = 0;
        int c;
        while ((c = source.peek()) >= '0' && c <= '9') {
            source.read();
            value = value * 10 + (c - '0');
            if (++digits > 18) {
                throw new PDFRangeCheckException("Number too long in cross-reference table", start);
            }
        }
        if (digits == 0) {
            throw new PDFSyntaxException("Expected a number in cross-reference table", start);
        }
        return value;
    }

}
