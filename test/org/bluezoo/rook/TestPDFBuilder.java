/*
 * TestPDFBuilder.java
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
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.Deflater;

/**
 * Writes small PDF files for tests, keeping track of object offsets so
 * that cross-reference sections can be generated.
 */
final class TestPDFBuilder {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final Map<Integer, Long> offsets = new TreeMap<>();
    private final Map<Integer, int[]> compressed = new TreeMap<>();

    TestPDFBuilder() {
        this("%PDF-1.7\n%âãÏÓ\n");
    }

    TestPDFBuilder(String header) {
        raw(header);
    }

    TestPDFBuilder raw(String s) {
        return raw(s.getBytes(StandardCharsets.ISO_8859_1));
    }

    TestPDFBuilder raw(byte[] bytes) {
        out.write(bytes, 0, bytes.length);
        return this;
    }

    long position() {
        return out.size();
    }

    long offsetOf(int num) {
        return offsets.get(num);
    }

    TestPDFBuilder object(int num, String body) {
        offsets.put(num, position());
        return raw(num + " 0 obj\n" + body + "\nendobj\n");
    }

    /**
     * Writes a stream object. The dictionary entries are given without
     * the enclosing brackets; /Length is added unless present.
     */
    TestPDFBuilder stream(int num, String entries, byte[] data) {
        offsets.put(num, position());
        String dict = entries.contains("/Length") ? entries : entries + " /Length " + data.length;
        raw(num + " 0 obj\n<<" + dict + ">>\nstream\n");
        raw(data);
        return raw("\nendstream\nendobj\n");
    }

    TestPDFBuilder stream(int num, String entries, String data) {
        return stream(num, entries, data.getBytes(StandardCharsets.ISO_8859_1));
    }

    /**
     * Writes an object stream holding the given objects, compressed with
     * FlateDecode.
     */
    TestPDFBuilder objectStream(int num, int[] members, String[] bodies) {
        StringBuilder header = new StringBuilder();
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < members.length; i++) {
            header.append(members[i]).append(' ').append(body.length()).append(' ');
            body.append(bodies[i]).append('\n');
            compressed.put(members[i], new int[] { num, i });
        }
        String data = header.toString() + body;
        byte[] deflated = deflate(data.getBytes(StandardCharsets.ISO_8859_1));
        return stream(num, "/Type /ObjStm /N " + members.length + " /First " + header.length()
                + " /Filter /FlateDecode", deflated);
    }

    /**
     * Records the current position as the offset of an object written
     * with {@link #raw}.
     */
    TestPDFBuilder mark(int num) {
        offsets.put(num, position());
        return this;
    }

    /**
     * Points a cross-reference entry at another object's offset.
     */
    TestPDFBuilder alias(int num, int other) {
        offsets.put(num, offsets.get(other));
        return this;
    }

    /**
     * Sets the offset a cross-reference entry points at.
     */
    TestPDFBuilder offset(int num, long offset) {
        offsets.put(num, offset);
        return this;
    }

    /**
     * Adds a compressed entry for an object that need not exist.
     */
    TestPDFBuilder compress(int num, int streamNumber, int index) {
        compressed.put(num, new int[] { streamNumber, index });
        return this;
    }

    /**
     * Gives a compressed object the wrong index in its object stream.
     */
    TestPDFBuilder misplace(int num, int index) {
        compressed.get(num)[1] = index;
        return this;
    }

    int size() {
        int max = 0;
        for (int num : offsets.keySet()) {
            max = Math.max(max, num);
        }
        for (int num : compressed.keySet()) {
            max = Math.max(max, num);
        }
        return max + 1;
    }

    /**
     * Writes a classic cross-reference section covering every object
     * written so far, followed by a trailer.
     *
     * @param trailerEntries extra trailer entries, such as "/Root 1 0 R"
     * @return the offset of the section
     */
    long xref(String trailerEntries) {
        long start = position();
        int size = size();
        StringBuilder sb = new StringBuilder("xref\n0 " + size + "\n");
        sb.append("0000000000 65535 f \n");
        for (int num = 1; num < size; num++) {
            Long offset = offsets.get(num);
            if (offset == null || compressed.containsKey(num)) {
                sb.append("0000000000 00000 f \n");
            } else {
                sb.append(String.format("%010d 00000 n \n", offset));
            }
        }
        sb.append("trailer\n<</Size ").append(size).append(' ').append(trailerEntries).append(">>\n");
        raw(sb.toString());
        return start;
    }

    /**
     * Writes a cross-reference stream covering every object written so
     * far, including itself.
     *
     * @param num the object number of the stream
     * @param entries extra dictionary entries, such as "/Root 1 0 R"
     * @return the offset of the stream
     */
    long xrefStream(int num, String entries) {
        long start = position();
        offsets.put(num, start);
        int size = size();
        ByteArrayOutputStream data = new ByteArrayOutputStream();
        for (int i = 0; i < size; i++) {
            int[] member = compressed.get(i);
            Long offset = offsets.get(i);
            if (member != null) {
                entry(data, 2, member[0], member[1]);
            } else if (offset != null) {
                entry(data, 1, offset, 0);
            } else {
                entry(data, 0, 0, i == 0 ? 65535 : 0);
            }
        }
        stream(num, "/Type /XRef /Size " + size + " /W [1 4 2] " + entries, data.toByteArray());
        return start;
    }

    private static void entry(ByteArrayOutputStream data, int type, long f2, int f3) {
        data.write(type);
        data.write((int) (f2 >> 24));
        data.write((int) (f2 >> 16));
        data.write((int) (f2 >> 8));
        data.write((int) f2);
        data.write(f3 >> 8);
        data.write(f3);
    }

    TestPDFBuilder startxref(long offset) {
        return raw("startxref\n" + offset + "\n%%EOF\n");
    }

    /**
     * Writes a classic cross-reference section and the file tail.
     */
    byte[] finish(String trailerEntries) {
        startxref(xref(trailerEntries));
        return toByteArray();
    }

    byte[] toByteArray() {
        return out.toByteArray();
    }

    ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(toByteArray());
    }

    static byte[] deflate(byte[] data) {
        Deflater deflater = new Deflater();
        deflater.setInput(data);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[1024];
        while (!deflater.finished()) {
            int n = deflater.deflate(buf);
            out.write(buf, 0, n);
        }
        deflater.end();
        return out.toByteArray();
    }

    /**
     * A minimal two page document: catalog 1, page tree 2, pages 3 and 4,
     * content stream 5 and info 6.
     */
    static TestPDFBuilder twoPages() {
        return new TestPDFBuilder()
                .object(1, "<</Type /Catalog /Pages 2 0 R>>")
                .object(2, "<</Type /Pages /Kids [3 0 R 4 0 R] /Count 2 /MediaBox [0 0 612 792]"
                        + " /Resources <</Font <<>>>>>>")
                .object(3, "<</Type /Page /Parent 2 0 R /Contents 5 0 R>>")
                .object(4, "<</Type /Page /Parent 2 0 R /MediaBox [0 0 100 100]>>")
                .stream(5, "", "BT /F1 12 Tf (Hello) Tj ET")
                .object(6, "<</Producer (Rook Test Suite)>>");
    }

}
