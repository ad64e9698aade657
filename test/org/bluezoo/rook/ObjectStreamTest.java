/*
 * ObjectStreamTest.java
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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Objects stored in object streams and indexed by cross-reference
 * streams.
 */
class ObjectStreamTest {

    private static int[] members(int first, int count) {
        int[] nums = new int[count];
        for (int i = 0; i < count; i++) {
            nums[i] = first + i;
        }
        return nums;
    }

    private static String[] bodies(int first, int count) {
        String[] bodies = new String[count];
        for (int i = 0; i < count; i++) {
            bodies[i] = "<</Index " + i + " /Number " + (first + i) + ">>";
        }
        return bodies;
    }

    private static TestPDFBuilder tenMembers() {
        return new TestPDFBuilder()
                .object(1, "<</Type /Catalog /Pages 2 0 R>>")
                .object(2, "<</Type /Pages /Kids [] /Count 0>>")
                .objectStream(3, members(20, 10), bodies(20, 10));
    }

    private static byte[] finish(TestPDFBuilder builder) {
        long offset = builder.xrefStream(4, "/Root 1 0 R");
        return builder.startxref(offset).toByteArray();
    }

    private static PDFDocument open(byte[] data, PDFOptions options) throws IOException {
        return PDFDocument.open(ByteBuffer.wrap(data), options);
    }

    private static long number(PDFDocument doc, int num) throws IOException {
        try (PDFDictionary dict = (PDFDictionary) doc.dereference(num, 0)) {
            assertThat(dict.getObjectNumber()).isEqualTo(num);
            return dict.getInteger("Number", -1);
        }
    }

    @Test
    void membersResolveInAnyOrder() throws IOException {
        try (PDFDocument doc = open(finish(tenMembers()), new PDFOptions())) {
            String before;
            try (PDFObject obj = doc.dereference(23, 0)) {
                before = obj.toString();
            }
            assertThat(number(doc, 27)).isEqualTo(27L);
            try (PDFObject obj = doc.dereference(23, 0)) {
                assertThat(obj.toString()).isEqualTo(before).isEqualTo("<</Index 3 /Number 23>>");
            }
            assertThat(number(doc, 20)).isEqualTo(20L);
            assertThat(number(doc, 29)).isEqualTo(29L);
            assertThat(doc.isHybrid()).isFalse();
            assertThat(doc.getDiagnostics().isEmpty()).isTrue();
        }
    }

    @Test
    void memberTakesRequestedGeneration() throws IOException {
        try (PDFDocument doc = open(finish(tenMembers()), new PDFOptions());
             PDFObject obj = doc.dereference(22, 3)) {
            assertThat(obj.getObjectNumber()).isEqualTo(22);
            assertThat(obj.getGenerationNumber()).isEqualTo(3);
        }
    }

    @Test
    void memberAtWrongIndexIsFoundByNumber() throws IOException {
        try (PDFDocument doc = open(finish(tenMembers().misplace(25, 0)), new PDFOptions())) {
            assertThat(number(doc, 25)).isEqualTo(25L);
        }
    }

    @Test
    void missingMemberIsUndefined() throws IOException {
        try (PDFDocument doc = open(finish(tenMembers().compress(30, 3, 0)), new PDFOptions())) {
            assertThrows(PDFUndefinedException.class, () -> doc.dereference(30, 0));
        }
    }

    @Test
    void indexPastEndIsRangeError() throws IOException {
        try (PDFDocument doc = open(finish(tenMembers().compress(31, 3, 50)), new PDFOptions())) {
            assertThrows(PDFRangeCheckException.class, () -> doc.dereference(31, 0));
        }
    }

    @Test
    void containerMustBeObjectStream() throws IOException {
        try (PDFDocument doc = open(finish(tenMembers().compress(32, 1, 0)), new PDFOptions())) {
            assertThrows(PDFSyntaxException.class, () -> doc.dereference(32, 0));
        }
    }

    @Test
    void catalogMayBeCompressed() throws IOException {
        TestPDFBuilder builder = new TestPDFBuilder()
                .objectStream(3, new int[] { 1, 2 }, new String[] {
                        "<</Type /Catalog /Pages 2 0 R>>",
                        "<</Type /Pages /Kids [] /Count 0>>" });
        try (PDFDocument doc = open(finish(builder), new PDFOptions())) {
            assertThat(doc.getCatalog().getObjectNumber()).isEqualTo(1);
            assertThat(doc.getPageCount()).isZero();
        }
    }

    @Test
    void objectStreamsAreReloadedWhenEvicted() throws IOException {
        TestPDFBuilder builder = tenMembers()
                .objectStream(5, members(40, 5), bodies(40, 5));
        long offset = builder.xrefStream(6, "/Root 1 0 R");
        byte[] data = builder.startxref(offset).toByteArray();
        PDFOptions options = new PDFOptions();
        options.setCacheSize(1);
        options.setObjectStreamCacheSize(1);
        try (PDFDocument doc = open(data, options)) {
            for (int round = 0; round < 3; round++) {
                assertThat(number(doc, 21)).isEqualTo(21L);
                assertThat(number(doc, 43)).isEqualTo(43L);
            }
        }
    }

}
