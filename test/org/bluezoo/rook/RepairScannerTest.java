/*
 * RepairScannerTest.java
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
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Scanning damaged files for object headers, and rebuilding the
 * cross-reference table from what is found.
 */
class RepairScannerTest {

    private static PDFSource source(String text) {
        return PDFSource.wrap(ByteBuffer.wrap(text.getBytes(StandardCharsets.ISO_8859_1)));
    }

    private static List<RepairScanner.Discovery> scanAll(RepairScanner scanner) {
        List<RepairScanner.Discovery> found = new ArrayList<>();
        while (scanner.hasNext()) {
            found.add(scanner.next());
        }
        return found;
    }

    @Test
    void findsObjectHeaders() {
        String text = "%PDF-1.4\n1 0 obj\n<</A 2 0 R>>\nendobj\n  12 3 obj\n[1 2 3]\nendobj\n";
        RepairScanner scanner = new RepairScanner(source(text), 0L);
        List<RepairScanner.Discovery> found = scanAll(scanner);
        assertThat(found).hasSize(2);
        assertThat(found.get(0).getObjectNumber()).isEqualTo(1);
        assertThat(found.get(0).getGeneration()).isEqualTo(0);
        assertThat(found.get(0).getOffset()).isEqualTo(text.indexOf("1 0 obj"));
        assertThat(found.get(1).getObjectNumber()).isEqualTo(12);
        assertThat(found.get(1).getGeneration()).isEqualTo(3);
        assertThat(found.get(1).getOffset()).isEqualTo(text.indexOf("12 3 obj"));
        assertThat(scanner.getState()).isEqualTo(RepairScanner.State.DONE);
    }

    @Test
    void ignoresHeadersInStringsAndComments() {
        String text = "1 0 obj\n<</T (2 0 obj \\) 3 0 obj (nested 4 0 obj))>>\nendobj\n"
                + "% 5 0 obj\n<6 0 6F626A>\n7 0 obj\nnull\nendobj\n";
        List<RepairScanner.Discovery> found = scanAll(new RepairScanner(source(text), 0L));
        assertThat(found).extracting(RepairScanner.Discovery::getObjectNumber).containsExactly(1, 7);
    }

    @Test
    void skipsStreamData() {
        String text = "1 0 obj\n<</Length 20>>\nstream\n2 0 obj endobj junk\nendstream\nendobj\n"
                + "3 0 obj\n42\nendobj\n";
        List<RepairScanner.Discovery> found = scanAll(new RepairScanner(source(text), 0L));
        assertThat(found).extracting(RepairScanner.Discovery::getObjectNumber).containsExactly(1, 3);
    }

    @Test
    void unterminatedStreamEndsScan() {
        String text = "1 0 obj\n<<>>\nstream\n2 0 obj\n";
        RepairScanner scanner = new RepairScanner(source(text), 0L);
        assertThat(scanAll(scanner)).hasSize(1);
        assertThat(scanner.getState()).isEqualTo(RepairScanner.State.DONE);
    }

    @Test
    void rejectsOutOfRangeNumbers() {
        String text = "0 0 obj\nnull\nendobj\n1 70000 obj\nnull\nendobj\n99999999 0 obj\nnull\nendobj\n";
        assertThat(scanAll(new RepairScanner(source(text), 0L))).isEmpty();
    }

    @Test
    void recordsTrailerOffsets() {
        String text = "1 0 obj\n1\nendobj\ntrailer\n<</Size 2>>\ntrailer <</Size 3>>\n";
        RepairScanner scanner = new RepairScanner(source(text), 0L);
        scanAll(scanner);
        int first = text.indexOf("trailer") + "trailer".length();
        int second = text.lastIndexOf("trailer") + "trailer".length();
        assertThat(scanner.getTrailerOffsets()).containsExactly((long) first, (long) second);
    }

    @Test
    void nextAfterEndThrows() {
        RepairScanner scanner = new RepairScanner(source("nothing here"), 0L);
        assertThat(scanner.hasNext()).isFalse();
        assertThrows(java.util.NoSuchElementException.class, scanner::next);
    }

    // -- Whole-document repair --

    private static final String TRAILER = "/Root 1 0 R /Info 6 0 R";

    private static PDFDocument open(byte[] data) throws IOException {
        return PDFDocument.open(ByteBuffer.wrap(data), new PDFOptions());
    }

    private static void assertTwoPages(PDFDocument doc) throws IOException {
        assertThat(doc.getPageCount()).isEqualTo(2);
        try (PDFDictionary page = doc.getPageDictionary(1)) {
            assertThat(page.getObjectNumber()).isEqualTo(4);
            assertThat(page.getNoDeref("MediaBox").toString()).isEqualTo("[0 0 100 100]");
        }
    }

    @Test
    void badStartxrefIsRepaired() throws IOException {
        TestPDFBuilder builder = TestPDFBuilder.twoPages();
        long xref = builder.xref(TRAILER);
        builder.startxref(xref + 3);
        try (PDFDocument doc = open(builder.toByteArray())) {
            assertThat(doc.isRepaired()).isTrue();
            assertThat(doc.getDiagnostics().has(PDFErrorKind.REPAIRED)).isTrue();
            assertThat(doc.getProducer()).isEqualTo("Rook Test Suite");
            assertTwoPages(doc);
        }
    }

    @Test
    void startxrefPastEndIsRepaired() throws IOException {
        TestPDFBuilder builder = TestPDFBuilder.twoPages();
        builder.xref(TRAILER);
        builder.startxref(1000000L);
        try (PDFDocument doc = open(builder.toByteArray())) {
            assertThat(doc.getDiagnostics().has(PDFErrorKind.BAD_STARTXREF)).isTrue();
            assertThat(doc.isRepaired()).isTrue();
            assertTwoPages(doc);
        }
    }

    @Test
    void trailerWithoutTableIsUsed() throws IOException {
        TestPDFBuilder builder = TestPDFBuilder.twoPages();
        builder.raw("trailer\n<<" + TRAILER + ">>\n%%EOF\n");
        try (PDFDocument doc = open(builder.toByteArray())) {
            assertThat(doc.getDiagnostics().has(PDFErrorKind.NO_STARTXREF)).isTrue();
            assertThat(doc.isRepaired()).isTrue();
            assertThat(doc.getInfo()).isNotNull();
            assertTwoPages(doc);
        }
    }

    @Test
    void catalogIsFoundWithoutTrailer() throws IOException {
        byte[] data = TestPDFBuilder.twoPages().toByteArray();
        try (PDFDocument doc = open(data)) {
            assertThat(doc.isRepaired()).isTrue();
            assertThat(doc.getCatalog().getObjectNumber()).isEqualTo(1);
            assertThat(doc.getInfo()).isNull();
            assertTwoPages(doc);
        }
    }

    @Test
    void laterCopyOfAnObjectWins() throws IOException {
        TestPDFBuilder builder = TestPDFBuilder.twoPages();
        builder.object(6, "<</Producer (Second Copy)>>");
        builder.raw("trailer\n<<" + TRAILER + ">>\n");
        try (PDFDocument doc = open(builder.toByteArray())) {
            assertThat(doc.getProducer()).isEqualTo("Second Copy");
        }
    }

    @Test
    void compressedObjectsAreRecovered() throws IOException {
        TestPDFBuilder builder = new TestPDFBuilder()
                .objectStream(3, new int[] { 1, 2, 5 }, new String[] {
                    "<</Type /Catalog /Pages 2 0 R>>",
                    "<</Type /Pages /Kids [6 0 R] /Count 1>>",
                    "<</Producer (Packed)>>"
                })
                .object(6, "<</Type /Page /MediaBox [0 0 10 10]>>");
        long stream = builder.xrefStream(4, "/Root 1 0 R /Info 5 0 R");
        builder.startxref(stream + 1);
        try (PDFDocument doc = open(builder.toByteArray())) {
            assertThat(doc.isRepaired()).isTrue();
            assertThat(doc.getCatalog().isName("Type", "Catalog")).isTrue();
            assertThat(doc.getProducer()).isEqualTo("Packed");
            assertThat(doc.getPageCount()).isEqualTo(1);
            try (PDFDictionary page = doc.getPageDictionary(0)) {
                assertThat(page.getObjectNumber()).isEqualTo(6);
            }
        }
    }

    @Test
    void strictModeDoesNotRepair() {
        TestPDFBuilder builder = TestPDFBuilder.twoPages();
        long xref = builder.xref(TRAILER);
        builder.startxref(xref + 3);
        PDFOptions options = new PDFOptions();
        options.setStopOnError(true);
        assertThrows(PDFParseException.class,
                () -> PDFDocument.open(ByteBuffer.wrap(builder.toByteArray()), options));
    }

    @Test
    void repairedDocumentReleasesEverything() throws IOException {
        TestPDFBuilder builder = TestPDFBuilder.twoPages();
        builder.raw("trailer\n<<" + TRAILER + ">>\n");
        PDFDocument doc = open(builder.toByteArray());
        ObjectAllocator allocator = doc.getAllocator();
        doc.getPageDictionary(0).release();
        doc.close();
        assertThat(allocator.liveCount()).isZero();
    }

}
