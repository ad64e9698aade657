/*
 * DereferenceTest.java
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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Resolution of indirect objects: caching, loops and bad entries.
 */
class DereferenceTest {

    private static final String PAGES = "<</Type /Pages /Kids [] /Count 0>>";

    private static TestPDFBuilder base() {
        return new TestPDFBuilder()
                .object(1, "<</Type /Catalog /Pages 2 0 R>>")
                .object(2, PAGES);
    }

    private static PDFDocument open(byte[] data) throws IOException {
        return open(data, new PDFOptions());
    }

    private static PDFDocument open(byte[] data, PDFOptions options) throws IOException {
        return PDFDocument.open(ByteBuffer.wrap(data), options);
    }

    @Test
    void resolvesCatalogThroughTrailer() throws IOException {
        try (PDFDocument doc = open(base().finish("/Root 1 0 R"))) {
            assertThat(doc.getCatalog().isName("Type", "Catalog")).isTrue();
            assertThat(doc.getCatalog().getObjectNumber()).isEqualTo(1);
            try (PDFDictionary pages = doc.dictGetDictionary(doc.getCatalog(), "Pages")) {
                assertThat(pages.getObjectNumber()).isEqualTo(2);
                assertThat(pages.isName("Type", "Pages")).isTrue();
            }
            assertThat(doc.isRepaired()).isFalse();
            assertThat(doc.getDiagnostics().isEmpty()).isTrue();
        }
    }

    @Test
    void selfReferenceIsCircular() throws IOException {
        byte[] data = base().object(5, "5 0 R").finish("/Root 1 0 R");
        try (PDFDocument doc = open(data)) {
            PDFObject direct = doc.dereference(5, 0);
            assertThat(direct).isInstanceOf(PDFIndirectReference.class);
            direct.release();
            PDFIndirectReference ref = doc.getAllocator().allocReference(5, 0);
            assertThrows(CircularReferenceException.class, () -> doc.resolve(ref, 0));
            assertThat(doc.getDiagnostics().has(PDFErrorKind.CIRCULAR_REFERENCE)).isTrue();
        }
    }

    @Test
    void twoObjectLoopIsCircular() throws IOException {
        byte[] data = base().object(5, "7 0 R").object(7, "5 0 R").finish("/Root 1 0 R");
        try (PDFDocument doc = open(data)) {
            PDFIndirectReference ref = doc.getAllocator().allocReference(5, 0);
            assertThrows(CircularReferenceException.class, () -> doc.resolve(ref, 0));
            // the failed chain leaves nothing behind
            try (PDFObject obj = doc.dereference(7, 0)) {
                assertThat(obj).isInstanceOf(PDFIndirectReference.class);
            }
        }
    }

    private static void follow(PDFDocument doc, PDFDictionary start, int hops) throws IOException {
        PDFDictionary current = (PDFDictionary) start.retain();
        try {
            for (int i = 0; i < hops; i++) {
                PDFDictionary next = doc.dictGetDictionary(current, "Next");
                current.release();
                current = next;
            }
        } finally {
            current.release();
        }
    }

    @Test
    void dictionaryChainLoopIsCircularWithinScope() throws IOException {
        byte[] data = base().object(5, "<</Next 7 0 R>>").object(7, "<</Next 5 0 R>>")
                .finish("/Root 1 0 R");
        try (PDFDocument doc = open(data);
             PDFDictionary start = (PDFDictionary) doc.dereference(5, 0)) {
            doc.loopDetectorMark();
            doc.loopDetectorAdd(5);
            assertThrows(CircularReferenceException.class, () -> follow(doc, start, 1000));
            doc.loopDetectorClearToMark();
            assertThat(doc.getDiagnostics().has(PDFErrorKind.CIRCULAR_REFERENCE)).isTrue();

            // without a scope each lookup stands alone
            follow(doc, start, 10);
        }
    }

    @Test
    void resolvedObjectsStayInEnclosingScope() throws IOException {
        byte[] data = base().object(5, "<</Next 7 0 R>>").object(7, "<</Next 5 0 R>>")
                .object(9, "<</First 5 0 R>>").finish("/Root 1 0 R");
        try (PDFDocument doc = open(data);
             PDFDictionary holder = (PDFDictionary) doc.dereference(9, 0)) {
            doc.loopDetectorMark();
            try {
                try (PDFDictionary first = doc.dictGetDictionary(holder, "First");
                     PDFDictionary second = doc.dictGetDictionary(first, "Next")) {
                    assertThat(second.getObjectNumber()).isEqualTo(7);
                    assertThrows(CircularReferenceException.class, () -> doc.dictGet(second, "Next"));
                }
            } finally {
                doc.loopDetectorClearToMark();
            }
            try (PDFObject again = doc.dictGet(holder, "First")) {
                assertThat(again.getObjectNumber()).isEqualTo(5);
            }
        }
    }

    @Test
    void valueReferringToItsContainerIsCircular() throws IOException {
        byte[] data = base().object(8, "<</Self 8 0 R /Other 9 0 R>>").object(9, "(fine)")
                .finish("/Root 1 0 R");
        try (PDFDocument doc = open(data);
             PDFDictionary dict = (PDFDictionary) doc.dereference(8, 0)) {
            assertThrows(CircularReferenceException.class, () -> doc.dictGet(dict, "Self"));
            try (PDFObject other = doc.dictGet(dict, "Other")) {
                assertThat(((PDFString) other).getText()).isEqualTo("fine");
            }
        }
    }

    @Test
    void siblingsAreNotLoops() throws IOException {
        byte[] data = base().object(5, "[10 0 R 10 0 R]").object(10, "<</V 1>>").finish("/Root 1 0 R");
        try (PDFDocument doc = open(data);
             PDFArray array = (PDFArray) doc.dereference(5, 0);
             PDFObject a = doc.arrayGet(array, 0);
             PDFObject b = doc.arrayGet(array, 1)) {
            assertThat(a).isSameAs(b);
        }
    }

    @Test
    void evictedObjectsAreReadAgain() throws IOException {
        TestPDFBuilder builder = base();
        for (int i = 10; i < 20; i++) {
            builder.object(i, "<</Index " + i + " /Name (object " + i + ")>>");
        }
        PDFOptions options = new PDFOptions();
        options.setCacheSize(4);
        try (PDFDocument doc = open(builder.finish("/Root 1 0 R"), options)) {
            String[] first = new String[20];
            for (int i = 10; i < 20; i++) {
                try (PDFObject obj = doc.dereference(i, 0)) {
                    first[i] = obj.toString();
                }
            }
            assertThat(doc.getCachedObjectCount()).isLessThanOrEqualTo(4);
            for (int i = 10; i < 20; i++) {
                try (PDFObject obj = doc.dereference(i, 0)) {
                    assertThat(obj.toString()).isEqualTo(first[i]);
                    assertThat(obj.getObjectNumber()).isEqualTo(i);
                }
            }
        }
    }

    @Test
    void heldObjectSurvivesEviction() throws IOException {
        TestPDFBuilder builder = base();
        for (int i = 10; i < 15; i++) {
            builder.object(i, "[" + i + "]");
        }
        PDFOptions options = new PDFOptions();
        options.setCacheSize(1);
        try (PDFDocument doc = open(builder.finish("/Root 1 0 R"), options)) {
            PDFObject held = doc.dereference(10, 0);
            for (int i = 11; i < 15; i++) {
                doc.dereference(i, 0).release();
            }
            assertThat(held.isFreed()).isFalse();
            assertThat(held.toString()).isEqualTo("[10]");
            held.release();
        }
    }

    @Test
    void freeAndUndefinedEntriesAreNull() throws IOException {
        byte[] data = base().object(4, "(four)").finish("/Root 1 0 R");
        try (PDFDocument doc = open(data)) {
            assertThat(doc.dereference(3, 0)).isSameAs(doc.getAllocator().getNull());
            assertThat(doc.dereference(0, 65535)).isSameAs(doc.getAllocator().getNull());
        }
    }

    @Test
    void numberOutsideTableIsRangeError() throws IOException {
        try (PDFDocument doc = open(base().finish("/Root 1 0 R"))) {
            assertThrows(PDFRangeCheckException.class, () -> doc.dereference(99, 0));
            assertThrows(PDFRangeCheckException.class, () -> doc.dereference(-1, 0));
            assertThat(doc.getDiagnostics().has(PDFErrorKind.BAD_OBJECT_NUMBER)).isTrue();
        }
    }

    @Test
    void wrongObjectAtOffsetIsUndefined() throws IOException {
        byte[] data = base().object(4, "(four)").alias(5, 4).finish("/Root 1 0 R");
        try (PDFDocument doc = open(data)) {
            assertThrows(PDFUndefinedException.class, () -> doc.dereference(5, 0));
        }
    }

    @Test
    void typedAccessChecksTypes() throws IOException {
        byte[] data = base().object(5, "<</N 3 /R 2.5 /S (x) /A [1 2]>>").finish("/Root 1 0 R");
        try (PDFDocument doc = open(data);
             PDFDictionary dict = (PDFDictionary) doc.dereference(5, 0)) {
            assertThat(doc.dictGetInteger(dict, "N")).isEqualTo(3L);
            assertThat(doc.dictGetNumber(dict, "R")).isEqualTo(2.5);
            assertThat(doc.dictGetNumber(dict, "N")).isEqualTo(3.0);
            assertThrows(PDFTypeCheckException.class, () -> doc.dictGetInteger(dict, "R"));
            assertThrows(PDFTypeCheckException.class, () -> doc.dictGetName(dict, "S"));
            assertThrows(PDFUndefinedException.class, () -> doc.dictGet(dict, "Missing"));
            assertThat(doc.dictKnownGet(dict, "Missing")).isNull();
            try (PDFArray array = doc.dictGetArray(dict, "A")) {
                assertThat(array.size()).isEqualTo(2);
                assertThrows(PDFRangeCheckException.class, () -> doc.arrayGet(array, 2));
            }
        }
    }

    @Test
    void streamLengthMayBeIndirect() throws IOException {
        byte[] data = base()
                .stream(5, "/Length 6 0 R", "0123456789")
                .object(6, "10")
                .finish("/Root 1 0 R");
        try (PDFDocument doc = open(data);
             PDFDictionary stream = (PDFDictionary) doc.dereference(5, 0)) {
            assertThat(stream.isStream()).isTrue();
            assertThat(stream.getStreamLength()).isEqualTo(10L);
            assertThat(text(doc.readStream(stream))).isEqualTo("0123456789");
            assertThat(doc.getDiagnostics().isEmpty()).isTrue();
        }
    }

    @Test
    void wrongStreamLengthIsRecovered() throws IOException {
        byte[] data = base()
                .stream(5, "/Length 3", "0123456789")
                .stream(6, "/Length 1000", "abc")
                .finish("/Root 1 0 R");
        try (PDFDocument doc = open(data)) {
            try (PDFDictionary stream = (PDFDictionary) doc.dereference(5, 0)) {
                assertThat(text(doc.readStream(stream))).isEqualTo("0123456789");
            }
            try (PDFDictionary stream = (PDFDictionary) doc.dereference(6, 0)) {
                assertThat(text(doc.readStream(stream))).isEqualTo("abc");
            }
            assertThat(doc.getDiagnostics().has(PDFErrorKind.BAD_STREAM_LENGTH)).isTrue();
            assertThat(doc.getDiagnostics().getKinds()).containsOnly(PDFErrorKind.BAD_STREAM_LENGTH);
        }
    }

    @Test
    void streamLengthReferringToItselfIsCircular() throws IOException {
        byte[] data = base().stream(5, "/Length 5 0 R", "data").finish("/Root 1 0 R");
        try (PDFDocument doc = open(data)) {
            assertThrows(CircularReferenceException.class, () -> doc.dereference(5, 0));
        }
    }

    @Test
    void missingEndobjIsTolerated() throws IOException {
        byte[] data = base()
                .mark(5).raw("5 0 obj\n(five)\n")
                .object(6, "(six)")
                .finish("/Root 1 0 R");
        try (PDFDocument doc = open(data);
             PDFObject five = doc.dereference(5, 0);
             PDFObject six = doc.dereference(6, 0)) {
            assertThat(((PDFString) five).getText()).isEqualTo("five");
            assertThat(((PDFString) six).getText()).isEqualTo("six");
            assertThat(doc.getDiagnostics().has(PDFErrorKind.MISSING_ENDOBJ)).isTrue();
        }
    }

    @Test
    void everythingIsReleasedOnClose() throws IOException {
        byte[] data = TestPDFBuilder.twoPages().finish("/Root 1 0 R /Info 6 0 R");
        PDFDocument doc = open(data);
        ObjectAllocator allocator = doc.getAllocator();
        for (int i = 0; i < doc.getPageCount(); i++) {
            doc.getPageDictionary(i).release();
        }
        doc.processPages((d, stream, page) -> d.readStream(stream));
        doc.close();
        assertThat(allocator.liveCount()).isZero();
    }

    static String text(ByteBuffer data) {
        byte[] bytes = new byte[data.remaining()];
        data.duplicate().get(bytes);
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

}
