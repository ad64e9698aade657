/*
 * PDFTokenReaderTest.java
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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for the tokenizer, including its handling of malformed input.
 */
class PDFTokenReaderTest {

    private ObjectAllocator allocator;
    private PDFDiagnostics diagnostics;
    private PDFTokenReader reader;
    private ObjectStack stack;
    private PDFSource src;

    @BeforeEach
    void setUp() {
        allocator = new ObjectAllocator();
        diagnostics = new PDFDiagnostics(false, null);
        reader = new PDFTokenReader(allocator, diagnostics);
        stack = new ObjectStack(allocator, 1000);
    }

    /**
     * Reads tokens until one complete value is on top of the stack.
     */
    private PDFObject read(String input) throws IOException {
        src = PDFSource.wrap(ByteBuffer.wrap(input.getBytes(StandardCharsets.ISO_8859_1)));
        int base = stack.size();
        do {
            assertThat(reader.readToken(src, stack)).isTrue();
        } while (stack.size() <= base || stack.countToMark() >= 0);
        return stack.peek(0);
    }

    private PDFObject next() throws IOException {
        assertThat(reader.readToken(src, stack)).isTrue();
        return stack.peek(0);
    }

    @Test
    void readsNumbers() throws IOException {
        assertThat(((PDFInteger) read("42")).longValue()).isEqualTo(42L);
        assertThat(((PDFInteger) read("-17")).longValue()).isEqualTo(-17L);
        assertThat(((PDFInteger) read("+3")).longValue()).isEqualTo(3L);
        assertThat(((PDFReal) read(".5")).doubleValue()).isEqualTo(0.5);
        assertThat(((PDFReal) read("4.")).doubleValue()).isEqualTo(4.0);
        assertThat(((PDFReal) read("-0.25")).doubleValue()).isEqualTo(-0.25);
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void integerOverflowBecomesReal() throws IOException {
        PDFObject value = read("99999999999999999999");
        assertThat(value).isInstanceOf(PDFReal.class);
        assertThat(((PDFReal) value).doubleValue()).isEqualTo(1e20);
    }

    @Test
    void malformedNumberReadsAsZero() throws IOException {
        PDFObject value = read("12.5.3 7");
        assertThat(value).isInstanceOf(PDFInteger.class);
        assertThat(((PDFInteger) value).longValue()).isZero();
        assertThat(diagnostics.has(PDFErrorKind.MALFORMED_NUMBER)).isTrue();
        assertThat(src.position()).isEqualTo(6L);
        assertThat(((PDFInteger) next()).longValue()).isEqualTo(7L);
    }

    @Test
    void signInsideNumberIsMalformed() throws IOException {
        assertThat(((PDFInteger) read("1-2")).longValue()).isZero();
        assertThat(diagnostics.has(PDFErrorKind.MALFORMED_NUMBER)).isTrue();
    }

    @Test
    void numberRunningIntoNameIsRecorded() throws IOException {
        assertThat(((PDFInteger) read("12/Name")).longValue()).isEqualTo(12L);
        assertThat(next()).isInstanceOf(PDFName.class);
        assertThat(diagnostics.has(PDFErrorKind.MISSING_WHITESPACE)).isFalse();

        assertThat(((PDFInteger) read("12abc")).longValue()).isEqualTo(12L);
        assertThat(diagnostics.has(PDFErrorKind.MISSING_WHITESPACE)).isTrue();
        assertThat(((PDFKeyword) next()).getText()).isEqualTo("abc");
    }

    @Test
    void decodesNameEscapes() throws IOException {
        PDFName name = (PDFName) read("/A#20B#2f");
        assertThat(name.getValue()).isEqualTo("A B/");
        assertThat(((PDFName) read("/")).getBytes()).isEmpty();
    }

    @Test
    void decodesLiteralStringEscapes() throws IOException {
        PDFString s = (PDFString) read("(a\\(b\\)\\n\\101\\0532 (nested) \\\ncontinued\\q)");
        assertThat(new String(s.getBytes(), StandardCharsets.ISO_8859_1))
                .isEqualTo("a(b)\nA+2 (nested) continuedq");
    }

    @Test
    void normalizesLineEndsInStrings() throws IOException {
        PDFString s = (PDFString) read("(a\r\nb\rc)");
        assertThat(new String(s.getBytes(), StandardCharsets.ISO_8859_1)).isEqualTo("a\nb\nc");
    }

    @Test
    void escapesForReturnAndBackspace() throws IOException {
        PDFString s = (PDFString) read("(\\r\\b\\f\\t)");
        assertThat(s.getBytes()).containsExactly('\r', '\b', '\f', '\t');
    }

    @Test
    void unterminatedStringIsRecorded() throws IOException {
        PDFString s = (PDFString) read("(abc");
        assertThat(s.getText()).isEqualTo("abc");
        assertThat(diagnostics.has(PDFErrorKind.UNTERMINATED_STRING)).isTrue();
    }

    @Test
    void readsHexStrings() throws IOException {
        PDFString s = (PDFString) read("<48 65 6C6C 6F7>");
        assertThat(s.getBytes()).containsExactly('H', 'e', 'l', 'l', 'o', 0x70);
    }

    @Test
    void readsUnicodeText() throws IOException {
        PDFString s = (PDFString) read("<FEFF00410042>");
        assertThat(s.getText()).isEqualTo("AB");
    }

    @Test
    void readsArraysAndDictionaries() throws IOException {
        PDFArray array = (PDFArray) read("[1 [2 3] /N (s) <</K true>>]");
        assertThat(array.size()).isEqualTo(5);
        assertThat(array.getNoDeref(1)).isInstanceOf(PDFArray.class);
        PDFDictionary dict = (PDFDictionary) array.getNoDeref(4);
        assertThat(((PDFBoolean) dict.getNoDeref("K")).booleanValue()).isTrue();
        assertThat(stack.size()).isEqualTo(1);
    }

    @Test
    void procedureBecomesArray() throws IOException {
        PDFArray array = (PDFArray) read("{1 2 add}");
        assertThat(array.size()).isEqualTo(3);
        assertThat(array.getNoDeref(2)).isInstanceOf(PDFKeyword.class);
    }

    @Test
    void readsReferences() throws IOException {
        PDFArray array = (PDFArray) read("[12 3 R]");
        PDFIndirectReference ref = (PDFIndirectReference) array.getNoDeref(0);
        assertThat(ref.getTargetNumber()).isEqualTo(12);
        assertThat(ref.getTargetGeneration()).isEqualTo(3);
    }

    @Test
    void referenceWithoutNumbersIsAnError() throws IOException {
        PDFObject value = read("/X R");
        assertThat(value).isInstanceOf(PDFName.class);
        PDFKeyword keyword = (PDFKeyword) next();
        assertThat(keyword.getKeyword()).isEqualTo(PDFKeyword.Keyword.UNRECOGNIZED);
        assertThat(diagnostics.has(PDFErrorKind.TOKEN_ERROR)).isTrue();
    }

    @Test
    void readsLiteralKeywords() throws IOException {
        assertThat(((PDFBoolean) read("true")).booleanValue()).isTrue();
        assertThat(((PDFBoolean) read("false")).booleanValue()).isFalse();
        assertThat(read("null")).isSameAs(allocator.getNull());
        assertThat(((PDFKeyword) read("endobj")).getKeyword()).isEqualTo(PDFKeyword.Keyword.ENDOBJ);
    }

    @Test
    void overlongKeywordIsRecorded() throws IOException {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 300; i++) {
            sb.append('k');
        }
        PDFKeyword keyword = (PDFKeyword) read(sb + " 1");
        assertThat(keyword.getKeyword()).isEqualTo(PDFKeyword.Keyword.TOO_LONG);
        assertThat(diagnostics.has(PDFErrorKind.KEYWORD_TOO_LONG)).isTrue();
        assertThat(((PDFInteger) next()).longValue()).isEqualTo(1L);
    }

    @Test
    void danglingDictionaryKeyIsDropped() throws IOException {
        PDFDictionary dict = (PDFDictionary) read("<</A 1 /B>>");
        assertThat(dict.size()).isEqualTo(1);
        assertThat(dict.knownNoDeref("A")).isTrue();
        assertThat(dict.knownNoDeref("B")).isFalse();
        assertThat(diagnostics.has(PDFErrorKind.BAD_DICTIONARY)).isTrue();
    }

    @Test
    void nonNameKeyIsDropped() throws IOException {
        PDFDictionary dict = (PDFDictionary) read("<</A 1 2 3 /C 4>>");
        assertThat(dict.size()).isEqualTo(2);
        assertThat(dict.knownNoDeref("C")).isTrue();
        assertThat(diagnostics.has(PDFErrorKind.BAD_DICTIONARY)).isTrue();
    }

    @Test
    void strayDelimitersAreSkipped() throws IOException {
        assertThat(((PDFInteger) read(") ] 5")).longValue()).isEqualTo(5L);
        assertThat(diagnostics.has(PDFErrorKind.TOKEN_ERROR)).isTrue();
    }

    @Test
    void commentsAreIgnored() throws IOException {
        assertThat(((PDFInteger) read("% comment\n 8")).longValue()).isEqualTo(8L);
    }

    @Test
    void streamKeywordConsumesEndOfLine() throws IOException {
        read("stream\r\nDATA");
        assertThat(src.position()).isEqualTo(8L);
        stack.clear();
        read("stream\rDATA");
        assertThat(src.position()).isEqualTo(7L);
    }

    @Test
    void endOfInputReturnsFalse() throws IOException {
        src = PDFSource.wrap(ByteBuffer.wrap("   % only a comment".getBytes(StandardCharsets.ISO_8859_1)));
        assertThat(reader.readToken(src, stack)).isFalse();
        assertThat(stack.size()).isZero();
    }

    @Test
    void strictModeThrows() {
        diagnostics = new PDFDiagnostics(true, null);
        reader = new PDFTokenReader(allocator, diagnostics);
        assertThrows(PDFSyntaxException.class, () -> read("1.2.3"));
        assertThrows(PDFSyntaxException.class, () -> read("<</A>>"));
    }

    @Test
    void clearingTheStackFreesEverything() throws IOException {
        read("[1 (two) /three <</four [5.0]>>]");
        stack.clear();
        assertThat(allocator.liveCount()).isZero();
    }

}
