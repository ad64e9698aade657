/*
 * ObjectStackTest.java
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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ObjectStackTest {

    private final ObjectAllocator allocator = new ObjectAllocator();
    private final ObjectStack stack = new ObjectStack(allocator, 8);

    @Test
    void pushRetainsAndPopReleases() {
        PDFInteger i = allocator.allocInteger(1);
        stack.push(i);
        assertThat(i.refCount()).isEqualTo(1);
        stack.pop();
        assertThat(i.isFreed()).isTrue();
    }

    @Test
    void takeTransfersOwnership() {
        stack.push(allocator.allocInteger(1));
        PDFObject obj = stack.take();
        assertThat(stack.size()).isZero();
        assertThat(obj.refCount()).isEqualTo(1);
        obj.release();
    }

    @Test
    void buildsArrayAboveMark() {
        stack.push(allocator.allocInteger(0));
        stack.markStack(PDFObjectType.ARRAY_MARK);
        stack.push(allocator.allocInteger(1));
        stack.push(allocator.allocInteger(2));
        assertThat(stack.countToMark()).isEqualTo(2);
        PDFArray array = stack.arrayFromStack(PDFObjectType.ARRAY_MARK);
        assertThat(array.size()).isEqualTo(2);
        assertThat(stack.size()).isEqualTo(2);
        assertThat(stack.peek(0)).isSameAs(array);
        assertThat(((PDFInteger) array.getNoDeref(1)).longValue()).isEqualTo(2L);
    }

    @Test
    void buildsDictionaryAboveMark() {
        stack.markStack(PDFObjectType.DICT_MARK);
        stack.push(allocator.allocName("A"));
        stack.push(allocator.allocInteger(1));
        PDFDictionary dict = stack.dictionaryFromStack();
        assertThat(dict.getInteger("A", 0)).isEqualTo(1L);
        assertThat(stack.size()).isEqualTo(1);
    }

    @Test
    void dictionaryRejectsBadEntries() {
        stack.markStack(PDFObjectType.DICT_MARK);
        stack.push(allocator.allocName("A"));
        assertThrows(PDFSyntaxException.class, stack::dictionaryFromStack);
        stack.push(allocator.allocInteger(1));
        stack.push(allocator.allocInteger(2));
        stack.push(allocator.allocInteger(3));
        assertThrows(PDFTypeCheckException.class, stack::dictionaryFromStack);
    }

    @Test
    void mismatchedMarkIsRejected() {
        stack.markStack(PDFObjectType.DICT_MARK);
        assertThat(stack.nearestMarkType()).isEqualTo(PDFObjectType.DICT_MARK);
        assertThrows(PDFSyntaxException.class, () -> stack.arrayFromStack(PDFObjectType.ARRAY_MARK));
    }

    @Test
    void clearToMarkDropsMarkedEntries() {
        stack.push(allocator.allocInteger(0));
        stack.markStack(PDFObjectType.PROC_MARK);
        stack.push(allocator.allocInteger(1));
        stack.clearToMark();
        assertThat(stack.size()).isEqualTo(1);
        assertThat(stack.countToMark()).isEqualTo(-1);
        assertThrows(PDFSyntaxException.class, stack::clearToMark);
    }

    @Test
    void overflowAndUnderflowAreRangeErrors() {
        for (int i = 0; i < 8; i++) {
            stack.push(allocator.getNull());
        }
        assertThrows(PDFRangeCheckException.class, () -> stack.push(allocator.getNull()));
        stack.clear();
        assertThrows(PDFRangeCheckException.class, stack::pop);
        assertThrows(PDFRangeCheckException.class, () -> stack.peek(0));
        assertThat(allocator.liveCount()).isZero();
    }

}
