/*
 * ObjectStack.java
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

/**
 * The interpreter stack on which the token reader stages objects.
 * <p>
 * Pushing an object retains it and popping releases it, so an object
 * read from the file lives exactly as long as something holds it.
 * {@link #take} removes the top entry and hands its counted reference
 * to the caller instead of releasing it.
 * <p>
 * Composite values are bracketed by marks: the reader pushes a mark on
 * {@code [} or {@code <<} and, on the matching close, collapses the
 * entries above the mark into a single array or dictionary.
 * <p>
 * One stack serves a whole document. Callers record {@link #size} before
 * reading and only look at entries above that depth, which lets a nested
 * read (resolving a stream length, say) run above a partly built object.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ObjectStack {

    private final ObjectAllocator allocator;
    private final int maxDepth;
    private PDFObject[] stack;
    private int top;

    public ObjectStack(ObjectAllocator allocator, int maxDepth) {
        this.allocator = allocator;
        this.maxDepth = maxDepth;
        this.stack = new PDFObject[Math.min(maxDepth, 64)];
    }

    public int size() {
        return top;
    }

    /**
     * Pushes an object, retaining it.
     *
     * @param obj the object
     * @throws PDFRangeCheckException if the stack is full
     */
    public void push(PDFObject obj) {
        if (top == maxDepth) {
            throw new PDFRangeCheckException("Interpreter stack overflow (" + maxDepth + ")");
        }
        if (top == stack.length) {
            PDFObject[] grown = new PDFObject[Math.min(stack.length * 2, maxDepth)];
            System.arraycopy(stack, 0, grown, 0, top);
            stack = grown;
        }
        stack[top++] = obj.retain();
    }

    /**
     * Pops and releases the top entry.
     */
    public void pop() {
        pop(1);
    }

    /**
     * Pops and releases entries.
     *
     * @param count the number of entries to pop
     */
    public void pop(int count) {
        if (count > top) {
            throw new PDFRangeCheckException("Stack underflow");
        }
        for (int i = 0; i < count; i++) {
            PDFObject obj = stack[--top];
            stack[top] = null;
            obj.release();
        }
    }

    /**
     * Removes the top entry, transferring its counted reference to the
     * caller.
     *
     * @return the former top entry
     */
    public PDFObject take() {
        if (top == 0) {
            throw new PDFRangeCheckException("Stack underflow");
        }
        PDFObject obj = stack[--top];
        stack[top] = null;
        return obj;
    }

    /**
     * Returns an entry without removing it.
     *
     * @param depth 0 for the top entry, 1 for the one below and so on
     * @return the entry, uncounted
     */
    public PDFObject peek(int depth) {
        if (depth < 0 || depth >= top) {
            throw new PDFRangeCheckException("Stack underflow");
        }
        return stack[top - 1 - depth];
    }

    /**
     * Pops entries until the stack is back at the given depth.
     *
     * @param depth the depth to return to
     */
    public void popTo(int depth) {
        if (top > depth) {
            pop(top - depth);
        }
    }

    public void clear() {
        popTo(0);
    }

    /**
     * Pushes a mark of the given type.
     *
     * @param type one of the mark types
     */
    public void markStack(PDFObjectType type) {
        push(allocator.allocMark(type));
    }

    /**
     * Counts the entries above the nearest mark of any type.
     *
     * @return the count, or -1 if there is no mark
     */
    public int countToMark() {
        for (int i = top - 1; i >= 0; i--) {
            if (stack[i].getType().isMark()) {
                return top - 1 - i;
            }
        }
        return -1;
    }

    /**
     * Returns the type of the nearest mark.
     *
     * @return the mark type, or null if there is no mark
     */
    public PDFObjectType nearestMarkType() {
        int count = countToMark();
        return count < 0 ? null : peek(count).getType();
    }

    /**
     * Pops everything down to and including the nearest mark.
     *
     * @throws PDFSyntaxException if there is no mark
     */
    public void clearToMark() {
        int count = countToMark();
        if (count < 0) {
            throw new PDFSyntaxException("No mark on stack");
        }
        pop(count + 1);
    }

    /**
     * Collapses the entries above the nearest mark into an array, which
     * replaces them and the mark on the stack.
     *
     * @param markType the mark type the array must close
     * @return the array, now on top of the stack
     * @throws PDFSyntaxException if the nearest mark is missing or of a
     *         different type
     */
    public PDFArray arrayFromStack(PDFObjectType markType) {
        int count = countToMark();
        if (count < 0 || peek(count).getType() != markType) {
            throw new PDFSyntaxException("Unmatched array close");
        }
        PDFArray array = allocator.allocArray(count);
        for (int i = 0; i < count; i++) {
            array.put(i, stack[top - count + i]);
        }
        pop(count + 1);
        push(array);
        return array;
    }

    /**
     * Collapses alternating keys and values above the nearest
     * dictionary mark into a dictionary, which replaces them and the
     * mark on the stack. A later duplicate key overrides an earlier one.
     *
     * @return the dictionary, now on top of the stack
     * @throws PDFSyntaxException if the nearest mark is not a dictionary
     *         mark or the entries do not pair up
     * @throws PDFTypeCheckException if a key is not a name
     */
    public PDFDictionary dictionaryFromStack() {
        int count = countToMark();
        if (count < 0 || peek(count).getType() != PDFObjectType.DICT_MARK) {
            throw new PDFSyntaxException("Unmatched dictionary close");
        }
        if ((count & 1) != 0) {
            throw new PDFSyntaxException("Dictionary has a key with no value");
        }
        for (int i = top - count; i < top; i += 2) {
            if (!(stack[i] instanceof PDFName)) {
                throw new PDFTypeCheckException("Dictionary key is not a name");
            }
        }
        PDFDictionary dict = allocator.allocDictionary(count / 2);
        for (int i = top - count; i < top; i += 2) {
            dict.put((PDFName) stack[i], stack[i + 1]);
        }
        pop(count + 1);
        push(dict);
        return dict;
    }

}
