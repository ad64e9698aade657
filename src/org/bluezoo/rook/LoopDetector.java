/*
 * LoopDetector.java
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
 * Tracks the chain of object numbers currently being resolved.
 * <p>
 * A caller opens a scope with {@link #mark}, object numbers are
 * {@link #add added} as the chain is followed, and {@link #clearToMark}
 * closes the scope. Scopes nest. {@link #contains} searches every open
 * scope, so a reference back to any object still being resolved is seen
 * as circular, while siblings resolved in separate scopes never see each
 * other.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class LoopDetector {

    private static final int MARK = -1;

    private int[] chain = new int[32];
    private int top;

    void mark() {
        push(MARK);
    }

    void add(int objectNumber) {
        if (objectNumber > 0) {
            push(objectNumber);
        }
    }

    boolean contains(int objectNumber) {
        for (int i = 0; i < top; i++) {
            if (chain[i] == objectNumber) {
                return true;
            }
        }
        return false;
    }

    boolean isActive() {
        return top > 0;
    }

    void clearToMark() {
        while (top > 0) {
            if (chain[--top] == MARK) {
                return;
            }
        }
    }

    void reset() {
        top = 0;
    }

    private void push(int value) {
        if (top == chain.length) {
            int[] grown = new int[chain.length * 2];
            System.arraycopy(chain, 0, grown, 0, top);
            chain = grown;
        }
        chain[top++] = value;
    }

}
