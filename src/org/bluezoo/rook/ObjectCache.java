/*
 * ObjectCache.java
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded LRU cache of resolved objects.
 * <p>
 * The cache is an arena of fixed capacity. Slots are linked into a
 * doubly linked list by index, least recently used at the head and most
 * recently used at the tail, so promotion and eviction are O(1). Each
 * occupied slot holds one counted reference to its object, and the xref
 * entry for that object number points back at the slot.
 * <p>
 * Eviction clears the xref entry's back-pointer before dropping the
 * cache's reference; the object itself survives if anyone else holds it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class ObjectCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(ObjectCache.class);

    private static final int NIL = -1;

    private final CrossReferenceTable xref;
    private final int capacity;
    private final PDFObject[] objects;
    private final int[] objectNumbers;
    private final int[] prev;
    private final int[] next;
    private int head = NIL;
    private int tail = NIL;
    private int freeHead;
    private int size;

    ObjectCache(CrossReferenceTable xref, int capacity) {
        this.xref = xref;
        this.capacity = Math.max(capacity, 1);
        objects = new PDFObject[this.capacity];
        objectNumbers = new int[this.capacity];
        prev = new int[this.capacity];
        next = new int[this.capacity];
        // free list threads through next[]
        for (int i = 0; i < this.capacity; i++) {
            next[i] = i + 1 < this.capacity ? i + 1 : NIL;
            prev[i] = NIL;
        }
        freeHead = 0;
    }

    int size() {
        return size;
    }

    int capacity() {
        return capacity;
    }

    /**
     * Returns the cached object for an entry, promoting it to most
     * recently used.
     *
     * @param entry the xref entry
     * @return the cached object, uncounted, or null if not cached
     */
    PDFObject get(CrossReferenceEntry entry) {
        int slot = entry.getCacheSlot();
        if (slot == NIL) {
            return null;
        }
        if (objects[slot] == null || objectNumbers[slot] != entry.getObjectNumber()) {
            entry.setCacheSlot(NIL);
            return null;
        }
        promote(slot);
        return objects[slot];
    }

    /**
     * Inserts an object, evicting the least recently used one if full.
     * The cache retains the object.
     *
     * @param entry the xref entry for the object's number
     * @param obj the resolved object
     */
    void put(CrossReferenceEntry entry, PDFObject obj) {
        if (entry.getCacheSlot() != NIL) {
            return;
        }
        if (size == capacity) {
            evict();
        }
        int slot = freeHead;
        freeHead = next[slot];
        objects[slot] = obj.retain();
        objectNumbers[slot] = entry.getObjectNumber();
        linkAtTail(slot);
        size++;
        entry.setCacheSlot(slot);
    }

    /**
     * Evicts the least recently used object.
     */
    void evict() {
        int slot = head;
        if (slot == NIL) {
            return;
        }
        unlink(slot);
        int objectNumber = objectNumbers[slot];
        if (objectNumber < xref.size()) {
            CrossReferenceEntry entry = xref.lookup(objectNumber);
            if (entry != null && entry.getCacheSlot() == slot) {
                entry.setCacheSlot(NIL);
            }
        }
        PDFObject obj = objects[slot];
        objects[slot] = null;
        next[slot] = freeHead;
        freeHead = slot;
        size--;
        LOGGER.debug("Evicted object {} from cache", objectNumber);
        obj.release();
    }

    /**
     * Evicts everything.
     */
    void clear() {
        while (size > 0) {
            evict();
        }
    }

    boolean contains(int objectNumber) {
        for (int slot = head; slot != NIL; slot = next[slot]) {
            if (objectNumbers[slot] == objectNumber) {
                return true;
            }
        }
        return false;
    }

    private void promote(int slot) {
        if (slot != tail) {
            unlink(slot);
            linkAtTail(slot);
        }
    }

    private void linkAtTail(int slot) {
        prev[slot] = tail;
        next[slot] = NIL;
        if (tail != NIL) {
            next[tail] = slot;
        } else {
            head = slot;
        }
        tail = slot;
    }

    private void unlink(int slot) {
        int p = prev[slot];
        int n = next[slot];
        if (p != NIL) {
            next[p] = n;
        } else {
            head = n;
        }
        if (n != NIL) {
            prev[n] = p;
        } else {
            tail = p;
        }
        prev[slot] = NIL;
        next[slot] = NIL;
    }

}
