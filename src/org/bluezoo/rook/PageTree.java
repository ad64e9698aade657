/*
 * PageTree.java
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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates page dictionaries in the page tree.
 * <p>
 * A page is found by descending from the root, using each intermediate
 * node's {@code /Count} to skip whole subtrees. The walk accumulates the
 * inheritable attributes of the nodes it passes through and merges them
 * into the page dictionary it returns when the page does not set them
 * itself.
 * <p>
 * As a side effect, references in {@code /Kids} arrays are replaced by
 * what they point to, so that later walks need not dereference them
 * again. Intermediate nodes are stored directly; page leaves are stored
 * as a small {@code /Type /PageRef} marker holding the original
 * reference, which keeps the page itself out of the tree and lets it be
 * evicted from the cache. All replacements are undone by
 * {@link #dispose}, since a page tree with loops would otherwise keep
 * itself alive.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class PageTree {

    private static final Logger LOGGER = LoggerFactory.getLogger(PageTree.class);

    static final String[] INHERITABLE = { "Resources", "MediaBox", "CropBox", "Rotate" };

    private final PDFDocument document;
    private final ObjectAllocator allocator;
    private final PDFDiagnostics diagnostics;
    private final PDFDictionary root;
    private final int pageCount;

    private final List<PDFArray> replacedArrays = new ArrayList<>();
    private final List<Integer> replacedIndices = new ArrayList<>();
    private final List<PDFObject> originals = new ArrayList<>();

    /**
     * Takes ownership of the root node's reference.
     */
    PageTree(PDFDocument document, PDFDictionary root) throws IOException {
        this.document = document;
        this.allocator = document.getAllocator();
        this.diagnostics = document.getDiagnostics();
        this.root = root;
        try {
            this.pageCount = readCount(root);
        } catch (IOException | RuntimeException e) {
            root.release();
            throw e;
        }
        LOGGER.debug("Page tree declares {} pages", pageCount);
    }

    int getPageCount() {
        return pageCount;
    }

    /**
     * Returns a page dictionary with inherited attributes merged in.
     *
     * @param index the zero-based page index
     * @return the page dictionary, counted for the caller
     */
    PDFDictionary getPage(int index) throws IOException {
        if (index < 0 || index >= pageCount) {
            throw new PDFRangeCheckException("Page index " + index + " not in [0," + pageCount + ")");
        }
        PDFDictionary inherited = allocator.allocDictionary(INHERITABLE.length);
        inherited.retain();
        try {
            PDFDictionary page = walk(root, index, inherited, new ArrayDeque<>());
            for (String key : INHERITABLE) {
                PDFObject value = inherited.getNoDeref(key);
                if (value != null && !page.knownNoDeref(key)) {
                    page.put(key, value);
                }
            }
            return page;
        } finally {
            inherited.release();
        }
    }

    /**
     * Puts back every {@code /Kids} entry replaced during walks and
     * releases the tree.
     */
    void dispose() {
        for (int i = replacedArrays.size() - 1; i >= 0; i--) {
            PDFArray kids = replacedArrays.get(i);
            PDFObject original = originals.get(i);
            kids.put(replacedIndices.get(i), original);
            original.release();
            kids.release();
        }
        replacedArrays.clear();
        replacedIndices.clear();
        originals.clear();
        root.release();
    }

    private PDFDictionary walk(PDFDictionary node, int target, PDFDictionary inherited,
                               Deque<Integer> path) throws IOException {
        int nodeNumber = node.getObjectNumber();
        if (nodeNumber > 0) {
            if (path.contains(nodeNumber)) {
                throw loop(nodeNumber);
            }
            path.push(nodeNumber);
        }
        for (String key : INHERITABLE) {
            PDFObject value = node.getNoDeref(key);
            if (value != null) {
                inherited.put(key, value);
            }
        }
        PDFArray kids = document.dictGetArray(node, "Kids");
        try {
            int skipped = 0;
            for (int i = 0; i < kids.size(); i++) {
                PDFObject kid = kids.getNoDeref(i);
                PDFDictionary child = null;
                PDFObject leafRef = null;
                boolean leaf;
                try {
                    if (isPageRef(kid)) {
                        leaf = true;
                        leafRef = ((PDFDictionary) kid).getNoDeref("PageRef");
                    } else {
                        if (kid instanceof PDFIndirectReference
                                && path.contains(((PDFIndirectReference) kid).getTargetNumber())) {
                            throw loop(((PDFIndirectReference) kid).getTargetNumber());
                        }
                        child = resolveKid(kid, nodeNumber);
                        if (child == null) {
                            continue;
                        }
                        leaf = !isPagesNode(child);
                        if (kid instanceof PDFIndirectReference) {
                            if (leaf) {
                                leafRef = kid;
                                replace(kids, i, pageRef((PDFIndirectReference) kid));
                            } else {
                                replace(kids, i, child);
                            }
                        }
                    }
                    if (leaf) {
                        if (skipped == target) {
                            if (child != null) {
                                PDFDictionary page = child;
                                child = null;
                                return page;
                            }
                            return resolvePage(leafRef, nodeNumber);
                        }
                        skipped++;
                    } else {
                        int count = readCount(child);
                        if (target < skipped + count) {
                            return walk(child, target - skipped, inherited, path);
                        }
                        skipped += count;
                    }
                } finally {
                    if (child != null) {
                        child.release();
                    }
                }
            }
            throw new PDFRangeCheckException("Page " + target + " not found below object " + nodeNumber);
        } finally {
            kids.release();
            if (nodeNumber > 0) {
                path.pop();
            }
        }
    }

    private PDFDictionary resolveKid(PDFObject kid, int nodeNumber) throws IOException {
        PDFObject value = document.resolve(kid, nodeNumber);
        if (value instanceof PDFDictionary) {
            return (PDFDictionary) value;
        }
        value.release();
        diagnostics.record(PDFErrorKind.BAD_PAGE_TYPE,
                "/Kids entry of object " + nodeNumber + " is not a dictionary");
        return null;
    }

    private PDFDictionary resolvePage(PDFObject ref, int nodeNumber) throws IOException {
        PDFObject value = document.resolve(ref, nodeNumber);
        if (value instanceof PDFDictionary) {
            return (PDFDictionary) value;
        }
        value.release();
        throw new PDFTypeCheckException("Page is not a dictionary");
    }

    /**
     * Classifies a node by /Type, falling back to the presence of
     * /Kids when the type is missing or wrong.
     */
    private boolean isPagesNode(PDFDictionary dict) {
        if (dict.isName("Type", "Pages")) {
            return true;
        }
        if (dict.isName("Type", "Page")) {
            return false;
        }
        boolean pages = dict.knownNoDeref("Kids");
        diagnostics.record(PDFErrorKind.BAD_PAGE_TYPE, "Object " + dict.getObjectNumber()
                + " treated as " + (pages ? "/Pages" : "/Page"));
        return pages;
    }

    private int readCount(PDFDictionary node) throws IOException {
        PDFObject value = document.dictGet(node, "Count");
        try {
            if (!(value instanceof PDFNumber)) {
                throw new PDFTypeCheckException("/Count of object " + node.getObjectNumber()
                        + " is not a number");
            }
            PDFNumber count = (PDFNumber) value;
            if (!count.isIntegral() || count.doubleValue() < 0 || count.doubleValue() > Integer.MAX_VALUE) {
                throw new PDFRangeCheckException("/Count of object " + node.getObjectNumber()
                        + " is not a page count");
            }
            return count.intValue();
        } finally {
            value.release();
        }
    }

    private static boolean isPageRef(PDFObject kid) {
        return kid instanceof PDFDictionary && ((PDFDictionary) kid).isName("Type", "PageRef");
    }

    private PDFDictionary pageRef(PDFIndirectReference ref) {
        PDFDictionary marker = allocator.allocDictionary(2);
        marker.put("Type", allocator.allocName("PageRef"));
        marker.put("PageRef", ref);
        return marker;
    }

    private void replace(PDFArray kids, int index, PDFObject value) {
        replacedArrays.add((PDFArray) kids.retain());
        replacedIndices.add(index);
        originals.add(kids.getNoDeref(index).retain());
        kids.put(index, value);
    }

    private CircularReferenceException loop(int objectNumber) {
        diagnostics.note(PDFErrorKind.CIRCULAR_REFERENCE, "Page tree node " + objectNumber, -1L);
        return new CircularReferenceException("Page tree loops through object " + objectNumber);
    }

}
