/*
 * PDFDiagnostics.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The sticky record of conditions seen while reading one document.
 * <p>
 * Every kind recorded is kept until the document is closed, so that a
 * single report can list each distinct problem once. In stop-on-error
 * mode recording an error throws instead.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFDiagnostics {

    private static final Logger LOGGER = LoggerFactory.getLogger(PDFDiagnostics.class);

    private final Set<PDFErrorKind> kinds = EnumSet.noneOf(PDFErrorKind.class);
    private final boolean stopOnError;
    private final PDFErrorHandler errorHandler;

    public PDFDiagnostics(boolean stopOnError, PDFErrorHandler errorHandler) {
        this.stopOnError = stopOnError;
        this.errorHandler = errorHandler;
    }

    public boolean isStopOnError() {
        return stopOnError;
    }

    /**
     * Records a condition.
     *
     * @param kind the kind of condition
     * @param detail a description of this occurrence
     * @param offset the byte offset concerned, or -1
     * @throws PDFSyntaxException if the kind is an error and stop-on-error
     *         is set
     */
    public void record(PDFErrorKind kind, String detail, long offset) {
        if (kind.isError() && stopOnError) {
            throw new PDFSyntaxException(kind.getMessage() + ": " + detail, offset);
        }
        note(kind, detail, offset);
    }

    /**
     * Records a condition without ever throwing. Used where the caller
     * raises its own, more specific, exception.
     */
    void note(PDFErrorKind kind, String detail, long offset) {
        if (!kinds.add(kind)) {
            LOGGER.debug("{}: {} (offset {})", kind, detail, offset);
            return;
        }
        LOGGER.warn("{}: {} (offset {})", kind.getMessage(), detail, offset);
        if (errorHandler != null) {
            if (kind.isError()) {
                errorHandler.error(kind, detail, offset);
            } else {
                errorHandler.warning(kind, detail, offset);
            }
        }
    }

    public void record(PDFErrorKind kind, String detail) {
        record(kind, detail, -1L);
    }

    public boolean has(PDFErrorKind kind) {
        return kinds.contains(kind);
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    /**
     * Returns every kind recorded so far.
     *
     * @return an unmodifiable set
     */
    public Set<PDFErrorKind> getKinds() {
        return Collections.unmodifiableSet(kinds);
    }

    /**
     * Builds the final report: each distinct error, then each distinct
     * warning, then the producing application if known.
     *
     * @param producer the document's /Producer, or null
     * @return the report lines, empty if nothing was recorded
     */
    public List<String> report(String producer) {
        List<String> lines = new ArrayList<>();
        if (kinds.isEmpty()) {
            return lines;
        }
        appendKinds(lines, true,
                "The following errors were encountered at least once while processing this file:");
        appendKinds(lines, false,
                "The following warnings were encountered at least once while processing this file:");
        if (producer != null) {
            lines.add("The file was produced by: " + producer);
        }
        return lines;
    }

    private void appendKinds(List<String> lines, boolean errors, String heading) {
        boolean first = true;
        for (PDFErrorKind kind : kinds) {
            if (kind.isError() != errors) {
                continue;
            }
            if (first) {
                lines.add(heading);
                first = false;
            }
            lines.add("\t" + kind.getMessage());
        }
    }

}
