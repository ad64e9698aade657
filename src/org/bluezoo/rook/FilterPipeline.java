/*
 * FilterPipeline.java
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
import java.nio.channels.WritableByteChannel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A chain of decoding filters ending in a final consumer.
 * <pre>
 *   raw data &rarr; filter 1 &rarr; filter 2 &rarr; ... &rarr; consumer
 * </pre>
 * The chain is built from a stream's {@code /Filter} and
 * {@code /DecodeParms} entries, which must already be resolved. A filter
 * this library cannot decode is left out of the chain and reported by
 * {@link #getUnsupportedFilters}; its data passes through undecoded.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FilterPipeline implements StreamConsumer {

    private final WritableByteChannel head;
    private final List<StreamFilter> filters;
    private final List<String> unsupported;
    private boolean open = true;

    private FilterPipeline(WritableByteChannel head, List<StreamFilter> filters, List<String> unsupported) {
        this.head = head;
        this.filters = filters;
        this.unsupported = unsupported;
    }

    /**
     * Builds a pipeline.
     *
     * @param filter the resolved /Filter value: a name, an array of names,
     *        or null for none
     * @param decodeParms the resolved /DecodeParms value: a dictionary, an
     *        array parallel to the filters, or null
     * @param consumer the final consumer
     * @return the pipeline
     */
    public static FilterPipeline create(PDFObject filter, PDFObject decodeParms, WritableByteChannel consumer) {
        List<String> names = new ArrayList<>();
        List<PDFDictionary> params = new ArrayList<>();
        if (filter instanceof PDFName) {
            names.add(((PDFName) filter).getValue());
            params.add(paramsAt(decodeParms, 0));
        } else if (filter instanceof PDFArray) {
            PDFArray array = (PDFArray) filter;
            for (int i = 0; i < array.size(); i++) {
                PDFObject element = array.getNoDeref(i);
                if (element instanceof PDFName) {
                    names.add(((PDFName) element).getValue());
                    params.add(paramsAt(decodeParms, i));
                }
            }
        }
        List<StreamFilter> filters = new ArrayList<>();
        List<String> unsupported = new ArrayList<>();
        WritableByteChannel current = consumer;
        for (int i = names.size() - 1; i >= 0; i--) {
            StreamFilter f = StreamFilter.create(names.get(i));
            if (f == null) {
                unsupported.add(0, names.get(i));
                continue;
            }
            f.setParams(params.get(i));
            f.setNext(current);
            filters.add(0, f);
            current = f;
        }
        return new FilterPipeline(current, filters, unsupported);
    }

    private static PDFDictionary paramsAt(PDFObject decodeParms, int index) {
        if (decodeParms instanceof PDFDictionary) {
            return index == 0 ? (PDFDictionary) decodeParms : null;
        }
        if (decodeParms instanceof PDFArray) {
            PDFArray array = (PDFArray) decodeParms;
            if (index < array.size() && array.getNoDeref(index) instanceof PDFDictionary) {
                return (PDFDictionary) array.getNoDeref(index);
            }
        }
        return null;
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        return head.write(src);
    }

    @Override
    public void close() throws IOException {
        if (open) {
            open = false;
            head.close();
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void reset() {
        for (StreamFilter f : filters) {
            f.reset();
        }
        open = true;
    }

    public boolean hasFilters() {
        return !filters.isEmpty();
    }

    /**
     * Returns the names of filters that were left out of the chain.
     *
     * @return the unsupported filter names
     */
    public List<String> getUnsupportedFilters() {
        return Collections.unmodifiableList(unsupported);
    }

}
