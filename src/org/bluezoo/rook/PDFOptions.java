/*
 * PDFOptions.java
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
 * Options controlling how a document is opened and read.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFOptions {

    private boolean stopOnError;
    private int cacheSize = 200;
    private int objectStreamCacheSize = 8;
    private int headerSearchSize = 2048;
    private int startxrefChunkSize = 2048;
    private int maxStackDepth = 100000;
    private boolean preferXRefStream = true;
    private int firstPage = 1;
    private int lastPage = Integer.MAX_VALUE;
    private PDFErrorHandler errorHandler;

    /**
     * Returns whether every recoverable error is treated as fatal.
     *
     * @return true for strict processing
     */
    public boolean isStopOnError() {
        return stopOnError;
    }

    public void setStopOnError(boolean stopOnError) {
        this.stopOnError = stopOnError;
    }

    /**
     * Returns the maximum number of resolved objects kept in the cache.
     *
     * @return the cache capacity
     */
    public int getCacheSize() {
        return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
        if (cacheSize < 1) {
            throw new IllegalArgumentException("Cache size must be positive: " + cacheSize);
        }
        this.cacheSize = cacheSize;
    }

    /**
     * Returns the number of decoded object streams kept in memory.
     *
     * @return the object stream cache capacity
     */
    public int getObjectStreamCacheSize() {
        return objectStreamCacheSize;
    }

    public void setObjectStreamCacheSize(int objectStreamCacheSize) {
        if (objectStreamCacheSize < 1) {
            throw new IllegalArgumentException("Object stream cache size must be positive: " + objectStreamCacheSize);
        }
        this.objectStreamCacheSize = objectStreamCacheSize;
    }

    /**
     * Returns how many bytes from the start of the file are searched
     * for the %PDF header.
     *
     * @return the header search size
     */
    public int getHeaderSearchSize() {
        return headerSearchSize;
    }

    public void setHeaderSearchSize(int headerSearchSize) {
        this.headerSearchSize = headerSearchSize;
    }

    /**
     * Returns the size of each chunk read while scanning backward from
     * the end of the file for startxref.
     *
     * @return the chunk size
     */
    public int getStartxrefChunkSize() {
        return startxrefChunkSize;
    }

    public void setStartxrefChunkSize(int startxrefChunkSize) {
        if (startxrefChunkSize < 64) {
            throw new IllegalArgumentException("startxref chunk size must be at least 64: " + startxrefChunkSize);
        }
        this.startxrefChunkSize = startxrefChunkSize;
    }

    public int getMaxStackDepth() {
        return maxStackDepth;
    }

    public void setMaxStackDepth(int maxStackDepth) {
        this.maxStackDepth = maxStackDepth;
    }

    /**
     * Returns whether the cross-reference stream of a hybrid file is
     * preferred to its classic table.
     *
     * @return true to read /XRefStm first
     */
    public boolean isPreferXRefStream() {
        return preferXRefStream;
    }

    public void setPreferXRefStream(boolean preferXRefStream) {
        this.preferXRefStream = preferXRefStream;
    }

    /**
     * Returns the first page processed by
     * {@link PDFDocument#processPages}, counting from 1.
     *
     * @return the first page number
     */
    public int getFirstPage() {
        return firstPage;
    }

    public void setFirstPage(int firstPage) {
        this.firstPage = firstPage;
    }

    public int getLastPage() {
        return lastPage;
    }

    public void setLastPage(int lastPage) {
        this.lastPage = lastPage;
    }

    public PDFErrorHandler getErrorHandler() {
        return errorHandler;
    }

    public void setErrorHandler(PDFErrorHandler errorHandler) {
        this.errorHandler = errorHandler;
    }

}
