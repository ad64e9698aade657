/*
 * FlateDecodeFilter.java
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
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * FlateDecode (zlib) with optional TIFF and PNG predictors.
 * <p>
 * Predictor 2 undoes TIFF horizontal differencing; predictors 10 to 15
 * undo the PNG filter named by the tag byte at the start of each row.
 * Rows may straddle writes, so undecoded predictor input is held back
 * until a whole row is available. Truncated deflate data is tolerated:
 * whatever inflated before the end is passed on.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FlateDecodeFilter extends StreamFilter {

    private final Inflater inflater = new Inflater();
    private final byte[] inflated = new byte[8192];
    private int predictor = 1;
    private int colors = 1;
    private int bitsPerComponent = 8;
    private int columns = 1;
    private byte[] row;
    private byte[] previousRow;
    private int rowFill;

    @Override
    public void setParams(PDFDictionary params) {
        super.setParams(params);
        if (params != null) {
            predictor = (int) params.getInteger("Predictor", 1);
            colors = (int) params.getInteger("Colors", 1);
            bitsPerComponent = (int) params.getInteger("BitsPerComponent", 8);
            columns = (int) params.getInteger("Columns", 1);
        }
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        int consumed = src.remaining();
        byte[] input = new byte[consumed];
        src.get(input);
        inflater.setInput(input);
        drain();
        return consumed;
    }

    @Override
    protected void finish() throws IOException {
        drain();
        if (predictor >= 10 && rowFill > 0) {
            // a short final row is passed through unpredicted
            emit(row, 1, rowFill - 1);
            rowFill = 0;
        }
    }

    private void drain() throws IOException {
        try {
            while (!inflater.finished()) {
                int n = inflater.inflate(inflated);
                if (n == 0) {
                    break;
                }
                predict(inflated, n);
            }
        } catch (DataFormatException e) {
            throw new IOException("FlateDecode: " + e.getMessage(), e);
        }
    }

    private void predict(byte[] data, int len) throws IOException {
        if (predictor < 2) {
            emit(data, 0, len);
            return;
        }
        int bpp = Math.max(1, (colors * bitsPerComponent + 7) / 8);
        int rowBytes = (columns * colors * bitsPerComponent + 7) / 8;
        int stride = predictor == 2 ? rowBytes : rowBytes + 1;
        if (row == null) {
            row = new byte[stride];
            previousRow = new byte[rowBytes];
        }
        for (int i = 0; i < len; i++) {
            row[rowFill++] = data[i];
            if (rowFill == stride) {
                if (predictor == 2) {
                    undoTiff(row, rowBytes, bpp);
                    emit(row, 0, rowBytes);
                } else {
                    undoPng(row, rowBytes, bpp);
                    emit(row, 1, rowBytes);
                }
                rowFill = 0;
            }
        }
    }

    private static void undoTiff(byte[] row, int rowBytes, int bpp) {
        for (int i = bpp; i < rowBytes; i++) {
            row[i] += row[i - bpp];
        }
    }

    /**
     * Undoes the PNG filter of one row. row[0] is the filter type and
     * row[1..rowBytes] the data.
     */
    private void undoPng(byte[] row, int rowBytes, int bpp) {
        int type = row[0] & 0xff;
        for (int i = 0; i < rowBytes; i++) {
            int left = i >= bpp ? row[1 + i - bpp] & 0xff : 0;
            int up = previousRow[i] & 0xff;
            int upLeft = i >= bpp ? previousRow[i - bpp] & 0xff : 0;
            int x = row[1 + i] & 0xff;
            switch (type) {
                case 1:
                    x += left;
                    break;
                case 2:
                    x += up;
                    break;
                case 3:
                    x += (left + up) >> 1;
                    break;
                case 4:
                    x += paeth(left, up, upLeft);
                    break;
                default:
                    break;
            }
            row[1 + i] = (byte) x;
        }
        System.arraycopy(row, 1, previousRow, 0, rowBytes);
    }

    private static int paeth(int a, int b, int c) {
        int p = a + b - c;
        int pa = Math.abs(p - a);
        int pb = Math.abs(p - b);
        int pc = Math.abs(p - c);
        if (pa <= pb && pa <= pc) {
            return a;
        }
        return pb <= pc ? b : c;
    }

    @Override
    public void reset() {
        super.reset();
        inflater.reset();
        row = null;
        previousRow = null;
        rowFill = 0;
    }

}
