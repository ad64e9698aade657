/*
 * PDFNumber.java
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
 * Common base of integer and real objects.
 * <p>
 * Numbers compare numerically: the integer 5 equals the real 5.0.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class PDFNumber extends PDFObject {

    PDFNumber(ObjectAllocator allocator) {
        super(allocator);
    }

    public abstract long longValue();

    public abstract double doubleValue();

    /**
     * Returns the value as an int, saturating at the int range.
     *
     * @return the value as an int
     */
    public int intValue() {
        long value = longValue();
        if (value > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (value < Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) value;
    }

    /**
     * Returns whether the value has no fractional part.
     *
     * @return true if the value is integral
     */
    public boolean isIntegral() {
        double d = doubleValue();
        return d == Math.rint(d) && !Double.isInfinite(d);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof PDFNumber) {
            return Double.compare(doubleValue(), ((PDFNumber) obj).doubleValue()) == 0;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(doubleValue());
    }

}
