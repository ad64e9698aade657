/*
 * StreamConsumer.java
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

import java.nio.channels.WritableByteChannel;

/**
 * A stage of the stream decoding pipeline.
 * <p>
 * Data is pushed through with {@code write} and the end of the stream is
 * signalled with {@code close}. Data may arrive in any number of chunks,
 * so a stage must carry partial state (an incomplete tuple, a partial
 * predictor row) from one write to the next.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface StreamConsumer extends WritableByteChannel {

    /**
     * Resets the consumer so it can decode another stream.
     */
    void reset();

}
