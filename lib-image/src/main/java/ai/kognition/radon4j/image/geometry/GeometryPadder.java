/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.radon4j.image.geometry;

import ai.kognition.radon4j.image.DoubleRaster;
import ai.kognition.radon4j.image.ShapeException;

/**
 * Pads an image out to a square whose side is the length of the image's
 * diagonal so that rotating it by any angle never pushes content off the edge.
 */
public final class GeometryPadder {

    private GeometryPadder() {}

    /**
     * The side of the square needed to hold an image of the given size at any rotation:
     * {@code ceil(sqrt(rows^2 + cols^2))}.
     */
    public static int diagonalSide(final int rows, final int cols) {
        if(rows <= 0 || cols <= 0)
            throw new ShapeException("Cannot pad an image with a non-positive dimension (" + rows + " X " + cols + ")");
        final double diag = Math.sqrt(((double)rows * rows) + ((double)cols * cols));
        return (int)Math.ceil(diag);
    }

    /**
     * Returns a new S X S image ({@code S = diagonalSide(rows, cols)}) with the
     * original centered in it. The original's upper left corner lands at
     * {@code ((S - rows) / 2, (S - cols) / 2)} using integer division and every
     * other pixel is set to {@code fill}. The input isn't touched.
     *
     * @throws ShapeException if the image has no rows or no columns.
     */
    public static DoubleRaster padToDiagonal(final DoubleRaster image, final double fill) {
        final int rows = image.rows();
        final int cols = image.cols();
        final int side = diagonalSide(rows, cols);
        final int padRows = (side - rows) / 2;
        final int padCols = (side - cols) / 2;

        final DoubleRaster ret = DoubleRaster.filled(side, side, fill);
        final double[] src = image.underlying();
        final double[] dst = ret.underlying();
        for(int r = 0; r < rows; r++)
            System.arraycopy(src, r * cols, dst, ((r + padRows) * side) + padCols, cols);
        return ret;
    }
}
