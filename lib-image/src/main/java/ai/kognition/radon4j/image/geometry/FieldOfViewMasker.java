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

/**
 * Keeps only the circle inscribed in the image, which is the region the
 * classical Radon transform is defined over. Everything outside is zeroed.
 */
public final class FieldOfViewMasker {

    private FieldOfViewMasker() {}

    /**
     * Returns a new image equal to the input inside the disk centered at
     * {@code ((cols - 1) / 2, (rows - 1) / 2)} with radius equal to the smaller of
     * those two and {@code 0.0} outside of it. Pixels exactly on the circle are kept.
     */
    public static DoubleRaster applyCircularFov(final DoubleRaster image) {
        final int rows = image.rows();
        final int cols = image.cols();
        final double cx = (cols - 1) / 2.0;
        final double cy = (rows - 1) / 2.0;
        final double radius = Math.min(cx, cy);
        final double radiusSq = radius * radius;

        final DoubleRaster ret = DoubleRaster.zeros(rows, cols);
        final double[] src = image.underlying();
        final double[] dst = ret.underlying();
        for(int r = 0; r < rows; r++) {
            final double dy = r - cy;
            final double dySq = dy * dy;
            final int rowStart = r * cols;
            for(int c = 0; c < cols; c++) {
                final double dx = c - cx;
                if((dx * dx) + dySq <= radiusSq)
                    dst[rowStart + c] = src[rowStart + c];
            }
        }
        return ret;
    }
}
