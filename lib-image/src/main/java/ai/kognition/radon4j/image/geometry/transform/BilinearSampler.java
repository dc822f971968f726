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

package ai.kognition.radon4j.image.geometry.transform;

import ai.kognition.radon4j.image.DoubleRaster;
import ai.kognition.radon4j.image.ShapeException;

/**
 * <p>
 * Resamples an image at arbitrary floating point (x, y) positions using bilinear
 * interpolation. x is the column and y is the row.
 * </p>
 *
 * <p>
 * Sampling is done in two steps. First the four neighboring pixels are fetched with
 * their indices clamped into the image so a fetch can never land outside the buffer.
 * Then, any query whose (unclamped) x is outside {@code [0, cols - 1]} or whose y
 * is outside {@code [0, rows - 1]} has its value replaced by the fill value. The clamp
 * only guards the fetch. It never decides the result, so the image edge doesn't get
 * smeared outward.
 * </p>
 */
public final class BilinearSampler {

    private BilinearSampler() {}

    /**
     * Sample the image at each of the {@code (xs[i], ys[i])} positions.
     *
     * @return a new array, the same length as {@code xs}, with the interpolated values.
     * @throws ShapeException if {@code xs} and {@code ys} aren't the same length or the
     *     image has no rows or no columns.
     */
    public static double[] sample(final DoubleRaster image, final double[] xs, final double[] ys, final double fill) {
        if(xs.length != ys.length)
            throw new ShapeException("Sample coordinates must come in pairs but there are " + xs.length + " x's and " + ys.length + " y's");
        final double[] ret = new double[xs.length];
        sample(image, xs, ys, fill, ret);
        return ret;
    }

    /**
     * Same as {@link #sample(DoubleRaster, double[], double[], double)} but writes into {@code dst}.
     */
    public static void sample(final DoubleRaster image, final double[] xs, final double[] ys, final double fill, final double[] dst) {
        if(xs.length != ys.length || dst.length != xs.length)
            throw new ShapeException(
                "Sample coordinates and destination must be the same length (x:" + xs.length + ", y:" + ys.length + ", dst:" + dst.length + ")");
        image.requireNonEmpty();
        final int rows = image.rows();
        final int cols = image.cols();
        final double[] img = image.underlying();
        final int maxX = cols - 1;
        final int maxY = rows - 1;

        for(int i = 0; i < xs.length; i++)
            dst[i] = interpolate(img, cols, maxX, maxY, xs[i], ys[i], fill);
    }

    /**
     * Sample the image at a single (x, y) position.
     *
     * @throws ShapeException if the image has no rows or no columns.
     */
    public static double sample(final DoubleRaster image, final double x, final double y, final double fill) {
        image.requireNonEmpty();
        return interpolate(image.underlying(), image.cols(), image.cols() - 1, image.rows() - 1, x, y, fill);
    }

    private static double interpolate(final double[] img, final int cols, final int maxX, final int maxY, final double x, final double y,
        final double fill) {
        final double fx0 = Math.floor(x);
        final double fy0 = Math.floor(y);
        final double dx = x - fx0;
        final double dy = y - fy0;

        final int x0 = clamp(fx0, maxX);
        final int x1 = clamp(fx0 + 1.0, maxX);
        final int y0 = clamp(fy0, maxY);
        final int y1 = clamp(fy0 + 1.0, maxY);

        final double ia = img[(y0 * cols) + x0];
        final double ib = img[(y0 * cols) + x1];
        final double ic = img[(y1 * cols) + x0];
        final double id = img[(y1 * cols) + x1];

        final double value = (ia * ((1.0 - dx) * (1.0 - dy)))
            + (ib * (dx * (1.0 - dy)))
            + (ic * ((1.0 - dx) * dy))
            + (id * (dx * dy));

        // the bounds check is on the original coordinate, not the clamped index
        if(x < 0.0 || x > maxX || y < 0.0 || y > maxY)
            return fill;
        return value;
    }

    private static int clamp(final double index, final int max) {
        if(index <= 0.0)
            return 0;
        if(index >= max)
            return max;
        return (int)index;
    }
}
