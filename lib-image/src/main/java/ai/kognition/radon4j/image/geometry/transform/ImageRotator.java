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
 * Rotates an image about its geometric center, {@code ((cols - 1) / 2, (rows - 1) / 2)},
 * using inverse mapping. For every destination pixel we compute where it came from in
 * the source and sample there with the {@link BilinearSampler}. The result has the
 * same shape as the input and anything that maps from outside the source gets the
 * fill value.
 * </p>
 *
 * <p>
 * A positive angle turns the image from the +x (column) axis toward the +y (row)
 * axis. Because rows count DOWN the image, that is clockwise as the image appears
 * on screen, even though it's the positive (counter clockwise) direction in the
 * pixel coordinate system. For destination pixel (x, y), relative to the center:
 * </p>
 *
 * <pre>
 * xs =  cos(theta) * xrel + sin(theta) * yrel + cx
 * ys = -sin(theta) * xrel + cos(theta) * yrel + cy
 * </pre>
 */
public final class ImageRotator {

    private ImageRotator() {}

    /**
     * The rotation angle, in radians, used for the given angle in degrees. The angle is
     * first reduced modulo 360 so that whole turns give exactly {@code sin = 0} and
     * {@code cos = 1}, making them an exact identity.
     */
    public static double toRadians(final double angleDeg) {
        return Math.toRadians(angleDeg % 360.0);
    }

    /**
     * Return a new image that's the given image rotated by {@code angleDeg} degrees.
     *
     * @throws ShapeException if the image has no rows or no columns.
     */
    public static DoubleRaster rotate(final DoubleRaster image, final double angleDeg, final double fill) {
        image.requireNonEmpty();
        final int rows = image.rows();
        final int cols = image.cols();
        final int size = image.underlying().length;
        final double[] xs = new double[size];
        final double[] ys = new double[size];
        sourceCoordinates(rows, cols, angleDeg, xs, ys);

        final DoubleRaster ret = DoubleRaster.zeros(rows, cols);
        BilinearSampler.sample(image, xs, ys, fill, ret.underlying());
        return ret;
    }

    /**
     * Fill {@code xs} and {@code ys} (row-major, {@code rows * cols} long) with the source
     * location of each destination pixel for a rotation of {@code angleDeg} degrees.
     */
    public static void sourceCoordinates(final int rows, final int cols, final double angleDeg, final double[] xs, final double[] ys) {
        final double cx = (cols - 1) / 2.0;
        final double cy = (rows - 1) / 2.0;

        final double theta = toRadians(angleDeg);
        final double cost = Math.cos(theta);
        final double sint = Math.sin(theta);

        int pos = 0;
        for(int y = 0; y < rows; y++) {
            final double yrel = y - cy;
            for(int x = 0; x < cols; x++) {
                final double xrel = x - cx;
                xs[pos] = (cost * xrel) + (sint * yrel) + cx;
                ys[pos] = (-sint * xrel) + (cost * yrel) + cy;
                pos++;
            }
        }
    }
}
