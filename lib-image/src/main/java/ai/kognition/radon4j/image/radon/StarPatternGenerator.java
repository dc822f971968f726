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

package ai.kognition.radon4j.image.radon;

import java.util.Arrays;

import ai.kognition.radon4j.image.DoubleRaster;
import ai.kognition.radon4j.image.ShapeException;

/**
 * <p>
 * Draws a synthetic "star": rays fanning out from a center point, used to check
 * that a sinogram looks the way it should. "Main" rays are drawn with a value of
 * {@link #MAIN_VALUE} and then the weaker "noise" rays with {@link #NOISE_VALUE}.
 * Where rays overlap the later one overwrites the earlier one; they aren't summed.
 * </p>
 *
 * <p>
 * Rays are deliberately crude. Each step along the ray is rounded to the nearest
 * pixel (ties go to even) and stamped with a square brush of half width
 * {@code thickness}, with no anti-aliasing. Angles are measured from the +x axis
 * toward +y (down the image).
 * </p>
 *
 * <pre>
 * <code>
 * final DoubleRaster star = new StarPatternGenerator()
 *     .shape(1000, 1000)
 *     .center(800, 470)
 *     .generate();
 * </code>
 * </pre>
 */
public class StarPatternGenerator {
    public static final double MAIN_VALUE = 1.0;
    public static final double NOISE_VALUE = 0.25;

    public static final int DEFAULT_ROWS = 1000;
    public static final int DEFAULT_COLS = 1000;
    public static final int DEFAULT_LENGTH = 380;
    public static final int DEFAULT_THICKNESS = 1;
    public static final double[] DEFAULT_MAIN_ANGLES = {0,60,120,180,240,300};
    public static final double[] DEFAULT_NOISE_ANGLES = {30,90,150,210,270,330};

    private int rows = DEFAULT_ROWS;
    private int cols = DEFAULT_COLS;
    private Double centerRow = null;
    private Double centerCol = null;
    private double[] mainAnglesDeg = DEFAULT_MAIN_ANGLES.clone();
    private double[] noiseAnglesDeg = DEFAULT_NOISE_ANGLES.clone();
    private int length = DEFAULT_LENGTH;
    private int thickness = DEFAULT_THICKNESS;

    public StarPatternGenerator shape(final int rows, final int cols) {
        if(rows <= 0 || cols <= 0)
            throw new ShapeException("A star pattern needs a positive height and width but was given " + rows + " X " + cols);
        this.rows = rows;
        this.cols = cols;
        return this;
    }

    /**
     * Where the rays start. If this is never set the center is {@code (rows / 2, cols / 2)}
     * using integer division.
     */
    public StarPatternGenerator center(final double row, final double col) {
        this.centerRow = row;
        this.centerCol = col;
        return this;
    }

    public StarPatternGenerator mainAngles(final double... anglesDeg) {
        this.mainAnglesDeg = anglesDeg.clone();
        return this;
    }

    public StarPatternGenerator noiseAngles(final double... anglesDeg) {
        this.noiseAnglesDeg = anglesDeg.clone();
        return this;
    }

    /**
     * Number of steps along each ray, in pixels.
     */
    public StarPatternGenerator length(final int length) {
        if(length < 0)
            throw new IllegalArgumentException("Ray length can't be negative but was " + length);
        this.length = length;
        return this;
    }

    /**
     * Half width of the square brush. 0 draws single pixel rays.
     */
    public StarPatternGenerator thickness(final int thickness) {
        if(thickness < 0)
            throw new IllegalArgumentException("Ray thickness can't be negative but was " + thickness);
        this.thickness = thickness;
        return this;
    }

    public DoubleRaster generate() {
        final DoubleRaster img = DoubleRaster.zeros(rows, cols);
        final double cy = centerRow == null ? (rows / 2) : centerRow.doubleValue();
        final double cx = centerCol == null ? (cols / 2) : centerCol.doubleValue();

        for(final double angle: mainAnglesDeg)
            drawRay(img, cy, cx, angle, MAIN_VALUE);

        for(final double angle: noiseAnglesDeg)
            drawRay(img, cy, cx, angle, NOISE_VALUE);

        return img;
    }

    private void drawRay(final DoubleRaster img, final double cy, final double cx, final double angleDeg, final double value) {
        final double theta = Math.toRadians(angleDeg);
        final double dx = Math.cos(theta);
        final double dy = Math.sin(theta);
        for(int r = 0; r < length; r++) {
            final double x = Math.rint(cx + (r * dx));
            final double y = Math.rint(cy + (r * dy));
            if(x >= 0 && x < cols && y >= 0 && y < rows)
                stamp(img, (int)y, (int)x, value);
        }
    }

    private void stamp(final DoubleRaster img, final int y, final int x, final double value) {
        final int rowStart = Math.max(0, y - thickness);
        final int rowEnd = Math.min(rows, y + thickness + 1);
        final int colStart = Math.max(0, x - thickness);
        final int colEnd = Math.min(cols, x + thickness + 1);
        final double[] data = img.underlying();
        for(int r = rowStart; r < rowEnd; r++)
            Arrays.fill(data, (r * cols) + colStart, (r * cols) + colEnd, value);
    }
}
