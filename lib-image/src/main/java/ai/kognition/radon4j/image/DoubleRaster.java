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

package ai.kognition.radon4j.image;

import java.lang.reflect.Array;
import java.util.Arrays;

/**
 * <p>
 * A single channel, row-major image of {@code double} samples. The row index is
 * the vertical pixel position (y, counting up as you move DOWN the image) and the
 * column index is the horizontal position (x).
 * </p>
 *
 * <p>
 * All of the factory methods copy the data handed to them so a {@link DoubleRaster}
 * never aliases a caller's array. You can get at the backing buffer through
 * {@link #underlying()} when you need to loop over it directly.
 * </p>
 *
 * <pre>
 * <code>
 * final DoubleRaster raster = DoubleRaster.zeros(rows, cols);
 * raster.apply((row, col) -> row == col ? 1.0 : 0.0);
 * final double trace = raster.reduce(0.0, (prev, pixel, row, col) -> row == col ? prev + pixel : prev);
 * </code>
 * </pre>
 */
public final class DoubleRaster {
    private final int rows;
    private final int cols;
    private final double[] data;

    /**
     * Wraps (does NOT copy) the data.
     */
    DoubleRaster(final int rows, final int cols, final double[] data) {
        if(rows < 0 || cols < 0)
            throw new ShapeException("A raster can't have a negative dimension (" + rows + " X " + cols + ")");
        if(data.length != (long)rows * cols)
            throw new ShapeException("Data of length " + data.length + " can't be viewed as a " + rows + " X " + cols + " raster");
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    public static DoubleRaster zeros(final int rows, final int cols) {
        return filled(rows, cols, 0.0);
    }

    public static DoubleRaster filled(final int rows, final int cols, final double value) {
        final double[] data = new double[size(rows, cols)];
        if(value != 0.0)
            Arrays.fill(data, value);
        return new DoubleRaster(rows, cols, data);
    }

    /**
     * Copy a flat, row-major buffer into a new raster.
     *
     * @throws ShapeException if the buffer length isn't {@code rows * cols}.
     */
    public static DoubleRaster of(final int rows, final int cols, final double[] rowMajor) {
        if(rowMajor == null)
            throw new NullPointerException("Cannot create a " + DoubleRaster.class.getSimpleName() + " from a null buffer");
        return new DoubleRaster(rows, cols, Arrays.copyOf(rowMajor, rowMajor.length));
    }

    /**
     * Copy a {@code double[row][col]} array into a new raster.
     *
     * @throws ShapeException if the rows aren't all the same length.
     */
    public static DoubleRaster of(final double[][] image) {
        final int rows = rowCount(image);
        final int cols = colCount(image);
        final double[] data = new double[size(rows, cols)];
        for(int r = 0; r < rows; r++) {
            checkRow(image[r] == null ? -1 : image[r].length, r, cols);
            System.arraycopy(image[r], 0, data, r * cols, cols);
        }
        return new DoubleRaster(rows, cols, data);
    }

    /**
     * Copy a {@code float[row][col]} array into a new, double precision, raster.
     *
     * @throws ShapeException if the rows aren't all the same length.
     */
    public static DoubleRaster of(final float[][] image) {
        final int rows = rowCount(image);
        final int cols = colCount(image);
        final double[] data = new double[size(rows, cols)];
        for(int r = 0; r < rows; r++) {
            checkRow(image[r] == null ? -1 : image[r].length, r, cols);
            for(int c = 0; c < cols; c++)
                data[(r * cols) + c] = image[r][c];
        }
        return new DoubleRaster(rows, cols, data);
    }

    /**
     * Copy an {@code int[row][col]} array into a new, double precision, raster.
     *
     * @throws ShapeException if the rows aren't all the same length.
     */
    public static DoubleRaster of(final int[][] image) {
        final int rows = rowCount(image);
        final int cols = colCount(image);
        final double[] data = new double[size(rows, cols)];
        for(int r = 0; r < rows; r++) {
            checkRow(image[r] == null ? -1 : image[r].length, r, cols);
            for(int c = 0; c < cols; c++)
                data[(r * cols) + c] = image[r][c];
        }
        return new DoubleRaster(rows, cols, data);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public boolean isEmpty() {
        return rows == 0 || cols == 0;
    }

    /**
     * Direct access to the row-major backing buffer. Changes are visible in the raster.
     */
    public double[] underlying() {
        return data;
    }

    public double get(final int row, final int col) {
        return data[(row * cols) + col];
    }

    public void set(final int row, final int col, final double value) {
        data[(row * cols) + col] = value;
    }

    /**
     * Make sure this raster is a usable image: at least one row and one column.
     *
     * @throws ShapeException if either dimension is zero.
     */
    public DoubleRaster requireNonEmpty() {
        if(isEmpty())
            throw new ShapeException("An image needs a positive height and width but this one is " + rows + " X " + cols);
        return this;
    }

    public DoubleRaster copy() {
        return new DoubleRaster(rows, cols, Arrays.copyOf(data, data.length));
    }

    /**
     * Copy out the given column from top to bottom.
     */
    public double[] column(final int col) {
        if(col < 0 || col >= cols)
            throw new IndexOutOfBoundsException("Column " + col + " is outside of a raster with " + cols + " columns");
        final double[] ret = new double[rows];
        for(int r = 0; r < rows; r++)
            ret[r] = data[(r * cols) + col];
        return ret;
    }

    /**
     * Overwrite the given column with {@code values}, which must have one entry per row.
     */
    public void setColumn(final int col, final double[] values) {
        if(values.length != rows)
            throw new ShapeException("Column of length " + values.length + " doesn't fit a raster with " + rows + " rows");
        for(int r = 0; r < rows; r++)
            data[(r * cols) + col] = values[r];
    }

    public double[][] toArray() {
        final double[][] ret = new double[rows][];
        for(int r = 0; r < rows; r++)
            ret[r] = Arrays.copyOfRange(data, r * cols, (r + 1) * cols);
        return ret;
    }

    /**
     * Set every pixel to the value returned from the given lambda.
     */
    public void apply(final DoublePixelSetter pixelSetter) {
        int pos = 0;
        for(int r = 0; r < rows; r++) {
            for(int c = 0; c < cols; c++)
                data[pos++] = pixelSetter.pixel(r, c);
        }
    }

    /**
     * Hand every pixel, in row-major order, to the given lambda.
     */
    public void forEach(final DoublePixelConsumer consumer) {
        int pos = 0;
        for(int r = 0; r < rows; r++) {
            for(int c = 0; c < cols; c++)
                consumer.accept(r, c, data[pos++]);
        }
    }

    /**
     * Reduce the raster to a single value of type {@code U}, visiting pixels in row-major order.
     */
    public <U> U reduce(final U identity, final PixelAggregate<U> seqOp) {
        U prev = identity;
        int pos = 0;
        for(int r = 0; r < rows; r++) {
            for(int c = 0; c < cols; c++)
                prev = seqOp.apply(prev, data[pos++], r, c);
        }
        return prev;
    }

    @FunctionalInterface
    public static interface DoublePixelSetter {
        public double pixel(int row, int col);
    }

    @FunctionalInterface
    public static interface DoublePixelConsumer {
        public void accept(int row, int col, double pixel);
    }

    @FunctionalInterface
    public static interface PixelAggregate<R> {
        public R apply(R prev, double pixel, int row, int col);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + rows;
        result = prime * result + cols;
        result = prime * result + Arrays.hashCode(data);
        return result;
    }

    /**
     * Two rasters are equal when they have the same shape and bit-identical samples.
     */
    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        final DoubleRaster other = (DoubleRaster)obj;
        if(rows != other.rows) return false;
        if(cols != other.cols) return false;
        return Arrays.equals(data, other.data);
    }

    @Override
    public String toString() {
        return DoubleRaster.class.getSimpleName() + " [" + rows + " X " + cols + "]";
    }

    private static int size(final int rows, final int cols) {
        if(rows < 0 || cols < 0)
            throw new ShapeException("A raster can't have a negative dimension (" + rows + " X " + cols + ")");
        try {
            return Math.multiplyExact(rows, cols);
        } catch(final ArithmeticException ae) {
            throw new ShapeException("A " + rows + " X " + cols + " raster has too many pixels to fit in a single buffer", ae);
        }
    }

    private static int rowCount(final Object[] image) {
        if(image == null)
            throw new NullPointerException("Cannot create a " + DoubleRaster.class.getSimpleName() + " from a null array");
        return image.length;
    }

    private static int colCount(final Object[] image) {
        if(image.length == 0)
            return 0;
        if(image[0] == null)
            throw new ShapeException("Row 0 of the image is null");
        return Array.getLength(image[0]);
    }

    private static void checkRow(final int rowLength, final int row, final int cols) {
        if(rowLength != cols)
            throw new ShapeException("The image isn't rectangular. Row " + row + " has " + (rowLength < 0 ? "no" : Integer.toString(rowLength))
                + " columns while row 0 has " + cols);
    }
}
