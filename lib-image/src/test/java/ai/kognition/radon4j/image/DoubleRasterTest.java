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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class DoubleRasterTest {

    @Test
    public void testRowMajorLayout() {
        final DoubleRaster raster = DoubleRaster.of(new double[][] {
            {1,2,3},
            {4,5,6}
        });

        assertEquals(2, raster.rows());
        assertEquals(3, raster.cols());
        assertArrayEquals(new double[] {1,2,3,4,5,6}, raster.underlying(), 0.0);
        assertEquals(6.0, raster.get(1, 2), 0.0);
        assertArrayEquals(new double[] {2,5}, raster.column(1), 0.0);
    }

    @Test
    public void testFactoriesCopy() {
        final double[][] src = {{1,2},{3,4}};
        final DoubleRaster raster = DoubleRaster.of(src);
        src[0][0] = 100.0;
        assertEquals(1.0, raster.get(0, 0), 0.0);

        final double[] flat = {1,2,3,4};
        final DoubleRaster fromFlat = DoubleRaster.of(2, 2, flat);
        flat[3] = 100.0;
        assertEquals(4.0, fromFlat.get(1, 1), 0.0);

        final DoubleRaster copy = raster.copy();
        copy.set(1, 1, -1.0);
        assertEquals(4.0, raster.get(1, 1), 0.0);
        assertNotEquals(raster, copy);
    }

    @Test
    public void testFloatAndIntConvertToDouble() {
        final DoubleRaster f = DoubleRaster.of(new float[][] {{0.5f,1.5f},{2.5f,3.5f}});
        final DoubleRaster i = DoubleRaster.of(new int[][] {{1,2},{3,4}});

        assertEquals(3.5, f.get(1, 1), 0.0);
        assertEquals(3.0, i.get(1, 0), 0.0);
    }

    @Test
    public void testRaggedIsAShapeError() {
        final ShapeException se = assertThrows(ShapeException.class, () -> DoubleRaster.of(new double[][] {{1,2,3},{4,5}}));
        assertTrue(se.getMessage().contains("Row 1"));

        assertThrows(ShapeException.class, () -> DoubleRaster.of(new double[][] {{1,2},null}));
        assertThrows(ShapeException.class, () -> DoubleRaster.of(new float[][] {{1},{2,3}}));
        assertThrows(ShapeException.class, () -> DoubleRaster.of(2, 3, new double[5]));
        assertThrows(ShapeException.class, () -> DoubleRaster.zeros(-1, 3));
    }

    @Test
    public void testEmpty() {
        final DoubleRaster empty = DoubleRaster.of(new double[0][]);
        assertTrue(empty.isEmpty());
        assertThrows(ShapeException.class, () -> empty.requireNonEmpty());
        assertThrows(ShapeException.class, () -> DoubleRaster.zeros(4, 0).requireNonEmpty());
    }

    @Test
    public void testApplyAndReduce() {
        final DoubleRaster raster = DoubleRaster.zeros(3, 3);
        raster.apply((row, col) -> row == col ? 2.0 : 0.0);

        final double trace = raster.reduce(0.0, (prev, pixel, row, col) -> row == col ? prev + pixel : prev);
        assertEquals(6.0, trace, 0.0);

        final double[] sum = new double[1];
        raster.forEach((row, col, pixel) -> sum[0] += pixel);
        assertEquals(6.0, sum[0], 0.0);
    }

    @Test
    public void testSetColumn() {
        final DoubleRaster raster = DoubleRaster.zeros(2, 3);
        raster.setColumn(2, new double[] {7,8});

        assertArrayEquals(new double[][] {{0,0,7},{0,0,8}}, raster.toArray());
        assertThrows(ShapeException.class, () -> raster.setColumn(0, new double[] {1,2,3}));
    }

    @Test
    public void testTooManyPixels() {
        // 100000 * 100000 doesn't fit in an int
        assertThrows(ShapeException.class, () -> DoubleRaster.zeros(100000, 100000));
        assertThrows(ShapeException.class, () -> DoubleRaster.filled(Integer.MAX_VALUE, 2, 1.0));
        assertThrows(ShapeException.class, () -> DoubleRaster.zeros(-1, 2));
    }
}
