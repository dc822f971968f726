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

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import ai.kognition.radon4j.image.DoubleRaster;

public class FieldOfViewMaskerTest {

    @Test
    public void testSquareImage() {
        final DoubleRaster masked = FieldOfViewMasker.applyCircularFov(DoubleRaster.filled(5, 5, 3.0));

        // center (2,2), radius 2
        assertEquals(0.0, masked.get(0, 0), 0.0);
        assertEquals(0.0, masked.get(4, 4), 0.0);
        assertEquals(0.0, masked.get(0, 1), 0.0);
        // on the circle is kept
        assertEquals(3.0, masked.get(0, 2), 0.0);
        assertEquals(3.0, masked.get(2, 4), 0.0);
        assertEquals(3.0, masked.get(1, 1), 0.0);
        assertEquals(3.0, masked.get(2, 2), 0.0);
    }

    @Test
    public void testRadiusIsTheSmallerHalfDimension() {
        final DoubleRaster masked = FieldOfViewMasker.applyCircularFov(DoubleRaster.filled(3, 5, 1.0));

        // center (x=2, y=1), radius 1
        assertEquals(1.0, masked.get(1, 3), 0.0);
        assertEquals(1.0, masked.get(0, 2), 0.0);
        assertEquals(0.0, masked.get(0, 1), 0.0);
        assertEquals(0.0, masked.get(1, 0), 0.0);
        assertEquals(0.0, masked.get(1, 4), 0.0);

        final double total = masked.reduce(0.0, (prev, pixel, row, col) -> prev + pixel);
        assertEquals(5.0, total, 0.0);
    }

    @Test
    public void testInputNotMutatedAndValuesOutsideAreZeroed() {
        final DoubleRaster image = DoubleRaster.filled(4, 4, Double.NaN);
        final DoubleRaster masked = FieldOfViewMasker.applyCircularFov(image);

        assertEquals(0.0, masked.get(0, 0), 0.0);
        assertEquals(Double.NaN, masked.get(1, 1), 0.0);
        assertEquals(Double.NaN, image.get(0, 0), 0.0);
    }
}
