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
import static org.junit.Assert.assertThrows;

import org.junit.Test;

import ai.kognition.radon4j.image.DoubleRaster;
import ai.kognition.radon4j.image.ShapeException;

public class GeometryPadderTest {

    @Test
    public void testDiagonalSide() {
        assertEquals(4, GeometryPadder.diagonalSide(2, 3)); // sqrt(13) = 3.6
        assertEquals(5, GeometryPadder.diagonalSide(3, 4)); // exactly 5
        assertEquals(143, GeometryPadder.diagonalSide(101, 101));
        assertEquals(2, GeometryPadder.diagonalSide(1, 1));
    }

    @Test
    public void testImageIsCenteredAndSurroundedByFill() {
        final DoubleRaster image = DoubleRaster.of(new double[][] {
            {1,2,3},
            {4,5,6}
        });

        final DoubleRaster padded = GeometryPadder.padToDiagonal(image, 7.0);

        assertEquals(4, padded.rows());
        assertEquals(4, padded.cols());
        // offsets are (4 - 2) / 2 = 1 rows and (4 - 3) / 2 = 0 columns
        final double[][] expected = {
            {7,7,7,7},
            {1,2,3,7},
            {4,5,6,7},
            {7,7,7,7}
        };
        for(int r = 0; r < 4; r++)
            for(int c = 0; c < 4; c++)
                assertEquals("(" + r + "," + c + ")", expected[r][c], padded.get(r, c), 0.0);
    }

    @Test
    public void testInputNotMutated() {
        final DoubleRaster image = DoubleRaster.filled(3, 3, 1.0);
        final DoubleRaster before = image.copy();

        GeometryPadder.padToDiagonal(image, 9.0);

        assertEquals(before, image);
    }

    @Test
    public void testNonPositiveDimensions() {
        assertThrows(ShapeException.class, () -> GeometryPadder.padToDiagonal(DoubleRaster.zeros(0, 5), 0.0));
        assertThrows(ShapeException.class, () -> GeometryPadder.padToDiagonal(DoubleRaster.zeros(5, 0), 0.0));
    }
}
