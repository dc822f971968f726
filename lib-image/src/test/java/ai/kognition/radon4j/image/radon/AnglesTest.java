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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class AnglesTest {

    @Test
    public void testHalfTurnInDegreeSteps() {
        final double[] angles = Angles.range(0, 180, 1);
        assertEquals(180, angles.length);
        assertEquals(0.0, angles[0], 0.0);
        assertEquals(179.0, angles[179], 0.0);
    }

    @Test
    public void testFractionalAndNegativeSteps() {
        assertArrayEquals(new double[] {0,0.25,0.5,0.75}, Angles.range(0, 1, 0.25), 0.0);
        assertArrayEquals(new double[] {180,135,90,45}, Angles.range(180, 0, -45), 0.0);
        assertArrayEquals(new double[] {0,30,60}, Angles.range(0, 61, 30), 0.0);
    }

    @Test
    public void testEmptyRanges() {
        assertEquals(0, Angles.range(0, 0, 1).length);
        assertEquals(0, Angles.range(10, 0, 1).length);
        assertEquals(0, Angles.range(0, 10, -1).length);
    }

    @Test
    public void testBadStep() {
        assertThrows(IllegalArgumentException.class, () -> Angles.range(0, 180, 0));
        assertThrows(IllegalArgumentException.class, () -> Angles.range(0, 180, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> Angles.range(0, 180, Double.POSITIVE_INFINITY));
    }

    @Test
    public void testToRadians() {
        assertArrayEquals(new double[] {Math.PI,0.0,-Math.PI / 2.0}, Angles.toRadians(new double[] {180,0,-90}), 1e-15);
        assertEquals(0, Angles.toRadians(new double[0]).length);
    }
}
