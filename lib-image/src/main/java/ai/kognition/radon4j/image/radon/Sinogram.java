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

/**
 * The result of a {@link RadonTransform}. The {@link #sinogram()} has one row per
 * detector position and one column per projection angle, in the same order the
 * angles were given in. {@link #sCoords()} holds the detector coordinate for each row
 * and {@link #anglesRad()} the angle, in radians, for each column.
 *
 * <p>
 * A Sinogram is immutable. Each accessor hands back a copy so it can be shared
 * between threads.
 * </p>
 */
public class Sinogram {
    private final DoubleRaster sinogram;
    private final double[] sCoords;
    private final double[] anglesRad;

    Sinogram(final DoubleRaster sinogram, final double[] sCoords, final double[] anglesRad) {
        this.sinogram = sinogram;
        this.sCoords = sCoords;
        this.anglesRad = anglesRad;
    }

    /**
     * A copy of the (s, theta) raster.
     */
    public DoubleRaster sinogram() {
        return sinogram.copy();
    }

    /**
     * A copy of the detector coordinates, strictly increasing and centered on zero.
     */
    public double[] sCoords() {
        return sCoords.clone();
    }

    /**
     * A copy of the projection angles in radians, in the order they were given.
     */
    public double[] anglesRad() {
        return anglesRad.clone();
    }

    public int numDetectors() {
        return sinogram.rows();
    }

    public int numAngles() {
        return sinogram.cols();
    }

    /**
     * A copy of the projection (line integrals ordered by s) for the angle at the given index.
     */
    public double[] projection(final int angleIndex) {
        return sinogram.column(angleIndex);
    }

    /**
     * The angles in degrees, converted back from {@link #anglesRad()}.
     */
    public double[] anglesDeg() {
        return Arrays.stream(anglesRad).map(Math::toDegrees).toArray();
    }

    @Override
    public String toString() {
        return "[ sinogram (s, theta): " + numDetectors() + " X " + numAngles()
            + (sCoords.length > 0 ? ", s: [" + sCoords[0] + ", " + sCoords[sCoords.length - 1] + "]" : "")
            + (anglesRad.length > 0 ? ", theta(rad): [" + anglesRad[0] + ", " + anglesRad[anglesRad.length - 1] + "]" : "")
            + "]";
    }
}
