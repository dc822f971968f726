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

/**
 * Helpers for building the angle sweeps handed to a {@link RadonTransform}.
 */
public final class Angles {

    private Angles() {}

    /**
     * Evenly spaced angles from {@code start} (inclusive) toward {@code stop} (exclusive).
     * {@code range(0, 180, 1)} gives {@code 0, 1, ..., 179}. A range that's empty in the
     * direction of the step gives an empty array.
     *
     * @throws IllegalArgumentException if the step is zero or not finite.
     */
    public static double[] range(final double start, final double stop, final double step) {
        if(step == 0.0 || !Double.isFinite(step))
            throw new IllegalArgumentException("The step between angles must be a non-zero finite number but was " + step);
        final double count = Math.ceil((stop - start) / step);
        if(!(count > 0))
            return new double[0];
        if(count > Integer.MAX_VALUE)
            throw new IllegalArgumentException("Too many angles from " + start + " to " + stop + " in steps of " + step);
        final double[] ret = new double[(int)count];
        for(int i = 0; i < ret.length; i++)
            ret[i] = start + (i * step);
        return ret;
    }

    /**
     * Element-wise conversion from degrees to radians, order preserved.
     */
    public static double[] toRadians(final double[] anglesDeg) {
        final double[] ret = new double[anglesDeg.length];
        for(int i = 0; i < ret.length; i++)
            ret[i] = Math.toRadians(anglesDeg[i]);
        return ret;
    }
}
