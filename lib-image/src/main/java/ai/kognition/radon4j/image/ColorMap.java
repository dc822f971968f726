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

/**
 * Maps a normalized intensity in {@code [0, 1]} to a packed 0xRRGGBB color.
 */
public enum ColorMap {
    GRAY {
        @Override
        public int rgb(final double t) {
            final int v = channel(t);
            return (v << 16) | (v << 8) | v;
        }
    },

    /**
     * Dark blue through cyan, yellow and on to dark red.
     */
    JET {
        @Override
        public int rgb(final double t) {
            final double q = 4.0 * clamp(t);
            final int r = channel(1.5 - Math.abs(q - 3.0));
            final int g = channel(1.5 - Math.abs(q - 2.0));
            final int b = channel(1.5 - Math.abs(q - 1.0));
            return (r << 16) | (g << 8) | b;
        }
    };

    public abstract int rgb(double t);

    private static double clamp(final double t) {
        if(Double.isNaN(t) || t <= 0.0)
            return 0.0;
        return t >= 1.0 ? 1.0 : t;
    }

    static int channel(final double t) {
        return (int)Math.round(clamp(t) * 255.0);
    }
}
