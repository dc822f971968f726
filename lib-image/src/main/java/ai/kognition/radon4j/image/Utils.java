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

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversions between {@link DoubleRaster}s and {@link BufferedImage}s.
 */
public class Utils {
    private static final Logger LOGGER = LoggerFactory.getLogger(Utils.class);

    /**
     * Render the raster by stretching its finite values between their min and max
     * onto the color map. NaN and infinite samples are drawn as the low end of the map.
     * A {@link ColorMap#GRAY} rendering produces a {@code TYPE_BYTE_GRAY} image, anything
     * else a {@code TYPE_INT_RGB} one.
     *
     * @throws ShapeException if the raster has no rows or no columns.
     */
    public static BufferedImage raster2Img(final DoubleRaster in, final ColorMap colorMap) {
        in.requireNonEmpty();
        final double[] minMax = minMax(in);
        final double min = minMax[0];
        final double range = minMax[1] - min;
        LOGGER.trace("Rendering {} with {} over the range [{}, {}]", in, colorMap, min, minMax[1]);

        final int rows = in.rows();
        final int cols = in.cols();
        final BufferedImage ret = new BufferedImage(cols, rows, colorMap == ColorMap.GRAY ? BufferedImage.TYPE_BYTE_GRAY : BufferedImage.TYPE_INT_RGB);
        final WritableRaster raster = ret.getRaster();
        in.forEach((row, col, pixel) -> {
            final double t = (range > 0.0 && Double.isFinite(pixel)) ? (pixel - min) / range : 0.0;
            if(colorMap == ColorMap.GRAY)
                raster.setSample(col, row, 0, ColorMap.channel(t));
            else
                ret.setRGB(col, row, colorMap.rgb(t));
        });
        return ret;
    }

    /**
     * Convert the image to a single channel raster. Single band images are copied sample
     * for sample. Anything else is converted to luminance using
     * {@code 0.299 R + 0.587 G + 0.114 B}.
     */
    public static DoubleRaster img2Raster(final BufferedImage bufferedImage) {
        final int rows = bufferedImage.getHeight();
        final int cols = bufferedImage.getWidth();
        final DoubleRaster ret = DoubleRaster.zeros(rows, cols);
        final Raster raster = bufferedImage.getRaster();
        if(raster.getNumBands() == 1) {
            ret.apply((row, col) -> raster.getSampleDouble(col, row, 0));
        } else {
            LOGGER.trace("Converting {} band image of type {} to luminance", raster.getNumBands(), bufferedImage.getType());
            ret.apply((row, col) -> {
                final int rgb = bufferedImage.getRGB(col, row);
                return (0.299 * ((rgb >> 16) & 0xff)) + (0.587 * ((rgb >> 8) & 0xff)) + (0.114 * (rgb & 0xff));
            });
        }
        return ret;
    }

    /**
     * The smallest and largest finite values in the raster, as {@code {min, max}}. If there
     * are no finite values the result is {@code {0, 0}}.
     */
    public static double[] minMax(final DoubleRaster in) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for(final double v: in.underlying()) {
            if(!Double.isFinite(v))
                continue;
            if(v < min)
                min = v;
            if(v > max)
                max = v;
        }
        return min > max ? new double[] {0.0,0.0} : new double[] {min,max};
    }
}
