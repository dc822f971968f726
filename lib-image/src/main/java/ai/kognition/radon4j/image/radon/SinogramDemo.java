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

import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.radon4j.image.ColorMap;
import ai.kognition.radon4j.image.DoubleRaster;
import ai.kognition.radon4j.image.ImageFile;
import ai.kognition.radon4j.image.ShapeException;
import ai.kognition.radon4j.image.Utils;
import ai.kognition.radon4j.image.display.swing.SwingImageDisplay;
import ai.kognition.radon4j.util.CommandLineParser;
import ai.kognition.radon4j.util.DetermineShowFlag;

/**
 * Builds a star pattern (or reads an image), computes its sinogram and either shows
 * both in windows or prints a short summary. Run with {@code -help} for the options.
 */
public class SinogramDemo {
    private static final Logger LOGGER = LoggerFactory.getLogger(SinogramDemo.class);

    public static final double DEFAULT_CENTER_ROW = 800;
    public static final double DEFAULT_CENTER_COL = 470;

    public static void usage(final PrintStream out) {
        out.println("usage: java " + SinogramDemo.class.getName() + " [options] [image]");
        out.println("  -in <file>            read a grayscale image rather than drawing the star pattern. The image");
        out.println("                        can also be given as the only non-option argument.");
        out.println("  -rows <n> -cols <n>   star pattern size (default " + StarPatternGenerator.DEFAULT_ROWS + " X "
            + StarPatternGenerator.DEFAULT_COLS + ")");
        out.println("  -cy <row> -cx <col>   star center (default " + DEFAULT_CENTER_ROW + ", " + DEFAULT_CENTER_COL + ")");
        out.println("  -length <n>           ray length (default " + StarPatternGenerator.DEFAULT_LENGTH + ")");
        out.println("  -thickness <n>        ray brush half width (default " + StarPatternGenerator.DEFAULT_THICKNESS + ")");
        out.println("  -start <deg> -stop <deg> -step <deg>   angle sweep, stop exclusive (default 0, 180, 1)");
        out.println("  -nopad                don't pad the image to its diagonal");
        out.println("  -nofov                don't restrict to the inscribed circle");
        out.println("  -fill <v>             fill value for padding and out of bounds samples (default 0)");
        out.println("  -threads <n>          threads to spread the angles over (default 1)");
        out.println("  -out <file>           write the sinogram, jet colored, to the file (format from extension)");
        out.println("  -show                 show the input and sinogram in windows (also -Dradon4j.SHOW)");
    }

    public static void main(final String[] args) throws Exception {
        final CommandLineParser clp = new CommandLineParser(args);
        if(clp.isSet("help") || clp.isSet("h")) {
            usage(System.out);
            return;
        }

        final Sinogram sinogram;
        try {
            sinogram = run(clp);
        } catch(final IllegalArgumentException | ShapeException bad) {
            LOGGER.error(bad.getMessage());
            usage(System.err);
            System.exit(1);
            return;
        }

        final boolean show = (clp.isSet("show") || DetermineShowFlag.SHOW) && !GraphicsEnvironment.isHeadless();
        if(!show)
            System.out.println(summarize(sinogram));
    }

    /**
     * Build the input, transform it, and write/show the results as the options ask.
     */
    public static Sinogram run(final CommandLineParser clp) throws IOException, InterruptedException, InvocationTargetException {
        final DoubleRaster image = input(clp);

        final double[] anglesDeg = Angles.range(clp.getDouble("start", 0.0), clp.getDouble("stop", 180.0), clp.getDouble("step", 1.0));
        final RadonTransform transform = new RadonTransform(!clp.isSet("nofov"), !clp.isSet("nopad"), clp.getDouble("fill", RadonTransform.DEFAULT_FILL))
            .withParallelism(clp.getInt("threads", 1));

        LOGGER.info("Computing the sinogram of {} over {} angles", image, anglesDeg.length);
        final Sinogram sinogram = transform.transform(image, anglesDeg);
        LOGGER.info("Computed {}", sinogram);

        final String out = clp.getString("out", null);
        if(out != null) {
            if(sinogram.numAngles() == 0)
                LOGGER.warn("There are no angles so there's no sinogram to write to {}", out);
            else {
                ImageFile.writeImageFile(sinogram.sinogram(), ColorMap.JET, out);
                LOGGER.info("Wrote the sinogram to {}", out);
            }
        }

        final boolean show = (clp.isSet("show") || DetermineShowFlag.SHOW);
        if(show) {
            if(GraphicsEnvironment.isHeadless())
                LOGGER.info("Can't show anything in a headless environment.");
            else
                show(image, sinogram);
        }

        return sinogram;
    }

    /**
     * The textual fallback used when nothing is displayed.
     */
    public static String summarize(final Sinogram sinogram) {
        final StringBuilder sb = new StringBuilder();
        sb.append("Computed sinogram shape (s, theta): (").append(sinogram.numDetectors()).append(", ").append(sinogram.numAngles()).append(")")
            .append(System.lineSeparator());
        final double[] s = sinogram.sCoords();
        sb.append("s range: (").append(s[0]).append(", ").append(s[s.length - 1]).append(")").append(System.lineSeparator());
        final double[] deg = sinogram.anglesDeg();
        if(deg.length == 0)
            sb.append("theta range (deg): none");
        else
            sb.append("theta range (deg): (").append(deg[0]).append(", ").append(deg[deg.length - 1]).append(")");
        return sb.toString();
    }

    /**
     * The image named by {@code -in} or by the single non-option argument.
     *
     * @throws IllegalArgumentException if more than one image is named.
     */
    static String inputFilename(final CommandLineParser clp) {
        final List<String> positional = clp.getNonOptionArgs();
        if(positional.size() > 1)
            throw new IllegalArgumentException("Only one input image can be given but there are " + positional.size() + ": " + positional);
        final String in = clp.getString("in", null);
        if(positional.isEmpty())
            return in;
        if(in != null)
            throw new IllegalArgumentException("The input image was given both with -in (" + in + ") and as an argument (" + positional.get(0) + ")");
        return positional.get(0);
    }

    private static DoubleRaster input(final CommandLineParser clp) throws IOException {
        final String in = inputFilename(clp);
        if(in != null) {
            LOGGER.info("Reading the input image from {}", in);
            return ImageFile.readRasterFromFile(in);
        }

        return new StarPatternGenerator()
            .shape(clp.getInt("rows", StarPatternGenerator.DEFAULT_ROWS), clp.getInt("cols", StarPatternGenerator.DEFAULT_COLS))
            .center(clp.getDouble("cy", DEFAULT_CENTER_ROW), clp.getDouble("cx", DEFAULT_CENTER_COL))
            .length(clp.getInt("length", StarPatternGenerator.DEFAULT_LENGTH))
            .thickness(clp.getInt("thickness", StarPatternGenerator.DEFAULT_THICKNESS))
            .generate();
    }

    private static void show(final DoubleRaster image, final Sinogram sinogram) throws InvocationTargetException, InterruptedException {
        try(SwingImageDisplay input = SwingImageDisplay.showImage(Utils.raster2Img(image, ColorMap.JET), "Input image");) {
            if(sinogram.numAngles() == 0) {
                input.waitUntilClosed();
                return;
            }
            try(SwingImageDisplay sino = SwingImageDisplay.showImage(Utils.raster2Img(flipRows(sinogram.sinogram()), ColorMap.JET),
                "Sinogram (x = theta, y = s)");) {
                sino.waitUntilClosed();
            }
        }
    }

    // smallest s at the bottom of the window
    private static DoubleRaster flipRows(final DoubleRaster in) {
        final DoubleRaster ret = DoubleRaster.zeros(in.rows(), in.cols());
        ret.apply((row, col) -> in.get(in.rows() - 1 - row, col));
        return ret;
    }
}
