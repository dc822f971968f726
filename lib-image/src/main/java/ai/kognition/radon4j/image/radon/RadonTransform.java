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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.radon4j.image.DoubleRaster;
import ai.kognition.radon4j.image.ShapeException;
import ai.kognition.radon4j.image.geometry.FieldOfViewMasker;
import ai.kognition.radon4j.image.geometry.GeometryPadder;
import ai.kognition.radon4j.image.geometry.transform.ImageRotator;
import ai.kognition.radon4j.util.Timer;

/**
 * <p>
 * Computes the (parallel beam) Radon transform of an image using the rotate-and-sum
 * approximation. For each projection angle the working image is rotated (see
 * {@link ImageRotator}) and each column is summed from top to bottom. At 0 degrees
 * that's the line integral along vertical lines.
 * </p>
 *
 * <p>
 * Before rotating, the image is optionally padded out to its diagonal (so nothing is
 * lost to the corners) and optionally masked down to the inscribed circle (the
 * classical Radon field of view). Every angle is resampled from that same working
 * image rather than from the previous angle's rotation so interpolation error never
 * accumulates across the sweep.
 * </p>
 *
 * <p>
 * Instances are immutable and can be shared between threads. If {@code parallelism}
 * is more than 1, the angles of a single call are spread across that many threads.
 * Each column is still summed top to bottom by the thread that owns its angle so the
 * result is bit-for-bit the same as the single threaded one.
 * </p>
 *
 * <pre>
 * <code>
 * final Sinogram result = new RadonTransform().transform(image, Angles.range(0, 180, 1));
 * </code>
 * </pre>
 */
public class RadonTransform {
    private static final Logger LOGGER = LoggerFactory.getLogger(RadonTransform.class);
    private static final AtomicInteger threadSequence = new AtomicInteger(0);

    /**
     * System property holding the default number of threads used per transform.
     */
    public static final String PARALLELISM_PROPERTY = "radon4j.parallelism";

    public static final boolean DEFAULT_USE_CIRCULAR_FOV = true;
    public static final boolean DEFAULT_PAD = true;
    public static final double DEFAULT_FILL = 0.0;

    public final boolean useCircularFov;
    public final boolean pad;
    public final double fill;
    public final int parallelism;

    /**
     * Pad to the diagonal, restrict to the circular field of view and fill with 0.0.
     */
    public RadonTransform() {
        this(DEFAULT_USE_CIRCULAR_FOV, DEFAULT_PAD, DEFAULT_FILL);
    }

    public RadonTransform(final boolean useCircularFov, final boolean pad, final double fill) {
        this(useCircularFov, pad, fill, defaultParallelism());
    }

    public RadonTransform(final boolean useCircularFov, final boolean pad, final double fill, final int parallelism) {
        if(parallelism < 1)
            throw new IllegalArgumentException("parallelism must be at least 1 but was " + parallelism);
        this.useCircularFov = useCircularFov;
        this.pad = pad;
        this.fill = fill;
        this.parallelism = parallelism;
    }

    /**
     * A copy of this transform that spreads the angles over the given number of threads.
     */
    public RadonTransform withParallelism(final int threads) {
        return new RadonTransform(useCircularFov, pad, fill, threads);
    }

    /**
     * Convenience for a one off transform.
     */
    public static Sinogram radon(final DoubleRaster image, final double[] anglesDeg, final boolean useCircularFov, final boolean pad,
        final double fill) {
        return new RadonTransform(useCircularFov, pad, fill).transform(image, anglesDeg);
    }

    /**
     * @throws ShapeException if the array is ragged or empty.
     */
    public Sinogram transform(final double[][] image, final double... anglesDeg) {
        return transform(DoubleRaster.of(image), anglesDeg);
    }

    /**
     * Compute the sinogram of the image for the given angles, in degrees. The angles
     * don't need to be sorted and the order is kept in the result. An empty list of
     * angles gives a sinogram with no columns.
     *
     * @throws ShapeException if the image has no rows or no columns.
     */
    public Sinogram transform(final DoubleRaster image, final double... anglesDeg) {
        if(anglesDeg == null)
            throw new NullPointerException("Cannot pass a null array of angles to " + RadonTransform.class.getSimpleName() + ".transform");

        final Timer timer = new Timer().start();
        final DoubleRaster work = prepare(image);

        final int numDetectors = work.cols();
        final int numAngles = anglesDeg.length;
        final DoubleRaster sinogram = DoubleRaster.zeros(numDetectors, numAngles);

        if(parallelism > 1 && numAngles > 1)
            projectInParallel(work, anglesDeg, sinogram);
        else {
            for(int j = 0; j < numAngles; j++)
                sinogram.setColumn(j, project(ImageRotator.rotate(work, anglesDeg[j], fill)));
        }

        final Sinogram ret = new Sinogram(sinogram, detectorCoordinates(numDetectors), Angles.toRadians(anglesDeg));
        timer.stop();
        if(LOGGER.isDebugEnabled())
            LOGGER.debug("Radon transform of {} over {} angles using {} thread(s) took {} seconds: {}", image, numAngles,
                Math.min(parallelism, Math.max(numAngles, 1)), timer, ret);
        return ret;
    }

    /**
     * The working image the projections are taken from: a double precision copy of the
     * input, padded to its diagonal and/or masked to the inscribed circle depending on
     * how this transform is configured.
     *
     * @throws ShapeException if the image has no rows or no columns.
     */
    public DoubleRaster prepare(final DoubleRaster image) {
        if(image == null)
            throw new NullPointerException("Cannot pass a null image to " + RadonTransform.class.getSimpleName());
        DoubleRaster work = image.requireNonEmpty().copy();
        if(pad)
            work = GeometryPadder.padToDiagonal(work, fill);
        if(useCircularFov)
            work = FieldOfViewMasker.applyCircularFov(work);
        LOGGER.trace("Working image for {} is {} (pad: {}, circular fov: {})", image, work, pad, useCircularFov);
        return work;
    }

    /**
     * Sum each column of the image from the top row to the bottom row.
     */
    public static double[] project(final DoubleRaster rotated) {
        final int rows = rotated.rows();
        final int cols = rotated.cols();
        final double[] data = rotated.underlying();
        final double[] ret = new double[cols];
        for(int r = 0; r < rows; r++) {
            final int rowStart = r * cols;
            for(int c = 0; c < cols; c++)
                ret[c] += data[rowStart + c];
        }
        return ret;
    }

    /**
     * Detector positions, centered on zero with unit spacing:
     * {@code -(n - 1)/2, ..., (n - 1)/2}.
     */
    public static double[] detectorCoordinates(final int numDetectors) {
        final double[] ret = new double[numDetectors];
        final double start = -(numDetectors - 1) / 2.0;
        for(int i = 0; i < numDetectors; i++)
            ret[i] = start + i;
        return ret;
    }

    private static int defaultParallelism() {
        final Integer prop = Integer.getInteger(PARALLELISM_PROPERTY);
        if(prop == null)
            return 1;
        if(prop.intValue() < 1) {
            LOGGER.warn("Ignoring the system property \"{}\" since it's set to {}. It must be at least 1.", PARALLELISM_PROPERTY, prop);
            return 1;
        }
        return prop.intValue();
    }

    private void projectInParallel(final DoubleRaster work, final double[] anglesDeg, final DoubleRaster sinogram) {
        final int numThreads = Math.min(parallelism, anglesDeg.length);
        final ExecutorService executor = Executors.newFixedThreadPool(numThreads, r -> {
            final Thread t = new Thread(r, "radon-projector-" + threadSequence.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        try {
            final List<Future<double[]>> projections = new ArrayList<>(anglesDeg.length);
            for(final double angle: anglesDeg)
                projections.add(executor.submit(() -> project(ImageRotator.rotate(work, angle, fill))));

            for(int j = 0; j < anglesDeg.length; j++) {
                try {
                    sinogram.setColumn(j, projections.get(j).get());
                } catch(final ExecutionException ee) {
                    final Throwable cause = ee.getCause();
                    if(cause instanceof RuntimeException)
                        throw (RuntimeException)cause;
                    if(cause instanceof Error)
                        throw (Error)cause;
                    throw new RadonException("Failed to project angle " + anglesDeg[j], cause);
                }
            }
        } catch(final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RadonException("Interrupted while waiting on the projections", ie);
        } finally {
            executor.shutdownNow();
        }
    }
}
