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
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import javax.imageio.ImageIO;

import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reading and writing images through ImageIO.
 */
public class ImageFile {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageFile.class);

    /**
     * Read an image file into a {@link BufferedImage}.
     *
     * @throws FileNotFoundException if the file doesn't exist.
     * @throws IOException if no ImageIO reader can decode it.
     */
    public static BufferedImage readBufferedImageFromFile(final String filename) throws IOException {
        LOGGER.trace("Reading image from {}", filename);
        final File f = new File(filename);
        if(!f.exists())
            throw new FileNotFoundException(filename);
        final BufferedImage ret = ImageIO.read(f);
        if(ret == null)
            throw new IOException("No ImageIO reader could decode '" + filename + "'");
        LOGGER.trace("Read {} from {}", ret, filename);
        return ret;
    }

    /**
     * Read an image file as a single channel, double precision raster. Color images are
     * converted to luminance (see {@link Utils#img2Raster(BufferedImage)}).
     */
    public static DoubleRaster readRasterFromFile(final String filename) throws IOException {
        return Utils.img2Raster(readBufferedImageFromFile(filename));
    }

    /**
     * Write the image using the format implied by the file's extension. Missing parent
     * directories are created.
     *
     * @throws IOException if the filename has no extension or the write fails.
     * @throws IllegalArgumentException if ImageIO has no writer for the extension.
     */
    public static void writeImageFile(final BufferedImage ri, final String filename) throws IOException {
        LOGGER.trace("Writing image {} to {}", ri, filename);
        final String ext = FilenameUtils.getExtension(filename);
        if(ext == null || ext.isEmpty())
            throw new IOException("No extention on " + filename);

        final File f = new File(filename).getCanonicalFile();
        final File p = f.getParentFile();
        // make sure the output directory exists.
        if(p != null)
            p.mkdirs();

        if(!ImageIO.write(ri, ext, f)) {
            LOGGER.debug("Failed to write '{}' using ImageIO", filename);
            throw new IllegalArgumentException("Failed to write \"" + filename + "\". There's no ImageIO writer for \"" + ext + "\"");
        }
    }

    /**
     * Render the raster with the given color map (see {@link Utils#raster2Img(DoubleRaster, ColorMap)})
     * and write it out.
     */
    public static void writeImageFile(final DoubleRaster raster, final ColorMap colorMap, final String filename) throws IOException {
        writeImageFile(Utils.raster2Img(raster, colorMap), filename);
    }
}
