/*-
 * #%L
 * Genome Damage and Stability Centre ImageJ Plugins
 *
 * Software for microscopy image analysis
 * %%
 * Copyright (C) 2011 - 2020 Alex Herbert
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package uk.ac.sussex.gdsc.astro.image;

import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * Convert floating-point working data to 8-bit display data using a min-max normalisation.
 *
 * <pre>
 * u8 = round(255 * (x - min) / (max - min))
 * </pre>
 *
 * <p>Non-finite samples do not contribute to the min and max and map to zero. If there are no
 * finite samples, or all finite samples are equal, the output is all zero.
 */
public final class ImageNormaliser {

  /** No public construction. */
  private ImageNormaliser() {}

  /**
   * Normalise the data to the range [0, 255].
   *
   * @param data the data
   * @return the normalised data
   */
  public static byte[] normalise(float[] data) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (final float value : data) {
      if (Float.isFinite(value)) {
        if (value < min) {
          min = value;
        }
        if (value > max) {
          max = value;
        }
      }
    }

    final byte[] out = new byte[data.length];
    // Also true when no finite values were found
    if (!(max > min)) {
      return out;
    }
    final double range = max - min;
    for (int i = 0; i < data.length; i++) {
      final float value = data[i];
      if (Float.isFinite(value)) {
        out[i] = (byte) Math.round(255.0 * (value - min) / range);
      }
    }
    return out;
  }

  /**
   * Normalise a single channel image to the range [0, 255].
   *
   * @param ip the image (8, 16 or 32-bit)
   * @return the normalised image
   * @throws IllegalArgumentException if the image is an RGB image
   */
  public static ByteProcessor normalise(ImageProcessor ip) {
    return new ByteProcessor(ip.getWidth(), ip.getHeight(), normalise(toFloat(ip)));
  }

  /**
   * Normalise each channel independently and combine to a display image. One channel creates a
   * {@link ByteProcessor}, three channels create a {@link ColorProcessor}.
   *
   * @param channels the channels
   * @return the display image
   */
  public static ImageProcessor normalise(FloatProcessor[] channels) {
    final ByteProcessor[] out = new ByteProcessor[channels.length];
    for (int i = 0; i < channels.length; i++) {
      out[i] = normalise(channels[i]);
    }
    return ImageChannels.merge(out);
  }

  /**
   * Get a copy of the single channel image samples as floats.
   *
   * @param ip the image (8, 16 or 32-bit)
   * @return the samples
   * @throws IllegalArgumentException if the image is an RGB image
   */
  public static float[] toFloat(ImageProcessor ip) {
    if (ip instanceof ColorProcessor) {
      throw new IllegalArgumentException("A single channel image is required");
    }
    if (ip instanceof FloatProcessor) {
      return ((float[]) ip.getPixels()).clone();
    }
    final float[] data = new float[ip.getPixelCount()];
    for (int i = 0; i < data.length; i++) {
      data[i] = ip.getf(i);
    }
    return data;
  }
}
