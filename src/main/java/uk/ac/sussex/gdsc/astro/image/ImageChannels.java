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
import ij.process.ImageProcessor;
import uk.ac.sussex.gdsc.astro.ShapeMismatchException;

/**
 * Split and merge 8-bit images as single channel planes.
 *
 * <p>Grayscale images are a {@link ByteProcessor}; colour images are a {@link ColorProcessor}
 * with channels in RGB order. Single channel operations are mapped over the planes so grayscale
 * and colour images are processed identically.
 */
public final class ImageChannels {
  /** Luminance weight for the red channel. */
  private static final double WEIGHT_R = 0.299;
  /** Luminance weight for the green channel. */
  private static final double WEIGHT_G = 0.587;
  /** Luminance weight for the blue channel. */
  private static final double WEIGHT_B = 0.114;

  /** No public construction. */
  private ImageChannels() {}

  /**
   * Get the number of channels.
   *
   * @param ip the image
   * @return the channel count (1 or 3)
   * @throws IllegalArgumentException if the image is not 8-bit grayscale or RGB
   */
  public static int getChannelCount(ImageProcessor ip) {
    if (ip instanceof ByteProcessor) {
      return 1;
    }
    if (ip instanceof ColorProcessor) {
      return 3;
    }
    throw new IllegalArgumentException(
        "An 8-bit grayscale or RGB image is required: " + ip.getBitDepth() + "-bit");
  }

  /**
   * Split the image into channels. A grayscale image returns itself as the single channel.
   *
   * @param ip the image
   * @return the channels
   * @throws IllegalArgumentException if the image is not 8-bit grayscale or RGB
   */
  public static ByteProcessor[] split(ImageProcessor ip) {
    if (getChannelCount(ip) == 1) {
      return new ByteProcessor[] {(ByteProcessor) ip};
    }
    final int width = ip.getWidth();
    final int height = ip.getHeight();
    final int size = width * height;
    final byte[] r = new byte[size];
    final byte[] g = new byte[size];
    final byte[] b = new byte[size];
    ((ColorProcessor) ip).getRGB(r, g, b);
    return new ByteProcessor[] {new ByteProcessor(width, height, r),
        new ByteProcessor(width, height, g), new ByteProcessor(width, height, b)};
  }

  /**
   * Merge the channels. A single channel is returned as is; three channels are combined as RGB.
   *
   * @param channels the channels
   * @return the image
   * @throws IllegalArgumentException if the channel count is not 1 or 3
   * @throws ShapeMismatchException if the channels have different dimensions
   */
  public static ImageProcessor merge(ByteProcessor[] channels) {
    if (channels.length == 1) {
      return channels[0];
    }
    if (channels.length != 3) {
      throw new IllegalArgumentException("Expected 1 or 3 channels: " + channels.length);
    }
    checkSameSize(channels[0], channels[1], "red", "green");
    checkSameSize(channels[0], channels[2], "red", "blue");
    final ColorProcessor cp = new ColorProcessor(channels[0].getWidth(), channels[0].getHeight());
    cp.setRGB((byte[]) channels[0].getPixels(), (byte[]) channels[1].getPixels(),
        (byte[]) channels[2].getPixels());
    return cp;
  }

  /**
   * Get the luminance of the image. A grayscale image is returned as is.
   *
   * <pre>
   * Y = round(0.299 R + 0.587 G + 0.114 B)
   * </pre>
   *
   * @param ip the image
   * @return the luminance
   * @throws IllegalArgumentException if the image is not 8-bit grayscale or RGB
   */
  public static ByteProcessor luminance(ImageProcessor ip) {
    final ByteProcessor[] channels = split(ip);
    if (channels.length == 1) {
      return channels[0];
    }
    final byte[] r = (byte[]) channels[0].getPixels();
    final byte[] g = (byte[]) channels[1].getPixels();
    final byte[] b = (byte[]) channels[2].getPixels();
    final byte[] y = new byte[r.length];
    for (int i = 0; i < y.length; i++) {
      y[i] = (byte) Math.round(
          WEIGHT_R * (r[i] & 0xff) + WEIGHT_G * (g[i] & 0xff) + WEIGHT_B * (b[i] & 0xff));
    }
    return new ByteProcessor(ip.getWidth(), ip.getHeight(), y);
  }

  /**
   * Check the two images have the same width, height and channel count.
   *
   * @param ip1 the first image
   * @param ip2 the second image
   * @param name1 the name of the first image
   * @param name2 the name of the second image
   * @throws ShapeMismatchException if the shapes differ
   */
  public static void checkSameShape(ImageProcessor ip1, ImageProcessor ip2, String name1,
      String name2) {
    checkSameSize(ip1, ip2, name1, name2);
    final int c1 = getChannelCount(ip1);
    final int c2 = getChannelCount(ip2);
    if (c1 != c2) {
      throw new ShapeMismatchException(
          String.format("Channel mismatch: %s=%d, %s=%d", name1, c1, name2, c2));
    }
  }

  /**
   * Check the two images have the same width and height.
   *
   * @param ip1 the first image
   * @param ip2 the second image
   * @param name1 the name of the first image
   * @param name2 the name of the second image
   * @throws ShapeMismatchException if the dimensions differ
   */
  public static void checkSameSize(ImageProcessor ip1, ImageProcessor ip2, String name1,
      String name2) {
    if (ip1.getWidth() != ip2.getWidth() || ip1.getHeight() != ip2.getHeight()) {
      throw new ShapeMismatchException(String.format("Size mismatch: %s=%dx%d, %s=%dx%d", name1,
          ip1.getWidth(), ip1.getHeight(), name2, ip2.getWidth(), ip2.getHeight()));
    }
  }
}
