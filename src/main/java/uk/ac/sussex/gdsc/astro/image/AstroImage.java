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

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import uk.ac.sussex.gdsc.astro.ShapeMismatchException;

/**
 * An astronomical image held as floating-point working data and an 8-bit display copy.
 *
 * <p>The working data has one plane per channel with an arbitrary range. The display copy is the
 * per-channel min-max normalisation of the working data (see {@link ImageNormaliser}): a
 * {@link ByteProcessor} for a single channel or a {@link ColorProcessor} for three channels.
 *
 * <p>Instances are immutable. Accessors return the internal objects which must not be modified.
 */
public final class AstroImage {
  private final String title;
  private final FloatProcessor[] data;
  private final ImageProcessor image;

  /**
   * Create a new instance.
   *
   * @param title the title
   * @param data the data
   * @param image the image
   */
  private AstroImage(String title, FloatProcessor[] data, ImageProcessor image) {
    this.title = title;
    this.data = data;
    this.image = image;
  }

  /**
   * Create an image from the working data.
   *
   * @param title the title
   * @param channels the channels (1 or 3)
   * @return the image
   * @throws IllegalArgumentException if the channel count is not 1 or 3
   * @throws ShapeMismatchException if the channels have different dimensions
   */
  public static AstroImage create(String title, FloatProcessor... channels) {
    if (channels.length != 1 && channels.length != 3) {
      throw new IllegalArgumentException("Expected 1 or 3 channels: " + channels.length);
    }
    for (int i = 1; i < channels.length; i++) {
      ImageChannels.checkSameSize(channels[0], channels[i], "channel 1", "channel " + (i + 1));
    }
    final FloatProcessor[] data = new FloatProcessor[channels.length];
    for (int i = 0; i < data.length; i++) {
      data[i] = toFloatProcessor(channels[i]);
    }
    return new AstroImage(title, data, ImageNormaliser.normalise(data));
  }

  /**
   * Create an image from an ImageJ image.
   *
   * <p>Supported layouts are a single grayscale plane (any bit depth), an RGB image, or a stack
   * of three grayscale planes (e.g. a colour FITS cube stored channel-first).
   *
   * @param imp the image
   * @return the image
   * @throws IllegalArgumentException if the layout is not supported
   */
  public static AstroImage create(ImagePlus imp) {
    final ImageStack stack = imp.getImageStack();
    final int size = stack.getSize();
    if (imp.getType() == ImagePlus.COLOR_RGB) {
      if (size != 1) {
        throw new IllegalArgumentException("RGB stacks are not supported: " + size + " slices");
      }
      final ByteProcessor[] rgb = ImageChannels.split(imp.getProcessor());
      return create(imp.getTitle(), toFloatProcessor(rgb[0]), toFloatProcessor(rgb[1]),
          toFloatProcessor(rgb[2]));
    }
    if (size == 1) {
      return create(imp.getTitle(), toFloatProcessor(imp.getProcessor()));
    }
    if (size == 3) {
      return create(imp.getTitle(), toFloatProcessor(stack.getProcessor(1)),
          toFloatProcessor(stack.getProcessor(2)), toFloatProcessor(stack.getProcessor(3)));
    }
    throw new IllegalArgumentException(
        "Expected a single plane or 3 colour planes: " + size + " slices");
  }

  private static FloatProcessor toFloatProcessor(ImageProcessor ip) {
    return new FloatProcessor(ip.getWidth(), ip.getHeight(), ImageNormaliser.toFloat(ip));
  }

  /**
   * Gets the title.
   *
   * @return the title
   */
  public String getTitle() {
    return title;
  }

  /**
   * Gets the width.
   *
   * @return the width
   */
  public int getWidth() {
    return image.getWidth();
  }

  /**
   * Gets the height.
   *
   * @return the height
   */
  public int getHeight() {
    return image.getHeight();
  }

  /**
   * Gets the channel count.
   *
   * @return the channel count
   */
  public int getChannelCount() {
    return data.length;
  }

  /**
   * Checks if is colour.
   *
   * @return true if colour
   */
  public boolean isColour() {
    return data.length == 3;
  }

  /**
   * Gets the working data for the channel.
   *
   * @param channel the channel (0-based)
   * @return the data
   */
  public FloatProcessor getData(int channel) {
    return data[channel];
  }

  /**
   * Gets the 8-bit display image.
   *
   * @return the image
   */
  public ImageProcessor getImage() {
    return image;
  }

  /**
   * Gets the 8-bit grayscale image used for star detection. For a colour image this is the
   * luminance of the display image.
   *
   * @return the gray image
   */
  public ByteProcessor getGrayImage() {
    return ImageChannels.luminance(image);
  }

  @Override
  public String toString() {
    return String.format("%s [%dx%dx%d]", title, getWidth(), getHeight(), getChannelCount());
  }
}
