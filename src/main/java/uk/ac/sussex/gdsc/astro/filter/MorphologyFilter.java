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

package uk.ac.sussex.gdsc.astro.filter;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import uk.ac.sussex.gdsc.astro.ParameterUtils;
import uk.ac.sussex.gdsc.astro.image.ImageChannels;
import uk.ac.sussex.gdsc.core.utils.concurrent.ConcurrencyUtils;

/**
 * Apply grey-level morphology with a square structuring element.
 *
 * <p>Erosion replaces each pixel with the minimum of the {@code k x k} neighbourhood and dilation
 * with the maximum. The neighbourhood spans offsets {@code -k/2} to {@code k-1-k/2} so an odd
 * kernel is centred. The square element is separable and is applied as a row pass followed by a
 * column pass. Pixels outside the image take the value of the nearest edge pixel.
 *
 * <p>Colour images are processed per channel. The input image is never modified.
 */
public class MorphologyFilter {
  private final MorphologyMode mode;
  private final int kernelSize;
  private final int iterations;

  /**
   * Create a new instance.
   *
   * @param mode the mode
   * @param kernelSize the kernel size (at least 1)
   * @param iterations the iterations (at least 0)
   * @throws uk.ac.sussex.gdsc.astro.InvalidConfigurationException if the parameters are invalid
   */
  public MorphologyFilter(MorphologyMode mode, int kernelSize, int iterations) {
    this.mode = ParameterUtils.checkNotNull(mode, "mode");
    this.kernelSize = ParameterUtils.checkAtLeast(kernelSize, 1, "kernel size");
    this.iterations = ParameterUtils.checkAtLeast(iterations, 0, "iterations");
  }

  /**
   * Gets the mode.
   *
   * @return the mode
   */
  public MorphologyMode getMode() {
    return mode;
  }

  /**
   * Gets the kernel size.
   *
   * @return the kernel size
   */
  public int getKernelSize() {
    return kernelSize;
  }

  /**
   * Gets the iterations.
   *
   * @return the iterations
   */
  public int getIterations() {
    return iterations;
  }

  /**
   * Apply the filter to an 8-bit grayscale or RGB image.
   *
   * @param ip the image
   * @return the filtered image
   * @throws IllegalArgumentException if the image is not 8-bit grayscale or RGB
   */
  public ImageProcessor apply(ImageProcessor ip) {
    return apply(ip, null);
  }

  /**
   * Apply the filter to an 8-bit grayscale or RGB image. The channels of a colour image are
   * processed using the executor (if not null).
   *
   * <p>This method waits for the channel tasks. It must not be called from a task running on the
   * same executor if the pool may be exhausted.
   *
   * @param ip the image
   * @param executor the executor (can be null)
   * @return the filtered image
   * @throws IllegalArgumentException if the image is not 8-bit grayscale or RGB
   */
  public ImageProcessor apply(ImageProcessor ip, ExecutorService executor) {
    final ByteProcessor[] channels = ImageChannels.split(ip);
    final ByteProcessor[] results = new ByteProcessor[channels.length];
    if (executor == null || channels.length == 1) {
      for (int i = 0; i < channels.length; i++) {
        results[i] = filter(channels[i]);
      }
    } else {
      final List<Future<?>> futures = new ArrayList<>(channels.length);
      for (int i = 0; i < channels.length; i++) {
        final int channel = i;
        futures.add(executor.submit(() -> {
          results[channel] = filter(channels[channel]);
        }));
      }
      ConcurrencyUtils.waitForCompletionUnchecked(futures);
    }
    return ImageChannels.merge(results);
  }

  /**
   * Apply the filter to a single channel.
   *
   * @param bp the channel
   * @return the filtered channel
   */
  public ByteProcessor filter(ByteProcessor bp) {
    final int width = bp.getWidth();
    final int height = bp.getHeight();
    final byte[] pixels = (byte[]) bp.getPixels();
    int[] data = new int[pixels.length];
    for (int i = 0; i < data.length; i++) {
      data[i] = pixels[i] & 0xff;
    }
    switch (mode) {
      case ERODE:
        data = repeat(data, width, height, true);
        break;
      case DILATE:
        data = repeat(data, width, height, false);
        break;
      case OPEN:
        data = repeat(repeat(data, width, height, true), width, height, false);
        break;
      case CLOSE:
        data = repeat(repeat(data, width, height, false), width, height, true);
        break;
      default:
        throw new IllegalStateException("Unknown mode: " + mode);
    }
    final byte[] out = new byte[data.length];
    for (int i = 0; i < out.length; i++) {
      out[i] = (byte) data[i];
    }
    return new ByteProcessor(width, height, out);
  }

  private int[] repeat(int[] data, int width, int height, boolean minimum) {
    int[] result = data;
    for (int i = 0; i < iterations; i++) {
      result = rank(result, width, height, minimum);
    }
    return result;
  }

  /**
   * Compute the minimum or maximum of the square neighbourhood of each pixel.
   *
   * @param data the data
   * @param width the width
   * @param height the height
   * @param minimum set to true for the minimum
   * @return the result
   */
  private int[] rank(int[] data, int width, int height, boolean minimum) {
    if (kernelSize == 1) {
      return data;
    }
    final int lower = -(kernelSize / 2);
    final int upper = lower + kernelSize - 1;

    final int[] rows = new int[data.length];
    for (int y = 0; y < height; y++) {
      final int base = y * width;
      for (int x = 0; x < width; x++) {
        int value = data[base + clamp(x + lower, width)];
        for (int d = lower + 1; d <= upper; d++) {
          value = select(value, data[base + clamp(x + d, width)], minimum);
        }
        rows[base + x] = value;
      }
    }

    final int[] result = new int[data.length];
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        int value = rows[clamp(y + lower, height) * width + x];
        for (int d = lower + 1; d <= upper; d++) {
          value = select(value, rows[clamp(y + d, height) * width + x], minimum);
        }
        result[y * width + x] = value;
      }
    }
    return result;
  }

  private static int select(int v1, int v2, boolean minimum) {
    return minimum ? Math.min(v1, v2) : Math.max(v1, v2);
  }

  private static int clamp(int index, int size) {
    if (index < 0) {
      return 0;
    }
    return index >= size ? size - 1 : index;
  }
}
