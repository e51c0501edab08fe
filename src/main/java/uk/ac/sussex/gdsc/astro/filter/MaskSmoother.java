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

import ij.plugin.filter.GaussianBlur;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import uk.ac.sussex.gdsc.astro.ParameterUtils;

/**
 * Smooth a binary mask into a continuous weight map.
 *
 * <p>The mask is scaled to [0, 1], blurred with the ImageJ {@link GaussianBlur} and clamped to
 * [0, 1]. Pixels outside the image take the value of the nearest edge pixel. A sigma below
 * {@link #MIN_SIGMA} uses the 3x3 binomial kernel [1, 2, 1] / 4 so that any hard edge is softened.
 * The Gaussian is truncated where it falls below {@value #ACCURACY} of the peak.
 */
public class MaskSmoother {
  /** The smallest sigma that uses a Gaussian kernel. */
  public static final double MIN_SIGMA = 0.8;

  /** The relative kernel value at the truncation point. */
  public static final double ACCURACY = 1e-3;

  /** The 3x3 binomial kernel. */
  private static final int[] BINOMIAL_KERNEL = {1, 2, 1, 2, 4, 2, 1, 2, 1};

  /** Weights this close to 0 or 1 are set to 0 or 1. */
  private static final double SNAP = 1e-5;

  private final double sigma;

  /**
   * Create a new instance.
   *
   * @param sigma the Gaussian standard deviation
   * @throws uk.ac.sussex.gdsc.astro.InvalidConfigurationException if the sigma is negative
   */
  public MaskSmoother(double sigma) {
    this.sigma = ParameterUtils.checkPositive(sigma, "blur sigma");
  }

  /**
   * Gets the sigma.
   *
   * @return the sigma
   */
  public double getSigma() {
    return sigma;
  }

  /**
   * Checks if the fixed 3x3 binomial kernel is used in place of a Gaussian.
   *
   * @return true if using the binomial kernel
   */
  public boolean isMinimumSmoothing() {
    return sigma < MIN_SIGMA;
  }

  /**
   * Smooth the binary mask.
   *
   * @param mask the mask (8-bit)
   * @return the smoothed mask
   * @throws IllegalArgumentException if the mask is not 8-bit
   */
  public SmoothedMask smooth(ImageProcessor mask) {
    if (!(mask instanceof ByteProcessor)) {
      throw new IllegalArgumentException(
          "An 8-bit mask is required: " + mask.getBitDepth() + "-bit");
    }
    final int width = mask.getWidth();
    final int height = mask.getHeight();
    final byte[] pixels = (byte[]) mask.getPixels();
    final float[] data = new float[pixels.length];
    for (int i = 0; i < data.length; i++) {
      data[i] = (pixels[i] & 0xff) / 255f;
    }
    final FloatProcessor fp = new FloatProcessor(width, height, data);

    if (isMinimumSmoothing()) {
      fp.convolve3x3(BINOMIAL_KERNEL);
    } else {
      final GaussianBlur gb = new GaussianBlur();
      gb.showProgress(false);
      gb.blurGaussian(fp, sigma, sigma, ACCURACY);
    }

    // The blur works in single precision. Flat regions are restored to exact weights.
    final float[] blurred = (float[]) fp.getPixels();
    final double[] result = new double[blurred.length];
    for (int i = 0; i < result.length; i++) {
      final double value = blurred[i];
      if (value < SNAP) {
        result[i] = 0;
      } else if (value > 1 - SNAP) {
        result[i] = 1;
      } else {
        result[i] = value;
      }
    }
    return new SmoothedMask(width, height, result);
  }
}
