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
import ij.process.FloatProcessor;

/**
 * A continuous mask of weights in the range [0, 1].
 */
public class SmoothedMask {
  private final int width;
  private final int height;
  private final double[] weights;

  /**
   * Create a new instance.
   *
   * @param width the width
   * @param height the height
   * @param weights the weights (not copied)
   */
  SmoothedMask(int width, int height, double[] weights) {
    this.width = width;
    this.height = height;
    this.weights = weights;
  }

  /**
   * Gets the width.
   *
   * @return the width
   */
  public int getWidth() {
    return width;
  }

  /**
   * Gets the height.
   *
   * @return the height
   */
  public int getHeight() {
    return height;
  }

  /**
   * Gets the weight.
   *
   * @param x the x
   * @param y the y
   * @return the weight
   */
  public double get(int x, int y) {
    return weights[y * width + x];
  }

  /**
   * Gets the weight at the pixel index.
   *
   * @param index the index
   * @return the weight
   */
  public double get(int index) {
    return weights[index];
  }

  /**
   * Convert to a float image.
   *
   * @return the image
   */
  public FloatProcessor toFloatProcessor() {
    final float[] pixels = new float[weights.length];
    for (int i = 0; i < pixels.length; i++) {
      pixels[i] = (float) weights[i];
    }
    return new FloatProcessor(width, height, pixels);
  }

  /**
   * Convert to an 8-bit image. The weights are scaled by 255 and truncated.
   *
   * @return the image
   */
  public ByteProcessor toByteProcessor() {
    final byte[] pixels = new byte[weights.length];
    for (int i = 0; i < pixels.length; i++) {
      pixels[i] = (byte) (int) (weights[i] * 255);
    }
    return new ByteProcessor(width, height, pixels);
  }
}
