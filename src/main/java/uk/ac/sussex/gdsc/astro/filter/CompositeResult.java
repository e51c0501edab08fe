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

import ij.process.ImageProcessor;

/**
 * The composite image and the smoothed mask used to create it.
 */
public class CompositeResult {
  private final ImageProcessor composite;
  private final SmoothedMask smoothedMask;

  /**
   * Create a new instance.
   *
   * @param composite the composite
   * @param smoothedMask the smoothed mask
   */
  CompositeResult(ImageProcessor composite, SmoothedMask smoothedMask) {
    this.composite = composite;
    this.smoothedMask = smoothedMask;
  }

  /**
   * Gets the composite.
   *
   * @return the composite
   */
  public ImageProcessor getComposite() {
    return composite;
  }

  /**
   * Gets the smoothed mask.
   *
   * @return the smoothed mask
   */
  public SmoothedMask getSmoothedMask() {
    return smoothedMask;
  }
}
