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

package uk.ac.sussex.gdsc.astro.detection;

import ij.process.ByteProcessor;
import java.util.List;

/**
 * The result of star detection: the source centroids and the binary star mask.
 */
public class StarDetection {
  private final List<Centroid> centroids;
  private final ByteProcessor mask;
  private final SigmaClippedStatistics background;
  private final int radius;

  /**
   * Create a new instance.
   *
   * @param centroids the centroids
   * @param mask the mask
   * @param background the background statistics
   * @param radius the mask radius
   */
  StarDetection(List<Centroid> centroids, ByteProcessor mask, SigmaClippedStatistics background,
      int radius) {
    this.centroids = centroids;
    this.mask = mask;
    this.background = background;
    this.radius = radius;
  }

  /**
   * Gets the centroids, ordered by ascending y then x.
   *
   * @return the centroids
   */
  public List<Centroid> getCentroids() {
    return centroids;
  }

  /**
   * Gets the number of detected stars.
   *
   * @return the count
   */
  public int getCount() {
    return centroids.size();
  }

  /**
   * Gets the star mask. Pixels are {@link StarMaskRenderer#ON} inside a star and
   * {@link StarMaskRenderer#OFF} outside.
   *
   * @return the mask
   */
  public ByteProcessor getMask() {
    return mask;
  }

  /**
   * Gets the background statistics of the detection image.
   *
   * @return the background
   */
  public SigmaClippedStatistics getBackground() {
    return background;
  }

  /**
   * Gets the radius used to draw the mask.
   *
   * @return the radius
   */
  public int getRadius() {
    return radius;
  }
}
