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
import java.util.Arrays;
import java.util.List;
import uk.ac.sussex.gdsc.astro.ParameterUtils;

/**
 * Render a binary star mask from a set of centroids.
 *
 * <p>Each centroid is drawn as a filled disk centred on the pixel containing the centroid. Pixels
 * inside any disk are set to {@link #ON}; all other pixels are {@link #OFF}. Disks are clipped to
 * the image bounds.
 */
public final class StarMaskRenderer {
  /** The value of a mask pixel inside a star. */
  public static final int ON = 255;
  /** The value of a mask pixel outside all stars. */
  public static final int OFF = 0;

  /** No public constructor. */
  private StarMaskRenderer() {}

  /**
   * Gets the mask radius for the given source width. The radius saturates at
   * {@link Integer#MAX_VALUE}.
   *
   * @param fwhm the full width at half maximum
   * @param radiusFactor the radius factor
   * @return the radius (in pixels)
   */
  public static int getRadius(double fwhm, double radiusFactor) {
    return (int) Math.min(Integer.MAX_VALUE, Math.round(fwhm * radiusFactor));
  }

  /**
   * Render the mask.
   *
   * <p>A disk includes all pixels with {@code dx^2 + dy^2 <= r^2} from the centre pixel. A radius
   * of zero or below marks only the centre pixel.
   *
   * @param width the width
   * @param height the height
   * @param centroids the centroids
   * @param radius the radius
   * @return the mask
   */
  public static ByteProcessor render(int width, int height, List<Centroid> centroids,
      int radius) {
    ParameterUtils.checkAtLeast(width, 1, "width");
    ParameterUtils.checkAtLeast(height, 1, "height");
    final byte[] mask = new byte[width * height];
    final long r = Math.max(0, radius);
    // r^2 and dx^2 + dy^2 fit in a long for any int radius
    final long limit = r * r;
    for (final Centroid centroid : centroids) {
      final long cx = centroid.getXpixel();
      final long cy = centroid.getYpixel();
      // Upper bound on the distance to the furthest image pixel
      final long reach = Math.max(Math.abs(cx), Math.abs(cx - width + 1))
          + Math.max(Math.abs(cy), Math.abs(cy - height + 1));
      if (r >= reach) {
        Arrays.fill(mask, (byte) ON);
        break;
      }
      final int minY = (int) Math.max(0, cy - r);
      final int maxY = (int) Math.min(height - 1, cy + r);
      final int minX = (int) Math.max(0, cx - r);
      final int maxX = (int) Math.min(width - 1, cx + r);
      for (int y = minY; y <= maxY; y++) {
        final long dy2 = (y - cy) * (y - cy);
        for (int x = minX, index = y * width + minX; x <= maxX; x++, index++) {
          if ((x - cx) * (x - cx) + dy2 <= limit) {
            mask[index] = (byte) ON;
          }
        }
      }
    }
    return new ByteProcessor(width, height, mask);
  }
}
