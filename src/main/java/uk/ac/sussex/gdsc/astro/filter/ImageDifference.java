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
import uk.ac.sussex.gdsc.astro.image.ImageChannels;

/**
 * Compute the normalised absolute difference between two images for inspection.
 *
 * <p>The absolute difference is scaled so the largest difference over all channels is 255. If the
 * images are identical the result is zero.
 */
public final class ImageDifference {
  /** No public construction. */
  private ImageDifference() {}

  /**
   * Compute the difference.
   *
   * @param ip1 the first image (8-bit grayscale or RGB)
   * @param ip2 the second image (same shape as the first)
   * @return the normalised difference (same type as the input)
   * @throws uk.ac.sussex.gdsc.astro.ShapeMismatchException if the shapes differ
   */
  public static ImageProcessor difference(ImageProcessor ip1, ImageProcessor ip2) {
    ImageChannels.checkSameShape(ip1, ip2, "first", "second");
    final ByteProcessor[] c1 = ImageChannels.split(ip1);
    final ByteProcessor[] c2 = ImageChannels.split(ip2);
    final int[][] diff = new int[c1.length][];
    int max = 0;
    for (int c = 0; c < c1.length; c++) {
      final byte[] p1 = (byte[]) c1[c].getPixels();
      final byte[] p2 = (byte[]) c2[c].getPixels();
      final int[] d = new int[p1.length];
      for (int i = 0; i < d.length; i++) {
        d[i] = Math.abs((p1[i] & 0xff) - (p2[i] & 0xff));
        max = Math.max(max, d[i]);
      }
      diff[c] = d;
    }
    final ByteProcessor[] out = new ByteProcessor[c1.length];
    final double scale = max == 0 ? 0 : 255.0 / max;
    for (int c = 0; c < out.length; c++) {
      final int[] d = diff[c];
      final byte[] pixels = new byte[d.length];
      for (int i = 0; i < d.length; i++) {
        pixels[i] = (byte) Math.round(d[i] * scale);
      }
      out[c] = new ByteProcessor(ip1.getWidth(), ip1.getHeight(), pixels);
    }
    return ImageChannels.merge(out);
  }
}
