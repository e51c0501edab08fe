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
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.astro.ShapeMismatchException;

@SuppressWarnings({"javadoc"})
class ImageDifferenceTest {
  @Test
  void checkSameImageIsZero() {
    final UniformRandomProvider rng = RandomSource.SPLIT_MIX_64.create(31L);
    final byte[] pixels = new byte[64];
    rng.nextBytes(pixels);
    final ByteProcessor bp = new ByteProcessor(8, 8, pixels);
    Assertions.assertArrayEquals(new byte[64],
        (byte[]) ImageDifference.difference(bp, bp.duplicate()).getPixels());

    final ColorProcessor cp = new ColorProcessor(8, 8);
    final int[] rgb = (int[]) cp.getPixels();
    for (int i = 0; i < rgb.length; i++) {
      rgb[i] = rng.nextInt() & 0xffffff;
    }
    final ImageProcessor diff = ImageDifference.difference(cp, cp.duplicate());
    Assertions.assertTrue(diff instanceof ColorProcessor);
    for (final int value : (int[]) diff.getPixels()) {
      Assertions.assertEquals(0, value & 0xffffff);
    }
  }

  @Test
  void checkNormalisation() {
    final ByteProcessor a = new ByteProcessor(4, 1, new byte[] {0, 10, 20, 30});
    final ByteProcessor b = new ByteProcessor(4, 1, new byte[] {0, 5, 30, 20});
    final ImageProcessor diff = ImageDifference.difference(a, b);
    // |a-b| = 0, 5, 10, 10 ; max = 10
    Assertions.assertArrayEquals(new byte[] {0, (byte) 128, (byte) 255, (byte) 255},
        (byte[]) diff.getPixels());
  }

  @Test
  void checkColourUsesGlobalMaximum() {
    final ColorProcessor a = new ColorProcessor(1, 1);
    a.putPixel(0, 0, new int[] {100, 50, 0});
    final ColorProcessor b = new ColorProcessor(1, 1);
    b.putPixel(0, 0, new int[] {0, 100, 0});
    final ColorProcessor diff = (ColorProcessor) ImageDifference.difference(a, b);
    Assertions.assertArrayEquals(new int[] {255, 128, 0}, diff.getPixel(0, 0, null));
  }

  @Test
  void checkShapeMismatch() {
    Assertions.assertThrows(ShapeMismatchException.class,
        () -> ImageDifference.difference(new ByteProcessor(3, 3), new ByteProcessor(3, 4)));
    Assertions.assertThrows(ShapeMismatchException.class,
        () -> ImageDifference.difference(new ByteProcessor(3, 3), new ColorProcessor(3, 3)));
  }
}
