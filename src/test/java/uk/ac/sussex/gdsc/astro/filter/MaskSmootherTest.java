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
import ij.process.ShortProcessor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.astro.InvalidConfigurationException;

@SuppressWarnings({"javadoc"})
class MaskSmootherTest {
  @Test
  void checkInvalidSigma() {
    Assertions.assertThrows(InvalidConfigurationException.class, () -> new MaskSmoother(-1));
    Assertions.assertThrows(InvalidConfigurationException.class,
        () -> new MaskSmoother(Double.POSITIVE_INFINITY));
  }

  @Test
  void checkUnsupportedMask() {
    final MaskSmoother smoother = new MaskSmoother(2);
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> smoother.smooth(new ShortProcessor(3, 3)));
  }

  @Test
  void checkMinimumSmoothingThreshold() {
    Assertions.assertTrue(new MaskSmoother(0).isMinimumSmoothing());
    Assertions.assertTrue(new MaskSmoother(0.79).isMinimumSmoothing());
    Assertions.assertFalse(new MaskSmoother(MaskSmoother.MIN_SIGMA).isMinimumSmoothing());
    Assertions.assertEquals(1.5, new MaskSmoother(1.5).getSigma());
  }

  @Test
  void checkGaussianIsNormalisedAndTruncated() {
    final int size = 61;
    final ByteProcessor bp = new ByteProcessor(size, size);
    bp.set(30, 30, 255);
    final double sigma = 2;
    final SmoothedMask mask = new MaskSmoother(sigma).smooth(bp);
    double sum = 0;
    for (int i = 0; i < size * size; i++) {
      sum += mask.get(i);
    }
    Assertions.assertEquals(1, sum, 1e-3);
    Assertions.assertEquals(1 / (2 * Math.PI * sigma * sigma), mask.get(30, 30), 1e-3);
    // The kernel radius is ceil(sigma * sqrt(-2 ln(accuracy))) + 1 = 9
    Assertions.assertTrue(mask.get(31, 30) > 0);
    Assertions.assertEquals(0.0, mask.get(40, 30));
    Assertions.assertEquals(0.0, mask.get(30, 50));
  }

  @Test
  void checkEmptyMaskIsZero() {
    final SmoothedMask mask = new MaskSmoother(5).smooth(new ByteProcessor(20, 10));
    Assertions.assertEquals(20, mask.getWidth());
    Assertions.assertEquals(10, mask.getHeight());
    for (int i = 0; i < 200; i++) {
      Assertions.assertEquals(0.0, mask.get(i));
    }
  }

  @Test
  void checkFullMaskIsOne() {
    final ByteProcessor bp = new ByteProcessor(20, 10);
    bp.add(255);
    for (final double sigma : new double[] {0, 1, 5, 30}) {
      final SmoothedMask mask = new MaskSmoother(sigma).smooth(bp);
      for (int i = 0; i < 200; i++) {
        Assertions.assertEquals(1.0, mask.get(i));
      }
    }
  }

  //@formatter:off

  @Test
  void checkMinimumSmoothing() {
    final ByteProcessor bp = new ByteProcessor(5, 5);
    bp.set(2, 2, 255);
    final FloatProcessor fp = new MaskSmoother(0).smooth(bp).toFloatProcessor();
    Assertions.assertArrayEquals(new float[] {
        0, 0,      0,     0,      0,
        0, 0.0625f, 0.125f, 0.0625f, 0,
        0, 0.125f,  0.25f,  0.125f,  0,
        0, 0.0625f, 0.125f, 0.0625f, 0,
        0, 0,      0,     0,      0,
    }, (float[]) fp.getPixels());
  }

  //@formatter:on

  @Test
  void checkSmoothedDiskIsBoundedAndSymmetric() {
    final int size = 41;
    final ByteProcessor bp = new ByteProcessor(size, size);
    for (int y = 0; y < size; y++) {
      for (int x = 0; x < size; x++) {
        if ((x - 20) * (x - 20) + (y - 20) * (y - 20) <= 36) {
          bp.set(x, y, 255);
        }
      }
    }
    final SmoothedMask mask = new MaskSmoother(3).smooth(bp);
    for (int y = 0; y < size; y++) {
      for (int x = 0; x < size; x++) {
        final double value = mask.get(x, y);
        Assertions.assertTrue(value >= 0 && value <= 1);
        Assertions.assertEquals(value, mask.get(size - 1 - x, y), 1e-6);
        Assertions.assertEquals(value, mask.get(y, x), 1e-6);
      }
    }
    // Decreases away from the centre
    for (int x = 20; x < size - 1; x++) {
      Assertions.assertTrue(mask.get(x, 20) >= mask.get(x + 1, 20));
    }
    Assertions.assertTrue(mask.get(20, 20) > 0.8);
    Assertions.assertTrue(mask.get(26, 20) > 0.3 && mask.get(26, 20) < 0.7);
    Assertions.assertTrue(mask.get(40, 20) < 1e-3);
  }

  @Test
  void checkByteConversionTruncates() {
    final ByteProcessor bp = new ByteProcessor(5, 5);
    bp.set(2, 2, 255);
    final ByteProcessor out = new MaskSmoother(0).smooth(bp).toByteProcessor();
    // 0.25 * 255 = 63.75
    Assertions.assertEquals(63, out.get(2, 2));
    // 0.125 * 255 = 31.875
    Assertions.assertEquals(31, out.get(1, 2));
  }
}
