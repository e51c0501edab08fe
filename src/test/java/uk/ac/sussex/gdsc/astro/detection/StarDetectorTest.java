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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.astro.InvalidConfigurationException;

@SuppressWarnings({"javadoc"})
class StarDetectorTest {
  /**
   * Create a 100x100 image with background 10 and a disk of radius 3 and value 200 at (50, 50).
   */
  static ByteProcessor createDiskImage() {
    final ByteProcessor bp = new ByteProcessor(100, 100);
    bp.add(10);
    for (int y = 0; y < 100; y++) {
      for (int x = 0; x < 100; x++) {
        if ((x - 50) * (x - 50) + (y - 50) * (y - 50) <= 9) {
          bp.set(x, y, 200);
        }
      }
    }
    return bp;
  }

  @Test
  void checkInvalidParameters() {
    Assertions.assertThrows(InvalidConfigurationException.class,
        () -> new StarDetector(4, 2, 0));
    Assertions.assertThrows(InvalidConfigurationException.class,
        () -> new StarDetector(-4, 2, 1.5));
    Assertions.assertThrows(InvalidConfigurationException.class,
        () -> new StarDetector(4, 0, 1.5));
  }

  @Test
  void checkSingleDisk() {
    final StarDetector detector = new StarDetector(4, 2, 1.5);
    Assertions.assertEquals(6, detector.getRadius());
    final StarDetection detection = detector.detect(createDiskImage());

    Assertions.assertEquals(1, detection.getCount());
    final Centroid centroid = detection.getCentroids().get(0);
    Assertions.assertEquals(50, centroid.getX(), 1);
    Assertions.assertEquals(50, centroid.getY(), 1);
    Assertions.assertEquals(10, detection.getBackground().getMedian());
    Assertions.assertEquals(6, detection.getRadius());

    final ByteProcessor mask = detection.getMask();
    for (int y = 0; y < 100; y++) {
      for (int x = 0; x < 100; x++) {
        final double d = Math.sqrt((x - 50) * (x - 50) + (y - 50) * (y - 50));
        if (d <= 6) {
          Assertions.assertEquals(255, mask.get(x, y), () -> "inside " + d);
        } else if (d > 8) {
          Assertions.assertEquals(0, mask.get(x, y), () -> "outside " + d);
        }
      }
    }
  }

  @Test
  void checkFlatImage() {
    final ByteProcessor bp = new ByteProcessor(100, 100);
    bp.add(10);
    final StarDetection detection = new StarDetector(4, 2, 1.5).detect(bp);
    Assertions.assertEquals(0, detection.getCount());
    Assertions.assertTrue(detection.getCentroids().isEmpty());
    Assertions.assertArrayEquals(new byte[100 * 100], (byte[]) detection.getMask().getPixels());
  }
}
