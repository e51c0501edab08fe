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

package uk.ac.sussex.gdsc.astro.image;

import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.astro.ShapeMismatchException;

@SuppressWarnings({"javadoc"})
class ImageChannelsTest {
  @Test
  void checkChannelCount() {
    Assertions.assertEquals(1, ImageChannels.getChannelCount(new ByteProcessor(2, 2)));
    Assertions.assertEquals(3, ImageChannels.getChannelCount(new ColorProcessor(2, 2)));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> ImageChannels.getChannelCount(new FloatProcessor(2, 2)));
  }

  @Test
  void checkSplitGrayReturnsSameInstance() {
    final ByteProcessor bp = new ByteProcessor(3, 2);
    final ByteProcessor[] channels = ImageChannels.split(bp);
    Assertions.assertEquals(1, channels.length);
    Assertions.assertSame(bp, channels[0]);
    Assertions.assertSame(bp, ImageChannels.merge(channels));
  }

  @Test
  void checkSplitAndMergeColour() {
    final ColorProcessor cp = new ColorProcessor(2, 1);
    cp.putPixel(0, 0, new int[] {1, 2, 3});
    cp.putPixel(1, 0, new int[] {250, 128, 0});
    final ByteProcessor[] channels = ImageChannels.split(cp);
    Assertions.assertEquals(3, channels.length);
    Assertions.assertEquals(1, channels[0].get(0));
    Assertions.assertEquals(2, channels[1].get(0));
    Assertions.assertEquals(3, channels[2].get(0));
    Assertions.assertEquals(250, channels[0].get(1));
    Assertions.assertEquals(128, channels[1].get(1));
    Assertions.assertEquals(0, channels[2].get(1));

    final ImageProcessor merged = ImageChannels.merge(channels);
    Assertions.assertTrue(merged instanceof ColorProcessor);
    final int[] expected = new int[3];
    final int[] actual = new int[3];
    for (int x = 0; x < 2; x++) {
      Assertions.assertArrayEquals(cp.getPixel(x, 0, expected), merged.getPixel(x, 0, actual));
    }
  }

  @Test
  void checkMergeThrowsWithTwoChannels() {
    final ByteProcessor[] channels = {new ByteProcessor(2, 2), new ByteProcessor(2, 2)};
    Assertions.assertThrows(IllegalArgumentException.class, () -> ImageChannels.merge(channels));
  }

  @Test
  void checkMergeThrowsWithDifferentSizes() {
    final ByteProcessor[] channels =
        {new ByteProcessor(2, 2), new ByteProcessor(2, 2), new ByteProcessor(3, 2)};
    Assertions.assertThrows(ShapeMismatchException.class, () -> ImageChannels.merge(channels));
  }

  @Test
  void checkLuminance() {
    final ColorProcessor cp = new ColorProcessor(3, 1);
    cp.putPixel(0, 0, new int[] {255, 0, 0});
    cp.putPixel(1, 0, new int[] {10, 20, 30});
    cp.putPixel(2, 0, new int[] {255, 255, 255});
    final ByteProcessor y = ImageChannels.luminance(cp);
    Assertions.assertEquals(76, y.get(0));
    Assertions.assertEquals(18, y.get(1));
    Assertions.assertEquals(255, y.get(2));

    final ByteProcessor bp = new ByteProcessor(3, 1);
    Assertions.assertSame(bp, ImageChannels.luminance(bp));
  }

  @Test
  void checkShape() {
    final ByteProcessor bp = new ByteProcessor(4, 3);
    ImageChannels.checkSameShape(bp, new ByteProcessor(4, 3), "a", "b");
    ImageChannels.checkSameSize(bp, new ColorProcessor(4, 3), "a", "b");
    Assertions.assertThrows(ShapeMismatchException.class,
        () -> ImageChannels.checkSameShape(bp, new ColorProcessor(4, 3), "a", "b"));
    Assertions.assertThrows(ShapeMismatchException.class,
        () -> ImageChannels.checkSameShape(bp, new ByteProcessor(3, 4), "a", "b"));
    Assertions.assertThrows(ShapeMismatchException.class,
        () -> ImageChannels.checkSameSize(bp, new ByteProcessor(4, 4), "a", "b"));
  }
}
