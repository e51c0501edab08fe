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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class CentroidTest {
  @Test
  void checkPixel() {
    final Centroid c = new Centroid(3.9, -0.2);
    Assertions.assertEquals(3, c.getXpixel());
    Assertions.assertEquals(-1, c.getYpixel());
    Assertions.assertEquals(5, new Centroid(3, 4).distance(0, 0), 1e-12);
  }

  @Test
  void checkOrderIsYThenX() {
    final Centroid c1 = new Centroid(40, 10);
    final Centroid c2 = new Centroid(10, 30);
    final Centroid c3 = new Centroid(50, 30);
    final List<Centroid> list = Arrays.asList(c3, c1, c2);
    Collections.sort(list);
    Assertions.assertEquals(Arrays.asList(c1, c2, c3), list);
  }

  @Test
  void checkEquals() {
    Assertions.assertEquals(new Centroid(1.5, 2), new Centroid(1.5, 2));
    Assertions.assertEquals(new Centroid(1.5, 2).hashCode(), new Centroid(1.5, 2).hashCode());
    Assertions.assertNotEquals(new Centroid(1.5, 2), new Centroid(2, 1.5));
  }
}
