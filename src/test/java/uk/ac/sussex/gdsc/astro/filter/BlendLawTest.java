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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class BlendLawTest {
  @Test
  void checkBlend() {
    Assertions.assertEquals(10, BlendLaw.FULL.blend(10, 200, 0));
    Assertions.assertEquals(200, BlendLaw.FULL.blend(10, 200, 1));
    Assertions.assertEquals(105, BlendLaw.FULL.blend(10, 200, 0.5));
    Assertions.assertEquals(10, BlendLaw.HALF.blend(10, 200, 0));
    Assertions.assertEquals(105, BlendLaw.HALF.blend(10, 200, 1));
    Assertions.assertEquals(57.5, BlendLaw.HALF.blend(10, 200, 0.5));
  }

  @Test
  void checkStrengthScalesWeight() {
    Assertions.assertEquals(1.0, BlendLaw.FULL.getStrength());
    Assertions.assertEquals(0.5, BlendLaw.HALF.getStrength());
    for (final BlendLaw law : BlendLaw.values()) {
      for (final double w : new double[] {0, 0.25, 0.8, 1}) {
        Assertions.assertEquals(BlendLaw.FULL.blend(30, 90, w * law.getStrength()),
            law.blend(30, 90, w), 1e-12);
      }
    }
  }

  @Test
  void checkDescriptions() {
    final String[] descriptions = BlendLaw.getDescriptions();
    Assertions.assertEquals(BlendLaw.values().length, descriptions.length);
    for (final BlendLaw law : BlendLaw.values()) {
      Assertions.assertSame(law, BlendLaw.fromDescription(law.getDescription()));
      Assertions.assertSame(law, BlendLaw.fromOrdinal(law.ordinal()));
    }
    Assertions.assertNull(BlendLaw.fromDescription("unknown"));
    Assertions.assertThrows(IndexOutOfBoundsException.class, () -> BlendLaw.fromOrdinal(-1));
  }
}
