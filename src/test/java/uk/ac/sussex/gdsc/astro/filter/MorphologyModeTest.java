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
class MorphologyModeTest {
  @Test
  void checkResultNames() {
    Assertions.assertEquals("eroded", MorphologyMode.ERODE.getResultName());
    Assertions.assertEquals("dilated", MorphologyMode.DILATE.getResultName());
    Assertions.assertEquals("opened", MorphologyMode.OPEN.getResultName());
    Assertions.assertEquals("closed", MorphologyMode.CLOSE.getResultName());
  }

  @Test
  void checkDescriptions() {
    final String[] descriptions = MorphologyMode.getDescriptions();
    Assertions.assertEquals(MorphologyMode.values().length, descriptions.length);
    for (final MorphologyMode mode : MorphologyMode.values()) {
      Assertions.assertSame(mode, MorphologyMode.fromDescription(mode.getDescription()));
      Assertions.assertSame(mode, MorphologyMode.fromOrdinal(mode.ordinal()));
    }
    Assertions.assertNull(MorphologyMode.fromDescription(null));
    Assertions.assertThrows(IndexOutOfBoundsException.class,
        () -> MorphologyMode.fromOrdinal(MorphologyMode.values().length));
  }
}
