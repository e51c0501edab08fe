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

import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * The morphological operation applied to the whole image.
 */
public enum MorphologyMode {
  /** Replace each pixel with the minimum of the neighbourhood. */
  ERODE("Erode", "eroded"),
  /** Replace each pixel with the maximum of the neighbourhood. */
  DILATE("Dilate", "dilated"),
  /** Erode then dilate using the same number of iterations. */
  OPEN("Open", "opened"),
  /** Dilate then erode using the same number of iterations. */
  CLOSE("Close", "closed");

  private static final MorphologyMode[] values;
  private static final String[] descriptions;

  static {
    values = values();
    descriptions = new String[values.length];
    for (int i = 0; i < values.length; i++) {
      descriptions[i] = values[i].getDescription();
    }
  }

  private final String description;
  private final String resultName;

  MorphologyMode(String description, String resultName) {
    this.description = description;
    this.resultName = resultName;
  }

  /**
   * Gets the description.
   *
   * @return the description
   */
  public String getDescription() {
    return description;
  }

  /**
   * Gets the name used for the transformed image, e.g. {@code eroded}.
   *
   * @return the result name
   */
  public String getResultName() {
    return resultName;
  }

  @Override
  public String toString() {
    return getDescription();
  }

  /**
   * Gets the descriptions for all of the values.
   *
   * @return the descriptions
   */
  public static String[] getDescriptions() {
    return descriptions.clone();
  }

  /**
   * Create from the description.
   *
   * @param description the description
   * @return the mode (or null)
   */
  public static MorphologyMode fromDescription(String description) {
    for (final MorphologyMode value : values) {
      if (value.getDescription().equals(description)) {
        return value;
      }
    }
    return null;
  }

  /**
   * Create from the enum {@link #ordinal()}.
   *
   * @param ordinal the ordinal
   * @return the mode
   * @throws IndexOutOfBoundsException if the index is invalid
   */
  public static MorphologyMode fromOrdinal(int ordinal) {
    return values[ValidationUtils.checkIndex(ordinal, values)];
  }
}
