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
 * The law used to blend the original and transformed images using the smoothed star mask.
 *
 * <p>The blended value is {@code original + strength * m * (transformed - original)} where
 * {@code m} is the mask weight in [0, 1].
 */
public enum BlendLaw {
  /**
   * Full replacement: {@code m * transformed + (1 - m) * original}. Where the mask is 1 the output
   * is the transformed value.
   */
  FULL("Full replacement", 1.0),
  /**
   * Half strength: {@code original + 0.5 * m * (transformed - original)}. The output is never
   * pulled more than half way towards the transformed value.
   */
  HALF("Half strength", 0.5);

  private static final BlendLaw[] values;
  private static final String[] descriptions;

  static {
    values = values();
    descriptions = new String[values.length];
    for (int i = 0; i < values.length; i++) {
      descriptions[i] = values[i].getDescription();
    }
  }

  private final String description;
  private final double strength;

  BlendLaw(String description, double strength) {
    this.description = description;
    this.strength = strength;
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
   * Gets the strength applied to the mask weight.
   *
   * @return the strength
   */
  public double getStrength() {
    return strength;
  }

  /**
   * Blend the values.
   *
   * @param original the original value
   * @param transformed the transformed value
   * @param weight the mask weight in [0, 1]
   * @return the blended value (unrounded)
   */
  public double blend(double original, double transformed, double weight) {
    return original + strength * weight * (transformed - original);
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
   * @return the law (or null)
   */
  public static BlendLaw fromDescription(String description) {
    for (final BlendLaw value : values) {
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
   * @return the law
   * @throws IndexOutOfBoundsException if the index is invalid
   */
  public static BlendLaw fromOrdinal(int ordinal) {
    return values[ValidationUtils.checkIndex(ordinal, values)];
  }
}
