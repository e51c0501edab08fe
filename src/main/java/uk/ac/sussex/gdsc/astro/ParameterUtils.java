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

package uk.ac.sussex.gdsc.astro;

/**
 * Checks for processing parameters.
 *
 * <p>All checks throw an {@link InvalidConfigurationException} naming the parameter.
 */
public final class ParameterUtils {

  /** No public construction. */
  private ParameterUtils() {}

  /**
   * Check the value is finite and strictly positive.
   *
   * @param value the value
   * @param name the parameter name
   * @return the value
   * @throws InvalidConfigurationException if {@code value <= 0} or is not finite
   */
  public static double checkStrictlyPositive(double value, String name) {
    if (!(value > 0 && value < Double.POSITIVE_INFINITY)) {
      throw new InvalidConfigurationException(name + " must be strictly positive: " + value);
    }
    return value;
  }

  /**
   * Check the value is finite and positive.
   *
   * @param value the value
   * @param name the parameter name
   * @return the value
   * @throws InvalidConfigurationException if {@code value < 0} or is not finite
   */
  public static double checkPositive(double value, String name) {
    if (!(value >= 0 && value < Double.POSITIVE_INFINITY)) {
      throw new InvalidConfigurationException(name + " must be positive: " + value);
    }
    return value;
  }

  /**
   * Check the value is at least the given minimum.
   *
   * @param value the value
   * @param min the minimum
   * @param name the parameter name
   * @return the value
   * @throws InvalidConfigurationException if {@code value < min}
   */
  public static int checkAtLeast(int value, int min, String name) {
    if (value < min) {
      throw new InvalidConfigurationException(name + " must be at least " + min + ": " + value);
    }
    return value;
  }

  /**
   * Check the value is not null.
   *
   * @param <T> the type
   * @param value the value
   * @param name the parameter name
   * @return the value
   * @throws InvalidConfigurationException if {@code value} is null
   */
  public static <T> T checkNotNull(T value, String name) {
    if (value == null) {
      throw new InvalidConfigurationException(name + " is null");
    }
    return value;
  }
}
