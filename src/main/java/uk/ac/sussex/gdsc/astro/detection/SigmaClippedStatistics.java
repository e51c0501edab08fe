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
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Compute sigma-clipped statistics of a set of samples.
 *
 * <p>The mean, median and standard deviation are computed iteratively. At each iteration samples
 * outside {@code median +/- clip * std} are excluded. Iteration stops when no samples are
 * excluded or the iteration limit is reached. The statistics are then computed on the remaining
 * samples.
 *
 * <p>Non-finite samples are ignored. The standard deviation is the population value (no bias
 * correction). A flat set of samples has a standard deviation of zero; if there are no finite
 * samples all statistics are zero.
 */
public final class SigmaClippedStatistics {
  /** The default clip factor. */
  public static final double DEFAULT_CLIP = 3.0;
  /** The default maximum number of clipping iterations. */
  public static final int DEFAULT_MAX_ITERATIONS = 5;

  private final double mean;
  private final double median;
  private final double standardDeviation;
  private final int size;
  private final int iterations;

  /**
   * Create a new instance.
   *
   * @param mean the mean
   * @param median the median
   * @param standardDeviation the standard deviation
   * @param size the number of samples remaining after clipping
   * @param iterations the number of clipping iterations
   */
  private SigmaClippedStatistics(double mean, double median, double standardDeviation, int size,
      int iterations) {
    this.mean = mean;
    this.median = median;
    this.standardDeviation = standardDeviation;
    this.size = size;
    this.iterations = iterations;
  }

  /**
   * Compute the statistics using the default clip factor and iteration limit.
   *
   * @param data the data
   * @return the statistics
   */
  public static SigmaClippedStatistics compute(float[] data) {
    return compute(data, DEFAULT_CLIP, DEFAULT_MAX_ITERATIONS);
  }

  /**
   * Compute the statistics.
   *
   * @param data the data
   * @param clip the clip factor (in units of the standard deviation)
   * @param maxIterations the maximum number of clipping iterations
   * @return the statistics
   */
  public static SigmaClippedStatistics compute(float[] data, double clip, int maxIterations) {
    final double[] values = new double[data.length];
    int count = 0;
    for (final float value : data) {
      if (Float.isFinite(value)) {
        values[count++] = value;
      }
    }
    if (count == 0) {
      return new SigmaClippedStatistics(0, 0, 0, 0, 0);
    }

    // Clipping on sorted data reduces to moving the bounds of the included range
    Arrays.sort(values, 0, count);
    final StandardDeviation sd = new StandardDeviation(false);
    final Median med = new Median();
    int lower = 0;
    int upper = count;
    int iteration = 0;
    while (iteration < maxIterations) {
      final double centre = med.evaluate(values, lower, upper - lower);
      final double delta = clip * sd.evaluate(values, lower, upper - lower);
      final double min = centre - delta;
      final double max = centre + delta;
      int newLower = lower;
      while (values[newLower] < min) {
        newLower++;
      }
      int newUpper = upper;
      while (values[newUpper - 1] > max) {
        newUpper--;
      }
      iteration++;
      // A small clip factor may exclude everything; keep the last non-empty range
      if ((newLower == lower && newUpper == upper) || newLower >= newUpper) {
        break;
      }
      lower = newLower;
      upper = newUpper;
    }

    final int length = upper - lower;
    return new SigmaClippedStatistics(new Mean().evaluate(values, lower, length),
        med.evaluate(values, lower, length), sd.evaluate(values, lower, length), length, iteration);
  }

  /**
   * Gets the mean.
   *
   * @return the mean
   */
  public double getMean() {
    return mean;
  }

  /**
   * Gets the median.
   *
   * @return the median
   */
  public double getMedian() {
    return median;
  }

  /**
   * Gets the standard deviation.
   *
   * @return the standard deviation
   */
  public double getStandardDeviation() {
    return standardDeviation;
  }

  /**
   * Gets the number of samples remaining after clipping.
   *
   * @return the size
   */
  public int getSize() {
    return size;
  }

  /**
   * Gets the number of clipping iterations performed.
   *
   * @return the iterations
   */
  public int getIterations() {
    return iterations;
  }

  @Override
  public String toString() {
    return "mean=" + mean + ", median=" + median + ", std=" + standardDeviation + ", n=" + size;
  }
}
