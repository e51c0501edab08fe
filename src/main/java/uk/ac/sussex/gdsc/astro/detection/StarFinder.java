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

import ij.process.ImageProcessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.astro.ParameterUtils;
import uk.ac.sussex.gdsc.astro.image.ImageNormaliser;
import uk.ac.sussex.gdsc.core.data.VisibleForTesting;

/**
 * Find point sources using a Gaussian matched filter.
 *
 * <p>The image background is estimated using sigma-clipped statistics and the median is
 * subtracted. The residual is correlated with a Gaussian of the expected full width at half
 * maximum (FWHM) truncated to a circular footprint. The filter is scaled so the response to a
 * centred Gaussian source of the same width is the source amplitude. Sources are local maxima of
 * the response within the footprint that exceed {@code threshold * std} of the background.
 *
 * <p>The centroid of each source is the intensity-weighted centre of the positive residual within
 * the footprint around the maximum.
 */
public class StarFinder {
  /** The conversion from the full width at half maximum to the Gaussian standard deviation. */
  public static final double FWHM_TO_SD = 1.0 / (2 * Math.sqrt(2 * Math.log(2)));

  private static final Logger logger = Logger.getLogger(StarFinder.class.getName());

  /** The footprint radius in units of the Gaussian standard deviation. */
  private static final double SIGMA_RADIUS = 1.5;
  /** The minimum footprint radius in pixels. */
  private static final double MIN_RADIUS = 2;

  private final double fwhm;
  private final double threshold;
  /** The x offsets of the footprint. */
  private final int[] offsetX;
  /** The y offsets of the footprint. */
  private final int[] offsetY;
  /** The filter weights for the footprint. */
  private final double[] weights;

  /**
   * The result of a search.
   */
  public static class Result {
    private final List<Centroid> centroids;
    private final SigmaClippedStatistics background;
    private final double level;

    /**
     * Create a new instance.
     *
     * @param centroids the centroids
     * @param background the background
     * @param level the detection level
     */
    Result(List<Centroid> centroids, SigmaClippedStatistics background, double level) {
      this.centroids = Collections.unmodifiableList(centroids);
      this.background = background;
      this.level = level;
    }

    /**
     * Gets the centroids, ordered by ascending y then x.
     *
     * @return the centroids
     */
    public List<Centroid> getCentroids() {
      return centroids;
    }

    /**
     * Gets the background statistics.
     *
     * @return the background
     */
    public SigmaClippedStatistics getBackground() {
      return background;
    }

    /**
     * Gets the detection level. The filter response at a source must exceed this value.
     *
     * @return the level
     */
    public double getLevel() {
      return level;
    }
  }

  /**
   * Create a new instance.
   *
   * @param fwhm the expected full width at half maximum of a source (in pixels)
   * @param threshold the detection threshold (in units of the background standard deviation)
   * @throws uk.ac.sussex.gdsc.astro.InvalidConfigurationException if the parameters are not
   *         strictly positive
   */
  public StarFinder(double fwhm, double threshold) {
    this.fwhm = ParameterUtils.checkStrictlyPositive(fwhm, "fwhm");
    this.threshold = ParameterUtils.checkStrictlyPositive(threshold, "threshold");

    final double sd = fwhm * FWHM_TO_SD;
    final double radius = getFootprintRadius(fwhm);
    final int halfWidth = (int) radius;
    final double limit = radius * radius;
    final List<int[]> offsets = new ArrayList<>();
    for (int dy = -halfWidth; dy <= halfWidth; dy++) {
      for (int dx = -halfWidth; dx <= halfWidth; dx++) {
        if (dx * dx + dy * dy <= limit) {
          offsets.add(new int[] {dx, dy});
        }
      }
    }
    final int size = offsets.size();
    offsetX = new int[size];
    offsetY = new int[size];
    weights = new double[size];
    final double scale = -0.5 / (sd * sd);
    double sum2 = 0;
    for (int i = 0; i < size; i++) {
      final int[] offset = offsets.get(i);
      offsetX[i] = offset[0];
      offsetY[i] = offset[1];
      weights[i] = Math.exp(scale * (offset[0] * offset[0] + offset[1] * offset[1]));
      sum2 += weights[i] * weights[i];
    }
    // Least-squares amplitude of a unit peak Gaussian: sum(g * d) / sum(g * g)
    for (int i = 0; i < size; i++) {
      weights[i] /= sum2;
    }
  }

  /**
   * Gets the radius of the circular footprint used for filtering, the local maxima search and
   * centroiding.
   *
   * @param fwhm the full width at half maximum
   * @return the footprint radius
   */
  public static double getFootprintRadius(double fwhm) {
    return Math.max(MIN_RADIUS, SIGMA_RADIUS * fwhm * FWHM_TO_SD);
  }

  /**
   * Gets the expected full width at half maximum of a source.
   *
   * @return the fwhm
   */
  public double getFwhm() {
    return fwhm;
  }

  /**
   * Gets the detection threshold.
   *
   * @return the threshold
   */
  public double getThreshold() {
    return threshold;
  }

  /**
   * Find the sources in the image.
   *
   * @param ip the image (single channel of any bit depth)
   * @return the result
   * @throws IllegalArgumentException if the image is an RGB image
   */
  public Result find(ImageProcessor ip) {
    final int width = ip.getWidth();
    final int height = ip.getHeight();
    final float[] data = ImageNormaliser.toFloat(ip);

    final SigmaClippedStatistics background = SigmaClippedStatistics.compute(data);
    logger.log(Level.FINE, () -> "Background: " + background);
    if (background.getStandardDeviation() == 0) {
      logger.warning("Background has zero deviation");
    }

    final double median = background.getMedian();
    final double[] residual = new double[data.length];
    for (int i = 0; i < data.length; i++) {
      if (Float.isFinite(data[i])) {
        residual[i] = data[i] - median;
      }
    }

    final double[] response = correlate(residual, width, height);
    final double level = threshold * background.getStandardDeviation();

    final List<Centroid> centroids = new ArrayList<>();
    for (int y = 0, index = 0; y < height; y++) {
      for (int x = 0; x < width; x++, index++) {
        if (response[index] > level && isMaximum(response, width, height, x, y)) {
          centroids.add(centroid(residual, width, height, x, y));
        }
      }
    }
    Collections.sort(centroids);
    return new Result(centroids, background, level);
  }

  /**
   * Correlate the data with the filter. Pixels outside the image are zero.
   *
   * @param data the data
   * @param width the width
   * @param height the height
   * @return the response
   */
  @VisibleForTesting
  double[] correlate(double[] data, int width, int height) {
    final double[] response = new double[data.length];
    for (int y = 0, index = 0; y < height; y++) {
      for (int x = 0; x < width; x++, index++) {
        double sum = 0;
        for (int k = 0; k < weights.length; k++) {
          final int xx = x + offsetX[k];
          final int yy = y + offsetY[k];
          if (xx >= 0 && xx < width && yy >= 0 && yy < height) {
            sum += weights[k] * data[yy * width + xx];
          }
        }
        response[index] = sum;
      }
    }
    return response;
  }

  /**
   * Check if the response is a maximum within the footprint. Equal values are resolved in favour
   * of the lowest index so a plateau yields a single maximum.
   *
   * @param response the response
   * @param width the width
   * @param height the height
   * @param x the x
   * @param y the y
   * @return true if a maximum
   */
  private boolean isMaximum(double[] response, int width, int height, int x, int y) {
    final int index = y * width + x;
    final double value = response[index];
    for (int k = 0; k < weights.length; k++) {
      final int xx = x + offsetX[k];
      final int yy = y + offsetY[k];
      if (xx >= 0 && xx < width && yy >= 0 && yy < height) {
        final int j = yy * width + xx;
        final double other = response[j];
        if (other > value || (other == value && j < index)) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Compute the intensity-weighted centre of the positive residual within the footprint.
   *
   * @param residual the residual
   * @param width the width
   * @param height the height
   * @param x the x of the maximum
   * @param y the y of the maximum
   * @return the centroid
   */
  private Centroid centroid(double[] residual, int width, int height, int x, int y) {
    double sum = 0;
    double sumX = 0;
    double sumY = 0;
    for (int k = 0; k < weights.length; k++) {
      final int xx = x + offsetX[k];
      final int yy = y + offsetY[k];
      if (xx >= 0 && xx < width && yy >= 0 && yy < height) {
        final double value = residual[yy * width + xx];
        if (value > 0) {
          sum += value;
          sumX += value * xx;
          sumY += value * yy;
        }
      }
    }
    if (sum == 0) {
      return new Centroid(x, y);
    }
    return new Centroid(sumX / sum, sumY / sum);
  }
}
