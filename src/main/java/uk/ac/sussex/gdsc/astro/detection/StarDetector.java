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
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.astro.ParameterUtils;
import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.core.utils.TextUtils;

/**
 * Detect stars in a single channel image and build the binary star mask.
 */
public class StarDetector {
  private static final Logger logger = Logger.getLogger(StarDetector.class.getName());

  private final StarFinder finder;
  private final int radius;

  /**
   * Create a new instance.
   *
   * @param fwhm the expected full width at half maximum of a star (in pixels)
   * @param threshold the detection threshold (in units of the background standard deviation)
   * @param radiusFactor the mask radius as a multiple of the fwhm
   * @throws uk.ac.sussex.gdsc.astro.InvalidConfigurationException if any parameter is not
   *         strictly positive
   */
  public StarDetector(double fwhm, double threshold, double radiusFactor) {
    finder = new StarFinder(fwhm, threshold);
    ParameterUtils.checkStrictlyPositive(radiusFactor, "radius factor");
    radius = StarMaskRenderer.getRadius(fwhm, radiusFactor);
  }

  /**
   * Gets the mask radius.
   *
   * @return the radius
   */
  public int getRadius() {
    return radius;
  }

  /**
   * Detect the stars.
   *
   * @param ip the image (single channel)
   * @return the detection
   * @throws IllegalArgumentException if the image is an RGB image
   */
  public StarDetection detect(ImageProcessor ip) {
    final StarFinder.Result result = finder.find(ip);
    final StarDetection detection = new StarDetection(result.getCentroids(),
        StarMaskRenderer.render(ip.getWidth(), ip.getHeight(), result.getCentroids(), radius),
        result.getBackground(), radius);
    if (logger.isLoggable(Level.INFO)) {
      logger.info(String.format("Detected %s above %s (radius %d)",
          TextUtils.pleural(detection.getCount(), "star"), MathUtils.rounded(result.getLevel()),
          radius));
    }
    return detection;
  }
}
