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

import ij.process.ImageProcessor;
import java.util.LinkedHashMap;
import java.util.Map;
import uk.ac.sussex.gdsc.astro.detection.StarDetection;
import uk.ac.sussex.gdsc.astro.filter.CompositeResult;
import uk.ac.sussex.gdsc.astro.filter.MorphologyMode;

/**
 * Contains the images produced by selective morphology.
 */
public class SelectiveMorphologyResult {
  /** The name of the original image. */
  public static final String ORIGINAL = "original";
  /** The name of the star mask. */
  public static final String STAR_MASK = "starmask";
  /** The name of the smoothed mask. */
  public static final String SMOOTH_MASK = "smooth_mask";
  /** The name of the difference image. */
  public static final String DIFFERENCE = "difference";
  /** The prefix for the name of the selective composite. */
  public static final String SELECTIVE_PREFIX = "selective_";

  private final ImageProcessor original;
  private final ImageProcessor transformed;
  private final StarDetection detection;
  private final CompositeResult composite;
  private final ImageProcessor difference;
  private final MorphologyMode mode;

  /**
   * Create a new instance.
   *
   * @param original the original
   * @param transformed the transformed image
   * @param detection the detection
   * @param composite the composite
   * @param difference the difference
   * @param mode the morphology mode
   */
  SelectiveMorphologyResult(ImageProcessor original, ImageProcessor transformed,
      StarDetection detection, CompositeResult composite, ImageProcessor difference,
      MorphologyMode mode) {
    this.original = original;
    this.transformed = transformed;
    this.detection = detection;
    this.composite = composite;
    this.difference = difference;
    this.mode = mode;
  }

  /**
   * Gets the original 8-bit image.
   *
   * @return the original
   */
  public ImageProcessor getOriginal() {
    return original;
  }

  /**
   * Gets the globally transformed image.
   *
   * @return the transformed image
   */
  public ImageProcessor getTransformed() {
    return transformed;
  }

  /**
   * Gets the star detection.
   *
   * @return the detection
   */
  public StarDetection getDetection() {
    return detection;
  }

  /**
   * Gets the selective composite image.
   *
   * @return the composite
   */
  public ImageProcessor getComposite() {
    return composite.getComposite();
  }

  /**
   * Gets the composite result including the smoothed mask.
   *
   * @return the composite result
   */
  public CompositeResult getCompositeResult() {
    return composite;
  }

  /**
   * Gets the normalised difference between the transformed image and the composite.
   *
   * @return the difference
   */
  public ImageProcessor getDifference() {
    return difference;
  }

  /**
   * Gets the morphology mode.
   *
   * @return the mode
   */
  public MorphologyMode getMode() {
    return mode;
  }

  /**
   * Gets the result images keyed by name in display order. The smoothed mask is scaled to 8-bit.
   *
   * @return the images
   */
  public Map<String, ImageProcessor> getImages() {
    final Map<String, ImageProcessor> images = new LinkedHashMap<>();
    images.put(ORIGINAL, original);
    images.put(STAR_MASK, detection.getMask());
    images.put(mode.getResultName(), transformed);
    images.put(SELECTIVE_PREFIX + mode.getResultName(), composite.getComposite());
    images.put(SMOOTH_MASK, composite.getSmoothedMask().toByteProcessor());
    images.put(DIFFERENCE, difference);
    return images;
  }
}
