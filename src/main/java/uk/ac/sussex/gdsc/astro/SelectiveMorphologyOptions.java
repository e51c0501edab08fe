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

import uk.ac.sussex.gdsc.astro.filter.BlendLaw;
import uk.ac.sussex.gdsc.astro.filter.MorphologyMode;

/**
 * Contains the options for selective morphology.
 */
public class SelectiveMorphologyOptions {
  /** The default full width at half maximum of a star. */
  public static final double DEFAULT_FWHM = 4;
  /** The default detection threshold. */
  public static final double DEFAULT_THRESHOLD = 2;
  /** The default mask radius factor. */
  public static final double DEFAULT_RADIUS_FACTOR = 1.5;
  /** The default kernel size. */
  public static final int DEFAULT_KERNEL_SIZE = 3;
  /** The default iterations. */
  public static final int DEFAULT_ITERATIONS = 1;
  /** The default blur sigma. */
  public static final double DEFAULT_BLUR_SIGMA = 5;

  private double fwhm = DEFAULT_FWHM;
  private double threshold = DEFAULT_THRESHOLD;
  private double radiusFactor = DEFAULT_RADIUS_FACTOR;
  private int kernelSize = DEFAULT_KERNEL_SIZE;
  private int iterations = DEFAULT_ITERATIONS;
  private double blurSigma = DEFAULT_BLUR_SIGMA;
  private MorphologyMode mode = MorphologyMode.ERODE;
  private BlendLaw blendLaw = BlendLaw.FULL;

  /**
   * Default constructor.
   */
  public SelectiveMorphologyOptions() {
    // Do nothing
  }

  /**
   * Copy constructor.
   *
   * @param source the source
   */
  protected SelectiveMorphologyOptions(SelectiveMorphologyOptions source) {
    fwhm = source.fwhm;
    threshold = source.threshold;
    radiusFactor = source.radiusFactor;
    kernelSize = source.kernelSize;
    iterations = source.iterations;
    blurSigma = source.blurSigma;
    mode = source.mode;
    blendLaw = source.blendLaw;
  }

  /**
   * Copy the options.
   *
   * @return the copy
   */
  public SelectiveMorphologyOptions copy() {
    return new SelectiveMorphologyOptions(this);
  }

  /**
   * Validate the options.
   *
   * @return this instance
   * @throws InvalidConfigurationException if any option is invalid
   */
  public SelectiveMorphologyOptions validate() {
    ParameterUtils.checkStrictlyPositive(fwhm, "fwhm");
    ParameterUtils.checkStrictlyPositive(threshold, "threshold");
    ParameterUtils.checkStrictlyPositive(radiusFactor, "radius factor");
    ParameterUtils.checkAtLeast(kernelSize, 1, "kernel size");
    ParameterUtils.checkAtLeast(iterations, 0, "iterations");
    ParameterUtils.checkPositive(blurSigma, "blur sigma");
    ParameterUtils.checkNotNull(mode, "mode");
    ParameterUtils.checkNotNull(blendLaw, "blend law");
    return this;
  }

  /**
   * Gets the expected full width at half maximum of a star (in pixels).
   *
   * @return the fwhm
   */
  public double getFwhm() {
    return fwhm;
  }

  /**
   * Sets the expected full width at half maximum of a star (in pixels).
   *
   * @param fwhm the new fwhm
   */
  public void setFwhm(double fwhm) {
    this.fwhm = fwhm;
  }

  /**
   * Gets the detection threshold (in units of the background standard deviation).
   *
   * @return the threshold
   */
  public double getThreshold() {
    return threshold;
  }

  /**
   * Sets the detection threshold (in units of the background standard deviation).
   *
   * @param threshold the new threshold
   */
  public void setThreshold(double threshold) {
    this.threshold = threshold;
  }

  /**
   * Gets the mask radius factor. The mask radius is {@code round(fwhm * factor)}.
   *
   * @return the radius factor
   */
  public double getRadiusFactor() {
    return radiusFactor;
  }

  /**
   * Sets the mask radius factor.
   *
   * @param radiusFactor the new radius factor
   */
  public void setRadiusFactor(double radiusFactor) {
    this.radiusFactor = radiusFactor;
  }

  /**
   * Gets the structuring element size.
   *
   * @return the kernel size
   */
  public int getKernelSize() {
    return kernelSize;
  }

  /**
   * Sets the structuring element size.
   *
   * @param kernelSize the new kernel size
   */
  public void setKernelSize(int kernelSize) {
    this.kernelSize = kernelSize;
  }

  /**
   * Gets the morphology iterations.
   *
   * @return the iterations
   */
  public int getIterations() {
    return iterations;
  }

  /**
   * Sets the morphology iterations.
   *
   * @param iterations the new iterations
   */
  public void setIterations(int iterations) {
    this.iterations = iterations;
  }

  /**
   * Gets the mask blur sigma.
   *
   * @return the blur sigma
   */
  public double getBlurSigma() {
    return blurSigma;
  }

  /**
   * Sets the mask blur sigma.
   *
   * @param blurSigma the new blur sigma
   */
  public void setBlurSigma(double blurSigma) {
    this.blurSigma = blurSigma;
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
   * Sets the morphology mode.
   *
   * @param mode the new mode
   */
  public void setMode(MorphologyMode mode) {
    this.mode = mode;
  }

  /**
   * Gets the blend law.
   *
   * @return the blend law
   */
  public BlendLaw getBlendLaw() {
    return blendLaw;
  }

  /**
   * Sets the blend law.
   *
   * @param blendLaw the new blend law
   */
  public void setBlendLaw(BlendLaw blendLaw) {
    this.blendLaw = blendLaw;
  }

  @Override
  public String toString() {
    return String.format(
        "fwhm=%s, threshold=%s, radiusFactor=%s, kernelSize=%d, iterations=%d, "
            + "blurSigma=%s, mode=%s, blendLaw=%s",
        fwhm, threshold, radiusFactor, kernelSize, iterations, blurSigma, mode, blendLaw);
  }
}
