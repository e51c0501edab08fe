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

import ij.Prefs;
import ij.process.ByteProcessor;
import ij.process.ImageProcessor;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.astro.detection.StarDetection;
import uk.ac.sussex.gdsc.astro.detection.StarDetector;
import uk.ac.sussex.gdsc.astro.filter.BlendLaw;
import uk.ac.sussex.gdsc.astro.filter.CompositeResult;
import uk.ac.sussex.gdsc.astro.filter.ImageDifference;
import uk.ac.sussex.gdsc.astro.filter.MorphologyFilter;
import uk.ac.sussex.gdsc.astro.filter.MorphologyMode;
import uk.ac.sussex.gdsc.astro.filter.SelectiveCompositor;
import uk.ac.sussex.gdsc.astro.image.AstroImage;
import uk.ac.sussex.gdsc.astro.image.ImageChannels;
import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.core.utils.concurrent.ConcurrencyUtils;

/**
 * Apply morphology selectively to the stars in an image.
 *
 * <p>Stars are detected on the luminance of the 8-bit image and drawn into a binary mask. The
 * whole image is transformed by the morphology filter. The transformed image is blended back with
 * the original using the smoothed star mask so the filter acts on the stars and not the extended
 * structure. The difference between the transformed and blended images is provided for
 * inspection.
 *
 * <p>Detection and the global transform are independent and run concurrently.
 */
public class SelectiveMorphologyProcessor {
  private static final Logger logger =
      Logger.getLogger(SelectiveMorphologyProcessor.class.getName());

  private final SelectiveMorphologyOptions options;
  private final int threads;

  /**
   * Create a new instance using the ImageJ thread count.
   *
   * @param options the options
   * @throws InvalidConfigurationException if the options are invalid
   */
  public SelectiveMorphologyProcessor(SelectiveMorphologyOptions options) {
    this(options, Prefs.getThreads());
  }

  /**
   * Create a new instance.
   *
   * @param options the options
   * @param threads the number of threads
   * @throws InvalidConfigurationException if the options are invalid
   */
  public SelectiveMorphologyProcessor(SelectiveMorphologyOptions options, int threads) {
    this.options = ParameterUtils.checkNotNull(options, "options").copy().validate();
    this.threads = Math.max(1, threads);
  }

  /**
   * Gets a copy of the options.
   *
   * @return the options
   */
  public SelectiveMorphologyOptions getOptions() {
    return options.copy();
  }

  /**
   * Process the 8-bit display image of the astronomical image.
   *
   * @param image the image
   * @return the result
   */
  public SelectiveMorphologyResult process(AstroImage image) {
    logger.fine(() -> "Processing " + image);
    return process(image.getImage());
  }

  /**
   * Process the image.
   *
   * @param image the image (8-bit grayscale or RGB)
   * @return the result
   * @throws IllegalArgumentException if the image is not 8-bit grayscale or RGB
   */
  public SelectiveMorphologyResult process(ImageProcessor image) {
    final long start = System.nanoTime();
    final ByteProcessor gray = ImageChannels.luminance(image);
    final StarDetector detector =
        new StarDetector(options.getFwhm(), options.getThreshold(), options.getRadiusFactor());
    final MorphologyFilter filter =
        new MorphologyFilter(options.getMode(), options.getKernelSize(), options.getIterations());
    final SelectiveCompositor compositor =
        new SelectiveCompositor(options.getBlurSigma(), options.getBlendLaw());

    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final AtomicReference<StarDetection> detection = new AtomicReference<>();
      final List<Future<?>> futures = new ArrayList<>(1);
      futures.add(executor.submit(() -> detection.set(detector.detect(gray))));
      // The channel tasks queue behind detection if the pool is small
      final ImageProcessor transformed = filter.apply(image, executor);
      ConcurrencyUtils.waitForCompletionUnchecked(futures);

      final CompositeResult composite =
          compositor.composite(image, transformed, detection.get().getMask());
      final ImageProcessor difference =
          ImageDifference.difference(transformed, composite.getComposite());
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Processing time: " + MathUtils.rounded((System.nanoTime() - start) / 1e6)
            + " ms");
      }
      return new SelectiveMorphologyResult(image, transformed, detection.get(), composite,
          difference, options.getMode());
    } finally {
      executor.shutdown();
    }
  }

  /**
   * Detect stars and create the binary star mask.
   *
   * @param image the image (single channel)
   * @param fwhm the expected full width at half maximum of a star
   * @param threshold the detection threshold (in units of the background standard deviation)
   * @param radiusFactor the mask radius as a multiple of the fwhm
   * @return the detection (mask and star count)
   * @throws InvalidConfigurationException if the parameters are invalid
   */
  public static StarDetection detect(ImageProcessor image, double fwhm, double threshold,
      double radiusFactor) {
    return new StarDetector(fwhm, threshold, radiusFactor).detect(image);
  }

  /**
   * Apply morphology to the whole image.
   *
   * @param image the image (8-bit grayscale or RGB)
   * @param kernelSize the kernel size
   * @param iterations the iterations
   * @param mode the mode
   * @return the transformed image
   * @throws InvalidConfigurationException if the parameters are invalid
   */
  public static ImageProcessor morphologicalTransform(ImageProcessor image, int kernelSize,
      int iterations, MorphologyMode mode) {
    return new MorphologyFilter(mode, kernelSize, iterations).apply(image);
  }

  /**
   * Blend the original and transformed images using the smoothed mask.
   *
   * @param original the original image (8-bit grayscale or RGB)
   * @param transformed the transformed image
   * @param mask the binary mask
   * @param blurSigma the blur sigma
   * @param law the blend law
   * @return the composite and smoothed mask
   * @throws InvalidConfigurationException if the parameters are invalid
   * @throws ShapeMismatchException if the shapes differ
   */
  public static CompositeResult composite(ImageProcessor original, ImageProcessor transformed,
      ImageProcessor mask, double blurSigma, BlendLaw law) {
    return new SelectiveCompositor(blurSigma, law).composite(original, transformed, mask);
  }

  /**
   * Compute the normalised absolute difference between two images.
   *
   * @param image1 the first image
   * @param image2 the second image
   * @return the difference
   * @throws ShapeMismatchException if the shapes differ
   */
  public static ImageProcessor difference(ImageProcessor image1, ImageProcessor image2) {
    return ImageDifference.difference(image1, image2);
  }
}
