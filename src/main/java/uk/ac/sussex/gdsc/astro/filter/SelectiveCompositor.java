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

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;
import uk.ac.sussex.gdsc.astro.ParameterUtils;
import uk.ac.sussex.gdsc.astro.ShapeMismatchException;
import uk.ac.sussex.gdsc.astro.image.ImageChannels;

/**
 * Blend an original image with a transformed image using a smoothed star mask.
 *
 * <p>The binary mask is smoothed with a {@link MaskSmoother}. Each pixel of each channel is
 * blended using the {@link BlendLaw}, rounded and clipped to [0, 255].
 */
public class SelectiveCompositor {
  private final MaskSmoother smoother;
  private final BlendLaw law;

  /**
   * Create a new instance.
   *
   * @param blurSigma the blur sigma for the mask
   * @param law the blend law
   * @throws uk.ac.sussex.gdsc.astro.InvalidConfigurationException if the parameters are invalid
   */
  public SelectiveCompositor(double blurSigma, BlendLaw law) {
    smoother = new MaskSmoother(blurSigma);
    this.law = ParameterUtils.checkNotNull(law, "blend law");
  }

  /**
   * Gets the blend law.
   *
   * @return the law
   */
  public BlendLaw getLaw() {
    return law;
  }

  /**
   * Create the composite.
   *
   * @param original the original image (8-bit grayscale or RGB)
   * @param transformed the transformed image (same shape as the original)
   * @param mask the binary mask (8-bit, same size as the original)
   * @return the result
   * @throws ShapeMismatchException if the shapes differ
   * @throws IllegalArgumentException if the image types are not supported
   */
  public CompositeResult composite(ImageProcessor original, ImageProcessor transformed,
      ImageProcessor mask) {
    ImageChannels.checkSameShape(original, transformed, "original", "transformed");
    ImageChannels.checkSameSize(original, mask, "original", "mask");
    final SmoothedMask smoothedMask = smoother.smooth(mask);
    return new CompositeResult(blend(original, transformed, smoothedMask, law), smoothedMask);
  }

  /**
   * Blend the images using the weights.
   *
   * @param original the original image (8-bit grayscale or RGB)
   * @param transformed the transformed image (same shape as the original)
   * @param weights the weights (same size as the original)
   * @param law the blend law
   * @return the blended image
   * @throws ShapeMismatchException if the shapes differ
   */
  public static ImageProcessor blend(ImageProcessor original, ImageProcessor transformed,
      SmoothedMask weights, BlendLaw law) {
    ImageChannels.checkSameShape(original, transformed, "original", "transformed");
    if (original.getWidth() != weights.getWidth() || original.getHeight() != weights.getHeight()) {
      throw new ShapeMismatchException(
          String.format("Size mismatch: original=%dx%d, mask=%dx%d", original.getWidth(),
              original.getHeight(), weights.getWidth(), weights.getHeight()));
    }
    final ByteProcessor[] o = ImageChannels.split(original);
    final ByteProcessor[] t = ImageChannels.split(transformed);
    final ByteProcessor[] out = new ByteProcessor[o.length];
    for (int c = 0; c < o.length; c++) {
      final byte[] op = (byte[]) o[c].getPixels();
      final byte[] tp = (byte[]) t[c].getPixels();
      final byte[] result = new byte[op.length];
      for (int i = 0; i < result.length; i++) {
        final double value = law.blend(op[i] & 0xff, tp[i] & 0xff, weights.get(i));
        result[i] = (byte) clip(Math.round(value));
      }
      out[c] = new ByteProcessor(original.getWidth(), original.getHeight(), result);
    }
    return ImageChannels.merge(out);
  }

  private static long clip(long value) {
    if (value < 0) {
      return 0;
    }
    return value > 255 ? 255 : value;
  }
}
