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

import ij.IJ;
import ij.ImagePlus;
import ij.Prefs;
import ij.WindowManager;
import ij.gui.GenericDialog;
import ij.gui.PointRoi;
import ij.plugin.PlugIn;
import ij.process.ImageProcessor;
import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import uk.ac.sussex.gdsc.astro.detection.Centroid;
import uk.ac.sussex.gdsc.astro.detection.StarDetection;
import uk.ac.sussex.gdsc.astro.filter.BlendLaw;
import uk.ac.sussex.gdsc.astro.filter.MorphologyMode;
import uk.ac.sussex.gdsc.astro.image.AstroImage;
import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.core.utils.TextUtils;

/**
 * Erode or dilate the stars in an astronomical image leaving the extended structure unchanged.
 *
 * <p>Stars are detected and drawn into a mask. The morphology filter is applied to the whole
 * image and blended back with the original using the smoothed mask.
 */
public class SelectiveMorphology_PlugIn implements PlugIn {
  private static final String TITLE = "Selective Morphology";

  /** The current settings for the plugin instance. */
  private Settings settings;

  /**
   * Contains the settings that are the re-usable state of the plugin.
   */
  private static class Settings {
    static final String KEY_FWHM = "gdsc.astro.fwhm";
    static final String KEY_THRESHOLD = "gdsc.astro.threshold";
    static final String KEY_RADIUS_FACTOR = "gdsc.astro.radiusFactor";
    static final String KEY_KERNEL_SIZE = "gdsc.astro.kernelSize";
    static final String KEY_ITERATIONS = "gdsc.astro.iterations";
    static final String KEY_BLUR_SIGMA = "gdsc.astro.blurSigma";
    static final String KEY_MODE = "gdsc.astro.mode";
    static final String KEY_BLEND_LAW = "gdsc.astro.blendLaw";
    static final String KEY_SHOW_RESULTS = "gdsc.astro.showResults";
    static final String KEY_SHOW_STARS = "gdsc.astro.showStars";
    static final String KEY_SAVE_RESULTS = "gdsc.astro.saveResults";
    static final String KEY_RESULTS_DIRECTORY = "gdsc.astro.resultsDirectory";

    /** The last settings used by the plugin. This should be updated after plugin execution. */
    private static final AtomicReference<Settings> lastSettings =
        new AtomicReference<>(new Settings());

    SelectiveMorphologyOptions options;
    boolean showResults;
    boolean showStars;
    boolean saveResults;
    String resultsDirectory;

    /**
     * Default constructor. Loads the values from the ImageJ preferences.
     */
    Settings() {
      options = new SelectiveMorphologyOptions();
      options.setFwhm(Prefs.get(KEY_FWHM, SelectiveMorphologyOptions.DEFAULT_FWHM));
      options.setThreshold(Prefs.get(KEY_THRESHOLD, SelectiveMorphologyOptions.DEFAULT_THRESHOLD));
      options.setRadiusFactor(
          Prefs.get(KEY_RADIUS_FACTOR, SelectiveMorphologyOptions.DEFAULT_RADIUS_FACTOR));
      options.setKernelSize(
          (int) Prefs.get(KEY_KERNEL_SIZE, SelectiveMorphologyOptions.DEFAULT_KERNEL_SIZE));
      options.setIterations(
          (int) Prefs.get(KEY_ITERATIONS, SelectiveMorphologyOptions.DEFAULT_ITERATIONS));
      options
          .setBlurSigma(Prefs.get(KEY_BLUR_SIGMA, SelectiveMorphologyOptions.DEFAULT_BLUR_SIGMA));
      options.setMode(getMode((int) Prefs.get(KEY_MODE, MorphologyMode.ERODE.ordinal())));
      options.setBlendLaw(getBlendLaw((int) Prefs.get(KEY_BLEND_LAW, BlendLaw.FULL.ordinal())));
      showResults = Prefs.get(KEY_SHOW_RESULTS, true);
      showStars = Prefs.get(KEY_SHOW_STARS, false);
      saveResults = Prefs.get(KEY_SAVE_RESULTS, false);
      resultsDirectory = Prefs.get(KEY_RESULTS_DIRECTORY, "");
    }

    /**
     * Copy constructor.
     *
     * @param source the source
     */
    private Settings(Settings source) {
      options = source.options.copy();
      showResults = source.showResults;
      showStars = source.showStars;
      saveResults = source.saveResults;
      resultsDirectory = source.resultsDirectory;
    }

    private static MorphologyMode getMode(int ordinal) {
      final MorphologyMode[] values = MorphologyMode.values();
      return ordinal >= 0 && ordinal < values.length ? values[ordinal] : MorphologyMode.ERODE;
    }

    private static BlendLaw getBlendLaw(int ordinal) {
      final BlendLaw[] values = BlendLaw.values();
      return ordinal >= 0 && ordinal < values.length ? values[ordinal] : BlendLaw.FULL;
    }

    /**
     * Copy the settings.
     *
     * @return the settings
     */
    Settings copy() {
      return new Settings(this);
    }

    /**
     * Load a copy of the settings.
     *
     * @return the settings
     */
    static Settings load() {
      return lastSettings.get().copy();
    }

    /**
     * Save the settings.
     */
    void save() {
      lastSettings.set(this);
      Prefs.set(KEY_FWHM, options.getFwhm());
      Prefs.set(KEY_THRESHOLD, options.getThreshold());
      Prefs.set(KEY_RADIUS_FACTOR, options.getRadiusFactor());
      Prefs.set(KEY_KERNEL_SIZE, options.getKernelSize());
      Prefs.set(KEY_ITERATIONS, options.getIterations());
      Prefs.set(KEY_BLUR_SIGMA, options.getBlurSigma());
      Prefs.set(KEY_MODE, options.getMode().ordinal());
      Prefs.set(KEY_BLEND_LAW, options.getBlendLaw().ordinal());
      Prefs.set(KEY_SHOW_RESULTS, showResults);
      Prefs.set(KEY_SHOW_STARS, showStars);
      Prefs.set(KEY_SAVE_RESULTS, saveResults);
      Prefs.set(KEY_RESULTS_DIRECTORY, resultsDirectory);
    }
  }

  @Override
  public void run(String arg) {
    final ImagePlus imp = WindowManager.getCurrentImage();
    if (imp == null) {
      IJ.noImage();
      return;
    }
    if (!showDialog()) {
      return;
    }

    final AstroImage image;
    final SelectiveMorphologyResult result;
    try {
      image = AstroImage.create(imp);
      IJ.showStatus(TITLE + " ...");
      result = new SelectiveMorphologyProcessor(settings.options).process(image);
    } catch (final IllegalArgumentException ex) {
      // Invalid options, mismatched shapes or an unsupported image
      IJ.error(TITLE, ex.getMessage());
      return;
    } finally {
      IJ.showStatus("");
    }

    logSummary(image, result);
    if (settings.showStars) {
      showStars(imp, result.getDetection());
    }
    if (settings.showResults) {
      showResults(image, result);
    }
    if (settings.saveResults) {
      saveResults(result);
    }
  }

  private boolean showDialog() {
    settings = Settings.load();
    final SelectiveMorphologyOptions options = settings.options;

    final GenericDialog gd = new GenericDialog(TITLE);
    gd.addMessage("Apply morphology to the stars and blend with the original image");
    gd.addNumericField("FWHM", options.getFwhm(), 2, 6, "px");
    gd.addNumericField("Threshold", options.getThreshold(), 2, 6, "SD");
    gd.addNumericField("Radius_factor", options.getRadiusFactor(), 2);
    gd.addChoice("Mode", MorphologyMode.getDescriptions(), options.getMode().getDescription());
    gd.addNumericField("Kernel_size", options.getKernelSize(), 0);
    gd.addNumericField("Iterations", options.getIterations(), 0);
    gd.addNumericField("Blur_sigma", options.getBlurSigma(), 2, 6, "px");
    gd.addChoice("Blend_law", BlendLaw.getDescriptions(), options.getBlendLaw().getDescription());
    gd.addCheckbox("Show_results", settings.showResults);
    gd.addCheckbox("Show_stars", settings.showStars);
    gd.addCheckbox("Save_results", settings.saveResults);
    gd.addDirectoryField("Results_directory", settings.resultsDirectory);
    gd.showDialog();
    if (gd.wasCanceled()) {
      return false;
    }

    options.setFwhm(gd.getNextNumber());
    options.setThreshold(gd.getNextNumber());
    options.setRadiusFactor(gd.getNextNumber());
    options.setMode(MorphologyMode.fromOrdinal(gd.getNextChoiceIndex()));
    options.setKernelSize((int) gd.getNextNumber());
    options.setIterations((int) gd.getNextNumber());
    options.setBlurSigma(gd.getNextNumber());
    options.setBlendLaw(BlendLaw.fromOrdinal(gd.getNextChoiceIndex()));
    settings.showResults = gd.getNextBoolean();
    settings.showStars = gd.getNextBoolean();
    settings.saveResults = gd.getNextBoolean();
    settings.resultsDirectory = gd.getNextString();

    try {
      options.validate();
    } catch (final InvalidConfigurationException ex) {
      IJ.error(TITLE, ex.getMessage());
      return false;
    }
    if (settings.saveResults && settings.resultsDirectory.trim().isEmpty()) {
      IJ.error(TITLE, "A results directory is required to save the results");
      return false;
    }
    settings.save();
    return true;
  }

  private void logSummary(AstroImage image, SelectiveMorphologyResult result) {
    final SelectiveMorphologyOptions options = settings.options;
    final StarDetection detection = result.getDetection();
    IJ.log(String.format("%s : %s (%dx%d, %s)", TITLE, image.getTitle(), image.getWidth(),
        image.getHeight(), image.isColour() ? "colour" : "grayscale"));
    IJ.log(String.format("  FWHM = %s, threshold = %s, radius = %d px",
        MathUtils.rounded(options.getFwhm()), MathUtils.rounded(options.getThreshold()),
        detection.getRadius()));
    IJ.log(String.format("  %s %dx%d x%d, blur = %s, %s", options.getMode(),
        options.getKernelSize(), options.getKernelSize(), options.getIterations(),
        MathUtils.rounded(options.getBlurSigma()), options.getBlendLaw()));
    IJ.log(String.format("  Background = %s +/- %s",
        MathUtils.rounded(detection.getBackground().getMedian()),
        MathUtils.rounded(detection.getBackground().getStandardDeviation())));
    IJ.log("  Detected " + TextUtils.pleural(detection.getCount(), "star"));
  }

  private static void showStars(ImagePlus imp, StarDetection detection) {
    final List<Centroid> centroids = detection.getCentroids();
    if (centroids.isEmpty()) {
      imp.deleteRoi();
      return;
    }
    final float[] x = new float[centroids.size()];
    final float[] y = new float[centroids.size()];
    for (int i = 0; i < x.length; i++) {
      // Pixel centres are at +0.5 in ImageJ sub-pixel coordinates
      x[i] = (float) (centroids.get(i).getX() + 0.5);
      y[i] = (float) (centroids.get(i).getY() + 0.5);
    }
    imp.setRoi(new PointRoi(x, y, x.length));
  }

  private static void showResults(AstroImage image, SelectiveMorphologyResult result) {
    for (final Map.Entry<String, ImageProcessor> entry : result.getImages().entrySet()) {
      new ImagePlus(image.getTitle() + " " + entry.getKey(), entry.getValue()).show();
    }
  }

  private void saveResults(SelectiveMorphologyResult result) {
    final File directory = new File(settings.resultsDirectory);
    final List<File> files;
    try {
      files = ResultImageWriter.save(result, directory);
    } catch (final IOException ex) {
      IJ.error(TITLE, "Failed to create results directory: " + directory.getPath());
      return;
    }
    IJ.log(String.format("  Saved %s to %s", TextUtils.pleural(files.size(), "image"),
        directory.getPath()));
    final int failed = result.getImages().size() - files.size();
    if (failed != 0) {
      IJ.error(TITLE, "Failed to save " + TextUtils.pleural(failed, "image") + " to "
          + directory.getPath());
    }
  }
}
