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

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ImageProcessor;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Write the result images to a directory as PNG files.
 */
public final class ResultImageWriter {
  /** The file extension. */
  public static final String EXTENSION = ".png";

  private static final Logger logger = Logger.getLogger(ResultImageWriter.class.getName());

  /** No public construction. */
  private ResultImageWriter() {}

  /**
   * Gets the file name for the named result image.
   *
   * @param name the name
   * @return the file name
   */
  public static String getFileName(String name) {
    return name + EXTENSION;
  }

  /**
   * Gets the files for the result images in the directory, in display order.
   *
   * @param result the result
   * @param directory the directory
   * @return the files
   */
  public static List<File> getFiles(SelectiveMorphologyResult result, File directory) {
    final List<File> files = new ArrayList<>();
    for (final String name : result.getImages().keySet()) {
      files.add(new File(directory, getFileName(name)));
    }
    return files;
  }

  /**
   * Save the result images. The directory is created if it does not exist.
   *
   * <p>Images that fail to save are logged and omitted from the returned list.
   *
   * @param result the result
   * @param directory the directory
   * @return the files that were written
   * @throws IOException if the directory cannot be created
   */
  public static List<File> save(SelectiveMorphologyResult result, File directory)
      throws IOException {
    Files.createDirectories(directory.toPath());
    final List<File> files = new ArrayList<>();
    for (final Map.Entry<String, ImageProcessor> entry : result.getImages().entrySet()) {
      final File file = new File(directory, getFileName(entry.getKey()));
      final ImagePlus imp = new ImagePlus(entry.getKey(), entry.getValue());
      if (new FileSaver(imp).saveAsPng(file.getPath()) && file.isFile()) {
        files.add(file);
      } else {
        logger.warning(() -> "Failed to save " + file);
      }
    }
    return files;
  }
}
