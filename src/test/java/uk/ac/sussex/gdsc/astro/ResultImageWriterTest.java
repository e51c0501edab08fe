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
import ij.process.ByteProcessor;
import ij.process.ImageProcessor;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings({"javadoc"})
class ResultImageWriterTest {
  @Test
  void checkFileName() {
    Assertions.assertEquals("starmask.png", ResultImageWriter.getFileName("starmask"));
  }

  @Test
  void checkFiles() {
    final ByteProcessor bp = new ByteProcessor(20, 20);
    bp.add(3);
    final SelectiveMorphologyResult result =
        new SelectiveMorphologyProcessor(new SelectiveMorphologyOptions(), 1).process(bp);
    final File dir = new File("results");
    final List<File> files = ResultImageWriter.getFiles(result, dir);
    Assertions.assertEquals(6, files.size());
    Assertions.assertEquals(new File(dir, "original.png"), files.get(0));
    Assertions.assertEquals(new File(dir, "eroded.png"), files.get(2));
    Assertions.assertEquals(new File(dir, "selective_eroded.png"), files.get(3));
    Assertions.assertEquals(new File(dir, "difference.png"), files.get(5));
  }

  @Test
  void checkSave(@TempDir Path tempDir) throws IOException {
    final ByteProcessor bp = new ByteProcessor(16, 12);
    for (int i = 0; i < bp.getPixelCount(); i++) {
      bp.set(i, (i * 7) % 256);
    }
    final SelectiveMorphologyResult result =
        new SelectiveMorphologyProcessor(new SelectiveMorphologyOptions(), 1).process(bp);
    final File dir = tempDir.resolve("out").resolve("run1").toFile();
    final List<File> files = ResultImageWriter.save(result, dir);
    Assertions.assertEquals(ResultImageWriter.getFiles(result, dir), files);
    for (final File file : files) {
      Assertions.assertTrue(file.isFile(), () -> "Missing " + file);
    }

    final ImageProcessor expected = result.getImages().get("original");
    final ImagePlus imp = IJ.openImage(new File(dir, "original.png").getPath());
    Assertions.assertNotNull(imp);
    final ImageProcessor actual = imp.getProcessor();
    Assertions.assertEquals(expected.getWidth(), actual.getWidth());
    Assertions.assertEquals(expected.getHeight(), actual.getHeight());
    for (int y = 0; y < expected.getHeight(); y++) {
      for (int x = 0; x < expected.getWidth(); x++) {
        // A gray image may be read back as RGB
        Assertions.assertEquals(expected.get(x, y), actual.getPixel(x, y) & 0xff);
      }
    }
  }

  @Test
  void checkSaveThrowsWhenDirectoryCannotBeCreated(@TempDir Path tempDir) throws IOException {
    final ByteProcessor bp = new ByteProcessor(8, 8);
    final SelectiveMorphologyResult result =
        new SelectiveMorphologyProcessor(new SelectiveMorphologyOptions(), 1).process(bp);
    final Path file = Files.createFile(tempDir.resolve("results"));
    Assertions.assertThrows(IOException.class,
        () -> ResultImageWriter.save(result, file.toFile()));
    Assertions.assertThrows(IOException.class,
        () -> ResultImageWriter.save(result, file.resolve("sub").toFile()));
  }
}
