// ******************************************************************************
//
// Title:       Crooks-Bayes X.
// Description: Crooks-Bayes X - Sequential Bayesian Free Energy Estimation.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2024.
//
// This file is part of Crooks-Bayes X.
//
// Crooks-Bayes X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Crooks-Bayes X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Crooks-Bayes X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package cbx.utilities;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.lang.String.format;

/**
 * FileUtils class.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class FileUtils {

  private static final Logger logger = Logger.getLogger(FileUtils.class.getName());

  /**
   * Private constructor to prevent instantiation.
   */
  private FileUtils() {
    // Empty constructor.
  }

  /**
   * Traverse a directory to find files matching the given regex pattern.
   *
   * @param directory   The directory to traverse.
   * @param maxDepth    Maximum depth to traverse.
   * @param filePattern Regular expression pattern to match file names.
   * @return List of matching files, sorted by path.
   */
  public static List<File> traverseFiles(File directory, int maxDepth, String filePattern) {
    List<File> matchingFiles = new ArrayList<>();
    Pattern pattern = Pattern.compile(filePattern);

    try (Stream<Path> paths = Files.walk(directory.toPath(), maxDepth)) {
      matchingFiles = paths
          .filter(Files::isRegularFile)
          .filter(path -> pattern.matcher(path.getFileName().toString()).matches())
          .sorted()
          .map(Path::toFile)
          .collect(Collectors.toList());
    } catch (IOException e) {
      logger.warning(format("Error traversing directory %s: %s", directory.getAbsolutePath(), e.getMessage()));
    }

    return matchingFiles;
  }

  /**
   * Delete a directory and everything below it.
   *
   * @param path The directory to delete.
   * @throws IOException If a file or directory could not be deleted.
   */
  public static void deleteDirectoryTree(Path path) throws IOException {
    if (!Files.exists(path)) {
      return;
    }
    Files.walkFileTree(path, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
        Files.delete(file);
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult postVisitDirectory(Path dir, IOException e) throws IOException {
        if (e != null) {
          throw e;
        }
        Files.delete(dir);
        return FileVisitResult.CONTINUE;
      }
    });
  }
}
