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
package cbx.algorithms.misc;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static cbx.utilities.FileUtils.traverseFiles;
import static java.lang.String.format;
import static org.apache.commons.lang3.ArrayUtils.toPrimitive;
import static org.apache.commons.io.FilenameUtils.normalize;

/**
 * Reads non-equilibrium work values from text files.
 * <p>
 * The work value is the last whitespace delimited column of each line. Blank lines and lines that
 * begin with '#' are skipped. If a line selection regular expression is given, only lines that
 * contain a match are read. A directory is expanded to the files in it whose names match the file
 * selection regular expression, down to the run directories below it, read in sorted path order.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class WorkFileReader {

  private static final Logger logger = Logger.getLogger(WorkFileReader.class.getName());

  /**
   * Default file selection regular expression used for directories.
   */
  public static final String DEFAULT_FILE_REGEX = "work.log";
  /**
   * Directory depth searched for work files: the directory itself and one level of run directories.
   */
  private static final int MAX_DEPTH = 2;

  /**
   * Selects lines that carry work values; null to read every line.
   */
  private final Pattern lineRegex;
  /**
   * Selects the files read from a directory.
   */
  private final String fileRegex;

  /**
   * Read every non-comment line, and "work.log" files from directories.
   */
  public WorkFileReader() {
    this(null, DEFAULT_FILE_REGEX);
  }

  /**
   * Constructor.
   *
   * @param lineRegex Regular expression selecting lines to read (null reads every line).
   * @param fileRegex Regular expression selecting the files of a directory.
   */
  public WorkFileReader(String lineRegex, String fileRegex) {
    this.lineRegex = lineRegex == null ? null : Pattern.compile(lineRegex);
    this.fileRegex = fileRegex == null ? DEFAULT_FILE_REGEX : fileRegex;
  }

  /**
   * Read the work values of a file, or of the matching files of a directory.
   *
   * @param file A work file or a directory of work files.
   * @return The work values in file (then line) order.
   * @throws IllegalArgumentException If the file cannot be read or a value cannot be parsed.
   */
  public double[] readWorks(File file) {
    List<File> files;
    if (file.isDirectory()) {
      files = traverseFiles(file, MAX_DEPTH, fileRegex);
      if (files.isEmpty()) {
        logger.warning(format(" No files matching %s were found in %s.", fileRegex, file.getPath()));
      }
    } else {
      files = List.of(file);
    }

    List<Double> works = new ArrayList<>();
    for (File f : files) {
      works.addAll(readFile(f));
    }

    double[] result = toPrimitive(works.toArray(new Double[0]));
    logger.fine(format(" Read %d work values from %s", result.length, file.getPath()));
    return result;
  }

  private List<Double> readFile(File file) {
    String path = normalize(file.getAbsolutePath());
    List<Double> works = new ArrayList<>();
    try (BufferedReader reader = new BufferedReader(new FileReader(path))) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        if (lineRegex != null) {
          Matcher matcher = lineRegex.matcher(line);
          if (!matcher.find()) {
            continue;
          }
        }
        String[] tokens = trimmed.split("\\s+");
        String token = tokens[tokens.length - 1];
        double work;
        try {
          work = Double.parseDouble(token);
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(
              format(" Could not parse a work value from %s line %d: \"%s\"", path, lineNumber, line), e);
        }
        if (!Double.isFinite(work)) {
          throw new IllegalArgumentException(
              format(" The work value on %s line %d is not finite: \"%s\"", path, lineNumber, line));
        }
        works.add(work);
      }
    } catch (IOException e) {
      logger.warning(format(" Error reading %s: %s", path, e.getMessage()));
      throw new IllegalArgumentException(format(" Could not read work values from %s.", path), e);
    }
    return works;
  }
}
