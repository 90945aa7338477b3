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
package cbx.algorithms.commands;

import cbx.algorithms.misc.AlgorithmsTest;
import cbx.numerics.estimator.CrooksBayesEstimator;
import cbx.numerics.estimator.CrooksBayesResult;
import cbx.numerics.estimator.NonEquilibriumBAR;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static cbx.utilities.Constants.inverseTemperature;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 * Tests the CrooksBayes command.
 */
public class CrooksBayesTest extends AlgorithmsTest {

  @Test
  public void testCrooksBayes() throws IOException {
    Path dir = registerTemporaryDirectory();
    Path forward = writeLines(dir, "forward.dat", "5.0", "5.0", "5.0");
    Path backward = writeLines(dir, "backward.dat", "-5.0", "-5.0", "-5.0");
    Path trace = dir.resolve("trace.txt");
    Path posterior = dir.resolve("posterior.txt");

    String[] args = {"--min", "-10", "--max", "10", "--beta", "1.0",
        "--trace", trace.toString(), "--posterior", posterior.toString(),
        forward.toString(), backward.toString()};
    binding.setVariable("args", args);
    CrooksBayes crooksBayes = new CrooksBayes(binding).run();

    CrooksBayesResult result = crooksBayes.getResult();
    assertNotNull(result);
    assertEquals(0, crooksBayes.getExitStatus());
    assertEquals(3, result.getNumberOfSamples());
    assertEquals(200, result.getGridPoints().length);
    assertEquals(5.0, result.getFinalMean(), 0.05);

    NonEquilibriumBAR bar = crooksBayes.getBAR();
    assertNotNull(bar);
    assertEquals(5.0, bar.getFreeEnergyDifference(), 1.0e-6);

    assertEquals(3, dataLines(trace).size());
    assertEquals(200, dataLines(posterior).size());
    String[] last = dataLines(trace).get(2).trim().split("\\s+");
    assertEquals(3, Integer.parseInt(last[0]));
    assertEquals(result.getFinalMean(), Double.parseDouble(last[1]), 1.0e-10);
    assertEquals(result.getFinalStdDev(), Double.parseDouble(last[2]), 1.0e-10);
  }

  @Test
  public void testRangeFromProperties() {
    Path dir = registerTemporaryDirectory();
    Path forward = writeLines(dir, "forward.dat", "2.0", "1.0");
    Path backward = writeLines(dir, "backward.dat", "-1.0", "0.0");
    writeLines(dir, "forward.properties",
        "crooks-bayes-min = -5.0",
        "crooks-bayes-max = 5.0",
        "crooks-bayes-step = 0.5");

    String[] args = {"--beta", "1.0", "--noBAR", forward.toString(), backward.toString()};
    binding.setVariable("args", args);
    CrooksBayes crooksBayes = new CrooksBayes(binding).run();

    CrooksBayesResult result = crooksBayes.getResult();
    assertNotNull(result);
    assertEquals(20, result.getGridPoints().length);
    assertEquals(-5.0, result.getGrid().getLowerBound(), 0.0);
    assertEquals(5.0, result.getGrid().getUpperBound(), 0.0);
    assertNull(crooksBayes.getBAR());
  }

  @Test
  public void testOptionsOverrideProperties() {
    Path dir = registerTemporaryDirectory();
    Path forward = writeLines(dir, "forward.dat", "2.0");
    Path backward = writeLines(dir, "backward.dat", "-1.0");
    System.setProperty("crooks-bayes-min", "-5.0");
    System.setProperty("crooks-bayes-max", "5.0");

    String[] args = {"--beta", "1.0", "--max", "15.0", "--step", "1.0", forward.toString(), backward.toString()};
    binding.setVariable("args", args);
    CrooksBayes crooksBayes = new CrooksBayes(binding).run();

    CrooksBayesResult result = crooksBayes.getResult();
    assertNotNull(result);
    assertEquals(-5.0, result.getGrid().getLowerBound(), 0.0);
    assertEquals(15.0, result.getGrid().getUpperBound(), 0.0);
    assertEquals(20, result.getGridPoints().length);
  }

  @Test
  public void testTemperature() {
    Path dir = registerTemporaryDirectory();
    Path forward = writeLines(dir, "forward.dat", "1.2", "0.4", "2.0");
    Path backward = writeLines(dir, "backward.dat", "0.3", "-0.5", "1.1");

    String[] args = {"-t", "310.0", "--min", "-4", "--max", "4", forward.toString(), backward.toString()};
    binding.setVariable("args", args);
    CrooksBayes crooksBayes = new CrooksBayes(binding).run();

    CrooksBayesResult expected = CrooksBayesEstimator.estimate(
        new double[]{1.2, 0.4, 2.0}, new double[]{0.3, -0.5, 1.1}, inverseTemperature(310.0), -4.0, 4.0);
    CrooksBayesResult result = crooksBayes.getResult();
    assertNotNull(result);
    assertEquals(expected.getFinalMean(), result.getFinalMean(), 1.0e-12);
    assertEquals(expected.getFinalStdDev(), result.getFinalStdDev(), 1.0e-12);
  }

  @Test
  public void testWorkLogDirectories() {
    Path dir = registerTemporaryDirectory();
    writeLines(dir, "forward/run1/work.log", " Boole 1 0.5 4.8", " Step 1 energy -100.0");
    writeLines(dir, "forward/run2/work.log", " Boole 1 0.5 5.2");
    writeLines(dir, "backward/run1/work.log", " Boole 1 0.5 -4.9");
    writeLines(dir, "backward/run2/work.log", " Boole 1 0.5 -5.1");

    String[] args = {"--re", "Boole", "--min", "-10", "--max", "10", "--beta", "1.0",
        dir.resolve("forward").toString(), dir.resolve("backward").toString()};
    binding.setVariable("args", args);
    CrooksBayes crooksBayes = new CrooksBayes(binding).run();

    CrooksBayesResult result = crooksBayes.getResult();
    assertNotNull(result);
    assertEquals(2, result.getNumberOfSamples());
    assertEquals(5.0, crooksBayes.getBAR().getFreeEnergyDifference(), 0.1);
  }

  @Test
  public void testLengthMismatch() {
    Path dir = registerTemporaryDirectory();
    Path forward = writeLines(dir, "forward.dat", "1.0", "2.0", "3.0");
    Path backward = writeLines(dir, "backward.dat", "-1.0", "-2.0");

    String[] args = {"--min", "-10", "--max", "10", "--beta", "1.0", forward.toString(), backward.toString()};
    binding.setVariable("args", args);
    CrooksBayes crooksBayes = new CrooksBayes(binding).run();
    assertNull(crooksBayes.getResult());
    assertNull(crooksBayes.getBAR());
    assertEquals(1, crooksBayes.getExitStatus());
  }

  @Test
  public void testMissingRange() {
    Path dir = registerTemporaryDirectory();
    Path forward = writeLines(dir, "forward.dat", "1.0");
    Path backward = writeLines(dir, "backward.dat", "-1.0");

    String[] args = {"--beta", "1.0", forward.toString(), backward.toString()};
    binding.setVariable("args", args);
    CrooksBayes crooksBayes = new CrooksBayes(binding).run();
    assertNull(crooksBayes.getResult());
    assertEquals(1, crooksBayes.getExitStatus());
  }

  /**
   * A termination request made before the estimator exists stops it before the first pair.
   */
  @Test
  public void testTerminateBeforeEstimate() {
    Path dir = registerTemporaryDirectory();
    Path forward = writeLines(dir, "forward.dat", "5.0", "5.0");
    Path backward = writeLines(dir, "backward.dat", "-5.0", "-5.0");

    String[] args = {"--min", "-10", "--max", "10", "--beta", "1.0", "--noBAR", forward.toString(), backward.toString()};
    binding.setVariable("args", args);
    CrooksBayes crooksBayes = new CrooksBayes(binding);
    crooksBayes.terminate();
    crooksBayes.run();

    CrooksBayesResult result = crooksBayes.getResult();
    assertNotNull(result);
    assertTrue(result.isTerminated());
    assertEquals(0, result.getNumberOfSamples());
    assertEquals(0, crooksBayes.getExitStatus());
  }

  @Test
  public void testCrooksBayesHelp() {
    String[] args = {"-h"};
    binding.setVariable("args", args);
    CrooksBayes crooksBayes = new CrooksBayes(binding).run();
    assertNull(crooksBayes.getResult());
    assertEquals(0, crooksBayes.getExitStatus());
  }

  private static List<String> dataLines(Path path) throws IOException {
    return Files.readAllLines(path).stream()
        .filter(line -> !line.isBlank() && !line.startsWith("#"))
        .collect(Collectors.toList());
  }
}
