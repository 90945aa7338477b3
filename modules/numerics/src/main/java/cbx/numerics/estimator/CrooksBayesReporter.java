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
package cbx.numerics.estimator;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.util.List;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * The CrooksBayesReporter class reports the trace and final estimate of a Crooks-Bayes run, and
 * writes the trace and posterior as whitespace delimited text.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CrooksBayesReporter {

  private static final Logger logger = Logger.getLogger(CrooksBayesReporter.class.getName());

  private final CrooksBayesResult result;

  /**
   * Constructor.
   *
   * @param result The result to report.
   */
  public CrooksBayesReporter(CrooksBayesResult result) {
    this.result = result;
  }

  /**
   * Log the posterior mean and standard deviation after each work pair, then the final estimate.
   */
  public void report() {
    List<PosteriorSummary> trace = result.getTrace();
    StringBuilder sb = new StringBuilder("\n Crooks-Bayes Posterior Trace\n");
    sb.append(format(" %8s %12s     %10s\n", "Pair", "Mean", "SD"));
    for (PosteriorSummary summary : trace) {
      sb.append(summary.toString()).append("\n");
    }
    logger.info(sb.toString());

    if (trace.isEmpty()) {
      logger.info(" No work pairs were absorbed.");
      return;
    }
    if (result.isTerminated()) {
      logger.info(format(" Estimation was terminated after %d work pairs.", trace.size()));
    }
    logger.info(format(" Crooks-Bayes Free Energy Difference: %12.6f +/- %10.6f (%d work pairs)",
        result.getFinalMean(), result.getFinalStdDev(), trace.size()));
  }

  /**
   * Write the trace: one line per absorbed pair with its index, posterior mean and standard deviation.
   *
   * @param file The file to write.
   * @throws IOException If the file cannot be written.
   */
  public void writeTrace(File file) throws IOException {
    try (BufferedWriter bw = new BufferedWriter(new FileWriter(file))) {
      bw.write("# pair mean sd\n");
      for (PosteriorSummary summary : result.getTrace()) {
        bw.write(format("%8d %20.12f %20.12f\n", summary.sample, summary.mean, summary.sd));
      }
    }
    logger.info(format(" Wrote the Crooks-Bayes trace to %s", file.getPath()));
  }

  /**
   * Write the final posterior: one line per hypothesis with the free energy difference and its
   * probability density.
   *
   * @param file The file to write.
   * @throws IOException If the file cannot be written.
   */
  public void writePosterior(File file) throws IOException {
    double[] points = result.getGridPoints();
    double[] posterior = result.getPosterior();
    try (BufferedWriter bw = new BufferedWriter(new FileWriter(file))) {
      bw.write("# deltaG probability\n");
      for (int i = 0; i < points.length; i++) {
        bw.write(format("%16.8f %22.14e\n", points[i], posterior[i]));
      }
    }
    logger.info(format(" Wrote the Crooks-Bayes posterior to %s", file.getPath()));
  }
}
