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

import cbx.algorithms.cli.CrooksBayesOptions;
import cbx.algorithms.misc.WorkFileReader;
import cbx.numerics.estimator.CrooksBayesEstimator;
import cbx.numerics.estimator.CrooksBayesReporter;
import cbx.numerics.estimator.CrooksBayesResult;
import cbx.numerics.estimator.DegenerateLikelihoodException;
import cbx.numerics.estimator.HypothesisGrid;
import cbx.numerics.estimator.InvalidRangeException;
import cbx.numerics.estimator.NonEquilibriumBAR;
import cbx.numerics.estimator.SampleLengthMismatchException;
import cbx.utilities.CBXCommand;
import cbx.utilities.CBXContext;
import org.apache.commons.configuration2.CompositeConfiguration;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.util.List;

import static cbx.utilities.ConfigurationLoader.loadProperties;
import static java.lang.String.format;

/**
 * The CrooksBayes command estimates a free energy difference from forward and backward
 * non-equilibrium work values by sequential Bayesian updates of a posterior over a grid of
 * hypotheses.
 * <br>
 * Usage:
 * <br>
 * cbx CrooksBayes [options] &lt;forwardWorks&gt; &lt;backwardWorks&gt;
 */
@Command(description = " Sequential Bayesian estimate of a free energy difference from non-equilibrium work.", name = "CrooksBayes")
public class CrooksBayes extends CBXCommand {

  @Mixin
  private CrooksBayesOptions crooksBayesOptions;

  /**
   * --re or --regex Only read work values from lines that match a regular expression.
   */
  @Option(names = {"--re", "--regex"}, paramLabel = "regex",
      description = "Only read the last column of lines that match this regular expression.")
  private String regex = null;

  /**
   * --reFile or --fileSelectionRegex Read files that match a regular expression from directories.
   */
  @Option(names = {"--reFile", "--fileSelectionRegex"}, paramLabel = "work.log", defaultValue = "work.log",
      description = "When a path is a directory, read the files that match this regular expression.")
  private String reFile;

  /**
   * --trace Write the posterior mean and standard deviation after each work pair.
   */
  @Option(names = {"--trace"}, paramLabel = "file",
      description = "Write the posterior mean and standard deviation after each work pair to this file.")
  private String traceFilename = null;

  /**
   * --posterior Write the final posterior.
   */
  @Option(names = {"--posterior"}, paramLabel = "file",
      description = "Write the final posterior over the free energy hypotheses to this file.")
  private String posteriorFilename = null;

  /**
   * --noBAR Skip the Bennett Acceptance Ratio cross-check.
   */
  @Option(names = {"--noBAR"}, paramLabel = "false", defaultValue = "false",
      description = "Skip the Bennett Acceptance Ratio estimate from the same work values.")
  private boolean noBAR;

  /**
   * The forward and backward work files (or directories).
   */
  @Parameters(arity = "2", paramLabel = "works",
      description = "Forward work values, then backward work values (files, or directories of work.log files).")
  private List<String> filenames = null;

  private volatile CrooksBayesEstimator estimator;
  private volatile boolean terminate = false;
  private CrooksBayesResult result;
  private NonEquilibriumBAR bar;

  /**
   * CrooksBayes Constructor.
   */
  public CrooksBayes() {
    super();
  }

  /**
   * CrooksBayes Constructor.
   *
   * @param binding The context to use.
   */
  public CrooksBayes(CBXContext binding) {
    super(binding);
  }

  /**
   * CrooksBayes constructor that sets the command line arguments.
   *
   * @param args Command line arguments.
   */
  public CrooksBayes(String[] args) {
    super(args);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public CrooksBayes run() {
    exitStatus = 0;
    if (!init()) {
      return this;
    }

    File forwardFile = new File(filenames.get(0));
    File backwardFile = new File(filenames.get(1));
    CompositeConfiguration properties = loadProperties(forwardFile);

    WorkFileReader reader = new WorkFileReader(regex, reFile);
    double[] workForwards = reader.readWorks(forwardFile);
    double[] workBackwards = reader.readWorks(backwardFile);
    logger.info(format(" Forward work values:  %6d (%s)", workForwards.length, forwardFile.getPath()));
    logger.info(format(" Backward work values: %6d (%s)", workBackwards.length, backwardFile.getPath()));

    double beta = crooksBayesOptions.getBeta(properties);
    try {
      HypothesisGrid grid = crooksBayesOptions.createGrid(properties);
      estimator = new CrooksBayesEstimator(grid, beta);
      // Pass on a termination request made while the work values were read.
      if (terminate) {
        estimator.terminate();
      }
      terminate = false;
      result = estimator.addSamples(workForwards, workBackwards);
    } catch (SampleLengthMismatchException | InvalidRangeException | DegenerateLikelihoodException e) {
      logger.severe(format(" Crooks-Bayes estimation failed:\n%s", e.getMessage()));
      exitStatus = 1;
      return this;
    }

    CrooksBayesReporter reporter = new CrooksBayesReporter(result);
    reporter.report();

    if (!noBAR) {
      try {
        bar = new NonEquilibriumBAR(workForwards, workBackwards, beta);
        logger.info(format(" BAR Free Energy Difference:          %12.6f +/- %10.6f (%d iterations)",
            bar.getFreeEnergyDifference(), bar.getFEDifferenceUncertainty(), bar.getIterations()));
      } catch (IllegalArgumentException e) {
        logger.warning(format(" BAR estimate skipped:\n%s", e.getMessage()));
      }
    }

    if (traceFilename != null) {
      try {
        reporter.writeTrace(new File(traceFilename));
      } catch (IOException e) {
        logger.warning(format(" Exception writing the trace to %s: %s", traceFilename, e));
      }
    }
    if (posteriorFilename != null) {
      try {
        reporter.writePosterior(new File(posteriorFilename));
      } catch (IOException e) {
        logger.warning(format(" Exception writing the posterior to %s: %s", posteriorFilename, e));
      }
    }

    return this;
  }

  /**
   * Request that a running estimate stop before its next work pair. A request made before the
   * estimator exists is applied once it is created.
   */
  public void terminate() {
    terminate = true;
    CrooksBayesEstimator current = estimator;
    if (current != null) {
      current.terminate();
    }
  }

  /**
   * The Crooks-Bayes result, or null if the command did not complete.
   *
   * @return The result.
   */
  public CrooksBayesResult getResult() {
    return result;
  }

  /**
   * The BAR cross-check, or null if it was skipped or failed.
   *
   * @return The BAR estimator.
   */
  public NonEquilibriumBAR getBAR() {
    return bar;
  }
}
