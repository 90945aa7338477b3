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

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static cbx.utilities.Constants.NS2SEC;
import static java.lang.String.format;
import static java.util.Arrays.copyOf;
import static java.util.Arrays.fill;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * The CrooksBayesEstimator class implements sequential Bayesian estimation of a free energy
 * difference from pairs of forward and backward non-equilibrium work values.
 *
 * <p>Starting from a flat prior over a {@link HypothesisGrid}, each work pair contributes the
 * likelihood of {@link CrooksLikelihood}; the posterior is updated, renormalized, and its mean and
 * standard deviation are recorded. The posterior mean is the estimate that minimizes the mean
 * squared error and the standard deviation is the matching uncertainty.
 *
 * <p>Pairs are absorbed strictly in order: each update depends on the posterior left by the
 * previous pair. The final posterior does not depend on the order, but the trace does.
 *
 * <p>Literature reference: P. Maragakis, F. Ritort, C. Bustamante, M. Karplus and G. E. Crooks,
 * "Bayesian estimates of free energies from nonequilibrium work data in the presence of
 * instrument noise", Journal of Chemical Physics, 129, 024102 (2008)
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CrooksBayesEstimator implements StatisticalEstimator {

  private static final Logger logger = Logger.getLogger(CrooksBayesEstimator.class.getName());

  /**
   * Free energy hypotheses.
   */
  private final HypothesisGrid grid;
  /**
   * Per-sample likelihood.
   */
  private final CrooksLikelihood crooksLikelihood;
  /**
   * Current posterior at each grid point. Flat (all ones) until the first sample is absorbed.
   */
  private final double[] posterior;
  /**
   * Posterior summary after each absorbed sample.
   */
  private final List<PosteriorSummary> trace = new ArrayList<>();
  /**
   * Flag to indicate estimation should stop before the next sample.
   */
  private volatile boolean terminate = false;

  /**
   * Constructs an estimator with a flat prior.
   *
   * @param grid The free energy hypotheses.
   * @param beta The inverse temperature in inverse work units.
   * @throws DegenerateLikelihoodException If beta is not finite.
   */
  public CrooksBayesEstimator(HypothesisGrid grid, double beta) {
    this.grid = grid;
    this.crooksLikelihood = new CrooksLikelihood(grid, beta);
    posterior = new double[grid.size()];
    fill(posterior, 1.0);
  }

  /**
   * Estimate the free energy difference using the default hypothesis step.
   *
   * @param workForwards  Work values of the forward protocol.
   * @param workBackwards Work values of the backward protocol.
   * @param beta          The inverse temperature.
   * @param deltaGMin     Smallest free energy difference considered.
   * @param deltaGMax     Largest free energy difference considered.
   * @return The result of absorbing every work pair.
   */
  public static CrooksBayesResult estimate(double[] workForwards, double[] workBackwards,
                                           double beta, double deltaGMin, double deltaGMax) {
    return estimate(workForwards, workBackwards, beta, deltaGMin, deltaGMax, HypothesisGrid.DEFAULT_STEP);
  }

  /**
   * Estimate the free energy difference.
   *
   * @param workForwards  Work values of the forward protocol.
   * @param workBackwards Work values of the backward protocol.
   * @param beta          The inverse temperature.
   * @param deltaGMin     Smallest free energy difference considered.
   * @param deltaGMax     Largest free energy difference considered.
   * @param step          Step between hypotheses.
   * @return The result of absorbing every work pair.
   * @throws SampleLengthMismatchException If the work arrays differ in length or are empty.
   * @throws InvalidRangeException         If the hypothesis range is unusable.
   * @throws DegenerateLikelihoodException If a work pair cannot be normalized over the range.
   */
  public static CrooksBayesResult estimate(double[] workForwards, double[] workBackwards,
                                           double beta, double deltaGMin, double deltaGMax, double step) {
    checkSampleLengths(workForwards, workBackwards);
    HypothesisGrid grid = new HypothesisGrid(deltaGMin, deltaGMax, step);
    CrooksBayesEstimator estimator = new CrooksBayesEstimator(grid, beta);
    return estimator.addSamples(workForwards, workBackwards);
  }

  /**
   * Absorb a sequence of work pairs, in order.
   *
   * @param workForwards  Work values of the forward protocol.
   * @param workBackwards Work values of the backward protocol.
   * @return A snapshot of the estimator after the last absorbed pair.
   * @throws SampleLengthMismatchException If the work arrays differ in length or are empty; no
   *                                       pair is absorbed in that case.
   */
  public CrooksBayesResult addSamples(double[] workForwards, double[] workBackwards) {
    checkSampleLengths(workForwards, workBackwards);
    int nPairs = workForwards.length;
    logger.info(format("\n Crooks-Bayes estimation of %d work pairs at beta %8.4f", nPairs, getBeta()));
    logger.info(grid.toString());

    boolean terminated = false;
    long time = -System.nanoTime();
    try {
      for (int i = 0; i < nPairs; i++) {
        // Check for a termination request.
        if (terminate) {
          logger.info(format("\n Terminating after %d of %d work pairs\n", i, nPairs));
          terminated = true;
          break;
        }
        addSample(workForwards[i], workBackwards[i]);
      }
    } finally {
      terminate = false;
    }
    time += System.nanoTime();

    logger.fine(format(" Crooks-Bayes estimation complete: %7.4f sec", time * NS2SEC));
    return getResult(terminated);
  }

  /**
   * Absorb one work pair into the posterior.
   *
   * @param workForward  Work of the forward protocol.
   * @param workBackward Work of the backward protocol.
   * @return The posterior summary after this pair.
   * @throws DegenerateLikelihoodException If the likelihood or the updated posterior cannot be normalized.
   */
  public PosteriorSummary addSample(double workForward, double workBackward) {
    double[] likelihood = crooksLikelihood.likelihood(workForward, workBackward);

    int n = posterior.length;
    double[] updated = new double[n];
    for (int i = 0; i < n; i++) {
      updated[i] = likelihood[i] * posterior[i];
    }
    double norm = grid.integrate(updated);
    if (!(norm > 0.0) || !Double.isFinite(norm)) {
      throw new DegenerateLikelihoodException(
          format(" The posterior after work pair %d (%12.6f, %12.6f) integrates to %s.",
              trace.size() + 1, workForward, workBackward, norm));
    }
    for (int i = 0; i < n; i++) {
      posterior[i] = updated[i] / norm;
    }

    double mean = grid.firstMoment(posterior);
    // Cancellation can leave a tiny negative variance once the posterior has collapsed.
    double variance = max(0.0, grid.secondMoment(posterior) - mean * mean);
    PosteriorSummary summary = new PosteriorSummary(trace.size() + 1, mean, sqrt(variance));
    trace.add(summary);
    logger.fine(summary.toString());
    return summary;
  }

  /**
   * Request that estimation stop before the next work pair. Pairs already absorbed are kept.
   */
  public void terminate() {
    terminate = true;
  }

  /**
   * A snapshot of the current state of the estimator.
   *
   * @return The current result.
   */
  public CrooksBayesResult getResult() {
    return getResult(false);
  }

  private CrooksBayesResult getResult(boolean terminated) {
    return new CrooksBayesResult(grid, posterior, trace, terminated);
  }

  /**
   * Returns a copy of the current posterior. Before any pair is absorbed this is the unnormalized
   * flat prior (all ones).
   *
   * @return The posterior at each grid point.
   */
  public double[] getPosterior() {
    return copyOf(posterior, posterior.length);
  }

  public HypothesisGrid getGrid() {
    return grid;
  }

  public double getBeta() {
    return crooksLikelihood.getBeta();
  }

  /**
   * {@inheritDoc}
   *
   * <p>NaN until a pair is absorbed.
   */
  @Override
  public double getFreeEnergyDifference() {
    return trace.isEmpty() ? Double.NaN : trace.get(trace.size() - 1).mean;
  }

  /**
   * {@inheritDoc}
   *
   * <p>NaN until a pair is absorbed.
   */
  @Override
  public double getFEDifferenceUncertainty() {
    return trace.isEmpty() ? Double.NaN : trace.get(trace.size() - 1).sd;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public int getNumberOfSamples() {
    return trace.size();
  }

  /**
   * Check that forward and backward work values pair up.
   *
   * @param workForwards  Work values of the forward protocol.
   * @param workBackwards Work values of the backward protocol.
   * @throws SampleLengthMismatchException If the lengths differ or no pair is given.
   */
  static void checkSampleLengths(double[] workForwards, double[] workBackwards) {
    int nF = workForwards.length;
    int nB = workBackwards.length;
    if (nF != nB) {
      throw new SampleLengthMismatchException(
          format(" The number of forward work values (%d) must equal the number of backward work values (%d).", nF, nB), nF, nB);
    }
    if (nF == 0) {
      throw new SampleLengthMismatchException(" At least one forward/backward work pair is required.", nF, nB);
    }
  }
}
