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

import java.util.logging.Logger;

import static cbx.numerics.estimator.CrooksBayesEstimator.checkSampleLengths;
import static cbx.numerics.math.ScalarMath.fermiFunction;
import static cbx.numerics.math.ScalarMath.logFermiFunction;
import static java.lang.String.format;
import static java.util.Arrays.copyOf;
import static java.util.Arrays.stream;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.exp;
import static org.apache.commons.math3.util.FastMath.log;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * The NonEquilibriumBAR class implements the Bennett Acceptance Ratio (BAR) estimate of a free
 * energy difference from equal numbers of forward and backward non-equilibrium work values.
 *
 * <p>The estimate c solves sum_i f(beta * (Wf_i - c)) = sum_i f(beta * (Wb_i + c)), with
 * f(x) = 1 / (1 + exp(x)). This is the maximum likelihood estimate for the same likelihood used by
 * the {@link CrooksBayesEstimator}, and serves as a cross-check of its posterior mean.
 *
 * <p>Literature References: C. H. Bennett, "Efficient Estimation of Free Energy Differences from
 * Monte Carlo Data", Journal of Computational Physics, 22, 245-268 (1976)
 *
 * <p>M. R. Shirts, E. Bair, G. Hooker and V. S. Pande, "Equilibrium Free Energies from
 * Nonequilibrium Measurements Using Maximum-Likelihood Methods", Physical Review Letters, 91,
 * 140601 (2003)
 *
 * @author Michael J. Schnieders
 * @author Jacob M. Litman
 * @since 1.0
 */
public class NonEquilibriumBAR implements StatisticalEstimator {

  private static final Logger logger = Logger.getLogger(NonEquilibriumBAR.class.getName());

  /**
   * Default BAR convergence tolerance.
   */
  public static final double DEFAULT_TOLERANCE = 1.0E-7;
  /**
   * Default maximum number of BAR iterations.
   */
  public static final int DEFAULT_MAX_BAR_ITERATIONS = 100;

  private final double[] workForwards;
  private final double[] workBackwards;
  private final double beta;
  private final double tolerance;
  private final int nIterations;
  /**
   * BAR free-energy difference estimate.
   */
  private double freeEnergyDifference;
  /**
   * BAR free-energy difference uncertainty.
   */
  private double freeEnergyDifferenceUncertainty;
  /**
   * Number of iterations used to converge.
   */
  private int iterations;

  /**
   * Constructs a BAR estimator and obtains a free energy estimate.
   *
   * @param workForwards  Work values of the forward protocol.
   * @param workBackwards Work values of the backward protocol.
   * @param beta          The inverse temperature.
   */
  public NonEquilibriumBAR(double[] workForwards, double[] workBackwards, double beta) {
    this(workForwards, workBackwards, beta, DEFAULT_TOLERANCE, DEFAULT_MAX_BAR_ITERATIONS);
  }

  /**
   * Constructs a BAR estimator and obtains a free energy estimate.
   *
   * @param workForwards  Work values of the forward protocol.
   * @param workBackwards Work values of the backward protocol.
   * @param beta          The inverse temperature.
   * @param tolerance     Convergence criterion for BAR iteration (work units).
   * @param nIterations   Maximum number of iterations for BAR.
   * @throws SampleLengthMismatchException If the work arrays differ in length or are empty.
   * @throws IllegalArgumentException      If beta is zero or not finite, or BAR does not converge.
   */
  public NonEquilibriumBAR(double[] workForwards, double[] workBackwards, double beta,
                           double tolerance, int nIterations) {
    checkSampleLengths(workForwards, workBackwards);
    if (!Double.isFinite(beta) || beta == 0.0) {
      throw new IllegalArgumentException(format(" BAR requires a finite, non-zero inverse temperature (%s).", beta));
    }
    this.workForwards = copyOf(workForwards, workForwards.length);
    this.workBackwards = copyOf(workBackwards, workBackwards.length);
    this.beta = beta;
    this.tolerance = tolerance;
    this.nIterations = nIterations;
    estimateDG();
  }

  /**
   * Self-consistent iteration: c += (1 / beta) * log(sum f(beta (Wb + c)) / sum f(beta (Wf - c))).
   * <p>
   * The sums are accumulated in log space so that extreme work values do not underflow.
   */
  private void estimateDG() {
    int len = workForwards.length;

    // Seed with the average of the forward and backward exponential averages.
    double forwardFEP = -logSumExp(workForwards, -beta, 0.0) / beta + log(len) / beta;
    double backwardFEP = logSumExp(workBackwards, -beta, 0.0) / beta - log(len) / beta;
    double c = 0.5 * (forwardFEP + backwardFEP);
    if (!Double.isFinite(c)) {
      c = 0.5 * (stream(workForwards).average().orElse(0.0) - stream(workBackwards).average().orElse(0.0));
    }
    logger.fine(format(" BAR Iteration   %2d: %12.4f", 0, c));

    double cold = c;
    int cycleCounter = 0;
    boolean converged = false;
    while (!converged) {
      double logSumF = logSumFermi(workForwards, -c);
      double logSumB = logSumFermi(workBackwards, c);
      c += (logSumB - logSumF) / beta;

      converged = (abs(c - cold) < tolerance);

      if (!converged && ++cycleCounter > nIterations) {
        throw new IllegalArgumentException(
            format(" BAR required too many iterations (%d) to converge! (%9.8f > %9.8f)", cycleCounter, abs(c - cold), tolerance));
      }
      logger.fine(format(" BAR Iteration   %2d: %12.4f", cycleCounter, c));
      cold = c;
    }
    iterations = cycleCounter;
    freeEnergyDifference = c;

    // Asymptotic BAR variance from the Fermi values at convergence.
    double[] fermi0 = new double[len];
    double[] fermi1 = new double[len];
    for (int i = 0; i < len; i++) {
      fermi0[i] = fermiFunction(beta * (workForwards[i] - c));
      fermi1[i] = fermiFunction(beta * (workBackwards[i] + c));
    }
    double variance = uncertaintyCalculation(fermi0, len) + uncertaintyCalculation(fermi1, len);
    freeEnergyDifferenceUncertainty = sqrt(max(0.0, variance)) / abs(beta);
  }

  /**
   * Log of sum_i f(beta * (w_i + shift)).
   */
  private double logSumFermi(double[] work, double shift) {
    int len = work.length;
    double[] logs = new double[len];
    double maxLog = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < len; i++) {
      logs[i] = logFermiFunction(beta * (work[i] + shift));
      maxLog = max(maxLog, logs[i]);
    }
    double sum = 0.0;
    for (double l : logs) {
      sum += exp(l - maxLog);
    }
    return maxLog + log(sum);
  }

  /**
   * Log of sum_i exp(scale * w_i + shift).
   */
  private static double logSumExp(double[] work, double scale, double shift) {
    double maxLog = Double.NEGATIVE_INFINITY;
    for (double w : work) {
      maxLog = max(maxLog, scale * w + shift);
    }
    double sum = 0.0;
    for (double w : work) {
      sum += exp(scale * w + shift - maxLog);
    }
    return maxLog + log(sum);
  }

  /**
   * Computes one half of the BAR variance.
   *
   * @param fermi Fermi values for one direction.
   * @param len   Number of values.
   * @return One half of BAR variance.
   */
  private static double uncertaintyCalculation(double[] fermi, int len) {
    double meanFermi = stream(fermi).sum() / len;
    double meanSqFermi = stream(fermi).map((double d) -> d * d).sum() / len;
    double sqMeanFermi = meanFermi * meanFermi;
    return ((meanSqFermi - sqMeanFermi) / len) / sqMeanFermi;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public double getFreeEnergyDifference() {
    return freeEnergyDifference;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public double getFEDifferenceUncertainty() {
    return freeEnergyDifferenceUncertainty;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public int getNumberOfSamples() {
    return workForwards.length;
  }

  /**
   * Number of self-consistent iterations needed to converge.
   *
   * @return The iteration count.
   */
  public int getIterations() {
    return iterations;
  }
}
