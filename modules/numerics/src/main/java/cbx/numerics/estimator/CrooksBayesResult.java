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

import java.util.Collections;
import java.util.List;

import static java.util.Arrays.copyOf;

/**
 * The CrooksBayesResult is a snapshot of a Crooks-Bayes run: the final estimate, the hypothesis
 * grid, the posterior over it, and the per-sample trace of posterior means and standard deviations.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CrooksBayesResult {

  private final HypothesisGrid grid;
  private final double[] posterior;
  private final List<PosteriorSummary> trace;
  private final boolean terminated;

  /**
   * Constructor.
   *
   * @param grid       The hypothesis grid.
   * @param posterior  The posterior at each grid point (copied).
   * @param trace      Summary after each absorbed sample, in input order.
   * @param terminated Whether the run stopped early on a termination request.
   */
  public CrooksBayesResult(HypothesisGrid grid, double[] posterior, List<PosteriorSummary> trace, boolean terminated) {
    this.grid = grid;
    this.posterior = copyOf(posterior, posterior.length);
    this.trace = List.copyOf(trace);
    this.terminated = terminated;
  }

  /**
   * Posterior mean after the last absorbed sample.
   *
   * @return The final free energy difference estimate, or NaN if no sample was absorbed.
   */
  public double getFinalMean() {
    return trace.isEmpty() ? Double.NaN : trace.get(trace.size() - 1).mean;
  }

  /**
   * Posterior standard deviation after the last absorbed sample.
   *
   * @return The final uncertainty, or NaN if no sample was absorbed.
   */
  public double getFinalStdDev() {
    return trace.isEmpty() ? Double.NaN : trace.get(trace.size() - 1).sd;
  }

  public HypothesisGrid getGrid() {
    return grid;
  }

  /**
   * Returns a copy of the grid points.
   *
   * @return The free energy hypotheses.
   */
  public double[] getGridPoints() {
    return grid.getPoints();
  }

  /**
   * Returns a copy of the posterior.
   *
   * @return The posterior probability density at each grid point.
   */
  public double[] getPosterior() {
    return copyOf(posterior, posterior.length);
  }

  /**
   * Posterior mean after each absorbed sample.
   *
   * @return The mean trace.
   */
  public double[] getMeanTrace() {
    return trace.stream().mapToDouble(s -> s.mean).toArray();
  }

  /**
   * Posterior standard deviation after each absorbed sample.
   *
   * @return The standard deviation trace.
   */
  public double[] getStdDevTrace() {
    return trace.stream().mapToDouble(s -> s.sd).toArray();
  }

  /**
   * The per-sample summaries, in input order.
   *
   * @return An unmodifiable list.
   */
  public List<PosteriorSummary> getTrace() {
    return Collections.unmodifiableList(trace);
  }

  public int getNumberOfSamples() {
    return trace.size();
  }

  public boolean isTerminated() {
    return terminated;
  }
}
