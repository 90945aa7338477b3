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

import static cbx.numerics.math.ScalarMath.fermiFunction;
import static java.lang.String.format;

/**
 * The CrooksLikelihood evaluates the likelihood of one forward/backward pair of non-equilibrium
 * work values for every free energy difference of a hypothesis grid.
 *
 * <p>From the Crooks fluctuation theorem, the probability that a work value W came from the
 * forward (rather than the backward) protocol given a free energy difference dG is the Fermi
 * function of beta * (W - dG). For one forward work Wf and one backward work Wb:
 *
 * <p>L(dG) = f(beta * (Wf - dG)) * f(beta * (Wb + dG)), with f(x) = 1 / (1 + exp(x)).
 *
 * <p>Literature reference: P. Maragakis, F. Ritort, C. Bustamante, M. Karplus and G. E. Crooks,
 * "Bayesian estimates of free energies from nonequilibrium work data in the presence of
 * instrument noise", Journal of Chemical Physics, 129, 024102 (2008)
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CrooksLikelihood {

  private final HypothesisGrid grid;
  private final double beta;

  /**
   * Constructor.
   *
   * @param grid The free energy hypotheses.
   * @param beta The inverse temperature 1 / kT in inverse work units.
   * @throws DegenerateLikelihoodException If beta is not finite.
   */
  public CrooksLikelihood(HypothesisGrid grid, double beta) {
    if (!Double.isFinite(beta)) {
      throw new DegenerateLikelihoodException(format(" The inverse temperature beta (%s) must be finite.", beta));
    }
    this.grid = grid;
    this.beta = beta;
  }

  public HypothesisGrid getGrid() {
    return grid;
  }

  public double getBeta() {
    return beta;
  }

  /**
   * Unnormalized likelihood of a work pair at every hypothesis.
   *
   * @param workForward  Work of the forward protocol.
   * @param workBackward Work of the backward protocol.
   * @return The product of the forward and backward Fermi functions at each grid point.
   */
  public double[] rawLikelihood(double workForward, double workBackward) {
    int n = grid.size();
    double[] likelihood = new double[n];
    for (int i = 0; i < n; i++) {
      double dG = grid.getPoint(i);
      double exponentF = beta * (workForward - dG);
      double exponentB = beta * (workBackward + dG);
      likelihood[i] = fermiFunction(exponentF) * fermiFunction(exponentB);
    }
    return likelihood;
  }

  /**
   * Likelihood of a work pair at every hypothesis, scaled to integrate to one over the grid. The
   * scaling keeps magnitudes comparable from sample to sample.
   *
   * @param workForward  Work of the forward protocol.
   * @param workBackward Work of the backward protocol.
   * @return The normalized likelihood at each grid point.
   * @throws DegenerateLikelihoodException If the likelihood integrates to zero or a non-finite value.
   */
  public double[] likelihood(double workForward, double workBackward) {
    double[] likelihood = rawLikelihood(workForward, workBackward);
    double norm = grid.integrate(likelihood);
    if (!(norm > 0.0) || !Double.isFinite(norm)) {
      throw new DegenerateLikelihoodException(
          format(" The likelihood of work pair (%12.6f, %12.6f) integrates to %s over [%9.4f, %9.4f] at beta %9.4f.",
              workForward, workBackward, norm, grid.getLowerBound(), grid.getUpperBound(), beta));
    }
    for (int i = 0; i < likelihood.length; i++) {
      likelihood[i] /= norm;
    }
    return likelihood;
  }
}
