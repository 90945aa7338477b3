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

import static java.lang.String.format;

/**
 * The PosteriorSummary holds the posterior mean and standard deviation of the free energy
 * difference just after a sample has been absorbed.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PosteriorSummary {

  /**
   * One-based index of the sample that produced this posterior.
   */
  public final int sample;
  /**
   * Posterior mean, the estimate that minimizes the mean squared error.
   */
  public final double mean;
  /**
   * Posterior standard deviation.
   */
  public final double sd;

  public PosteriorSummary(int sample, double mean, double sd) {
    this.sample = sample;
    this.mean = mean;
    this.sd = sd;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return format(" %8d %12.6f +/- %10.6f", sample, mean, sd);
  }
}
