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

import cbx.utilities.CBXTest;
import org.junit.Test;

import java.util.Random;

import static java.lang.String.format;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Tests the non-equilibrium BAR estimator and its agreement with the Crooks-Bayes posterior.
 */
public class NonEquilibriumBARTest extends CBXTest {

  @Test
  public void testIdenticalPairs() {
    double[] forwards = {5.0, 5.0, 5.0};
    double[] backwards = {-5.0, -5.0, -5.0};
    NonEquilibriumBAR bar = new NonEquilibriumBAR(forwards, backwards, 1.0);
    assertEquals(5.0, bar.getFreeEnergyDifference(), 1.0e-7);
    assertEquals(0.0, bar.getFEDifferenceUncertainty(), 1.0e-7);
    assertEquals(3, bar.getNumberOfSamples());
  }

  @Test
  public void testAgreesWithCrooksBayes() {
    double deltaG = -1.5;
    double sigma = 1.2;
    double beta = 1.0;
    double dissipation = 0.5 * beta * sigma * sigma;
    int n = 400;

    Random random = new Random(3L);
    double[] forwards = new double[n];
    double[] backwards = new double[n];
    for (int i = 0; i < n; i++) {
      forwards[i] = deltaG + dissipation + sigma * random.nextGaussian();
      backwards[i] = -deltaG + dissipation + sigma * random.nextGaussian();
    }

    NonEquilibriumBAR bar = new NonEquilibriumBAR(forwards, backwards, beta);
    CrooksBayesResult result = CrooksBayesEstimator.estimate(forwards, backwards, beta, -10.0, 10.0, 0.05);

    double barDG = bar.getFreeEnergyDifference();
    double barSD = bar.getFEDifferenceUncertainty();
    logger.info(format(" BAR %10.5f +/- %8.5f Crooks-Bayes %10.5f +/- %8.5f",
        barDG, barSD, result.getFinalMean(), result.getFinalStdDev()));

    assertEquals(result.getFinalMean(), barDG, 0.1);
    assertEquals(deltaG, barDG, Math.max(0.3, 5.0 * barSD));
    double ratio = barSD / result.getFinalStdDev();
    assertTrue(format(" Uncertainty ratio %8.4f", ratio), ratio > 0.5 && ratio < 2.0);
    assertTrue(bar.getIterations() <= NonEquilibriumBAR.DEFAULT_MAX_BAR_ITERATIONS);
  }

  @Test(expected = SampleLengthMismatchException.class)
  public void testLengthMismatch() {
    new NonEquilibriumBAR(new double[]{1.0, 2.0}, new double[]{1.0}, 1.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroBeta() {
    new NonEquilibriumBAR(new double[]{1.0, 2.0}, new double[]{-1.0, -2.0}, 0.0);
  }
}
