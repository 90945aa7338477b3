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

import cbx.numerics.integrate.Integrate1DNumeric;

import static java.lang.String.format;
import static java.util.Arrays.copyOf;
import static org.apache.commons.math3.util.FastMath.floor;

/**
 * The HypothesisGrid is the ordered set of free energy differences considered by the Crooks-Bayes
 * estimator. It evenly partitions [lowerBound, upperBound] into floor((upper - lower) / step)
 * points, with the first point at the lower bound and the last point at the upper bound.
 * <p>
 * Instances are immutable and may be shared.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class HypothesisGrid {

  /**
   * Default step between hypotheses (kcal/mol).
   */
  public static final double DEFAULT_STEP = 0.1;

  /**
   * Relative slack when counting points, so that a range that is an exact multiple of the step in
   * decimal does not lose its last point to rounding.
   */
  private static final double COUNT_TOLERANCE = 1.0e-9;

  private final double lowerBound;
  private final double upperBound;
  private final double step;
  private final double[] x;
  private final double[] x2;

  /**
   * Construct a hypothesis grid using the default step.
   *
   * @param lowerBound Smallest free energy difference considered.
   * @param upperBound Largest free energy difference considered.
   */
  public HypothesisGrid(double lowerBound, double upperBound) {
    this(lowerBound, upperBound, DEFAULT_STEP);
  }

  /**
   * Construct a hypothesis grid.
   *
   * @param lowerBound Smallest free energy difference considered.
   * @param upperBound Largest free energy difference considered.
   * @param step       Requested spacing, which sets the number of points.
   * @throws InvalidRangeException If the bounds are not ordered and finite, the step is not
   *                               positive and finite, or fewer than 2 points result.
   */
  public HypothesisGrid(double lowerBound, double upperBound, double step) {
    if (!Double.isFinite(lowerBound) || !Double.isFinite(upperBound)) {
      throw new InvalidRangeException(format(" The hypothesis bounds must be finite (%s, %s).", lowerBound, upperBound));
    }
    if (upperBound <= lowerBound) {
      throw new InvalidRangeException(
          format(" The hypothesis upper bound (%8.4f) must be greater than the lower bound (%8.4f).", upperBound, lowerBound));
    }
    if (!(step > 0.0) || !Double.isFinite(step)) {
      throw new InvalidRangeException(format(" The hypothesis step (%s) must be positive and finite.", step));
    }

    double ratio = (upperBound - lowerBound) / step;
    double count = floor(ratio + ratio * COUNT_TOLERANCE);
    if (count < 2) {
      throw new InvalidRangeException(
          format(" The step %8.4f over [%8.4f, %8.4f] gives %d point(s); at least 2 are required.",
              step, lowerBound, upperBound, (int) count));
    }
    if (count > Integer.MAX_VALUE - 8) {
      throw new InvalidRangeException(format(" The step %s over [%s, %s] gives too many points.", step, lowerBound, upperBound));
    }

    this.lowerBound = lowerBound;
    this.upperBound = upperBound;
    this.step = step;

    int n = (int) count;
    x = new double[n];
    x2 = new double[n];
    double spacing = (upperBound - lowerBound) / (n - 1);
    for (int i = 0; i < n; i++) {
      x[i] = lowerBound + i * spacing;
    }
    // The last point is the upper bound exactly.
    x[n - 1] = upperBound;
    for (int i = 0; i < n; i++) {
      x2[i] = x[i] * x[i];
    }
  }

  /**
   * Number of hypotheses.
   *
   * @return The number of grid points.
   */
  public int size() {
    return x.length;
  }

  /**
   * The hypothesis at index i.
   *
   * @param i Index.
   * @return The free energy difference at that index.
   */
  public double getPoint(int i) {
    return x[i];
  }

  /**
   * Returns a copy of the hypotheses.
   *
   * @return An array of grid points.
   */
  public double[] getPoints() {
    return copyOf(x, x.length);
  }

  public double getLowerBound() {
    return lowerBound;
  }

  public double getUpperBound() {
    return upperBound;
  }

  /**
   * The step requested at construction.
   *
   * @return The requested step.
   */
  public double getStep() {
    return step;
  }

  /**
   * The actual separation between adjacent points, which differs slightly from the requested step
   * when the range is not a multiple of it.
   *
   * @return The grid spacing.
   */
  public double getSpacing() {
    return (upperBound - lowerBound) / (x.length - 1);
  }

  /**
   * Trapezoidal integral of a function sampled on this grid.
   *
   * @param fX Values of f at each grid point.
   * @return The integral over the grid.
   */
  public double integrate(double[] fX) {
    return Integrate1DNumeric.trapezoidal(x, fX);
  }

  /**
   * First moment of a density sampled on this grid: the integral of x * p(x).
   *
   * @param density Values of p at each grid point.
   * @return The first moment.
   */
  public double firstMoment(double[] density) {
    return Integrate1DNumeric.trapezoidal(x, x, density);
  }

  /**
   * Second moment of a density sampled on this grid: the integral of x^2 * p(x).
   *
   * @param density Values of p at each grid point.
   * @return The second moment.
   */
  public double secondMoment(double[] density) {
    return Integrate1DNumeric.trapezoidal(x, x2, density);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return format(" Hypothesis grid of %d points from %9.4f to %9.4f (spacing %8.5f)",
        x.length, lowerBound, upperBound, getSpacing());
  }
}
