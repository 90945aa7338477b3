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
package cbx.numerics.integrate;

import static java.lang.String.format;

/**
 * Composite trapezoidal integration of sampled functions.
 * <p>
 * The x points only need to be ordered; the width of each trapezoid is taken from the pair of
 * points it spans, so non-uniform sampling is handled exactly.
 *
 * @author Claire O'Connell
 * @author Jacob M. Litman
 */
public class Integrate1DNumeric {

  private Integrate1DNumeric() {
    // Prevent instantiation.
  }

  /**
   * Numerically integrates f(x) using the composite trapezoidal rule.
   *
   * @param x  Points where f(x) is known.
   * @param fX Values of f(x).
   * @return Area of integral.
   * @throws IllegalArgumentException If the arrays differ in length or hold fewer than 2 points.
   */
  public static double trapezoidal(double[] x, double[] fX) {
    checkPoints(x, fX);
    int n = x.length;
    double area = 0.0;
    for (int i = 0; i < n - 1; i++) {
      area += 0.5 * (fX[i] + fX[i + 1]) * (x[i + 1] - x[i]);
    }
    return area;
  }

  /**
   * Numerically integrates the product w(x) * f(x) using the composite trapezoidal rule, without
   * allocating the product array.
   *
   * @param x  Points where f(x) is known.
   * @param wX Values of the weight w(x).
   * @param fX Values of f(x).
   * @return Area of integral.
   * @throws IllegalArgumentException If the arrays differ in length or hold fewer than 2 points.
   */
  public static double trapezoidal(double[] x, double[] wX, double[] fX) {
    checkPoints(x, fX);
    checkPoints(x, wX);
    int n = x.length;
    double area = 0.0;
    for (int i = 0; i < n - 1; i++) {
      area += 0.5 * (wX[i] * fX[i] + wX[i + 1] * fX[i + 1]) * (x[i + 1] - x[i]);
    }
    return area;
  }

  private static void checkPoints(double[] x, double[] fX) {
    if (x.length != fX.length) {
      throw new IllegalArgumentException(
          format(" The number of x points (%d) does not match the number of f(x) points (%d).", x.length, fX.length));
    }
    if (x.length < 2) {
      throw new IllegalArgumentException(format(" At least 2 points are required to integrate (%d).", x.length));
    }
  }
}
