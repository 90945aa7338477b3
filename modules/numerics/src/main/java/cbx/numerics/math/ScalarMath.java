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
package cbx.numerics.math;

import static org.apache.commons.math3.util.FastMath.exp;
import static org.apache.commons.math3.util.FastMath.log1p;

/**
 * The ScalarMath class is a simple math library that operates on single variables
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ScalarMath {

  private ScalarMath() {
    // Prevent instantiation.
  }

  /**
   * The Fermi (acceptance) function 1 / (1 + exp(x)), which decreases from 1 to 0 as x increases.
   *
   * <p>For x &gt; 0 the equivalent form exp(-x) / (1 + exp(-x)) is used so that exp never
   * overflows: very negative x saturates to 1 and very positive x to 0, and no finite input
   * produces NaN.
   *
   * @param x Input.
   * @return Returns 1.0 / (1.0 + exp(x)).
   */
  public static double fermiFunction(double x) {
    if (x > 0.0) {
      double e = exp(-x);
      return e / (1.0 + e);
    }
    return 1.0 / (1.0 + exp(x));
  }

  /**
   * Elementwise Fermi function.
   *
   * @param x Input values.
   * @return A new array with 1.0 / (1.0 + exp(x[i])).
   */
  public static double[] fermiFunction(double[] x) {
    int n = x.length;
    double[] ret = new double[n];
    for (int i = 0; i < n; i++) {
      ret[i] = fermiFunction(x[i]);
    }
    return ret;
  }

  /**
   * Natural logarithm of the Fermi function, -log(1 + exp(x)), without overflow.
   *
   * @param x Input.
   * @return Returns -log(1.0 + exp(x)).
   */
  public static double logFermiFunction(double x) {
    if (x > 0.0) {
      return -x - log1p(exp(-x));
    }
    return -log1p(exp(x));
  }
}
