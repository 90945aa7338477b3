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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Tests construction of the free energy hypothesis grid.
 *
 * @author Michael J. Schnieders
 */
public class HypothesisGridTest extends CBXTest {

  private static final double TOLERANCE = 1.0e-12;

  @Test
  public void testDefaultGrid() {
    HypothesisGrid grid = new HypothesisGrid(-10.0, 10.0);
    assertEquals(200, grid.size());
    assertEquals(HypothesisGrid.DEFAULT_STEP, grid.getStep(), 0.0);
    assertEquals(-10.0, grid.getPoint(0), 0.0);
    assertEquals(10.0, grid.getPoint(grid.size() - 1), 0.0);
    assertEquals(20.0 / 199.0, grid.getSpacing(), TOLERANCE);

    double[] points = grid.getPoints();
    for (int i = 1; i < points.length; i++) {
      assertTrue(" Grid points must be strictly increasing.", points[i] > points[i - 1]);
    }
  }

  @Test
  public void testPointsAreCopied() {
    HypothesisGrid grid = new HypothesisGrid(0.0, 1.0, 0.25);
    double[] points = grid.getPoints();
    points[0] = 100.0;
    assertEquals(0.0, grid.getPoint(0), 0.0);
  }

  @Test
  public void testRangeNotAMultipleOfStep() {
    // floor(1.0 / 0.3) = 3 points evenly spanning [0, 1].
    HypothesisGrid grid = new HypothesisGrid(0.0, 1.0, 0.3);
    assertEquals(3, grid.size());
    assertEquals(0.5, grid.getPoint(1), TOLERANCE);
    assertEquals(1.0, grid.getPoint(2), 0.0);
  }

  @Test
  public void testMoments() {
    HypothesisGrid grid = new HypothesisGrid(0.0, 2.0, 0.5);
    double[] flat = new double[grid.size()];
    java.util.Arrays.fill(flat, 0.5);
    assertEquals(1.0, grid.integrate(flat), TOLERANCE);
    assertEquals(1.0, grid.firstMoment(flat), TOLERANCE);
    // Exact second moment is 4/3; the trapezoidal error is (b - a) h^2 f'' / 12 with f'' = 1.
    double h = grid.getSpacing();
    assertEquals(4.0 / 3.0 + 2.0 * h * h / 12.0, grid.secondMoment(flat), TOLERANCE);
  }

  @Test
  public void testInvalidRanges() {
    assertInvalid(1.0, 1.0, 0.1);
    assertInvalid(2.0, -2.0, 0.1);
    assertInvalid(0.0, 1.0, 0.0);
    assertInvalid(0.0, 1.0, -0.1);
    assertInvalid(0.0, 1.0, Double.NaN);
    assertInvalid(Double.NEGATIVE_INFINITY, 1.0, 0.1);
    // A single point cannot be integrated.
    assertInvalid(0.0, 0.15, 0.1);
    assertInvalid(0.0, 1.0, 5.0);
  }

  private static void assertInvalid(double min, double max, double step) {
    try {
      new HypothesisGrid(min, max, step);
      fail(String.format(" Expected an InvalidRangeException for [%s, %s] with step %s.", min, max, step));
    } catch (InvalidRangeException e) {
      // Expected.
    }
  }
}
