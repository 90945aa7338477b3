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
package cbx.utilities;

import org.junit.Test;

import static cbx.utilities.Constants.R;
import static cbx.utilities.Constants.ROOM_TEMPERATURE;
import static cbx.utilities.Constants.inverseTemperature;
import static org.junit.Assert.assertEquals;

/**
 * Tests physical constants and the inverse temperature.
 */
public class ConstantsTest {

  @Test
  public void testGasConstant() {
    assertEquals(1.987204e-3, R, 1.0e-9);
  }

  @Test
  public void testInverseTemperature() {
    // kT at room temperature is ~0.5925 kcal/mol.
    assertEquals(1.0 / 0.592487, inverseTemperature(ROOM_TEMPERATURE), 1.0e-4);
    assertEquals(1.0, inverseTemperature(1.0 / R), 1.0e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroTemperature() {
    inverseTemperature(0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNaNTemperature() {
    inverseTemperature(Double.NaN);
  }
}
