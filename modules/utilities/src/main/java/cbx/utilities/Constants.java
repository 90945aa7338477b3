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

/**
 * Library class containing physical constants and unit conversions.
 *
 * @author Jacob M. Litman
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Constants {

  // SI units: kg, m, s, C, K, mol, lm
  // Work and free energy values are typically kcal/mol; temperatures are in Kelvin.

  /** Boltzmann's constant in J/K, defining the Kelvin. <code>BOLTZMANN_SI=1.380649E-23d</code> */
  public static final double BOLTZMANN_SI = 1.380649E-23d;
  /** Avogadro's number, defining the mol. <code>AVOGADRO=6.02214076E23d</code> */
  public static final double AVOGADRO = 6.02214076E23d;
  /** Constant <code>KCAL_TO_KJ=4.184</code> */
  public static final double KCAL_TO_KJ = 4.184;
  /** Constant <code>KJ_TO_KCAL=1.0 / KCAL_TO_KJ</code> */
  public static final double KJ_TO_KCAL = 1.0 / KCAL_TO_KJ;
  /**
   * Ideal gas constant in kcal/(mol*K) <code>R = BOLTZMANN_SI * AVOGADRO * 0.001 * KJ_TO_KCAL
   * </code>
   */
  public static final double R = BOLTZMANN_SI * AVOGADRO * 0.001 * KJ_TO_KCAL;
  /** Convert nanoseconds to seconds. <code>NS2SEC=1e-9</code> */
  public static final double NS2SEC = 1e-9;
  /** Room temperature ~= 298.15 Kelvins. <code>ROOM_TEMPERATURE=298.15</code> */
  public static final double ROOM_TEMPERATURE = 298.15;

  private Constants() {
    // Prevent instantiation.
  }

  /**
   * Inverse temperature 1 / (R * T) in mol/kcal, for work values expressed in kcal/mol.
   *
   * @param temperature Temperature in Kelvin.
   * @return The inverse temperature beta.
   */
  public static double inverseTemperature(double temperature) {
    if (!(temperature > 0.0) || Double.isInfinite(temperature)) {
      throw new IllegalArgumentException(
          String.format(" The temperature (%s K) must be positive and finite.", temperature));
    }
    return 1.0 / (R * temperature);
  }
}
