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
package cbx.algorithms.cli;

import cbx.numerics.estimator.HypothesisGrid;
import cbx.numerics.estimator.InvalidRangeException;
import org.apache.commons.configuration2.CompositeConfiguration;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Option;

import java.util.logging.Logger;

import static cbx.utilities.Constants.ROOM_TEMPERATURE;
import static cbx.utilities.Constants.inverseTemperature;
import static java.lang.String.format;

/**
 * Represents command line options for commands that run a Crooks-Bayes estimate.
 * <p>
 * Each option left unset falls back to a property (e.g. crooks-bayes-min), so that a range can be
 * kept next to the work files in a properties file.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CrooksBayesOptions {

  private static final Logger logger = Logger.getLogger(CrooksBayesOptions.class.getName());

  /**
   * Property giving the smallest free energy difference considered.
   */
  public static final String MIN_PROPERTY = "crooks-bayes-min";
  /**
   * Property giving the largest free energy difference considered.
   */
  public static final String MAX_PROPERTY = "crooks-bayes-max";
  /**
   * Property giving the step between hypotheses.
   */
  public static final String STEP_PROPERTY = "crooks-bayes-step";
  /**
   * Property giving the temperature used when no inverse temperature is given.
   */
  public static final String TEMPERATURE_PROPERTY = "temperature";

  /**
   * The ArgGroup keeps the CrooksBayesOptions together when printing help.
   */
  @ArgGroup(heading = "%n Crooks-Bayes Options%n", validate = false)
  public CrooksBayesOptionGroup group = new CrooksBayesOptionGroup();

  /**
   * Create the hypothesis grid from the options, falling back to properties.
   *
   * @param properties The layered configuration.
   * @return The hypothesis grid.
   * @throws InvalidRangeException If a bound is missing or the range is unusable.
   */
  public HypothesisGrid createGrid(CompositeConfiguration properties) {
    double min = resolve(group.min, properties, MIN_PROPERTY, Double.NaN);
    double max = resolve(group.max, properties, MAX_PROPERTY, Double.NaN);
    double step = resolve(group.step, properties, STEP_PROPERTY, HypothesisGrid.DEFAULT_STEP);
    if (Double.isNaN(min)) {
      throw new InvalidRangeException(format(" A lower bound is required (--min or the %s property).", MIN_PROPERTY));
    }
    if (Double.isNaN(max)) {
      throw new InvalidRangeException(format(" An upper bound is required (--max or the %s property).", MAX_PROPERTY));
    }
    return new HypothesisGrid(min, max, step);
  }

  /**
   * The inverse temperature: --beta if given, otherwise 1 / (R T) from --temperature, the
   * temperature property, or room temperature.
   *
   * @param properties The layered configuration.
   * @return The inverse temperature.
   * @throws IllegalArgumentException If the temperature is not positive.
   */
  public double getBeta(CompositeConfiguration properties) {
    if (group.beta != null) {
      return group.beta;
    }
    double temperature = resolve(group.temperature, properties, TEMPERATURE_PROPERTY, ROOM_TEMPERATURE);
    double beta = inverseTemperature(temperature);
    logger.info(format(" Inverse temperature %10.6f mol/kcal at %8.3f K", beta, temperature));
    return beta;
  }

  private static double resolve(Double option, CompositeConfiguration properties, String key, double defaultValue) {
    if (option != null) {
      return option;
    }
    return properties.getDouble(key, defaultValue);
  }

  /**
   * Collection of Crooks-Bayes Options.
   */
  public static class CrooksBayesOptionGroup {

    /**
     * --min Smallest free energy difference considered.
     */
    @Option(names = {"--min", "--deltaGMin"}, paramLabel = "dG",
        description = "Smallest free energy difference considered (default: property crooks-bayes-min).")
    public Double min = null;

    /**
     * --max Largest free energy difference considered.
     */
    @Option(names = {"--max", "--deltaGMax"}, paramLabel = "dG",
        description = "Largest free energy difference considered (default: property crooks-bayes-max).")
    public Double max = null;

    /**
     * --step Step between free energy hypotheses.
     */
    @Option(names = {"--step"}, paramLabel = "0.1",
        description = "Step between free energy hypotheses (default: property crooks-bayes-step or 0.1).")
    public Double step = null;

    /**
     * -b or --beta Inverse temperature in inverse work units.
     */
    @Option(names = {"-b", "--beta"}, paramLabel = "1/kT",
        description = "Inverse temperature in inverse work units; overrides the temperature.")
    public Double beta = null;

    /**
     * -t or --temperature Temperature in Kelvin, used with kcal/mol work values.
     */
    @Option(names = {"-t", "--temperature"}, paramLabel = "298.15",
        description = "Temperature (K) for work values in kcal/mol (default: property temperature or 298.15).")
    public Double temperature = null;
  }
}
