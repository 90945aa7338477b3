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

import java.io.File;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

import static java.lang.String.format;

/**
 * The ConfigurationLoader assembles the layered Crooks-Bayes X properties.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ConfigurationLoader {

  private static final Logger logger = Logger.getLogger(ConfigurationLoader.class.getName());

  /**
   * Environment variable naming a system wide property file.
   */
  public static final String CBX_PROPERTIES = "CBX_PROPERTIES";

  private ConfigurationLoader() {
    // Prevent instantiation.
  }

  /**
   * This method sets up configuration properties in the following precedence order:
   * <p>
   * 1.) JVM system properties (i.e. -Dkey=value).
   * <p>
   * 2.) Input specific properties (for work.dat, work.properties is read if present).
   * <p>
   * 3.) User specific properties (~/.cbx/cbx.properties).
   * <p>
   * 4.) System wide properties (file defined by environment variable CBX_PROPERTIES).
   *
   * @param file The primary input file; may be null.
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File file) {

    // Command line options take precedence.
    CompositeConfiguration properties = new CompositeConfiguration();

    /*
      JVM system properties are read first.
      a.) -Dkey=value from the Java command line
      b.) System.setProperty("key","value") within Java code.
     */
    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // Input specific options are 2nd.
    if (file != null) {
      String basename = FilenameUtils.removeExtension(file.getAbsolutePath());
      File inputPropFile = new File(basename + ".properties");
      if (inputPropFile.exists() && inputPropFile.canRead()) {
        addPropertyFile(properties, inputPropFile, "Input properties");
        properties.addProperty("propertyFile", inputPropFile.getAbsolutePath());
      }
    }

    // User specific options are 3rd.
    String filename = System.getProperty("user.home") + File.separator + ".cbx" + File.separator + "cbx.properties";
    File userPropFile = new File(filename);
    if (userPropFile.exists() && userPropFile.canRead()) {
      addPropertyFile(properties, userPropFile, "User property file");
    }

    // System wide options are last.
    filename = System.getenv(CBX_PROPERTIES);
    if (filename != null) {
      File systemPropFile = new File(filename);
      if (systemPropFile.exists() && systemPropFile.canRead()) {
        addPropertyFile(properties, systemPropFile, "Environment variable " + CBX_PROPERTIES);
      }
    }

    // Echo the interpolated configuration.
    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys();
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  /**
   * Append a property file to the composite configuration. Unreadable files are reported and skipped.
   *
   * @param properties  The composite configuration.
   * @param file        The property file.
   * @param description Header describing the source of the properties.
   */
  private static void addPropertyFile(CompositeConfiguration properties, File file, String description) {
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(file)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      PropertiesConfiguration configuration = builder.getConfiguration();
      configuration.setHeader(description + " (" + file.getAbsolutePath() + ").");
      properties.addConfiguration(configuration);
    } catch (ConfigurationException e) {
      logger.log(Level.INFO, " Error loading {0}.", file.getAbsolutePath());
    }
  }
}
