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
package cbx;

import cbx.utilities.CBXCommand;
import cbx.utilities.CBXContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * The Main class is the entry point to the command line interface of Crooks-Bayes X.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Main {

  private static final Logger logger = Logger.getLogger(Main.class.getName());

  private Main() {
    // Prevent instantiation.
  }

  /**
   * Run the command named by the first argument with the remaining arguments.
   *
   * @param args an array of {@link java.lang.String} objects.
   */
  public static void main(String[] args) {
    args = processProperties(args);
    if (args.length == 0) {
      commandLineInterfaceHelp();
      return;
    }

    try {
      int statusCode = exitStatus(cbxCommand(args));
      if (statusCode != 0) {
        logger.info(" Command failed: exiting with status code " + statusCode);
        System.exit(statusCode);
      }
    } catch (Throwable t) {
      int statusCode = 1;
      logger.info(" Uncaught exception: exiting with status code " + statusCode);
      t.printStackTrace();
      System.exit(statusCode);
    }
  }

  /**
   * Run a command and return a reference to it.
   *
   * @param args The command name followed by its arguments.
   * @return The command after it has run, or null if no such command exists.
   * @throws ReflectiveOperationException If the command cannot be instantiated.
   */
  public static CBXCommand cbxCommand(String[] args) throws ReflectiveOperationException {
    String name = args[0];
    Class<? extends CBXCommand> commandClass = CBXCommand.getCommand(name);
    if (commandClass == null) {
      logger.severe(format(" Unknown command: %s", name));
      return null;
    }

    String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);
    header(name, commandArgs);
    CBXContext binding = new CBXContext(commandArgs);
    CBXCommand command = commandClass.getDeclaredConstructor(CBXContext.class).newInstance(binding);
    return command.run();
  }

  /**
   * The process exit status for a command returned by {@link #cbxCommand(String[])}.
   *
   * @param command The command after it has run, or null if no such command exists.
   * @return 0 on success, non-zero otherwise.
   */
  static int exitStatus(CBXCommand command) {
    if (command == null) {
      return 1;
    }
    return command.getExitStatus();
  }

  /** Print out help for the command line interface. */
  private static void commandLineInterfaceHelp() {
    logger.info(" usage: cbx [-D<property=value>] <command> [-options] <forwardWorks> <backwardWorks>");
    logger.info("  where commands include:");
    logger.info("   CrooksBayes");
    logger.info("\n For help on a specific command use:  cbx <command> -h\n");
  }

  /** Print out a promo. */
  private static void header(String name, String[] args) {
    StringBuilder sb = new StringBuilder();
    sb.append("\n Crooks-Bayes X - Sequential Bayesian Free Energy Estimation");
    sb.append("\n ").append(new Date());
    sb.append(format("\n Command: %s", name));
    if (args.length > 0) {
      sb.append("\n\n Command line arguments:\n ");
      sb.append(Arrays.toString(args));
      sb.append("\n");
    }
    logger.info(sb.toString());
  }

  /** Process any "-D" command line flags. */
  static String[] processProperties(String[] args) {
    List<String> newArgs = new ArrayList<>();
    for (String arg : args) {
      arg = arg.trim();
      if (arg.startsWith("-D")) {
        // Remove -D from the front of String.
        arg = arg.substring(2);
        // Split at the first equals if it exists.
        if (arg.contains("=")) {
          int equalsPosition = arg.indexOf("=");
          String key = arg.substring(0, equalsPosition);
          String value = arg.substring(equalsPosition + 1);
          System.setProperty(key, value);
        } else if (arg.length() > 0) {
          System.setProperty(arg, "");
        }
      } else {
        // Collect non "-D" arguments.
        newArgs.add(arg);
      }
    }
    return newArgs.toArray(new String[0]);
  }
}
