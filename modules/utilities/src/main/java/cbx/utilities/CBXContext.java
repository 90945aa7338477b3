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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The CBXContext holds the variables passed to a command (e.g. "args").
 * <p>
 * The context is not supposed to be used in a multithreaded context.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CBXContext {

  private final Map<String, Object> variables = new LinkedHashMap<>();

  public CBXContext() {
  }

  /**
   * A helper constructor used in main(String[]) method calls
   *
   * @param args are the command line arguments from a main()
   */
  public CBXContext(String[] args) {
    setVariable("args", args);
  }

  /**
   * @param name the name of the variable to lookup
   * @return the variable value, or null if the variable has not been set.
   */
  public Object getVariable(String name) {
    return variables.get(name);
  }

  /**
   * Sets the value of the given variable
   *
   * @param name the name of the variable to set
   * @param value the new value for the given variable
   */
  public void setVariable(String name, Object value) {
    variables.put(name, value);
  }
}
