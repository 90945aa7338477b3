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

import cbx.algorithms.commands.CrooksBayes;
import cbx.utilities.CBXCommand;
import cbx.utilities.CBXTest;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 * Tests command resolution from the command line.
 */
public class MainTest extends CBXTest {

  @Test
  public void testCommandByName() throws ReflectiveOperationException {
    CBXCommand command = Main.cbxCommand(new String[]{"CrooksBayes", "-h"});
    assertTrue(command instanceof CrooksBayes);
    assertNull(((CrooksBayes) command).getResult());
    assertEquals(CrooksBayes.class, CBXCommand.getCommand("cbx.algorithms.commands.CrooksBayes"));
  }

  @Test
  public void testUnknownCommand() throws ReflectiveOperationException {
    assertNull(Main.cbxCommand(new String[]{"NoSuchCommand"}));
    assertNull(CBXCommand.getCommand("java.lang.String"));
  }

  @Test
  public void testExitStatus() throws IOException, ReflectiveOperationException {
    Path dir = registerTemporaryDirectory();
    Path forward = Files.write(dir.resolve("forward.dat"), List.of("1.0", "2.0", "3.0"));
    Path backward = Files.write(dir.resolve("backward.dat"), List.of("-1.0", "-2.0"));
    String[] mismatch = {"CrooksBayes", "--min", "-10", "--max", "10", "--beta", "1.0",
        forward.toString(), backward.toString()};
    assertEquals(1, Main.exitStatus(Main.cbxCommand(mismatch)));

    Files.write(backward, List.of("-1.0", "-2.0", "-3.0"));
    assertEquals(0, Main.exitStatus(Main.cbxCommand(mismatch)));
    assertEquals(0, Main.exitStatus(Main.cbxCommand(new String[]{"CrooksBayes", "-h"})));
    assertEquals(1, Main.exitStatus(Main.cbxCommand(new String[]{"NoSuchCommand"})));
  }

  @Test
  public void testProcessProperties() {
    String[] args = Main.processProperties(new String[]{"-Dcrooks-bayes-step=0.25", "CrooksBayes", "-Dcbx.flag", "--min", "-3"});
    assertArrayEquals(new String[]{"CrooksBayes", "--min", "-3"}, args);
    assertEquals("0.25", System.getProperty("crooks-bayes-step"));
    assertEquals("", System.getProperty("cbx.flag"));
  }
}
