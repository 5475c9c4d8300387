/*************************************************************************
*                                                                        *
*  This file is part of the spectacular project.                         *
*  spectacular manipulates and calibrates infrared spectra of minerals.  *
*  Copyright (C) 2026 The spectacular authors.                           *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.spectacular.spectra.operations;

import com.spectacular.spectra.InvalidOperandException;
import com.spectacular.spectra.Minerals;
import com.spectacular.spectra.MissingArgumentException;
import com.spectacular.spectra.Spectrum;
import com.spectacular.spectra.SpectrumTable;
import com.spectacular.spectra.UnknownOperationException;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.spectacular.spectra.SpectrumFixtures.spectrum;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class OperationFamilyTest {

  @Test
  public void testFamiliesListTheirOperations() throws Exception {
    assertEquals(Arrays.asList("add", "subtract", "multiply", "divide", "toTransmittance", "toAbsorption"),
        OperationFamily.SPECTRUM_OPERATIONS.getOperationNames());
    assertEquals(Arrays.asList("zero", "grindingCurve"),
        OperationFamily.PARAMETERISED_OPERATIONS.getOperationNames());
  }

  @Test
  public void testArities() throws Exception {
    assertEquals(2, OperationFamily.SPECTRUM_OPERATIONS.lookup("divide").getArity());
    assertEquals(1, OperationFamily.SPECTRUM_OPERATIONS.lookup("toAbsorption").getArity());
    assertEquals(1, OperationFamily.PARAMETERISED_OPERATIONS.lookup("zero").getArity());
    assertTrue(OperationFamily.PARAMETERISED_OPERATIONS.lookup("grindingCurve").isVariadic());
  }

  @Test
  public void testFamilyLookups() throws Exception {
    assertEquals(OperationFamily.PARAMETERISED_OPERATIONS, OperationFamily.forOperation("zero"));
    assertEquals(OperationFamily.SPECTRUM_OPERATIONS, OperationFamily.forOperation("multiply"));
    assertEquals(OperationFamily.PARAMETERISED_OPERATIONS, OperationFamily.fromShortName("Parameterised"));
  }

  @Test(expected = UnknownOperationException.class)
  public void testUnknownOperationInFamily() throws Exception {
    OperationFamily.SPECTRUM_OPERATIONS.lookup("zero");
  }

  @Test(expected = UnknownOperationException.class)
  public void testUnknownOperation() throws Exception {
    OperationFamily.forOperation("integrate");
  }

  @Test(expected = InvalidOperandException.class)
  public void testWrongOperandCount() throws Exception {
    OperationFamily.SPECTRUM_OPERATIONS.lookup("add")
        .apply(Collections.singletonList(spectrum("s", 1.0, 2.0)), OperationArguments.none());
  }

  @Test(expected = InvalidOperandException.class)
  public void testVariadicNeedsAnOperand() throws Exception {
    OperationFamily.PARAMETERISED_OPERATIONS.lookup("grindingCurve")
        .apply(Collections.<Spectrum>emptyList(), OperationArguments.none());
  }

  @Test
  public void testZeroDispatchUsesArguments() throws Exception {
    SpectrumTable result = OperationFamily.PARAMETERISED_OPERATIONS.lookup("zero").apply(
        Collections.singletonList(spectrum("s", 1.0, 2.0, 3.0)),
        OperationArguments.none().with(OperationArguments.LEFT_INDEX, 0).with(OperationArguments.RIGHT_INDEX, 2));
    assertEquals(Arrays.asList(0.0, 0.0, 3.0), result.getColumn("intensity"));
  }

  @Test
  public void testZeroDefaultsToAnEmptyRange() throws Exception {
    SpectrumTable result = OperationFamily.PARAMETERISED_OPERATIONS.lookup("zero").apply(
        Collections.singletonList(spectrum("s", 1.0, 2.0, 3.0)), OperationArguments.none());
    assertEquals(Arrays.asList(1.0, 2.0, 3.0), result.getColumn("intensity"));
  }

  @Test(expected = MissingArgumentException.class)
  public void testMistypedArgument() throws Exception {
    OperationFamily.PARAMETERISED_OPERATIONS.lookup("grindingCurve").apply(
        Collections.singletonList(ParameterisedOperationsTest.FINE_CALCITE),
        OperationArguments.none().with(OperationArguments.MINERAL, Minerals.CALCITE));
  }
}
