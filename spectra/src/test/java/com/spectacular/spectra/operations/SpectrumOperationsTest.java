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

import com.spectacular.spectra.DivisionByZeroException;
import com.spectacular.spectra.DomainException;
import com.spectacular.spectra.Spectrum;
import com.spectacular.spectra.SpectrumTable;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.spectacular.spectra.SpectrumFixtures.spectrum;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class SpectrumOperationsTest {
  private static final double TOLERANCE = 1e-9;

  private static final Spectrum S = spectrum("s", 0.5, 1.0, 2.0, 0.25, 3.0);
  private static final Spectrum T = spectrum("t", 2.0, 4.0, 1.0, 0.5, 1.5);

  private static void assertEqualsWithFPErr(String msg, List<Double> expected, List<Double> actual) {
    if (expected.size() != actual.size()) {
      fail(msg + ": unequal list sizes");
    }
    for (int i = 0; i < expected.size(); i++) {
      assertEquals(msg, expected.get(i), actual.get(i), TOLERANCE);
    }
  }

  private static List<Double> y(SpectrumTable table) {
    return table.getColumn(table.getColumnName(1));
  }

  @Test
  public void testResultKeepsFirstOperandAxis() throws Exception {
    SpectrumTable sum = SpectrumOperations.add(S, T);
    assertEquals(Arrays.asList("wavenumber", "intensity"), sum.getColumnNames());
    assertEquals(S.getX(), sum.getColumn("wavenumber"));
  }

  @Test
  public void testArithmetic() throws Exception {
    assertEqualsWithFPErr("add", Arrays.asList(2.5, 5.0, 3.0, 0.75, 4.5), y(SpectrumOperations.add(S, T)));
    assertEqualsWithFPErr("subtract", Arrays.asList(-1.5, -3.0, 1.0, -0.25, 1.5), y(SpectrumOperations.subtract(S, T)));
    assertEqualsWithFPErr("multiply", Arrays.asList(1.0, 4.0, 2.0, 0.125, 4.5), y(SpectrumOperations.multiply(S, T)));
    assertEqualsWithFPErr("divide", Arrays.asList(0.25, 0.25, 2.0, 0.5, 2.0), y(SpectrumOperations.divide(S, T)));
  }

  @Test
  public void testArithmeticIdentities() throws Exception {
    assertEqualsWithFPErr("s + s == 2s", Arrays.asList(1.0, 2.0, 4.0, 0.5, 6.0), y(SpectrumOperations.add(S, S)));
    assertEqualsWithFPErr("s - s == 0", Arrays.asList(0.0, 0.0, 0.0, 0.0, 0.0), y(SpectrumOperations.subtract(S, S)));
    assertEqualsWithFPErr("s / s == 1", Arrays.asList(1.0, 1.0, 1.0, 1.0, 1.0), y(SpectrumOperations.divide(S, S)));
  }

  @Test
  public void testDivisionByZero() throws Exception {
    Spectrum withZero = spectrum("withZero", 1.0, 0.0, 1.0, 1.0, 1.0);
    try {
      SpectrumOperations.divide(S, withZero);
      fail("Dividing by a zero intensity should fail");
    } catch (DivisionByZeroException e) {
      assertEquals("Spectrum 'withZero' has zero intensity at wavenumber 401.0", e.getMessage());
    }
    // Zero in the numerator is fine.
    assertEqualsWithFPErr("0 / t", Arrays.asList(0.5, 0.0, 1.0, 1.0, 1.0),
        y(SpectrumOperations.divide(withZero, spectrum("ones", 2.0, 1.0, 1.0, 1.0, 1.0))));
  }

  @Test
  public void testTransmittance() throws Exception {
    Spectrum absorbance = spectrum("absorbance", 0.0, 1.0, 2.0);
    assertEqualsWithFPErr("T = 100 * 10^-A", Arrays.asList(100.0, 10.0, 1.0),
        y(SpectrumOperations.toTransmittance(absorbance)));
  }

  @Test
  public void testAbsorption() throws Exception {
    Spectrum transmittance = spectrum("transmittance", 1.0, 0.1, 0.01, 10.0, 0.5);
    assertEqualsWithFPErr("A = -log10(T)", Arrays.asList(0.0, 1.0, 2.0, -1.0, 0.3010299956639812),
        y(SpectrumOperations.toAbsorption(transmittance)));
  }

  @Test
  public void testAbsorptionOfPercentTransmittanceIsOffsetByTwo() throws Exception {
    SpectrumTable transmittance = SpectrumOperations.toTransmittance(S);
    Spectrum t = new Spectrum("t", transmittance, "wavenumber", "intensity");
    SpectrumTable back = SpectrumOperations.toAbsorption(t);

    List<Double> expected = new ArrayList<>();
    for (Double a : S.getY()) {
      expected.add(a - 2.0);
    }
    assertEqualsWithFPErr("-log10(100 * 10^-A) = A - 2", expected, y(back));
  }

  @Test(expected = DomainException.class)
  public void testAbsorptionOfNonPositive() throws Exception {
    SpectrumOperations.toAbsorption(spectrum("negative", 1.0, -0.5, 2.0));
  }

  @Test(expected = DomainException.class)
  public void testAbsorptionOfZero() throws Exception {
    SpectrumOperations.toAbsorption(spectrum("zero", 1.0, 0.0, 2.0));
  }
}
