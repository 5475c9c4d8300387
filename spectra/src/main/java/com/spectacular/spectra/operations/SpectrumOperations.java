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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Operations whose operands are spectra only.  Binary operations expect their operands to share an x-axis, which the
 * {@link com.spectacular.spectra.engine.OperationEngine} checks before dispatching here.  Every result keeps the
 * x-axis of the first operand.
 */
public class SpectrumOperations {

  private SpectrumOperations() {
  }

  public static SpectrumTable add(Spectrum s1, Spectrum s2) {
    return combine(s1, s2, (a, b) -> a + b);
  }

  public static SpectrumTable subtract(Spectrum s1, Spectrum s2) {
    return combine(s1, s2, (a, b) -> a - b);
  }

  public static SpectrumTable multiply(Spectrum s1, Spectrum s2) {
    return combine(s1, s2, (a, b) -> a * b);
  }

  /**
   * Divides the intensities of one spectrum by those of another.
   * @throws DivisionByZeroException If any intensity of the divisor is zero.  No infinite values are produced.
   */
  public static SpectrumTable divide(Spectrum s1, Spectrum s2) {
    List<Double> divisor = s2.getY();
    for (int i = 0; i < divisor.size(); i++) {
      if (divisor.get(i) == 0.0) {
        throw new DivisionByZeroException(String.format(
            "Spectrum '%s' has zero intensity at wavenumber %s", s2.getName(), s2.getX().get(i)));
      }
    }
    return combine(s1, s2, (a, b) -> a / b);
  }

  /**
   * Converts absorbance to percent transmittance: T = 100 * 10^-A.
   */
  public static SpectrumTable toTransmittance(Spectrum spectrum) {
    return transform(spectrum, a -> 100.0 * Math.pow(10.0, -a));
  }

  /**
   * Converts transmittance to absorbance: A = -log10(T).  The input is taken as a fraction, so applying this to the
   * percent output of {@link #toTransmittance(Spectrum)} gives the original absorbance minus 2.
   * @throws DomainException If any intensity is zero or negative.
   */
  public static SpectrumTable toAbsorption(Spectrum spectrum) {
    List<Double> ys = spectrum.getY();
    for (int i = 0; i < ys.size(); i++) {
      if (ys.get(i) <= 0.0) {
        throw new DomainException(String.format(
            "Cannot take the logarithm of intensity %s at wavenumber %s of spectrum '%s'",
            ys.get(i), spectrum.getX().get(i), spectrum.getName()));
      }
    }
    return transform(spectrum, t -> -Math.log10(t));
  }

  private static SpectrumTable combine(Spectrum s1, Spectrum s2, DoubleBinaryOperator op) {
    List<Double> a = s1.getY();
    List<Double> b = s2.getY();
    List<Double> result = new ArrayList<>(a.size());
    for (int i = 0; i < a.size(); i++) {
      result.add(op.applyAsDouble(a.get(i), b.get(i)));
    }
    return resultTable(s1, result);
  }

  private static SpectrumTable transform(Spectrum spectrum, DoubleUnaryOperator op) {
    List<Double> result = new ArrayList<>(spectrum.size());
    for (Double y : spectrum.getY()) {
      result.add(op.applyAsDouble(y));
    }
    return resultTable(spectrum, result);
  }

  static SpectrumTable resultTable(Spectrum source, List<Double> y) {
    List<String> labels = source.toTable().getColumnNames();
    return SpectrumTable.ofColumns(labels.get(0), source.getX(), labels.get(1), y);
  }

  static Map<String, OperationDefinition> operations() {
    Map<String, OperationDefinition> ops = new LinkedHashMap<>();
    ops.put("add", OperationDefinition.binary("add", SpectrumOperations::add));
    ops.put("subtract", OperationDefinition.binary("subtract", SpectrumOperations::subtract));
    ops.put("multiply", OperationDefinition.binary("multiply", SpectrumOperations::multiply));
    ops.put("divide", OperationDefinition.binary("divide", SpectrumOperations::divide));
    ops.put("toTransmittance", OperationDefinition.unary("toTransmittance", SpectrumOperations::toTransmittance));
    ops.put("toAbsorption", OperationDefinition.unary("toAbsorption", SpectrumOperations::toAbsorption));
    return ops;
  }
}
