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
import com.spectacular.spectra.IndexRangeException;
import com.spectacular.spectra.InsufficientPeaksException;
import com.spectacular.spectra.Mineral;
import com.spectacular.spectra.Minerals;
import com.spectacular.spectra.NotGrindableException;
import com.spectacular.spectra.Spectrum;
import com.spectacular.spectra.SpectrumTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operations that need arguments besides their spectral operands.
 */
public class ParameterisedOperations {
  public static final List<String> GRINDING_CURVE_COLUMNS = Arrays.asList("v2/v3", "v4/v3");

  private static final int DIAGNOSTIC_PEAK_COUNT = 3;

  private ParameterisedOperations() {
  }

  /**
   * Sets the intensities at positions [leftIndex, rightIndex) to zero.  Indices are positions in the spectrum, not
   * wavenumbers.
   * @throws IndexRangeException Unless 0 <= leftIndex <= rightIndex <= the spectrum's length.
   */
  public static SpectrumTable zero(Spectrum spectrum, int leftIndex, int rightIndex) {
    if (leftIndex < 0 || leftIndex > rightIndex || rightIndex > spectrum.size()) {
      throw new IndexRangeException(String.format(
          "Cannot zero [%d, %d) of spectrum '%s' with %d points", leftIndex, rightIndex, spectrum.getName(),
          spectrum.size()));
    }

    List<Double> y = new ArrayList<>(spectrum.getY());
    for (int i = leftIndex; i < rightIndex; i++) {
      y.set(i, 0.0);
    }
    return SpectrumOperations.resultTable(spectrum, y);
  }

  /**
   * Builds a grinding curve: for each spectrum, the intensities of the peaks nearest the mineral's three diagnostic
   * wavenumbers are found, the largest of the three is taken as the reference, and the two others are divided by it.
   * The two ratios keep the order of their peaks in the mineral's definition.
   * @param mineral The mineral whose diagnostic peaks are used.
   * @param spectra The spectra to measure, one output row each, in order.
   * @return A table with columns {@link #GRINDING_CURVE_COLUMNS}.
   * @throws NotGrindableException If the mineral is not flagged as grindable.
   * @throws InsufficientPeaksException If the mineral defines fewer than three diagnostic peaks.
   * @throws DivisionByZeroException If the reference peak of any spectrum has zero intensity.
   */
  public static SpectrumTable grindingCurve(Mineral mineral, List<Spectrum> spectra) {
    if (!mineral.isGrindable()) {
      throw new NotGrindableException(String.format("Mineral %s does not have a grinding curve", mineral.getName()));
    }
    if (mineral.getPeaks().size() < DIAGNOSTIC_PEAK_COUNT) {
      throw new InsufficientPeaksException(String.format("Mineral %s defines %d diagnostic peaks, %d are needed",
          mineral.getName(), mineral.getPeaks().size(), DIAGNOSTIC_PEAK_COUNT));
    }

    List<List<Double>> rows = new ArrayList<>(spectra.size());
    for (Spectrum spectrum : spectra) {
      List<Double> maxima = new ArrayList<>(DIAGNOSTIC_PEAK_COUNT);
      for (Double guess : mineral.getPeaks().subList(0, DIAGNOSTIC_PEAK_COUNT)) {
        maxima.add(Transformations.findMaximum(spectrum, guess).getRight());
      }

      // The first occurrence of the largest intensity is the reference peak.
      int largestIndex = 0;
      for (int i = 1; i < maxima.size(); i++) {
        if (maxima.get(i) > maxima.get(largestIndex)) {
          largestIndex = i;
        }
      }
      Double largest = maxima.remove(largestIndex);
      if (largest == 0.0) {
        throw new DivisionByZeroException(String.format(
            "The largest diagnostic peak of spectrum '%s' for %s has zero intensity", spectrum.getName(),
            mineral.getName()));
      }
      rows.add(Arrays.asList(maxima.get(0) / largest, maxima.get(1) / largest));
    }
    return SpectrumTable.fromRows(GRINDING_CURVE_COLUMNS, rows);
  }

  static Map<String, OperationDefinition> operations() {
    Map<String, OperationDefinition> ops = new LinkedHashMap<>();
    ops.put("zero", new OperationDefinition("zero", 1, (operands, arguments) ->
        zero(operands.get(0),
            arguments.getInteger(OperationArguments.LEFT_INDEX, 0),
            arguments.getInteger(OperationArguments.RIGHT_INDEX, 0))));
    ops.put("grindingCurve", new OperationDefinition("grindingCurve", OperationDefinition.VARIADIC,
        (operands, arguments) ->
            grindingCurve(arguments.getMineral(OperationArguments.MINERAL, Minerals.CALCITE.getMineral()), operands)));
    return ops;
  }
}
