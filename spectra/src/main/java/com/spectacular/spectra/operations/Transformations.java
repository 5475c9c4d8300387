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

import com.spectacular.spectra.EmptySeriesException;
import com.spectacular.spectra.NoLocalMaximumException;
import com.spectacular.spectra.Spectrum;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.List;

/**
 * Operations on a spectrum whose result is a point rather than a new curve.
 */
public class Transformations {

  private Transformations() {
  }

  /**
   * Finds the global maximum of a spectrum.  When several points share the largest intensity, the first one wins.
   * @param spectrum The spectrum to search.
   * @return A {wavenumber, intensity} pair for the highest point.
   * @throws EmptySeriesException If the spectrum has no points.
   */
  public static Pair<Double, Double> findMaximum(Spectrum spectrum) {
    List<Double> ys = spectrum.getY();
    if (ys.isEmpty()) {
      throw new EmptySeriesException(String.format("Spectrum '%s' has no points", spectrum.getName()));
    }

    int best = 0;
    for (int i = 1; i < ys.size(); i++) {
      if (ys.get(i) > ys.get(best)) {
        best = i;
      }
    }
    return Pair.of(spectrum.getX().get(best), ys.get(best));
  }

  /**
   * Finds the local maximum whose wavenumber is closest to a guess.  Ties in distance go to the lower index.
   * @param spectrum The spectrum to search.
   * @param guess The wavenumber around which the peak is expected, or null to find the global maximum instead.
   * @return A {wavenumber, intensity} pair for the selected peak.
   * @throws EmptySeriesException If the spectrum has no points.
   * @throws NoLocalMaximumException If the spectrum has no local maxima at all.
   */
  public static Pair<Double, Double> findMaximum(Spectrum spectrum, Double guess) {
    if (guess == null) {
      return findMaximum(spectrum);
    }
    if (spectrum.size() == 0) {
      throw new EmptySeriesException(String.format("Spectrum '%s' has no points", spectrum.getName()));
    }

    List<Integer> peaks = findLocalMaxima(spectrum.getY());
    if (peaks.isEmpty()) {
      throw new NoLocalMaximumException(String.format("Spectrum '%s' has no local maxima", spectrum.getName()));
    }

    List<Double> xs = spectrum.getX();
    int closest = peaks.get(0);
    double closestDistance = Math.abs(xs.get(closest) - guess);
    for (Integer peak : peaks) {
      double distance = Math.abs(xs.get(peak) - guess);
      if (distance < closestDistance) {
        closest = peak;
        closestDistance = distance;
      }
    }
    return Pair.of(xs.get(closest), spectrum.getY().get(closest));
  }

  /**
   * Locates every position whose value is strictly greater than both its neighbours.  The first and last positions
   * only have one neighbour and so are never reported.
   * @param values The series to scan.
   * @return The indices of the local maxima in ascending order.
   */
  public static List<Integer> findLocalMaxima(List<Double> values) {
    List<Integer> peaks = new ArrayList<>();
    for (int i = 1; i < values.size() - 1; i++) {
      double v = values.get(i);
      if (v > values.get(i - 1) && v > values.get(i + 1)) {
        peaks.add(i);
      }
    }
    return peaks;
  }
}
