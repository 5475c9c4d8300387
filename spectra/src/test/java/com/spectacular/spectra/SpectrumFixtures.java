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

package com.spectacular.spectra;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for small spectra used across tests.
 */
public class SpectrumFixtures {

  public static Spectrum spectrum(String name, List<Double> x, List<Double> y) {
    return new Spectrum(name, SpectrumTable.ofColumns("wavenumber", x, "intensity", y), "wavenumber", "intensity");
  }

  public static Spectrum spectrum(String name, Double... y) {
    List<Double> x = new ArrayList<>(y.length);
    for (int i = 0; i < y.length; i++) {
      x.add(400.0 + i);
    }
    return spectrum(name, x, Arrays.asList(y));
  }
}
