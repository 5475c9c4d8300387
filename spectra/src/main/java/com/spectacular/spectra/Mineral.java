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
import java.util.Collections;
import java.util.List;

/**
 * Reference data for a mineral: the wavenumbers of its diagnostic absorption peaks, and whether its spectrum is known
 * to change in a useful way with grinding (particle size).
 */
public class Mineral {
  private final String name;
  private final List<Double> peaks;
  private final boolean grindable;

  public Mineral(String name, List<Double> peaks, boolean grindable) {
    this.name = name;
    this.peaks = Collections.unmodifiableList(new ArrayList<>(peaks));
    this.grindable = grindable;
  }

  public String getName() {
    return name;
  }

  /**
   * Get the diagnostic peak wavenumbers (in cm^-1), in the order the grinding curve ratios refer to them.
   */
  public List<Double> getPeaks() {
    return peaks;
  }

  public boolean isGrindable() {
    return grindable;
  }

  @Override
  public String toString() {
    return name;
  }
}
