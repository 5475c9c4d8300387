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

import java.util.Arrays;

/**
 * Enumerates the minerals with known diagnostic peaks.
 */
public enum Minerals {
  CALCITE(true, 875.0, 1420.0, 713.0),
  ARAGONITE(true, 713.0, 860.0, 1500.0),
  ;

  private Mineral mineral;

  Minerals(Boolean isGrindable, Double... peaks) {
    mineral = new Mineral(this.name(), Arrays.asList(peaks), isGrindable);
  }

  public Mineral getMineral() {
    return this.mineral;
  }

  /**
   * Looks up a catalog entry by name, ignoring case.
   * @throws IllegalArgumentException If no mineral of that name is known.
   */
  public static Minerals fromName(String name) {
    for (Minerals m : values()) {
      if (m.name().equalsIgnoreCase(name.trim())) {
        return m;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown mineral '%s', expected one of %s",
        name, Arrays.toString(values())));
  }
}
