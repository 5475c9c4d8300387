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

/**
 * Raised when operand x-axes differ, or when the x and y columns picked for a new spectrum hold a different number of
 * values once missing cells are dropped.
 */
public class BadAxisSymmetryException extends SpectralException {
  public BadAxisSymmetryException(String msg) {
    super(msg);
  }

  public BadAxisSymmetryException() {
    super("The x-axes are incongruent.");
  }
}
