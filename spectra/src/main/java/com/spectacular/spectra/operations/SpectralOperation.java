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

import com.spectacular.spectra.Spectrum;
import com.spectacular.spectra.SpectrumTable;

import java.util.List;

/**
 * A pure function from validated spectral operands and extra arguments to a result table.
 */
@FunctionalInterface
public interface SpectralOperation {
  /**
   * Computes the result of this operation.
   * @param operands The spectra to operate on, already checked to share one x-axis.
   * @param arguments Any extra, non-spectral arguments the operation needs.
   * @return The result table; its first two columns become the x and y of the result spectrum.
   */
  SpectrumTable apply(List<Spectrum> operands, OperationArguments arguments);
}
