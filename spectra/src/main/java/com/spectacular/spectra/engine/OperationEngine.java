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

package com.spectacular.spectra.engine;

import com.spectacular.spectra.BadAxisSymmetryException;
import com.spectacular.spectra.InvalidOperandException;
import com.spectacular.spectra.Spectrum;
import com.spectacular.spectra.SpectrumTable;
import com.spectacular.spectra.operations.OperationArguments;
import com.spectacular.spectra.operations.OperationDefinition;
import com.spectacular.spectra.operations.OperationFamily;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates operands, runs operations on them and publishes the results into a {@link SpectrumRegistry}.
 *
 * Every operand must be a {@link Spectrum}, and all operands must share the exact same x-axis.  If either check fails
 * nothing is run and the registry is left as it was.  A result is stored under its name only once it is fully built,
 * replacing any spectrum already held under that name.
 */
public class OperationEngine {
  private final SpectrumRegistry registry;

  public OperationEngine(SpectrumRegistry registry) {
    this.registry = registry;
  }

  public SpectrumRegistry getRegistry() {
    return registry;
  }

  /**
   * Runs a named operation of a family and stores its result.
   * @param family The family defining the operation.
   * @param operationName The name of the operation within the family.
   * @param resultName The name to store the result under.
   * @param operands The spectra to operate on.
   * @param arguments Extra arguments for parameterised operations.
   * @return The newly stored spectrum.
   * @throws InvalidOperandException If an operand is not a spectrum or the operand count is wrong.
   * @throws BadAxisSymmetryException If the operands do not share an x-axis.
   * @throws com.spectacular.spectra.UnknownOperationException If the family has no such operation.
   */
  public Spectrum apply(OperationFamily family, String operationName, String resultName,
                        List<?> operands, OperationArguments arguments) {
    List<Spectrum> spectra = validateOperands(operands);
    OperationDefinition operation = family.lookup(operationName);
    return run(operation, resultName, spectra, arguments);
  }

  /**
   * Runs an operation definition directly and stores its result.  See
   * {@link #apply(OperationFamily, String, String, List, OperationArguments)}.
   */
  public Spectrum apply(OperationDefinition operation, String resultName,
                        List<?> operands, OperationArguments arguments) {
    List<Spectrum> spectra = validateOperands(operands);
    return run(operation, resultName, spectra, arguments);
  }

  /**
   * Runs a named operation on spectra held in the registry, looked up by name.
   * @throws InvalidOperandException If any name does not refer to a registered spectrum.
   */
  public Spectrum applyToNamed(OperationFamily family, String operationName, String resultName,
                               List<String> operandNames, OperationArguments arguments) {
    List<Object> operands = new ArrayList<>(operandNames.size());
    for (String name : operandNames) {
      Spectrum spectrum = registry.get(name);
      if (spectrum == null) {
        throw new InvalidOperandException(String.format("'%s' is not a known spectrum", name));
      }
      operands.add(spectrum);
    }
    return apply(family, operationName, resultName, operands, arguments);
  }

  /**
   * Checks that every operand is a spectrum and that all of them share the first operand's x-axis.
   * @return The operands as spectra, in order.
   */
  static List<Spectrum> validateOperands(List<?> operands) {
    List<Spectrum> spectra = new ArrayList<>(operands.size());
    for (int i = 0; i < operands.size(); i++) {
      Object operand = operands.get(i);
      if (!(operand instanceof Spectrum)) {
        throw new InvalidOperandException(String.format("Operand %d is not a spectrum: %s", i, operand));
      }
      spectra.add((Spectrum) operand);
    }

    for (Spectrum s : spectra) {
      if (!s.sharesAxisWith(spectra.get(0))) {
        throw new BadAxisSymmetryException(String.format(
            "The x-axes are incongruent: '%s' and '%s' have different wavenumbers",
            spectra.get(0).getName(), s.getName()));
      }
    }
    return spectra;
  }

  private Spectrum run(OperationDefinition operation, String resultName,
                       List<Spectrum> spectra, OperationArguments arguments) {
    if (StringUtils.isBlank(resultName)) {
      throw new IllegalArgumentException("A result spectrum needs a non-empty name");
    }

    SpectrumTable table = operation.apply(spectra, arguments == null ? OperationArguments.none() : arguments);
    if (table.getColumnCount() < 2) {
      throw new IllegalStateException(String.format(
          "Operation '%s' returned %d columns, 2 are needed for a spectrum", operation.getName(),
          table.getColumnCount()));
    }

    Spectrum result = new Spectrum(resultName, table, table.getColumnName(0), table.getColumnName(1));
    registry.upsert(result);
    return result;
  }
}
