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

import com.spectacular.spectra.InvalidOperandException;
import com.spectacular.spectra.Spectrum;
import com.spectacular.spectra.SpectrumTable;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Binds an operation name to the function implementing it and to the number of spectra it takes.
 */
public class OperationDefinition {
  public static final int VARIADIC = -1;

  private final String name;
  private final int arity;
  private final SpectralOperation operation;

  public OperationDefinition(String name, int arity, SpectralOperation operation) {
    this.name = name;
    this.arity = arity;
    this.operation = operation;
  }

  public static OperationDefinition unary(String name, Function<Spectrum, SpectrumTable> fn) {
    return new OperationDefinition(name, 1, (operands, arguments) -> fn.apply(operands.get(0)));
  }

  public static OperationDefinition binary(String name, BiFunction<Spectrum, Spectrum, SpectrumTable> fn) {
    return new OperationDefinition(name, 2, (operands, arguments) -> fn.apply(operands.get(0), operands.get(1)));
  }

  public String getName() {
    return name;
  }

  /**
   * Get the number of spectra this operation takes, or {@link #VARIADIC} if it takes one or more.
   */
  public int getArity() {
    return arity;
  }

  public boolean isVariadic() {
    return arity == VARIADIC;
  }

  /**
   * Runs the operation after checking the operand count.
   * @throws InvalidOperandException If the number of operands does not match this operation's arity.
   */
  public SpectrumTable apply(List<Spectrum> operands, OperationArguments arguments) {
    if (isVariadic() ? operands.isEmpty() : operands.size() != arity) {
      throw new InvalidOperandException(String.format("Operation '%s' takes %s spectra, got %d",
          name, isVariadic() ? "one or more" : String.valueOf(arity), operands.size()));
    }
    return operation.apply(operands, arguments);
  }
}
