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

import com.spectacular.spectra.UnknownOperationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The closed set of operation families.  Each family maps operation names to their definitions; the tables are built
 * once, when the enum is initialised.
 */
public enum OperationFamily {
  SPECTRUM_OPERATIONS("spectrum", SpectrumOperations.operations()),
  PARAMETERISED_OPERATIONS("parameterised", ParameterisedOperations.operations()),
  ;

  private final String shortName;
  private final Map<String, OperationDefinition> operations;

  OperationFamily(String shortName, Map<String, OperationDefinition> operations) {
    this.shortName = shortName;
    this.operations = Collections.unmodifiableMap(operations);
  }

  public String getShortName() {
    return shortName;
  }

  /**
   * Gets the definition of a named operation in this family.
   * @throws UnknownOperationException If this family has no operation of that name.
   */
  public OperationDefinition lookup(String operationName) {
    OperationDefinition definition = operations.get(operationName);
    if (definition == null) {
      throw new UnknownOperationException(String.format("No operation '%s' in family %s; expected one of %s",
          operationName, shortName, operations.keySet()));
    }
    return definition;
  }

  public Collection<OperationDefinition> getOperations() {
    return operations.values();
  }

  public List<String> getOperationNames() {
    return new ArrayList<>(operations.keySet());
  }

  public static OperationFamily fromShortName(String shortName) {
    for (OperationFamily family : values()) {
      if (family.shortName.equalsIgnoreCase(shortName)) {
        return family;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown operation family '%s'", shortName));
  }

  /**
   * Finds the family that defines an operation name.  Operation names are unique across families.
   * @throws UnknownOperationException If no family defines the operation.
   */
  public static OperationFamily forOperation(String operationName) {
    for (OperationFamily family : values()) {
      if (family.operations.containsKey(operationName)) {
        return family;
      }
    }
    throw new UnknownOperationException(String.format("No operation named '%s'", operationName));
  }
}
