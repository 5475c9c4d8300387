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

import com.spectacular.spectra.Mineral;
import com.spectacular.spectra.Spectrum;
import com.spectacular.spectra.SpectrumTable;
import com.spectacular.spectra.UnknownColumnException;
import com.spectacular.spectra.operations.OperationArguments;
import com.spectacular.spectra.operations.OperationFamily;
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * The state of one session: the tables loaded so far and the spectra derived from them.  It is created empty and only
 * shrinks through explicit deletes.
 */
public class SpectralWorkspace {
  private final Registry<SpectrumTable> tables = new Registry<>();
  private final SpectrumRegistry spectra = new SpectrumRegistry();
  private final OperationEngine engine = new OperationEngine(spectra);

  public OperationEngine getEngine() {
    return engine;
  }

  /**
   * Registers a parsed table under a name (typically the file it came from), replacing any table of that name.
   */
  public void addTable(String name, SpectrumTable table) {
    tables.upsert(name, table);
  }

  public SpectrumTable getTable(String name) {
    SpectrumTable table = tables.get(name);
    if (table == null) {
      throw new NoSuchElementException(String.format("No table named '%s' has been loaded", name));
    }
    return table;
  }

  public Map<String, SpectrumTable> getTables() {
    return tables.snapshot();
  }

  /**
   * Builds a spectrum from two columns of a table and registers it, replacing any spectrum of the same name.
   * @throws UnknownColumnException If either column is not in the table.
   * @throws com.spectacular.spectra.BadAxisSymmetryException If the columns hold different numbers of values.
   */
  public Spectrum createSpectrum(String name, SpectrumTable table, String xColumn, String yColumn) {
    if (StringUtils.isBlank(name)) {
      throw new IllegalArgumentException("A spectrum needs a non-empty name");
    }
    Spectrum spectrum = new Spectrum(name, table, xColumn, yColumn);
    spectra.upsert(spectrum);
    return spectrum;
  }

  public Spectrum createSpectrum(String name, String tableName, String xColumn, String yColumn) {
    return createSpectrum(name, getTable(tableName), xColumn, yColumn);
  }

  /**
   * Registers a copy of an existing spectrum under a new name.
   * @throws IllegalArgumentException If the new name is the source's own name.
   */
  public Spectrum duplicateSpectrum(String newName, String sourceName) {
    if (StringUtils.equals(newName, sourceName)) {
      throw new IllegalArgumentException("Names cannot be the same!");
    }
    if (StringUtils.isBlank(newName)) {
      throw new IllegalArgumentException("A spectrum needs a non-empty name");
    }
    Spectrum copy = getSpectrum(sourceName).withName(newName);
    spectra.upsert(copy);
    return copy;
  }

  /**
   * Removes a spectrum from the session.
   * @return true if a spectrum of that name existed.
   */
  public boolean deleteSpectrum(String name) {
    return spectra.remove(name) != null;
  }

  public Spectrum getSpectrum(String name) {
    Spectrum spectrum = spectra.get(name);
    if (spectrum == null) {
      throw new NoSuchElementException(String.format("No spectrum named '%s'", name));
    }
    return spectrum;
  }

  public List<String> getSpectrumNames() {
    return spectra.names();
  }

  public Map<String, Spectrum> getSpectra() {
    return spectra.snapshot();
  }

  public Spectrum apply(OperationFamily family, String operationName, String resultName,
                        List<String> operandNames, OperationArguments arguments) {
    return engine.applyToNamed(family, operationName, resultName, operandNames, arguments);
  }

  /**
   * Zeroes a range of a registered spectrum.  With a blank result name the source spectrum itself is replaced.
   */
  public Spectrum zero(String sourceName, String resultName, int leftIndex, int rightIndex) {
    String target = StringUtils.isBlank(resultName) ? sourceName : resultName;
    return apply(OperationFamily.PARAMETERISED_OPERATIONS, "zero", target, Collections.singletonList(sourceName),
        OperationArguments.none()
            .with(OperationArguments.LEFT_INDEX, leftIndex)
            .with(OperationArguments.RIGHT_INDEX, rightIndex));
  }

  public Spectrum grindingCurve(String resultName, Mineral mineral, List<String> spectrumNames) {
    return apply(OperationFamily.PARAMETERISED_OPERATIONS, "grindingCurve", resultName, spectrumNames,
        OperationArguments.none().with(OperationArguments.MINERAL, mineral));
  }
}
