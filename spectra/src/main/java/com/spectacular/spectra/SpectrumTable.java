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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable table of named numeric columns.  Tables are what the ingestion side hands to the core and what every
 * operation returns before its result is wrapped as a {@link Spectrum}.
 *
 * Missing cells are represented as null.  All columns have the same number of rows; shorter columns are padded with
 * missing cells on construction.
 */
public class SpectrumTable implements Serializable {
  private static final long serialVersionUID = 2486135043316257071L;

  private final List<String> columnNames;
  private final Map<String, List<Double>> columns;
  private final int rowCount;

  /**
   * Builds a table from column-major data.
   * @param columnNames The names of the columns, in order.  Names must be unique.
   * @param columnValues One list of values per column name.
   */
  public SpectrumTable(List<String> columnNames, List<List<Double>> columnValues) {
    if (columnNames.size() != columnValues.size()) {
      throw new IllegalArgumentException(String.format(
          "Got %d column names for %d columns", columnNames.size(), columnValues.size()));
    }

    int rows = 0;
    for (List<Double> values : columnValues) {
      rows = Math.max(rows, values.size());
    }

    Map<String, List<Double>> cols = new LinkedHashMap<>();
    for (int i = 0; i < columnNames.size(); i++) {
      String name = columnNames.get(i);
      if (cols.containsKey(name)) {
        throw new IllegalArgumentException(String.format("Duplicate column name '%s'", name));
      }
      List<Double> padded = new ArrayList<>(columnValues.get(i));
      while (padded.size() < rows) {
        padded.add(null);
      }
      cols.put(name, Collections.unmodifiableList(padded));
    }

    this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
    this.columns = Collections.unmodifiableMap(cols);
    this.rowCount = rows;
  }

  /**
   * Builds a table from row-major data, as produced by a line-oriented parser or by an operation that emits one
   * result row per input.  Rows shorter than the header are padded with missing cells.
   */
  public static SpectrumTable fromRows(List<String> columnNames, List<List<Double>> rows) {
    List<List<Double>> columnValues = new ArrayList<>(columnNames.size());
    for (int c = 0; c < columnNames.size(); c++) {
      List<Double> column = new ArrayList<>(rows.size());
      for (List<Double> row : rows) {
        column.add(c < row.size() ? row.get(c) : null);
      }
      columnValues.add(column);
    }
    return new SpectrumTable(columnNames, columnValues);
  }

  public static SpectrumTable ofColumns(String xName, List<Double> x, String yName, List<Double> y) {
    List<String> names = new ArrayList<>(2);
    names.add(xName);
    names.add(yName);
    List<List<Double>> values = new ArrayList<>(2);
    values.add(x);
    values.add(y);
    return new SpectrumTable(names, values);
  }

  public List<String> getColumnNames() {
    return columnNames;
  }

  public String getColumnName(int index) {
    return columnNames.get(index);
  }

  public boolean hasColumn(String name) {
    return columns.containsKey(name);
  }

  /**
   * Gets the values of a named column.
   * @param name The column to look up.
   * @return An unmodifiable view of the column; missing cells are null.
   * @throws UnknownColumnException If the table has no such column.
   */
  public List<Double> getColumn(String name) {
    List<Double> column = columns.get(name);
    if (column == null) {
      throw new UnknownColumnException(String.format("No column named '%s'; available columns: %s",
          name, columnNames));
    }
    return column;
  }

  public List<Double> getRow(int index) {
    List<Double> row = new ArrayList<>(columnNames.size());
    for (String name : columnNames) {
      row.add(columns.get(name).get(index));
    }
    return row;
  }

  public int getColumnCount() {
    return columnNames.size();
  }

  public int getRowCount() {
    return rowCount;
  }
}
