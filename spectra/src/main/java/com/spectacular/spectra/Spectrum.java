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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named pairing of wavenumbers (x) and intensities (y).
 *
 * A spectrum is never changed once built: every operation on spectra produces a new instance.  The x and y lists are
 * index aligned and always the same length.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class Spectrum implements Serializable {
  private static final long serialVersionUID = -3807542127315946812L;

  @JsonProperty("name")
  private final String name;

  @JsonProperty("x_label")
  private final String xLabel;

  @JsonProperty("y_label")
  private final String yLabel;

  @JsonProperty("x")
  private final List<Double> x;

  @JsonProperty("y")
  private final List<Double> y;

  /**
   * Picks two columns out of a table as the x and y data of a new spectrum.
   *
   * Missing cells are dropped from each column independently and the remaining counts must match.  Only rows where
   * both the x and the y cell are present are kept.
   *
   * @param name The name of the new spectrum.
   * @param source The table to take the columns from.
   * @param xColumn The column holding wavenumbers.
   * @param yColumn The column holding intensities.
   * @throws UnknownColumnException If either column is not in the table.
   * @throws BadAxisSymmetryException If the columns hold a different number of values.
   */
  public Spectrum(String name, SpectrumTable source, String xColumn, String yColumn) {
    List<Double> xs = source.getColumn(xColumn);
    List<Double> ys = source.getColumn(yColumn);

    if (countPresent(xs) != countPresent(ys)) {
      throw new BadAxisSymmetryException(String.format(
          "The x-axes are incongruent: column '%s' has %d values but column '%s' has %d",
          xColumn, countPresent(xs), yColumn, countPresent(ys)));
    }

    List<Double> keptX = new ArrayList<>(xs.size());
    List<Double> keptY = new ArrayList<>(ys.size());
    for (int i = 0; i < xs.size(); i++) {
      if (isPresent(xs.get(i)) && isPresent(ys.get(i))) {
        keptX.add(xs.get(i));
        keptY.add(ys.get(i));
      }
    }

    this.name = name;
    this.xLabel = xColumn;
    this.yLabel = yColumn;
    this.x = Collections.unmodifiableList(keptX);
    this.y = Collections.unmodifiableList(keptY);
  }

  private Spectrum(String name, Spectrum other) {
    this.name = name;
    this.xLabel = other.xLabel;
    this.yLabel = other.yLabel;
    this.x = other.x;
    this.y = other.y;
  }

  private static boolean isPresent(Double value) {
    return value != null && !value.isNaN();
  }

  private static int countPresent(List<Double> values) {
    int count = 0;
    for (Double v : values) {
      if (isPresent(v)) {
        count++;
      }
    }
    return count;
  }

  /**
   * Makes a copy of this spectrum under a different name.  The data is shared, which is safe since neither copy
   * can be modified.
   */
  public Spectrum withName(String newName) {
    return new Spectrum(newName, this);
  }

  public String getName() {
    return name;
  }

  public String getXLabel() {
    return xLabel;
  }

  public String getYLabel() {
    return yLabel;
  }

  public List<Double> getX() {
    return x;
  }

  public List<Double> getY() {
    return y;
  }

  public int size() {
    return x.size();
  }

  /**
   * Tests whether this spectrum and another have exactly the same wavenumbers in the same order.
   */
  public boolean sharesAxisWith(Spectrum other) {
    return x.equals(other.x);
  }

  /**
   * Renders this spectrum as a two-column table, e.g. for writing it out.
   */
  public SpectrumTable toTable() {
    return SpectrumTable.ofColumns(xLabel, x, yLabel.equals(xLabel) ? yLabel + ".1" : yLabel, y);
  }

  @Override
  public String toString() {
    return String.format("Spectrum{name='%s', x='%s', y='%s', points=%d}", name, xLabel, yLabel, x.size());
  }
}
