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

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SpectrumTest {

  private static SpectrumTable makeTable() {
    return new SpectrumTable(
        Arrays.asList("wavenumber", "sampleA", "sampleB", "short"),
        Arrays.asList(
            Arrays.asList(400.0, 401.0, 402.0, 403.0),
            Arrays.asList(0.1, 0.2, 0.3, 0.4),
            Arrays.asList(1.0, 2.0, 3.0, 4.0),
            Arrays.asList(7.0, 8.0)
        ));
  }

  @Test
  public void testConstructionPicksColumns() throws Exception {
    Spectrum s = new Spectrum("A", makeTable(), "wavenumber", "sampleA");
    assertEquals("A", s.getName());
    assertEquals("wavenumber", s.getXLabel());
    assertEquals("sampleA", s.getYLabel());
    assertEquals(Arrays.asList(400.0, 401.0, 402.0, 403.0), s.getX());
    assertEquals(Arrays.asList(0.1, 0.2, 0.3, 0.4), s.getY());
    assertEquals(4, s.size());
  }

  @Test(expected = BadAxisSymmetryException.class)
  public void testMismatchedColumnLengthsAreRejected() throws Exception {
    new Spectrum("bad", makeTable(), "wavenumber", "short");
  }

  @Test(expected = UnknownColumnException.class)
  public void testUnknownColumnIsRejected() throws Exception {
    new Spectrum("bad", makeTable(), "wavenumber", "nope");
  }

  @Test
  public void testMissingValuesAreDroppedBeforeCounting() throws Exception {
    // Both columns have three values, at different rows.
    SpectrumTable table = new SpectrumTable(
        Arrays.asList("x", "y"),
        Arrays.asList(
            Arrays.asList(1.0, 2.0, null, 4.0),
            Arrays.asList(10.0, Double.NaN, 30.0, 40.0)
        ));
    Spectrum s = new Spectrum("gappy", table, "x", "y");
    assertEquals("Only rows with both values are kept", Arrays.asList(1.0, 4.0), s.getX());
    assertEquals(Arrays.asList(10.0, 40.0), s.getY());
  }

  @Test
  public void testSpectrumIsNotModifiable() throws Exception {
    Spectrum s = new Spectrum("A", makeTable(), "wavenumber", "sampleA");
    try {
      s.getY().set(0, 100.0);
      fail("Spectrum data should be read-only");
    } catch (UnsupportedOperationException e) {
      // Expected.
    }
  }

  @Test
  public void testAxisComparison() throws Exception {
    SpectrumTable table = makeTable();
    Spectrum a = new Spectrum("A", table, "wavenumber", "sampleA");
    Spectrum b = new Spectrum("B", table, "wavenumber", "sampleB");
    Spectrum c = new Spectrum("C", table, "sampleB", "sampleA");
    assertTrue(a.sharesAxisWith(b));
    assertFalse(a.sharesAxisWith(c));
  }

  @Test
  public void testWithNameKeepsData() throws Exception {
    Spectrum a = new Spectrum("A", makeTable(), "wavenumber", "sampleA");
    Spectrum copy = a.withName("copy");
    assertEquals("copy", copy.getName());
    assertEquals(a.getX(), copy.getX());
    assertEquals(a.getY(), copy.getY());
    assertEquals("A", a.getName());
  }

  @Test
  public void testToTableWithSameColumnForBothAxes() throws Exception {
    Spectrum s = new Spectrum("diag", makeTable(), "sampleB", "sampleB");
    SpectrumTable table = s.toTable();
    assertEquals(Arrays.asList("sampleB", "sampleB.1"), table.getColumnNames());
    assertEquals(s.getY(), table.getColumn("sampleB.1"));
  }

  @Test
  public void testTablePadsShortColumns() throws Exception {
    SpectrumTable table = makeTable();
    assertEquals(4, table.getRowCount());
    List<Double> shortColumn = table.getColumn("short");
    assertEquals(Arrays.asList(7.0, 8.0, null, null), shortColumn);

    SpectrumTable fromRows = SpectrumTable.fromRows(Arrays.asList("a", "b"),
        Arrays.asList(Arrays.asList(1.0, 2.0), Collections.singletonList(3.0)));
    assertEquals(Arrays.asList(2.0, null), fromRows.getColumn("b"));
  }
}
