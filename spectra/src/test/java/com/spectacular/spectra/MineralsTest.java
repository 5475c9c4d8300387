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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class MineralsTest {

  @Test
  public void testCatalog() throws Exception {
    Mineral calcite = Minerals.CALCITE.getMineral();
    assertEquals("CALCITE", calcite.getName());
    assertEquals(Arrays.asList(875.0, 1420.0, 713.0), calcite.getPeaks());
    assertTrue(calcite.isGrindable());

    Mineral aragonite = Minerals.ARAGONITE.getMineral();
    assertEquals(Arrays.asList(713.0, 860.0, 1500.0), aragonite.getPeaks());
    assertTrue(aragonite.isGrindable());
  }

  @Test
  public void testLookupByName() throws Exception {
    assertEquals(Minerals.ARAGONITE, Minerals.fromName("aragonite"));
    assertEquals(Minerals.CALCITE, Minerals.fromName(" Calcite "));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownMineral() throws Exception {
    Minerals.fromName("quartz");
  }

  @Test
  public void testPeaksAreCopiedOnConstruction() throws Exception {
    List<Double> peaks = new ArrayList<>(Arrays.asList(1080.0, 798.0, 778.0));
    Mineral quartz = new Mineral("QUARTZ", peaks, false);
    peaks.set(0, 0.0);
    peaks.add(460.0);

    assertEquals(Arrays.asList(1080.0, 798.0, 778.0), quartz.getPeaks());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testPeaksCannotBeModified() throws Exception {
    Minerals.CALCITE.getMineral().getPeaks().set(0, 0.0);
  }
}
