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

package com.spectacular.utils;

import com.spectacular.spectra.Spectrum;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import static com.spectacular.spectra.SpectrumFixtures.spectrum;
import static org.junit.Assert.assertEquals;

public class SpectrumWriterTest {

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  @Test
  public void testWritesTwoColumnsWithHeader() throws Exception {
    Spectrum s = spectrum("s", Arrays.asList(700.0, 713.0), Arrays.asList(0.5, 1.25));
    StringWriter out = new StringWriter();
    new SpectrumWriter(',').write(s.toTable(), out);
    assertEquals("wavenumber,intensity\n700.0,0.5\n713.0,1.25\n", out.toString());
  }

  @Test
  public void testWritesFileForFileType() throws Exception {
    Spectrum s = spectrum("s", Arrays.asList(700.0, 713.0), Arrays.asList(0.5, 1.25));
    File f = new File(tempFolder.getRoot(), "s.tsv");
    new SpectrumWriter(DelimitedTableParser.FileType.TSV).write(s, f);

    List<String> lines = Files.readAllLines(f.toPath(), StandardCharsets.UTF_8);
    assertEquals(Arrays.asList("wavenumber\tintensity", "700.0\t0.5", "713.0\t1.25"), lines);
  }
}
