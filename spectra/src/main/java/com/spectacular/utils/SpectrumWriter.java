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
import com.spectacular.spectra.SpectrumTable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes spectra out as two-column delimited tables, with the x and y labels as the header row.
 */
public class SpectrumWriter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumWriter.class);

  private final CSVFormat format;

  public SpectrumWriter(char delimiter) {
    this.format = CSVFormat.newFormat(delimiter).withRecordSeparator('\n').withQuote('"');
  }

  public SpectrumWriter(DelimitedTableParser.FileType fileType) {
    this(fileType.getDelimiter() != null ? fileType.getDelimiter() : '\t');
  }

  public void write(Spectrum spectrum, File file) throws IOException {
    try (Writer writer = new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8)) {
      write(spectrum.toTable(), writer);
    }
    LOGGER.info("Wrote %d points of spectrum '%s' to %s", spectrum.size(), spectrum.getName(), file);
  }

  public void write(SpectrumTable table, Writer writer) throws IOException {
    List<String> header = table.getColumnNames();
    CSVPrinter printer = new CSVPrinter(writer, format.withHeader(header.toArray(new String[header.size()])));
    for (int i = 0; i < table.getRowCount(); i++) {
      printer.printRecord(table.getRow(i));
    }
    printer.flush();
  }
}
