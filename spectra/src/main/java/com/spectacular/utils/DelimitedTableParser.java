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

import com.spectacular.spectra.SpectrumTable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads delimited or fixed-width text files of spectral measurements into {@link SpectrumTable}s.
 *
 * If any cell of the first row is not a number, that row is used as the header.  Otherwise the columns are named
 * w0, w1, ... in order.  In delimited files a space is a thousands separator and is removed before parsing numbers.
 * Empty cells are missing values.
 */
public class DelimitedTableParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DelimitedTableParser.class);

  public static final String DEFAULT_COLUMN_PREFIX = "w";

  public enum FileType {
    CSV(','),
    TSV('\t'),
    // Columns separated by runs of whitespace.
    FWF(null),
    ;

    private final Character delimiter;

    FileType(Character delimiter) {
      this.delimiter = delimiter;
    }

    public Character getDelimiter() {
      return delimiter;
    }

    /**
     * Guesses the file type from a file name's extension, falling back to CSV.
     */
    public static FileType fromFileName(String fileName) {
      String lower = fileName.toLowerCase();
      if (lower.endsWith(".tsv") || lower.endsWith(".tab")) {
        return TSV;
      }
      if (lower.endsWith(".fwf") || lower.endsWith(".dat") || lower.endsWith(".prn")) {
        return FWF;
      }
      return CSV;
    }
  }

  private final FileType fileType;
  private final Character delimiter;

  public DelimitedTableParser(FileType fileType) {
    this(fileType, null);
  }

  /**
   * @param fileType The layout of the files to read.
   * @param delimiter A delimiter overriding the file type's default one, or null.
   */
  public DelimitedTableParser(FileType fileType, Character delimiter) {
    this.fileType = fileType;
    this.delimiter = delimiter != null ? delimiter : fileType.getDelimiter();
  }

  public SpectrumTable parse(File file) throws IOException, UnsupportedFileTypeException {
    if (!file.isFile()) {
      throw new FileNotFoundException(String.format("File %s could not be found.", file));
    }
    try (InputStream in = new FileInputStream(file)) {
      SpectrumTable table = parse(in, file);
      LOGGER.info("Loaded %d columns x %d rows from %s", table.getColumnCount(), table.getRowCount(), file);
      return table;
    }
  }

  public SpectrumTable parse(InputStream inStream, File source) throws IOException, UnsupportedFileTypeException {
    List<List<String>> records = delimiter == null ? readWhitespaceSeparated(inStream) : readDelimited(inStream, source);
    if (records.isEmpty()) {
      throw new UnsupportedFileTypeException(source, "no rows found");
    }

    List<String> first = records.get(0);
    boolean hasHeader = false;
    for (String cell : first) {
      if (!StringUtils.isBlank(cell) && !isNumeric(cell)) {
        hasHeader = true;
        break;
      }
    }

    int width = 0;
    for (List<String> record : records) {
      width = Math.max(width, record.size());
    }

    List<String> header = hasHeader ? makeHeader(first, width) : defaultHeader(width);
    List<List<Double>> rows = new ArrayList<>(records.size());
    for (int r = hasHeader ? 1 : 0; r < records.size(); r++) {
      List<String> record = records.get(r);
      List<Double> row = new ArrayList<>(record.size());
      for (int c = 0; c < record.size(); c++) {
        row.add(parseCell(record.get(c), r, header.get(c), source));
      }
      rows.add(row);
    }

    if (hasHeader) {
      LOGGER.debug("Using header row of %s: %s", source, header);
    }
    return SpectrumTable.fromRows(header, rows);
  }

  private List<List<String>> readDelimited(InputStream inStream, File source) throws UnsupportedFileTypeException {
    CSVFormat format = CSVFormat.newFormat(delimiter).
        withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true).withIgnoreSurroundingSpaces(true);

    List<List<String>> records = new ArrayList<>();
    Reader reader = new InputStreamReader(inStream, StandardCharsets.UTF_8);
    try (CSVParser parser = new CSVParser(reader, format)) {
      for (CSVRecord record : parser) {
        List<String> cells = new ArrayList<>(record.size());
        for (String cell : record) {
          cells.add(cell);
        }
        records.add(cells);
      }
    } catch (IOException | UncheckedIOException | IllegalStateException e) {
      throw new UnsupportedFileTypeException(source, e);
    }
    return records;
  }

  private List<List<String>> readWhitespaceSeparated(InputStream inStream) throws IOException {
    List<List<String>> records = new ArrayList<>();
    BufferedReader reader = new BufferedReader(new InputStreamReader(inStream, StandardCharsets.UTF_8));
    String line;
    while ((line = reader.readLine()) != null) {
      if (StringUtils.isBlank(line)) {
        continue;
      }
      records.add(Arrays.asList(line.trim().split("\\s+")));
    }
    return records;
  }

  private Double parseCell(String cell, int row, String column, File source) throws UnsupportedFileTypeException {
    if (StringUtils.isBlank(cell)) {
      return null;
    }
    Double value = toNumber(cell);
    if (value == null) {
      throw new UnsupportedFileTypeException(source,
          String.format("non-numeric value '%s' in row %d, column '%s'", cell, row, column));
    }
    return value;
  }

  private boolean isNumeric(String cell) {
    return toNumber(cell) != null;
  }

  /**
   * Reads a plain decimal number, optionally in scientific notation, after removing thousands separators.
   * @return The value, or null for anything else (including Java literal forms like 1f, 0x10 and Infinity).
   */
  static Double toNumber(String cell) {
    String stripped = StringUtils.deleteWhitespace(cell);
    if (NumberUtils.isParsable(stripped)) {
      return Double.valueOf(stripped);
    }
    // isParsable has no exponents; isCreatable does, but also takes hex and type suffixes.
    if (!NumberUtils.isCreatable(stripped) || StringUtils.containsAny(stripped, 'x', 'X')) {
      return null;
    }
    char last = stripped.charAt(stripped.length() - 1);
    if (!Character.isDigit(last) && last != '.') {
      return null;
    }
    return Double.valueOf(stripped);
  }

  // Blank header cells get positional names and repeated names get a .N suffix so every column is addressable.
  private static List<String> makeHeader(List<String> first, int width) {
    List<String> header = new ArrayList<>(width);
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < width; i++) {
      String name = i < first.size() && !StringUtils.isBlank(first.get(i)) ?
          first.get(i).trim() : DEFAULT_COLUMN_PREFIX + i;
      String unique = name;
      int suffix = 1;
      while (seen.contains(unique)) {
        unique = name + "." + suffix++;
      }
      seen.add(unique);
      header.add(unique);
    }
    return header;
  }

  private static List<String> defaultHeader(int width) {
    List<String> header = new ArrayList<>(width);
    for (int i = 0; i < width; i++) {
      header.add(DEFAULT_COLUMN_PREFIX + i);
    }
    return header;
  }
}
