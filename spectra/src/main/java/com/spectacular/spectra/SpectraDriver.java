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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spectacular.spectra.engine.SpectralWorkspace;
import com.spectacular.spectra.operations.OperationArguments;
import com.spectacular.spectra.operations.OperationDefinition;
import com.spectacular.spectra.operations.OperationFamily;
import com.spectacular.utils.CLIUtil;
import com.spectacular.utils.DelimitedTableParser;
import com.spectacular.utils.SpectrumWriter;
import com.spectacular.utils.UnsupportedFileTypeException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Command line entry point: loads tables, derives spectra from their columns, runs one operation and writes out the
 * result.
 */
public class SpectraDriver {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectraDriver.class);

  public static final String OPTION_TABLE = "t";
  public static final String OPTION_FILE_TYPE = "f";
  public static final String OPTION_DELIMITER = "d";
  public static final String OPTION_SPECTRUM = "s";
  public static final String OPTION_OPERATION = "o";
  public static final String OPTION_FAMILY = "F";
  public static final String OPTION_OPERANDS = "a";
  public static final String OPTION_RESULT = "r";
  public static final String OPTION_LEFT_INDEX = "l";
  public static final String OPTION_RIGHT_INDEX = "R";
  public static final String OPTION_MINERAL = "m";
  public static final String OPTION_OUTPUT = "w";
  public static final String OPTION_JSON = "j";
  public static final String OPTION_LIST_OPERATIONS = "L";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "Loads tables of spectral measurements, builds named spectra from pairs of their columns, ",
      "and applies one operation (arithmetic, unit conversion, zeroing or a mineral grinding curve) to them. ",
      "The result can be written out as a delimited table, and all spectra can be dumped as JSON."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_TABLE)
        .argName("name=path")
        .desc("A table to load; the name defaults to the path")
        .hasArgs()
        .longOpt("table")
    );
    add(Option.builder(OPTION_FILE_TYPE)
        .argName("type")
        .desc("The layout of the table files: csv, tsv or fwf; guessed from the extension by default")
        .hasArg()
        .longOpt("file-type")
    );
    add(Option.builder(OPTION_DELIMITER)
        .argName("char")
        .desc("A delimiter overriding the file type's default")
        .hasArg()
        .longOpt("delimiter")
    );
    add(Option.builder(OPTION_SPECTRUM)
        .argName("name=table:x:y")
        .desc("A spectrum to build from the x and y columns of a loaded table")
        .hasArgs()
        .longOpt("spectrum")
    );
    add(Option.builder(OPTION_OPERATION)
        .argName("operation")
        .desc("The operation to apply, e.g. add, divide, toTransmittance, zero, grindingCurve")
        .hasArg()
        .longOpt("operation")
    );
    add(Option.builder(OPTION_FAMILY)
        .argName("family")
        .desc("The operation family (spectrum or parameterised); found from the operation name by default")
        .hasArg()
        .longOpt("family")
    );
    add(Option.builder(OPTION_OPERANDS)
        .argName("spectrum names")
        .desc("The names of the spectra to operate on, comma separated")
        .hasArgs()
        .valueSeparator(',')
        .longOpt("operands")
    );
    add(Option.builder(OPTION_RESULT)
        .argName("name")
        .desc("The name of the result spectrum; zeroing without a name replaces its operand")
        .hasArg()
        .longOpt("result")
    );
    add(Option.builder(OPTION_LEFT_INDEX)
        .argName("index")
        .desc("The first position to zero")
        .hasArg()
        .longOpt("left-index")
    );
    add(Option.builder(OPTION_RIGHT_INDEX)
        .argName("index")
        .desc("The position after the last one to zero")
        .hasArg()
        .longOpt("right-index")
    );
    add(Option.builder(OPTION_MINERAL)
        .argName("mineral")
        .desc(String.format("The mineral for a grinding curve, one of %s (default CALCITE)",
            Arrays.toString(Minerals.values())))
        .hasArg()
        .longOpt("mineral")
    );
    add(Option.builder(OPTION_OUTPUT)
        .argName("path")
        .desc("Write the result spectrum to this file")
        .hasArg()
        .longOpt("write-result")
    );
    add(Option.builder(OPTION_JSON)
        .argName("path")
        .desc("Write every spectrum in the session to this file as JSON")
        .hasArg()
        .longOpt("json")
    );
    add(Option.builder(OPTION_LIST_OPERATIONS)
        .desc("List the available operations and exit")
        .longOpt("list-operations")
    );
  }};

  private final SpectralWorkspace workspace;

  public SpectraDriver(SpectralWorkspace workspace) {
    this.workspace = workspace;
  }

  public static void main(String[] args) {
    CLIUtil cliUtil = new CLIUtil(SpectraDriver.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    if (cl.hasOption(OPTION_LIST_OPERATIONS)) {
      listOperations();
      return;
    }

    try {
      new SpectraDriver(new SpectralWorkspace()).run(cl);
    } catch (SpectralException | IllegalArgumentException | NoSuchElementException e) {
      cliUtil.failWithMessage("%s", e.getMessage());
    } catch (IOException | UnsupportedFileTypeException e) {
      LOGGER.error("Unable to read or write data: %s", e.getMessage());
      System.exit(1);
    }
  }

  private static void listOperations() {
    for (OperationFamily family : OperationFamily.values()) {
      for (OperationDefinition op : family.getOperations()) {
        LOGGER.info("%s: %s (%s)", family.getShortName(), op.getName(),
            op.isVariadic() ? "one or more spectra" : op.getArity() + " spectra");
      }
    }
  }

  /**
   * Carries out everything the command line asks for.
   * @return The result spectrum, or null if no operation was requested.
   */
  public Spectrum run(CommandLine cl) throws IOException, UnsupportedFileTypeException {
    loadTables(cl);
    createSpectra(cl);

    Spectrum result = null;
    if (cl.hasOption(OPTION_OPERATION)) {
      result = applyOperation(cl);
      LOGGER.info("Created %s", result);

      if (cl.hasOption(OPTION_OUTPUT)) {
        File out = new File(cl.getOptionValue(OPTION_OUTPUT));
        new SpectrumWriter(DelimitedTableParser.FileType.fromFileName(out.getName())).write(result, out);
      }
    }

    if (cl.hasOption(OPTION_JSON)) {
      File jsonFile = new File(cl.getOptionValue(OPTION_JSON));
      new ObjectMapper().writerWithDefaultPrettyPrinter().writeValue(jsonFile, workspace.getSpectra());
      LOGGER.info("Wrote %d spectra to %s", workspace.getSpectra().size(), jsonFile);
    }
    return result;
  }

  private void loadTables(CommandLine cl) throws IOException, UnsupportedFileTypeException {
    if (!cl.hasOption(OPTION_TABLE)) {
      return;
    }

    Character delimiter = null;
    if (cl.hasOption(OPTION_DELIMITER)) {
      String d = cl.getOptionValue(OPTION_DELIMITER);
      if (d.length() != 1) {
        throw new IllegalArgumentException(String.format("Delimiter must be a single character, got '%s'", d));
      }
      delimiter = d.charAt(0);
    }

    for (String spec : cl.getOptionValues(OPTION_TABLE)) {
      String name = spec;
      String path = spec;
      if (spec.contains("=")) {
        name = StringUtils.substringBefore(spec, "=");
        path = StringUtils.substringAfter(spec, "=");
      }

      DelimitedTableParser.FileType fileType = cl.hasOption(OPTION_FILE_TYPE) ?
          DelimitedTableParser.FileType.valueOf(cl.getOptionValue(OPTION_FILE_TYPE).toUpperCase()) :
          DelimitedTableParser.FileType.fromFileName(path);
      workspace.addTable(name, new DelimitedTableParser(fileType, delimiter).parse(new File(path)));
    }
  }

  private void createSpectra(CommandLine cl) {
    if (!cl.hasOption(OPTION_SPECTRUM)) {
      return;
    }

    for (String spec : cl.getOptionValues(OPTION_SPECTRUM)) {
      String name = StringUtils.substringBefore(spec, "=");
      String[] source = StringUtils.substringAfter(spec, "=").split(":", 3);
      if (StringUtils.isBlank(name) || source.length != 3) {
        throw new IllegalArgumentException(String.format(
            "Spectrum definitions look like name=table:xColumn:yColumn, got '%s'", spec));
      }
      Spectrum spectrum = workspace.createSpectrum(name, source[0], source[1], source[2]);
      LOGGER.info("Created %s", spectrum);
    }
  }

  private Spectrum applyOperation(CommandLine cl) {
    String operation = cl.getOptionValue(OPTION_OPERATION);
    OperationFamily family = cl.hasOption(OPTION_FAMILY) ?
        OperationFamily.fromShortName(cl.getOptionValue(OPTION_FAMILY)) :
        OperationFamily.forOperation(operation);
    List<String> operands = cl.hasOption(OPTION_OPERANDS) ?
        Arrays.asList(cl.getOptionValues(OPTION_OPERANDS)) : Collections.<String>emptyList();
    String resultName = cl.getOptionValue(OPTION_RESULT);

    if ("zero".equals(operation) && family == OperationFamily.PARAMETERISED_OPERATIONS) {
      if (operands.size() != 1) {
        throw new InvalidOperandException(String.format("zero takes one spectrum, got %d", operands.size()));
      }
      return workspace.zero(operands.get(0), resultName,
          Integer.parseInt(cl.getOptionValue(OPTION_LEFT_INDEX, "0")),
          Integer.parseInt(cl.getOptionValue(OPTION_RIGHT_INDEX, "0")));
    }

    if (StringUtils.isBlank(resultName)) {
      throw new IllegalArgumentException(String.format("Operation '%s' needs a result name", operation));
    }

    OperationArguments arguments = OperationArguments.none();
    if (cl.hasOption(OPTION_MINERAL)) {
      arguments.with(OperationArguments.MINERAL, Minerals.fromName(cl.getOptionValue(OPTION_MINERAL)).getMineral());
    }
    return workspace.apply(family, operation, resultName, operands, arguments);
  }
}
