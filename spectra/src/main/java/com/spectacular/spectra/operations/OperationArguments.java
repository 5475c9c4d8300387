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

import com.spectacular.spectra.Mineral;
import com.spectacular.spectra.MissingArgumentException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * The extra, non-spectral arguments of an operation, keyed by name.
 */
public class OperationArguments {
  public static final String LEFT_INDEX = "left_index";
  public static final String RIGHT_INDEX = "right_index";
  public static final String MINERAL = "mineral";

  private final Map<String, Object> values = new HashMap<>();

  public static OperationArguments none() {
    return new OperationArguments();
  }

  public OperationArguments with(String key, Object value) {
    values.put(key, value);
    return this;
  }

  public boolean has(String key) {
    return values.containsKey(key);
  }

  public Integer getInteger(String key, Integer defaultValue) {
    return get(key, Integer.class, defaultValue);
  }

  public Mineral getMineral(String key, Mineral defaultValue) {
    return get(key, Mineral.class, defaultValue);
  }

  public Map<String, Object> asMap() {
    return Collections.unmodifiableMap(values);
  }

  private <T> T get(String key, Class<T> type, T defaultValue) {
    Object value = values.get(key);
    if (value == null) {
      if (defaultValue == null) {
        throw new MissingArgumentException(String.format("Required argument '%s' was not supplied", key));
      }
      return defaultValue;
    }
    if (!type.isInstance(value)) {
      throw new MissingArgumentException(String.format("Argument '%s' should be a %s but is a %s",
          key, type.getSimpleName(), value.getClass().getSimpleName()));
    }
    return type.cast(value);
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
