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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A name-keyed store holding at most one value per name.  Inserting under a name that is already taken replaces the
 * previous value.
 *
 * All access is synchronized so that concurrent callers see inserts, overwrites and removals one at a time.  Values
 * must be fully built before they are published here.
 * @param <V> The type of the stored values.
 */
public class Registry<V> {
  private final Map<String, V> entries = new LinkedHashMap<>();

  /**
   * Stores a value, replacing any value already held under the same name.
   * @return The value that was replaced, or null if the name was free.
   */
  public synchronized V upsert(String name, V value) {
    if (name == null || value == null) {
      throw new IllegalArgumentException("Registry names and values must not be null");
    }
    return entries.put(name, value);
  }

  public synchronized V get(String name) {
    return entries.get(name);
  }

  public synchronized boolean contains(String name) {
    return entries.containsKey(name);
  }

  /**
   * Removes the value held under a name.
   * @return The removed value, or null if there was none.
   */
  public synchronized V remove(String name) {
    return entries.remove(name);
  }

  public synchronized int size() {
    return entries.size();
  }

  /**
   * Get the names in insertion order.  Overwriting a name keeps its original position.
   */
  public synchronized List<String> names() {
    return new ArrayList<>(entries.keySet());
  }

  /**
   * Get a point-in-time copy of the contents.
   */
  public synchronized Map<String, V> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
  }

  public synchronized void clear() {
    entries.clear();
  }
}
