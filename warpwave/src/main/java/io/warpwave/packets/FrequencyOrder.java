//
//   Copyright 2021  SenX S.A.S.
//
//   Licensed under the Apache License, Version 2.0 (the "License");
//   you may not use this file except in compliance with the License.
//   You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
//   Unless required by applicable law or agreed to in writing, software
//   distributed under the License is distributed on an "AS IS" BASIS,
//   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
//   See the License for the specific language governing permissions and
//   limitations under the License.
//

package io.warpwave.packets;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

/**
 * Orderings of the paths of a packet tree level.
 *
 * The natural order enumerates paths in alphabet order. The frequency order
 * sorts the 1D paths by ascending frequency band: the high pass filter mirrors
 * the spectrum, so the order of the children of a 'd' node is reversed, which
 * gives the reflected binary Gray code. 2D paths are sorted along both axes.
 */
public final class FrequencyOrder {

  public static final String ALPHABET_1D = "ad";
  public static final String ALPHABET_2D = "ahvd";

  private FrequencyOrder() {}

  /**
   * Cartesian product of the alphabet, 'level' times.
   */
  public static List<String> naturalOrder(int level, String alphabet) {
    Preconditions.checkArgument(level >= 0, "Level must be positive, got %s.", level);

    List<String> order = new ArrayList<String>();
    order.add("");

    for (int l = 0; l < level; l++) {
      List<String> next = new ArrayList<String>(order.size() * alphabet.length());
      for (String path : order) {
        for (int i = 0; i < alphabet.length(); i++) {
          next.add(path + alphabet.charAt(i));
        }
      }
      order = next;
    }

    return order;
  }

  /**
   * Reflected Gray code of the paths of a level.
   *
   * @param low symbol of the low pass band
   * @param high symbol of the high pass band
   */
  public static List<String> grayCode(int level, char low, char high) {
    Preconditions.checkArgument(level >= 0, "Level must be positive, got %s.", level);

    List<String> order = new ArrayList<String>();
    order.add("");

    for (int l = 0; l < level; l++) {
      List<String> next = new ArrayList<String>(2 * order.size());
      for (String path : order) {
        next.add(low + path);
      }
      List<String> reversed = new ArrayList<String>(order);
      Collections.reverse(reversed);
      for (String path : reversed) {
        next.add(high + path);
      }
      order = next;
    }

    return order;
  }

  /**
   * Frequency ordered paths of a 1D packet tree level.
   */
  public static List<String> getFreqOrder1D(int level) {
    return grayCode(level, ALPHABET_1D.charAt(0), ALPHABET_1D.charAt(1));
  }

  /**
   * Frequency ordered grid of the paths of a 2D packet tree level.
   *
   * Each 2D symbol is a pair of 1D bands (height band, width band), 'a' is
   * low/low, 'h' high/low, 'v' low/high and 'd' high/high. Rows of the result
   * share the same height band path, columns the same width band path, both in
   * ascending frequency.
   */
  public static List<List<String>> getFreqOrder(int level) {
    Preconditions.checkArgument(level >= 1, "Level must be at least 1, got %s.", level);

    Map<String, Map<String, String>> grid = new LinkedHashMap<String, Map<String, String>>();

    for (String path : naturalOrder(level, ALPHABET_2D)) {
      StringBuilder rows = new StringBuilder();
      StringBuilder cols = new StringBuilder();

      for (int i = 0; i < path.length(); i++) {
        String bands = expand(path.charAt(i));
        rows.append(bands.charAt(0));
        cols.append(bands.charAt(1));
      }

      Map<String, String> row = grid.get(rows.toString());

      if (null == row) {
        row = new LinkedHashMap<String, String>();
        grid.put(rows.toString(), row);
      }

      row.put(cols.toString(), path);
    }

    List<String> bandOrder = grayCode(level, 'l', 'h');

    List<List<String>> order = new ArrayList<List<String>>();

    for (String rowPath : bandOrder) {
      Map<String, String> row = grid.get(rowPath);
      if (null == row) {
        continue;
      }
      List<String> line = new ArrayList<String>();
      for (String colPath : bandOrder) {
        String path = row.get(colPath);
        if (null != path) {
          line.add(path);
        }
      }
      order.add(line);
    }

    return order;
  }

  private static String expand(char symbol) {
    switch (symbol) {
      case 'a':
        return "ll";
      case 'h':
        return "hl";
      case 'v':
        return "lh";
      case 'd':
        return "hh";
      default:
        throw new IllegalArgumentException("Unknown 2D packet symbol '" + symbol + "'.");
    }
  }
}
