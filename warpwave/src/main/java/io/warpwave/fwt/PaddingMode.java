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

package io.warpwave.fwt;

import io.warpwave.InvalidPaddingModeException;

/**
 * Signal extension applied before filtering.
 */
public enum PaddingMode {
  /**
   * Zeros outside of the signal
   */
  ZERO("zero"),
  /**
   * Edge values repeated
   */
  CONSTANT("constant"),
  /**
   * Mirror image of the signal, edge samples are not repeated
   */
  REFLECT("reflect"),
  /**
   * Signal repeated periodically
   */
  PERIODIC("periodic"),
  /**
   * No extension, orthogonalized boundary matrices are used instead of padding
   */
  BOUNDARY("boundary");

  private final String name;

  private PaddingMode(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public static PaddingMode fromString(String name) {
    if (null != name) {
      for (PaddingMode mode : values()) {
        if (mode.name.equals(name)) {
          return mode;
        }
      }
    }

    throw new InvalidPaddingModeException(name);
  }

  /**
   * Maps a position of the extended signal onto the original one.
   *
   * @param i position, may be negative or greater than n - 1
   * @param n length of the signal
   * @return index of the sample to read, or -1 if the extended sample is zero
   */
  public int extend(int i, int n) {
    if (i >= 0 && i < n) {
      return i;
    }

    switch (this) {
      case ZERO:
        return -1;
      case CONSTANT:
        return i < 0 ? 0 : n - 1;
      case PERIODIC:
        return Math.floorMod(i, n);
      case REFLECT:
        if (1 == n) {
          return 0;
        }
        int period = 2 * (n - 1);
        int idx = Math.floorMod(i, period);
        return idx < n ? idx : period - idx;
      default:
        throw new IllegalStateException("Mode '" + name + "' does not extend signals.");
    }
  }

  @Override
  public String toString() {
    return name;
  }
}
