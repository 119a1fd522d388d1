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

import io.warpwave.wavelets.FilterBankSource;

import java.util.Arrays;
import java.util.List;

/**
 * Validated filter quadruple.
 *
 * Decomposition filters are also kept time-reversed, as the analysis step
 * correlates the extended signal with them, reconstruction filters are used
 * in their natural order.
 */
public final class FilterBank implements FilterBankSource {

  private final String name;

  private final double[] decLo;
  private final double[] decHi;
  private final double[] recLo;
  private final double[] recHi;

  private final double[] decLoKernel;
  private final double[] decHiKernel;

  FilterBank(String name, double[] decLo, double[] decHi, double[] recLo, double[] recHi) {
    this.name = name;
    this.decLo = decLo.clone();
    this.decHi = decHi.clone();
    this.recLo = recLo.clone();
    this.recHi = recHi.clone();
    this.decLoKernel = reverse(decLo);
    this.decHiKernel = reverse(decHi);
  }

  public String getName() {
    return name;
  }

  public int length() {
    return decLo.length;
  }

  @Override
  public List<double[]> getFilters() {
    return Arrays.asList(decLo.clone(), decHi.clone(), recLo.clone(), recHi.clone());
  }

  double[] decLo() {
    return decLo;
  }

  double[] decHi() {
    return decHi;
  }

  double[] recLo() {
    return recLo;
  }

  double[] recHi() {
    return recHi;
  }

  double[] decLoKernel() {
    return decLoKernel;
  }

  double[] decHiKernel() {
    return decHiKernel;
  }

  /**
   * Checks numerically that the bank is orthogonal: reconstruction filters are
   * the time-reverse of the decomposition ones and the decomposition filters
   * are orthonormal under even shifts.
   */
  public boolean isOrthogonal(double tolerance) {
    int len = decLo.length;

    if (0 != len % 2) {
      return false;
    }

    for (int i = 0; i < len; i++) {
      if (Math.abs(recLo[i] - decLo[len - 1 - i]) > tolerance || Math.abs(recHi[i] - decHi[len - 1 - i]) > tolerance) {
        return false;
      }
    }

    for (int shift = -len + 2; shift < len; shift += 2) {
      double expected = 0 == shift ? 1.0D : 0.0D;

      if (Math.abs(correlate(decLo, decLo, shift) - expected) > tolerance
          || Math.abs(correlate(decHi, decHi, shift) - expected) > tolerance
          || Math.abs(correlate(decLo, decHi, shift)) > tolerance) {
        return false;
      }
    }

    return true;
  }

  private static double correlate(double[] a, double[] b, int shift) {
    double sum = 0.0D;
    for (int j = 0; j < a.length; j++) {
      int k = j + shift;
      if (k >= 0 && k < b.length) {
        sum += a[j] * b[k];
      }
    }
    return sum;
  }

  private static double[] reverse(double[] filter) {
    double[] reversed = new double[filter.length];
    for (int i = 0; i < filter.length; i++) {
      reversed[i] = filter[filter.length - 1 - i];
    }
    return reversed;
  }

  @Override
  public String toString() {
    return "FilterBank(" + name + ", length=" + decLo.length + ")";
  }
}
