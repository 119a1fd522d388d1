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

package io.warpwave.wavelets;

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Coefficients of a named wavelet, stored in the order used by PyWavelets'
 * filter_bank property.
 */
public abstract class Wavelet implements FilterBankSource {

  public enum Family {
    HAAR("haar", true),
    DAUBECHIES("db", true),
    SYMLETS("sym", true),
    COIFLETS("coif", true),
    BIORTHOGONAL("bior", false),
    REVERSE_BIORTHOGONAL("rbio", false);

    private final String shortName;
    private final boolean orthogonal;

    private Family(String shortName, boolean orthogonal) {
      this.shortName = shortName;
      this.orthogonal = orthogonal;
    }

    public String getShortName() {
      return shortName;
    }

    public boolean isOrthogonal() {
      return orthogonal;
    }
  }

  private final String name;
  private final Family family;
  private final int vanishingMomentsPsi;

  private final double[] decLo;
  private final double[] decHi;
  private final double[] recLo;
  private final double[] recHi;

  protected Wavelet(String name, Family family, int vanishingMomentsPsi, double[] decLo, double[] decHi, double[] recLo, double[] recHi) {
    Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(family);
    Preconditions.checkArgument(decLo.length == decHi.length && decLo.length == recLo.length && decLo.length == recHi.length, "Wavelet '%s' has filters of unequal lengths.", name);

    this.name = name;
    this.family = family;
    this.vanishingMomentsPsi = vanishingMomentsPsi;
    this.decLo = decLo;
    this.decHi = decHi;
    this.recLo = recLo;
    this.recHi = recHi;
  }

  public String getName() {
    return name;
  }

  public Family getFamily() {
    return family;
  }

  public int getVanishingMomentsPsi() {
    return vanishingMomentsPsi;
  }

  public boolean isOrthogonal() {
    return family.isOrthogonal();
  }

  /**
   * Every wavelet of the catalog, orthogonal ones included, is biorthogonal.
   */
  public boolean isBiorthogonal() {
    return true;
  }

  /**
   * Length of the filters, i.e. the support of the wavelet.
   */
  public int getFilterLength() {
    return decLo.length;
  }

  public double[] getDecompositionLowPass() {
    return decLo.clone();
  }

  public double[] getDecompositionHighPass() {
    return decHi.clone();
  }

  public double[] getReconstructionLowPass() {
    return recLo.clone();
  }

  public double[] getReconstructionHighPass() {
    return recHi.clone();
  }

  @Override
  public List<double[]> getFilters() {
    return Arrays.asList(getDecompositionLowPass(), getDecompositionHighPass(), getReconstructionLowPass(), getReconstructionHighPass());
  }

  @Override
  public String toString() {
    return "Wavelet(" + name + ", " + family.getShortName() + ", length=" + decLo.length + ")";
  }
}
