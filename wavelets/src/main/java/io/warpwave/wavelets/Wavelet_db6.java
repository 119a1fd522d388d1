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

public class Wavelet_db6 extends Wavelet {

  private static final double[] DEC_LO = new double[] { -0.00107730108499558, 0.004777257511010651, 0.0005538422009938016, -0.031582039318031156, 0.02752286553001629, 0.09750160558707936, -0.12976686756709563, -0.22626469396516913, 0.3152503517092432, 0.7511339080215775, 0.4946238903983854, 0.11154074335008017 };
  private static final double[] DEC_HI = new double[] { -0.11154074335008017, 0.4946238903983854, -0.7511339080215775, 0.3152503517092432, 0.22626469396516913, -0.12976686756709563, -0.09750160558707936, 0.02752286553001629, 0.031582039318031156, 0.0005538422009938016, -0.004777257511010651, -0.00107730108499558 };
  private static final double[] REC_LO = new double[] { 0.11154074335008017, 0.4946238903983854, 0.7511339080215775, 0.3152503517092432, -0.22626469396516913, -0.12976686756709563, 0.09750160558707936, 0.02752286553001629, -0.031582039318031156, 0.0005538422009938016, 0.004777257511010651, -0.00107730108499558 };
  private static final double[] REC_HI = new double[] { -0.00107730108499558, -0.004777257511010651, 0.0005538422009938016, 0.031582039318031156, 0.02752286553001629, -0.09750160558707936, -0.12976686756709563, 0.22626469396516913, 0.3152503517092432, -0.7511339080215775, 0.4946238903983854, -0.11154074335008017 };

  public Wavelet_db6() {
    super("db6", Family.DAUBECHIES, 6, DEC_LO, DEC_HI, REC_LO, REC_HI);
  }
}
