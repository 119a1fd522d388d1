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

public class Wavelet_db1 extends Wavelet {

  private static final double[] DEC_LO = new double[] { 0.7071067811865476, 0.7071067811865476 };
  private static final double[] DEC_HI = new double[] { -0.7071067811865476, 0.7071067811865476 };
  private static final double[] REC_LO = new double[] { 0.7071067811865476, 0.7071067811865476 };
  private static final double[] REC_HI = new double[] { 0.7071067811865476, -0.7071067811865476 };

  public Wavelet_db1() {
    super("db1", Family.DAUBECHIES, 1, DEC_LO, DEC_HI, REC_LO, REC_HI);
  }
}
