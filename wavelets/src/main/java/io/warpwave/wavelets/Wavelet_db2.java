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

public class Wavelet_db2 extends Wavelet {

  private static final double[] DEC_LO = new double[] { -0.12940952255092145, 0.22414386804185735, 0.836516303737469, 0.48296291314469025 };
  private static final double[] DEC_HI = new double[] { -0.48296291314469025, 0.836516303737469, -0.22414386804185735, -0.12940952255092145 };
  private static final double[] REC_LO = new double[] { 0.48296291314469025, 0.836516303737469, 0.22414386804185735, -0.12940952255092145 };
  private static final double[] REC_HI = new double[] { -0.12940952255092145, -0.22414386804185735, 0.836516303737469, -0.48296291314469025 };

  public Wavelet_db2() {
    super("db2", Family.DAUBECHIES, 2, DEC_LO, DEC_HI, REC_LO, REC_HI);
  }
}
