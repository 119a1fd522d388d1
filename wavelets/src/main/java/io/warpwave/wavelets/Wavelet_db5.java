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

public class Wavelet_db5 extends Wavelet {

  private static final double[] DEC_LO = new double[] { 0.003335725285001549, -0.012580751999015526, -0.006241490213011705, 0.07757149384006515, -0.03224486958502952, -0.24229488706619015, 0.13842814590110342, 0.7243085284385744, 0.6038292697974729, 0.160102397974125 };
  private static final double[] DEC_HI = new double[] { -0.160102397974125, 0.6038292697974729, -0.7243085284385744, 0.13842814590110342, 0.24229488706619015, -0.03224486958502952, -0.07757149384006515, -0.006241490213011705, 0.012580751999015526, 0.003335725285001549 };
  private static final double[] REC_LO = new double[] { 0.160102397974125, 0.6038292697974729, 0.7243085284385744, 0.13842814590110342, -0.24229488706619015, -0.03224486958502952, 0.07757149384006515, -0.006241490213011705, -0.012580751999015526, 0.003335725285001549 };
  private static final double[] REC_HI = new double[] { 0.003335725285001549, 0.012580751999015526, -0.006241490213011705, -0.07757149384006515, -0.03224486958502952, 0.24229488706619015, 0.13842814590110342, -0.7243085284385744, 0.6038292697974729, -0.160102397974125 };

  public Wavelet_db5() {
    super("db5", Family.DAUBECHIES, 5, DEC_LO, DEC_HI, REC_LO, REC_HI);
  }
}
