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

public class Wavelet_bior28 extends Wavelet {

  private static final double[] DEC_LO = new double[] { 0.0, 0.0015105430506304422, -0.0030210861012608843, -0.012947511862546647, 0.02891610982635418, 0.052998481890690945, -0.13491307360773608, -0.16382918343409025, 0.4625714404759166, 0.9516421218971786, 0.4625714404759166, -0.16382918343409025, -0.13491307360773608, 0.052998481890690945, 0.02891610982635418, -0.012947511862546647, -0.0030210861012608843, 0.0015105430506304422 };
  private static final double[] DEC_HI = new double[] { 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.3535533905932738, -0.7071067811865476, 0.3535533905932738, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0 };
  private static final double[] REC_LO = new double[] { 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.3535533905932738, 0.7071067811865476, 0.3535533905932738, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0 };
  private static final double[] REC_HI = new double[] { 0.0, -0.0015105430506304422, -0.0030210861012608843, 0.012947511862546647, 0.02891610982635418, -0.052998481890690945, -0.13491307360773608, 0.16382918343409025, 0.4625714404759166, -0.9516421218971786, 0.4625714404759166, 0.16382918343409025, -0.13491307360773608, -0.052998481890690945, 0.02891610982635418, 0.012947511862546647, -0.0030210861012608843, -0.0015105430506304422 };

  public Wavelet_bior28() {
    super("bior2.8", Family.BIORTHOGONAL, 2, DEC_LO, DEC_HI, REC_LO, REC_HI);
  }
}
