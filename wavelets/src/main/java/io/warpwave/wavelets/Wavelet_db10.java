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

public class Wavelet_db10 extends Wavelet {

  private static final double[] DEC_LO = new double[] { -1.326420300235487e-05, 9.358867000108985e-05, -0.0001164668549943862, -0.0006858566950046825, 0.00199240529499085, 0.0013953517469940798, -0.010733175482979604, 0.0036065535669883944, 0.03321267405893324, -0.02945753682194567, -0.07139414716586077, 0.09305736460380659, 0.12736934033574265, -0.19594627437659665, -0.24984642432648865, 0.2811723436604265, 0.6884590394525921, 0.5272011889309198, 0.18817680007762133, 0.026670057900950818 };
  private static final double[] DEC_HI = new double[] { -0.026670057900950818, 0.18817680007762133, -0.5272011889309198, 0.6884590394525921, -0.2811723436604265, -0.24984642432648865, 0.19594627437659665, 0.12736934033574265, -0.09305736460380659, -0.07139414716586077, 0.02945753682194567, 0.03321267405893324, -0.0036065535669883944, -0.010733175482979604, -0.0013953517469940798, 0.00199240529499085, 0.0006858566950046825, -0.0001164668549943862, -9.358867000108985e-05, -1.326420300235487e-05 };
  private static final double[] REC_LO = new double[] { 0.026670057900950818, 0.18817680007762133, 0.5272011889309198, 0.6884590394525921, 0.2811723436604265, -0.24984642432648865, -0.19594627437659665, 0.12736934033574265, 0.09305736460380659, -0.07139414716586077, -0.02945753682194567, 0.03321267405893324, 0.0036065535669883944, -0.010733175482979604, 0.0013953517469940798, 0.00199240529499085, -0.0006858566950046825, -0.0001164668549943862, 9.358867000108985e-05, -1.326420300235487e-05 };
  private static final double[] REC_HI = new double[] { -1.326420300235487e-05, -9.358867000108985e-05, -0.0001164668549943862, 0.0006858566950046825, 0.00199240529499085, -0.0013953517469940798, -0.010733175482979604, -0.0036065535669883944, 0.03321267405893324, 0.02945753682194567, -0.07139414716586077, -0.09305736460380659, 0.12736934033574265, 0.19594627437659665, -0.24984642432648865, -0.2811723436604265, 0.6884590394525921, -0.5272011889309198, 0.18817680007762133, -0.026670057900950818 };

  public Wavelet_db10() {
    super("db10", Family.DAUBECHIES, 10, DEC_LO, DEC_HI, REC_LO, REC_HI);
  }
}
