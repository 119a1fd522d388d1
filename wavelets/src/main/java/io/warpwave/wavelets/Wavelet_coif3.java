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

public class Wavelet_coif3 extends Wavelet {

  private static final double[] DEC_LO = new double[] { -3.459977283621256e-05, -7.098330313814125e-05, 0.0004662169601128863, 0.0011175187708906016, -0.0025745176887502236, -0.00900797613666158, 0.015880544863615904, 0.03455502757306163, -0.08230192710688598, -0.07179982161931202, 0.42848347637761874, 0.7937772226256206, 0.4051769024096169, -0.06112339000267287, -0.0657719112818555, 0.023452696141836267, 0.007782596427325418, -0.003793512864491014 };
  private static final double[] DEC_HI = new double[] { 0.003793512864491014, 0.007782596427325418, -0.023452696141836267, -0.0657719112818555, 0.06112339000267287, 0.4051769024096169, -0.7937772226256206, 0.42848347637761874, 0.07179982161931202, -0.08230192710688598, -0.03455502757306163, 0.015880544863615904, 0.00900797613666158, -0.0025745176887502236, -0.0011175187708906016, 0.0004662169601128863, 7.098330313814125e-05, -3.459977283621256e-05 };
  private static final double[] REC_LO = new double[] { -0.003793512864491014, 0.007782596427325418, 0.023452696141836267, -0.0657719112818555, -0.06112339000267287, 0.4051769024096169, 0.7937772226256206, 0.42848347637761874, -0.07179982161931202, -0.08230192710688598, 0.03455502757306163, 0.015880544863615904, -0.00900797613666158, -0.0025745176887502236, 0.0011175187708906016, 0.0004662169601128863, -7.098330313814125e-05, -3.459977283621256e-05 };
  private static final double[] REC_HI = new double[] { -3.459977283621256e-05, 7.098330313814125e-05, 0.0004662169601128863, -0.0011175187708906016, -0.0025745176887502236, 0.00900797613666158, 0.015880544863615904, -0.03455502757306163, -0.08230192710688598, 0.07179982161931202, 0.42848347637761874, -0.7937772226256206, 0.4051769024096169, 0.06112339000267287, -0.0657719112818555, -0.023452696141836267, 0.007782596427325418, 0.003793512864491014 };

  public Wavelet_coif3() {
    super("coif3", Family.COIFLETS, 6, DEC_LO, DEC_HI, REC_LO, REC_HI);
  }
}
