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

public class Wavelet_db8 extends Wavelet {

  private static final double[] DEC_LO = new double[] { -0.00011747678400228192, 0.0006754494059985568, -0.0003917403729959771, -0.00487035299301066, 0.008746094047015655, 0.013981027917015516, -0.04408825393106472, -0.01736930100202211, 0.128747426620186, 0.00047248457399797254, -0.2840155429624281, -0.015829105256023893, 0.5853546836548691, 0.6756307362980128, 0.3128715909144659, 0.05441584224308161 };
  private static final double[] DEC_HI = new double[] { -0.05441584224308161, 0.3128715909144659, -0.6756307362980128, 0.5853546836548691, 0.015829105256023893, -0.2840155429624281, -0.00047248457399797254, 0.128747426620186, 0.01736930100202211, -0.04408825393106472, -0.013981027917015516, 0.008746094047015655, 0.00487035299301066, -0.0003917403729959771, -0.0006754494059985568, -0.00011747678400228192 };
  private static final double[] REC_LO = new double[] { 0.05441584224308161, 0.3128715909144659, 0.6756307362980128, 0.5853546836548691, -0.015829105256023893, -0.2840155429624281, 0.00047248457399797254, 0.128747426620186, -0.01736930100202211, -0.04408825393106472, 0.013981027917015516, 0.008746094047015655, -0.00487035299301066, -0.0003917403729959771, 0.0006754494059985568, -0.00011747678400228192 };
  private static final double[] REC_HI = new double[] { -0.00011747678400228192, -0.0006754494059985568, -0.0003917403729959771, 0.00487035299301066, 0.008746094047015655, -0.013981027917015516, -0.04408825393106472, 0.01736930100202211, 0.128747426620186, -0.00047248457399797254, -0.2840155429624281, 0.015829105256023893, 0.5853546836548691, -0.6756307362980128, 0.3128715909144659, -0.05441584224308161 };

  public Wavelet_db8() {
    super("db8", Family.DAUBECHIES, 8, DEC_LO, DEC_HI, REC_LO, REC_HI);
  }
}
