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

import java.util.List;

/**
 * Anything able to hand out a wavelet filter bank.
 *
 * The returned list holds, in order, the decomposition low pass, decomposition
 * high pass, reconstruction low pass and reconstruction high pass filters, each
 * in natural (non time-reversed) coefficient order.
 *
 * Registered wavelets implement it, so do explicitly built banks such as
 * learnt filters, usually through a lambda.
 */
@FunctionalInterface
public interface FilterBankSource {
  List<double[]> getFilters();
}
