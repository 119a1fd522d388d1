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

package io.warpwave.packets;

import io.warpwave.fwt.BoundaryMatrixTransform;
import io.warpwave.fwt.Coefficients2D;
import io.warpwave.fwt.FWT2;
import io.warpwave.fwt.FilterBank;
import io.warpwave.fwt.FilterBanks;
import io.warpwave.fwt.PaddingMode;
import io.warpwave.tensor.Tensor;
import io.warpwave.wavelets.FilterBankSource;

import java.util.List;

/**
 * Wavelet packet tree of batched images, nodes are addressed by paths over
 * 'a' (approximation), 'h' (horizontal), 'v' (vertical) and 'd' (diagonal).
 */
public class WaveletPacket2D extends AbstractWaveletPacket {

  public WaveletPacket2D(Tensor data, String wavelet) {
    this(data, FilterBanks.resolve(wavelet), defaultMode(), null);
  }

  public WaveletPacket2D(Tensor data, FilterBankSource wavelet, PaddingMode mode, Integer maxLevel) {
    this(data, wavelet, mode, maxLevel, defaultLazy());
  }

  /**
   * @param data images to decompose, height and width on the last two axes, null to create an empty tree
   * @param maxLevel depth of the tree, null for the maximum level of the smallest axis
   */
  public WaveletPacket2D(Tensor data, FilterBankSource wavelet, PaddingMode mode, Integer maxLevel, boolean lazy) {
    super(FrequencyOrder.ALPHABET_2D, wavelet, mode, lazy);

    if (null != data) {
      build(data, maxLevel);
    }
  }

  public static WaveletPacket2D createEmpty(FilterBankSource wavelet, PaddingMode mode) {
    return new WaveletPacket2D(null, wavelet, mode, null);
  }

  public static WaveletPacket2D createEmpty(String wavelet) {
    return createEmpty(FilterBanks.resolve(wavelet), defaultMode());
  }

  public WaveletPacket2D transform(Tensor data) {
    return transform(data, null);
  }

  /**
   * @return this tree
   */
  public WaveletPacket2D transform(Tensor data, Integer maxLevel) {
    build(data, maxLevel);
    return this;
  }

  /**
   * Paths of a level arranged by ascending vertical (rows) and horizontal (columns) frequency.
   */
  public List<List<String>> getFrequencyOrderedLevel(int level) {
    return FrequencyOrder.getFreqOrder(level);
  }

  @Override
  protected Tensor[] split(Tensor data, FilterBank bank, PaddingMode mode, BoundaryMatrixTransform boundary) {
    Coefficients2D coeffs = FWT2.dwt2(data, bank, mode, boundary);
    Coefficients2D.DetailBands bands = coeffs.getDetails(0);

    return new Tensor[] { coeffs.getApproximation(), bands.getHorizontal(), bands.getVertical(), bands.getDiagonal() };
  }

  @Override
  protected int computeMaxLevel(Tensor data, int filterLength) {
    return FWT2.maxLevel(data.size(-2), data.size(-1), filterLength);
  }

  @Override
  protected int minimumRank() {
    return 2;
  }
}
