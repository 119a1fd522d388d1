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
import io.warpwave.fwt.FWT;
import io.warpwave.fwt.FilterBank;
import io.warpwave.fwt.FilterBanks;
import io.warpwave.fwt.PaddingMode;
import io.warpwave.tensor.Tensor;
import io.warpwave.wavelets.FilterBankSource;

import java.util.List;

/**
 * Wavelet packet tree of batched 1D signals, nodes are addressed by paths over
 * 'a' (approximation) and 'd' (detail).
 */
public class WaveletPacket extends AbstractWaveletPacket {

  /**
   * Decomposes a signal down to the maximum level it supports.
   */
  public WaveletPacket(Tensor data, String wavelet) {
    this(data, FilterBanks.resolve(wavelet), defaultMode(), null);
  }

  public WaveletPacket(Tensor data, FilterBankSource wavelet, PaddingMode mode, Integer maxLevel) {
    this(data, wavelet, mode, maxLevel, defaultLazy());
  }

  /**
   * @param data signal to decompose, null to create an empty tree
   * @param maxLevel depth of the tree, null for the maximum level
   */
  public WaveletPacket(Tensor data, FilterBankSource wavelet, PaddingMode mode, Integer maxLevel, boolean lazy) {
    super(FrequencyOrder.ALPHABET_1D, wavelet, mode, lazy);

    if (null != data) {
      build(data, maxLevel);
    }
  }

  public static WaveletPacket createEmpty(FilterBankSource wavelet, PaddingMode mode) {
    return new WaveletPacket(null, wavelet, mode, null);
  }

  public static WaveletPacket createEmpty(String wavelet) {
    return createEmpty(FilterBanks.resolve(wavelet), defaultMode());
  }

  public WaveletPacket transform(Tensor data) {
    return transform(data, null);
  }

  /**
   * Replaces the content of the tree with the decomposition of a signal.
   *
   * @param maxLevel depth of the tree, null for the maximum level
   * @return this tree
   */
  public WaveletPacket transform(Tensor data, Integer maxLevel) {
    build(data, maxLevel);
    return this;
  }

  public List<String> getLevel(int level, PacketOrder order) {
    if (PacketOrder.FREQUENCY == order) {
      return FrequencyOrder.getFreqOrder1D(level);
    }
    return getLevel(level);
  }

  @Override
  protected Tensor[] split(Tensor data, FilterBank bank, PaddingMode mode, BoundaryMatrixTransform boundary) {
    return FWT.dwt(data, bank, mode, boundary);
  }

  @Override
  protected int computeMaxLevel(Tensor data, int filterLength) {
    return FWT.maxLevel(data.size(-1), filterLength);
  }

  @Override
  protected int minimumRank() {
    return 1;
  }
}
