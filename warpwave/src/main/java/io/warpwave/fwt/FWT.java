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

package io.warpwave.fwt;

import io.warpwave.Configuration;
import io.warpwave.LevelRangeException;
import io.warpwave.WarpWaveConfig;
import io.warpwave.tensor.Tensor;
import io.warpwave.wavelets.FilterBankSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Convolution based fast wavelet transform of batched 1D signals.
 *
 * The last axis of the input holds the signal, every leading axis is a batch
 * axis. Coefficients match those of PyWavelets' wavedec for the zero,
 * constant, reflect and periodic modes.
 */
public class FWT {

  private static final Logger LOG = LoggerFactory.getLogger(FWT.class);

  /**
   * Maximum useful decomposition level, floor(log2(length / (filterLength - 1))), at least 1.
   */
  public static int maxLevel(int length, int filterLength) {
    if (filterLength <= 1 || length < filterLength - 1) {
      return 1;
    }

    int level = (int) Math.floor(Math.log((double) length / (filterLength - 1)) / Math.log(2.0D));

    return Math.max(1, level);
  }

  /**
   * Padding added on the left of a signal before filtering.
   */
  static int padLeft(int filterLength) {
    return (2 * filterLength - 3) / 2;
  }

  /**
   * Padding added on the right, odd signals get one more sample.
   */
  static int padRight(int length, int filterLength) {
    return padLeft(filterLength) + (length % 2);
  }

  /**
   * Number of coefficients produced by one analysis step with padding.
   */
  public static int coefficientLength(int length, int filterLength) {
    return (length + padLeft(filterLength) + padRight(length, filterLength) - filterLength) / 2 + 1;
  }

  static PaddingMode defaultMode() {
    return PaddingMode.fromString(WarpWaveConfig.getProperty(Configuration.FWT_MODE, Configuration.DEFAULT_FWT_MODE));
  }

  static BoundaryMatrixTransform boundaryFor(FilterBank bank, PaddingMode mode) {
    if (PaddingMode.BOUNDARY != mode) {
      return null;
    }
    return new BoundaryMatrixTransform(bank);
  }

  /**
   * Single level decomposition.
   *
   * @return approximation and detail coefficients
   */
  public static Tensor[] dwt(Tensor data, FilterBankSource wavelet, PaddingMode mode) {
    Preconditions.checkNotNull(data);
    Preconditions.checkArgument(data.dim() >= 1, "Expected at least a 1D tensor.");

    FilterBank bank = FilterBanks.resolve(wavelet);

    return analyze(data, -1, bank, mode, boundaryFor(bank, mode));
  }

  /**
   * Single level decomposition with an already resolved bank.
   *
   * @param boundary boundary matrices shared across calls, required when mode is BOUNDARY
   */
  public static Tensor[] dwt(Tensor data, FilterBank bank, PaddingMode mode, BoundaryMatrixTransform boundary) {
    Preconditions.checkNotNull(data);
    Preconditions.checkArgument(data.dim() >= 1, "Expected at least a 1D tensor.");

    return analyze(data, -1, bank, mode, boundary);
  }

  /**
   * Single level reconstruction.
   */
  public static Tensor idwt(Tensor approximation, Tensor detail, FilterBankSource wavelet, PaddingMode mode) {
    FilterBank bank = FilterBanks.resolve(wavelet);

    return synthesize(approximation, detail, -1, bank, mode, boundaryFor(bank, mode), -1);
  }

  public static List<Tensor> wavedec(Tensor data, String wavelet) {
    return wavedec(data, FilterBanks.resolve(wavelet), null, defaultMode());
  }

  public static List<Tensor> wavedec(Tensor data, String wavelet, Integer level, String mode) {
    return wavedec(data, FilterBanks.resolve(wavelet), level, PaddingMode.fromString(mode));
  }

  public static List<Tensor> wavedec(Tensor data, FilterBankSource wavelet) {
    return wavedec(data, wavelet, null, defaultMode());
  }

  public static List<Tensor> wavedec(Tensor data, FilterBankSource wavelet, Integer level) {
    return wavedec(data, wavelet, level, defaultMode());
  }

  /**
   * Multi level decomposition.
   *
   * @param level number of levels, null for the maximum level
   * @return [approximation_level, detail_level, ..., detail_1], coarsest first
   */
  public static List<Tensor> wavedec(Tensor data, FilterBankSource wavelet, Integer level, PaddingMode mode) {
    Preconditions.checkNotNull(data);
    Preconditions.checkNotNull(mode);
    Preconditions.checkArgument(data.dim() >= 1, "Expected at least a 1D tensor.");
    Preconditions.checkArgument(data.size(-1) >= 1, "Cannot decompose an empty signal.");

    FilterBank bank = FilterBanks.resolve(wavelet);

    int max = maxLevel(data.size(-1), bank.length());

    if (null == level) {
      level = max;
      if (LOG.isDebugEnabled()) {
        LOG.debug("Using decomposition level " + level + " for length " + data.size(-1) + " and filter length " + bank.length() + ".");
      }
    } else if (level < 1 || level > max) {
      throw new LevelRangeException(level, max);
    }

    BoundaryMatrixTransform boundary = boundaryFor(bank, mode);

    List<Tensor> result = new ArrayList<Tensor>(level + 1);

    Tensor lo = data;

    for (int l = 0; l < level; l++) {
      Tensor[] bands = analyze(lo, -1, bank, mode, boundary);
      lo = bands[0];
      result.add(bands[1]);
    }

    result.add(lo);

    Collections.reverse(result);

    return result;
  }

  public static Tensor waverec(List<Tensor> coeffs, String wavelet) {
    return waverec(coeffs, FilterBanks.resolve(wavelet), null);
  }

  public static Tensor waverec(List<Tensor> coeffs, FilterBankSource wavelet) {
    return waverec(coeffs, wavelet, null);
  }

  /**
   * Multi level reconstruction.
   *
   * The result may be longer than the original signal when its length was not a
   * multiple of 2^level, callers truncate it to the length they know.
   *
   * @param mode only BOUNDARY changes the synthesis, null means convolution
   */
  public static Tensor waverec(List<Tensor> coeffs, FilterBankSource wavelet, PaddingMode mode) {
    Preconditions.checkNotNull(coeffs);
    Preconditions.checkArgument(coeffs.size() >= 2, "Expected an approximation and at least one detail.");

    FilterBank bank = FilterBanks.resolve(wavelet);
    BoundaryMatrixTransform boundary = boundaryFor(bank, mode);

    Tensor lo = coeffs.get(0);

    for (int i = 1; i < coeffs.size(); i++) {
      int target = i + 1 < coeffs.size() ? coeffs.get(i + 1).size(-1) : -1;
      lo = synthesize(lo, coeffs.get(i), -1, bank, mode, boundary, target);
    }

    return lo;
  }

  /**
   * One analysis step along an axis.
   *
   * @param boundary boundary matrices to use, required when mode is BOUNDARY
   */
  static Tensor[] analyze(Tensor data, int axis, FilterBank bank, PaddingMode mode, BoundaryMatrixTransform boundary) {
    if (PaddingMode.BOUNDARY == mode) {
      Preconditions.checkNotNull(boundary, "Boundary mode needs boundary matrices.");
      return boundary.forward(data, axis);
    }

    int len = data.size(axis);
    int outLength = coefficientLength(len, bank.length());

    Tensor lo = data.mapLines(axis, outLength, (in, out) -> correlate(in, bank.decLoKernel(), mode, out));
    Tensor hi = data.mapLines(axis, outLength, (in, out) -> correlate(in, bank.decHiKernel(), mode, out));

    return new Tensor[] { lo, hi };
  }

  /**
   * One synthesis step along an axis.
   *
   * @param target expected output length, used to resolve the extra sample of odd lengths, -1 if unknown
   */
  static Tensor synthesize(Tensor lo, Tensor hi, int axis, FilterBank bank, PaddingMode mode, BoundaryMatrixTransform boundary, int target) {
    Preconditions.checkNotNull(lo);
    Preconditions.checkNotNull(hi);
    Preconditions.checkArgument(lo.size(axis) == hi.size(axis), "Approximation and detail lengths differ, %s vs %s.", lo.size(axis), hi.size(axis));

    if (PaddingMode.BOUNDARY == mode) {
      Preconditions.checkNotNull(boundary, "Boundary mode needs boundary matrices.");
      return boundary.inverse(lo, hi, axis, target);
    }

    int len = lo.size(axis);
    int filterLength = bank.length();
    int full = 2 * (len - 1) + filterLength;

    int padl = padLeft(filterLength);
    int padr = padl;

    if (target >= 0 && full - padl - padr != target) {
      padr++;
      Preconditions.checkArgument(full - padl - padr == target, "Coefficient of length %s cannot produce a signal of length %s.", len, target);
    }

    int outLength = full - padl - padr;

    Preconditions.checkArgument(outLength > 0, "Coefficients of length %s are too short for filters of length %s.", len, filterLength);

    final int offset = padl;

    return Tensor.combineLines(lo, hi, axis, outLength, (a, d, out) -> upsampleConvolve(a, d, bank.recLo(), bank.recHi(), offset, out));
  }

  /**
   * out[k] = sum_j x_ext[2k + j - padl] * kernel[j]
   */
  private static void correlate(double[] x, double[] kernel, PaddingMode mode, double[] out) {
    int n = x.length;
    int padl = padLeft(kernel.length);

    for (int k = 0; k < out.length; k++) {
      double sum = 0.0D;
      int start = 2 * k - padl;

      for (int j = 0; j < kernel.length; j++) {
        int idx = mode.extend(start + j, n);
        if (idx >= 0) {
          sum += x[idx] * kernel[j];
        }
      }

      out[k] = sum;
    }
  }

  /**
   * Transposed strided convolution of both bands, cropped by 'offset' on the left.
   */
  private static void upsampleConvolve(double[] lo, double[] hi, double[] recLo, double[] recHi, int offset, double[] out) {
    for (int k = 0; k < lo.length; k++) {
      for (int j = 0; j < recLo.length; j++) {
        int t = 2 * k + j - offset;
        if (t >= 0 && t < out.length) {
          out[t] += lo[k] * recLo[j] + hi[k] * recHi[j];
        }
      }
    }
  }
}
