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

import io.warpwave.LevelRangeException;
import io.warpwave.fwt.Coefficients2D.DetailBands;
import io.warpwave.tensor.Tensor;
import io.warpwave.wavelets.FilterBankSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Separable 2D wavelet transform of batched images.
 *
 * The last two axes hold height and width. Each level filters along the height
 * axis first, then along the width axis of both height bands.
 */
public class FWT2 {

  private static final Logger LOG = LoggerFactory.getLogger(FWT2.class);

  private static final int HEIGHT = -2;
  private static final int WIDTH = -1;

  public static int maxLevel(int height, int width, int filterLength) {
    return Math.min(FWT.maxLevel(height, filterLength), FWT.maxLevel(width, filterLength));
  }

  /**
   * Single level decomposition.
   */
  public static Coefficients2D dwt2(Tensor data, FilterBankSource wavelet, PaddingMode mode) {
    checkImage(data);

    FilterBank bank = FilterBanks.resolve(wavelet);
    Tensor[] bands = analyze(data, bank, mode, FWT.boundaryFor(bank, mode));

    return new Coefficients2D(bands[0], Collections.singletonList(new DetailBands(bands[1], bands[2], bands[3])));
  }

  /**
   * Single level decomposition with an already resolved bank.
   *
   * @param boundary boundary matrices shared across calls, required when mode is BOUNDARY
   */
  public static Coefficients2D dwt2(Tensor data, FilterBank bank, PaddingMode mode, BoundaryMatrixTransform boundary) {
    checkImage(data);

    Tensor[] bands = analyze(data, bank, mode, boundary);

    return new Coefficients2D(bands[0], Collections.singletonList(new DetailBands(bands[1], bands[2], bands[3])));
  }

  /**
   * Single level reconstruction.
   */
  public static Tensor idwt2(Coefficients2D coeffs, FilterBankSource wavelet, PaddingMode mode) {
    Preconditions.checkNotNull(coeffs);
    Preconditions.checkArgument(1 == coeffs.getLevels(), "Expected a single level of details, got %s.", coeffs.getLevels());

    FilterBank bank = FilterBanks.resolve(wavelet);

    return synthesize(coeffs.getApproximation(), coeffs.getDetails(0), bank, mode, FWT.boundaryFor(bank, mode), -1, -1);
  }

  public static Coefficients2D wavedec2(Tensor data, String wavelet) {
    return wavedec2(data, FilterBanks.resolve(wavelet), null, FWT.defaultMode());
  }

  public static Coefficients2D wavedec2(Tensor data, String wavelet, Integer level, String mode) {
    return wavedec2(data, FilterBanks.resolve(wavelet), level, PaddingMode.fromString(mode));
  }

  public static Coefficients2D wavedec2(Tensor data, FilterBankSource wavelet, Integer level) {
    return wavedec2(data, wavelet, level, FWT.defaultMode());
  }

  /**
   * Multi level decomposition, the approximation is decomposed again at each level.
   *
   * @param level number of levels, null for the maximum level of the smallest axis
   */
  public static Coefficients2D wavedec2(Tensor data, FilterBankSource wavelet, Integer level, PaddingMode mode) {
    checkImage(data);
    Preconditions.checkNotNull(mode);

    FilterBank bank = FilterBanks.resolve(wavelet);

    int max = maxLevel(data.size(HEIGHT), data.size(WIDTH), bank.length());

    if (null == level) {
      level = max;
      if (LOG.isDebugEnabled()) {
        LOG.debug("Using decomposition level " + level + " for a " + data.size(HEIGHT) + "x" + data.size(WIDTH) + " image.");
      }
    } else if (level < 1 || level > max) {
      throw new LevelRangeException(level, max);
    }

    BoundaryMatrixTransform boundary = FWT.boundaryFor(bank, mode);

    List<DetailBands> details = new ArrayList<DetailBands>(level);

    Tensor approximation = data;

    for (int l = 0; l < level; l++) {
      Tensor[] bands = analyze(approximation, bank, mode, boundary);
      approximation = bands[0];
      details.add(new DetailBands(bands[1], bands[2], bands[3]));
    }

    Collections.reverse(details);

    return new Coefficients2D(approximation, details);
  }

  public static Tensor waverec2(Coefficients2D coeffs, String wavelet) {
    return waverec2(coeffs, FilterBanks.resolve(wavelet), null);
  }

  public static Tensor waverec2(Coefficients2D coeffs, FilterBankSource wavelet) {
    return waverec2(coeffs, wavelet, null);
  }

  /**
   * Multi level reconstruction, coarsest level first. As in 1D the result may
   * exceed the original extent by the padding of odd sizes.
   *
   * @param mode only BOUNDARY changes the synthesis, null means convolution
   */
  public static Tensor waverec2(Coefficients2D coeffs, FilterBankSource wavelet, PaddingMode mode) {
    Preconditions.checkNotNull(coeffs);

    FilterBank bank = FilterBanks.resolve(wavelet);
    BoundaryMatrixTransform boundary = FWT.boundaryFor(bank, mode);

    List<DetailBands> details = coeffs.getDetails();
    Tensor approximation = coeffs.getApproximation();

    for (int i = 0; i < details.size(); i++) {
      int targetHeight = -1;
      int targetWidth = -1;

      if (i + 1 < details.size()) {
        Tensor next = details.get(i + 1).getHorizontal();
        targetHeight = next.size(HEIGHT);
        targetWidth = next.size(WIDTH);
      }

      approximation = synthesize(approximation, details.get(i), bank, mode, boundary, targetHeight, targetWidth);
    }

    return approximation;
  }

  /**
   * @return approximation, horizontal, vertical and diagonal bands
   */
  static Tensor[] analyze(Tensor data, FilterBank bank, PaddingMode mode, BoundaryMatrixTransform boundary) {
    Tensor[] rows = FWT.analyze(data, HEIGHT, bank, mode, boundary);
    Tensor[] low = FWT.analyze(rows[0], WIDTH, bank, mode, boundary);
    Tensor[] high = FWT.analyze(rows[1], WIDTH, bank, mode, boundary);

    return new Tensor[] { low[0], high[0], low[1], high[1] };
  }

  static Tensor synthesize(Tensor approximation, DetailBands bands, FilterBank bank, PaddingMode mode, BoundaryMatrixTransform boundary, int targetHeight, int targetWidth) {
    Tensor low = FWT.synthesize(approximation, bands.getVertical(), WIDTH, bank, mode, boundary, targetWidth);
    Tensor high = FWT.synthesize(bands.getHorizontal(), bands.getDiagonal(), WIDTH, bank, mode, boundary, targetWidth);

    return FWT.synthesize(low, high, HEIGHT, bank, mode, boundary, targetHeight);
  }

  private static void checkImage(Tensor data) {
    Preconditions.checkNotNull(data);
    Preconditions.checkArgument(data.dim() >= 2, "Expected at least a 2D tensor.");
    Preconditions.checkArgument(data.size(HEIGHT) >= 1 && data.size(WIDTH) >= 1, "Cannot decompose an empty image.");
  }
}
