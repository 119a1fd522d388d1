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

import io.warpwave.tensor.Tensor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Result of a multi level 2D decomposition: the coarsest approximation and the
 * detail bands of every level, coarsest level first.
 */
public class Coefficients2D {

  /**
   * Detail bands of one level.
   *
   * Horizontal is high pass along the height axis and low pass along the width,
   * vertical is the opposite, diagonal is high pass along both.
   */
  public static class DetailBands {
    private final Tensor horizontal;
    private final Tensor vertical;
    private final Tensor diagonal;

    public DetailBands(Tensor horizontal, Tensor vertical, Tensor diagonal) {
      Preconditions.checkNotNull(horizontal);
      Preconditions.checkNotNull(vertical);
      Preconditions.checkNotNull(diagonal);
      this.horizontal = horizontal;
      this.vertical = vertical;
      this.diagonal = diagonal;
    }

    public Tensor getHorizontal() {
      return horizontal;
    }

    public Tensor getVertical() {
      return vertical;
    }

    public Tensor getDiagonal() {
      return diagonal;
    }

    public List<Tensor> asList() {
      return Arrays.asList(horizontal, vertical, diagonal);
    }
  }

  private final Tensor approximation;
  private final List<DetailBands> details;

  /**
   * @param details detail bands, coarsest level first
   */
  public Coefficients2D(Tensor approximation, List<DetailBands> details) {
    Preconditions.checkNotNull(approximation);
    Preconditions.checkArgument(null != details && !details.isEmpty(), "At least one level of details is needed.");
    this.approximation = approximation;
    this.details = Collections.unmodifiableList(new ArrayList<DetailBands>(details));
  }

  public Tensor getApproximation() {
    return approximation;
  }

  public List<DetailBands> getDetails() {
    return details;
  }

  /**
   * @param index 0 for the coarsest level
   */
  public DetailBands getDetails(int index) {
    return details.get(index);
  }

  public int getLevels() {
    return details.size();
  }

  /**
   * @return [a, h_k, v_k, d_k, ..., h_1, v_1, d_1]
   */
  public List<Tensor> flatten() {
    List<Tensor> flat = new ArrayList<Tensor>(1 + 3 * details.size());
    flat.add(approximation);
    for (DetailBands bands : details) {
      flat.addAll(bands.asList());
    }
    return flat;
  }
}
