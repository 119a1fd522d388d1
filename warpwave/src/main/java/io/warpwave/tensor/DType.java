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

package io.warpwave.tensor;

/**
 * Element precision of a {@link Tensor}.
 */
public enum DType {
  FLOAT32(1e-6) {
    @Override
    public double round(double value) {
      return (double) (float) value;
    }
  },
  FLOAT64(1e-15) {
    @Override
    public double round(double value) {
      return value;
    }
  };

  private final double resolution;

  private DType(double resolution) {
    this.resolution = resolution;
  }

  /**
   * Rounds a value to the precision of this type.
   */
  public abstract double round(double value);

  /**
   * Approximate decimal resolution, 10^-digits where digits is the number of significant decimal digits
   */
  public double resolution() {
    return resolution;
  }
}
