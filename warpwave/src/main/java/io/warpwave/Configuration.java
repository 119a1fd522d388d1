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

package io.warpwave;

public class Configuration {

  /**
   * Padding mode used by the convolution transforms when the caller does not specify one
   */
  public static final String FWT_MODE = "fwt.mode";

  /**
   * Tolerance used when checking that a filter bank is orthogonal before building boundary matrices
   */
  public static final String FWT_BOUNDARY_TOLERANCE = "fwt.boundary.tolerance";

  /**
   * Padding mode of wavelet packet trees created without an explicit mode
   */
  public static final String PACKETS_MODE = "packets.mode";

  /**
   * Set to 'true' to expand packet tree nodes on first access instead of at transform time
   */
  public static final String PACKETS_LAZY = "packets.lazy";

  public static final String DEFAULT_FWT_MODE = "reflect";
  public static final String DEFAULT_PACKETS_MODE = "reflect";
  public static final String DEFAULT_FWT_BOUNDARY_TOLERANCE = "1e-8";
  public static final String DEFAULT_PACKETS_LAZY = "false";
}
