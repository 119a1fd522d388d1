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

/**
 * Raised for a padding mode name outside of zero, constant, reflect, periodic and boundary.
 *
 * This is a value error: the argument has the right type but no meaning.
 */
public class InvalidPaddingModeException extends WaveletException {

  private final String mode;

  public InvalidPaddingModeException(String mode) {
    super("Unknown padding mode '" + mode + "'.");
    this.mode = mode;
  }

  public String getMode() {
    return mode;
  }
}
