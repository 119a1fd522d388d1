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
 * Base class of the errors raised by the transforms and packet trees.
 *
 * Subclasses fall in two categories. Value errors are raised for arguments or
 * states that cannot be used ({@link InvalidPaddingModeException},
 * {@link WaveletConfigurationException}, {@link LevelRangeException},
 * {@link TreeNotBuiltException}). Key errors are raised for lookups of packet
 * nodes that do not exist ({@link PathKeyException}).
 */
public class WaveletException extends RuntimeException {
  public WaveletException(String message) {
    super(message);
  }

  public WaveletException(String message, Throwable cause) {
    super(message, cause);
  }
}
