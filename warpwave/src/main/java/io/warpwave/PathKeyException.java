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
 * Raised when a packet path is deeper than the tree or uses symbols outside of the tree alphabet.
 *
 * This is a key error: the path does not address a node the tree can hold.
 */
public class PathKeyException extends WaveletException {

  private final String path;

  public PathKeyException(String path, String reason) {
    super("Invalid packet path '" + path + "', " + reason);
    this.path = path;
  }

  public String getPath() {
    return path;
  }
}
