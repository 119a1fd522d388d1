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

import io.warpwave.tensor.Tensor;

/**
 * Node of a wavelet packet tree.
 *
 * Nodes live in the arena of their tree and refer to their parent by index.
 */
public final class PacketNode {

  private final int index;
  private final int parent;
  private final String path;
  private final Tensor data;

  PacketNode(int index, int parent, String path, Tensor data) {
    this.index = index;
    this.parent = parent;
    this.path = path;
    this.data = data;
  }

  public int getIndex() {
    return index;
  }

  /**
   * @return index of the parent node, -1 for the root
   */
  public int getParentIndex() {
    return parent;
  }

  public String getPath() {
    return path;
  }

  /**
   * Depth of the node, 0 for the root.
   */
  public int getLevel() {
    return path.length();
  }

  public boolean isRoot() {
    return -1 == parent;
  }

  public Tensor getData() {
    return data;
  }

  @Override
  public String toString() {
    return "PacketNode('" + path + "', " + data + ")";
  }
}
