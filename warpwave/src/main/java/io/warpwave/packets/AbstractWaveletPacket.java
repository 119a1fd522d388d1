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

import io.warpwave.Configuration;
import io.warpwave.LevelRangeException;
import io.warpwave.PathKeyException;
import io.warpwave.TreeNotBuiltException;
import io.warpwave.WarpWaveConfig;
import io.warpwave.fwt.BoundaryMatrixTransform;
import io.warpwave.fwt.FilterBank;
import io.warpwave.fwt.FilterBanks;
import io.warpwave.fwt.PaddingMode;
import io.warpwave.tensor.Tensor;
import io.warpwave.wavelets.FilterBankSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Path addressed tree of wavelet packets.
 *
 * Every node is split by one level of the transform into as many children as
 * the alphabet has symbols, the child for symbol 'c' of node 'p' lives at path
 * p + c. Nodes are stored in an arena and indexed by path.
 *
 * Eager trees expand every node down to the maximum level when transforming,
 * lazy trees only keep the root and expand the nodes along a path when it is
 * first accessed. Both yield the same coefficients.
 */
public abstract class AbstractWaveletPacket {

  private static final Logger LOG = LoggerFactory.getLogger(AbstractWaveletPacket.class);

  private final String alphabet;
  private final FilterBank bank;
  private final PaddingMode mode;
  private final boolean lazy;

  /**
   * Shared by all the splits so the boundary matrices are built once per length
   */
  private final BoundaryMatrixTransform boundary;

  private final List<PacketNode> nodes = new ArrayList<PacketNode>();
  private final Map<String, Integer> paths = new HashMap<String, Integer>();

  private int maxLevel = 0;

  protected AbstractWaveletPacket(String alphabet, FilterBankSource wavelet, PaddingMode mode, boolean lazy) {
    Preconditions.checkNotNull(mode);

    this.alphabet = alphabet;
    this.bank = FilterBanks.resolve(wavelet);
    this.mode = mode;
    this.lazy = lazy;
    this.boundary = PaddingMode.BOUNDARY == mode ? new BoundaryMatrixTransform(bank) : null;
  }

  static PaddingMode defaultMode() {
    return PaddingMode.fromString(WarpWaveConfig.getProperty(Configuration.PACKETS_MODE, Configuration.DEFAULT_PACKETS_MODE));
  }

  static boolean defaultLazy() {
    return WarpWaveConfig.getBooleanProperty(Configuration.PACKETS_LAZY, Configuration.DEFAULT_PACKETS_LAZY);
  }

  /**
   * Splits a tensor into one child per symbol of the alphabet, in alphabet order.
   */
  protected abstract Tensor[] split(Tensor data, FilterBank bank, PaddingMode mode, BoundaryMatrixTransform boundary);

  protected abstract int computeMaxLevel(Tensor data, int filterLength);

  protected abstract int minimumRank();

  /**
   * Discards the current nodes and decomposes a new signal.
   *
   * @param level depth of the tree, null for the maximum level the signal supports
   */
  protected void build(Tensor data, Integer level) {
    Preconditions.checkNotNull(data);
    Preconditions.checkArgument(data.dim() >= minimumRank(), "Expected a tensor of rank %s or more.", minimumRank());

    int max = computeMaxLevel(data, bank.length());

    if (null == level) {
      level = max;
      if (LOG.isDebugEnabled()) {
        LOG.debug("Using packet depth " + level + " for a signal of shape " + Arrays.toString(data.shape()) + ".");
      }
    } else if (level < 1 || level > max) {
      throw new LevelRangeException(level, max);
    }

    nodes.clear();
    paths.clear();

    this.maxLevel = level;

    add(-1, "", data);

    if (!lazy) {
      // The arena grows while iterating, parents always come before their children
      for (int i = 0; i < nodes.size(); i++) {
        if (nodes.get(i).getLevel() < maxLevel) {
          expand(nodes.get(i));
        }
      }
    }

    if (LOG.isDebugEnabled()) {
      LOG.debug("Built " + (lazy ? "lazy " : "") + "packet tree of depth " + maxLevel + " with " + nodes.size() + " nodes.");
    }
  }

  /**
   * @return the coefficients stored at a path, the empty path is the signal itself
   */
  public Tensor get(String path) {
    return getNode(path).getData();
  }

  public PacketNode getNode(String path) {
    checkPath(path);

    Integer idx = paths.get(path);

    if (null == idx) {
      PacketNode parent = getNode(path.substring(0, path.length() - 1));
      expand(parent);
      idx = paths.get(path);
    }

    return nodes.get(idx);
  }

  /**
   * @return the parent of a node, null for the root
   */
  public PacketNode getParent(PacketNode node) {
    return node.isRoot() ? null : nodes.get(node.getParentIndex());
  }

  /**
   * Tells whether a node has been materialized.
   */
  public boolean contains(String path) {
    return paths.containsKey(path);
  }

  /**
   * Paths of the nodes at a given depth in natural order.
   */
  public List<String> getLevel(int level) {
    return FrequencyOrder.naturalOrder(level, alphabet);
  }

  public boolean isBuilt() {
    return !nodes.isEmpty();
  }

  /**
   * @return depth of the tree, 0 when it has not been built
   */
  public int getMaxLevel() {
    return maxLevel;
  }

  public FilterBank getFilterBank() {
    return bank;
  }

  public PaddingMode getMode() {
    return mode;
  }

  public boolean isLazy() {
    return lazy;
  }

  public String getAlphabet() {
    return alphabet;
  }

  /**
   * Number of materialized nodes, the root included.
   */
  public int size() {
    return nodes.size();
  }

  private void expand(PacketNode node) {
    Tensor[] children = split(node.getData(), bank, mode, boundary);

    for (int i = 0; i < alphabet.length(); i++) {
      add(node.getIndex(), node.getPath() + alphabet.charAt(i), children[i]);
    }
  }

  private void add(int parent, String path, Tensor data) {
    PacketNode node = new PacketNode(nodes.size(), parent, path, data);
    nodes.add(node);
    paths.put(path, node.getIndex());
  }

  private void checkPath(String path) {
    if (!isBuilt()) {
      throw new TreeNotBuiltException();
    }

    Preconditions.checkNotNull(path);

    if (path.length() > maxLevel) {
      throw new PathKeyException(path, "the tree is only " + maxLevel + " levels deep");
    }

    for (int i = 0; i < path.length(); i++) {
      if (alphabet.indexOf(path.charAt(i)) < 0) {
        throw new PathKeyException(path, "'" + path.charAt(i) + "' is not one of '" + alphabet + "'");
      }
    }
  }
}
