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

import io.warpwave.MackeyGlass;
import io.warpwave.PathKeyException;
import io.warpwave.TreeNotBuiltException;
import io.warpwave.fwt.FilterBanks;
import io.warpwave.fwt.PaddingMode;
import io.warpwave.fwt.ReferenceDWT;
import io.warpwave.tensor.Tensor;
import io.warpwave.wavelets.WaveletRegistry;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

public class WaveletPacket2DTest {

  private static final String ALPHABET = "ahvd";

  @Test
  public void testLeavesMatchRecursiveDecomposition() {
    Tensor images = MackeyGlass.noise(21L, 2, 48, 40);

    for (String wavelet : new String[] { "haar", "db2", "db3" }) {
      List<double[]> filters = WaveletRegistry.find(wavelet).getFilters();

      for (String mode : new String[] { "zero", "reflect" }) {
        WaveletPacket2D wp = new WaveletPacket2D(images, FilterBanks.resolve(wavelet), PaddingMode.fromString(mode), 2, false);

        List<String> paths = wp.getLevel(2);

        Assert.assertEquals(16, paths.size());

        for (int b = 0; b < 2; b++) {
          double[][] image = ReferenceDWT.toMatrix(images.narrow(0, b, 1));

          for (String path : paths) {
            double[][] expected = image;
            for (int i = 0; i < path.length(); i++) {
              expected = ReferenceDWT.dwt2(expected, filters, mode)[ALPHABET.indexOf(path.charAt(i))];
            }

            double[][] actual = ReferenceDWT.toMatrix(wp.get(path).narrow(0, b, 1));

            Assert.assertEquals(expected.length, actual.length);
            for (int r = 0; r < expected.length; r++) {
              Assert.assertArrayEquals(wavelet + "/" + mode + "/" + path, expected[r], actual[r], 1e-10D);
            }
          }
        }
      }
    }
  }

  @Test
  public void testTreeSize() {
    Tensor images = MackeyGlass.noise(22L, 1, 32, 32);

    WaveletPacket2D wp = new WaveletPacket2D(images, FilterBanks.resolve("db2"), PaddingMode.ZERO, null, false);

    Assert.assertEquals(3, wp.getMaxLevel());
    Assert.assertEquals(1 + 4 + 16 + 64, wp.size());
    Assert.assertEquals(64, wp.getLevel(3).size());
    Assert.assertEquals("ahvd", wp.getAlphabet());
  }

  @Test
  public void testMaxLevelFollowsSmallestAxis() {
    WaveletPacket2D wp = new WaveletPacket2D(MackeyGlass.noise(23L, 1, 16, 256), "db2");
    Assert.assertEquals(2, wp.getMaxLevel());
  }

  @Test
  public void testTransformModes() {
    Tensor images = MackeyGlass.noise(24L, 2, 64, 64);

    WaveletPacket2D direct = new WaveletPacket2D(images, FilterBanks.resolve("db4"), PaddingMode.REFLECT, 2, false);
    WaveletPacket2D transformed = WaveletPacket2D.createEmpty(FilterBanks.resolve("db4"), PaddingMode.REFLECT).transform(images, 2);
    WaveletPacket2D twice = WaveletPacket2D.createEmpty(FilterBanks.resolve("db4"), PaddingMode.REFLECT).transform(images, 1).transform(images, 2);
    WaveletPacket2D lazy = new WaveletPacket2D(images, FilterBanks.resolve("db4"), PaddingMode.REFLECT, 2, true);

    Assert.assertEquals(1, lazy.size());

    for (int level = 0; level <= 2; level++) {
      for (String path : direct.getLevel(level)) {
        Assert.assertEquals(path, direct.get(path), transformed.get(path));
        Assert.assertEquals(path, direct.get(path), twice.get(path));
        Assert.assertEquals(path, direct.get(path), lazy.get(path));
      }
    }

    Assert.assertEquals(direct.size(), twice.size());
  }

  @Test
  public void testBoundaryHaarMatchesZeroPadding() {
    Tensor images = MackeyGlass.noise(25L, 2, 32, 32);

    WaveletPacket2D boundary = new WaveletPacket2D(images, FilterBanks.resolve("db1"), PaddingMode.BOUNDARY, 3, false);
    WaveletPacket2D zero = new WaveletPacket2D(images, FilterBanks.resolve("db1"), PaddingMode.ZERO, 3, false);

    for (String path : zero.getLevel(3)) {
      Assert.assertTrue(path, boundary.get(path).allClose(zero.get(path), 0.0D, 1e-12D));
    }
  }

  @Test
  public void testFrequencyOrderedLevel() {
    WaveletPacket2D wp = new WaveletPacket2D(MackeyGlass.noise(26L, 1, 32, 32), "db2");

    List<List<String>> grid = wp.getFrequencyOrderedLevel(2);

    Assert.assertEquals(FrequencyOrder.getFreqOrder(2), grid);
    Assert.assertEquals(4, grid.size());

    for (List<String> row : grid) {
      Assert.assertEquals(4, row.size());
      for (String path : row) {
        Assert.assertArrayEquals(new int[] { 1, 10, 10 }, wp.get(path).shape());
      }
    }
  }

  @Test(expected = TreeNotBuiltException.class)
  public void testEmptyTreeAccess() {
    WaveletPacket2D.createEmpty("haar").get("a");
  }

  @Test
  public void testInvalidPaths() {
    WaveletPacket2D wp = WaveletPacket2D.createEmpty("haar").transform(MackeyGlass.noise(27L, 1, 16, 16));

    for (String path : new String[] { "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaa", "adx", "b" }) {
      try {
        wp.get(path);
        Assert.fail(path);
      } catch (PathKeyException pke) {
        Assert.assertEquals(path, pke.getPath());
      }
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejects1D() {
    WaveletPacket2D.createEmpty("haar").transform(MackeyGlass.generate(1, 64).reshape(64));
  }
}
