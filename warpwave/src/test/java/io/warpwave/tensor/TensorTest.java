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

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

public class TensorTest {

  @Test
  public void testShape() {
    Tensor t = Tensor.of(new double[][][] { { { 1, 2, 3 }, { 4, 5, 6 } }, { { 7, 8, 9 }, { 10, 11, 12 } } });

    Assert.assertArrayEquals(new int[] { 2, 2, 3 }, t.shape());
    Assert.assertEquals(3, t.dim());
    Assert.assertEquals(12, t.numel());
    Assert.assertEquals(3, t.size(-1));
    Assert.assertEquals(2, t.size(0));
    Assert.assertEquals(11.0D, t.get(1, 1, 1), 0.0D);
    Assert.assertEquals(12.0D, t.get(-1, -1, -1), 0.0D);
  }

  @Test
  public void testFloat32Rounding() {
    Tensor t = Tensor.of(DType.FLOAT32, 0.1D, 1.0D / 3.0D);

    Assert.assertEquals(DType.FLOAT32, t.dtype());
    Assert.assertEquals((double) 0.1F, t.get(0), 0.0D);
    Assert.assertNotEquals(0.1D, t.get(0), 0.0D);

    Tensor widened = t.to(DType.FLOAT64);
    Assert.assertEquals((double) 0.1F, widened.get(0), 0.0D);

    Assert.assertEquals(1e-6D, DType.FLOAT32.resolution(), 0.0D);
    Assert.assertEquals(1e-15D, DType.FLOAT64.resolution(), 0.0D);
  }

  @Test
  public void testNarrow() {
    Tensor t = Tensor.of(new double[][] { { 1, 2, 3, 4 }, { 5, 6, 7, 8 } });

    Assert.assertEquals(Tensor.of(new double[][] { { 2, 3 }, { 6, 7 } }), t.narrow(-1, 1, 2));
    Assert.assertEquals(Tensor.of(new double[][] { { 5, 6, 7, 8 } }), t.narrow(0, 1, 1));
    Assert.assertArrayEquals(new int[] { 2, 0 }, t.narrow(1, 4, 0).shape());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNarrowOutOfBounds() {
    Tensor.of(1, 2, 3).narrow(0, 2, 2);
  }

  @Test
  public void testCatAndStack() {
    Tensor a = Tensor.of(new double[][] { { 1, 2 }, { 3, 4 } });
    Tensor b = Tensor.of(new double[][] { { 5 }, { 6 } });

    Assert.assertEquals(Tensor.of(new double[][] { { 1, 2, 5 }, { 3, 4, 6 } }), Tensor.cat(-1, a, b));
    Assert.assertEquals(Tensor.of(new double[][] { { 1, 2 }, { 3, 4 }, { 1, 2 }, { 3, 4 } }), Tensor.cat(0, a, a));

    Tensor stacked = Tensor.stack(Arrays.asList(a, a, a));
    Assert.assertArrayEquals(new int[] { 3, 2, 2 }, stacked.shape());
    Assert.assertEquals(4.0D, stacked.get(2, 1, 1), 0.0D);
  }

  @Test
  public void testCatWidensPrecision() {
    Tensor a = Tensor.of(DType.FLOAT32, 1, 2);
    Tensor b = Tensor.of(3, 4);

    Assert.assertEquals(DType.FLOAT64, Tensor.cat(0, a, b).dtype());
    Assert.assertEquals(DType.FLOAT32, Tensor.cat(0, a, a).dtype());
  }

  @Test
  public void testMapLines() {
    Tensor t = Tensor.of(new double[][] { { 1, 2, 3 }, { 4, 5, 6 } });

    // Sum of each column, along the first axis
    Tensor sums = t.mapLines(0, 1, (in, out) -> {
      for (double v : in) {
        out[0] += v;
      }
    });

    Assert.assertEquals(Tensor.of(new double[][] { { 5, 7, 9 } }), sums);

    // Reversal of each row
    Tensor reversed = t.mapLines(-1, 3, (in, out) -> {
      for (int i = 0; i < in.length; i++) {
        out[i] = in[in.length - 1 - i];
      }
    });

    Assert.assertEquals(Tensor.of(new double[][] { { 3, 2, 1 }, { 6, 5, 4 } }), reversed);
    Assert.assertEquals(Tensor.of(new double[][] { { 1, 2, 3 }, { 4, 5, 6 } }), t);
  }

  @Test
  public void testCombineLines() {
    Tensor a = Tensor.of(new double[][] { { 1, 2 }, { 3, 4 } });
    Tensor b = Tensor.of(new double[][] { { 10, 20 }, { 30, 40 } });

    Tensor interleaved = Tensor.combineLines(a, b, -1, 4, (x, y, out) -> {
      for (int i = 0; i < x.length; i++) {
        out[2 * i] = x[i];
        out[2 * i + 1] = y[i];
      }
    });

    Assert.assertEquals(Tensor.of(new double[][] { { 1, 10, 2, 20 }, { 3, 30, 4, 40 } }), interleaved);
  }

  @Test
  public void testReshape() {
    Tensor t = Tensor.of(1, 2, 3, 4, 5, 6);

    Assert.assertArrayEquals(new int[] { 2, 3 }, t.reshape(2, 3).shape());
    Assert.assertArrayEquals(new int[] { 1, 6 }, t.unsqueeze(0).shape());
    Assert.assertArrayEquals(new int[] { 6, 1 }, t.unsqueeze(-1).shape());
    Assert.assertArrayEquals(new int[] { 6 }, t.reshape(1, 6, 1).squeeze().shape());
    Assert.assertEquals(4.0D, Tensor.of(4).item(), 0.0D);
  }

  @Test
  public void testAllClose() {
    Tensor a = Tensor.of(1.0D, 2.0D);
    Tensor b = Tensor.of(1.0D + 1e-9D, 2.0D);

    Assert.assertTrue(a.allClose(b, 0.0D, 1e-8D));
    Assert.assertFalse(a.allClose(b, 0.0D, 1e-10D));
    Assert.assertFalse(a.allClose(Tensor.of(1.0D, 2.0D, 3.0D), 0.0D, 1.0D));
    Assert.assertFalse(Tensor.of(Double.NaN).allClose(Tensor.of(Double.NaN), 0.0D, 1.0D));
    Assert.assertEquals(1e-9D, a.maxAbsDifference(b), 1e-15D);
  }

  @Test
  public void testImmutability() {
    double[] values = new double[] { 1, 2, 3 };
    Tensor t = Tensor.create(DType.FLOAT64, new int[] { 3 }, values);

    values[0] = 42.0D;
    t.toArray()[1] = 42.0D;

    Assert.assertEquals(Tensor.of(1, 2, 3), t);
  }

  @Test
  public void testZeros() {
    Tensor t = Tensor.zeros(DType.FLOAT32, 2, 3);
    Assert.assertArrayEquals(new double[6], t.toArray(), 0.0D);
    Assert.assertEquals(DType.FLOAT32, t.dtype());
  }
}
