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

package io.warpwave.wavelets;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

public class WaveletRegistryTest {

  private static final double EPSILON = 1e-8D;

  private static final String[] CATALOG = new String[] { "haar", "db1", "db2", "db3", "db4", "db5", "db6", "db7", "db8", "db9", "db10",
      "sym4", "sym5", "sym7", "sym8", "coif3", "coif4", "bior2.8", "bior5.5", "rbio2.6" };

  @Test
  public void testCatalog() {
    for (String name : CATALOG) {
      Wavelet wavelet = WaveletRegistry.find(name);
      Assert.assertNotNull(name, wavelet);
      Assert.assertEquals(name, wavelet.getName());
      Assert.assertTrue(wavelet.isBiorthogonal());
    }

    Assert.assertTrue(WaveletRegistry.names().contains("db4"));
    Assert.assertNull(WaveletRegistry.find("db42"));
    Assert.assertNull(WaveletRegistry.find(null));
  }

  @Test
  public void testFilterLengths() {
    Assert.assertEquals(2, WaveletRegistry.find("haar").getFilterLength());
    Assert.assertEquals(4, WaveletRegistry.find("db2").getFilterLength());
    Assert.assertEquals(20, WaveletRegistry.find("db10").getFilterLength());
    Assert.assertEquals(16, WaveletRegistry.find("sym8").getFilterLength());
    Assert.assertEquals(18, WaveletRegistry.find("coif3").getFilterLength());
    Assert.assertEquals(18, WaveletRegistry.find("bior2.8").getFilterLength());

    for (String name : CATALOG) {
      List<double[]> filters = WaveletRegistry.find(name).getFilters();
      Assert.assertEquals(4, filters.size());
      for (double[] filter : filters) {
        Assert.assertEquals(name, filters.get(0).length, filter.length);
      }
    }
  }

  @Test
  public void testOrthonormality() {
    for (String name : CATALOG) {
      Wavelet wavelet = WaveletRegistry.find(name);

      if (!wavelet.isOrthogonal()) {
        continue;
      }

      double[] lo = wavelet.getDecompositionLowPass();
      double[] hi = wavelet.getDecompositionHighPass();
      double[] rlo = wavelet.getReconstructionLowPass();
      double[] rhi = wavelet.getReconstructionHighPass();

      int len = lo.length;

      double sum = 0.0D;

      for (int i = 0; i < len; i++) {
        sum += lo[i];
        // Reconstruction filters are the time reverse of the decomposition ones
        Assert.assertEquals(name, lo[len - 1 - i], rlo[i], EPSILON);
        Assert.assertEquals(name, hi[len - 1 - i], rhi[i], EPSILON);
      }

      Assert.assertEquals(name, Math.sqrt(2.0D), sum, EPSILON);

      for (int shift = 0; shift < len; shift += 2) {
        Assert.assertEquals(name, 0 == shift ? 1.0D : 0.0D, dot(lo, lo, shift), EPSILON);
        Assert.assertEquals(name, 0 == shift ? 1.0D : 0.0D, dot(hi, hi, shift), EPSILON);
        Assert.assertEquals(name, 0.0D, dot(lo, hi, shift), EPSILON);
        Assert.assertEquals(name, 0.0D, dot(hi, lo, shift), EPSILON);
      }
    }
  }

  @Test
  public void testFamilies() {
    Assert.assertEquals(Wavelet.Family.DAUBECHIES, WaveletRegistry.find("db3").getFamily());
    Assert.assertEquals("sym", WaveletRegistry.find("sym5").getFamily().getShortName());
    Assert.assertTrue(WaveletRegistry.find("coif4").isOrthogonal());
    Assert.assertFalse(WaveletRegistry.find("bior5.5").isOrthogonal());
    Assert.assertFalse(WaveletRegistry.find("rbio2.6").isOrthogonal());
    Assert.assertEquals(6, WaveletRegistry.find("coif3").getVanishingMomentsPsi());
    Assert.assertEquals(4, WaveletRegistry.find("db4").getVanishingMomentsPsi());
  }

  @Test
  public void testFiltersAreCopies() {
    Wavelet wavelet = WaveletRegistry.find("db2");
    double[] lo = wavelet.getDecompositionLowPass();
    double first = lo[0];
    lo[0] = 42.0D;
    Assert.assertEquals(first, wavelet.getDecompositionLowPass()[0], 0.0D);
  }

  @Test
  public void testRegister() {
    Wavelet custom = new Wavelet("custom-haar", Wavelet.Family.HAAR, 1,
        new double[] { 0.5D, 0.5D }, new double[] { -0.5D, 0.5D }, new double[] { 0.5D, 0.5D }, new double[] { 0.5D, -0.5D }) {};

    WaveletRegistry.register(custom);

    Assert.assertSame(custom, WaveletRegistry.find("custom-haar"));
  }

  private static double dot(double[] a, double[] b, int shift) {
    double sum = 0.0D;
    for (int j = 0; j + shift < a.length; j++) {
      sum += a[j] * b[j + shift];
    }
    return sum;
  }
}
