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

package io.warpwave.fwt;

import io.warpwave.WaveletConfigurationException;
import io.warpwave.wavelets.FilterBankSource;
import io.warpwave.wavelets.WaveletRegistry;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

public class FilterBanksTest {

  @Test
  public void testResolveName() {
    FilterBank bank = FilterBanks.resolve("db2");

    Assert.assertEquals("db2", bank.getName());
    Assert.assertEquals(4, bank.length());

    double[] decLo = WaveletRegistry.find("db2").getDecompositionLowPass();

    Assert.assertArrayEquals(decLo, bank.decLo(), 0.0D);

    // Decomposition filters are reversed to be used as correlation kernels
    for (int i = 0; i < 4; i++) {
      Assert.assertEquals(decLo[3 - i], bank.decLoKernel()[i], 0.0D);
    }

    Assert.assertTrue(bank.isOrthogonal(1e-8D));
  }

  @Test
  public void testResolveIsIdempotent() {
    FilterBank bank = FilterBanks.resolve("sym4");
    Assert.assertSame(bank, FilterBanks.resolve(bank));
  }

  @Test
  public void testExplicitBank() {
    FilterBank bank = FilterBanks.resolve(FWTTest.UNSCALED_HAAR);

    Assert.assertEquals(2, bank.length());
    Assert.assertArrayEquals(new double[] { -0.5D, 0.5D }, bank.decHi(), 0.0D);

    // Unscaled filters are not orthonormal
    Assert.assertFalse(bank.isOrthogonal(1e-8D));
  }

  @Test
  public void testBiorthogonalIsNotOrthogonal() {
    Assert.assertFalse(FilterBanks.resolve("bior5.5").isOrthogonal(1e-8D));
    Assert.assertTrue(FilterBanks.resolve("coif3").isOrthogonal(1e-8D));
  }

  @Test
  public void testFiltersAreCopied() {
    double[] lo = new double[] { 0.5D, 0.5D };

    FilterBank bank = FilterBanks.resolve(() -> Arrays.asList(lo, new double[] { -0.5D, 0.5D }, new double[] { 0.5D, 0.5D }, new double[] { 0.5D, -0.5D }));

    lo[0] = 3.0D;

    Assert.assertEquals(0.5D, bank.decLo()[0], 0.0D);
    Assert.assertEquals(0.5D, bank.getFilters().get(0)[0], 0.0D);
  }

  @Test
  public void testMalformedBanks() {
    double[] two = new double[] { 1.0D, 1.0D };
    double[] three = new double[] { 1.0D, 1.0D, 1.0D };

    assertRejected(() -> Arrays.asList(two, two, two));
    assertRejected(() -> Arrays.asList(two, two, two, two, two));
    assertRejected(() -> Arrays.asList(two, two, two, three));
    assertRejected(() -> Arrays.asList(two, new double[0], two, two));
    assertRejected(() -> Arrays.asList(new double[] { 1.0D }, new double[] { 1.0D }, new double[] { 1.0D }, new double[] { 1.0D }));
    assertRejected(() -> Arrays.asList(two, null, two, two));
    assertRejected(() -> null);
    assertRejected(() -> Collections.<double[]>emptyList());
  }

  @Test(expected = WaveletConfigurationException.class)
  public void testUnknownName() {
    FilterBanks.resolve("haar2");
  }

  private static void assertRejected(FilterBankSource source) {
    try {
      FilterBank bank = FilterBanks.resolve(source);
      List<double[]> filters = bank.getFilters();
      Assert.fail("Accepted a bank of " + filters.size() + " filters.");
    } catch (WaveletConfigurationException wce) {
      Assert.assertTrue(wce.getMessage().startsWith("Filter bank"));
    }
  }
}
