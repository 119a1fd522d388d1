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
import io.warpwave.wavelets.Wavelet;
import io.warpwave.wavelets.WaveletRegistry;

import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Turns wavelet names and filter bank sources into validated {@link FilterBank} instances.
 */
public class FilterBanks {

  public static FilterBank resolve(String name) {
    Wavelet wavelet = WaveletRegistry.find(name);

    if (null == wavelet) {
      throw new WaveletConfigurationException("Could not find wavelet '" + name + "'.");
    }

    return resolve(wavelet);
  }

  public static FilterBank resolve(FilterBankSource source) {
    Preconditions.checkNotNull(source, "No filter bank source given.");

    if (source instanceof FilterBank) {
      return (FilterBank) source;
    }

    String name = source instanceof Wavelet ? ((Wavelet) source).getName() : source.getClass().getSimpleName();

    List<double[]> filters = source.getFilters();

    if (null == filters || filters.size() < 4) {
      throw new WaveletConfigurationException("Filter bank '" + name + "' must expose four filters, got " + (null == filters ? 0 : filters.size()) + ".");
    }

    if (filters.size() > 4) {
      throw new WaveletConfigurationException("Filter bank '" + name + "' must expose exactly four filters, got " + filters.size() + ".");
    }

    int len = -1;

    for (double[] filter : filters) {
      if (null == filter || 0 == filter.length) {
        throw new WaveletConfigurationException("Filter bank '" + name + "' contains an empty filter.");
      }
      if (-1 == len) {
        len = filter.length;
      } else if (len != filter.length) {
        throw new WaveletConfigurationException("Filter bank '" + name + "' contains filters of unequal lengths.");
      }
    }

    if (len < 2) {
      throw new WaveletConfigurationException("Filter bank '" + name + "' has filters shorter than 2 taps.");
    }

    return new FilterBank(name, filters.get(0), filters.get(1), filters.get(2), filters.get(3));
  }
}
