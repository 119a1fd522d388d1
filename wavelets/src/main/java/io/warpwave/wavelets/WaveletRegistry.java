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

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.base.Preconditions;

public class WaveletRegistry {
  private static final Map<String,Wavelet> registry = new ConcurrentHashMap<String, Wavelet>();

  static {
    register(new Wavelet_haar());
    register(new Wavelet_db1());
    register(new Wavelet_db2());
    register(new Wavelet_db3());
    register(new Wavelet_db4());
    register(new Wavelet_db5());
    register(new Wavelet_db6());
    register(new Wavelet_db7());
    register(new Wavelet_db8());
    register(new Wavelet_db9());
    register(new Wavelet_db10());
    register(new Wavelet_sym4());
    register(new Wavelet_sym5());
    register(new Wavelet_sym7());
    register(new Wavelet_sym8());
    register(new Wavelet_coif3());
    register(new Wavelet_coif4());
    register(new Wavelet_bior28());
    register(new Wavelet_bior55());
    register(new Wavelet_rbio26());
  }

  public static void register(Wavelet wavelet) {
    register(wavelet.getName(), wavelet);
  }

  public static void register(String name, Wavelet wavelet) {
    Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(wavelet);
    registry.put(name, wavelet);
  }

  /**
   * @return the wavelet registered under 'name' or null if there is none
   */
  public static Wavelet find(String name) {
    if (null == name) {
      return null;
    }
    return registry.get(name);
  }

  public static Set<String> names() {
    return Collections.unmodifiableSet(new TreeSet<String>(registry.keySet()));
  }
}
