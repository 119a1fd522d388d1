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

import io.warpwave.fwt.FWT;
import io.warpwave.fwt.PaddingMode;
import io.warpwave.packets.WaveletPacket;
import io.warpwave.tensor.Tensor;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Properties;

import org.junit.After;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class WarpWaveConfigTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @After
  public void tearDown() {
    WarpWaveConfig.clearProperties();
  }

  @Test
  public void testDefaults() {
    Assert.assertFalse(WarpWaveConfig.isPropertiesSet());
    Assert.assertNull(WarpWaveConfig.getProperty(Configuration.FWT_MODE));
    Assert.assertEquals("reflect", WarpWaveConfig.getProperty(Configuration.FWT_MODE, Configuration.DEFAULT_FWT_MODE));
    Assert.assertFalse(WarpWaveConfig.getBooleanProperty(Configuration.PACKETS_LAZY, Configuration.DEFAULT_PACKETS_LAZY));
    Assert.assertEquals(1e-8D, WarpWaveConfig.getDoubleProperty(Configuration.FWT_BOUNDARY_TOLERANCE, Configuration.DEFAULT_FWT_BOUNDARY_TOLERANCE), 0.0D);
  }

  @Test
  public void testReadConfig() throws IOException {
    StringBuilder sb = new StringBuilder();
    sb.append("// comment\n");
    sb.append("# another comment\n");
    sb.append("-- and another one\n");
    sb.append("\n");
    sb.append("fwt.mode = periodic\n");
    sb.append("missing equal sign\n");
    sb.append("empty.value =\n");
    sb.append("base = db\n");
    sb.append("wavelet = ${base}4\n");
    sb.append("dangling = ${warpwave.test.unset}\n");
    sb.append("nothing = ''\n");

    Properties props = WarpWaveConfig.readConfig(new StringReader(sb.toString()), null);

    Assert.assertEquals("periodic", props.getProperty("fwt.mode"));
    Assert.assertEquals("db4", props.getProperty("wavelet"));
    Assert.assertEquals("", props.getProperty("nothing"));
    Assert.assertNull(props.getProperty("empty.value"));
    Assert.assertNull(props.getProperty("dangling"));
    Assert.assertNull(props.getProperty("missing equal sign"));
  }

  @Test(expected = IOException.class)
  public void testInvalidLine() throws IOException {
    WarpWaveConfig.readConfig(new StringReader("a = b = c\n"), null);
  }

  @Test
  public void testSystemPropertiesOverride() throws IOException {
    System.setProperty("warpwave.test.override", "system");

    try {
      Properties props = WarpWaveConfig.readConfig(new StringReader("warpwave.test.override = file\n"), null);
      Assert.assertEquals("system", props.getProperty("warpwave.test.override"));
    } finally {
      System.clearProperty("warpwave.test.override");
    }
  }

  @Test
  public void testConfiguredModes() throws IOException {
    WarpWaveConfig.setProperties(new StringReader("fwt.mode = zero\npackets.mode = periodic\npackets.lazy = true\n"));

    Assert.assertTrue(WarpWaveConfig.isPropertiesSet());

    Tensor data = MackeyGlass.generate(1, 64);

    List<Tensor> coeffs = FWT.wavedec(data, "db2");
    List<Tensor> zero = FWT.wavedec(data, "db2", null, "zero");

    for (int i = 0; i < coeffs.size(); i++) {
      Assert.assertEquals(zero.get(i), coeffs.get(i));
    }

    WaveletPacket wp = new WaveletPacket(data, "db2");

    Assert.assertEquals(PaddingMode.PERIODIC, wp.getMode());
    Assert.assertTrue(wp.isLazy());
    Assert.assertEquals(1, wp.size());
  }

  @Test
  public void testSafeSetProperties() throws IOException {
    WarpWaveConfig.safeSetProperties(new StringReader("fwt.mode = zero\n"));
    WarpWaveConfig.safeSetProperties(new StringReader("fwt.mode = periodic\n"));

    Assert.assertEquals("zero", WarpWaveConfig.getProperty(Configuration.FWT_MODE));

    try {
      WarpWaveConfig.setProperties(new StringReader("fwt.mode = periodic\n"));
      Assert.fail();
    } catch (RuntimeException re) {
      Assert.assertEquals("zero", WarpWaveConfig.getProperty(Configuration.FWT_MODE));
    }
  }

  @Test
  public void testSetPropertiesFromSystem() throws IOException {
    Assert.assertNull(System.getProperty(WarpWaveConfig.WARPWAVE_CONFIG));

    WarpWaveConfig.safeSetPropertiesFromSystem();
    Assert.assertFalse(WarpWaveConfig.isPropertiesSet());

    File config = folder.newFile("warpwave.conf");
    Files.write(config.toPath(), "fwt.mode = periodic\npackets.lazy = true\n".getBytes(StandardCharsets.UTF_8));

    System.setProperty(WarpWaveConfig.WARPWAVE_CONFIG, config.getAbsolutePath());

    try {
      WarpWaveConfig.safeSetPropertiesFromSystem();

      Assert.assertTrue(WarpWaveConfig.isPropertiesSet());
      Assert.assertEquals("periodic", WarpWaveConfig.getProperty(Configuration.FWT_MODE));
      Assert.assertTrue(WarpWaveConfig.getBooleanProperty(Configuration.PACKETS_LAZY, Configuration.DEFAULT_PACKETS_LAZY));

      // Already loaded, a second call keeps the current properties
      Files.write(config.toPath(), "fwt.mode = zero\n".getBytes(StandardCharsets.UTF_8));
      WarpWaveConfig.safeSetPropertiesFromSystem();
      Assert.assertEquals("periodic", WarpWaveConfig.getProperty(Configuration.FWT_MODE));
    } finally {
      System.clearProperty(WarpWaveConfig.WARPWAVE_CONFIG);
    }
  }

  @Test(expected = InvalidPaddingModeException.class)
  public void testInvalidConfiguredMode() throws IOException {
    WarpWaveConfig.setProperties(new StringReader("fwt.mode = mirror\n"));
    FWT.wavedec(MackeyGlass.generate(1, 64), "db2");
  }
}
