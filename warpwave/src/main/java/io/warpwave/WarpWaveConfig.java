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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Map.Entry;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process wide configuration.
 *
 * Until properties are set, every lookup returns its default value so the
 * transforms can be used without any configuration file.
 */
public class WarpWaveConfig {

  private static final Logger LOG = LoggerFactory.getLogger(WarpWaveConfig.class);

  /**
   * Name of the system property pointing to a configuration file
   */
  public static final String WARPWAVE_CONFIG = "warpwave.config";

  private static final Pattern VAR = Pattern.compile(".*\\$\\{([^}]+)\\}.*");

  private static Properties properties = null;

  public static synchronized void safeSetProperties(Reader reader) throws IOException {
    if (null != properties) {
      return;
    }

    setProperties(reader);
  }

  public static void setProperties(String file) throws IOException {
    if (null == file) {
      setProperties((Reader) null);
    } else {
      setProperties(Files.newBufferedReader(Paths.get(file), StandardCharsets.UTF_8));
    }
  }

  public static synchronized void setProperties(Reader reader) throws IOException {
    if (null != properties) {
      throw new RuntimeException("Properties already set.");
    }

    if (null != reader) {
      properties = readConfig(reader, null);
    } else {
      properties = readConfig(new StringReader(""), null);
    }
  }

  /**
   * Loads the file designated by the 'warpwave.config' system property, if any.
   */
  public static synchronized void safeSetPropertiesFromSystem() throws IOException {
    String file = System.getProperty(WARPWAVE_CONFIG);

    if (null != file && null == properties) {
      safeSetProperties(Files.newBufferedReader(Paths.get(file), StandardCharsets.UTF_8));
    }
  }

  public static synchronized boolean isPropertiesSet() {
    return null != properties;
  }

  static synchronized void clearProperties() {
    properties = null;
  }

  public static Properties readConfig(Reader reader, Properties properties) throws IOException {
    return readConfig(reader, properties, true);
  }

  public static Properties readConfig(Reader reader, Properties properties, boolean expandVars) throws IOException {
    //
    // Read the properties in the config file
    //

    if (null == properties) {
      properties = new Properties();
    }

    int lineno = 0;

    int errorcount = 0;

    try (BufferedReader br = new BufferedReader(reader)) {
      while (true) {
        String line = br.readLine();

        if (null == line) {
          break;
        }

        line = line.trim();
        lineno++;

        // Skip comments and blank lines
        if ("".equals(line) || line.startsWith("//") || line.startsWith("#") || line.startsWith("--")) {
          continue;
        }

        if (!line.contains("=")) {
          LOG.warn("Line " + lineno + " is missing an '=' sign, skipping.");
          continue;
        }

        String[] tokens = line.split("=");

        if (tokens.length > 2) {
          LOG.error("Invalid syntax on line " + lineno + ".");
          errorcount++;
          continue;
        }

        if (tokens.length < 2) {
          LOG.warn("Empty value for property '" + tokens[0].trim() + "', ignoring.");
          continue;
        }

        String name = tokens[0].trim();
        String value = tokens[1].trim();

        if ("".equals(value)) {
          continue;
        }

        properties.setProperty(name, value);
      }
    }

    if (errorcount > 0) {
      throw new IOException("Configuration contains " + errorcount + " error" + (errorcount > 1 ? "s" : "") + ".");
    }

    if (expandVars) {
      //
      // Override properties with system properties
      //

      for (Entry<Object, Object> entry : System.getProperties().entrySet()) {
        properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
      }

      //
      // Now expand ${xxx} constructs
      //

      Set<String> emptyProperties = new HashSet<String>();

      for (String name : properties.stringPropertyNames()) {
        String value = properties.getProperty(name);

        //
        // Replace '' with the empty string
        //

        if ("''".equals(value)) {
          value = "";
        }

        int loopcount = 0;

        while (true) {
          Matcher m = VAR.matcher(value);

          if (!m.matches()) {
            break;
          }

          String var = m.group(1);

          if (properties.containsKey(var)) {
            value = value.replace("${" + var + "}", properties.getProperty(var));
          } else {
            LOG.warn("Property '" + var + "' referenced in property '" + name + "' is unset, unsetting '" + name + "'");
            value = null;
            break;
          }

          loopcount++;

          if (loopcount > 100) {
            throw new IOException("Too many dereferencing steps while expanding property '" + name + "'.");
          }
        }

        if (null == value) {
          emptyProperties.add(name);
        } else {
          properties.setProperty(name, value);
        }
      }

      for (String property : emptyProperties) {
        properties.remove(property);
      }
    }

    return properties;
  }

  public static synchronized Properties getProperties() {
    if (null == properties) {
      return null;
    }
    return (Properties) properties.clone();
  }

  public static synchronized String getProperty(String key) {
    if (null == properties) {
      return null;
    }
    return properties.getProperty(key);
  }

  public static synchronized String getProperty(String key, String defaultValue) {
    if (null == properties) {
      return defaultValue;
    }
    return properties.getProperty(key, defaultValue);
  }

  public static boolean getBooleanProperty(String key, String defaultValue) {
    return "true".equalsIgnoreCase(getProperty(key, defaultValue).trim());
  }

  public static double getDoubleProperty(String key, String defaultValue) {
    return Double.parseDouble(getProperty(key, defaultValue).trim());
  }
}
