/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.midend.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.midend.common.exceptions.InvalidOptionException;

/**
 * Middle-end settings.
 *
 * Each compilation unit is handed its own instance, so that no
 * configuration state is shared between units.
 * */
public class Settings
{
  /** Only public, protected and internal declarations get mangled ids */
  public static final String EXTERNALLY_VISIBLE_ONLY =
                                "midend.ir.externally-visible-only";
  /* Mirrors of external declarations get UNDEFINED_OFFSET
   * instead of the original source offsets */
  public static final String UNDEFINED_OFFSETS = "midend.ir.undefined-offsets";
  public static final String VALIDATE_CFG = "midend.cfg.validate";
  public static final String LOWER_PRIVATE_MEMBERS =
                                "midend.lower.private-members";

  public static final String LOG_FILE = "midend.log.file";
  public static final String LOG_TRACE = "midend.log.trace";

  private static final Properties defaults;

  static {
    defaults = new Properties();
    defaults.setProperty(EXTERNALLY_VISIBLE_ONLY, "true");
    defaults.setProperty(UNDEFINED_OFFSETS, "false");
    defaults.setProperty(VALIDATE_CFG, "true");
    defaults.setProperty(LOWER_PRIVATE_MEMBERS, "true");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
  }

  private final Properties properties;

  private Settings(Properties properties) {
    this.properties = properties;
  }

  /**
   * @return settings with default values only
   */
  public static Settings defaultSettings() {
    return new Settings(new Properties(defaults));
  }

  /**
     Overwrite each default property with value from System
   */
  public static Settings fromSystemProperties()
                                      throws InvalidOptionException {
    Settings settings = defaultSettings();
    for (String key: defaults.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        settings.set(key, sysVal);
      }
    }
    settings.validate();
    return settings;
  }

  public void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public String get(String key) {
    return properties.getProperty(key);
  }

  public List<String> getKeys() {
    List<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  public void validate() throws InvalidOptionException {
    for (String key: Arrays.asList(EXTERNALLY_VISIBLE_ONLY,
                          UNDEFINED_OFFSETS, VALIDATE_CFG,
                          LOWER_PRIVATE_MEMBERS, LOG_TRACE)) {
      getBoolean(key);
    }
  }

  public boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
