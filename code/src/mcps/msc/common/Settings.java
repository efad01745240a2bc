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

package mcps.msc.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import mcps.msc.common.exceptions.InvalidOptionException;

/**
 * General compiler settings.  Each has a default which can be
 * overridden by a Java system property of the same name.
 * */
public class Settings
{
  public static final String LOG_FILE = "msc.log.file";
  public static final String LOG_TRACE = "msc.log.trace";

  /** Run the scope validator before generating code */
  public static final String VALIDATE = "msc.validate";

  public static final String INPUT_FILENAME = "msc.input_filename";
  public static final String OUTPUT_FILENAME = "msc.output_filename";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(VALIDATE, "true");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_FILENAME, "");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initMscProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(VALIDATE);
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    strVal = strVal.trim();
    if (strVal.equalsIgnoreCase("true")) {
      return true;
    } else if (strVal.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for option " +
          key + ": " + strVal);
    }
  }
}
