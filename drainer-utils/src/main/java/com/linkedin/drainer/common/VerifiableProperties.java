/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.common;

import java.util.Collections;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Utility class for managing property retrieval from {@link Properties} objects.
 * Values of keys containing "password" are never printed.
 */
public class VerifiableProperties {

  protected static final Logger LOG = LoggerFactory.getLogger(VerifiableProperties.class);

  private static final String MASK = "******";

  private final Set<String> _referenceSet = Collections.synchronizedSet(new HashSet<>());
  private final Properties _props;

  /**
   * Construct an instance of VerifiableProperties given a set of {@link Properties}
   */
  public VerifiableProperties(Properties props) {
    _props = new Properties();
    _props.putAll(props);
  }

  /**
   * Get all properties under a specific domain (start with a certain prefix)
   * @param prefix The prefix being used to filter the properties. If it's blank (null or empty or whitespace only),
   *               the method will return a copy of all properties.
   * @param preserveFullKey Whether to preserve the full key (including the prefix) or strip the prefix in the result
   * @return A Properties that contains all the entries that are under the domain
   */
  public Properties getDomainProperties(String prefix, boolean preserveFullKey) {
    String fullPrefix;
    if (StringUtils.isBlank(prefix)) {
      fullPrefix = "";
    } else {
      fullPrefix = prefix.endsWith(".") ? prefix : prefix + ".";
    }
    Properties ret = new Properties();
    for (String key : _props.stringPropertyNames()) {
      if (key.startsWith(fullPrefix) && !key.equals(fullPrefix)) {
        ret.put(preserveFullKey ? key : key.substring(fullPrefix.length()), getProperty(key));
      }
    }
    return ret;
  }

  /**
   * Retrieve the properties of a certain domain (i.e. starting with a given prefix)
   */
  public Properties getDomainProperties(String prefix) {
    return getDomainProperties(prefix, false);
  }

  /**
   * Get a property by name
   */
  public String getProperty(String name) {
    String value = _props.getProperty(name);
    _referenceSet.add(name);
    return value;
  }

  /**
   * Read an integer from the properties instance. Throw an exception
   * if the value is not in the given range (inclusive)
   * @param name The property name
   * @param defaultVal The default value to use if the property is not found
   * @param start The start of the range in which the value must fall (inclusive)
   * @param end The end of the range in which the value must fall
   * @throws IllegalArgumentException If the value is not a number or not in the given range
   * @return the integer value
   */
  public int getIntInRange(String name, int defaultVal, int start, int end) {
    return (int) getLongInRange(name, defaultVal, start, end);
  }

  /**
   * Read a long from the properties instance
   * @param name The property name
   * @param defaultVal The default value to use if the property is not found
   * @return the long value
   */
  public long getLong(String name, long defaultVal) {
    return getLongInRange(name, defaultVal, Long.MIN_VALUE, Long.MAX_VALUE);
  }

  /**
   * Read a long from the properties instance. Throw an exception
   * if the value is not in the given range (inclusive)
   * @param name The property name
   * @param defaultVal The default value to use if the property is not found
   * @param start The start of the range in which the value must fall (inclusive)
   * @param end The end of the range in which the value must fall
   * @throws IllegalArgumentException If the value is not a number or not in the given range
   * @return the long value
   */
  public long getLongInRange(String name, long defaultVal, long start, long end) {
    if (!containsKey(name)) {
      return defaultVal;
    }
    String raw = StringUtils.trim(getProperty(name));
    long v;
    try {
      v = Long.parseLong(raw);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " has value " + raw + " which is not a number.", e);
    }
    if (v >= start && v <= end) {
      return v;
    }
    throw new IllegalArgumentException(name + " has value " + v + " which is not in the range " + start + "-" + end
        + ".");
  }

  /**
   * Get a string property, or, if no such property is defined, return the given default value
   */
  public String getString(String name, String defaultVal) {
    if (containsKey(name)) {
      return getProperty(name);
    } else {
      return defaultVal;
    }
  }

  /**
   * Verify that every property has been accessed/retrieved at least once.
   * A warning is logged for every property that has never been retrieved.
   */
  public void verify() {
    LOG.info("Verifying properties");
    Enumeration<?> keys = _props.propertyNames();
    while (keys.hasMoreElements()) {
      String key = keys.nextElement().toString();
      if (!_referenceSet.contains(key)) {
        LOG.warn("Property {} is not valid", key);
      } else {
        LOG.info("Property {} is overridden to {}", key, printable(key, _props.getProperty(key)));
      }
    }
  }

  private boolean containsKey(String name) {
    return _props.containsKey(name);
  }

  private static String printable(String key, String value) {
    return StringUtils.containsIgnoreCase(key, "password") && StringUtils.isNotEmpty(value) ? MASK : value;
  }

  @Override
  public String toString() {
    TreeMap<String, String> sorted = new TreeMap<>();
    for (String key : _props.stringPropertyNames()) {
      sorted.put(key, printable(key, _props.getProperty(key)));
    }
    return sorted.toString();
  }
}
