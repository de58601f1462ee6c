/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.common;

import java.io.IOException;

import org.apache.commons.lang3.Validate;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;


/**
 * Utility class for converting objects and JSON strings.
 * Parse and serialization failures surface as {@link DrainerRuntimeException}
 * carrying the underlying Jackson exception as the cause.
 * Integral fields only accept JSON integers: floats and numeric strings are rejected rather than truncated.
 */
public final class JsonUtils {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  static {
    MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    MAPPER.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
    MAPPER.configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
    MAPPER.coercionConfigFor(LogicalType.Integer)
        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
  }

  private JsonUtils() {
  }

  /**
   * Deserialize a JSON string into an object with the specified type.
   * @param json JSON string
   * @param clazz class of the target object
   * @param <T> type of the target object
   * @return deserialized Java object
   */
  public static <T> T fromJson(String json, Class<T> clazz) {
    Validate.notNull(json, "null JSON string");
    Validate.notNull(clazz, "null class object");
    try {
      return MAPPER.readValue(json, clazz);
    } catch (IOException e) {
      throw new DrainerRuntimeException("Failed to parse json: " + json, e);
    }
  }

  /**
   * Serialize a Java object into JSON string.
   * @param object object to be serialized
   * @param <T> type of the input object
   * @return JSON string
   */
  public static <T> String toJson(T object) {
    Validate.notNull(object, "null input object");
    try {
      return MAPPER.writeValueAsString(object);
    } catch (IOException e) {
      throw new DrainerRuntimeException("Failed to serialize object: " + object, e);
    }
  }
}
