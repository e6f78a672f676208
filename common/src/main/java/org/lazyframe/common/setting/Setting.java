/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.common.setting;

import java.util.function.Function;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A typed configuration key. The raw value read from configuration is converted by the setting's
 * converter; a missing key falls back to the default value.
 *
 * @param <T> value type
 */
@Getter
@RequiredArgsConstructor
public class Setting<T> {

  private final String key;
  private final T defaultValue;
  private final Function<Object, T> converter;

  public static Setting<Integer> intSetting(String key, int defaultValue) {
    return new Setting<>(
        key,
        defaultValue,
        raw ->
            raw instanceof Number ? ((Number) raw).intValue() : Integer.parseInt(raw.toString()));
  }

  public static Setting<String> stringSetting(String key, String defaultValue) {
    return new Setting<>(key, defaultValue, Object::toString);
  }

  /** Converts a raw configuration value, or returns the default when it is absent. */
  public T convert(Object raw) {
    if (raw == null) {
      return defaultValue;
    }
    try {
      return converter.apply(raw);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException(
          "Invalid value [" + raw + "] for setting " + key + ": " + e.getMessage(), e);
    }
  }

  @Override
  public String toString() {
    return key;
  }
}
