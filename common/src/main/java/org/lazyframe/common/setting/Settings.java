/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.common.setting;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/** Immutable view over raw configuration values, read through typed {@link Setting} keys. */
public class Settings {

  private static final Settings EMPTY = new Settings(Map.of());

  private final Map<String, Object> values;

  public Settings(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(new HashMap<>(values));
  }

  /** Settings with every key at its default. */
  public static Settings defaults() {
    return EMPTY;
  }

  public <T> T get(Setting<T> setting) {
    return setting.convert(values.get(setting.getKey()));
  }

  /** Returns a copy of these settings with one key overridden. */
  public Settings with(Setting<?> setting, Object value) {
    Map<String, Object> copy = new HashMap<>(values);
    copy.put(setting.getKey(), value);
    return new Settings(copy);
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public String toString() {
    return "Settings" + values;
  }
}
