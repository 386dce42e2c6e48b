package com.mk.fx.qa.consistency.producer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Builds event payloads from a configured template. Any string value equal to {@value
 * #UUID_PLACEHOLDER}, at any depth, is replaced by a fresh random UUID per payload.
 */
public final class PayloadTemplate implements Supplier<Map<String, Object>> {

  public static final String UUID_PLACEHOLDER = "{{uuid}}";

  private final Map<String, Object> template;

  public PayloadTemplate(Map<String, Object> template) {
    this.template = template != null ? Map.copyOf(template) : Map.of();
  }

  @Override
  public Map<String, Object> get() {
    return expandMap(template);
  }

  private static Map<String, Object> expandMap(Map<?, ?> source) {
    Map<String, Object> out = new LinkedHashMap<>();
    source.forEach((key, value) -> out.put(String.valueOf(key), expand(value)));
    return out;
  }

  private static Object expand(Object value) {
    if (value instanceof Map<?, ?> map) {
      return expandMap(map);
    }
    if (value instanceof List<?> list) {
      List<Object> out = new ArrayList<>(list.size());
      list.forEach(item -> out.add(expand(item)));
      return out;
    }
    if (UUID_PLACEHOLDER.equals(value)) {
      return UUID.randomUUID().toString();
    }
    return value;
  }
}
