package io.intellixity.vigil.advisor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IndexStatus {
  UNKNOWN,
  PENDING,
  VALID,
  INVALID;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static IndexStatus fromWireName(String s) {
    if (s == null) return UNKNOWN;
    for (IndexStatus st : values()) {
      if (st.wireName().equalsIgnoreCase(s.trim())) return st;
    }
    return UNKNOWN;
  }
}
