package com.consullo.hdlbench.trace;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable map from trace identifier to {@link SignalRecord}, in declaration order.
 *
 * @since 1.0
 */
public final class SignalTable {

  private static final SignalTable EMPTY = new SignalTable(new LinkedHashMap<>());

  private final Map<String, SignalRecord> byIdentifier;

  private SignalTable(LinkedHashMap<String, SignalRecord> byIdentifier) {
    this.byIdentifier = Collections.unmodifiableMap(byIdentifier);
  }

  public static SignalTable empty() {
    return EMPTY;
  }

  /**
   * Builds a table from records; a later record with the same identifier replaces an earlier one.
   *
   * @param records records in declaration order
   * @return table
   */
  public static SignalTable of(Collection<SignalRecord> records) {
    LinkedHashMap<String, SignalRecord> map = new LinkedHashMap<>();
    for (SignalRecord r : records) {
      map.put(r.identifier(), r);
    }
    return new SignalTable(map);
  }

  public Optional<SignalRecord> get(String identifier) {
    return Optional.ofNullable(byIdentifier.get(identifier));
  }

  /**
   * Looks a record up by short name, then by full name. The first match in declaration order wins.
   *
   * @param name short or full name
   * @return record, if any
   */
  public Optional<SignalRecord> byName(String name) {
    for (SignalRecord r : byIdentifier.values()) {
      if (r.name().equals(name)) {
        return Optional.of(r);
      }
    }
    for (SignalRecord r : byIdentifier.values()) {
      if (r.fullName().equals(name)) {
        return Optional.of(r);
      }
    }
    return Optional.empty();
  }

  public List<SignalRecord> records() {
    return List.copyOf(byIdentifier.values());
  }

  public List<String> names() {
    List<String> out = new ArrayList<>(byIdentifier.size());
    for (SignalRecord r : byIdentifier.values()) {
      out.add(r.name());
    }
    return out;
  }

  public int size() {
    return byIdentifier.size();
  }

  public boolean isEmpty() {
    return byIdentifier.isEmpty();
  }

  @Override
  public String toString() {
    return "SignalTable" + names();
  }
}
