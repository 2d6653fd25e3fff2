package com.consullo.hdlbench.trace;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A declared trace variable and its value changes.
 *
 * <p>Changes are kept in ascending time order; changes at the same time keep the order in which they appeared.
 *
 * @param identifier trace identifier code
 * @param name short name as declared
 * @param fullName scope path joined with {@code .}, ending in {@code name}
 * @param kind variable kind as declared, e.g. {@code wire} or {@code reg}
 * @param width declared width in bits
 * @param changes value changes in time order
 * @since 1.0
 */
public record SignalRecord(
    String identifier,
    String name,
    String fullName,
    String kind,
    int width,
    List<ValueChange> changes) {

  public SignalRecord {
    if (identifier == null || identifier.isEmpty() || name == null || fullName == null || kind == null) {
      throw new IllegalArgumentException("identifier/name/fullName/kind must not be null.");
    }
    if (width < 1) {
      throw new IllegalArgumentException("width must be at least 1: " + width);
    }
    List<ValueChange> sorted = new ArrayList<>(changes == null ? List.of() : changes);
    sorted.sort(Comparator.comparingLong(ValueChange::time));
    changes = List.copyOf(sorted);
  }

  public boolean isScalar() {
    return width == 1;
  }

  public int changeCount() {
    return changes.size();
  }

  public Optional<ValueChange> firstChange() {
    return changes.isEmpty() ? Optional.empty() : Optional.of(changes.get(0));
  }

  public Optional<ValueChange> lastChange() {
    return changes.isEmpty() ? Optional.empty() : Optional.of(changes.get(changes.size() - 1));
  }

  /**
   * True when any recorded value has an {@code x} or {@code z} bit.
   */
  public boolean everUnknown() {
    for (ValueChange c : changes) {
      if (c.value().hasUnknownBits()) {
        return true;
      }
    }
    return false;
  }
}
