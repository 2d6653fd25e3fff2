package com.consullo.hdlbench.trace;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Point-in-time lookups over a {@link SignalRecord}.
 *
 * <p>Stateless; lookups use a binary search over the time-ordered change list.
 *
 * @since 1.0
 */
public final class TraceQuery {

  /**
   * Returns the value of the last change at or before {@code time}. When several changes share that timestamp the
   * one recorded last wins. Before the first change, or when there are no changes, the result is all {@code x} at
   * the record's width.
   *
   * @param record signal record
   * @param time query time; any value, negative times precede every change
   * @return value at {@code time}
   */
  public SignalValue valueAt(SignalRecord record, long time) {
    return lastChangeAtOrBefore(record, time)
        .map(ValueChange::value)
        .orElseGet(() -> SignalValue.unknown(record.width()));
  }

  /**
   * Returns the last change with a timestamp at or before {@code time}.
   *
   * @param record signal record
   * @param time query time
   * @return change, or empty when none qualifies
   */
  public Optional<ValueChange> lastChangeAtOrBefore(SignalRecord record, long time) {
    Validate.notNull(record, "record must not be null");
    List<ValueChange> changes = record.changes();
    int low = 0;
    int high = changes.size();
    // first index whose time is greater than the query
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (changes.get(mid).time() <= time) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low == 0 ? Optional.empty() : Optional.of(changes.get(low - 1));
  }

  /**
   * Inspects every signal of a table at {@code time}, in declaration order.
   *
   * @param table signals
   * @param time inspected time
   * @return one inspection per signal
   */
  public List<SignalInspection> inspect(SignalTable table, long time) {
    Validate.notNull(table, "table must not be null");
    return inspect(table.records(), time);
  }

  /**
   * Inspects the named signals at {@code time}. Names are matched as in {@link SignalTable#byName(String)};
   * unknown names are skipped.
   *
   * @param table signals
   * @param names short or full names
   * @param time inspected time
   * @return one inspection per resolved name, in the order given
   */
  public List<SignalInspection> inspect(SignalTable table, Collection<String> names, long time) {
    Validate.notNull(table, "table must not be null");
    Validate.notNull(names, "names must not be null");
    List<SignalRecord> selected = new ArrayList<>(names.size());
    for (String name : names) {
      table.byName(name).ifPresent(selected::add);
    }
    return inspect(selected, time);
  }

  private List<SignalInspection> inspect(List<SignalRecord> records, long time) {
    List<SignalInspection> out = new ArrayList<>(records.size());
    for (SignalRecord r : records) {
      out.add(new SignalInspection(r.name(), r.fullName(), r.width(), time, valueAt(r, time)));
    }
    return out;
  }
}
