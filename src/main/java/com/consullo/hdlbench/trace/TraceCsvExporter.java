package com.consullo.hdlbench.trace;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every value change of a trace as CSV rows {@code time,signal,value}, ordered by time. Rows with equal
 * times keep signal declaration order, then change order.
 *
 * @since 1.0
 */
public final class TraceCsvExporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TraceCsvExporter.class);

  public static final String HEADER = "Time (ns),Signal,Value";

  public void write(SignalTable table, Writer out) throws IOException {
    Validate.notNull(table, "table must not be null");
    Validate.notNull(out, "out must not be null");
    List<Row> rows = new ArrayList<>();
    for (SignalRecord r : table.records()) {
      for (ValueChange c : r.changes()) {
        rows.add(new Row(c.time(), r.name(), c.value().text()));
      }
    }
    rows.sort(Comparator.comparingLong(Row::time));
    out.write(HEADER);
    out.write('\n');
    for (Row row : rows) {
      out.write(row.time() + "," + quote(row.signal()) + "," + row.value() + "\n");
    }
    out.flush();
  }

  public String toCsv(SignalTable table) {
    StringWriter sw = new StringWriter();
    try {
      write(table, sw);
    } catch (IOException e) {
      throw new UncheckedIOException("StringWriter failed", e);
    }
    return sw.toString();
  }

  public Path writeTo(SignalTable table, Path file) throws IOException {
    Validate.notNull(file, "file must not be null");
    try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      write(table, w);
    }
    LOGGER.info("Exported {} signal(s) to {}", table.size(), file);
    return file;
  }

  private static String quote(String field) {
    if (StringUtils.containsAny(field, ',', '"', '\n')) {
      return "\"" + field.replace("\"", "\"\"") + "\"";
    }
    return field;
  }

  private record Row(long time, String signal, String value) {
  }
}
