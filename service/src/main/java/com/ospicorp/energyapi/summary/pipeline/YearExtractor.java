package com.ospicorp.energyapi.summary.pipeline;

import com.ospicorp.energyapi.summary.model.RawTable;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import org.springframework.util.StringUtils;

/**
 * Years holding at least one complete period. The last timestamp of a series belongs to a
 * period that is still open, so it never counts.
 */
public final class YearExtractor {
  private YearExtractor() {
  }

  public static List<Integer> years(RawTable table) {
    SortedSet<Instant> times = new TreeSet<>();
    for (Map<String, String> row : table.rows()) {
      String time = row.get(RowNormalizer.TIME);
      if (StringUtils.hasText(time)) {
        times.add(RowNormalizer.parseTime(time));
      }
    }
    if (times.size() < 2) {
      return List.of();
    }
    SortedSet<Integer> years = new TreeSet<>();
    for (Instant time : times.headSet(times.last())) {
      years.add(time.atZone(ZoneOffset.UTC).getYear());
    }
    return List.copyOf(years);
  }

  public static List<Integer> years(Collection<RawTable> tables) {
    SortedSet<Integer> union = new TreeSet<>();
    for (RawTable table : tables) {
      union.addAll(years(table));
    }
    return new ArrayList<>(union);
  }
}
