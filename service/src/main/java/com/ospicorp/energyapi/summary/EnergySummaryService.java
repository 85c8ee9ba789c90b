package com.ospicorp.energyapi.summary;

import com.ospicorp.energyapi.influx.FluxQueryBuilder;
import com.ospicorp.energyapi.influx.InfluxQueryClient;
import com.ospicorp.energyapi.influx.TimeSeriesStoreException;
import com.ospicorp.energyapi.summary.model.EnergySummaryDocument;
import com.ospicorp.energyapi.summary.model.RawTable;
import com.ospicorp.energyapi.summary.model.RequestedShape;
import com.ospicorp.energyapi.summary.model.Resolution;
import com.ospicorp.energyapi.summary.model.WideTable;
import com.ospicorp.energyapi.summary.pipeline.ConsumptionPipeline;
import com.ospicorp.energyapi.summary.pipeline.JsonAssembler;
import com.ospicorp.energyapi.summary.pipeline.QueryWindow;
import com.ospicorp.energyapi.summary.pipeline.ResolutionCalendar;
import com.ospicorp.energyapi.summary.pipeline.WeeklyStopRule;
import com.ospicorp.energyapi.summary.pipeline.YearExtractor;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class EnergySummaryService {
  private static final Logger log = LoggerFactory.getLogger(EnergySummaryService.class);
  static final String MEASUREMENT_COLUMN = "_measurement";

  private final InfluxQueryClient client;
  private final ResolutionCalendar calendar;
  private final String defaultBucket;
  private final String unit;

  public EnergySummaryService(InfluxQueryClient client,
      @Value("${influxdb.default-bucket:zeb_modell}") String defaultBucket,
      @Value("${energy.unit:kilowattHours}") String unit,
      @Value("${energy.weekly-stop-rule:FIXED_JANUARY_7}") WeeklyStopRule weeklyStopRule) {
    this.client = client;
    this.defaultBucket = defaultBucket;
    this.unit = unit;
    this.calendar = new ResolutionCalendar(weeklyStopRule);
  }

  public String unit() {
    return unit;
  }

  public EnergySummaryDocument getCombinedSummary(String bucket, String measuredMeasurement,
      String modeledMeasurement, RequestedShape requested, int year, Resolution resolution) {
    String effectiveBucket = effectiveBucket(bucket);
    List<String> measurements = new ArrayList<>();
    measurements.add(measuredMeasurement);
    if (StringUtils.hasText(modeledMeasurement)) {
      measurements.add(modeledMeasurement);
    }
    requireYear(effectiveBucket, measurements, year);

    QueryWindow window = calendar.window(resolution, year);
    RawTable measuredRaw = client.query(FluxQueryBuilder.measured(effectiveBucket,
        measuredMeasurement, unit, requested.fields(), window));
    WideTable measured = fromStore(measuredMeasurement,
        () -> ConsumptionPipeline.processMeasured(measuredRaw, requested, resolution));

    WideTable modeled = null;
    if (requested.hasModels() && StringUtils.hasText(modeledMeasurement)) {
      RawTable modeledRaw = client.query(FluxQueryBuilder.modeled(effectiveBucket,
          modeledMeasurement, unit, requested.fields(), requested.models(), window));
      modeled = fromStore(modeledMeasurement,
          () -> ConsumptionPipeline.processModeled(modeledRaw, requested, resolution));
    }
    log.debug("Combined summary for {} {} {}: measured {}, modeled {}", measurements, year,
        resolution.code(), measured, modeled);

    return JsonAssembler.combined(measured, modeled, requested, measurements, unit, year);
  }

  public EnergySummaryDocument getMeasuredSummary(String bucket, String measurement,
      RequestedShape requested, int year, Resolution resolution) {
    String effectiveBucket = effectiveBucket(bucket);
    requireYear(effectiveBucket, List.of(measurement), year);

    RawTable raw = client.query(FluxQueryBuilder.measured(effectiveBucket, measurement, unit,
        requested.fields(), calendar.window(resolution, year)));
    WideTable measured = fromStore(measurement,
        () -> ConsumptionPipeline.processMeasured(raw, requested, resolution));
    log.debug("Measured summary for {} {} {}: {}", measurement, year, resolution.code(),
        measured);

    return JsonAssembler.measuredOnly(measured, requested, measurement, unit, year);
  }

  public EnergySummaryDocument getModeledSummary(String bucket, String measurement,
      RequestedShape requested, int year, Resolution resolution) {
    if (!requested.hasModels()) {
      throw new IllegalArgumentException("At least one model must be requested");
    }
    String effectiveBucket = effectiveBucket(bucket);
    requireYear(effectiveBucket, List.of(measurement), year);

    RawTable raw = client.query(FluxQueryBuilder.modeled(effectiveBucket, measurement, unit,
        requested.fields(), requested.models(), calendar.window(resolution, year)));
    WideTable modeled = fromStore(measurement,
        () -> ConsumptionPipeline.processModeled(raw, requested, resolution));
    log.debug("Modeled summary for {} {} {}: {}", measurement, year, resolution.code(),
        modeled);

    return JsonAssembler.modeledOnly(modeled, requested, measurement, unit, year);
  }

  public List<Integer> availableYears(String bucket, List<String> measurements) {
    RawTable raw = client.query(FluxQueryBuilder.availability(effectiveBucket(bucket),
        measurements, unit, ResolutionCalendar.availabilityWindow()));
    return fromStore(String.join(",", measurements),
        () -> YearExtractor.years(raw.groupBy(MEASUREMENT_COLUMN).values()));
  }

  private void requireYear(String bucket, List<String> measurements, int year) {
    List<Integer> years = availableYears(bucket, measurements);
    if (!years.contains(year)) {
      log.info("No complete data for {} in {}; available years {}", measurements, year, years);
      throw new NoSuchElementException("No data for this year.");
    }
  }

  // rows the pipeline cannot read are reported as a store failure
  private static <T> T fromStore(String measurement, Supplier<T> step) {
    try {
      return step.get();
    } catch (IllegalArgumentException ex) {
      throw new TimeSeriesStoreException(
          "Unreadable data for measurement " + measurement + ": " + ex.getMessage(), ex);
    }
  }

  private String effectiveBucket(String bucket) {
    return StringUtils.hasText(bucket) ? bucket : defaultBucket;
  }
}
