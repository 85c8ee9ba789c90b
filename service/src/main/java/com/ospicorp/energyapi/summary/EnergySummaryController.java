package com.ospicorp.energyapi.summary;

import com.ospicorp.energyapi.summary.model.ColumnKey;
import com.ospicorp.energyapi.summary.model.EnergySummaryDocument;
import com.ospicorp.energyapi.summary.model.RequestedShape;
import com.ospicorp.energyapi.summary.model.Resolution;
import com.ospicorp.energyapi.summary.model.UnsupportedResolutionException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.util.Arrays;
import java.util.List;
import org.springframework.http.ProblemDetail;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Validated
@Tag(name = "Energy summary")
public class EnergySummaryController {
  static final String MEASUREMENT_REGEX = "^[A-Za-z0-9_.:\\- ]{1,128}$";
  private static final String ERROR_DOCS_BASE = "https://docs.energy-summary-api.dev/errors/";

  private final EnergySummaryService svc;

  public EnergySummaryController(EnergySummaryService svc) {
    this.svc = svc;
  }

  @GetMapping("/energy-summary-data")
  @Operation(summary = "Measured and modeled consumption",
      description = "Per-period consumption for the requested fields, measured and modeled side by side.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Summary document",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = EnergySummaryDocument.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "No data for the year",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public EnergySummaryDocument summary(
      @RequestParam(required = false) @Parameter(description = "InfluxDB bucket") String bucket,
      @RequestParam(name = "measured_data_measurement") @Pattern(regexp = MEASUREMENT_REGEX)
          @Parameter(description = "Measurement holding measured data") String measuredMeasurement,
      @RequestParam(name = "modeled_data_measurement", required = false)
          @Pattern(regexp = MEASUREMENT_REGEX)
          @Parameter(description = "Measurement holding modeled data") String modeledMeasurement,
      @RequestParam @Parameter(description = "Comma separated fields", example = "Heating,Cooling") String fields,
      @RequestParam(required = false) @Parameter(description = "Comma separated models", example = "modelA,modelB") String models,
      @RequestParam @Parameter(description = "Calendar year", example = "2023") int year,
      @RequestParam(defaultValue = "monthly") @Parameter(description = "hourly, daily, weekly, monthly or yearly") String resolution) {

    Resolution res = parseResolution(resolution);
    List<String> modelNames = StringUtils.hasText(models) ? parseNames(models, "models") : List.of();
    if (!modelNames.isEmpty() && !StringUtils.hasText(modeledMeasurement)) {
      throw invalidParameter("modeled_data_measurement",
          "modeled_data_measurement is required when models are requested.", 1005);
    }
    RequestedShape requested = new RequestedShape(parseNames(fields, "fields"), modelNames);
    return svc.getCombinedSummary(bucket, measuredMeasurement, modeledMeasurement, requested,
        year, res);
  }

  @GetMapping("/energy-summary-measured-field-data")
  @Operation(summary = "Measured consumption",
      description = "Per-period measured consumption for the requested fields.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Summary document",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = EnergySummaryDocument.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "No data for the year",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public EnergySummaryDocument measured(
      @RequestParam(required = false) @Parameter(description = "InfluxDB bucket") String bucket,
      @RequestParam @Pattern(regexp = MEASUREMENT_REGEX)
          @Parameter(description = "Measurement holding measured data") String measurement,
      @RequestParam @Parameter(description = "Comma separated fields", example = "Heating,Cooling") String fields,
      @RequestParam @Parameter(description = "Calendar year", example = "2023") int year,
      @RequestParam(defaultValue = "monthly") @Parameter(description = "hourly, daily, weekly, monthly or yearly") String resolution) {

    Resolution res = parseResolution(resolution);
    RequestedShape requested = RequestedShape.of(parseNames(fields, "fields"));
    return svc.getMeasuredSummary(bucket, measurement, requested, year, res);
  }

  @GetMapping("/energy-summary-modeled-field-data")
  @Operation(summary = "Modeled consumption",
      description = "Per-period modeled consumption for the requested fields and models.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Summary document",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = EnergySummaryDocument.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "No data for the year",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public EnergySummaryDocument modeled(
      @RequestParam(required = false) @Parameter(description = "InfluxDB bucket") String bucket,
      @RequestParam @Pattern(regexp = MEASUREMENT_REGEX)
          @Parameter(description = "Measurement holding modeled data") String measurement,
      @RequestParam @Parameter(description = "Comma separated fields", example = "Heating,Cooling") String fields,
      @RequestParam @Parameter(description = "Comma separated models", example = "modelA,modelB") String models,
      @RequestParam @Parameter(description = "Calendar year", example = "2023") int year,
      @RequestParam(defaultValue = "monthly") @Parameter(description = "hourly, daily, weekly, monthly or yearly") String resolution) {

    Resolution res = parseResolution(resolution);
    RequestedShape requested = new RequestedShape(parseNames(fields, "fields"),
        parseNames(models, "models"));
    return svc.getModeledSummary(bucket, measurement, requested, year, res);
  }

  private static Resolution parseResolution(String value) {
    try {
      return Resolution.fromName(value);
    } catch (UnsupportedResolutionException ex) {
      throw invalidParameter("resolution",
          "Invalid resolution. Valid resolutions are: hourly, daily, weekly, monthly, yearly", 1001);
    }
  }

  private static List<String> parseNames(String value, String parameter) {
    List<String> names = Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .distinct()
        .toList();
    if (names.isEmpty()) {
      throw invalidParameter(parameter,
          "Invalid " + parameter + " parameter. List at least one name.",
          "fields".equals(parameter) ? 1002 : 1003);
    }
    for (String name : names) {
      if (!ColumnKey.isValidComponent(name)) {
        throw invalidParameter(parameter, "Invalid " + parameter + " parameter. Names may not contain '"
            + ColumnKey.DELIMITER + "'.", 1004);
      }
    }
    return names;
  }

  private static InvalidParameterException invalidParameter(String parameter, String message,
      int errorCode) {
    return new InvalidParameterException(parameter, message, errorCode,
        ERROR_DOCS_BASE + errorCode);
  }
}
