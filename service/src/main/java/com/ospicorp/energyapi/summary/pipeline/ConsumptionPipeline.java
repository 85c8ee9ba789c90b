package com.ospicorp.energyapi.summary.pipeline;

import com.ospicorp.energyapi.summary.model.KeyShape;
import com.ospicorp.energyapi.summary.model.Observation;
import com.ospicorp.energyapi.summary.model.RawTable;
import com.ospicorp.energyapi.summary.model.RequestedShape;
import com.ospicorp.energyapi.summary.model.Resolution;
import com.ospicorp.energyapi.summary.model.WideTable;
import java.util.List;

/**
 * Turns raw cumulative readings into synthesized per-period consumption tables.
 */
public final class ConsumptionPipeline {
  public static final String MEASURED_DEFAULT_CARRIER = "Electric";
  public static final String MODELED_DEFAULT_CARRIER = ShapeSynthesizer.UNKNOWN_CARRIER;

  private ConsumptionPipeline() {
  }

  public static WideTable processMeasured(RawTable raw, RequestedShape requested,
      Resolution resolution) {
    List<Observation> observations = RowNormalizer.normalize(raw, MEASURED_DEFAULT_CARRIER);
    WideTable cumulative = PeriodPivot.pivot(observations, resolution, KeyShape.FIELD_CARRIER);
    return ShapeSynthesizer.synthesizeMeasured(DeltaEngine.differences(cumulative), requested);
  }

  public static WideTable processModeled(RawTable raw, RequestedShape requested,
      Resolution resolution) {
    if (raw.isEmpty()) {
      return ShapeSynthesizer.emptyModeled(requested);
    }
    List<Observation> observations = RowNormalizer.normalize(raw, MODELED_DEFAULT_CARRIER);
    WideTable cumulative = PeriodPivot.pivot(observations, resolution,
        KeyShape.FIELD_CARRIER_MODEL);
    return ShapeSynthesizer.synthesizeModeled(DeltaEngine.differences(cumulative), requested);
  }
}
