package com.ospicorp.energyapi.summary.pipeline;

/**
 * Where a weekly query window for a year ends. Weeks do not align with the year boundary, so
 * neither rule is exact: the fixed rule may take in part of the following year's first week.
 */
public enum WeeklyStopRule {
  /** Stop at 7 January of the following year. */
  FIXED_JANUARY_7,
  /** Stop where every other resolution stops. */
  YEAR_BOUNDARY
}
