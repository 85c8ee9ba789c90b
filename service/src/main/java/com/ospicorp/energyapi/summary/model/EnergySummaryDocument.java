package com.ospicorp.energyapi.summary.model;

import java.util.List;

public record EnergySummaryDocument(List<PeriodRecord> data, SummaryMetadata metadata) {}
