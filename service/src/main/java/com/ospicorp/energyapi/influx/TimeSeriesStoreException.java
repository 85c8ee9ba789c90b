package com.ospicorp.energyapi.influx;

public class TimeSeriesStoreException extends RuntimeException {

  public TimeSeriesStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
