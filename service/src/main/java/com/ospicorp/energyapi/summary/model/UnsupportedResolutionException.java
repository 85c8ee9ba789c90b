package com.ospicorp.energyapi.summary.model;

public class UnsupportedResolutionException extends IllegalArgumentException {
  private final String resolution;

  public UnsupportedResolutionException(String resolution) {
    super("Unsupported resolution: " + resolution);
    this.resolution = resolution;
  }

  public String resolution() {
    return resolution;
  }
}
