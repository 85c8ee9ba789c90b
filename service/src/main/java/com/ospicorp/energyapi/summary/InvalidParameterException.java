package com.ospicorp.energyapi.summary;

/**
 * A request parameter the summary endpoints cannot work with. Carries a stable error code and a
 * link to its documentation for the client.
 */
public class InvalidParameterException extends RuntimeException {
  private final String parameter;
  private final int errorCode;
  private final String moreInfo;

  public InvalidParameterException(String parameter, String message, int errorCode,
      String moreInfo) {
    super(message);
    this.parameter = parameter;
    this.errorCode = errorCode;
    this.moreInfo = moreInfo;
  }

  public String parameter() {
    return parameter;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return moreInfo;
  }
}
