package com.gentoro.specminer.exception;

/** Configuration or startup parameter problem detected before the pipeline runs. */
public class ConfigException extends SpecMinerException {
  public ConfigException(String message) {
    super(SpecMinerErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(SpecMinerErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
