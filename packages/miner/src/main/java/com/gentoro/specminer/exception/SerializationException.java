package com.gentoro.specminer.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends SpecMinerException {
  public SerializationException(String message) {
    super(SpecMinerErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(SpecMinerErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
