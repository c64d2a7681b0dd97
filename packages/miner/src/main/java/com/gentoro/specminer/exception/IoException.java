package com.gentoro.specminer.exception;

/** Filesystem or classpath I/O failed outside the per-file isolation boundary. */
public class IoException extends SpecMinerException {
  public IoException(String message) {
    super(SpecMinerErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(SpecMinerErrorCode.IO_ERROR, message, cause);
  }
}
