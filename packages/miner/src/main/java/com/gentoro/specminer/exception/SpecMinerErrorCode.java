package com.gentoro.specminer.exception;

/**
 * Stable error codes for the miner. Codes are suitable for logs and for mapping to process exit
 * statuses; prefer the most specific code that reflects where the failure originated.
 */
public enum SpecMinerErrorCode {
  CANCELLED,

  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  EMPTY_CORPUS,
}
