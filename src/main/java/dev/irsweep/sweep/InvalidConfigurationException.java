package dev.irsweep.sweep;

/** Thrown when a configured scheme or similarity tag is not known. */
public class InvalidConfigurationException extends IllegalArgumentException {

  public InvalidConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
