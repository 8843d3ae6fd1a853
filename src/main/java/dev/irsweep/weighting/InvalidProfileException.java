package dev.irsweep.weighting;

/** Thrown when a weight profile has a negative, non-finite or missing coefficient. */
public class InvalidProfileException extends IllegalArgumentException {

  public InvalidProfileException(String message) {
    super(message);
  }
}
