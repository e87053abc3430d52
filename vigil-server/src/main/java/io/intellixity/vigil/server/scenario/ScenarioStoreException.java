package io.intellixity.vigil.server.scenario;

public class ScenarioStoreException extends RuntimeException {
  public ScenarioStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
