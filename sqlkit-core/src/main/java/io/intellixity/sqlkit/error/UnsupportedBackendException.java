package io.intellixity.sqlkit.error;

/** Raised when a descriptor's scheme matches none of the supported backends. */
public final class UnsupportedBackendException extends SqlkitException {
  /** @param descriptor the offending descriptor, with any password already masked */
  public UnsupportedBackendException(String descriptor) {
    super("Unsupported database URL='" + descriptor + "'");
  }
}
