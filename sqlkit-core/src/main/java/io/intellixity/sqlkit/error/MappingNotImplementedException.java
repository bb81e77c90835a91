package io.intellixity.sqlkit.error;

/**
 * Raised when a record type opted into message mapping but left a required method unimplemented.
 * This is a programming error and is never caught by the library.
 */
public final class MappingNotImplementedException extends UnsupportedOperationException {
  public MappingNotImplementedException(Class<?> owner, String method) {
    super(owner.getSimpleName() + "." + method + "() not implemented");
  }
}
