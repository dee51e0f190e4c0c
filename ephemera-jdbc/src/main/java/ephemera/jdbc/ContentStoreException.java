package ephemera.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the content repository and engagement
 * stores.
 */
public final class ContentStoreException extends RuntimeException {
  public ContentStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
