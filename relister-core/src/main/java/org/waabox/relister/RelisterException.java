package org.waabox.relister;

/**
 * Base exception for failures reading resources through a
 * {@link RefreshLister}.
 *
 * <p>This is an unchecked exception. Adapters wrap transport failures in it,
 * keeping the HTTP status code when the transport reports one.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class RelisterException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Marker for failures that did not come with an HTTP status code. */
  public static final int NO_STATUS_CODE = -1;

  /** The HTTP status code reported by the transport, or -1. */
  private final int statusCode;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public RelisterException(final String message) {
    this(message, NO_STATUS_CODE, null);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public RelisterException(final String message, final Throwable cause) {
    this(message, NO_STATUS_CODE, cause);
  }

  /** Creates a new exception with the given message, status code and cause.
   *
   * @param message the detail message, cannot be null.
   * @param theStatusCode the HTTP status code, or {@link #NO_STATUS_CODE}.
   * @param cause the underlying cause, may be null.
   */
  public RelisterException(final String message, final int theStatusCode,
      final Throwable cause) {
    super(message, cause);
    statusCode = theStatusCode;
  }

  /** Returns the HTTP status code reported by the transport.
   *
   * @return the status code, or {@link #NO_STATUS_CODE} if none.
   */
  public int statusCode() {
    return statusCode;
  }
}
