package org.waabox.relister;

/**
 * Thrown when a direct read finds no resource with the requested name.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ResourceNotFoundException extends RelisterException {

  private static final long serialVersionUID = 1L;

  /** The HTTP status code for a missing resource. */
  private static final int NOT_FOUND = 404;

  /** Creates a new exception for the given resource.
   *
   * @param kind the resource kind, never null.
   * @param key the namespace and name that were not found, never null.
   * @param cause the underlying cause, may be null.
   */
  public ResourceNotFoundException(final String kind, final ResourceKey key,
      final Throwable cause) {
    super(kind + " '" + key + "' not found", NOT_FOUND, cause);
  }
}
