package org.waabox.relister;

import java.util.Objects;

/**
 * Identifies a namespaced resource by namespace and name.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ResourceKey {

  /** The namespace of the resource. */
  private final String namespace;

  /** The name of the resource. */
  private final String name;

  /** Private constructor; use {@link #of(String, String)}. */
  private ResourceKey(final String theNamespace, final String theName) {
    namespace = theNamespace;
    name = theName;
  }

  /**
   * Creates a new key.
   *
   * @param namespace the namespace, never null
   * @param name      the resource name, never null
   *
   * @return the key, never null
   */
  public static ResourceKey of(final String namespace, final String name) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(name, "name must not be null");
    return new ResourceKey(namespace, name);
  }

  /**
   * Returns the namespace.
   *
   * @return the namespace, never null
   */
  public String namespace() {
    return namespace;
  }

  /**
   * Returns the resource name.
   *
   * @return the name, never null
   */
  public String name() {
    return name;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ResourceKey)) {
      return false;
    }
    final ResourceKey other = (ResourceKey) o;
    return namespace.equals(other.namespace) && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(namespace, name);
  }

  @Override
  public String toString() {
    return namespace + "/" + name;
  }
}
