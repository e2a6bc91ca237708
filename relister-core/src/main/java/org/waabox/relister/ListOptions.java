package org.waabox.relister;

import java.util.Objects;

/**
 * The read options for a namespaced list call.
 *
 * <p>The {@code resourceVersion} is the consistency token: when set, the
 * server may answer from its watch cache; when absent, the list is served
 * from the authoritative store. {@link #withoutResourceVersion()} is how the
 * orchestrator forces such a read.
 *
 * <p>Instances are created through {@link #builder()} or {@link #none()}.
 * This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ListOptions {

  /** The options with nothing set. */
  private static final ListOptions NONE = builder().build();

  /** The resource version token, null means read from the source. */
  private final String resourceVersion;

  /** The label selector, may be null. */
  private final String labelSelector;

  /** The field selector, may be null. */
  private final String fieldSelector;

  /** The page size, null means unlimited. */
  private final Integer limit;

  /** The continuation token of a paged list, may be null. */
  private final String continueToken;

  /** The server side timeout in seconds, may be null. */
  private final Integer timeoutSeconds;

  /** Creates the options from the given builder. */
  private ListOptions(final Builder builder) {
    resourceVersion = builder.resourceVersion;
    labelSelector = builder.labelSelector;
    fieldSelector = builder.fieldSelector;
    limit = builder.limit;
    continueToken = builder.continueToken;
    timeoutSeconds = builder.timeoutSeconds;
  }

  /**
   * Returns the options with nothing set.
   *
   * @return the empty options, never null
   */
  public static ListOptions none() {
    return NONE;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a copy of these options without the resource version, so the
   * list bypasses the watch cache.
   *
   * @return the new options, never null
   */
  public ListOptions withoutResourceVersion() {
    return toBuilder().resourceVersion(null).build();
  }

  /**
   * Returns a builder initialized with the values of these options.
   *
   * @return a new builder, never null
   */
  public Builder toBuilder() {
    return new Builder()
        .resourceVersion(resourceVersion)
        .labelSelector(labelSelector)
        .fieldSelector(fieldSelector)
        .limit(limit)
        .continueToken(continueToken)
        .timeoutSeconds(timeoutSeconds);
  }

  /** @return the resource version, may be null. */
  public String resourceVersion() {
    return resourceVersion;
  }

  /** @return the label selector, may be null. */
  public String labelSelector() {
    return labelSelector;
  }

  /** @return the field selector, may be null. */
  public String fieldSelector() {
    return fieldSelector;
  }

  /** @return the page size, may be null. */
  public Integer limit() {
    return limit;
  }

  /** @return the continuation token, may be null. */
  public String continueToken() {
    return continueToken;
  }

  /** @return the server side timeout in seconds, may be null. */
  public Integer timeoutSeconds() {
    return timeoutSeconds;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ListOptions)) {
      return false;
    }
    final ListOptions other = (ListOptions) o;
    return Objects.equals(resourceVersion, other.resourceVersion)
        && Objects.equals(labelSelector, other.labelSelector)
        && Objects.equals(fieldSelector, other.fieldSelector)
        && Objects.equals(limit, other.limit)
        && Objects.equals(continueToken, other.continueToken)
        && Objects.equals(timeoutSeconds, other.timeoutSeconds);
  }

  @Override
  public int hashCode() {
    return Objects.hash(resourceVersion, labelSelector, fieldSelector,
        limit, continueToken, timeoutSeconds);
  }

  @Override
  public String toString() {
    return "ListOptions{resourceVersion=" + resourceVersion
        + ", labelSelector=" + labelSelector
        + ", fieldSelector=" + fieldSelector
        + ", limit=" + limit
        + ", continue=" + continueToken
        + ", timeoutSeconds=" + timeoutSeconds + "}";
  }

  /** Fluent builder for {@link ListOptions}. */
  public static final class Builder {

    private String resourceVersion;
    private String labelSelector;
    private String fieldSelector;
    private Integer limit;
    private String continueToken;
    private Integer timeoutSeconds;

    /** Private constructor; use {@link ListOptions#builder()}. */
    private Builder() {
    }

    /**
     * Sets the resource version token.
     *
     * @param theResourceVersion the token, may be null
     * @return this builder, never null
     */
    public Builder resourceVersion(final String theResourceVersion) {
      resourceVersion = theResourceVersion;
      return this;
    }

    /**
     * Sets the label selector.
     *
     * @param theLabelSelector the selector, may be null
     * @return this builder, never null
     */
    public Builder labelSelector(final String theLabelSelector) {
      labelSelector = theLabelSelector;
      return this;
    }

    /**
     * Sets the field selector.
     *
     * @param theFieldSelector the selector, may be null
     * @return this builder, never null
     */
    public Builder fieldSelector(final String theFieldSelector) {
      fieldSelector = theFieldSelector;
      return this;
    }

    /**
     * Sets the page size.
     *
     * @param theLimit the maximum number of items, may be null
     * @return this builder, never null
     *
     * @throws IllegalArgumentException if the limit is not positive
     */
    public Builder limit(final Integer theLimit) {
      if (theLimit != null && theLimit <= 0) {
        throw new IllegalArgumentException(
            "limit must be greater than 0, got: " + theLimit);
      }
      limit = theLimit;
      return this;
    }

    /**
     * Sets the continuation token of a paged list.
     *
     * @param theContinueToken the token, may be null
     * @return this builder, never null
     */
    public Builder continueToken(final String theContinueToken) {
      continueToken = theContinueToken;
      return this;
    }

    /**
     * Sets the server side timeout.
     *
     * @param theTimeoutSeconds the timeout in seconds, may be null
     * @return this builder, never null
     */
    public Builder timeoutSeconds(final Integer theTimeoutSeconds) {
      timeoutSeconds = theTimeoutSeconds;
      return this;
    }

    /**
     * Builds the options.
     *
     * @return the options, never null
     */
    public ListOptions build() {
      return new ListOptions(this);
    }
  }
}
