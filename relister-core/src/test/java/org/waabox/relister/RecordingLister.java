package org.waabox.relister;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A {@link RefreshLister} that answers from canned responses and records
 * every call, used by the tests of this package.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RecordingLister
    implements RefreshLister<RecordingLister.Run, RecordingLister.RunList> {

  /** A run resource; a null start time means an empty status. */
  record Run(String namespace, String name, Instant startTime) {

    static Run withoutStatus(final String namespace, final String name) {
      return new Run(namespace, name, null);
    }

    static Run withStatus(final String namespace, final String name) {
      return new Run(namespace, name, Instant.parse("2024-05-01T10:00:00Z"));
    }
  }

  /** A list of runs with its resource version. */
  record RunList(String resourceVersion, List<Run> items) {}

  /** The responses of successive list calls; the last one repeats. */
  private final List<Object> listResponses = new ArrayList<>();

  /** The responses of successive get calls; the last one repeats. */
  private final List<Object> getResponses = new ArrayList<>();

  /** The failure thrown by keyOf, may be null. */
  private RelisterException keyFailure;

  /** The options received by each list call. */
  private final List<ListOptions> listOptions = new ArrayList<>();

  /** The names received by each get call. */
  private final List<String> gets = new ArrayList<>();

  /** Adds a list response. */
  RecordingLister onList(final RunList response) {
    listResponses.add(response);
    return this;
  }

  /** Adds a failing list response. */
  RecordingLister onListFail(final RelisterException failure) {
    listResponses.add(failure);
    return this;
  }

  /** Adds a get response. */
  RecordingLister onGet(final Run response) {
    getResponses.add(response);
    return this;
  }

  /** Adds a failing get response. */
  RecordingLister onGetFail(final RelisterException failure) {
    getResponses.add(failure);
    return this;
  }

  /** Makes every keyOf call fail. */
  RecordingLister onKeyOfFail(final RelisterException failure) {
    keyFailure = failure;
    return this;
  }

  int listCount() {
    return listOptions.size();
  }

  int getCount() {
    return gets.size();
  }

  List<ListOptions> listOptions() {
    return Collections.unmodifiableList(listOptions);
  }

  List<String> gets() {
    return Collections.unmodifiableList(gets);
  }

  @Override
  public RunList list(final String namespace, final ListOptions options) {
    listOptions.add(options);
    return (RunList) answer(listResponses, listOptions.size());
  }

  @Override
  public Run get(final String namespace, final String name) {
    gets.add(name);
    if (getResponses.isEmpty()) {
      return Run.withoutStatus(namespace, name);
    }
    return (Run) answer(getResponses, gets.size());
  }

  @Override
  public List<Run> items(final RunList list) {
    if (list == null) {
      return List.of();
    }
    return list.items();
  }

  @Override
  public boolean statusIsEmpty(final Run item) {
    return item == null || item.startTime() == null;
  }

  @Override
  public ResourceKey keyOf(final Run item) {
    if (keyFailure != null) {
      throw keyFailure;
    }
    return ResourceKey.of(item.namespace(), item.name());
  }

  @Override
  public String kind() {
    return "test.dev/v1, Kind=Run";
  }

  /** Returns the response for the given 1-based call, or throws it. */
  private static Object answer(final List<Object> responses, final int call) {
    final Object response =
        responses.get(Math.min(call, responses.size()) - 1);
    if (response instanceof RelisterException) {
      throw (RelisterException) response;
    }
    return response;
  }
}
