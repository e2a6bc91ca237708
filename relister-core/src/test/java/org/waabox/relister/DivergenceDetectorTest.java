package org.waabox.relister;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.waabox.relister.RecordingLister.Run;
import org.waabox.relister.RecordingLister.RunList;

/**
 * Tests for {@link DivergenceDetector}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DivergenceDetectorTest {

  private final Run noStatus = Run.withoutStatus("ns", "run-a");

  private final Run hasStatus = Run.withStatus("ns", "run-a");

  @Test
  void whenChecking_givenPopulatedStatus_shouldNotReadAgain() {
    @SuppressWarnings("unchecked")
    final RefreshLister<Run, RunList> lister =
        createMock(RefreshLister.class);
    expect(lister.statusIsEmpty(hasStatus)).andReturn(false);
    replay(lister);

    final RefreshDecision decision =
        new DivergenceDetector<>(lister).needsRefresh(hasStatus);

    assertFalse(decision.refreshNeeded());
    assertTrue(decision.failure().isEmpty());
    verify(lister);
  }

  @Test
  void whenChecking_givenSourceHasStatus_shouldNeedRefresh() {
    @SuppressWarnings("unchecked")
    final RefreshLister<Run, RunList> lister =
        createMock(RefreshLister.class);
    expect(lister.statusIsEmpty(noStatus)).andReturn(true);
    expect(lister.keyOf(noStatus)).andReturn(ResourceKey.of("ns", "run-a"));
    expect(lister.get("ns", "run-a")).andReturn(hasStatus);
    expect(lister.statusIsEmpty(hasStatus)).andReturn(false);
    replay(lister);

    final RefreshDecision decision =
        new DivergenceDetector<>(lister).needsRefresh(noStatus);

    assertTrue(decision.refreshNeeded());
    assertTrue(decision.failure().isEmpty());
    assertEquals(ResourceKey.of("ns", "run-a"), decision.key().orElseThrow());
    verify(lister);
  }

  @Test
  void whenChecking_givenSourceAlsoEmpty_shouldNotNeedRefresh() {
    final RecordingLister lister = new RecordingLister().onGet(noStatus);

    final RefreshDecision decision =
        new DivergenceDetector<>(lister).needsRefresh(noStatus);

    assertFalse(decision.refreshNeeded());
    assertTrue(lister.gets().contains("run-a"));
  }

  @Test
  void whenChecking_givenNotFound_shouldNeedRefreshWithFailure() {
    final ResourceNotFoundException notFound = new ResourceNotFoundException(
        "Run", ResourceKey.of("ns", "run-a"), null);
    final RecordingLister lister = new RecordingLister().onGetFail(notFound);

    final RefreshDecision decision =
        new DivergenceDetector<>(lister).needsRefresh(noStatus);

    assertTrue(decision.refreshNeeded());
    assertSame(notFound, decision.failure().orElseThrow());
  }

  @Test
  void whenChecking_givenServerError_shouldNeedRefreshWithFailure() {
    final RelisterException failure =
        new RelisterException("internal error", 500, null);
    final RecordingLister lister = new RecordingLister().onGetFail(failure);

    final RefreshDecision decision =
        new DivergenceDetector<>(lister).needsRefresh(noStatus);

    assertTrue(decision.refreshNeeded());
    assertSame(failure, decision.failure().orElseThrow());
  }

  @Test
  void whenChecking_givenNullItem_shouldNeedRefreshWithoutReading() {
    final RecordingLister lister = new RecordingLister();

    final RefreshDecision decision =
        new DivergenceDetector<>(lister).needsRefresh(null);

    assertTrue(decision.refreshNeeded());
    assertTrue(decision.failure().isPresent());
    assertTrue(lister.gets().isEmpty());
  }

  @Test
  void whenChecking_givenUnreadableKey_shouldNeedRefreshWithoutKey() {
    final RelisterException failure = new RelisterException("no metadata");
    final RecordingLister lister = new RecordingLister()
        .onKeyOfFail(failure);

    final RefreshDecision decision =
        new DivergenceDetector<>(lister).needsRefresh(noStatus);

    assertTrue(decision.refreshNeeded());
    assertSame(failure, decision.failure().orElseThrow());
    assertTrue(decision.key().isEmpty());
    assertTrue(lister.gets().isEmpty());
  }

  @Test
  void whenCheckingStatus_givenNullItem_shouldBeEmpty() {
    assertTrue(new RecordingLister().statusIsEmpty(null));
    assertTrue(new RecordingLister().items(null).isEmpty());
  }

  @Test
  void whenCreating_givenNullLister_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        new DivergenceDetector<Run, RunList>(null));
  }
}
