package org.waabox.relister;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CheckedNamespaces}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CheckedNamespacesTest {

  @Test
  void whenMarking_givenNewNamespace_shouldBeChecked() {
    final CheckedNamespaces checked = new CheckedNamespaces();

    assertFalse(checked.isChecked("ci"));
    assertTrue(checked.markChecked("ci"));
    assertTrue(checked.isChecked("ci"));
    assertFalse(checked.isChecked("prod"));
  }

  @Test
  void whenMarking_givenAlreadyChecked_shouldStayChecked() {
    final CheckedNamespaces checked = new CheckedNamespaces();
    checked.markChecked("ci");

    assertFalse(checked.markChecked("ci"));
    assertTrue(checked.isChecked("ci"));
    assertEquals(1, checked.size());
  }

  @Test
  void whenReadingNamespaces_shouldBeReadOnly() {
    final CheckedNamespaces checked = new CheckedNamespaces();
    checked.markChecked("ci");

    assertThrows(UnsupportedOperationException.class, () ->
        checked.namespaces().remove("ci"));
    assertTrue(checked.isChecked("ci"));
  }

  @Test
  void whenMarking_givenNull_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        new CheckedNamespaces().markChecked(null));
  }

  @Test
  void whenMarkingConcurrently_givenSameNamespace_shouldReportFirstOnly()
      throws Exception {
    final CheckedNamespaces checked = new CheckedNamespaces();
    final int threads = 8;
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    final CountDownLatch start = new CountDownLatch(1);
    final AtomicInteger firstMarks = new AtomicInteger();

    for (int i = 0; i < threads; i++) {
      executor.submit(() -> {
        start.await();
        if (checked.markChecked("shared")) {
          firstMarks.incrementAndGet();
        }
        return null;
      });
    }
    start.countDown();
    executor.shutdown();
    assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

    assertEquals(1, firstMarks.get());
    assertTrue(checked.isChecked("shared"));
  }
}
