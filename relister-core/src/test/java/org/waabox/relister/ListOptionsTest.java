package org.waabox.relister;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ListOptions}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ListOptionsTest {

  @Test
  void whenClearingResourceVersion_shouldKeepEverythingElse() {
    final ListOptions options = ListOptions.builder()
        .resourceVersion("1234")
        .labelSelector("tekton.dev/pipeline=build")
        .fieldSelector("metadata.name!=skip")
        .limit(500)
        .continueToken("abc")
        .timeoutSeconds(30)
        .build();

    final ListOptions cleared = options.withoutResourceVersion();

    assertNull(cleared.resourceVersion());
    assertEquals("tekton.dev/pipeline=build", cleared.labelSelector());
    assertEquals("metadata.name!=skip", cleared.fieldSelector());
    assertEquals(Integer.valueOf(500), cleared.limit());
    assertEquals("abc", cleared.continueToken());
    assertEquals(Integer.valueOf(30), cleared.timeoutSeconds());
    assertEquals("1234", options.resourceVersion());
    assertNotEquals(options, cleared);
  }

  @Test
  void whenComparing_givenSameValues_shouldBeEqual() {
    final ListOptions a = ListOptions.builder().resourceVersion("1").build();
    final ListOptions b = ListOptions.builder().resourceVersion("1").build();

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertEquals(ListOptions.none(), a.withoutResourceVersion());
  }

  @Test
  void whenBuilding_givenNonPositiveLimit_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        ListOptions.builder().limit(0));
  }
}
