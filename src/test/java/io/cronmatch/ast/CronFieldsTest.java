package io.cronmatch.ast;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class CronFieldsTest {

  private static CronFields allWildcards(boolean hasYear) {
    return new CronFields(Collections.nCopies(Field.COUNT, Wildcard.any()), hasYear);
  }

  @Test
  void requiresSixMatchers() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new CronFields(List.of(Wildcard.any(), Wildcard.any()), false));
  }

  @Test
  void withReplacesOneSlotAndLeavesOriginalUntouched() {
    CronFields original = allWildcards(false);
    CronFields updated = original.with(Field.HOUR, new Exact(9));

    assertEquals(new Exact(9), updated.get(Field.HOUR));
    assertEquals(Wildcard.any(), original.get(Field.HOUR));
    assertFalse(updated.hasYearField());
  }

  @Test
  void withYearSetsYearFlag() {
    CronFields updated = allWildcards(false).with(Field.YEAR, new Exact(2024));
    assertTrue(updated.hasYearField());
  }

  @Test
  void matchersAreImmutable() {
    CronFields fields = allWildcards(true);
    assertThrows(UnsupportedOperationException.class, () -> fields.matchers().set(0, new Exact(1)));
  }
}
