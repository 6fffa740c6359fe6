package org.waabox.changecast.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link WatchedTable}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class WatchedTableTest {

  @Test
  void whenLookingUp_givenMixedCaseName_shouldResolveTable() {
    assertEquals(WatchedTable.FEE_PAYMENTS,
        WatchedTable.fromTableName("Fee_Payments"));
    assertEquals(WatchedTable.STUDENTS, WatchedTable.fromTableName("students"));
  }

  @Test
  void whenLookingUp_givenUnwatchedName_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> WatchedTable.fromTableName("users"));
  }

  @Test
  void whenGettingEntityName_shouldBeSingular() {
    assertEquals("student", WatchedTable.STUDENTS.entityName());
    assertEquals("fee_payment", WatchedTable.FEE_PAYMENTS.entityName());
    assertEquals("attendance", WatchedTable.ATTENDANCE.entityName());
  }

  @Test
  void whenListing_shouldWatchTenTables() {
    assertEquals(10, WatchedTable.values().length);
  }
}
