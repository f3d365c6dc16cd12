package io.github.suppierk.allocation.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BatchTest {
  static final LocalDate TODAY = LocalDate.of(2024, 5, 1);

  @Nested
  class Create {
    @Test
    void when_reference_is_blank_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> new Batch(" ", "LAMP", 10, null));
    }

    @Test
    void when_quantity_is_negative_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> new Batch("b1", "LAMP", -1, null));
    }

    @Test
    void when_batch_is_new_everything_is_available() {
      final var batch = new Batch("b1", "LAMP", 20, null);

      assertEquals(0, batch.allocatedQuantity());
      assertEquals(20, batch.availableQuantity());
      assertTrue(batch.getAllocations().isEmpty());
    }
  }

  @Nested
  class Allocate {
    @Test
    void when_line_is_allocated_available_quantity_is_reduced() {
      final var batch = new Batch("b1", "SMALL-TABLE", 20, null);

      assertTrue(batch.allocate(new OrderLine("o1", "SMALL-TABLE", 2)));
      assertEquals(18, batch.availableQuantity());
    }

    @Test
    void when_line_is_bigger_than_available_it_is_not_allocated() {
      final var batch = new Batch("b1", "ELEGANT-LAMP", 2, null);
      final var line = new OrderLine("o1", "ELEGANT-LAMP", 20);

      assertFalse(batch.canAllocate(line));
      assertFalse(batch.allocate(line));
      assertEquals(2, batch.availableQuantity());
    }

    @Test
    void when_line_is_equal_to_available_it_is_allocated() {
      final var batch = new Batch("b1", "ELEGANT-LAMP", 2, null);

      assertTrue(batch.allocate(new OrderLine("o1", "ELEGANT-LAMP", 2)));
      assertEquals(0, batch.availableQuantity());
    }

    @Test
    void when_skus_do_not_match_line_is_not_allocated() {
      final var batch = new Batch("b1", "UNCOMFORTABLE-CHAIR", 100, null);

      assertFalse(batch.canAllocate(new OrderLine("o1", "EXPENSIVE-TOASTER", 10)));
    }

    @Test
    void when_same_line_is_allocated_twice_it_is_counted_once() {
      final var batch = new Batch("b1", "ANGULAR-DESK", 20, null);
      final var line = new OrderLine("o1", "ANGULAR-DESK", 2);

      assertTrue(batch.allocate(line));
      assertTrue(batch.allocate(line));
      assertEquals(18, batch.availableQuantity());
    }
  }

  @Nested
  class Deallocate {
    @Test
    void when_order_is_allocated_it_is_released() {
      final var batch = new Batch("b1", "DECORATIVE-TRINKET", 20, null);
      final var line = new OrderLine("o1", "DECORATIVE-TRINKET", 2);
      batch.allocate(line);

      assertEquals(line, batch.deallocate("o1").orElseThrow());
      assertEquals(20, batch.availableQuantity());
    }

    @Test
    void when_order_is_not_allocated_nothing_happens() {
      final var batch = new Batch("b1", "DECORATIVE-TRINKET", 20, null);

      assertTrue(batch.deallocate("o1").isEmpty());
      assertEquals(20, batch.availableQuantity());
    }

    @Test
    void when_releasing_one_line_the_newest_goes_first() {
      final var batch = new Batch("b1", "DECORATIVE-TRINKET", 20, null);
      batch.allocate(new OrderLine("o1", "DECORATIVE-TRINKET", 2));
      batch.allocate(new OrderLine("o2", "DECORATIVE-TRINKET", 3));

      assertEquals("o2", batch.deallocateOne().orderId());
      assertEquals("o1", batch.deallocateOne().orderId());
      assertThrows(IllegalStateException.class, batch::deallocateOne);
    }
  }

  @Test
  void preference_order_puts_warehouse_stock_first_and_then_earliest_shipments() {
    final var warehouse = new Batch("in-stock", "CLOCK", 100, null);
    final var tomorrow = new Batch("tomorrow", "CLOCK", 100, TODAY.plusDays(1));
    final var later = new Batch("later", "CLOCK", 100, TODAY.plusDays(10));

    final List<Batch> batches = new ArrayList<>(List.of(later, tomorrow, warehouse));
    batches.sort(Batch.PREFERENCE_ORDER);

    assertEquals(List.of(warehouse, tomorrow, later), batches);
  }

  @Test
  void batches_with_same_reference_are_equal() {
    assertEquals(new Batch("b1", "CLOCK", 1, null), new Batch("b1", "CLOCK", 5, TODAY));
    assertNotEquals(new Batch("b1", "CLOCK", 1, null), new Batch("b2", "CLOCK", 1, null));
  }
}
