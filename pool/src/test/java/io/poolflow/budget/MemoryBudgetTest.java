package io.poolflow.budget;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MemoryBudgetTest {
    @Test
    void reserves_up_to_capacity_and_no_further() {
        MemoryBudget b = new MemoryBudget(1000);
        assertTrue(b.reserve(900));
        assertTrue(b.reserve(100));
        assertFalse(b.reserve(1));
        assertEquals(1000, b.allocated());
        assertEquals(0, b.available());
    }

    @Test
    void failed_reserve_changes_nothing() {
        MemoryBudget b = new MemoryBudget(1000);
        assertTrue(b.reserve(600));
        assertFalse(b.reserve(500));
        assertEquals(600, b.allocated());
        assertTrue(b.reserve(400));
    }

    @Test
    void release_returns_budget() {
        MemoryBudget b = new MemoryBudget(100);
        assertTrue(b.reserve(100));
        b.release(100);
        assertEquals(0, b.allocated());
        assertTrue(b.reserve(100));
    }

    @Test
    void release_below_zero_is_an_underflow() {
        MemoryBudget b = new MemoryBudget(100);
        assertTrue(b.reserve(40));
        AccountingUnderflowException e = assertThrows(AccountingUnderflowException.class, () -> b.release(41));
        assertEquals(40, e.allocated());
        assertEquals(41, e.requested());
        assertEquals(40, b.allocated());
    }

    @Test
    void huge_cost_does_not_overflow() {
        MemoryBudget b = new MemoryBudget(Long.MAX_VALUE - 1);
        assertTrue(b.reserve(10));
        assertFalse(b.reserve(Long.MAX_VALUE));
        assertEquals(10, b.allocated());
    }

    @Test
    void zero_cost_always_fits() {
        MemoryBudget b = new MemoryBudget(0);
        assertTrue(b.reserve(0));
        assertFalse(b.reserve(1));
    }

    @Test
    void negative_amounts_are_rejected() {
        MemoryBudget b = new MemoryBudget(100);
        assertThrows(IllegalArgumentException.class, () -> b.reserve(-1));
        assertThrows(IllegalArgumentException.class, () -> b.release(-1));
        assertThrows(IllegalArgumentException.class, () -> new MemoryBudget(-1));
    }
}
