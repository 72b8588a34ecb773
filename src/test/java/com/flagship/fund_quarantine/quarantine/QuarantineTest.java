package com.flagship.fund_quarantine.quarantine;

import com.flagship.fund_quarantine.quarantine.exception.DrawDownExceedsQuarantineException;
import com.flagship.fund_quarantine.quarantine.exception.QuarantineNotActiveException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class QuarantineTest {

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    private static Quarantine active(long quarantinedCents) {
        return Quarantine.create(UUID.randomUUID(), NewQuarantine.builder()
            .budgetLineId(UUID.randomUUID())
            .providerId(UUID.randomUUID())
            .quarantinedCents(quarantinedCents)
            .supportItemCode("01_011_0107_1_1")
            .notes("initial")
            .actorId("user-1")
            .build());
    }

    @Test
    @DisplayName("New quarantine is ACTIVE with nothing used")
    void testCreate() {
        printTestHeader("Create Quarantine");

        Quarantine quarantine = active(10_000);
        printOutput("Status", quarantine.getStatus());

        assertEquals(QuarantineStatus.ACTIVE, quarantine.getStatus());
        assertEquals(0, quarantine.getUsedCents());
        assertEquals(10_000, quarantine.remainingCents());
        assertEquals("user-1", quarantine.getCreatedById());
        printSuccess("Quarantine starts ACTIVE with full remaining amount");
    }

    @Test
    @DisplayName("Non-positive amount is rejected on create")
    void testCreateRejectsZero() {
        assertThrows(IllegalArgumentException.class, () -> active(0));
    }

    @Nested
    @DisplayName("Draw-down")
    class DrawDownTests {

        @Test
        @DisplayName("9000 then 1500 on 10000 fails; 9000 then 1000 uses it up")
        void testDrawDownCeiling() {
            printTestHeader("Draw-down Ceiling");

            Quarantine quarantine = active(10_000).drawDown(9_000);
            printInput("Used", quarantine.getUsedCents());

            DrawDownExceedsQuarantineException e = assertThrows(DrawDownExceedsQuarantineException.class,
                () -> quarantine.drawDown(1_500));
            printExpectedException("DrawDownExceedsQuarantineException", e.getMessage());
            assertEquals(1_500, e.getRequestedCents());
            assertEquals(1_000, e.getRemainingCents());

            Quarantine full = quarantine.drawDown(1_000);
            printOutput("Used", full.getUsedCents());
            assertEquals(10_000, full.getUsedCents());
            assertEquals(0, full.remainingCents());
            assertEquals(100, full.usedPercent());
            assertTrue(full.isActive());
            printSuccess("Used amount never exceeds the quarantined amount");
        }

        @Test
        @DisplayName("Non-positive draw-down is rejected")
        void testNonPositive() {
            Quarantine quarantine = active(10_000);
            assertThrows(IllegalArgumentException.class, () -> quarantine.drawDown(0));
            assertThrows(IllegalArgumentException.class, () -> quarantine.drawDown(-5));
        }

        @Test
        @DisplayName("Released quarantine cannot be drawn down")
        void testDrawDownAfterRelease() {
            Quarantine released = active(10_000).release();
            assertThrows(QuarantineNotActiveException.class, () -> released.drawDown(100));
        }
    }

    @Nested
    @DisplayName("Terminal states")
    class TerminalStateTests {

        @Test
        @DisplayName("Second release fails with NotActive")
        void testDoubleRelease() {
            printTestHeader("Double Release");

            Quarantine released = active(10_000).drawDown(2_500).release();
            printOutput("Status", released.getStatus());
            assertEquals(QuarantineStatus.RELEASED, released.getStatus());
            assertEquals(2_500, released.getUsedCents());

            QuarantineNotActiveException e = assertThrows(QuarantineNotActiveException.class, released::release);
            printExpectedException("QuarantineNotActiveException", e.getMessage());
            assertEquals(QuarantineStatus.RELEASED, e.getStatus());
            printSuccess("RELEASED is terminal");
        }

        @Test
        @DisplayName("Expired quarantine cannot be released or amended")
        void testExpiredIsTerminal() {
            Quarantine expired = active(10_000).expire();

            assertEquals(QuarantineStatus.EXPIRED, expired.getStatus());
            assertTrue(expired.getStatus().isTerminal());
            assertThrows(QuarantineNotActiveException.class, expired::release);
            assertThrows(QuarantineNotActiveException.class,
                () -> expired.amend(QuarantineAmendment.builder().quarantinedCents(5_000L).build()));
        }
    }

    @Nested
    @DisplayName("Amend")
    class AmendTests {

        @Test
        @DisplayName("Only supplied fields change; explicit null clears notes")
        void testPartialAmend() {
            printTestHeader("Partial Amend");

            Quarantine original = active(10_000);
            Quarantine amended = original.amend(QuarantineAmendment.builder()
                .notesSet(true)
                .notes(null)
                .build());

            printOutput("Notes", amended.getNotes());
            assertNull(amended.getNotes());
            assertEquals(original.getSupportItemCode(), amended.getSupportItemCode());
            assertEquals(10_000, amended.getQuarantinedCents());
            printSuccess("Absent fields untouched, present null cleared");
        }

        @Test
        @DisplayName("New amount below the used amount is rejected")
        void testAmendBelowUsed() {
            Quarantine drawn = active(10_000).drawDown(6_000);

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> drawn.amend(QuarantineAmendment.builder().quarantinedCents(5_999L).build()));
            printExpectedException("IllegalArgumentException", e.getMessage());

            Quarantine shrunk = drawn.amend(QuarantineAmendment.builder().quarantinedCents(6_000L).build());
            assertEquals(0, shrunk.remainingCents());
        }

        @Test
        @DisplayName("Amendment reports which fields it changes")
        void testAmendmentFlags() {
            QuarantineAmendment empty = QuarantineAmendment.builder().build();
            assertTrue(empty.isEmpty());

            QuarantineAmendment sameAmount = QuarantineAmendment.builder().quarantinedCents(10_000L).build();
            assertFalse(sameAmount.changesAmount(10_000));
            assertTrue(sameAmount.changesAmount(9_000));

            QuarantineAmendment clearCode = QuarantineAmendment.builder().supportItemCodeSet(true).build();
            assertTrue(clearCode.changesSupportItemCode("01_011_0107_1_1"));
            assertFalse(clearCode.changesSupportItemCode(null));
        }
    }

    @Test
    @DisplayName("Used percent rounds half-up")
    void testPercentRounding() {
        assertEquals(80, Quarantine.percentOf(7_950, 10_000));
        assertEquals(79, Quarantine.percentOf(7_949, 10_000));
        assertEquals(33, Quarantine.percentOf(1, 3));
        assertEquals(67, Quarantine.percentOf(2, 3));
        assertEquals(0, Quarantine.percentOf(0, 10_000));
    }
}
