package com.flagship.fund_quarantine.quarantine;

import com.flagship.fund_quarantine.agreement.ServiceAgreementRepository;
import com.flagship.fund_quarantine.budget.BudgetLineEntity;
import com.flagship.fund_quarantine.budget.BudgetLineRepository;
import com.flagship.fund_quarantine.budget.FundingPeriodRepository;
import com.flagship.fund_quarantine.capacity.CapacityChecker;
import com.flagship.fund_quarantine.quarantine.exception.DuplicateQuarantineException;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Ledger write rules with the repositories mocked out: which reservations
 * count as duplicates and how database constraint violations surface.
 */
class QuarantineLedgerTest {

    private QuarantineRepository quarantineRepository;
    private CapacityChecker capacityChecker;
    private QuarantineLedger ledger;

    private final UUID budgetLineId = UUID.randomUUID();
    private final UUID providerId = UUID.randomUUID();

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
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

    @BeforeEach
    void setUp() {
        quarantineRepository = mock(QuarantineRepository.class);
        BudgetLineRepository budgetLineRepository = mock(BudgetLineRepository.class);
        capacityChecker = mock(CapacityChecker.class);
        ledger = new QuarantineLedger(quarantineRepository, budgetLineRepository,
                mock(FundingPeriodRepository.class), mock(ServiceAgreementRepository.class), capacityChecker);

        when(budgetLineRepository.findByIdForUpdate(budgetLineId)).thenReturn(Optional.of(mock(BudgetLineEntity.class)));
        when(quarantineRepository.saveAndFlush(any(QuarantineEntity.class)))
            .thenAnswer(invocation -> invocation.getArgument(0));
    }

    private NewQuarantine request(String supportItemCode) {
        return NewQuarantine.builder()
            .budgetLineId(budgetLineId)
            .providerId(providerId)
            .quarantinedCents(100)
            .supportItemCode(supportItemCode)
            .actorId("planner-1")
            .build();
    }

    private static DataIntegrityViolationException violation(String constraintName) {
        SQLException sql = new SQLException(
            "ERROR: duplicate key value violates unique constraint \"" + constraintName + "\"", "23505");
        return new DataIntegrityViolationException("could not execute statement",
            new ConstraintViolationException("could not execute statement", sql, constraintName));
    }

    @Nested
    @DisplayName("Duplicate reservations")
    class DuplicateTests {

        @Test
        @DisplayName("A code-less reservation is inserted even when the provider already holds one on the line")
        void testNullCodeIsNotADuplicate() {
            printTestHeader("Code-less Reservation");

            Quarantine inserted = ledger.insert(request(null), null);
            printOutput("Inserted", inserted);

            assertEquals(QuarantineStatus.ACTIVE, inserted.getStatus());
            assertNull(inserted.getSupportItemCode());
            verify(capacityChecker).ensureCapacity(budgetLineId, 100, null);
            verify(quarantineRepository, never()).existsByBudgetLineIdAndProviderIdAndSupportItemCodeAndStatus(
                any(), any(), any(), any());
            printSuccess("No duplicate lookup for a reservation without a support item code");
        }

        @Test
        @DisplayName("A coded reservation matching an ACTIVE one is rejected before the capacity check")
        void testCodedDuplicateRejected() {
            when(quarantineRepository.existsByBudgetLineIdAndProviderIdAndSupportItemCodeAndStatus(
                budgetLineId, providerId, "01_011", QuarantineStatus.ACTIVE)).thenReturn(true);

            DuplicateQuarantineException e = assertThrows(DuplicateQuarantineException.class,
                () -> ledger.insert(request("01_011"), null));
            printExpectedException("DuplicateQuarantineException", e.getMessage());

            assertEquals(DuplicateQuarantineException.CODE, e.getCode());
            verify(capacityChecker, never()).ensureCapacity(any(), anyLong(), any());
            verify(quarantineRepository, never()).saveAndFlush(any());
        }
    }

    @Nested
    @DisplayName("Constraint violations")
    class ConstraintViolationTests {

        @Test
        @DisplayName("Losing the insert race on the active reservation index is a duplicate")
        void testActiveReservationIndexIsDuplicate() {
            printTestHeader("Active Reservation Index Violation");
            when(quarantineRepository.saveAndFlush(any(QuarantineEntity.class)))
                .thenThrow(violation(QuarantineLedger.ACTIVE_RESERVATION_INDEX));

            DuplicateQuarantineException e = assertThrows(DuplicateQuarantineException.class,
                () -> ledger.insert(request("01_011"), null));
            printExpectedException("DuplicateQuarantineException", e.getMessage());

            assertTrue(e.getMessage().contains("01_011"));
        }

        @Test
        @DisplayName("Any other integrity violation is rethrown unchanged")
        void testOtherViolationPropagates() {
            printTestHeader("Other Integrity Violation");
            DataIntegrityViolationException keyReuse = violation("fq_quarantines_idempotency_key_key");
            when(quarantineRepository.saveAndFlush(any(QuarantineEntity.class))).thenThrow(keyReuse);

            DataIntegrityViolationException e = assertThrows(DataIntegrityViolationException.class,
                () -> ledger.insert(request("01_011"), "key-1"));
            printExpectedException("DataIntegrityViolationException", e.getMostSpecificCause().getMessage());

            assertSame(keyReuse, e);
        }

        @Test
        @DisplayName("The index is recognised from the driver message when no constraint name was extracted")
        void testIndexRecognisedFromMessage() {
            SQLException sql = new SQLException(
                "ERROR: duplicate key value violates unique constraint \"uq_fq_quarantines_active_reservation\"",
                "23505");
            DataIntegrityViolationException e = new DataIntegrityViolationException("could not execute statement", sql);

            assertTrue(QuarantineLedger.violatesActiveReservationIndex(e));
            assertFalse(QuarantineLedger.violatesActiveReservationIndex(
                new DataIntegrityViolationException("violates check constraint \"chk_fq_used_within_ceiling\"")));
        }
    }
}
