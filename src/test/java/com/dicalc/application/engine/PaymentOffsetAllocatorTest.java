package com.dicalc.application.engine;

import com.dicalc.domain.exception.ValidationException;
import com.dicalc.domain.model.AllocationResult;
import com.dicalc.domain.model.OutstandingBalance;
import com.dicalc.domain.model.PaymentOffsetPolicy;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PaymentOffsetAllocatorTest {

    private final PaymentOffsetAllocator allocator = new PaymentOffsetAllocator();

    @Test
    void generalDebt_paysInterestBeforePrincipal() {
        AllocationResult result = allocator.allocate(
                BigDecimal.ZERO, new BigDecimal("5000"), new BigDecimal("100000"),
                new BigDecimal("7000"), PaymentOffsetPolicy.GENERAL_DEBT);

        assertEquals(0, BigDecimal.ZERO.compareTo(result.getRemainingInterest()));
        assertEquals(0, new BigDecimal("98000").compareTo(result.getRemainingPrincipal()));
        assertEquals(0, new BigDecimal("5000").compareTo(result.getAppliedToInterest()));
        assertEquals(0, new BigDecimal("2000").compareTo(result.getAppliedToPrincipal()));
        assertFalse(result.hasUnappliedRemainder());
    }

    @Test
    void generalDebt_paysCostsFirst() {
        AllocationResult result = allocator.allocate(
                new BigDecimal("300"), new BigDecimal("500"), new BigDecimal("1000"),
                new BigDecimal("600"), PaymentOffsetPolicy.GENERAL_DEBT);

        assertEquals(0, BigDecimal.ZERO.compareTo(result.getRemainingCosts()));
        assertEquals(0, new BigDecimal("200").compareTo(result.getRemainingInterest()));
        assertEquals(0, new BigDecimal("1000").compareTo(result.getRemainingPrincipal()));
    }

    @Test
    void judgmentDebt_paysJudgmentInterestBeforeCosts() {
        AllocationResult result = allocator.allocate(
                new BigDecimal("1000"), new BigDecimal("1000"), new BigDecimal("10000"),
                new BigDecimal("10500"), PaymentOffsetPolicy.JUDGMENT_DEBT);

        assertEquals(0, BigDecimal.ZERO.compareTo(result.getRemainingPrincipal()));
        assertEquals(0, new BigDecimal("500").compareTo(result.getRemainingInterest()));
        assertEquals(0, new BigDecimal("1000").compareTo(result.getRemainingCosts()));
        assertEquals(0, new BigDecimal("500").compareTo(result.getAppliedToPriorInterest()));
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getAppliedToCosts()));
    }

    @Test
    void judgmentDebt_paysAccruedInterestLast() {
        OutstandingBalance outstanding = new OutstandingBalance(
                new BigDecimal("300"), new BigDecimal("200"), new BigDecimal("500"), new BigDecimal("1000"));

        AllocationResult result = allocator.allocate(outstanding, new BigDecimal("1600"), PaymentOffsetPolicy.JUDGMENT_DEBT);

        assertEquals(0, BigDecimal.ZERO.compareTo(result.getRemainingPrincipal()));
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getRemaining().getPriorInterest()));
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getRemainingCosts()));
        assertEquals(0, new BigDecimal("100").compareTo(result.getAppliedToAccruedInterest()));
        assertEquals(0, new BigDecimal("400").compareTo(result.getRemaining().getAccruedInterest()));
    }

    @Test
    void generalDebt_paysPriorInterestBeforeAccrued() {
        OutstandingBalance outstanding = new OutstandingBalance(
                BigDecimal.ZERO, new BigDecimal("200"), new BigDecimal("500"), new BigDecimal("1000"));

        AllocationResult result = allocator.allocate(outstanding, new BigDecimal("300"), PaymentOffsetPolicy.GENERAL_DEBT);

        assertEquals(0, new BigDecimal("200").compareTo(result.getAppliedToPriorInterest()));
        assertEquals(0, new BigDecimal("100").compareTo(result.getAppliedToAccruedInterest()));
        assertEquals(0, new BigDecimal("400").compareTo(result.getRemainingInterest()));
        assertEquals(0, new BigDecimal("1000").compareTo(result.getRemainingPrincipal()));
    }

    @Test
    void overpaymentIsReportedNotAllocated() {
        AllocationResult result = allocator.allocate(
                new BigDecimal("10"), new BigDecimal("20"), new BigDecimal("30"),
                new BigDecimal("100"), PaymentOffsetPolicy.GENERAL_DEBT);

        assertEquals(0, BigDecimal.ZERO.compareTo(result.getRemainingCosts()));
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getRemainingInterest()));
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getRemainingPrincipal()));
        assertTrue(result.hasUnappliedRemainder());
        assertEquals(0, new BigDecimal("40").compareTo(result.getUnappliedRemainder()));
    }

    @Test
    void bucketsAreNeverTakenBelowZero() {
        BigDecimal[] payments = {BigDecimal.ONE, new BigDecimal("250.5"), new BigDecimal("5000"), new BigDecimal("1000000")};
        for (PaymentOffsetPolicy policy : PaymentOffsetPolicy.values()) {
            for (BigDecimal payment : payments) {
                AllocationResult result = allocator.allocate(
                        new BigDecimal("100"), new BigDecimal("200"), new BigDecimal("3000"), payment, policy);
                assertTrue(result.getRemainingCosts().signum() >= 0);
                assertTrue(result.getRemainingInterest().signum() >= 0);
                assertTrue(result.getRemainingPrincipal().signum() >= 0);
                BigDecimal applied = result.getAppliedToCosts()
                        .add(result.getAppliedToInterest())
                        .add(result.getAppliedToPrincipal())
                        .add(result.getUnappliedRemainder());
                assertEquals(0, payment.compareTo(applied), "payment must be fully accounted for");
            }
        }
    }

    @Test
    void negativeAmountsAreRejected() {
        assertThrows(ValidationException.class, () -> allocator.allocate(
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.TEN, new BigDecimal("-1"), PaymentOffsetPolicy.GENERAL_DEBT));
        assertThrows(ValidationException.class, () -> allocator.allocate(
                new BigDecimal("-5"), BigDecimal.ZERO, BigDecimal.TEN, BigDecimal.ONE, PaymentOffsetPolicy.GENERAL_DEBT));
    }
}
