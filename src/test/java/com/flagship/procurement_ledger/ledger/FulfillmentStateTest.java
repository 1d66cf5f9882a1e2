package com.flagship.procurement_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FulfillmentStateTest {

    @Test
    @DisplayName("Empty status is pending, CANCELLED is cancelled, anything else is fulfilled")
    void testClassify() {
        assertEquals(FulfillmentState.PENDING, FulfillmentState.classify(""));
        assertEquals(FulfillmentState.PENDING, FulfillmentState.classify("   "));
        assertEquals(FulfillmentState.PENDING, FulfillmentState.classify(null));
        assertEquals(FulfillmentState.CANCELLED, FulfillmentState.classify("CANCELLED"));
        assertEquals(FulfillmentState.CANCELLED, FulfillmentState.classify(" CANCELLED "));
        assertEquals(FulfillmentState.CANCELLED, FulfillmentState.classify("STORNIERT"));
        assertEquals(FulfillmentState.FULFILLED, FulfillmentState.classify("ja"));
        assertEquals(FulfillmentState.FULFILLED, FulfillmentState.classify("2024-05-14"));
    }

    @Test
    @DisplayName("Only the exact cancelled markers count as cancelled")
    void testCancelledMarkerIsCaseSensitive() {
        assertEquals(FulfillmentState.FULFILLED, FulfillmentState.classify("cancelled"));
        assertEquals(FulfillmentState.FULFILLED, FulfillmentState.classify("Storniert"));
    }
}
