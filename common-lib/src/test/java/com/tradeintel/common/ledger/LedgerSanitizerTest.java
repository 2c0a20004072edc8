package com.tradeintel.common.ledger;

import com.tradeintel.common.exception.InvalidOutcomeException;
import com.tradeintel.common.model.OutcomeResolution;
import com.tradeintel.common.model.TradeOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tradeintel.common.TestOutcomes.BAND;
import static com.tradeintel.common.TestOutcomes.trade;
import static org.junit.jupiter.api.Assertions.*;

class LedgerSanitizerTest {

    @Test
    @DisplayName("resolution contradicting the return is rejected, the rest survive in order")
    void inconsistentResolution() {
        TradeOutcome good = trade("A").ret(2.0).build();
        TradeOutcome bad = trade("A").ret(-3.0).resolution(OutcomeResolution.WIN).build();
        TradeOutcome open = trade("A").open().build();

        SanitizedLedger ledger = LedgerSanitizer.sanitize(List.of(open, bad, good), BAND);

        assertEquals(List.of(good, open), ledger.outcomes());
        assertEquals(1, ledger.rejected().size());
        assertEquals(bad.id(), ledger.rejected().get(0).id());
        assertEquals(List.of(good), ledger.closed());
    }

    @Test
    @DisplayName("returns inside the breakeven band must be BREAKEVEN")
    void breakevenBand() {
        TradeOutcome tinyWin = trade("A").ret(0.05).resolution(OutcomeResolution.WIN).build();
        assertTrue(LedgerSanitizer.validate(tinyWin, BAND).isPresent());
        TradeOutcome flat = trade("A").ret(-0.1).build();
        assertEquals(OutcomeResolution.BREAKEVEN, flat.resolution());
        assertTrue(LedgerSanitizer.validate(flat, BAND).isEmpty());
    }

    @Test
    @DisplayName("closed row without a return is malformed")
    void missingReturn() {
        TradeOutcome noReturn = trade("A").resolution(OutcomeResolution.LOSS).build();
        assertTrue(LedgerSanitizer.validate(noReturn, BAND).isPresent());
    }

    @Test
    @DisplayName("out-of-range confidence keeps the row in the ledger")
    void outOfRangeConfidenceKept() {
        TradeOutcome badConfidence = trade("A").ret(1.0).confidence(150.0).build();
        TradeOutcome fine = trade("A").ret(-2.0).confidence(70.0).build();

        SanitizedLedger ledger = LedgerSanitizer.sanitize(List.of(badConfidence, fine), BAND);

        assertTrue(ledger.rejected().isEmpty());
        assertEquals(2, ledger.closed().size());
        assertFalse(badConfidence.hasUsableConfidence());
    }

    @Test
    @DisplayName("missing optional fields do not make a row malformed")
    void optionalFieldsTolerated() {
        TradeOutcome sparse = new TradeOutcome(1L, "A", null, null, null, null, null, null,
                                               1.0, null, OutcomeResolution.WIN, null, null);
        assertTrue(LedgerSanitizer.validate(sparse, BAND).isEmpty());
    }

    @Test
    @DisplayName("requireValid throws on write")
    void requireValidThrows() {
        TradeOutcome bad = trade(" ").ret(1.0).build();
        assertThrows(InvalidOutcomeException.class, () -> LedgerSanitizer.requireValid(bad, BAND));
    }

    @Test
    @DisplayName("requireValid rejects a confidence outside [0, 100] on write")
    void requireValidRejectsConfidence() {
        TradeOutcome high = trade("A").ret(1.0).confidence(150.0).build();
        TradeOutcome nan = trade("A").ret(1.0).confidence(Double.NaN).build();
        TradeOutcome edge = trade("A").ret(1.0).confidence(100.0).build();

        InvalidOutcomeException ex = assertThrows(InvalidOutcomeException.class,
            () -> LedgerSanitizer.requireValid(high, BAND));
        assertTrue(ex.getMessage().contains("outside [0, 100]"));
        assertThrows(InvalidOutcomeException.class, () -> LedgerSanitizer.requireValid(nan, BAND));
        assertDoesNotThrow(() -> LedgerSanitizer.requireValid(edge, BAND));
    }
}
