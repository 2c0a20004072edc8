package com.tradeintel.intelligence.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeintel.common.exception.InvalidOutcomeException;
import com.tradeintel.common.intelligence.CatalystClassifier;
import com.tradeintel.common.model.OutcomeResolution;
import com.tradeintel.common.model.TradeDirection;
import com.tradeintel.common.model.TradeOutcome;
import com.tradeintel.intelligence.config.LedgerSettings;
import com.tradeintel.intelligence.dto.RecordOutcomeRequest;
import com.tradeintel.intelligence.model.TradeOutcomeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Converts between ledger rows, API requests and the {@link TradeOutcome} domain record.
 *
 * <p>Reading is lenient: an unparseable signal list only drops the row from signal weighting,
 * and a missing resolution is derived from the return, as is one recorded only as a closing status
 * such as {@code expired} or {@code manual_exit}. Writing is strict: unknown direction or
 * resolution values are rejected.
 */
@Component
public class OutcomeMapper {

    private static final Logger log = LoggerFactory.getLogger(OutcomeMapper.class);

    private static final TypeReference<List<String>> SIGNAL_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final LedgerSettings settings;

    public OutcomeMapper(ObjectMapper objectMapper, LedgerSettings settings) {
        this.objectMapper = objectMapper;
        this.settings     = settings;
    }

    public TradeOutcome toDomain(TradeOutcomeRecord r) {
        OutcomeResolution resolution = OutcomeResolution.fromString(r.getResolution());
        if (resolution == null && (r.getResolution() == null || r.getResolution().isBlank())) {
            resolution = r.getReturnPercent() == null
                ? OutcomeResolution.OPEN
                : OutcomeResolution.classify(r.getReturnPercent(), settings.breakevenBand());
        } else if (resolution == null && OutcomeResolution.isDerivedFromReturn(r.getResolution())
                   && r.getReturnPercent() != null) {
            resolution = OutcomeResolution.classify(r.getReturnPercent(), settings.breakevenBand());
        }
        return new TradeOutcome(
            r.getId(),
            r.getSymbol() == null ? null : r.getSymbol().trim().toUpperCase(Locale.ROOT),
            blankToNull(r.getEngine()),
            blankToNull(r.getAssetType()),
            TradeDirection.fromString(r.getDirection()),
            parseSignals(r),
            r.getConfidenceScore(),
            catalystOf(r.getCatalystType(), r.getCatalystText()),
            r.getReturnPercent(),
            r.getRealizedPnl(),
            resolution,
            r.getOpenedAt(),
            r.getClosedAt());
    }

    public TradeOutcome fromRequest(RecordOutcomeRequest req) {
        TradeDirection direction = TradeDirection.fromString(req.direction());
        if (direction == null && req.direction() != null && !req.direction().isBlank()) {
            throw new InvalidOutcomeException("unknown direction: " + req.direction());
        }
        OutcomeResolution resolution = OutcomeResolution.fromString(req.resolution());
        if (resolution == null && OutcomeResolution.isDerivedFromReturn(req.resolution())) {
            if (req.returnPercent() == null) {
                throw new InvalidOutcomeException("resolution " + req.resolution() + " requires a realized return");
            }
        } else if (resolution == null && req.resolution() != null && !req.resolution().isBlank()) {
            throw new InvalidOutcomeException("unknown resolution: " + req.resolution());
        }
        if (resolution == null) {
            resolution = req.returnPercent() == null
                ? OutcomeResolution.OPEN
                : OutcomeResolution.classify(req.returnPercent(), settings.breakevenBand());
        }
        Instant closedAt = req.closedAt();
        if (closedAt == null && resolution.isClosed()) {
            closedAt = Instant.now();
        }
        return new TradeOutcome(
            null,
            req.symbol() == null ? null : req.symbol().trim().toUpperCase(Locale.ROOT),
            blankToNull(req.engine()),
            blankToNull(req.assetType()),
            direction,
            req.signals(),
            req.confidenceScore(),
            catalystOf(req.catalystType(), req.catalyst()),
            req.returnPercent(),
            req.realizedPnl(),
            resolution,
            req.openedAt(),
            closedAt);
    }

    public TradeOutcomeRecord toEntity(TradeOutcome o, String catalystText) throws JsonProcessingException {
        TradeOutcomeRecord entity = new TradeOutcomeRecord();
        entity.setSymbol(o.symbol());
        entity.setEngine(o.engine());
        entity.setAssetType(o.assetType());
        entity.setDirection(o.direction() != null ? o.direction().name() : null);
        entity.setSignals(objectMapper.writeValueAsString(o.signals()));
        entity.setConfidenceScore(o.confidenceScore());
        entity.setCatalystType(o.catalystType());
        entity.setCatalystText(blankToNull(catalystText));
        entity.setReturnPercent(o.returnPercent());
        entity.setRealizedPnl(o.realizedPnl());
        entity.setResolution(o.resolution().name());
        entity.setOpenedAt(o.openedAt());
        entity.setClosedAt(o.closedAt());
        entity.setRecordedAt(Instant.now());
        return entity;
    }

    private List<String> parseSignals(TradeOutcomeRecord r) {
        if (r.getSignals() == null || r.getSignals().isBlank()) return List.of();
        try {
            return objectMapper.readValue(r.getSignals(), SIGNAL_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable signals on ledger row; row excluded from signal weighting. id={} symbol={}",
                     r.getId(), r.getSymbol());
            return List.of();
        }
    }

    private static String catalystOf(String catalystType, String catalystText) {
        String normalized = CatalystClassifier.normalize(catalystType);
        return normalized != null ? normalized : CatalystClassifier.classify(catalystText);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
