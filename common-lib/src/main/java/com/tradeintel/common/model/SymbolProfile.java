package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Historical summary of one symbol. Every statistic is {@code null} when the symbol has no
 * closed trades, so callers can render "no data" instead of a misleading 0%.
 *
 * <p>{@code actualVsPredicted} is the realized win rate as a percentage of the average
 * confidence the symbol's ideas were issued with (100 = confidence matched reality).
 */
public record SymbolProfile(
    @JsonProperty("symbol")               String  symbol,
    @JsonProperty("totalIdeas")           int     totalIdeas,
    @JsonProperty("closedTrades")         int     closedTrades,
    @JsonProperty("wins")                 int     wins,
    @JsonProperty("losses")               int     losses,
    @JsonProperty("breakevens")           int     breakevens,
    @JsonProperty("overallWinRate")       Double  overallWinRate,
    @JsonProperty("longTrades")           int     longTrades,
    @JsonProperty("longWinRate")          Double  longWinRate,
    @JsonProperty("shortTrades")          int     shortTrades,
    @JsonProperty("shortWinRate")         Double  shortWinRate,
    @JsonProperty("totalPnl")             Double  totalPnl,
    @JsonProperty("totalReturnPercent")   Double  totalReturnPercent,
    @JsonProperty("avgWinPercent")        Double  avgWinPercent,
    @JsonProperty("avgLossPercent")       Double  avgLossPercent,
    @JsonProperty("profitFactor")         Double  profitFactor,
    @JsonProperty("bestCatalyst")         String  bestCatalyst,
    @JsonProperty("bestCatalystWinRate")  Double  bestCatalystWinRate,
    @JsonProperty("worstCatalyst")        String  worstCatalyst,
    @JsonProperty("worstCatalystWinRate") Double  worstCatalystWinRate,
    @JsonProperty("avgConfidence")        Double  avgConfidence,
    @JsonProperty("actualVsPredicted")    Double  actualVsPredicted,
    @JsonProperty("lastTradeAt")          Instant lastTradeAt
) {

    /** Profile of a symbol the ledger has never seen. */
    public static SymbolProfile empty(String symbol) {
        return new SymbolProfile(symbol, 0, 0, 0, 0, 0, null, 0, null, 0, null,
                                 null, null, null, null, null, null, null, null, null,
                                 null, null, null);
    }
}
