package com.scratchodds.domain.model;

/**
 * Fields extracted from one game's detail page.
 * A zero (or "N/A" for odds) means the field was not found on the page.
 */
public record GameDetail(
    long packSize,
    double guaranteedPrizeAmount,
    long totalTickets,
    String overallOdds,
    double topPrize,
    long topPrizeInGame,
    long topPrizeClaimed,
    boolean prizesFound
) {}
