package com.scratchodds.domain.model;

/**
 * One game as listed on the games-index page.
 *
 * @param gameNumber  game identifier, unique within a listing
 * @param gameName    display name
 * @param startDate   start date as printed on the page (may be empty)
 * @param ticketPrice ticket price in dollars
 * @param detailUrl   absolute URL of the game's detail page
 */
public record GameSummary(
    String gameNumber,
    String gameName,
    String startDate,
    double ticketPrice,
    String detailUrl
) {}
