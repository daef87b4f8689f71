package com.scratchodds.infrastructure.scraper;

/**
 * Highest prize tier found in a page's prize tables.
 *
 * @param amount      prize amount in dollars
 * @param inGame      number of such prizes printed
 * @param claimed     number of such prizes already claimed
 * @param prizesFound whether any prize-tier row parsed
 */
public record TopPrize(double amount, long inGame, long claimed, boolean prizesFound) {

    public static final TopPrize NONE = new TopPrize(0, 0, 0, false);
}
