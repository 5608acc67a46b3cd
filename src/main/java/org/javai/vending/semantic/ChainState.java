package org.javai.vending.semantic;

/**
 * Balance and purchase count of a block at one point of its token chain.
 * Passed down as the inherited state before a token and returned as the synthesized
 * state after it.
 */
record ChainState(int balance, int purchaseCount) {

	static final ChainState EMPTY = new ChainState(0, 0);
}
