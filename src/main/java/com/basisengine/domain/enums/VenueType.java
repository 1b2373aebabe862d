package com.basisengine.domain.enums;

/**
 * Kind of execution venue. CEX venues expose synchronous REST order APIs, ONCHAIN venues are
 * DeFi protocols reached through transactions, WALLET is the on-chain treasury that only moves funds.
 */
public enum VenueType {
    CEX,
    ONCHAIN,
    WALLET
}
