package com.basisengine.venue.onchain;

public enum ChainOperation {
    TRADE,
    TRANSFER,
    FLASH_BORROW,
    FLASH_REPAY,
    SWAP
}
