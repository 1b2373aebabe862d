package com.basisengine.domain.enums;

/**
 * What an instruction asks a venue to do. OPEN/CLOSE/REBALANCE/HEDGE are position trades,
 * TRANSFER moves funds between venues, FLASH_BORROW/FLASH_REPAY bracket a flash loan and
 * SWAP exchanges one on-chain asset for another.
 */
public enum InstructionAction {
    OPEN,
    CLOSE,
    REBALANCE,
    HEDGE,
    TRANSFER,
    FLASH_BORROW,
    FLASH_REPAY,
    SWAP;

    public boolean isTrade() {
        return this == OPEN || this == CLOSE || this == REBALANCE || this == HEDGE;
    }

    public boolean isFlashLoan() {
        return this == FLASH_BORROW || this == FLASH_REPAY;
    }
}
