package com.basisengine.simulator;

import com.basisengine.exception.VenueApiException;
import com.basisengine.venue.onchain.ChainClient;
import com.basisengine.venue.onchain.ChainReceipt;
import com.basisengine.venue.onchain.ChainTransaction;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory chain for paper trading. A broadcast transaction is mined into the next block and
 * each {@link #latestBlock()} call produces one more block, so confirmations accrue as the
 * adapter polls. Every mined transaction burns a fixed gas fee in the native asset, reverted or not.
 *
 * <p>Scripting for tests:
 * <ul>
 *   <li>{@link #failNextBroadcasts}: the broadcast call itself fails</li>
 *   <li>{@link #revertNext}: the next transaction is mined but reverts</li>
 *   <li>{@link #revertReference}: the transaction for one instruction id is mined but reverts</li>
 *   <li>{@link #setWithholdReceipts}: transactions stay in the mempool until {@link #mineWithheld()}</li>
 * </ul>
 */
public class SimulatedChainClient implements ChainClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatedChainClient.class);

    private static final BigDecimal GAS_FEE = new BigDecimal("0.0005");

    private final String venueName;
    private final String nativeAsset;
    private final SimulatedVenueBook book;

    private final AtomicLong blockNumber = new AtomicLong(1_000);
    private final AtomicLong txSequence = new AtomicLong(1);
    private final Map<String, String> hashByReference = new HashMap<>();
    private final Map<String, ChainReceipt> receipts = new HashMap<>();
    private final Map<String, ChainTransaction> withheld = new LinkedHashMap<>();
    private final Deque<VenueApiException> scriptedFailures = new ArrayDeque<>();
    private final Deque<String> scriptedReverts = new ArrayDeque<>();
    private final Map<String, String> revertsByReference = new HashMap<>();

    private boolean withholdReceipts;

    public SimulatedChainClient(String venueName, String nativeAsset, SimulatedVenueBook book) {
        this.venueName = venueName;
        this.nativeAsset = nativeAsset;
        this.book = book;
    }

    public synchronized void failNextBroadcasts(int count, boolean retryable) {
        for (int i = 0; i < count; i++) {
            scriptedFailures.add(new VenueApiException(
                    venueName,
                    retryable ? 502 : 400,
                    retryable ? null : "TX_REJECTED",
                    retryable ? "Relayer unavailable (simulated)" : "Transaction rejected (simulated)",
                    retryable));
        }
    }

    public synchronized void revertNext(String reason) {
        scriptedReverts.add(reason);
    }

    public synchronized void revertReference(String reference, String reason) {
        revertsByReference.put(reference, reason);
    }

    public synchronized void setWithholdReceipts(boolean withholdReceipts) {
        this.withholdReceipts = withholdReceipts;
    }

    /** Mines every withheld transaction, as if they finally landed. */
    public synchronized void mineWithheld() {
        withheld.forEach(this::mine);
        withheld.clear();
    }

    @Override
    public synchronized String broadcast(ChainTransaction transaction) {
        VenueApiException failure = scriptedFailures.poll();
        if (failure != null) {
            throw failure;
        }
        String existing = hashByReference.get(transaction.getReference());
        if (existing != null) {
            return existing;
        }
        String txHash = String.format("0x%064x", txSequence.getAndIncrement());
        hashByReference.put(transaction.getReference(), txHash);
        if (withholdReceipts) {
            withheld.put(txHash, transaction);
        } else {
            mine(txHash, transaction);
        }
        return txHash;
    }

    @Override
    public synchronized Optional<ChainReceipt> getReceipt(String txHash) {
        return Optional.ofNullable(receipts.get(txHash));
    }

    @Override
    public long latestBlock() {
        return blockNumber.incrementAndGet();
    }

    @Override
    public synchronized Map<String, BigDecimal> getBalances() {
        return book.balancesOf(venueName);
    }

    private void mine(String txHash, ChainTransaction tx) {
        long block = blockNumber.incrementAndGet();
        String revertReason = revertsByReference.remove(tx.getReference());
        if (revertReason == null) {
            revertReason = scriptedReverts.poll();
        }
        ChainReceipt.ChainReceiptBuilder receipt = ChainReceipt.builder()
                .txHash(txHash)
                .blockNumber(block)
                .gasUsed(150_000)
                .fee(GAS_FEE)
                .feeAsset(nativeAsset);
        book.adjust(venueName, nativeAsset, GAS_FEE.negate());
        if (revertReason != null) {
            receipts.put(txHash, receipt.success(false).revertReason(revertReason).build());
            log.debug("Simulated revert {} {}: {}", tx.getOperation(), txHash, revertReason);
            return;
        }

        BigDecimal realized = apply(tx);
        receipts.put(txHash, receipt.success(true)
                .realizedAmount(realized)
                .realizedPrice(book.markPrice(tx.getAsset()))
                .build());
        log.debug("Simulated {} {} mined in block {}", tx.getOperation(), txHash, block);
    }

    private BigDecimal apply(ChainTransaction tx) {
        BigDecimal amount = tx.getAmount();
        switch (tx.getOperation()) {
            case FLASH_BORROW -> book.adjust(venueName, tx.getAsset(), amount);
            case FLASH_REPAY -> book.adjust(venueName, tx.getAsset(), amount.negate());
            case TRADE -> book.adjust(venueName, tx.getAsset(), amount);
            case TRANSFER -> {
                book.adjust(venueName, tx.getAsset(), amount.negate());
                book.venueForAddress(tx.getToAddress()).ifPresent(target -> book.adjust(target, tx.getAsset(), amount));
            }
            case SWAP -> {
                BigDecimal received = book.convert(tx.getAssetIn(), amount, tx.getAsset());
                book.adjust(venueName, tx.getAssetIn(), amount.negate());
                book.adjust(venueName, tx.getAsset(), received);
                return received;
            }
        }
        return amount.abs();
    }
}
