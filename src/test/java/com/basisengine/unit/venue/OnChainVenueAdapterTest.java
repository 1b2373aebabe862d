package com.basisengine.unit.venue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.basisengine.config.ExecutionProperties;
import com.basisengine.domain.enums.ActionClass;
import com.basisengine.domain.enums.ExecutionStatus;
import com.basisengine.domain.enums.InstructionAction;
import com.basisengine.domain.enums.VenueType;
import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.domain.model.FlashLoanInstruction;
import com.basisengine.domain.model.TransferInstruction;
import com.basisengine.exception.ErrorCode;
import com.basisengine.exception.TerminalVenueException;
import com.basisengine.exception.TransientVenueException;
import com.basisengine.exception.VenueApiException;
import com.basisengine.routing.VenueRegistry;
import com.basisengine.venue.onchain.ChainClient;
import com.basisengine.venue.onchain.ChainOperation;
import com.basisengine.venue.onchain.ChainReceipt;
import com.basisengine.venue.onchain.ChainTransaction;
import com.basisengine.venue.onchain.OnChainVenueAdapter;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class OnChainVenueAdapterTest {

    private static final String TX = "0xabc";

    private ChainClient client;
    private ExecutionProperties.Venue settings;
    private VenueRegistry venueRegistry;
    private OnChainVenueAdapter adapter;

    @BeforeEach
    void setUp() {
        client = mock(ChainClient.class);
        settings = new ExecutionProperties.Venue();
        settings.setType(VenueType.ONCHAIN);
        settings.setRequiredConfirmations(2);
        settings.setPollInterval(Duration.ZERO);
        settings.setConfirmationTimeout(Duration.ofSeconds(5));

        ExecutionProperties.Venue binance = new ExecutionProperties.Venue();
        binance.setType(VenueType.CEX);
        binance.setDepositAddress("binance-deposit");
        ExecutionProperties properties = new ExecutionProperties();
        properties.getVenues().put("aave", settings);
        properties.getVenues().put("binance", binance);
        venueRegistry = new VenueRegistry(properties);

        adapter = new OnChainVenueAdapter("aave", settings, client, venueRegistry, Clock.systemUTC());
    }

    private FlashLoanInstruction borrow() {
        return FlashLoanInstruction.builder()
                .id("FL-1")
                .action(InstructionAction.FLASH_BORROW)
                .venue("aave")
                .asset("USDT")
                .signedSize(new BigDecimal("1000"))
                .atomicGroupId("G-1")
                .sequenceInGroup(1)
                .build();
    }

    private ChainReceipt receipt(boolean success, long block) {
        return ChainReceipt.builder()
                .txHash(TX)
                .blockNumber(block)
                .success(success)
                .fee(new BigDecimal("0.0005"))
                .feeAsset("ETH")
                .realizedAmount(new BigDecimal("1000"))
                .revertReason(success ? null : "insufficient liquidity")
                .build();
    }

    @Test
    @DisplayName("WALLET venue serves transfers only")
    void walletSupportsTransfersOnly() {
        settings.setType(VenueType.WALLET);

        assertThat(adapter.supportedActionClasses()).containsExactly(ActionClass.WALLET_TRANSFER);
    }

    @Nested
    @DisplayName("Confirmation")
    class Confirmation {

        @Test
        @DisplayName("Confirmed once the required confirmations are reached")
        void confirmsAfterRequiredBlocks() {
            when(client.broadcast(any())).thenReturn(TX);
            when(client.getReceipt(TX)).thenReturn(Optional.empty()).thenReturn(Optional.of(receipt(true, 100)));
            when(client.latestBlock()).thenReturn(100L).thenReturn(101L);

            ExecutionResult result = adapter.execute(borrow());

            assertThat(result.getStatus()).isEqualTo(ExecutionStatus.CONFIRMED);
            assertThat(result.getVenueRef()).isEqualTo(TX);
            assertThat(result.getFilledSize()).isEqualByComparingTo("1000");
            verify(client, times(2)).latestBlock();
        }

        @Test
        @DisplayName("Broadcast carries the instruction id and group id")
        void transactionMapping() {
            when(client.broadcast(any())).thenReturn(TX);
            when(client.getReceipt(TX)).thenReturn(Optional.of(receipt(true, 100)));
            when(client.latestBlock()).thenReturn(105L);

            adapter.execute(borrow());

            ArgumentCaptor<ChainTransaction> captor = ArgumentCaptor.forClass(ChainTransaction.class);
            verify(client).broadcast(captor.capture());
            assertThat(captor.getValue().getReference()).isEqualTo("FL-1");
            assertThat(captor.getValue().getOperation()).isEqualTo(ChainOperation.FLASH_BORROW);
            assertThat(captor.getValue().getAtomicGroupId()).isEqualTo("G-1");
        }

        @Test
        @DisplayName("Reverted receipt is terminal TX_REVERTED with the burnt gas fee")
        void reverted() {
            when(client.broadcast(any())).thenReturn(TX);
            when(client.getReceipt(TX)).thenReturn(Optional.of(receipt(false, 100)));

            assertThatThrownBy(() -> adapter.execute(borrow()))
                    .isInstanceOf(TerminalVenueException.class)
                    .satisfies(e -> {
                        TerminalVenueException terminal = (TerminalVenueException) e;
                        assertThat(terminal.getErrorCode()).isEqualTo(ErrorCode.TX_REVERTED);
                        assertThat(terminal.getVenueRef()).isEqualTo(TX);
                        assertThat(terminal.getFee()).isEqualByComparingTo("0.0005");
                    });
        }

        @Test
        @DisplayName("Receipt poll errors after broadcast never surface as transient")
        void pollErrorAfterBroadcast() {
            when(client.broadcast(any())).thenReturn(TX);
            when(client.getReceipt(TX))
                    .thenThrow(new VenueApiException("aave", 502, null, "relayer down", true))
                    .thenReturn(Optional.of(receipt(true, 100)));
            when(client.latestBlock()).thenReturn(110L);

            ExecutionResult result = adapter.execute(borrow());

            assertThat(result.getStatus()).isEqualTo(ExecutionStatus.CONFIRMED);
            verify(client, times(1)).broadcast(any());
        }

        @Test
        @DisplayName("Not mined by the deadline: TIMEOUT carrying the tx hash")
        void timeout() {
            settings.setConfirmationTimeout(Duration.ZERO);
            when(client.broadcast(any())).thenReturn(TX);
            when(client.getReceipt(TX)).thenReturn(Optional.empty());

            ExecutionResult result = adapter.execute(borrow());

            assertThat(result.getStatus()).isEqualTo(ExecutionStatus.TIMEOUT);
            assertThat(result.getVenueRef()).isEqualTo(TX);
        }
    }

    @Nested
    @DisplayName("Broadcast failures")
    class BroadcastFailures {

        @Test
        @DisplayName("Relayer unavailable is transient")
        void transientBroadcast() {
            when(client.broadcast(any())).thenThrow(new VenueApiException("aave", 503, null, "down", true));

            assertThatThrownBy(() -> adapter.execute(borrow()))
                    .isInstanceOf(TransientVenueException.class)
                    .extracting(e -> ((TransientVenueException) e).getErrorCode())
                    .isEqualTo(ErrorCode.VENUE_UNAVAILABLE);
        }

        @Test
        @DisplayName("Rejected transaction is terminal TX_REJECTED")
        void rejectedBroadcast() {
            when(client.broadcast(any())).thenThrow(new VenueApiException("aave", 400, "NONCE_TOO_LOW", "nonce", false));

            assertThatThrownBy(() -> adapter.execute(borrow()))
                    .isInstanceOf(TerminalVenueException.class)
                    .extracting(e -> ((TerminalVenueException) e).getErrorCode())
                    .isEqualTo(ErrorCode.TX_REJECTED);
        }

        @Test
        @DisplayName("Transfer goes to the target venue's deposit address")
        void transferAddress() {
            when(client.broadcast(any())).thenReturn(TX);
            when(client.getReceipt(TX)).thenReturn(Optional.of(receipt(true, 100)));
            when(client.latestBlock()).thenReturn(101L);
            TransferInstruction transfer = TransferInstruction.builder()
                    .id("TR-1")
                    .action(InstructionAction.TRANSFER)
                    .venue("aave")
                    .asset("USDT")
                    .targetVenue("binance")
                    .signedSize(new BigDecimal("500"))
                    .build();

            adapter.execute(transfer);

            ArgumentCaptor<ChainTransaction> captor = ArgumentCaptor.forClass(ChainTransaction.class);
            verify(client).broadcast(captor.capture());
            assertThat(captor.getValue().getOperation()).isEqualTo(ChainOperation.TRANSFER);
            assertThat(captor.getValue().getToAddress()).isEqualTo("binance-deposit");
        }
    }

    @Nested
    @DisplayName("Pending resolution")
    class PendingResolution {

        private ExecutionResult timedOut() {
            return ExecutionResult.builder()
                    .instructionId("FL-1")
                    .venue("aave")
                    .status(ExecutionStatus.TIMEOUT)
                    .venueRef(TX)
                    .build();
        }

        @Test
        @DisplayName("Mined and confirmed later resolves to CONFIRMED")
        void confirmedLater() {
            when(client.getReceipt(TX)).thenReturn(Optional.of(receipt(true, 100)));
            when(client.latestBlock()).thenReturn(120L);

            Optional<ExecutionResult> resolved = adapter.resolvePending(borrow(), timedOut());

            assertThat(resolved).isPresent();
            assertThat(resolved.get().getStatus()).isEqualTo(ExecutionStatus.CONFIRMED);
        }

        @Test
        @DisplayName("Still in the mempool stays unresolved")
        void stillPending() {
            when(client.getReceipt(TX)).thenReturn(Optional.empty());

            assertThat(adapter.resolvePending(borrow(), timedOut())).isEmpty();
        }

        @Test
        @DisplayName("Mined but not yet deep enough stays unresolved")
        void notDeepEnough() {
            when(client.getReceipt(TX)).thenReturn(Optional.of(receipt(true, 100)));
            when(client.latestBlock()).thenReturn(100L);

            assertThat(adapter.resolvePending(borrow(), timedOut())).isEmpty();
        }

        @Test
        @DisplayName("Reverted later resolves to FAILED with TX_REVERTED")
        void revertedLater() {
            when(client.getReceipt(TX)).thenReturn(Optional.of(receipt(false, 100)));

            Optional<ExecutionResult> resolved = adapter.resolvePending(borrow(), timedOut());

            assertThat(resolved).isPresent();
            assertThat(resolved.get().getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(resolved.get().getErrorCode()).isEqualTo(ErrorCode.TX_REVERTED);
        }
    }
}
