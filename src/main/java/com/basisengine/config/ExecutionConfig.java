package com.basisengine.config;

import com.basisengine.domain.enums.TradingMode;
import com.basisengine.domain.enums.VenueType;
import com.basisengine.routing.VenueRegistry;
import com.basisengine.simulator.SimulatedCexVenueClient;
import com.basisengine.simulator.SimulatedChainClient;
import com.basisengine.simulator.SimulatedVenueBook;
import com.basisengine.venue.RequestSigner;
import com.basisengine.venue.VenueAdapter;
import com.basisengine.venue.cex.CexVenueAdapter;
import com.basisengine.venue.cex.CexVenueClient;
import com.basisengine.venue.cex.RestCexVenueClient;
import com.basisengine.venue.onchain.ChainClient;
import com.basisengine.venue.onchain.OnChainVenueAdapter;
import com.basisengine.venue.onchain.RelayerChainClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires one {@link VenueAdapter} per configured venue.
 *
 * <p>In PAPER mode every venue is backed by an in-memory simulated client sharing one
 * {@link SimulatedVenueBook}, seeded with the venue's {@code initial-balances}. In LIVE mode CEX
 * venues talk to their REST API and chain venues to their signing relayer, each through its own
 * {@link RestClient} with the venue's request timeout.
 */
@Configuration
@EnableConfigurationProperties(ExecutionProperties.class)
public class ExecutionConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutionConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SimulatedVenueBook simulatedVenueBook(ExecutionProperties executionProperties) {
        SimulatedVenueBook book = new SimulatedVenueBook();
        executionProperties.getVenues().forEach((name, venue) -> {
            book.seed(name, venue.getInitialBalances());
            if (venue.getDepositAddress() != null) {
                book.registerAddress(venue.getDepositAddress(), name);
            }
        });
        return book;
    }

    @Bean
    public List<VenueAdapter> venueAdapters(
            ExecutionProperties executionProperties,
            VenueRegistry venueRegistry,
            SimulatedVenueBook simulatedVenueBook,
            ObjectMapper objectMapper,
            Clock clock) {
        TradingMode mode = executionProperties.getTradingMode();
        List<VenueAdapter> adapters = new ArrayList<>();
        for (Map.Entry<String, ExecutionProperties.Venue> entry :
                executionProperties.getVenues().entrySet()) {
            String name = entry.getKey();
            ExecutionProperties.Venue venue = entry.getValue();
            if (venue.getType() == VenueType.CEX) {
                CexVenueClient client = mode == TradingMode.LIVE
                        ? new RestCexVenueClient(name, restClient(name, venue), signer(venue), objectMapper, clock)
                        : new SimulatedCexVenueClient(name, venue.getQuoteAsset(), simulatedVenueBook);
                adapters.add(new CexVenueAdapter(name, venue, client, venueRegistry, clock));
            } else {
                ChainClient client = mode == TradingMode.LIVE
                        ? new RelayerChainClient(name, restClient(name, venue), signer(venue), objectMapper, clock)
                        : new SimulatedChainClient(name, venue.getNativeAsset(), simulatedVenueBook);
                adapters.add(new OnChainVenueAdapter(name, venue, client, venueRegistry, clock));
            }
            log.info(
                    "Venue adapter configured: venue={}, type={}, mode={}, enabled={}",
                    name,
                    venue.getType(),
                    mode,
                    venue.isEnabled());
        }
        return adapters;
    }

    private RestClient restClient(String name, ExecutionProperties.Venue venue) {
        if (venue.getBaseUrl() == null || venue.getBaseUrl().isBlank()) {
            throw new IllegalStateException("basisengine.venues." + name + ".base-url is required in LIVE mode");
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(venue.getRequestTimeout());
        requestFactory.setReadTimeout(venue.getRequestTimeout());
        return RestClient.builder()
                .baseUrl(venue.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    private RequestSigner signer(ExecutionProperties.Venue venue) {
        return new RequestSigner(venue.getApiKey(), venue.getApiSecret());
    }
}
