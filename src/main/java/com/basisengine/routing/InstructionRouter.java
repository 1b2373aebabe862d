package com.basisengine.routing;

import com.basisengine.domain.enums.ActionClass;
import com.basisengine.domain.enums.VenueType;
import com.basisengine.domain.model.Instruction;
import com.basisengine.domain.model.TransferInstruction;
import com.basisengine.exception.UnroutableInstructionException;
import com.basisengine.venue.VenueAdapter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves an instruction to the adapter that executes it.
 *
 * <p>The routing key is (venue, action class), where the action class follows from the
 * instruction's action and the venue's type. The same instruction always lands on the same
 * adapter. Routing never changes state: an unroutable instruction raises
 * {@link UnroutableInstructionException} and nothing else happens.
 *
 * <p>Rejection reasons:
 * <ol>
 *   <li>venue unknown or disabled</li>
 *   <li>action meaningless for the venue type (e.g. a flash loan on a CEX)</li>
 *   <li>no adapter registered for the (venue, action class) pair</li>
 *   <li>transfer target unknown or disabled</li>
 * </ol>
 */
@Service
public class InstructionRouter {

    private static final Logger log = LoggerFactory.getLogger(InstructionRouter.class);

    private final VenueRegistry venueRegistry;
    private final Map<RouteKey, VenueAdapter> routes = new HashMap<>();

    public InstructionRouter(VenueRegistry venueRegistry, List<VenueAdapter> adapters) {
        this.venueRegistry = venueRegistry;
        for (VenueAdapter adapter : adapters) {
            for (ActionClass actionClass : adapter.supportedActionClasses()) {
                VenueAdapter previous = routes.put(new RouteKey(adapter.venueName(), actionClass), adapter);
                if (previous != null) {
                    throw new IllegalStateException(
                            "Two adapters registered for " + adapter.venueName() + "/" + actionClass);
                }
            }
        }
        log.info("Instruction router initialised with {} routes", routes.size());
    }

    /**
     * Returns the adapter for the instruction.
     *
     * @throws UnroutableInstructionException if no enabled venue/adapter pair accepts it
     */
    public VenueAdapter route(Instruction instruction) {
        String venue = instruction.getVenue();
        if (!venueRegistry.isKnown(venue)) {
            throw unroutable(instruction, "unknown venue");
        }
        if (!venueRegistry.isEnabled(venue)) {
            throw unroutable(instruction, "venue disabled");
        }
        if (instruction instanceof TransferInstruction transfer) {
            String target = transfer.getTargetVenue();
            if (!venueRegistry.isKnown(target) || !venueRegistry.isEnabled(target)) {
                throw unroutable(instruction, "transfer target " + target + " unknown or disabled");
            }
        }

        VenueType venueType = venueRegistry.typeOf(venue).orElseThrow();
        ActionClass actionClass = ActionClass.resolve(instruction.getAction(), venueType)
                .orElseThrow(() ->
                        unroutable(instruction, instruction.getAction() + " not supported on " + venueType + " venue"));

        VenueAdapter adapter = routes.get(new RouteKey(venue, actionClass));
        if (adapter == null) {
            throw unroutable(instruction, "no adapter for " + actionClass);
        }
        log.debug("Routed instruction {} to {}/{}", instruction.getId(), venue, actionClass);
        return adapter;
    }

    /** The adapter serving a venue's balance queries, if any adapter is registered for it. */
    public Optional<VenueAdapter> adapterForVenue(String venue) {
        return routes.entrySet().stream()
                .filter(e -> e.getKey().venue().equals(venue))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    private UnroutableInstructionException unroutable(Instruction instruction, String reason) {
        log.warn("Unroutable instruction {}: venue={}, reason={}", instruction.getId(), instruction.getVenue(), reason);
        return new UnroutableInstructionException(instruction.getId(), instruction.getVenue(), reason);
    }

    private record RouteKey(String venue, ActionClass actionClass) {}
}
