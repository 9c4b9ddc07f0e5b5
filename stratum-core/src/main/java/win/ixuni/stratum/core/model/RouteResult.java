package win.ixuni.stratum.core.model;

import lombok.Value;

/**
 * Routing decision together with the store outcome
 */
@Value
public class RouteResult {

    RoutingDecision decision;

    StoreResult storeResult;
}
