package trader.stablearb.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class EngineStatus {
    boolean running;
    boolean attemptInFlight;
    boolean reconciliationPending;
    String pendingReconciliationAttemptId;
    String haltReason;
    Instant lastTickAt;
    Instant lastAttemptClosedAt;
    String lastRejection;
}
