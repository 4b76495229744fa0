package br.com.eichler.registry.model;

/**
 * Result of probing the registry and its backing store.
 *
 * @param healthy  whether the backing store answered
 * @param api      state of the request-handling side, always {@code operational} when reported
 * @param database {@code connected} or {@code disconnected}
 * @param error    failure description, {@code null} when healthy
 */
public record HealthStatus(boolean healthy, String api, String database, String error) {

    public static HealthStatus up() {
        return new HealthStatus(true, "operational", "connected", null);
    }

    public static HealthStatus down(String error) {
        return new HealthStatus(false, "operational", "disconnected", error);
    }

    public String status() {
        return healthy ? "healthy" : "unhealthy";
    }
}
