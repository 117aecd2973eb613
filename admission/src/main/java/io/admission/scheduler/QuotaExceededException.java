package io.admission.scheduler;

/** A submission was refused by the tenant's quota. */
public class QuotaExceededException extends Exception {
    private final String tenantId;
    private final String reason;

    public QuotaExceededException(String tenantId, String reason) {
        super("Tenant " + tenantId + " quota exceeded: " + reason);
        this.tenantId = tenantId;
        this.reason = reason;
    }

    public String tenantId() { return tenantId; }
    public String reason() { return reason; }
}
