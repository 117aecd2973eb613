package io.admission.resource;

/**
 * Finite resource pools managed by the allocation system. Each type carries the unit its amounts are expressed in.
 */
public enum ResourceType {
    GPU("MB"),
    CPU("cores"),
    MEMORY("MB"),
    DISK_IO("MB/s"),
    NETWORK_IO("MB/s");

    private final String unit;

    ResourceType(String unit) { this.unit = unit; }

    public String unit() { return unit; }
}
