package blitz.engine.model;

public record CpuInfo(String name, String vendorId, String brand, long frequency) {
}
