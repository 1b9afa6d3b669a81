package nl.bytesoflife.fabcapacity.model;

public enum EquipmentStatus {
    ACTIVE,
    MAINTENANCE,
    UPGRADE;

    public static EquipmentStatus fromName(String name) {
        return switch (name.trim().toLowerCase()) {
            case "active" -> ACTIVE;
            case "maintenance" -> MAINTENANCE;
            case "upgrade" -> UPGRADE;
            default -> throw new IllegalArgumentException("Unknown equipment status: " + name);
        };
    }
}
