package com.hometwin.common.model;

/**
 * Home Assistant entity id, e.g. {@code sensor.hue_motion_sensor_4_illuminance}.
 * <p>
 * The part before the first period is the domain and is fixed by Home Assistant; the part
 * after it is the user-settable entity name. The entity name is used verbatim as the twin id.
 */
public record EntityId(String domain, String entityName) {

    public static EntityId parse(String entityId) {
        if (entityId == null) {
            throw new IllegalArgumentException("Entity id is required");
        }
        int dot = entityId.indexOf('.');
        if (dot <= 0 || dot == entityId.length() - 1) {
            throw new IllegalArgumentException("Entity id is not of the form <domain>.<name>: " + entityId);
        }
        return new EntityId(entityId.substring(0, dot), entityId.substring(dot + 1));
    }

    public String twinId() {
        return entityName;
    }
}
