package com.hometwin.ingestion.exception;

/**
 * A twin has to be created for a device class that has no model identifier configured.
 */
public class MissingModelIdentifierException extends IngestionException {

    private final String deviceClass;

    public MissingModelIdentifierException(String deviceClass, String twinId) {
        super("No model identifier for device class '" + deviceClass + "', cannot create twin '" + twinId + "'");
        this.deviceClass = deviceClass;
    }

    public String getDeviceClass() {
        return deviceClass;
    }
}
