package de.anton.cos.shift_monitor.exception;

import de.anton.cos.shift_monitor.model.ConfigurationKey;

/**
 * No reference-table row matches a configuration key. Recoverable: the caller
 * decides whether to skip the measurement or fall back to a default.
 */
public class LookupMissException extends Exception {

    private final String tableId;
    private final ConfigurationKey key;

    public LookupMissException(String tableId, ConfigurationKey key) {
        super(String.format("No row for %s in reference table %s", key, tableId));
        this.tableId = tableId;
        this.key = key;
    }

    public String getTableId() {
        return tableId;
    }

    public ConfigurationKey getKey() {
        return key;
    }
}
