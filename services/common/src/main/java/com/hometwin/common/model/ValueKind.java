package com.hometwin.common.model;

/**
 * How the textual state of a sensor is interpreted.
 */
public enum ValueKind {
    NUMERIC,   // state is a decimal number
    ON_OFF     // state is "on" or anything else
}
