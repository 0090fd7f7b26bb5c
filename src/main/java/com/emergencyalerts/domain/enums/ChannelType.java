package com.emergencyalerts.domain.enums;

/** Broadcast channel an alert is issued on. */
public enum ChannelType {
    TEST,
    OPERATOR,
    SEVERE,
    GOVERNMENT,
    SMS
}
