package com.certmanager.acme;

public enum OrderStatus {
    PENDING,
    READY,
    PROCESSING,
    VALID,
    INVALID,
    UNKNOWN
}
