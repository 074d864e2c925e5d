package com.fincube.fraud.model;

public enum TransferDirection {
    SENT,
    RECEIVED
}
