package com.airouter.provider;

public enum ProviderErrorType {
    AUTHENTICATION,
    RATE_LIMIT,
    TIMEOUT,
    TRANSPORT
}
