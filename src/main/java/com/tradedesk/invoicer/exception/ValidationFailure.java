package com.tradedesk.invoicer.exception;

public enum ValidationFailure {
    EMPTY_INVOICE,
    INVALID_QUANTITY,
    UNKNOWN_PRODUCT,
    MISSING_CUSTOMER,
    INVALID_PRODUCT,
    INVALID_PRICE,
    INVALID_GST_RATE,
    INVALID_PERIOD
}
