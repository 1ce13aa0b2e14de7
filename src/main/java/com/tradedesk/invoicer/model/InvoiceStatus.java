package com.tradedesk.invoicer.model;

public enum InvoiceStatus {
    ACTIVE,
    VOIDED
}
