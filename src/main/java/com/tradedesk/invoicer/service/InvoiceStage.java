package com.tradedesk.invoicer.service;

/**
 * Steps of {@link InvoiceTransaction#create}. Any stage before
 * {@code COMMITTED} may end in {@code REJECTED}.
 */
public enum InvoiceStage {
    VALIDATING,
    PRICING,
    RESERVING,
    NUMBERING,
    PERSISTING,
    COMMITTED,
    REJECTED
}
