package com.tradedesk.invoicer.model;

public enum DamageEntryType {
    MARKED_DAMAGED,
    RESTORED
}
