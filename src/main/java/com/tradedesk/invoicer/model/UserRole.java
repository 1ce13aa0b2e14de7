package com.tradedesk.invoicer.model;

public enum UserRole {
    ADMIN,
    CLERK
}
