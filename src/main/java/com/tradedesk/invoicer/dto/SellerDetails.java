package com.tradedesk.invoicer.dto;

public record SellerDetails(String name, String phone, String address, String currencySymbol) {
}
