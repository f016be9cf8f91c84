package com.simtrader.core.model;

public record AccountInfo(
    double balance,
    double equity,
    double profit,
    double margin,
    double marginFree,
    double marginLevel,
    int leverage,
    String currency,
    int currencyDigits
) {}
