package com.lelantos.domain;

public enum RecurringWalletType {
    EARLY_BUYER,
    TOP_TRADER
}
