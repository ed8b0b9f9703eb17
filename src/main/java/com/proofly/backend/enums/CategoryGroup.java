package com.proofly.backend.enums;

public enum CategoryGroup {
    INCOME,
    EXPENSE,
    TRANSFER,
    FEE,
    OTHER
}
