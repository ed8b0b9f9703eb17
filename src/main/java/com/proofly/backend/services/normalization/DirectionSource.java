package com.proofly.backend.services.normalization;

/** Which signal decided a transaction's direction. */
public enum DirectionSource {
    TYPE_HINT,
    KEYWORD,
    AMOUNT_SIGN
}
