package com.kekopoly.shared.util;

public enum MarketCondition {
    NORMAL,
    BULL,
    CRASH
}
