package com.kekopoly.shared.util;

public enum ActionType {
    ROLL_DICE,
    BUY_PROPERTY,
    PAY_RENT,
    DRAW_CARD,
    USE_CARD,
    MORTGAGE_PROPERTY,
    UNMORTGAGE_PROPERTY,
    BUILD_ENGAGEMENT,
    BUILD_CHECKMARK,
    END_TURN,
    TRADE,
    SPECIAL;

    /** Trade proposals may be made outside the acting player's turn. */
    public boolean turnIndependent() {
        return this == TRADE;
    }
}
