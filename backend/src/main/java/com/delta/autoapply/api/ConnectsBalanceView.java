package com.delta.autoapply.api;

/**
 * Available Upwork Connects; {@code balance} is null when it could not be read.
 */
public record ConnectsBalanceView(Integer balance, boolean known) {
    static ConnectsBalanceView of(Integer balance) {
        return new ConnectsBalanceView(balance, balance != null);
    }
}
