package com.flagship.flight_surety.oracle;

import com.flagship.flight_surety.common.AccountId;

/**
 * Source of pseudo-random oracle indexes.
 */
public interface IndexSource {

    /**
     * @return a value in {@code [0, range)} derived for {@code account}
     */
    int nextIndex(AccountId account, int range);
}
