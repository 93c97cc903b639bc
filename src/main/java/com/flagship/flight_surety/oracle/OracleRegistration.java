package com.flagship.flight_surety.oracle;

import com.flagship.flight_surety.common.AccountId;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A registered oracle and the three distinct indexes it may answer requests for.
 */
@Value
public class OracleRegistration {
    AccountId oracle;
    List<Integer> indexes;
    Instant registeredAt;

    public OracleRegistration(AccountId oracle, List<Integer> indexes, Instant registeredAt) {
        if (indexes.size() != 3 || indexes.stream().distinct().count() != 3) {
            throw new IllegalArgumentException("Oracle needs three distinct indexes, got " + indexes);
        }
        this.oracle = oracle;
        this.indexes = List.copyOf(indexes);
        this.registeredAt = registeredAt;
    }

    public boolean holds(int index) {
        return indexes.contains(index);
    }
}
