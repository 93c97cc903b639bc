package com.flagship.flight_surety.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.Locale;

/**
 * Identity of a participant (airline, passenger, oracle, gateway or owner).
 *
 * Values are normalised to lower case so that "0xAB" and "0xab" name the same account.
 */
@Value
public class AccountId implements Comparable<AccountId> {
    String value;

    private AccountId(String value) {
        this.value = value;
    }

    @JsonCreator
    public static AccountId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Account id cannot be null or blank");
        }
        return new AccountId(value.trim().toLowerCase(Locale.ROOT));
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(AccountId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
