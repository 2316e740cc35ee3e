package com.holdemengine.common;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigInteger;
import java.util.Collection;

/**
 * Immutable value object representing a count of the smallest chip unit.
 * Uses BigInteger so that all chip arithmetic is exact; there is no fractional chip.
 */
@Getter
@EqualsAndHashCode
public final class ChipAmount implements Comparable<ChipAmount> {

    private static final ChipAmount ZERO = new ChipAmount(BigInteger.ZERO);

    private final BigInteger amount;

    private ChipAmount(BigInteger amount) {
        this.amount = amount;
    }

    public static ChipAmount of(BigInteger amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return new ChipAmount(amount);
    }

    public static ChipAmount of(long amount) {
        return new ChipAmount(BigInteger.valueOf(amount));
    }

    public static ChipAmount of(String amount) {
        if (amount == null || amount.isBlank()) {
            throw new IllegalArgumentException("Amount cannot be blank");
        }
        try {
            return new ChipAmount(new BigInteger(amount.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a whole chip amount: " + amount, e);
        }
    }

    public static ChipAmount zero() {
        return ZERO;
    }

    public static ChipAmount sum(Collection<ChipAmount> amounts) {
        ChipAmount total = ZERO;
        for (ChipAmount amount : amounts) {
            total = total.add(amount);
        }
        return total;
    }

    public static ChipAmount min(ChipAmount a, ChipAmount b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static ChipAmount max(ChipAmount a, ChipAmount b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public ChipAmount add(ChipAmount other) {
        return new ChipAmount(this.amount.add(require(other).amount));
    }

    public ChipAmount subtract(ChipAmount other) {
        return new ChipAmount(this.amount.subtract(require(other).amount));
    }

    public ChipAmount multiply(long factor) {
        return new ChipAmount(this.amount.multiply(BigInteger.valueOf(factor)));
    }

    /**
     * Whole-chip division, truncating toward zero.
     */
    public ChipAmount divide(long divisor) {
        return new ChipAmount(this.amount.divide(requirePositive(divisor)));
    }

    public ChipAmount remainder(long divisor) {
        return new ChipAmount(this.amount.remainder(requirePositive(divisor)));
    }

    public boolean isGreaterThan(ChipAmount other) {
        return compareTo(other) > 0;
    }

    public boolean isGreaterThanOrEqual(ChipAmount other) {
        return compareTo(other) >= 0;
    }

    public boolean isLessThan(ChipAmount other) {
        return compareTo(other) < 0;
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    @Override
    public int compareTo(ChipAmount other) {
        return this.amount.compareTo(require(other).amount);
    }

    @Override
    public String toString() {
        return amount.toString();
    }

    private static ChipAmount require(ChipAmount other) {
        if (other == null) {
            throw new IllegalArgumentException("Chip amount operand cannot be null");
        }
        return other;
    }

    private static BigInteger requirePositive(long divisor) {
        if (divisor <= 0) {
            throw new IllegalArgumentException("Divisor must be positive: " + divisor);
        }
        return BigInteger.valueOf(divisor);
    }
}
