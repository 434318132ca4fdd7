/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.sage.dataset;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Exact conversions of boxed numbers so that values of different numeric types
 * ({@code Integer}, {@code Long}, {@code Double}, {@code BigDecimal}) compare by value.
 */
public final class NumericValues {

    private NumericValues() {}

    /**
     * Converts a number to a {@link BigDecimal}.
     *
     * @param number the number
     * @return the exact decimal value
     * @throws ArithmeticException if the number is NaN or infinite
     */
    public static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal bd) {
            return bd;
        }
        if (number instanceof BigInteger bi) {
            return new BigDecimal(bi);
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (!Double.isFinite(d)) {
                throw new ArithmeticException("Cannot compare non-finite value " + d);
            }
            return BigDecimal.valueOf(d);
        }
        return BigDecimal.valueOf(number.longValue());
    }

    /**
     * Orders two numbers by value. Infinities sort beyond every finite value.
     *
     * @param left  the left number
     * @param right the right number
     * @return a negative, zero or positive integer
     */
    public static int compare(Number left, Number right) {
        if (!isFinite(left) || !isFinite(right)) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    public static boolean isFinite(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return Double.isFinite(number.doubleValue());
        }
        return true;
    }

    /**
     * Returns a key under which numerically equal values collide, e.g. {@code 1} and {@code 1.0}.
     *
     * @param number the number
     * @return the normalized key
     */
    public static BigDecimal normalize(Number number) {
        BigDecimal value = toBigDecimal(number).stripTrailingZeros();
        return value.signum() == 0 ? BigDecimal.ZERO : value;
    }
}
