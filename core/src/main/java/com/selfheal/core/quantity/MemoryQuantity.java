package com.selfheal.core.quantity;

import java.math.BigInteger;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts Kubernetes memory quantity strings to whole mebibytes.
 * <p>
 * Only a leading integer and an optional alphabetic suffix are considered; anything after
 * the suffix is ignored. Unknown suffixes, including none at all, are taken as already
 * being in MiB. Results are truncated toward zero.
 * </p>
 * <p>
 * Input without leading digits yields {@link #FALLBACK_MEBIBYTES} instead of an error, so a
 * malformed manifest never blocks a remediation.
 * </p>
 */
public final class MemoryQuantity {
    private MemoryQuantity() {
    }

    /**
     * Value used for unparseable quantities and for containers without a memory limit.
     */
    public static final long FALLBACK_MEBIBYTES = 256L;

    private static final Pattern QUANTITY = Pattern.compile("(\\d+)([a-zA-Z]*)");

    // suffix -> {numerator, denominator} relative to MiB
    private static final Map<String, long[]> MULTIPLIERS = Map.of(
        "Ki", new long[]{1L, 1024L},
        "Mi", new long[]{1L, 1L},
        "Gi", new long[]{1024L, 1L},
        "K", new long[]{1_000L, 1024L * 1024L},
        "M", new long[]{1_000L, 1024L},
        "G", new long[]{1_000_000L, 1024L}
    );

    private static final long[] IDENTITY = {1L, 1L};
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    /**
     * Parses a quantity such as {@code 512Mi}, {@code 1Gi} or {@code 100M}.
     *
     * @param quantity quantity string, may be null
     * @return whole MiB, or {@link #FALLBACK_MEBIBYTES} if there are no leading digits
     */
    public static long parseMebibytes(String quantity) {
        if (quantity == null) {
            return FALLBACK_MEBIBYTES;
        }
        Matcher matcher = QUANTITY.matcher(quantity);
        if (!matcher.lookingAt()) {
            return FALLBACK_MEBIBYTES;
        }

        long[] multiplier = MULTIPLIERS.getOrDefault(matcher.group(2), IDENTITY);
        BigInteger mebibytes = new BigInteger(matcher.group(1))
            .multiply(BigInteger.valueOf(multiplier[0]))
            .divide(BigInteger.valueOf(multiplier[1]));

        return mebibytes.compareTo(LONG_MAX) > 0 ? Long.MAX_VALUE : mebibytes.longValue();
    }

    /**
     * Renders whole mebibytes in manifest form.
     *
     * @param mebibytes amount in MiB
     * @return e.g. {@code 320Mi}
     */
    public static String format(long mebibytes) {
        return mebibytes + "Mi";
    }
}
