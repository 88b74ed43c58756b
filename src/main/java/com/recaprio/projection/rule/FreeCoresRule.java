package com.recaprio.projection.rule;

import com.recaprio.projection.exception.DomainException;
import com.recaprio.projection.model.BaseRow;
import com.recaprio.projection.model.DerivedAttributes;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Set;

/**
 * Derives {@code FreeCores} from a cluster's spare frequency:
 * {@code FreeCores = FreeGHz / ghzPerCore}, kept at two decimals like the
 * {@code DECIMAL(10,2)} stat columns it is computed from.
 *
 * <p>A missing or null {@code FreeGHz} yields a null {@code FreeCores}. Negative,
 * NaN, infinite or non-numeric values are rejected.
 */
public class FreeCoresRule implements DerivationRule {

    public static final String FREE_GHZ = "FreeGHz";
    public static final String FREE_CORES = "FreeCores";
    public static final double DEFAULT_GHZ_PER_CORE = 2.4;

    private static final int SCALE = 2;

    private final BigDecimal ghzPerCore;

    public FreeCoresRule() {
        this(DEFAULT_GHZ_PER_CORE);
    }

    public FreeCoresRule(double ghzPerCore) {
        if (!(ghzPerCore > 0) || Double.isInfinite(ghzPerCore)) {
            throw new IllegalArgumentException("ghzPerCore must be a positive finite number, was " + ghzPerCore);
        }
        this.ghzPerCore = BigDecimal.valueOf(ghzPerCore);
    }

    @Override
    public String name() {
        return "free-cores";
    }

    @Override
    public Set<String> inputColumns() {
        return Set.of(FREE_GHZ);
    }

    @Override
    public Set<String> outputColumns() {
        return Set.of(FREE_CORES);
    }

    @Override
    public DerivedAttributes derive(BaseRow row) {
        Object raw = row.get(FREE_GHZ);
        if (raw == null) {
            return DerivedAttributes.of(FREE_CORES, null);
        }
        BigDecimal freeGhz = toDecimal(row.key(), raw);
        if (freeGhz.signum() < 0) {
            throw new DomainException(row.key(), FREE_GHZ, raw, "is negative");
        }
        double freeCores = freeGhz.divide(ghzPerCore, SCALE, RoundingMode.HALF_UP).doubleValue();
        return DerivedAttributes.of(FREE_CORES, freeCores);
    }

    private static BigDecimal toDecimal(Long key, Object raw) {
        if (raw instanceof Double d && (d.isNaN() || d.isInfinite())) {
            throw new DomainException(key, FREE_GHZ, raw, "is not a finite number");
        }
        if (raw instanceof Float f && (f.isNaN() || f.isInfinite())) {
            throw new DomainException(key, FREE_GHZ, raw, "is not a finite number");
        }
        if (raw instanceof BigDecimal decimal) {
            return decimal;
        }
        try {
            return new BigDecimal(raw.toString().trim());
        } catch (NumberFormatException ex) {
            throw new DomainException(key, FREE_GHZ, raw, "is not numeric");
        }
    }
}
