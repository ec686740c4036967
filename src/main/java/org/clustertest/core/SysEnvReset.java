package org.clustertest.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * Resets applied to a freshly constructed test, widening its validity to every system or
 * every programming environment.
 */
public enum SysEnvReset {
    VALID_SYSTEMS(1),
    VALID_PROG_ENVIRONS(2);

    private final int bit;

    SysEnvReset(final int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    /**
     * Decodes the bit mask form: bit 0 resets valid systems, bit 1 resets valid environments.
     */
    public static Set<SysEnvReset> fromBits(final int bits) {
        if (bits < 0 || bits > 3) {
            throw new IllegalArgumentException("reset flags must be within [0, 3]: " + bits);
        }
        final Set<SysEnvReset> flags = EnumSet.noneOf(SysEnvReset.class);
        for (final SysEnvReset flag : values()) {
            if ((bits & flag.bit) != 0) {
                flags.add(flag);
            }
        }
        return flags;
    }
}
