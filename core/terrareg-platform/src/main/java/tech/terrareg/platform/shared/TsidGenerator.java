package tech.terrareg.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

/**
 * Centralized TSID generation for all registry entities.
 *
 * TSIDs are time-sorted 64-bit values, so a row inserted later always receives
 * a larger id. Module versions rely on this: a re-ingested version never reuses
 * the id of the row it supersedes.
 */
public final class TsidGenerator {

    /**
     * Generate a new TSID as Long.
     */
    public static Long generate() {
        return TsidCreator.getTsid().toLong();
    }

    private TsidGenerator() {
        // Utility class
    }
}
