package org.iceforge.tilecut.archive;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declarative description of how archive file names are put together.
 * <p>
 * A product file is named {@code <stem>_TILE<tileId>-<hash>_<timestamp>.fits}; the stem is
 * {@code <prefix><channel><suffix>}. Adding a product type is a new row in {@link #RULES},
 * nothing else.
 */
public final class NamingRules {

    private NamingRules() {}

    public record Rule(String prefix, String suffix) {
        public Rule {
            prefix = prefix == null ? "" : prefix;
            suffix = suffix == null ? "" : suffix;
        }
    }

    public static final String EXTENSION = ".fits";

    /** Names containing any of these are never image products. */
    public static final List<String> EXCLUDED = List.of("FINAL-CAT");

    private static final Map<ProductType, Rule> RULES = new EnumMap<>(ProductType.class);

    static {
        RULES.put(ProductType.BGSUB, new Rule("EUC_MER_BGSUB-MOSAIC-", ""));
        RULES.put(ProductType.BGMOD, new Rule("EUC_MER_BGMOD-", ""));
        RULES.put(ProductType.FLAG, new Rule("EUC_MER_MOSAIC-", "-FLAG"));
        RULES.put(ProductType.RMS, new Rule("EUC_MER_MOSAIC-", "-RMS"));
        RULES.put(ProductType.CATALOG_PSF, new Rule("EUC_MER_CATALOG-PSF-", ""));
    }

    /**
     * Channel codes used in file names, keyed by the instrument directory they live in.
     */
    public static final Map<String, String> INSTRUMENT_CODES = Map.of(
            "VIS", "VIS",
            "NISP", "NIR",
            "DECAM", "DES",
            "HSC", "WISHES",
            "GPC", "PANSTARRS",
            "MEGACAM", "CFIS"
    );

    public static Rule ruleFor(ProductType type) {
        Rule r = RULES.get(type);
        if (r == null) {
            throw new IllegalArgumentException("No naming rule for " + type);
        }
        return r;
    }

    public static boolean isExcluded(String fileName) {
        for (String marker : EXCLUDED) {
            if (fileName.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    public static Optional<String> instrumentCode(String instrumentDir) {
        return Optional.ofNullable(INSTRUMENT_CODES.get(instrumentDir));
    }
}
