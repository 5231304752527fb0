package org.iceforge.tilecut.archive;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileNameParserTest {

    private static final String TAIL = "_TILE102018211-A1B2C3_20240101T000000.000000Z_00.00.fits";

    @Test
    void parse_singleChannelInstrument_bandEqualsInstrument() {
        Optional<FileNameParser.ParsedName> p = FileNameParser.parse(
                "EUC_MER_BGSUB-MOSAIC-VIS" + TAIL, NamingRules.ruleFor(ProductType.BGSUB));

        assertTrue(p.isPresent());
        assertEquals("102018211", p.get().tileId());
        assertEquals("VIS", p.get().instrumentCode());
        assertEquals("VIS", p.get().fullBand());
    }

    @Test
    void parse_multiBandInstrument_joinsInstrumentAndBand() {
        Optional<FileNameParser.ParsedName> p = FileNameParser.parse(
                "EUC_MER_BGSUB-MOSAIC-NIR-H" + TAIL, NamingRules.ruleFor(ProductType.BGSUB));

        assertThat(p).isPresent();
        assertEquals("NIR", p.get().instrumentCode());
        assertEquals("H", p.get().bandCode());
        assertEquals("NIR-H", p.get().fullBand());
    }

    @Test
    void parse_suffixRules_areStrict() {
        String flag = "EUC_MER_MOSAIC-DES-G-FLAG" + TAIL;
        String rms = "EUC_MER_MOSAIC-DES-G-RMS" + TAIL;

        assertEquals("DES-G", FileNameParser.parse(flag, NamingRules.ruleFor(ProductType.FLAG)).orElseThrow().fullBand());
        assertThat(FileNameParser.parse(flag, NamingRules.ruleFor(ProductType.RMS))).isEmpty();
        assertThat(FileNameParser.parse(rms, NamingRules.ruleFor(ProductType.FLAG))).isEmpty();
        assertThat(FileNameParser.parse(rms, NamingRules.ruleFor(ProductType.BGSUB))).isEmpty();
    }

    @Test
    void parse_rejectsCatalogsAndMalformedNames() {
        NamingRules.Rule rule = NamingRules.ruleFor(ProductType.BGSUB);

        assertThat(FileNameParser.parse("EUC_MER_FINAL-CAT" + TAIL, rule)).isEmpty();
        assertThat(FileNameParser.parse("EUC_MER_BGSUB-MOSAIC-VIS.fits", rule)).isEmpty();
        assertThat(FileNameParser.parse("EUC_MER_BGSUB-MOSAIC-" + TAIL, rule)).isEmpty();
        assertThat(FileNameParser.parse("EUC_MER_BGSUB-MOSAIC-VIS" + TAIL.replace(".fits", ".fits.gz"), rule)).isEmpty();
        assertThat(FileNameParser.parse(null, rule)).isEmpty();
    }

    @Test
    void productType_codesRoundTrip() {
        assertEquals(ProductType.CATALOG_PSF, ProductType.fromCode("catalog_psf"));
        assertEquals(ProductType.CATALOG_PSF, ProductType.fromCode("CATALOG-PSF"));
        assertEquals("CATALOG-PSF", ProductType.CATALOG_PSF.toString());
        assertTrue(ProductType.CATALOG_PSF.isStampGrid());
    }
}
