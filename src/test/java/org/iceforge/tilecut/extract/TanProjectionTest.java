package org.iceforge.tilecut.extract;

import nom.tam.fits.Header;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TanProjectionTest {

    private static final double SCALE = 0.1 / 3600.0;

    private final TanProjection wcs = new TanProjection(150.0, 2.0, 51.0, 41.0, -SCALE, 0.0, 0.0, SCALE);

    @Test
    void referencePoint_mapsToZeroBasedCrpix() {
        double[] p = wcs.skyToPixel(150.0, 2.0);

        assertThat(p[0]).isCloseTo(50.0, within(1e-9));
        assertThat(p[1]).isCloseTo(40.0, within(1e-9));
    }

    @Test
    void skyToPixel_invertsPixelToSky() {
        double[] sky = wcs.pixelToSky(12.25, 77.5);
        double[] pix = wcs.skyToPixel(sky[0], sky[1]);

        assertThat(pix[0]).isCloseTo(12.25, within(1e-6));
        assertThat(pix[1]).isCloseTo(77.5, within(1e-6));
    }

    @Test
    void raIncreasesToTheLeft() {
        double[] east = wcs.skyToPixel(150.0 + 10 * SCALE, 2.0);

        assertThat(east[0]).isLessThan(50.0);
    }

    @Test
    void shifted_movesReferencePixel() {
        Map<String, Object> cards = wcs.shifted(10, 5).toHeaderCards();

        assertEquals(41.0, (Double) cards.get("CRPIX1"));
        assertEquals(36.0, (Double) cards.get("CRPIX2"));
        assertEquals("RA---TAN", cards.get("CTYPE1"));
        assertThat(cards).containsKeys("CRVAL1", "CRVAL2", "CD1_1", "CD1_2", "CD2_1", "CD2_2");
    }

    @Test
    void fromHeader_acceptsPcCdeltForm() throws Exception {
        Header h = new Header();
        h.addValue("CTYPE1", "RA---TAN", null);
        h.addValue("CTYPE2", "DEC--TAN", null);
        h.addValue("CRVAL1", 150.0, null);
        h.addValue("CRVAL2", 2.0, null);
        h.addValue("CRPIX1", 51.0, null);
        h.addValue("CRPIX2", 41.0, null);
        h.addValue("CDELT1", -SCALE, null);
        h.addValue("CDELT2", SCALE, null);

        double[] p = TanProjection.fromHeader(h).skyToPixel(150.0, 2.0);

        assertThat(p[0]).isCloseTo(50.0, within(1e-9));
        assertThat(p[1]).isCloseTo(40.0, within(1e-9));
    }

    @Test
    void fromHeader_rejectsOtherProjectionsAndMissingCards() throws Exception {
        Header sin = new Header();
        sin.addValue("CTYPE1", "RA---SIN", null);
        sin.addValue("CTYPE2", "DEC--SIN", null);
        assertThatThrownBy(() -> TanProjection.fromHeader(sin)).isInstanceOf(ExtractionException.class);

        Header bare = new Header();
        bare.addValue("CRVAL1", 150.0, null);
        assertThatThrownBy(() -> TanProjection.fromHeader(bare))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("CRVAL2");
    }

    @Test
    void singularMatrixAndFarSide_areExtractionErrors() {
        assertThatThrownBy(() -> new TanProjection(0, 0, 1, 1, 0, 0, 0, 0))
                .isInstanceOf(ExtractionException.class);
        assertThatThrownBy(() -> wcs.skyToPixel(330.0, -2.0))
                .isInstanceOf(ExtractionException.class);
    }
}
