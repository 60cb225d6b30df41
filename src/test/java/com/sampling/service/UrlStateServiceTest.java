package com.sampling.service;

import com.sampling.model.CalculatorInput;
import java.util.Locale;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UrlStateServiceTest {

    private final CalculatorInput custom =
            new CalculatorInput(1234.5, null, 0.8, 2.0, 2.4, 9576, 6388, 2, 1.5, null);

    @Test
    void encode_defaultsGiveEmptyString() {
        assertEquals("", UrlStateService.encodeState(CalculatorInput.defaults()));
    }

    @Test
    void encode_onlyNonDefaultValues() {
        assertEquals("?fl=1000", UrlStateService.encodeState(CalculatorInput.defaults().withBaseFocalLength(1000)));
        assertEquals("?px=2.4&bin=2",
                UrlStateService.encodeState(CalculatorInput.defaults().withPixelSize(2.4).withBinning(2)));
    }

    @Test
    void encode_ignoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.GERMANY);
            assertEquals("?px=2.4", UrlStateService.encodeState(CalculatorInput.defaults().withPixelSize(2.4)));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void encode_missingApertureAsEmptyParameter() {
        assertEquals("?ap=", UrlStateService.encodeState(CalculatorInput.defaults().withoutAperture()));
    }

    @Test
    void decode_emptyApertureMeansNoAperture() {
        UrlState state = UrlStateService.decodeState("?ap=");
        assertFalse(state.inputA.hasAperture());
    }

    @Test
    void decode_absentApertureKeepsDefault() {
        UrlState state = UrlStateService.decodeState("?fl=1000");
        assertEquals(1000, state.inputA.baseFocalLength);
        assertEquals(200.0, state.inputA.apertureDiameter().getAsDouble());
    }

    @Test
    void roundTrip() {
        UrlState state = UrlStateService.decodeState(UrlStateService.encodeState(custom));
        assertEquals(custom, state.inputA);
        assertFalse(state.compareMode);
    }

    @Test
    void decode_withoutLeadingQuestionMark() {
        assertEquals(1000, UrlStateService.decodeState("fl=1000").inputA.baseFocalLength);
    }

    @Test
    void decode_nullOrBlankGivesDefaults() {
        assertEquals(CalculatorInput.defaults(), UrlStateService.decodeState(null).inputA);
        assertEquals(CalculatorInput.defaults(), UrlStateService.decodeState("  ").inputA);
    }

    @Test
    void decode_invalidValuesFallBackToDefaults() {
        CalculatorInput in = UrlStateService.decodeState("?fl=abc&bin=7&see=0.05&px=2,4&sw=-3&rd=").inputA;
        assertEquals(CalculatorInput.defaults(), in);
    }

    @Test
    void decode_outOfRangeApertureKeepsDefault() {
        assertEquals(200.0, UrlStateService.decodeState("?ap=20000").inputA.apertureDiameter().getAsDouble());
    }

    @Test
    void decode_ignoresUnknownKeys() {
        UrlState state = UrlStateService.decodeState("?foo=bar&fl=900");
        assertEquals(900, state.inputA.baseFocalLength);
    }

    @Test
    void compareMode_roundTrip() {
        CalculatorInput b = CalculatorInput.defaults().withBaseFocalLength(1200).withSeeing(3.0);
        String query = UrlStateService.encodeState(custom, b, true);
        assertTrue(query.contains("cmp=1"), query);
        assertTrue(query.contains("bfl=1200"), query);

        UrlState state = UrlStateService.decodeState(query);
        assertTrue(state.compareMode);
        assertEquals(custom, state.inputA);
        assertEquals(b, state.inputB);
    }

    @Test
    void setupB_ignoredWithoutCompareFlag() {
        UrlState state = UrlStateService.decodeState("?bfl=1200");
        assertFalse(state.compareMode);
        assertEquals(CalculatorInput.defaults(), state.inputB);
    }

    @Test
    void setupB_startsFromDefaultsNotFromA() {
        UrlState state = UrlStateService.decodeState("?fl=1500&cmp=1");
        assertEquals(1500, state.inputA.baseFocalLength);
        assertEquals(800, state.inputB.baseFocalLength);
    }

    @Test
    void encode_setupBOnlyInCompareMode() {
        CalculatorInput b = CalculatorInput.defaults().withBaseFocalLength(1200);
        assertEquals("?fl=1000", UrlStateService.encodeState(CalculatorInput.defaults().withBaseFocalLength(1000), b, false));
    }

    @Test
    void shareableUrl_replacesQueryAndFragment() {
        String url = UrlStateService.buildShareableUrl("https://example.org/calc?fl=5#top",
                CalculatorInput.defaults().withBaseFocalLength(1000), null, false);
        assertEquals("https://example.org/calc?fl=1000", url);
    }

    @Test
    void format_dropsTrailingZeros() {
        assertEquals("1000", UrlStateService.format(1000.0));
        assertEquals("0.7", UrlStateService.format(0.7));
        assertEquals("3.76", UrlStateService.format(3.76));
    }

    @Test
    void queryOf_pastedUrl() {
        assertEquals("?fl=1000", UrlStateService.queryOf(" https://example.org/calc?fl=1000#top "));
        assertEquals("", UrlStateService.queryOf("https://example.org/calc"));
        assertEquals("", UrlStateService.queryOf(null));
    }

    @Test
    void roundTrip_valueJustOffDefault() {
        CalculatorInput in = CalculatorInput.defaults().withPixelSize(3.76005).withSeeing(2.00002);
        String query = UrlStateService.encodeState(in);
        assertEquals("?px=3.76005&see=2.00002", query);
        assertEquals(in, UrlStateService.decodeState(query).inputA);
    }

    @Test
    void encode_differenceBelowEqualityToleranceIsDefault() {
        assertEquals("", UrlStateService.encodeState(CalculatorInput.defaults().withPixelSize(3.7600000001)));
    }
}
