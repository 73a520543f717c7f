// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import java.util.UUID;


class ParameterTest
{
    @Test
    void numbersAreFormattedWithoutTrailingZeros ()
    {
        assertThat (Parameter.formatNumber (120.0)).isEqualTo ("120");
        assertThat (Parameter.formatNumber (8.5)).isEqualTo ("8.5");
        assertThat (Parameter.formatNumber (0.0025)).isEqualTo ("0.0025");
        assertThat (Parameter.formatNumber (-0.0)).isEqualTo ("0");
        assertThat (Parameter.formatNumber (1e21)).isEqualTo ("1000000000000000000000");
    }


    @Test
    void nonFiniteNumbersAreRejected ()
    {
        assertThatThrownBy ( () -> Parameter.formatNumber (Double.NaN)).isInstanceOf (IllegalArgumentException.class);
        assertThatThrownBy ( () -> Parameter.ofNumber (Double.POSITIVE_INFINITY)).isInstanceOf (IllegalArgumentException.class);
    }


    @Test
    void typeOfNumberFollowsFormattedText ()
    {
        assertThat (Parameter.ofNumber (4.0).getType ()).isEqualTo (ParameterType.INTEGER);
        assertThat (Parameter.ofNumber (4.25).getType ()).isEqualTo (ParameterType.DECIMAL);
        assertThat (Parameter.ofNumber (4.25).asDouble ()).isEqualTo (4.25);
    }


    @Test
    void stringsUseTheFirstQuoteWhichCanEncloseThem ()
    {
        assertThat (Parameter.ofString ("Drums").getText ()).isEqualTo ("\"Drums\"");
        assertThat (Parameter.ofString ("").getText ()).isEqualTo ("\"\"");
        assertThat (Parameter.ofString ("say \"hi\" now").getText ()).isEqualTo ("'say \"hi\" now'");
        assertThat (Parameter.ofString ("it' \"x\" ok").getText ()).isEqualTo ("`it' \"x\" ok`");

        // A quote which is not followed by whitespace does not end the string
        assertThat (Parameter.ofString ("a\"b").getText ()).isEqualTo ("\"a\"b\"");
    }


    @Test
    void unquotableStringsAreRejected ()
    {
        assertThat (Parameter.isQuotable ("a\" b' c` d")).isFalse ();
        assertThat (Parameter.isQuotable ("line\nbreak")).isFalse ();
        assertThatThrownBy ( () -> Parameter.ofString ("tab\there")).isInstanceOf (IllegalArgumentException.class);
    }


    @Test
    void identifiersAreUpperCaseInBraces ()
    {
        final UUID uuid = UUID.fromString ("0a1b2c3d-4e5f-6a7b-8c9d-0e1f2a3b4c5d");
        final Parameter identifier = Parameter.ofIdentifier (uuid);
        assertThat (identifier.getText ()).isEqualTo ("{0A1B2C3D-4E5F-6A7B-8C9D-0E1F2A3B4C5D}");
        assertThat (identifier.isCanonicalIdentifier ()).isTrue ();
        assertThat (Parameter.ofBareword ("{not-a-guid}").isCanonicalIdentifier ()).isFalse ();
        assertThat (Parameter.ofBareword ("{not-a-guid}").getType ()).isEqualTo (ParameterType.IDENTIFIER);
    }


    @Test
    void barewordsMustNotContainWhitespaceOrStartWithAQuote ()
    {
        assertThat (Parameter.ofBareword ("MIDI").getType ()).isEqualTo (ParameterType.BAREWORD);
        assertThatThrownBy ( () -> Parameter.ofBareword ("two words")).isInstanceOf (IllegalArgumentException.class);
        assertThatThrownBy ( () -> Parameter.ofBareword ("\"quoted")).isInstanceOf (IllegalArgumentException.class);
        assertThatThrownBy ( () -> Parameter.ofBareword ("")).isInstanceOf (IllegalArgumentException.class);
    }


    @Test
    void conversionsRequireMatchingType ()
    {
        assertThat (Parameter.ofBareword ("+12").asLong ()).isEqualTo (12L);
        assertThat (Parameter.ofBareword ("-3").asDouble ()).isEqualTo (-3.0);
        assertThatThrownBy ( () -> Parameter.ofBareword ("1.5").asLong ()).isInstanceOf (NumberFormatException.class);
        assertThatThrownBy ( () -> Parameter.ofString ("12").asDouble ()).isInstanceOf (NumberFormatException.class);
    }


    @Test
    void equalityIgnoresTheOriginalText ()
    {
        assertThat (Parameter.ofString ("x")).isEqualTo (Parameter.parsed (ParameterType.STRING, "x", "'x'"));
        assertThat (Parameter.ofString ("12")).isNotEqualTo (Parameter.ofInteger (12));
    }
}
