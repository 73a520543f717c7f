// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper.model;

import java.util.regex.Pattern;


/**
 * The kinds of parameter values found in a Reaper project file.
 *
 * @author Jürgen Moßgraber
 */
public enum ParameterType
{
    /** A signed or unsigned integer, e.g. 960 or -1. */
    INTEGER,
    /** A floating point number, e.g. 0.0025 or 1.5e-3. */
    DECIMAL,
    /** A quoted string. */
    STRING,
    /** A brace delimited identifier, e.g. {0AB3E6E2-3A7B-4E4C-9E2D-2B8A1E3F7C11}. */
    IDENTIFIER,
    /** Any other unquoted token. */
    BAREWORD;


    private static final Pattern INTEGER_PATTERN    = Pattern.compile ("[+-]?\\d+");
    private static final Pattern DECIMAL_PATTERN    = Pattern.compile ("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile ("\\{[^{}\\s]+\\}");


    /**
     * Detect the type of an unquoted token.
     *
     * @param token The token text
     * @return The type
     */
    public static ParameterType classify (final String token)
    {
        if (INTEGER_PATTERN.matcher (token).matches ())
            return INTEGER;
        if (DECIMAL_PATTERN.matcher (token).matches ())
            return DECIMAL;
        if (IDENTIFIER_PATTERN.matcher (token).matches ())
            return IDENTIFIER;
        return BAREWORD;
    }


    /**
     * Is this a numeric type?
     *
     * @return True if integer or decimal
     */
    public boolean isNumeric ()
    {
        return this == INTEGER || this == DECIMAL;
    }
}
