// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper.model;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;


/**
 * A parameter of a node. Keeps the parsed value together with the text it was read from. Since
 * the text is written back unchanged, parameters which are not replaced are formatted exactly as
 * they were read.
 *
 * @author Jürgen Moßgraber
 */
public final class Parameter
{
    /** The characters which can be used to quote a string, in order of preference. */
    static final char []         QUOTES                       =
    {
        '"',
        '\'',
        '`'
    };

    private static final Pattern CANONICAL_IDENTIFIER_PATTERN = Pattern.compile ("\\{[0-9A-Fa-f]{8}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{12}\\}");

    private final ParameterType  type;
    private final String         value;
    private final String         text;


    /**
     * Constructor.
     *
     * @param type The type of the value
     * @param value The value, without quotes
     * @param text The text representation as it appears in a file
     */
    private Parameter (final ParameterType type, final String value, final String text)
    {
        this.type = type;
        this.value = value;
        this.text = text;
    }


    /**
     * Create a parameter from the text read from a file.
     *
     * @param type The type of the value
     * @param value The value, without quotes
     * @param text The original text
     * @return The parameter
     */
    static Parameter parsed (final ParameterType type, final String value, final String text)
    {
        return new Parameter (type, value, text);
    }


    /**
     * Create a numeric parameter. The number is formatted with the minimal number of digits
     * which still parse back to the same value.
     *
     * @param number The number
     * @return The parameter
     */
    public static Parameter ofNumber (final double number)
    {
        final String formatted = formatNumber (number);
        return new Parameter (ParameterType.classify (formatted), formatted, formatted);
    }


    /**
     * Create an integer parameter.
     *
     * @param number The number
     * @return The parameter
     */
    public static Parameter ofInteger (final long number)
    {
        final String formatted = Long.toString (number);
        return new Parameter (ParameterType.INTEGER, formatted, formatted);
    }


    /**
     * Create a quoted string parameter.
     *
     * @param value The string value
     * @return The parameter
     * @throws IllegalArgumentException The value cannot be written in a project file, see
     *             {@link #isQuotable(String)}
     */
    public static Parameter ofString (final String value)
    {
        return new Parameter (ParameterType.STRING, value, quote (value));
    }


    /**
     * Create an unquoted parameter.
     *
     * @param word The word, must not be empty or contain whitespace and must not start with a
     *            quote character
     * @return The parameter
     */
    public static Parameter ofBareword (final String word)
    {
        if (word.isEmpty () || startsWithQuote (word) || word.chars ().anyMatch (Character::isWhitespace))
            throw new IllegalArgumentException ("Not a valid unquoted parameter: '" + word + "'");
        return new Parameter (ParameterType.classify (word), word, word);
    }


    /**
     * Create an identifier parameter in the canonical form, e.g.
     * {0AB3E6E2-3A7B-4E4C-9E2D-2B8A1E3F7C11}.
     *
     * @param uuid The UUID
     * @return The parameter
     */
    public static Parameter ofIdentifier (final UUID uuid)
    {
        final String identifier = formatIdentifier (uuid);
        return new Parameter (ParameterType.IDENTIFIER, identifier, identifier);
    }


    /**
     * Format a UUID as a brace delimited upper-case identifier.
     *
     * @param uuid The UUID
     * @return The formatted identifier
     */
    public static String formatIdentifier (final UUID uuid)
    {
        return "{" + uuid.toString ().toUpperCase (Locale.US) + "}";
    }


    /**
     * Format a number with the minimal number of digits which still parse back to the same
     * double value. No exponent is used.
     *
     * @param number The number to format
     * @return The formatted number
     */
    public static String formatNumber (final double number)
    {
        if (!Double.isFinite (number))
            throw new IllegalArgumentException ("Not a finite number: " + number);
        if (number == 0)
            return "0";
        return BigDecimal.valueOf (number).stripTrailingZeros ().toPlainString ();
    }


    /**
     * Check if a string can be written as a quoted parameter. This is not possible if it contains
     * line breaks or other control characters or if none of the quote characters can enclose it
     * without ambiguity.
     *
     * @param value The value to check
     * @return True if it can be quoted
     */
    public static boolean isQuotable (final String value)
    {
        return findQuote (value) != 0;
    }


    /**
     * Get the type of the value.
     *
     * @return The type
     */
    public ParameterType getType ()
    {
        return this.type;
    }


    /**
     * Get the value. Strings are returned without quotes.
     *
     * @return The value
     */
    public String getValue ()
    {
        return this.value;
    }


    /**
     * Get the text as it is written to a project file.
     *
     * @return The text
     */
    public String getText ()
    {
        return this.text;
    }


    /**
     * Is this an integer or decimal value?
     *
     * @return True if numeric
     */
    public boolean isNumeric ()
    {
        return this.type.isNumeric ();
    }


    /**
     * Is this an identifier in the 8-4-4-4-12 hex grouping?
     *
     * @return True if canonical identifier
     */
    public boolean isCanonicalIdentifier ()
    {
        return this.type == ParameterType.IDENTIFIER && CANONICAL_IDENTIFIER_PATTERN.matcher (this.value).matches ();
    }


    /**
     * Get the value as a double.
     *
     * @return The value
     * @throws NumberFormatException The parameter is not numeric
     */
    public double asDouble ()
    {
        if (!this.isNumeric ())
            throw new NumberFormatException ("Not a number: '" + this.value + "'");
        return Double.parseDouble (this.value);
    }


    /**
     * Get the value as a long.
     *
     * @return The value
     * @throws NumberFormatException The parameter is not an integer or too large
     */
    public long asLong ()
    {
        if (this.type != ParameterType.INTEGER)
            throw new NumberFormatException ("Not an integer: '" + this.value + "'");
        return Long.parseLong (this.value.startsWith ("+") ? this.value.substring (1) : this.value);
    }


    /** {@inheritDoc} */
    @Override
    public boolean equals (final Object obj)
    {
        if (this == obj)
            return true;
        if (!(obj instanceof final Parameter other))
            return false;
        return this.type == other.type && this.value.equals (other.value);
    }


    /** {@inheritDoc} */
    @Override
    public int hashCode ()
    {
        return Objects.hash (this.type, this.value);
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return this.text;
    }


    private static String quote (final String value)
    {
        final char quote = findQuote (value);
        if (quote == 0)
            throw new IllegalArgumentException ("The text cannot be written as a parameter: '" + value + "'");
        return quote + value + quote;
    }


    /**
     * Find a quote character which can enclose the given value. A quote character can be used if
     * the value contains it neither in front of whitespace nor at its end (both would terminate
     * the string) nor after a backslash (would be read as an escaped quote).
     *
     * @param value The value to quote
     * @return The quote character or 0 if none is usable
     */
    private static char findQuote (final String value)
    {
        for (int i = 0; i < value.length (); i++)
        {
            if (Character.isISOControl (value.charAt (i)))
                return 0;
        }

        for (final char quote: QUOTES)
        {
            if (canEnclose (value, quote))
                return quote;
        }
        return 0;
    }


    private static boolean canEnclose (final String value, final char quote)
    {
        final int length = value.length ();
        for (int i = 0; i < length; i++)
        {
            if (value.charAt (i) != quote)
                continue;
            if (i + 1 == length || Character.isWhitespace (value.charAt (i + 1)))
                return false;
            if (i > 0 && value.charAt (i - 1) == '\\')
                return false;
        }
        return true;
    }


    private static boolean startsWithQuote (final String word)
    {
        final char first = word.charAt (0);
        for (final char quote: QUOTES)
        {
            if (first == quote)
                return true;
        }
        return false;
    }
}
