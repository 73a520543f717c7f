// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper.model;

import de.mossgrabers.rppeditor.core.LexException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;


/**
 * Splits the text of a Reaper project file into tokens, one per line. The text is processed in a
 * single forward pass, a line is only split when its' token is requested.
 *
 * @author Jürgen Moßgraber
 */
public class ReaperTokenizer
{
    /** The line separator used in files written by Reaper on Windows. */
    public static final String CRLF                  = "\r\n";
    /** The line separator used in files written by Reaper on Mac and Linux. */
    public static final String LF                    = "\n";

    private static final char  START_OF_CHUNK        = '<';
    private static final String END_OF_CHUNK         = ">";
    private static final char  START_OF_TEXT_LINE    = '|';
    private static final char  BYTE_ORDER_MARK       = '\uFEFF';

    private final String       text;
    private final boolean      hasByteOrderMark;
    private int                position;
    private int                lineNumber            = 0;
    private String             lineSeparator         = null;
    private boolean            endsWithLineSeparator = false;


    /**
     * Constructor.
     *
     * @param text The full content of a project file
     */
    public ReaperTokenizer (final String text)
    {
        this.text = text;
        this.hasByteOrderMark = !text.isEmpty () && text.charAt (0) == BYTE_ORDER_MARK;
        this.position = this.hasByteOrderMark ? 1 : 0;
    }


    /**
     * Are there more lines to tokenize?
     *
     * @return True if there are more lines
     */
    public boolean hasNext ()
    {
        return this.position < this.text.length ();
    }


    /**
     * Tokenize the next line.
     *
     * @return The token
     * @throws LexException The line could not be tokenized
     */
    public Token next () throws LexException
    {
        if (!this.hasNext ())
            throw new NoSuchElementException ();

        final int end = this.text.indexOf ('\n', this.position);
        String line;
        final String lineEnding;
        if (end < 0)
        {
            line = this.text.substring (this.position);
            lineEnding = "";
            this.position = this.text.length ();
            this.endsWithLineSeparator = false;
        }
        else
        {
            line = this.text.substring (this.position, end);
            this.position = end + 1;
            final boolean hasCarriageReturn = line.endsWith ("\r");
            if (hasCarriageReturn)
                line = line.substring (0, line.length () - 1);
            lineEnding = hasCarriageReturn ? CRLF : LF;
            if (this.lineSeparator == null)
                this.lineSeparator = lineEnding;
            this.endsWithLineSeparator = true;
        }

        this.lineNumber++;
        return tokenizeLine (line, lineEnding, this.lineNumber);
    }


    /**
     * Does the text start with a byte order mark? The mark is not part of the first line.
     *
     * @return True if there is a byte order mark
     */
    public boolean hasByteOrderMark ()
    {
        return this.hasByteOrderMark;
    }


    /**
     * Get the line separator of the text. Only valid after all lines have been read.
     *
     * @return The separator of the first line or null if the text is a single line
     */
    public String getLineSeparator ()
    {
        return this.lineSeparator;
    }


    /**
     * Does the text end with a line separator? Only valid after all lines have been read.
     *
     * @return True if it ends with a line separator
     */
    public boolean endsWithLineSeparator ()
    {
        return this.endsWithLineSeparator;
    }


    /**
     * Tokenize one line.
     *
     * @param line The line without the line separator
     * @param lineNumber The 1-based line number
     * @return The token
     * @throws LexException The line could not be tokenized
     */
    public static Token tokenizeLine (final String line, final int lineNumber) throws LexException
    {
        return tokenizeLine (line, "", lineNumber);
    }


    /**
     * Tokenize one line.
     *
     * @param line The line without the line separator
     * @param lineEnding The line separator which terminated the line, empty for the last line
     *            of a text without a final line separator
     * @param lineNumber The 1-based line number
     * @return The token
     * @throws LexException The line could not be tokenized
     */
    public static Token tokenizeLine (final String line, final String lineEnding, final int lineNumber) throws LexException
    {
        int start = 0;
        while (start < line.length () && Character.isWhitespace (line.charAt (start)))
            start++;
        final String indent = line.substring (0, start);
        final String content = line.substring (start);

        if (content.isEmpty () || content.startsWith ("#") || content.startsWith ("//"))
            return new Token (TokenType.COMMENT, line, lineEnding, lineNumber, indent, "", Collections.emptyList ());

        final String trimmed = content.strip ();
        if (END_OF_CHUNK.equals (trimmed))
            return new Token (TokenType.BLOCK_CLOSE, line, lineEnding, lineNumber, indent, "", Collections.emptyList ());

        // Text lines (e.g. project notes) are kept as a whole, they might contain unbalanced
        // quotes
        if (content.charAt (0) == START_OF_TEXT_LINE)
            return new Token (TokenType.DIRECTIVE, line, lineEnding, lineNumber, indent, trimmed, Collections.emptyList ());

        final boolean isChunk = content.charAt (0) == START_OF_CHUNK;
        final List<Parameter> parts = splitParameters (isChunk ? content.substring (1) : content, lineNumber);
        if (parts.isEmpty ())
            throw new LexException ("Chunk without a name", lineNumber);

        final String tag = parts.get (0).getValue ();
        final List<Parameter> parameters = new ArrayList<> (parts.subList (1, parts.size ()));
        return new Token (isChunk ? TokenType.BLOCK_OPEN : TokenType.DIRECTIVE, line, lineEnding, lineNumber, indent, tag, parameters);
    }


    /**
     * Splits the content of a line into its' parts. Handles strings quoted with double quotes,
     * single quotes and back-ticks. A quote character only starts a string at the beginning of a
     * part and only ends it when followed by whitespace or the end of the line.
     *
     * @param content The text to split
     * @param lineNumber The 1-based line number, for error reporting
     * @return The parts
     * @throws LexException A quoted string is not terminated
     */
    static List<Parameter> splitParameters (final String content, final int lineNumber) throws LexException
    {
        final List<Parameter> parts = new ArrayList<> ();
        final int length = content.length ();
        int index = 0;
        while (true)
        {
            while (index < length && Character.isWhitespace (content.charAt (index)))
                index++;
            if (index >= length)
                return parts;

            final char c = content.charAt (index);
            if (isQuote (c))
            {
                index = splitQuoted (content, index, c, parts, lineNumber);
                continue;
            }

            final int start = index;
            while (index < length && !Character.isWhitespace (content.charAt (index)))
                index++;
            final String word = content.substring (start, index);
            parts.add (Parameter.parsed (ParameterType.classify (word), word, word));
        }
    }


    /**
     * Reads a quoted string. A backslash followed by the quote character is an escaped quote
     * unless the quote terminates the string.
     *
     * @param content The text
     * @param start The index of the opening quote
     * @param quote The quote character
     * @param parts Where to add the string
     * @param lineNumber The 1-based line number, for error reporting
     * @return The index after the closing quote
     * @throws LexException The string is not terminated
     */
    private static int splitQuoted (final String content, final int start, final char quote, final List<Parameter> parts, final int lineNumber) throws LexException
    {
        final int length = content.length ();
        final StringBuilder value = new StringBuilder ();
        int index = start + 1;
        while (index < length)
        {
            final char c = content.charAt (index);
            if (c == '\\' && index + 2 < length && content.charAt (index + 1) == quote && !Character.isWhitespace (content.charAt (index + 2)))
            {
                value.append (quote);
                index += 2;
                continue;
            }
            if (c == quote && (index + 1 == length || Character.isWhitespace (content.charAt (index + 1))))
            {
                parts.add (Parameter.parsed (ParameterType.STRING, value.toString (), content.substring (start, index + 1)));
                return index + 1;
            }
            value.append (c);
            index++;
        }
        throw new LexException ("Unterminated quoted string: " + content.substring (start), lineNumber);
    }


    private static boolean isQuote (final char c)
    {
        for (final char quote: Parameter.QUOTES)
        {
            if (c == quote)
                return true;
        }
        return false;
    }
}
