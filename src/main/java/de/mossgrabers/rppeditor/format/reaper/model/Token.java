// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper.model;

import java.util.Collections;
import java.util.List;


/**
 * One line of a Reaper project file split into its parts.
 *
 * @author Jürgen Moßgraber
 */
public class Token
{
    private final TokenType       type;
    private final String          line;
    private final String          lineEnding;
    private final int             lineNumber;
    private final String          indent;
    private final String          tag;
    private final List<Parameter> parameters;


    /**
     * Constructor.
     *
     * @param type The type of the line
     * @param line The raw text of the line without the line separator
     * @param lineEnding The line separator which terminated the line, empty if there was none
     * @param lineNumber The 1-based line number
     * @param indent The whitespace in front of the content
     * @param tag The node name, empty for closing and comment lines
     * @param parameters The parameters following the tag
     */
    public Token (final TokenType type, final String line, final String lineEnding, final int lineNumber, final String indent, final String tag, final List<Parameter> parameters)
    {
        this.type = type;
        this.line = line;
        this.lineEnding = lineEnding;
        this.lineNumber = lineNumber;
        this.indent = indent;
        this.tag = tag;
        this.parameters = Collections.unmodifiableList (parameters);
    }


    public TokenType getType ()
    {
        return this.type;
    }


    public String getLine ()
    {
        return this.line;
    }


    public String getLineEnding ()
    {
        return this.lineEnding;
    }


    public int getLineNumber ()
    {
        return this.lineNumber;
    }


    public String getIndent ()
    {
        return this.indent;
    }


    public String getTag ()
    {
        return this.tag;
    }


    public List<Parameter> getParameters ()
    {
        return this.parameters;
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return this.type + "@" + this.lineNumber + ": " + this.line;
    }
}
