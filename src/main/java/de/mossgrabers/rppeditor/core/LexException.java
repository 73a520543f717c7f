// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.core;

/**
 * A line of a project file could not be split into tokens, e.g. a quoted string is not
 * terminated.
 *
 * @author Jürgen Moßgraber
 */
public class LexException extends ReaperProjectException
{
    private static final long serialVersionUID = -2810443517632410829L;


    /**
     * Constructor.
     *
     * @param message The error message
     * @param lineNumber The 1-based number of the offending line
     */
    public LexException (final String message, final int lineNumber)
    {
        super (message, lineNumber);
    }
}
