// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.core;

/**
 * Base class of all errors raised while reading, editing or writing a Reaper project.
 *
 * @author Jürgen Moßgraber
 */
public abstract class ReaperProjectException extends Exception
{
    private static final long serialVersionUID = 5073418221466729190L;

    /** Marks that the error is not related to a specific line. */
    public static final int   NO_LINE          = -1;

    private final int         lineNumber;


    /**
     * Constructor.
     *
     * @param message The error message
     * @param lineNumber The 1-based line number at which the error was detected or NO_LINE
     */
    protected ReaperProjectException (final String message, final int lineNumber)
    {
        super (lineNumber == NO_LINE ? message : message + " (line " + lineNumber + ")");
        this.lineNumber = lineNumber;
    }


    /**
     * Get the line number at which the error was detected.
     *
     * @return The 1-based line number or NO_LINE
     */
    public int getLineNumber ()
    {
        return this.lineNumber;
    }
}
