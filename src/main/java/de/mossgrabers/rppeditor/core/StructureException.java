// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.core;

/**
 * The chunk structure is broken (unbalanced nesting) or an edit tried to place or remove a node
 * where the structure does not allow it.
 *
 * @author Jürgen Moßgraber
 */
public class StructureException extends ReaperProjectException
{
    private static final long serialVersionUID = 8151020385512306731L;


    /**
     * Constructor for errors detected while parsing.
     *
     * @param message The error message
     * @param lineNumber The 1-based number of the offending line
     */
    public StructureException (final String message, final int lineNumber)
    {
        super (message, lineNumber);
    }


    /**
     * Constructor for errors detected while editing.
     *
     * @param message The error message
     */
    public StructureException (final String message)
    {
        super (message, NO_LINE);
    }
}
