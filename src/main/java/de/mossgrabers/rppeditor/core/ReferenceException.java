// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.core;

/**
 * A file reference is not a syntactically valid path. The existence of the file is never
 * checked.
 *
 * @author Jürgen Moßgraber
 */
public class ReferenceException extends ReaperProjectException
{
    private static final long serialVersionUID = 2716950349811324035L;

    private final String      path;


    /**
     * Constructor.
     *
     * @param path The invalid path
     * @param message The error message
     */
    public ReferenceException (final String path, final String message)
    {
        super (message, NO_LINE);
        this.path = path;
    }


    /**
     * Get the invalid path.
     *
     * @return The path
     */
    public String getPath ()
    {
        return this.path;
    }
}
