// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.core;

/**
 * A value is out of range or malformed, e.g. a negative item length or a tempo outside of the
 * supported range.
 *
 * @author Jürgen Moßgraber
 */
public class ValidationException extends ReaperProjectException
{
    private static final long serialVersionUID = -6934419520076150627L;

    private final String      field;


    /**
     * Constructor.
     *
     * @param field The name of the field which failed the validation
     * @param message The error message
     */
    public ValidationException (final String field, final String message)
    {
        super (field + ": " + message, NO_LINE);
        this.field = field;
    }


    /**
     * Get the name of the field which failed the validation.
     *
     * @return The field name
     */
    public String getField ()
    {
        return this.field;
    }
}
