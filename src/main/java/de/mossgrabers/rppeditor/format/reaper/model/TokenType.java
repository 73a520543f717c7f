// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper.model;

/**
 * The kinds of lines in a Reaper project file.
 *
 * @author Jürgen Moßgraber
 */
public enum TokenType
{
    /** Opens a chunk, e.g. '&lt;TRACK {...}'. */
    BLOCK_OPEN,
    /** Closes the current chunk: '&gt;'. */
    BLOCK_CLOSE,
    /** A single line node, e.g. 'TEMPO 120 4 4'. */
    DIRECTIVE,
    /** A blank or comment line. */
    COMMENT
}
