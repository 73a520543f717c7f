// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper;

/**
 * Where the content of a media item source is stored.
 *
 * @author Jürgen Moßgraber
 */
public enum SourceKind
{
    /** The content is stored in the project file, e.g. MIDI events. */
    EMBEDDED_DATA,
    /** The source references an external file. */
    FILE_REFERENCE
}
