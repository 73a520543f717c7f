// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper;

import java.util.Locale;


/**
 * Selects a track when searching the tracks of a project.
 *
 * @author Jürgen Moßgraber
 */
@FunctionalInterface
public interface TrackSelector
{
    /**
     * Test a track.
     *
     * @param track The track
     * @param index The index of the track among all tracks of the project
     * @return True if the track matches
     */
    boolean matches (ReaperTrack track, int index);


    /**
     * Select tracks by their name.
     *
     * @param name The name, must be equal
     * @return The selector
     */
    static TrackSelector byName (final String name)
    {
        return (track, index) -> track.getName ().equals (name);
    }


    /**
     * Select a track by its position.
     *
     * @param trackIndex The 0-based index among all tracks
     * @return The selector
     */
    static TrackSelector byIndex (final int trackIndex)
    {
        return (track, index) -> index == trackIndex;
    }


    /**
     * Select a track by its identifier. The case of the hex digits is ignored.
     *
     * @param identifier The identifier including the braces
     * @return The selector
     */
    static TrackSelector byIdentifier (final String identifier)
    {
        final String upperCaseIdentifier = identifier.toUpperCase (Locale.US);
        return (track, index) -> track.getIdentifier ().map (id -> id.toUpperCase (Locale.US).equals (upperCaseIdentifier)).orElse (Boolean.FALSE).booleanValue ();
    }
}
