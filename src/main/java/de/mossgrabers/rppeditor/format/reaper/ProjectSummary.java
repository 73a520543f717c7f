// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper;

import de.mossgrabers.rppeditor.core.ReferenceException;
import de.mossgrabers.rppeditor.core.ValidationException;
import de.mossgrabers.rppeditor.format.reaper.model.Parameter;
import de.mossgrabers.rppeditor.format.reaper.model.ReaperDocument;

import java.util.List;
import java.util.Optional;


/**
 * Creates a short, human readable description of the content of a project.
 *
 * @author Jürgen Moßgraber
 */
public class ProjectSummary
{
    private static final String EMBEDDED = "(embedded)";


    /**
     * Constructor.
     */
    private ProjectSummary ()
    {
        // Intentionally empty
    }


    /**
     * Describe the tempo, time signature and the tracks with their MIDI items. Lines are
     * separated by a line-feed.
     *
     * @param document The project
     * @return The description
     * @throws ValidationException A track or item of the project is malformed
     * @throws ReferenceException An item references a malformed path
     */
    public static String describe (final ReaperDocument document) throws ValidationException, ReferenceException
    {
        final int [] timeSignature = ReaperAccessors.getTimeSignature (document);
        final List<ReaperTrack> tracks = ReaperAccessors.getTracks (document);

        final StringBuilder sb = new StringBuilder ();
        sb.append ("Tempo: ").append (Parameter.formatNumber (ReaperAccessors.getTempo (document))).append (" BPM\n");
        sb.append ("Time Signature: ").append (timeSignature[0]).append ('/').append (timeSignature[1]).append ('\n');
        sb.append ("Tracks: ").append (tracks.size ());

        for (final ReaperTrack track: tracks)
        {
            sb.append ("\n  - ").append (track.getName ());
            for (final ReaperItem item: track.getItems ())
            {
                final ReaperSource source = item.getSource ();
                if (!ReaperTags.SOURCE_TYPE_MIDI.equalsIgnoreCase (source.getType ()))
                    continue;
                sb.append ("\n      MIDI: ").append (getFileName (source.getFilePath ())).append (" at ").append (Parameter.formatNumber (item.getPosition ())).append ('s');
            }
        }
        return sb.toString ();
    }


    private static String getFileName (final Optional<String> filePath)
    {
        if (filePath.isEmpty ())
            return EMBEDDED;
        final String path = filePath.get ();
        return path.substring (Math.max (path.lastIndexOf ('/'), path.lastIndexOf ('\\')) + 1);
    }
}
