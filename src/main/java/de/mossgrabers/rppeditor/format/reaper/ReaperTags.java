// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper;

/**
 * Tags used in Reaper project files.
 *
 * @author Jürgen Moßgraber
 */
public class ReaperTags
{
    protected static final String PROJECT_ROOT             = "REAPER_PROJECT";
    protected static final String PROJECT_TEMPO            = "TEMPO";
    protected static final String PROJECT_SAMPLERATE       = "SAMPLERATE";
    protected static final String PROJECT_RENDER_FILE      = "RENDER_FILE";

    protected static final String CHUNK_TRACK              = "TRACK";
    protected static final String TRACK_NAME               = "NAME";
    protected static final String TRACK_ID                 = "TRACKID";
    protected static final String TRACK_COLOR              = "PEAKCOL";
    protected static final String TRACK_BEAT               = "BEAT";
    protected static final String TRACK_AUTOMATION_MODE    = "AUTOMODE";
    protected static final String TRACK_VOLUME_PAN         = "VOLPAN";
    protected static final String TRACK_MUTE_SOLO          = "MUTESOLO";
    protected static final String TRACK_STRUCTURE          = "ISBUS";
    protected static final String TRACK_NUMBER_OF_CHANNELS = "NCHAN";
    protected static final String TRACK_FX_ENABLED         = "FX";
    protected static final String TRACK_MIDI_OUT           = "MIDIOUT";
    protected static final String TRACK_MAIN_SEND          = "MAINSEND";

    protected static final String CHUNK_FXCHAIN            = "FXCHAIN";
    protected static final String FXCHAIN_SHOW             = "SHOW";
    protected static final String FXCHAIN_LAST_SELECTED    = "LASTSEL";
    protected static final String FXCHAIN_DOCKED           = "DOCKED";
    protected static final String FXCHAIN_BYPASS           = "BYPASS";
    protected static final String FXCHAIN_FLOAT_POSITION   = "FLOATPOS";
    protected static final String FXCHAIN_FX_ID            = "FXID";
    protected static final String FXCHAIN_WAK              = "WAK";
    protected static final String CHUNK_VST                = "VST";

    protected static final String CHUNK_ITEM               = "ITEM";
    protected static final String ITEM_NAME                = "NAME";
    protected static final String ITEM_POSITION            = "POSITION";
    protected static final String ITEM_SNAP_OFFSET         = "SNAPOFFS";
    protected static final String ITEM_LENGTH              = "LENGTH";
    protected static final String ITEM_LOOP                = "LOOP";
    protected static final String ITEM_ALL_TAKES           = "ALLTAKES";
    protected static final String ITEM_FADEIN              = "FADEIN";
    protected static final String ITEM_FADEOUT             = "FADEOUT";
    protected static final String ITEM_MUTE                = "MUTE";
    protected static final String ITEM_SELECTED            = "SEL";
    protected static final String ITEM_ID                  = "IGUID";
    protected static final String ITEM_INDEX               = "IID";
    protected static final String ITEM_VOLUME_PAN          = "VOLPAN";
    protected static final String ITEM_SAMPLE_OFFSET       = "SOFFS";
    protected static final String ITEM_PLAYRATE            = "PLAYRATE";
    protected static final String ITEM_CHANNEL_MODE        = "CHANMODE";
    protected static final String ITEM_TAKE_ID             = "GUID";

    protected static final String CHUNK_ITEM_SOURCE        = "SOURCE";
    protected static final String SOURCE_TYPE_MIDI         = "MIDI";
    protected static final String SOURCE_FILE              = "FILE";


    /**
     * Constructor.
     */
    private ReaperTags ()
    {
        // Intentionally empty
    }
}
