// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper;

import de.mossgrabers.rppeditor.core.EditorConfig;
import de.mossgrabers.rppeditor.core.ReaperProjectException;
import de.mossgrabers.rppeditor.core.ReferenceException;
import de.mossgrabers.rppeditor.core.StructureException;
import de.mossgrabers.rppeditor.core.ValidationException;
import de.mossgrabers.rppeditor.format.reaper.model.Chunk;
import de.mossgrabers.rppeditor.format.reaper.model.Node;
import de.mossgrabers.rppeditor.format.reaper.model.Parameter;
import de.mossgrabers.rppeditor.format.reaper.model.ParameterType;
import de.mossgrabers.rppeditor.format.reaper.model.ReaperDocument;
import de.mossgrabers.rppeditor.format.reaper.model.ReaperProject;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;


/**
 * Edits a Reaper project. All functions modify the document in place. New nodes are appended to
 * their parent chunk, nodes and parameters which are not affected by an edit are not touched and
 * are therefore written exactly as they were read.
 *
 * @author Jürgen Moßgraber
 */
public class ReaperProjectEditor
{
    /** The lowest supported tempo. */
    public static final double MIN_TEMPO        = 20;
    /** The highest supported tempo. */
    public static final double MAX_TEMPO        = 960;

    private static final int       MAX_NUMERATOR        = 64;
    private static final int       MAX_DENOMINATOR      = 64;
    private static final int       TRACK_PEAK_COLOR     = 16576;
    private static final String    TEMPLATE_FOLDER      = "templates/";

    private static final String    INSTRUMENT_NAME      = "VSTi: ReaSynth (Cockos)";
    private static final String    INSTRUMENT_FILE      = "reasynth.vst.dylib";
    private static final String    INSTRUMENT_UNIQUE_ID = "1919251321<5653546872736E7265617379>";
    private static final String [] INSTRUMENT_STATE     =
    {
        "eXNlcu5e7f4CAAAAAQAAAAAAAAACAAAAAAAAAAIAAAABAAAAAAAAAAIAAAAAAAAAPAAAAAAAAAAAABA",
        "AAAAAAAAAAAAQAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA",
        "AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA",
        "AAAQAAAA"
    };


    /**
     * Constructor.
     */
    private ReaperProjectEditor ()
    {
        // Intentionally empty
    }


    /**
     * Create a new project without tracks from the configured template.
     *
     * @param config The configuration which provides the template, sample rate, tempo and line
     *            separator
     * @return The new project
     * @throws IOException The template could not be read
     * @throws ReaperProjectException The template is not a valid project or the configured values
     *             are out of range
     */
    public static ReaperDocument createProject (final EditorConfig config) throws IOException, ReaperProjectException
    {
        final String templateName = TEMPLATE_FOLDER + config.getTemplateName () + ".rpp";
        final String template;
        try (final InputStream in = ReaperProjectEditor.class.getResourceAsStream (templateName))
        {
            if (in == null)
                throw new FileNotFoundException ("Project template not found: " + templateName);
            template = new String (in.readAllBytes (), StandardCharsets.UTF_8);
        }

        // All lines of the new project use the configured line separator
        final String lineSeparator = config.getLineSeparator ();
        final ReaperDocument document = ReaperProject.parse (template.replace ("\r\n", "\n").replace ("\n", lineSeparator));
        final Chunk rootChunk = document.getRootChunk ();
        if (!ReaperTags.PROJECT_ROOT.equals (rootChunk.getName ()))
            throw new StructureException ("The template is not a Reaper project: " + templateName);

        document.setLineSeparator (lineSeparator);
        document.setEndsWithLineSeparator (true);

        // The third parameter is the time of creation
        if (rootChunk.getParameters ().size () >= 2)
            rootChunk.setParameter (2, Parameter.ofInteger (Instant.now ().getEpochSecond ()));

        final int sampleRate = config.getSampleRate ();
        if (sampleRate <= 0)
            throw new ValidationException (ReaperTags.PROJECT_SAMPLERATE, "Must be positive but is " + sampleRate + ".");
        final Optional<Node> sampleRateNode = rootChunk.getChildNode (ReaperTags.PROJECT_SAMPLERATE);
        if (sampleRateNode.isPresent ())
            sampleRateNode.get ().setParameter (0, Parameter.ofInteger (sampleRate));
        else
            insertBeforeTracks (rootChunk, createNode (ReaperTags.PROJECT_SAMPLERATE, Parameter.ofInteger (sampleRate), Parameter.ofInteger (0), Parameter.ofInteger (0)));

        setTempo (document, config.getTempo ());
        return document;
    }


    /**
     * Add a new track to the end of the project.
     *
     * @param document The project
     * @param name The name of the track
     * @return The new track
     * @throws ValidationException The name contains line breaks or other characters which cannot
     *             be written to a project file
     */
    public static ReaperTrack addTrack (final ReaperDocument document, final String name) throws ValidationException
    {
        if (name == null || !Parameter.isQuotable (name))
            throw new ValidationException (ReaperTags.CHUNK_TRACK + "." + ReaperTags.TRACK_NAME, "The name cannot be written to a project file: '" + name + "'.");

        final Parameter identifier = document.createIdentifier ();

        final Chunk trackChunk = new Chunk ();
        setNode (trackChunk, ReaperTags.CHUNK_TRACK, identifier);
        addNode (trackChunk, ReaperTags.TRACK_NAME, Parameter.ofString (name));
        addNode (trackChunk, ReaperTags.TRACK_COLOR, Parameter.ofInteger (TRACK_PEAK_COLOR));
        addNode (trackChunk, ReaperTags.TRACK_BEAT, Parameter.ofInteger (-1));
        addNode (trackChunk, ReaperTags.TRACK_AUTOMATION_MODE, Parameter.ofInteger (0));
        addNode (trackChunk, ReaperTags.TRACK_VOLUME_PAN, numbers (1, 0, -1, -1, 1));
        addNode (trackChunk, ReaperTags.TRACK_MUTE_SOLO, numbers (0, 0, 0));
        addNode (trackChunk, ReaperTags.TRACK_STRUCTURE, numbers (0, 0));
        addNode (trackChunk, ReaperTags.TRACK_NUMBER_OF_CHANNELS, Parameter.ofInteger (2));
        addNode (trackChunk, ReaperTags.TRACK_FX_ENABLED, Parameter.ofInteger (1));
        addNode (trackChunk, ReaperTags.TRACK_ID, identifier);
        addNode (trackChunk, ReaperTags.TRACK_MIDI_OUT, Parameter.ofInteger (-1));
        addNode (trackChunk, ReaperTags.TRACK_MAIN_SEND, numbers (1, 0));

        document.getRootChunk ().addChildNode (trackChunk);
        return ReaperAccessors.asTrack (trackChunk);
    }


    /**
     * Add a media item which references a MIDI file to the end of a track. The item loops its'
     * source. If the track has no effects chain yet, one with a synthesizer is added so that the
     * MIDI notes can be heard.
     *
     * @param document The project
     * @param track The track to which to add the item
     * @param filePath The path of the MIDI file, relative to the project folder; the existence of
     *            the file is not checked
     * @param startTime The start of the item in seconds, must not be negative
     * @param length The length of the item in seconds, must be positive
     * @return The new item
     * @throws ValidationException Start or length are out of range
     * @throws ReferenceException The path is malformed
     * @throws StructureException The track is not part of the project
     */
    public static ReaperItem addMidiItem (final ReaperDocument document, final ReaperTrack track, final String filePath, final double startTime, final double length) throws ValidationException, ReferenceException, StructureException
    {
        return addMidiItem (document, track, filePath, startTime, length, true);
    }


    /**
     * Add a media item which references a MIDI file to the end of a track. If the track has no
     * effects chain yet, one with a synthesizer is added in front of the items of the track. An
     * existing effects chain is not changed.
     *
     * @param document The project
     * @param track The track to which to add the item
     * @param filePath The path of the MIDI file, relative to the project folder; the existence of
     *            the file is not checked
     * @param startTime The start of the item in seconds, must not be negative
     * @param length The length of the item in seconds, must be positive
     * @param loop Loop the source if the item is longer than the source
     * @return The new item
     * @throws ValidationException Start or length are out of range or an item index of the
     *             project is not a valid number
     * @throws ReferenceException The path is malformed
     * @throws StructureException The track is not part of the project
     */
    public static ReaperItem addMidiItem (final ReaperDocument document, final ReaperTrack track, final String filePath, final double startTime, final double length, final boolean loop) throws ValidationException, ReferenceException, StructureException
    {
        if (!Double.isFinite (startTime) || startTime < 0)
            throw new ValidationException (ReaperTags.CHUNK_ITEM + "." + ReaperTags.ITEM_POSITION, "Must be a non-negative number but is " + startTime + ".");
        if (!Double.isFinite (length) || length <= 0)
            throw new ValidationException (ReaperTags.CHUNK_ITEM + "." + ReaperTags.ITEM_LENGTH, "Must be a positive number but is " + length + ".");
        ReaperAccessors.validatePath (filePath);

        final Chunk trackChunk = track.getChunk ();
        if (trackChunk.getParent () != document.getRootChunk ())
            throw new StructureException ("The track '" + track.getName () + "' is not part of the project.");
        final long itemIndex = getHighestItemIndex (document.getRootChunk ()) + 1L;

        if (trackChunk.getChildNode (ReaperTags.CHUNK_FXCHAIN).isEmpty ())
            addInstrument (document, trackChunk);

        final Parameter itemIdentifier = document.createIdentifier ();
        final Parameter takeIdentifier = document.createIdentifier ();

        final Chunk itemChunk = new Chunk ();
        setNode (itemChunk, ReaperTags.CHUNK_ITEM);
        addNode (itemChunk, ReaperTags.ITEM_POSITION, Parameter.ofNumber (startTime));
        addNode (itemChunk, ReaperTags.ITEM_SNAP_OFFSET, Parameter.ofInteger (0));
        addNode (itemChunk, ReaperTags.ITEM_LENGTH, Parameter.ofNumber (length));
        addNode (itemChunk, ReaperTags.ITEM_LOOP, Parameter.ofInteger (loop ? 1 : 0));
        addNode (itemChunk, ReaperTags.ITEM_ALL_TAKES, Parameter.ofInteger (0));
        addNode (itemChunk, ReaperTags.ITEM_FADEIN, numbers (1, 0.01, 0, 1, 0, 0, 0));
        addNode (itemChunk, ReaperTags.ITEM_FADEOUT, numbers (1, 0.01, 0, 1, 0, 0, 0));
        addNode (itemChunk, ReaperTags.ITEM_MUTE, numbers (0, 0));
        addNode (itemChunk, ReaperTags.ITEM_SELECTED, Parameter.ofInteger (0));
        addNode (itemChunk, ReaperTags.ITEM_ID, itemIdentifier);
        addNode (itemChunk, ReaperTags.ITEM_INDEX, Parameter.ofInteger (itemIndex));
        addNode (itemChunk, ReaperTags.ITEM_NAME, Parameter.ofString (getFileStem (filePath)));
        addNode (itemChunk, ReaperTags.ITEM_VOLUME_PAN, numbers (1, 0, 1, -1));
        addNode (itemChunk, ReaperTags.ITEM_SAMPLE_OFFSET, Parameter.ofInteger (0));
        addNode (itemChunk, ReaperTags.ITEM_PLAYRATE, numbers (1, 1, 0, -1, 0, 0.0025));
        addNode (itemChunk, ReaperTags.ITEM_CHANNEL_MODE, Parameter.ofInteger (0));
        addNode (itemChunk, ReaperTags.ITEM_TAKE_ID, takeIdentifier);

        final Chunk sourceChunk = addChunk (itemChunk, ReaperTags.CHUNK_ITEM_SOURCE, Parameter.ofBareword (ReaperTags.SOURCE_TYPE_MIDI));
        addNode (sourceChunk, ReaperTags.SOURCE_FILE, Parameter.ofString (filePath));

        trackChunk.addChildNode (itemChunk);
        return ReaperAccessors.asItem (itemChunk);
    }


    /**
     * Set the tempo of the project. Only the tempo parameter is changed, the time signature is
     * kept. If the project has no tempo yet, it is added in front of the first track.
     *
     * @param document The project
     * @param bpm The tempo in beats per minute, must be in the range of [20, 960]
     * @throws ValidationException The tempo is out of range
     */
    public static void setTempo (final ReaperDocument document, final double bpm) throws ValidationException
    {
        if (!Double.isFinite (bpm) || bpm < MIN_TEMPO || bpm > MAX_TEMPO)
            throw new ValidationException (ReaperTags.PROJECT_TEMPO, "Must be in the range of [" + Parameter.formatNumber (MIN_TEMPO) + ", " + Parameter.formatNumber (MAX_TEMPO) + "] but is " + bpm + ".");

        getOrCreateTempoNode (document).setParameter (0, Parameter.ofNumber (bpm));
    }


    /**
     * Set the time signature of the project.
     *
     * @param document The project
     * @param numerator The number of beats per bar, 1 to 64
     * @param denominator The note value of a beat, a power of 2 from 1 to 64
     * @throws ValidationException Numerator or denominator are out of range
     */
    public static void setTimeSignature (final ReaperDocument document, final int numerator, final int denominator) throws ValidationException
    {
        if (numerator < 1 || numerator > MAX_NUMERATOR)
            throw new ValidationException (ReaperTags.PROJECT_TEMPO + ".numerator", "Must be in the range of [1, " + MAX_NUMERATOR + "] but is " + numerator + ".");
        if (denominator < 1 || denominator > MAX_DENOMINATOR || Integer.bitCount (denominator) != 1)
            throw new ValidationException (ReaperTags.PROJECT_TEMPO + ".denominator", "Must be a power of 2 in the range of [1, " + MAX_DENOMINATOR + "] but is " + denominator + ".");

        final Node tempoNode = getOrCreateTempoNode (document);
        if (tempoNode.getParameters ().isEmpty ())
            tempoNode.setParameter (0, Parameter.ofNumber (ReaperAccessors.DEFAULT_TEMPO));
        tempoNode.setParameter (1, Parameter.ofInteger (numerator));
        tempoNode.setParameter (2, Parameter.ofInteger (denominator));
    }


    /**
     * Set the file to which the project is rendered. If the project has no render file yet, it is
     * added in front of the first track.
     *
     * @param document The project
     * @param path The path of the file without extension, relative to the project folder
     * @throws ReferenceException The path is malformed
     */
    public static void setRenderFile (final ReaperDocument document, final String path) throws ReferenceException
    {
        ReaperAccessors.validatePath (path);

        final Chunk rootChunk = document.getRootChunk ();
        final Optional<Node> renderFileNode = rootChunk.getChildNode (ReaperTags.PROJECT_RENDER_FILE);
        if (renderFileNode.isPresent ())
            renderFileNode.get ().setParameter (0, Parameter.ofString (path));
        else
            insertBeforeTracks (rootChunk, createNode (ReaperTags.PROJECT_RENDER_FILE, Parameter.ofString (path)));
    }


    /**
     * Find the first track in the order of the project which matches the selector.
     *
     * @param document The project
     * @param selector The selector
     * @return The track or empty if no track matches
     * @throws ValidationException A track chunk is malformed
     */
    public static Optional<ReaperTrack> findTrack (final ReaperDocument document, final TrackSelector selector) throws ValidationException
    {
        final List<ReaperTrack> tracks = ReaperAccessors.getTracks (document);
        for (int i = 0; i < tracks.size (); i++)
        {
            final ReaperTrack track = tracks.get (i);
            if (selector.matches (track, i))
                return Optional.of (track);
        }
        return Optional.empty ();
    }


    /**
     * Remove a track from the project. The identifier of the track is not re-used.
     *
     * @param document The project
     * @param track The track to remove
     * @throws StructureException The track is not part of the project
     */
    public static void removeTrack (final ReaperDocument document, final ReaperTrack track) throws StructureException
    {
        if (!document.getRootChunk ().removeChildNode (track.getChunk ()))
            throw new StructureException ("The track '" + track.getName () + "' is not part of the project.");
    }


    /**
     * Remove a media item from its' track. The identifier of the item is not re-used.
     *
     * @param document The project
     * @param item The item to remove
     * @throws StructureException The item is not part of a track of the project
     */
    public static void removeItem (final ReaperDocument document, final ReaperItem item) throws StructureException
    {
        final Chunk itemChunk = item.getChunk ();
        final Optional<Chunk> trackChunk = ReaperAccessors.findTrackChunk (itemChunk);
        if (trackChunk.isEmpty () || trackChunk.get ().getParent () != document.getRootChunk () || !trackChunk.get ().removeChildNode (itemChunk))
            throw new StructureException ("The item is not part of a track of the project.");
    }


    /**
     * Add an effects chain with a synthesizer in front of the first item of a track.
     *
     * @param document The project, provides the identifier of the effect
     * @param trackChunk The track chunk
     */
    private static void addInstrument (final ReaperDocument document, final Chunk trackChunk)
    {
        final Chunk fxChunk = new Chunk ();
        setNode (fxChunk, ReaperTags.CHUNK_FXCHAIN);
        addNode (fxChunk, ReaperTags.FXCHAIN_SHOW, Parameter.ofInteger (0));
        addNode (fxChunk, ReaperTags.FXCHAIN_LAST_SELECTED, Parameter.ofInteger (0));
        addNode (fxChunk, ReaperTags.FXCHAIN_DOCKED, Parameter.ofInteger (0));
        addNode (fxChunk, ReaperTags.FXCHAIN_BYPASS, numbers (0, 0, 0));

        final Chunk vstChunk = addChunk (fxChunk, ReaperTags.CHUNK_VST, Parameter.ofString (INSTRUMENT_NAME), Parameter.ofBareword (INSTRUMENT_FILE), Parameter.ofInteger (0), Parameter.ofString (""), Parameter.ofBareword (INSTRUMENT_UNIQUE_ID));
        // The plug-in state is Base64 encoded, one node per line
        for (final String stateLine: INSTRUMENT_STATE)
            addNode (vstChunk, stateLine);

        addNode (fxChunk, ReaperTags.FXCHAIN_FLOAT_POSITION, numbers (0, 0, 0, 0));
        addNode (fxChunk, ReaperTags.FXCHAIN_FX_ID, document.createIdentifier ());
        addNode (fxChunk, ReaperTags.FXCHAIN_WAK, numbers (0, 0));

        final Optional<Node> firstItem = trackChunk.getChildNode (ReaperTags.CHUNK_ITEM);
        if (firstItem.isPresent ())
            trackChunk.addChildNode (trackChunk.indexOf (firstItem.get ()), fxChunk);
        else
            trackChunk.addChildNode (fxChunk);
    }


    private static Node getOrCreateTempoNode (final ReaperDocument document)
    {
        final Chunk rootChunk = document.getRootChunk ();
        final Optional<Node> tempoNode = rootChunk.getChildNode (ReaperTags.PROJECT_TEMPO);
        if (tempoNode.isPresent ())
            return tempoNode.get ();
        final Node node = createNode (ReaperTags.PROJECT_TEMPO, Parameter.ofNumber (ReaperAccessors.DEFAULT_TEMPO), Parameter.ofInteger (4), Parameter.ofInteger (4));
        insertBeforeTracks (rootChunk, node);
        return node;
    }


    /**
     * Insert a node in front of the first track of the project or at the end if there are no
     * tracks.
     *
     * @param rootChunk The project chunk
     * @param node The node to insert
     */
    private static void insertBeforeTracks (final Chunk rootChunk, final Node node)
    {
        final Optional<Node> firstTrack = rootChunk.getChildNode (ReaperTags.CHUNK_TRACK);
        if (firstTrack.isPresent ())
            rootChunk.addChildNode (rootChunk.indexOf (firstTrack.get ()), node);
        else
            rootChunk.addChildNode (node);
    }


    /**
     * Get the highest item index (IID) used in the project.
     *
     * @param chunk The chunk to search recursively
     * @return The highest index or 0 if there are none
     * @throws ValidationException An index is too large
     */
    private static long getHighestItemIndex (final Chunk chunk) throws ValidationException
    {
        long highest = 0;
        for (final Node node: chunk.getChildNodes ())
        {
            if (node instanceof final Chunk subChunk)
                highest = Math.max (highest, getHighestItemIndex (subChunk));
            else if (ReaperTags.ITEM_INDEX.equals (node.getName ()) && ReaperTags.CHUNK_ITEM.equals (chunk.getName ()))
            {
                final Optional<Parameter> index = node.getParameter (0);
                if (index.isPresent () && index.get ().getType () == ParameterType.INTEGER)
                {
                    try
                    {
                        highest = Math.max (highest, index.get ().asLong ());
                    }
                    catch (final NumberFormatException ex)
                    {
                        throw new ValidationException (ReaperTags.CHUNK_ITEM + "." + ReaperTags.ITEM_INDEX, "The index is too large: " + index.get ().getText () + " (line " + node.getLineNumber () + ").");
                    }
                }
            }
        }
        return highest;
    }


    /**
     * Get the name of a file without folders and extension.
     *
     * @param filePath The path
     * @return The name
     */
    private static String getFileStem (final String filePath)
    {
        String name = filePath.substring (Math.max (filePath.lastIndexOf ('/'), filePath.lastIndexOf ('\\')) + 1);
        final int dot = name.lastIndexOf ('.');
        if (dot > 0)
            name = name.substring (0, dot);
        return name.isBlank () || !Parameter.isQuotable (name) ? filePath : name;
    }


    private static Parameter [] numbers (final double... values)
    {
        final Parameter [] parameters = new Parameter [values.length];
        for (int i = 0; i < values.length; i++)
            parameters[i] = Parameter.ofNumber (values[i]);
        return parameters;
    }


    /**
     * Create and add a chunk to a parent chunk.
     *
     * @param parentChunk The parent chunk to which to add the new chunk
     * @param childName The name of the new chunk
     * @param parameters The parameters to add to the chunk
     * @return The newly created chunk
     */
    private static Chunk addChunk (final Chunk parentChunk, final String childName, final Parameter... parameters)
    {
        return (Chunk) addNode (parentChunk, new Chunk (), childName, parameters);
    }


    /**
     * Create and add a node to a parent chunk.
     *
     * @param parentChunk The parent chunk to which to add the new node
     * @param childName The name of the new node
     * @param parameters The parameters to add to the node
     * @return The newly created node
     */
    private static Node addNode (final Chunk parentChunk, final String childName, final Parameter... parameters)
    {
        return addNode (parentChunk, new Node (), childName, parameters);
    }


    /**
     * Add a node to a parent chunk.
     *
     * @param parentChunk The parent chunk to which to add the new node
     * @param child The child node to add to the parent chunk
     * @param childName The name to set for the child node
     * @param parameters The parameters to add to the node
     * @return The added node
     */
    private static Node addNode (final Chunk parentChunk, final Node child, final String childName, final Parameter... parameters)
    {
        parentChunk.addChildNode (child);
        setNode (child, childName, parameters);
        return child;
    }


    private static Node createNode (final String nodeName, final Parameter... parameters)
    {
        final Node node = new Node ();
        setNode (node, nodeName, parameters);
        return node;
    }


    /**
     * Set the name and parameters of a node.
     *
     * @param node The node
     * @param nodeName The name to set for the node
     * @param parameters The parameters to add to the node
     */
    private static void setNode (final Node node, final String nodeName, final Parameter... parameters)
    {
        node.setName (nodeName);
        node.addParameters (List.of (parameters));
    }
}
