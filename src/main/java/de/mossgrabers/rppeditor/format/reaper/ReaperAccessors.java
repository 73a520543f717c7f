// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper;

import de.mossgrabers.rppeditor.core.ReferenceException;
import de.mossgrabers.rppeditor.core.ValidationException;
import de.mossgrabers.rppeditor.format.reaper.model.Chunk;
import de.mossgrabers.rppeditor.format.reaper.model.Node;
import de.mossgrabers.rppeditor.format.reaper.model.Parameter;
import de.mossgrabers.rppeditor.format.reaper.model.ReaperDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;


/**
 * Typed read access to the nodes of a Reaper project. None of the functions modifies the
 * document.
 *
 * @author Jürgen Moßgraber
 */
public class ReaperAccessors
{
    /** The tempo Reaper uses if a project does not specify one. */
    public static final double DEFAULT_TEMPO = 120;


    /**
     * Constructor.
     */
    private ReaperAccessors ()
    {
        // Intentionally empty
    }


    /**
     * Get a view on a track chunk.
     *
     * @param node The node
     * @return The track
     * @throws ValidationException The node is not a track chunk or its' identifier is malformed
     */
    public static ReaperTrack asTrack (final Node node) throws ValidationException
    {
        final Chunk trackChunk = requireChunk (node, ReaperTags.CHUNK_TRACK);

        String identifier = null;
        final Optional<Parameter> idParameter = trackChunk.getParameter (0);
        if (idParameter.isPresent ())
            identifier = requireIdentifier (trackChunk, ReaperTags.CHUNK_TRACK, idParameter.get ());
        else
        {
            final Optional<Node> trackIdNode = trackChunk.getChildNode (ReaperTags.TRACK_ID);
            if (trackIdNode.isPresent ())
                identifier = requireIdentifier (trackIdNode.get (), ReaperTags.TRACK_ID, requireParameter (trackIdNode.get (), ReaperTags.TRACK_ID, 0));
        }

        final Optional<Node> nameNode = trackChunk.getChildNode (ReaperTags.TRACK_NAME);
        final String name = nameNode.isEmpty () ? "" : nameNode.get ().getParameter (0).map (Parameter::getValue).orElse ("");
        return new ReaperTrack (trackChunk, identifier, name);
    }


    /**
     * Get a view on a media item chunk.
     *
     * @param node The node
     * @return The item
     * @throws ValidationException The node is not an item chunk, position or length are missing
     *             or not non-negative numbers or the item has no source
     * @throws ReferenceException The source of the item references a malformed path
     */
    public static ReaperItem asItem (final Node node) throws ValidationException, ReferenceException
    {
        final Chunk itemChunk = requireChunk (node, ReaperTags.CHUNK_ITEM);

        final double position = requireNonNegative (itemChunk, ReaperTags.ITEM_POSITION);
        final double length = requireNonNegative (itemChunk, ReaperTags.ITEM_LENGTH);

        boolean loop = false;
        final Optional<Node> loopNode = itemChunk.getChildNode (ReaperTags.ITEM_LOOP);
        if (loopNode.isPresent ())
            loop = getIntParam (loopNode.get (), ReaperTags.ITEM_LOOP, 0) != 0;

        String identifier = null;
        final Optional<Node> idNode = itemChunk.getChildNode (ReaperTags.ITEM_ID);
        if (idNode.isPresent ())
            identifier = requireIdentifier (idNode.get (), ReaperTags.ITEM_ID, requireParameter (idNode.get (), ReaperTags.ITEM_ID, 0));

        final Optional<Node> nameNode = itemChunk.getChildNode (ReaperTags.ITEM_NAME);
        final String name = nameNode.isEmpty () ? null : nameNode.get ().getParameter (0).map (Parameter::getValue).orElse ("");

        final Optional<Node> sourceNode = itemChunk.getChildNode (ReaperTags.CHUNK_ITEM_SOURCE);
        if (sourceNode.isEmpty ())
            throw new ValidationException (ReaperTags.CHUNK_ITEM_SOURCE, "The item has no source" + describe (itemChunk));

        return new ReaperItem (itemChunk, identifier, name, position, length, loop, asSource (sourceNode.get ()));
    }


    /**
     * Get a view on a source chunk.
     *
     * @param node The node
     * @return The source
     * @throws ValidationException The node is not a source chunk, the type of the source is
     *             missing or a file node has no path
     * @throws ReferenceException The referenced path is malformed
     */
    public static ReaperSource asSource (final Node node) throws ValidationException, ReferenceException
    {
        final Chunk sourceChunk = requireChunk (node, ReaperTags.CHUNK_ITEM_SOURCE);
        final String type = requireParameter (sourceChunk, ReaperTags.CHUNK_ITEM_SOURCE, 0).getValue ();

        String filePath = null;
        final Optional<Node> fileNode = sourceChunk.getChildNode (ReaperTags.SOURCE_FILE);
        if (fileNode.isPresent ())
        {
            filePath = requireParameter (fileNode.get (), ReaperTags.SOURCE_FILE, 0).getValue ();
            validatePath (filePath);
        }
        return new ReaperSource (sourceChunk, type, filePath);
    }


    /**
     * Checks if a path is syntactically valid: not empty, no control characters and it can be
     * written as a parameter. The existence of the file is not checked.
     *
     * @param path The path to check
     * @throws ReferenceException The path is not valid
     */
    public static void validatePath (final String path) throws ReferenceException
    {
        if (path == null || path.isBlank ())
            throw new ReferenceException (path, "The file path is empty.");
        for (int i = 0; i < path.length (); i++)
        {
            if (Character.isISOControl (path.charAt (i)))
                throw new ReferenceException (path, "The file path contains a control character at position " + i + ".");
        }
        if (!Parameter.isQuotable (path))
            throw new ReferenceException (path, "The file path cannot be quoted: " + path);
    }


    /**
     * Get all tracks of the project in the order of the file.
     *
     * @param document The document
     * @return The tracks
     * @throws ValidationException A track chunk is malformed
     */
    public static List<ReaperTrack> getTracks (final ReaperDocument document) throws ValidationException
    {
        final List<ReaperTrack> tracks = new ArrayList<> ();
        for (final Node trackNode: document.getRootChunk ().getChildNodes (ReaperTags.CHUNK_TRACK))
            tracks.add (asTrack (trackNode));
        return tracks;
    }


    /**
     * Get the tempo of the project.
     *
     * @param document The document
     * @return The tempo in beats per minute, the Reaper default if not set
     * @throws ValidationException The tempo is not a number
     */
    public static double getTempo (final ReaperDocument document) throws ValidationException
    {
        final Optional<Node> tempoNode = document.getRootChunk ().getChildNode (ReaperTags.PROJECT_TEMPO);
        return tempoNode.isEmpty () ? DEFAULT_TEMPO : getDoubleParam (tempoNode.get (), ReaperTags.PROJECT_TEMPO, 0, DEFAULT_TEMPO);
    }


    /**
     * Get the time signature of the project.
     *
     * @param document The document
     * @return The numerator and denominator, 4/4 if not set
     * @throws ValidationException The time signature is not made of integers
     */
    public static int [] getTimeSignature (final ReaperDocument document) throws ValidationException
    {
        final Optional<Node> tempoNode = document.getRootChunk ().getChildNode (ReaperTags.PROJECT_TEMPO);
        if (tempoNode.isEmpty ())
            return new int []
            {
                4,
                4
            };
        return new int []
        {
            getIntParam (tempoNode.get (), ReaperTags.PROJECT_TEMPO, 1, 4),
            getIntParam (tempoNode.get (), ReaperTags.PROJECT_TEMPO, 2, 4)
        };
    }


    /**
     * Get the sample rate of the project.
     *
     * @param document The document
     * @return The sample rate or -1 if not set
     * @throws ValidationException The sample rate is not an integer
     */
    public static int getSampleRate (final ReaperDocument document) throws ValidationException
    {
        final Optional<Node> sampleRateNode = document.getRootChunk ().getChildNode (ReaperTags.PROJECT_SAMPLERATE);
        return sampleRateNode.isEmpty () ? -1 : getIntParam (sampleRateNode.get (), ReaperTags.PROJECT_SAMPLERATE, 0, -1);
    }


    /**
     * Get the file (without extension) to which the project is rendered.
     *
     * @param document The document
     * @return The file or empty if not set
     */
    public static Optional<String> getRenderFile (final ReaperDocument document)
    {
        return document.getRootChunk ().getChildNode (ReaperTags.PROJECT_RENDER_FILE).flatMap (node -> node.getParameter (0)).map (Parameter::getValue);
    }


    /**
     * Get the track chunk which contains the given node.
     *
     * @param node The node
     * @return The track chunk or empty if the node is not part of a track
     */
    static Optional<Chunk> findTrackChunk (final Node node)
    {
        Chunk parent = node.getParent ();
        while (parent != null)
        {
            if (ReaperTags.CHUNK_TRACK.equals (parent.getName ()))
                return Optional.of (parent);
            parent = parent.getParent ();
        }
        return Optional.empty ();
    }


    private static Chunk requireChunk (final Node node, final String tag) throws ValidationException
    {
        if (!tag.equals (node.getName ()))
            throw new ValidationException (tag, "Expected a " + tag + " chunk but found '" + node.getName () + "'" + describe (node));
        if (node instanceof final Chunk chunk)
            return chunk;
        throw new ValidationException (tag, "Expected a chunk but found a single line" + describe (node));
    }


    private static Parameter requireParameter (final Node node, final String field, final int position) throws ValidationException
    {
        final Optional<Parameter> parameter = node.getParameter (position);
        if (parameter.isEmpty ())
            throw new ValidationException (field, "Parameter " + (position + 1) + " is missing" + describe (node));
        return parameter.get ();
    }


    private static String requireIdentifier (final Node node, final String field, final Parameter parameter) throws ValidationException
    {
        if (!parameter.isCanonicalIdentifier ())
            throw new ValidationException (field, "Not a valid identifier: '" + parameter.getText () + "'" + describe (node));
        return parameter.getValue ();
    }


    /**
     * Get the first parameter of a required child node as a non-negative number.
     *
     * @param chunk The parent chunk
     * @param field The name of the child node
     * @return The value
     * @throws ValidationException The node is missing or the value is not a non-negative number
     */
    private static double requireNonNegative (final Chunk chunk, final String field) throws ValidationException
    {
        final Optional<Node> node = chunk.getChildNode (field);
        if (node.isEmpty ())
            throw new ValidationException (chunk.getName () + "." + field, "Required parameter is missing" + describe (chunk));
        final double value = getDoubleParam (node.get (), chunk.getName () + "." + field, 0, Double.NaN);
        if (!Double.isFinite (value) || value < 0)
            throw new ValidationException (chunk.getName () + "." + field, "Must be a non-negative number but is '" + node.get ().getParameter (0).map (Parameter::getText).orElse ("") + "'" + describe (node.get ()));
        return value;
    }


    /**
     * Get the parameter value at the given position of a node as a double.
     *
     * @param node The node from which to get the parameter value
     * @param field The name of the field for error reporting
     * @param position The index of the parameter
     * @param defaultValue The value to return if there is no parameter at that position
     * @return The read value or the default value
     * @throws ValidationException The parameter is present but not a number
     */
    private static double getDoubleParam (final Node node, final String field, final int position, final double defaultValue) throws ValidationException
    {
        final Optional<Parameter> parameter = node.getParameter (position);
        if (parameter.isEmpty ())
            return defaultValue;
        try
        {
            return parameter.get ().asDouble ();
        }
        catch (final NumberFormatException ex)
        {
            throw new ValidationException (field, ex.getMessage () + describe (node));
        }
    }


    private static int getIntParam (final Node node, final String field, final int defaultValue) throws ValidationException
    {
        return getIntParam (node, field, 0, defaultValue);
    }


    /**
     * Get the parameter value at the given position of a node as an integer.
     *
     * @param node The node from which to get the parameter value
     * @param field The name of the field for error reporting
     * @param position The index of the parameter
     * @param defaultValue The value to return if there is no parameter at that position
     * @return The read value or the default value
     * @throws ValidationException The parameter is present but not an integer
     */
    private static int getIntParam (final Node node, final String field, final int position, final int defaultValue) throws ValidationException
    {
        final Optional<Parameter> parameter = node.getParameter (position);
        if (parameter.isEmpty ())
            return defaultValue;
        try
        {
            return Math.toIntExact (parameter.get ().asLong ());
        }
        catch (final NumberFormatException | ArithmeticException ex)
        {
            throw new ValidationException (field, "Not an integer: '" + parameter.get ().getText () + "'" + describe (node));
        }
    }


    private static String describe (final Node node)
    {
        return node.getLineNumber () > 0 ? " (line " + node.getLineNumber () + ")." : ".";
    }
}
