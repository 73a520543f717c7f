// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper;

import de.mossgrabers.rppeditor.core.ReferenceException;
import de.mossgrabers.rppeditor.core.ValidationException;
import de.mossgrabers.rppeditor.format.reaper.model.Chunk;
import de.mossgrabers.rppeditor.format.reaper.model.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;


/**
 * A read-only view on a TRACK chunk. All nodes of the track which are not items (FX chains,
 * envelopes, routing) are not interpreted.
 *
 * @author Jürgen Moßgraber
 */
public class ReaperTrack
{
    private final Chunk  trackChunk;
    private final String identifier;
    private final String name;


    /**
     * Constructor.
     *
     * @param trackChunk The chunk
     * @param identifier The identifier, might be null
     * @param name The name of the track
     */
    ReaperTrack (final Chunk trackChunk, final String identifier, final String name)
    {
        this.trackChunk = trackChunk;
        this.identifier = identifier;
        this.name = name;
    }


    public Chunk getChunk ()
    {
        return this.trackChunk;
    }


    public Optional<String> getIdentifier ()
    {
        return Optional.ofNullable (this.identifier);
    }


    /**
     * Get the name of the track.
     *
     * @return The name, empty if the track has no name
     */
    public String getName ()
    {
        return this.name;
    }


    /**
     * Get the media items of the track in the order of the file.
     *
     * @return The items
     * @throws ValidationException An item has missing or malformed parameters
     * @throws ReferenceException An item references a malformed file path
     */
    public List<ReaperItem> getItems () throws ValidationException, ReferenceException
    {
        final List<ReaperItem> items = new ArrayList<> ();
        for (final Node itemNode: this.trackChunk.getChildNodes (ReaperTags.CHUNK_ITEM))
            items.add (ReaperAccessors.asItem (itemNode));
        return items;
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return this.name;
    }
}
