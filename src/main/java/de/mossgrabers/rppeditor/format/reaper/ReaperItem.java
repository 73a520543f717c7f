// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper;

import de.mossgrabers.rppeditor.format.reaper.model.Chunk;

import java.util.Optional;


/**
 * A read-only view on an ITEM chunk. Positions and lengths are in seconds.
 *
 * @author Jürgen Moßgraber
 */
public class ReaperItem
{
    private final Chunk        itemChunk;
    private final String       identifier;
    private final String       name;
    private final double       position;
    private final double       length;
    private final boolean      loop;
    private final ReaperSource source;


    /**
     * Constructor.
     *
     * @param itemChunk The chunk
     * @param identifier The identifier, might be null
     * @param name The name, might be null
     * @param position The start position in seconds
     * @param length The length in seconds
     * @param loop Is looping enabled?
     * @param source The source of the (active) take
     */
    ReaperItem (final Chunk itemChunk, final String identifier, final String name, final double position, final double length, final boolean loop, final ReaperSource source)
    {
        this.itemChunk = itemChunk;
        this.identifier = identifier;
        this.name = name;
        this.position = position;
        this.length = length;
        this.loop = loop;
        this.source = source;
    }


    public Chunk getChunk ()
    {
        return this.itemChunk;
    }


    public Optional<String> getIdentifier ()
    {
        return Optional.ofNullable (this.identifier);
    }


    public Optional<String> getName ()
    {
        return Optional.ofNullable (this.name);
    }


    public double getPosition ()
    {
        return this.position;
    }


    public double getLength ()
    {
        return this.length;
    }


    /**
     * Get the end of the item (exclusive).
     *
     * @return The position plus the length
     */
    public double getEnd ()
    {
        return this.position + this.length;
    }


    public boolean isLoop ()
    {
        return this.loop;
    }


    /**
     * Get the source of the item. If the item has several takes, this is the source of the first
     * take.
     *
     * @return The source
     */
    public ReaperSource getSource ()
    {
        return this.source;
    }
}
