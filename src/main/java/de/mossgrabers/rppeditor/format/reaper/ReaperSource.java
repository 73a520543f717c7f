// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper;

import de.mossgrabers.rppeditor.format.reaper.model.Chunk;

import java.util.Optional;


/**
 * A read-only view on a SOURCE chunk of a media item.
 *
 * @author Jürgen Moßgraber
 */
public class ReaperSource
{
    private final Chunk      sourceChunk;
    private final String     type;
    private final SourceKind kind;
    private final String     filePath;


    /**
     * Constructor.
     *
     * @param sourceChunk The chunk
     * @param type The type of the source, e.g. MIDI or WAVE
     * @param filePath The referenced file or null if the content is embedded
     */
    ReaperSource (final Chunk sourceChunk, final String type, final String filePath)
    {
        this.sourceChunk = sourceChunk;
        this.type = type;
        this.filePath = filePath;
        this.kind = filePath == null ? SourceKind.EMBEDDED_DATA : SourceKind.FILE_REFERENCE;
    }


    public Chunk getChunk ()
    {
        return this.sourceChunk;
    }


    /**
     * Get the type of the source as written in the file, e.g. MIDI, WAVE or MP3.
     *
     * @return The type
     */
    public String getType ()
    {
        return this.type;
    }


    public SourceKind getKind ()
    {
        return this.kind;
    }


    /**
     * Get the path of the referenced file. The path is returned as stored, no resolution or
     * normalization is applied.
     *
     * @return The path or empty if the content is embedded
     */
    public Optional<String> getFilePath ()
    {
        return Optional.ofNullable (this.filePath);
    }
}
