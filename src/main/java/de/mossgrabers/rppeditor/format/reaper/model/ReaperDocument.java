// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper.model;

import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;


/**
 * A parsed Reaper project: the root chunk and the book-keeping required to format it again and
 * to create unique identifiers.
 *
 * @author Jürgen Moßgraber
 */
public class ReaperDocument
{
    private static final int    MAX_IDENTIFIER_ATTEMPTS = 100;

    private final Chunk         rootChunk;
    private final Set<String>   usedIdentifiers         = new HashSet<> ();
    private String              lineSeparator;
    private boolean             endsWithLineSeparator;
    private boolean             hasByteOrderMark        = false;
    private Supplier<UUID>      identifierSource        = UUID::randomUUID;


    /**
     * Constructor.
     *
     * @param rootChunk The project chunk
     * @param lineSeparator The line separator to use for formatting
     * @param endsWithLineSeparator True if the formatted text should end with a line separator
     */
    public ReaperDocument (final Chunk rootChunk, final String lineSeparator, final boolean endsWithLineSeparator)
    {
        this.rootChunk = rootChunk;
        this.lineSeparator = lineSeparator;
        this.endsWithLineSeparator = endsWithLineSeparator;

        this.collectIdentifiers (rootChunk);
    }


    /**
     * Get the project chunk.
     *
     * @return The root chunk
     */
    public Chunk getRootChunk ()
    {
        return this.rootChunk;
    }


    /**
     * Get the version of the file format, the first parameter of the project chunk.
     *
     * @return The version or an empty string if not present
     */
    public String getFormatVersion ()
    {
        return this.rootChunk.getParameter (0).map (Parameter::getValue).orElse ("");
    }


    /**
     * Get the version of Reaper which wrote the file, the second parameter of the project chunk.
     *
     * @return The version or an empty string if not present
     */
    public String getApplicationVersion ()
    {
        return this.rootChunk.getParameter (1).map (Parameter::getValue).orElse ("");
    }


    public String getLineSeparator ()
    {
        return this.lineSeparator;
    }


    public void setLineSeparator (final String lineSeparator)
    {
        this.lineSeparator = lineSeparator;
    }


    public boolean endsWithLineSeparator ()
    {
        return this.endsWithLineSeparator;
    }


    public void setEndsWithLineSeparator (final boolean endsWithLineSeparator)
    {
        this.endsWithLineSeparator = endsWithLineSeparator;
    }


    /**
     * Does the formatted text start with a byte order mark?
     *
     * @return True if it starts with a byte order mark
     */
    public boolean hasByteOrderMark ()
    {
        return this.hasByteOrderMark;
    }


    public void setByteOrderMark (final boolean hasByteOrderMark)
    {
        this.hasByteOrderMark = hasByteOrderMark;
    }


    /**
     * Set the source of the random UUIDs used to create identifiers.
     *
     * @param identifierSource The source
     */
    public void setIdentifierSource (final Supplier<UUID> identifierSource)
    {
        this.identifierSource = identifierSource;
    }


    /**
     * Get all identifiers which are in use or were in use since the document was created.
     *
     * @return The upper-case identifiers including the braces, not modifiable
     */
    public Set<String> getUsedIdentifiers ()
    {
        return Collections.unmodifiableSet (this.usedIdentifiers);
    }


    /**
     * Create a new identifier which was never used in this document. The identifier is reserved
     * for the lifetime of the document, even if the node using it is removed.
     *
     * @return The identifier parameter
     * @throws IllegalStateException No unused identifier could be created
     */
    public Parameter createIdentifier ()
    {
        for (int i = 0; i < MAX_IDENTIFIER_ATTEMPTS; i++)
        {
            final Parameter identifier = Parameter.ofIdentifier (this.identifierSource.get ());
            if (this.usedIdentifiers.add (identifier.getValue ()))
                return identifier;
        }
        throw new IllegalStateException ("Could not create a unique identifier.");
    }


    /**
     * Compare the structure with another document.
     *
     * @param other The other document
     * @return True if both root chunks have the same structure
     * @see Node#hasSameStructure(Node)
     */
    public boolean hasSameStructure (final ReaperDocument other)
    {
        return this.rootChunk.hasSameStructure (other.rootChunk);
    }


    private void collectIdentifiers (final Node node)
    {
        for (final Parameter parameter: node.getParameters ())
        {
            if (parameter.isCanonicalIdentifier ())
                this.usedIdentifiers.add (parameter.getValue ().toUpperCase (Locale.US));
        }

        if (node instanceof final Chunk chunk)
        {
            for (final Node childNode: chunk.getChildNodes ())
                this.collectIdentifiers (childNode);
        }
    }
}
