// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper.model;

import de.mossgrabers.rppeditor.core.LexException;
import de.mossgrabers.rppeditor.core.ReaperProjectException;
import de.mossgrabers.rppeditor.core.StructureException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;


/**
 * Support for parsing and formatting Reaper project files.
 *
 * @author Jürgen Moßgraber
 */
public class ReaperProject
{
    private static final char   START_OF_CHUNK  = '<';
    private static final char   END_OF_CHUNK    = '>';
    private static final String INDENTATION     = "  ";
    private static final char   BYTE_ORDER_MARK = '\uFEFF';


    /**
     * Constructor.
     */
    private ReaperProject ()
    {
        // Intentionally empty
    }


    /**
     * Parses the text of a Reaper project file into its' parts the so-called chunks. Comment and
     * blank lines are attached to the preceding node of the same chunk. If the chunk has no node
     * yet, they are attached in front of the next node or, if the chunk stays empty, in front of
     * its' closing line.
     *
     * @param text The text to parse
     * @return The parsed document
     * @throws LexException A line could not be tokenized
     * @throws StructureException The chunks are not properly nested
     */
    public static ReaperDocument parse (final String text) throws LexException, StructureException
    {
        final ReaperTokenizer tokenizer = new ReaperTokenizer (text);
        final Deque<Chunk> openChunks = new ArrayDeque<> ();
        final List<String> pendingComments = new ArrayList<> ();
        Chunk rootChunk = null;
        int lineNumber = 0;

        while (tokenizer.hasNext ())
        {
            final Token token = tokenizer.next ();
            lineNumber = token.getLineNumber ();

            switch (token.getType ())
            {
                case COMMENT:
                    addComment (openChunks, rootChunk, pendingComments, token.getLine () + token.getLineEnding ());
                    break;

                case BLOCK_OPEN:
                    if (openChunks.isEmpty () && rootChunk != null)
                        throw new StructureException ("Unsound file. Found a second chunk after the project chunk.", lineNumber);
                    openChunks.push (fillNode (new Chunk (), token, pendingComments));
                    break;

                case DIRECTIVE:
                    if (openChunks.isEmpty ())
                        throw new StructureException ("Unsound file. Found a parameter outside of the project chunk.", lineNumber);
                    openChunks.peek ().addChildNode (fillNode (new Node (), token, pendingComments));
                    break;

                case BLOCK_CLOSE:
                    if (openChunks.isEmpty ())
                        throw new StructureException ("Unbalanced nesting. Closing a chunk which was never opened.", lineNumber);
                    final Chunk chunk = openChunks.pop ();
                    chunk.setClosingLine (token.getLine (), token.getLineEnding ());
                    chunk.getInnerComments ().addAll (pendingComments);
                    pendingComments.clear ();
                    if (openChunks.isEmpty ())
                        rootChunk = chunk;
                    else
                        openChunks.peek ().addChildNode (chunk);
                    break;
            }
        }

        if (!openChunks.isEmpty ())
            throw new StructureException ("Unbalanced nesting. Chunk '" + openChunks.peek ().getName () + "' is not closed.", lineNumber);
        if (rootChunk == null)
            throw new StructureException ("No Reaper file. Project chunk not found.", ReaperProjectException.NO_LINE);

        final String lineSeparator = tokenizer.getLineSeparator ();
        final ReaperDocument document = new ReaperDocument (rootChunk, lineSeparator == null ? ReaperTokenizer.CRLF : lineSeparator, tokenizer.endsWithLineSeparator ());
        document.setByteOrderMark (tokenizer.hasByteOrderMark ());
        return document;
    }


    /**
     * Attach a comment line to the preceding node or keep it for the next one.
     *
     * @param openChunks The chunks which are currently open
     * @param rootChunk The closed project chunk, null if not closed yet
     * @param pendingComments The comments waiting for the next node
     * @param line The comment line including its line separator
     */
    private static void addComment (final Deque<Chunk> openChunks, final Chunk rootChunk, final List<String> pendingComments, final String line)
    {
        final Node precedingNode;
        if (openChunks.isEmpty ())
            precedingNode = rootChunk;
        else
        {
            final List<Node> childNodes = openChunks.peek ().getChildNodes ();
            precedingNode = childNodes.isEmpty () ? null : childNodes.get (childNodes.size () - 1);
        }

        if (precedingNode == null)
            pendingComments.add (line);
        else
            precedingNode.getTrailingComments ().add (line);
    }


    /**
     * Fills a node (name/values pair) from a token.
     *
     * @param node The node to fill
     * @param token The token to fill from
     * @param pendingComments The comments to attach in front of the node, the list is cleared
     * @return The node for convenience
     */
    private static <T extends Node> T fillNode (final T node, final Token token, final List<String> pendingComments)
    {
        node.setName (token.getTag ());
        node.addParameters (token.getParameters ());
        node.setIndent (token.getIndent ());
        node.setLineNumber (token.getLineNumber ());
        node.getLeadingComments ().addAll (pendingComments);
        pendingComments.clear ();
        // Must be set last, since setting name and parameters resets the line
        node.setLine (token.getLine ());
        node.setLineEnding (token.getLineEnding ());
        return node;
    }


    /**
     * Formats the document as a Reaper project file. Nodes which were not modified are written
     * exactly as they were read including their line separator. Modified and new lines are
     * terminated with the line separator of the document.
     *
     * @param document The document
     * @return The formatted file content
     */
    public static String format (final ReaperDocument document)
    {
        final LineWriter writer = new LineWriter (document.getLineSeparator ());
        if (document.hasByteOrderMark ())
            writer.text.append (BYTE_ORDER_MARK);
        formatChunk (writer, document.getRootChunk (), "");
        return writer.finish (document.endsWithLineSeparator ());
    }


    /**
     * Format recursively the chunk and all sub-chunks.
     *
     * @param writer Where to add the formatted lines
     * @param chunk The chunk to format
     * @param defaultIndent The indentation to use if the chunk has none
     */
    private static void formatChunk (final LineWriter writer, final Chunk chunk, final String defaultIndent)
    {
        final String indent = chunk.getIndent () == null ? defaultIndent : chunk.getIndent ();

        writer.addRawLines (chunk.getLeadingComments ());
        if (chunk.isModified ())
            writer.addLine (formatLine (chunk, indent, true), null);
        else
            writer.addLine (chunk.getLine (), chunk.getLineEnding ());

        final String childIndent = indent + INDENTATION;
        for (final Node node: chunk.getChildNodes ())
        {
            if (node instanceof final Chunk subChunk)
                formatChunk (writer, subChunk, childIndent);
            else
                formatNode (writer, node, childIndent);
        }

        writer.addRawLines (chunk.getInnerComments ());
        final String closingLine = chunk.getClosingLine ();
        if (closingLine == null)
            writer.addLine (indent + END_OF_CHUNK, null);
        else
            writer.addLine (closingLine, chunk.getClosingLineEnding ());
        writer.addRawLines (chunk.getTrailingComments ());
    }


    /**
     * Format one node (one name/values line) including its' comments.
     *
     * @param writer Where to add the formatted lines
     * @param node The node to format
     * @param defaultIndent The indentation to use if the node has none
     */
    private static void formatNode (final LineWriter writer, final Node node, final String defaultIndent)
    {
        writer.addRawLines (node.getLeadingComments ());
        if (node.isModified ())
            writer.addLine (formatLine (node, node.getIndent () == null ? defaultIndent : node.getIndent (), false), null);
        else
            writer.addLine (node.getLine (), node.getLineEnding ());
        writer.addRawLines (node.getTrailingComments ());
    }


    /**
     * Format the line of a node from its' name and parameters.
     *
     * @param node The node
     * @param indent The indentation
     * @param isChunk True to add the start of chunk marker
     * @return The line
     */
    private static String formatLine (final Node node, final String indent, final boolean isChunk)
    {
        final StringBuilder line = new StringBuilder (indent);
        if (isChunk)
            line.append (START_OF_CHUNK);
        line.append (node.getName ());
        for (final Parameter parameter: node.getParameters ())
            line.append (' ').append (parameter.getText ());
        return line.toString ();
    }


    /**
     * Collects the formatted lines. Each line is terminated with its own line separator or, if it
     * has none, with the one of the document.
     */
    private static final class LineWriter
    {
        private final StringBuilder text = new StringBuilder ();
        private final String        lineSeparator;
        private int                 lastLineEndingLength;


        LineWriter (final String lineSeparator)
        {
            this.lineSeparator = lineSeparator;
        }


        void addLine (final String line, final String lineEnding)
        {
            final String ending = lineEnding == null || lineEnding.isEmpty () ? this.lineSeparator : lineEnding;
            this.text.append (line).append (ending);
            this.lastLineEndingLength = ending.length ();
        }


        /**
         * Add lines which might end with their line separator.
         *
         * @param rawLines The lines
         */
        void addRawLines (final List<String> rawLines)
        {
            for (final String rawLine: rawLines)
            {
                int end = rawLine.length ();
                if (rawLine.endsWith (ReaperTokenizer.CRLF))
                    end -= 2;
                else if (rawLine.endsWith (ReaperTokenizer.LF))
                    end--;
                this.addLine (rawLine.substring (0, end), rawLine.substring (end));
            }
        }


        String finish (final boolean endsWithLineSeparator)
        {
            // The last line of a file without a final line separator
            if (!endsWithLineSeparator)
                this.text.setLength (this.text.length () - this.lastLineEndingLength);
            return this.text.toString ();
        }
    }
}
