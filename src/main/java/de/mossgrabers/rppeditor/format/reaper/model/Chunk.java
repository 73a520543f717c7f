// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;


/**
 * A chunk in a Reaper project.
 *
 * @author Jürgen Moßgraber
 */
public class Chunk extends Node
{
    private final List<Node>   childNodes    = new ArrayList<> ();
    private final List<String> innerComments = new ArrayList<> ();
    private String             closingLine;
    private String             closingLineEnding;


    /**
     * Add a child node to the end of the chunk.
     *
     * @param node The node to add
     */
    public void addChildNode (final Node node)
    {
        this.addChildNode (this.childNodes.size (), node);
    }


    /**
     * Insert a child node into the chunk.
     *
     * @param index The position at which to insert the node
     * @param node The node to add
     */
    public void addChildNode (final int index, final Node node)
    {
        if (node.getParent () != null)
            throw new IllegalArgumentException ("The node is already part of a chunk.");
        this.childNodes.add (index, node);
        node.setParent (this);
    }


    /**
     * Remove a child node from the chunk.
     *
     * @param node The node to remove
     * @return True if the node was a child of this chunk
     */
    public boolean removeChildNode (final Node node)
    {
        final int index = this.indexOf (node);
        if (index < 0)
            return false;
        this.childNodes.remove (index);
        node.setParent (null);
        return true;
    }


    /**
     * Get the position of a child node. Nodes are compared by identity.
     *
     * @param node The node to look up
     * @return The index or -1 if it is not a child of this chunk
     */
    public int indexOf (final Node node)
    {
        for (int i = 0; i < this.childNodes.size (); i++)
        {
            if (this.childNodes.get (i) == node)
                return i;
        }
        return -1;
    }


    /**
     * Get all child nodes of the chunk.
     *
     * @return The child nodes, not modifiable
     */
    public List<Node> getChildNodes ()
    {
        return Collections.unmodifiableList (this.childNodes);
    }


    /**
     * Lookup a child node of the chunk with a certain name.
     *
     * @param name The name of the node to look up
     * @return The first matching node or empty if not found
     */
    public Optional<Node> getChildNode (final String name)
    {
        for (final Node childNode: this.childNodes)
        {
            if (name.equals (childNode.getName ()))
                return Optional.of (childNode);
        }
        return Optional.empty ();
    }


    /**
     * Lookup all child nodes of the chunk with a certain name.
     *
     * @param name The name of the node to look up
     * @return All matching nodes
     */
    public List<Node> getChildNodes (final String name)
    {
        final List<Node> results = new ArrayList<> ();
        for (final Node childNode: this.childNodes)
        {
            if (name.equals (childNode.getName ()))
                results.add (childNode);
        }
        return results;
    }


    /**
     * Get the comment and blank lines between the last child (or the opening line if there are
     * no children) and the closing line. Lines which were read keep their line separator.
     *
     * @return The lines, modifiable
     */
    public List<String> getInnerComments ()
    {
        return this.innerComments;
    }


    /**
     * Set the raw text of the line which closes the chunk.
     *
     * @param closingLine The text without the line separator
     * @param closingLineEnding The line separator which terminated the line, empty if there was
     *            none
     */
    public void setClosingLine (final String closingLine, final String closingLineEnding)
    {
        this.closingLine = closingLine;
        this.closingLineEnding = closingLineEnding;
    }


    /**
     * Get the raw text of the line which closes the chunk.
     *
     * @return The text or null if the chunk was created
     */
    public String getClosingLine ()
    {
        return this.closingLine;
    }


    /**
     * Get the line separator which terminated the closing line.
     *
     * @return The separator or null if the chunk was created
     */
    public String getClosingLineEnding ()
    {
        return this.closingLineEnding;
    }


    /** {@inheritDoc} */
    @Override
    public boolean hasSameStructure (final Node other)
    {
        if (!super.hasSameStructure (other))
            return false;
        final List<Node> otherChildNodes = ((Chunk) other).childNodes;
        if (this.childNodes.size () != otherChildNodes.size ())
            return false;
        for (int i = 0; i < this.childNodes.size (); i++)
        {
            if (!this.childNodes.get (i).hasSameStructure (otherChildNodes.get (i)))
                return false;
        }
        return true;
    }
}
