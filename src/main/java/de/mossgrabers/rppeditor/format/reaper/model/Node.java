// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;


/**
 * A node in a Reaper project. A node has a name and parameters. It remembers the raw text line
 * it was read from; as long as neither name nor parameters are changed, the node is formatted
 * by writing this line unchanged.
 *
 * @author Jürgen Moßgraber
 */
public class Node
{
    private String                name             = "";
    private final List<Parameter> parameters       = new ArrayList<> ();
    private final List<String>    leadingComments  = new ArrayList<> ();
    private final List<String>    trailingComments = new ArrayList<> ();
    private String                line;
    private String                lineEnding;
    private String                indent;
    private int                   lineNumber;
    private Chunk                 parent;


    /**
     * Set the name of the node.
     *
     * @param name The name
     */
    public void setName (final String name)
    {
        this.name = name;
        this.line = null;
    }


    /**
     * Get the name of the node.
     *
     * @return The name
     */
    public String getName ()
    {
        return this.name;
    }


    /**
     * Add parameters to the node.
     *
     * @param parameters The parameters to add
     */
    public void addParameters (final List<Parameter> parameters)
    {
        this.parameters.addAll (parameters);
        this.line = null;
    }


    /**
     * Replace the parameter at the given index. All other parameters keep their text.
     *
     * @param index The index of the parameter, if it is equal to the number of parameters the
     *            parameter is added
     * @param parameter The new parameter
     */
    public void setParameter (final int index, final Parameter parameter)
    {
        if (index == this.parameters.size ())
            this.parameters.add (parameter);
        else
            this.parameters.set (index, parameter);
        this.line = null;
    }


    /**
     * Get the parameters of the node.
     *
     * @return The parameters, not modifiable
     */
    public List<Parameter> getParameters ()
    {
        return Collections.unmodifiableList (this.parameters);
    }


    /**
     * Get a parameter.
     *
     * @param index The index of the parameter
     * @return The parameter or empty if the node has less parameters
     */
    public Optional<Parameter> getParameter (final int index)
    {
        return index >= 0 && index < this.parameters.size () ? Optional.of (this.parameters.get (index)) : Optional.empty ();
    }


    /**
     * Set the raw text line of the node.
     *
     * @param line The text, without the line separator
     */
    public void setLine (final String line)
    {
        this.line = line;
    }


    /**
     * Get the raw text line.
     *
     * @return The text or null if the node was created or modified
     */
    public String getLine ()
    {
        return this.line;
    }


    /**
     * Set the line separator which terminated the raw text line.
     *
     * @param lineEnding The line separator, empty if the line was the last one and had none
     */
    public void setLineEnding (final String lineEnding)
    {
        this.lineEnding = lineEnding;
    }


    /**
     * Get the line separator which terminated the raw text line. It is only used as long as the
     * node is not modified.
     *
     * @return The line separator or null if the node was created
     */
    public String getLineEnding ()
    {
        return this.lineEnding;
    }


    /**
     * Was the node created or modified after parsing? If true the line is regenerated on
     * formatting.
     *
     * @return True if modified
     */
    public boolean isModified ()
    {
        return this.line == null;
    }


    /**
     * Set the whitespace in front of the node.
     *
     * @param indent The indentation
     */
    public void setIndent (final String indent)
    {
        this.indent = indent;
    }


    /**
     * Get the whitespace in front of the node.
     *
     * @return The indentation or null if it needs to be derived from the parent
     */
    public String getIndent ()
    {
        return this.indent;
    }


    /**
     * Set the number of the line the node was read from.
     *
     * @param lineNumber The 1-based line number
     */
    public void setLineNumber (final int lineNumber)
    {
        this.lineNumber = lineNumber;
    }


    /**
     * Get the number of the line the node was read from.
     *
     * @return The 1-based line number or 0 if the node was created
     */
    public int getLineNumber ()
    {
        return this.lineNumber;
    }


    /**
     * Get the comment and blank lines in front of the node. Lines which were read keep their line
     * separator, lines without one are terminated with the separator of the document.
     *
     * @return The lines, modifiable
     */
    public List<String> getLeadingComments ()
    {
        return this.leadingComments;
    }


    /**
     * Get the comment and blank lines following the node. Lines which were read keep their line
     * separator.
     *
     * @return The lines, modifiable
     */
    public List<String> getTrailingComments ()
    {
        return this.trailingComments;
    }


    /**
     * Get the chunk which contains this node.
     *
     * @return The parent chunk or null if this is the root or it is not attached
     */
    public Chunk getParent ()
    {
        return this.parent;
    }


    /**
     * Set the parent chunk.
     *
     * @param parent The parent
     */
    void setParent (final Chunk parent)
    {
        this.parent = parent;
    }


    /**
     * Compare the structure (not the formatting) with another node: name, parameter types and
     * values and, for chunks, all child nodes in order.
     *
     * @param other The other node
     * @return True if equal
     */
    public boolean hasSameStructure (final Node other)
    {
        return other != null && this.getClass () == other.getClass () && this.name.equals (other.name) && this.parameters.equals (other.parameters);
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        final StringBuilder sb = new StringBuilder (this.name);
        for (final Parameter parameter: this.parameters)
            sb.append (' ').append (parameter.getText ());
        return sb.toString ();
    }
}
