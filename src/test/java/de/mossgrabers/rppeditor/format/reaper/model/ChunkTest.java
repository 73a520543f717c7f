// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import java.util.List;


class ChunkTest
{
    @Test
    void nodeCanOnlyHaveOneParent ()
    {
        final Chunk first = createChunk ("TRACK");
        final Chunk second = createChunk ("TRACK");
        final Node name = new Node ();
        name.setName ("NAME");

        first.addChildNode (name);
        assertThat (name.getParent ()).isSameAs (first);
        assertThatThrownBy ( () -> second.addChildNode (name)).isInstanceOf (IllegalArgumentException.class);

        assertThat (first.removeChildNode (name)).isTrue ();
        assertThat (name.getParent ()).isNull ();
        second.addChildNode (name);
        assertThat (second.getChildNodes ()).containsExactly (name);
    }


    @Test
    void removesByIdentity ()
    {
        final Chunk chunk = createChunk ("ITEM");
        final Node a = createNode ("LOOP", 1);
        final Node b = createNode ("LOOP", 1);
        chunk.addChildNode (a);

        assertThat (a.hasSameStructure (b)).isTrue ();
        assertThat (chunk.removeChildNode (b)).isFalse ();
        assertThat (chunk.indexOf (a)).isZero ();
    }


    @Test
    void findsChildrenByName ()
    {
        final Chunk chunk = createChunk ("REAPER_PROJECT");
        chunk.addChildNode (createNode ("TRACK", 1));
        chunk.addChildNode (createNode ("TEMPO", 120));
        chunk.addChildNode (0, createNode ("TRACK", 0));

        assertThat (chunk.getChildNode ("TRACK").orElseThrow ().getParameter (0).orElseThrow ().asLong ()).isZero ();
        assertThat (chunk.getChildNodes ("TRACK")).hasSize (2);
        assertThat (chunk.getChildNode ("ITEM")).isEmpty ();
        assertThatThrownBy ( () -> chunk.getChildNodes ().clear ()).isInstanceOf (UnsupportedOperationException.class);
    }


    @Test
    void settingAParameterMarksTheNodeAsModified ()
    {
        final Node node = createNode ("TEMPO", 120);
        node.setLine ("  TEMPO 120.0");
        assertThat (node.isModified ()).isFalse ();

        node.setParameter (1, Parameter.ofInteger (4));
        assertThat (node.isModified ()).isTrue ();
        assertThat (node.getParameters ()).hasSize (2);
        assertThatThrownBy ( () -> node.setParameter (5, Parameter.ofInteger (4))).isInstanceOf (IndexOutOfBoundsException.class);
    }


    private static Chunk createChunk (final String name)
    {
        final Chunk chunk = new Chunk ();
        chunk.setName (name);
        return chunk;
    }


    private static Node createNode (final String name, final long value)
    {
        final Node node = new Node ();
        node.setName (name);
        node.addParameters (List.of (Parameter.ofInteger (value)));
        return node;
    }
}
