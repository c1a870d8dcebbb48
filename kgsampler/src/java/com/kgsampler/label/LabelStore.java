/*

Copyright (C) SYSTAP, LLC DBA Blazegraph 2006-2016.  All rights reserved.

Contact:
     SYSTAP, LLC DBA Blazegraph
     2501 Calvert ST NW #106
     Washington, DC 20008
     licenses@blazegraph.com

This program is free software; you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation; version 2 of the License.

This program is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with this program; if not, write to the Free Software
Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA
*/
package com.kgsampler.label;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

import java.io.IOException;

import com.kgsampler.index.EntityIndex;
import com.kgsampler.io.TSVWriter;

/**
 * Persists at most one label record per entity. The set of entities which
 * have been labeled is held in memory for the life of the run. A labels table
 * left behind by an earlier run is not consulted.
 * <p>
 * The store reads the {@link EntityIndex} to resolve URIs but never assigns
 * identifiers.
 * 
 * @version $Id$
 */
public class LabelStore {

    private final EntityIndex index;

    private final TSVWriter writer;

    private final boolean writeDepiction;

    /**
     * The identifiers of the entities which are done: either a label row was
     * written or the lookup found no label.
     */
    private final IntOpenHashSet labeled = new IntOpenHashSet();

    /**
     * The #of label rows written.
     */
    private int nwritten = 0;

    /**
     * @param index
     *            The index used to resolve URIs.
     * @param writer
     *            The table receiving the label rows.
     * @param writeDepiction
     *            When <code>true</code> the rows are
     *            <code>(id, label, description, depiction)</code>, otherwise
     *            <code>(id, label, description)</code>.
     */
    public LabelStore(final EntityIndex index, final TSVWriter writer,
            final boolean writeDepiction) {

        if (index == null)
            throw new IllegalArgumentException();

        if (writer == null)
            throw new IllegalArgumentException();

        this.index = index;
        this.writer = writer;
        this.writeDepiction = writeDepiction;

    }

    /**
     * Return <code>true</code> iff a label was written for the entity or the
     * entity was marked as having no label.
     */
    public boolean hasLabel(final int id) {

        return labeled.contains(id);

    }

    /**
     * Variant of {@link #hasLabel(int)} for a URI.
     * 
     * @throws IllegalStateException
     *             if the URI was never indexed.
     */
    public boolean hasLabel(final String uri) {

        return hasLabel(indexOf(uri));

    }

    /**
     * Write the label of an entity unless one has already been written for
     * that entity, in which case this is a NOP.
     * 
     * @return <code>true</code> iff a row was written.
     * 
     * @throws IOException
     */
    public boolean writeLabel(final int id, final String label,
            final String description, final String depiction)
            throws IOException {

        if (id < 0)
            throw new IllegalArgumentException();

        if (labeled.contains(id))
            return false;

        if (writeDepiction) {

            writer.writeRow(id, label, description, depiction);

        } else {

            writer.writeRow(id, label, description);

        }

        labeled.add(id);

        nwritten++;

        return true;

    }

    /**
     * Variant of {@link #writeLabel(int, String, String, String)} for a
     * {@link Label}.
     */
    public boolean writeLabel(final int id, final Label label)
            throws IOException {

        return writeLabel(id, label.getLabel(), label.getDescription(),
                label.getDepiction());

    }

    /**
     * Record that no label exists for the entity. Nothing is written, but the
     * entity will report {@link #hasLabel(int)} from now on so it is not
     * looked up again.
     */
    public void markUnlabeled(final int id) {

        if (id < 0)
            throw new IllegalArgumentException();

        labeled.add(id);

    }

    /**
     * The #of label rows written.
     */
    public int size() {

        return nwritten;

    }

    private int indexOf(final String uri) {

        final int id = index.get(uri);

        if (id == EntityIndex.NULL)
            throw new IllegalStateException("Entity was not indexed: " + uri);

        return id;

    }

}
