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
package com.kgsampler.index;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.io.IOException;

import org.apache.log4j.Logger;

import com.kgsampler.io.TSVWriter;

/**
 * An index mapping entity URIs to dense integer identifiers. Identifiers are
 * assigned from an auto-increment counter in the order in which the entities
 * are first seen, starting at ZERO (0), so <code>k</code> distinct entities
 * are assigned exactly the identifiers <code>0..k-1</code>. Once assigned, an
 * identifier never changes for the life of the index.
 * <p>
 * Each assignment is persisted as an <code>(id, uri)</code> row. An entity
 * which is <em>relevant</em> when it is first seen (it occurs as the subject
 * or object of a statement) is also persisted as an <code>(id)</code> row in
 * the relevant entities table. Relevance is decided at first sight only: an
 * entity first seen as a predicate is never written to the relevant entities
 * table, even if it later occurs as a subject or object.
 * <p>
 * Note: The index is not thread-safe. It is owned by a single extraction run.
 * 
 * @version $Id$
 */
public class EntityIndex {

    protected static final Logger log = Logger.getLogger(EntityIndex.class);

    /**
     * The value reported by {@link #get(String)} for a URI which has not been
     * indexed.
     */
    public static final int NULL = -1;

    private final Object2IntOpenHashMap<String> ids;

    private final TSVWriter indexWriter;

    private final TSVWriter relevantWriter;

    /**
     * The next identifier to be assigned.
     */
    private int nextId = 0;

    /**
     * The #of entities written to the relevant entities table.
     */
    private int nrelevant = 0;

    /**
     * @param indexWriter
     *            The table receiving the <code>(id, uri)</code> rows.
     * @param relevantWriter
     *            The table receiving the <code>(id)</code> rows of relevant
     *            entities.
     */
    public EntityIndex(final TSVWriter indexWriter,
            final TSVWriter relevantWriter) {

        if (indexWriter == null)
            throw new IllegalArgumentException();

        if (relevantWriter == null)
            throw new IllegalArgumentException();

        this.indexWriter = indexWriter;

        this.relevantWriter = relevantWriter;

        this.ids = new Object2IntOpenHashMap<String>();

        this.ids.defaultReturnValue(NULL);

    }

    /**
     * Resolve the identifier for a URI, assigning the next identifier if the
     * URI has not been seen before. If the URI has been seen before then its
     * identifier is returned and nothing is written, whatever the value of
     * <i>relevant</i>.
     * 
     * @param uri
     *            The URI of the entity.
     * @param relevant
     *            <code>true</code> iff the entity occurs as the subject or
     *            object of a statement.
     * 
     * @return The identifier of the entity.
     * 
     * @throws IOException
     *             if the index rows could not be written.
     */
    public int resolve(final String uri, final boolean relevant)
            throws IOException {

        if (uri == null)
            throw new IllegalArgumentException();

        final int id = ids.getInt(uri);

        if (id != NULL) {

            return id;

        }

        final int newId = nextId;

        if (relevant) {

            relevantWriter.writeRow(newId);

            nrelevant++;

        }

        indexWriter.writeRow(newId, uri);

        ids.put(uri, newId);

        nextId++;

        if (log.isDebugEnabled())
            log.debug("id=" + newId + ", uri=" + uri + ", relevant="
                    + relevant);

        return newId;

    }

    /**
     * Return the identifier of a URI without assigning one.
     * 
     * @param uri
     *            The URI of the entity.
     * 
     * @return The identifier -or- {@link #NULL} if the URI has not been
     *         indexed.
     */
    public int get(final String uri) {

        if (uri == null)
            throw new IllegalArgumentException();

        return ids.getInt(uri);

    }

    /**
     * The #of distinct entities in the index (also the next identifier to be
     * assigned).
     */
    public int size() {

        return nextId;

    }

    /**
     * The #of entities written to the relevant entities table.
     */
    public int getRelevantCount() {

        return nrelevant;

    }

}
