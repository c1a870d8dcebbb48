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
package com.kgsampler.fetch;

import java.util.Iterator;
import java.util.NoSuchElementException;

import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;

import com.kgsampler.query.GraphQueryException;
import com.kgsampler.query.IGraphSession;
import com.kgsampler.query.IQueryRecord;
import com.kgsampler.query.IQueryResult;
import com.kgsampler.query.MissingFieldException;
import com.kgsampler.statement.StatementWriter;

/**
 * Base class for lazy iterators visiting the statements produced by a query.
 * The iterator is finite and can not be restarted. Subclasses decide when the
 * query is issued and how the results of successive queries are chained.
 * <p>
 * Each record must have the columns {@value #SUBJECT}, {@value #PREDICATE} and
 * {@value #OBJECT}, each bound to an absolute URI which N-Triples can carry
 * (see {@link StatementWriter#isIRIRef(String)}).
 * 
 * @version $Id$
 */
abstract public class AbstractStatementIterator implements Iterator<Statement> {

    public static final String SUBJECT = "subj";

    public static final String PREDICATE = "pred";

    public static final String OBJECT = "obj";

    protected final IGraphSession session;

    protected final String query;

    private final ValueFactory valueFactory = ValueFactoryImpl.getInstance();

    /**
     * The #of statements visited so far.
     */
    private long nvisited = 0L;

    protected AbstractStatementIterator(final IGraphSession session,
            final String query) {

        if (session == null)
            throw new IllegalArgumentException();

        if (query == null)
            throw new IllegalArgumentException();

        this.session = session;

        this.query = query;

    }

    /**
     * Return the result whose next record is the next statement -or-
     * <code>null</code> when there are no more statements.
     */
    abstract protected IQueryResult current();

    public boolean hasNext() {

        return current() != null;

    }

    public Statement next() {

        final IQueryResult result = current();

        if (result == null)
            throw new NoSuchElementException();

        final Statement stmt = toStatement(result.next());

        nvisited++;

        return stmt;

    }

    public void remove() {

        throw new UnsupportedOperationException();

    }

    /**
     * The #of statements visited so far.
     */
    public long getVisitedCount() {

        return nvisited;

    }

    /**
     * Convert a record into a statement.
     * 
     * @throws MissingFieldException
     *             if a column is missing.
     * @throws GraphQueryException
     *             if a column is null or not an absolute URI.
     */
    protected Statement toStatement(final IQueryRecord record) {

        final URI s = toURI(record, SUBJECT);

        final URI p = toURI(record, PREDICATE);

        final URI o = toURI(record, OBJECT);

        return valueFactory.createStatement(s, p, o);

    }

    private URI toURI(final IQueryRecord record, final String field) {

        final String s = record.getString(field);

        if (s == null)
            throw new GraphQueryException("Field is null: " + field);

        if (!StatementWriter.isIRIRef(s))
            throw new GraphQueryException("Not a URI: field=" + field
                    + ", value=" + s);

        try {

            return valueFactory.createURI(s);

        } catch (IllegalArgumentException ex) {

            throw new GraphQueryException("Not a URI: field=" + field
                    + ", value=" + s, ex);

        }

    }

}
