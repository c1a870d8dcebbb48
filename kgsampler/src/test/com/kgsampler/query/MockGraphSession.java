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
package com.kgsampler.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * An in-memory {@link IGraphSession}. The statement query answers from a list
 * of <code>(subj, pred, obj)</code> rows, honoring <code>skip</code> and
 * <code>limit</code> when they are given. The label query answers from a map
 * keyed by URI. Every call is recorded.
 */
public class MockGraphSession implements IGraphSession {

    public static final String STATEMENT_QUERY = "statements";

    public static final String LABEL_QUERY = "label";

    /**
     * A statement query, a label query and its parameters.
     */
    public static class Call {

        public final String query;

        public final Map<String, Object> params;

        Call(final String query, final Map<String, Object> params) {
            this.query = query;
            this.params = new HashMap<String, Object>(params);
        }

    }

    private final List<String[]> statements = new ArrayList<String[]>();

    private final Map<String, String[]> labels = new HashMap<String, String[]>();

    public final List<Call> calls = new LinkedList<Call>();

    /**
     * When non-negative, the statement row at this position throws a
     * {@link GraphQueryException} when it is read.
     */
    public long failAt = -1L;

    public MockGraphSession addStatement(final String s, final String p,
            final String o) {

        statements.add(new String[] { s, p, o });

        return this;

    }

    public MockGraphSession addLabel(final String uri, final String label,
            final String description, final String depiction) {

        labels.put(uri, new String[] { label, description, depiction });

        return this;

    }

    /**
     * The #of statement rows. Subclasses may generate rows.
     */
    protected long getStatementCount() {

        return statements.size();

    }

    /**
     * The statement row at some position. Subclasses may generate rows.
     */
    protected IQueryRecord getStatement(final long i) {

        final String[] row = statements.get((int) i);

        return MapQueryRecord.of("subj", row[0], "pred", row[1], "obj",
                row[2]);

    }

    public IQueryResult run(final String query, final Map<String, Object> params) {

        calls.add(new Call(query, params));

        if (LABEL_QUERY.equals(query)) {

            final String[] row = labels.get(params.get("uri"));

            if (row == null)
                return new ListQueryResult(Collections.<IQueryRecord> emptyList()
                        .iterator());

            return new ListQueryResult(Collections.<IQueryRecord> singletonList(
                    MapQueryRecord.of("label", row[0], "description", row[1],
                            "depiction", row[2])).iterator());

        }

        if (STATEMENT_QUERY.equals(query)) {

            final long n = getStatementCount();

            final long skip = params.containsKey("skip") ? ((Number) params
                    .get("skip")).longValue() : 0L;

            final long limit = params.containsKey("limit") ? ((Number) params
                    .get("limit")).longValue() : n;

            return new ListQueryResult(new RowIterator(skip, Math.min(n, skip
                    + limit)));

        }

        throw new GraphQueryException("Unknown query: " + query);

    }

    /**
     * The calls made with a given query.
     */
    public List<Call> getCalls(final String query) {

        final List<Call> list = new ArrayList<Call>();

        for (Call c : calls) {

            if (c.query.equals(query))
                list.add(c);

        }

        return list;

    }

    private class RowIterator implements Iterator<IQueryRecord> {

        private long i;

        private final long end;

        RowIterator(final long begin, final long end) {
            this.i = begin;
            this.end = end;
        }

        public boolean hasNext() {
            return i < end;
        }

        public IQueryRecord next() {

            if (i >= end)
                throw new NoSuchElementException();

            if (i == failAt)
                throw new GraphQueryException("Backend failure at row " + i);

            return getStatement(i++);

        }

        public void remove() {
            throw new UnsupportedOperationException();
        }

    }

    /**
     * An {@link IQueryResult} over an iterator.
     */
    public static class ListQueryResult implements IQueryResult {

        private final Iterator<IQueryRecord> itr;

        public ListQueryResult(final Iterator<IQueryRecord> itr) {
            this.itr = itr;
        }

        public boolean hasNext() {
            return itr.hasNext();
        }

        public IQueryRecord next() {
            return itr.next();
        }

        public void remove() {
            throw new UnsupportedOperationException();
        }

    }

}
