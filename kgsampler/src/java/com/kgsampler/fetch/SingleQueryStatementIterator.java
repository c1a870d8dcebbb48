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

import java.util.Collections;

import com.kgsampler.query.IGraphSession;
import com.kgsampler.query.IQueryResult;

/**
 * Visits the statements of a query which is executed once, without a cursor.
 * Use this when the result is small enough for a single round trip. The query
 * is issued on the first call to {@link #hasNext()} or {@link #next()}.
 * 
 * @version $Id$
 */
public class SingleQueryStatementIterator extends AbstractStatementIterator {

    private IQueryResult result = null;

    public SingleQueryStatementIterator(final IGraphSession session,
            final String query) {

        super(session, query);

    }

    protected IQueryResult current() {

        if (result == null) {

            result = session.run(query, Collections.<String, Object> emptyMap());

        }

        return result.hasNext() ? result : null;

    }

}
