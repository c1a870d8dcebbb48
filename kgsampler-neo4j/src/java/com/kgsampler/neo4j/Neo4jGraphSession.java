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
package com.kgsampler.neo4j;

import java.util.Map;

import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.exceptions.Neo4jException;

import com.kgsampler.query.GraphQueryException;
import com.kgsampler.query.IGraphSession;
import com.kgsampler.query.IQueryResult;

/**
 * An {@link IGraphSession} backed by a Neo4j {@link Session}. Client failures
 * are reported as {@link GraphQueryException}s. The session is owned by the
 * caller, which is responsible for closing it.
 * 
 * @version $Id$
 */
public class Neo4jGraphSession implements IGraphSession {

    private final Session session;

    public Neo4jGraphSession(final Session session) {

        if (session == null)
            throw new IllegalArgumentException();

        this.session = session;

    }

    public IQueryResult run(final String query, final Map<String, Object> params) {

        final Result result;
        try {
            result = session.run(query, params);
        } catch (Neo4jException ex) {
            throw new GraphQueryException("Query failed: params=" + params, ex);
        }

        return new Neo4jQueryResult(result);

    }

}
