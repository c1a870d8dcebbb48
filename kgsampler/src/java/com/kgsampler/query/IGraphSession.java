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

import java.util.Map;

/**
 * A session against the graph database holding the knowledge graph. This is
 * the only way in which the extraction touches the database: a query string
 * together with its named parameters goes in, a sequence of records comes
 * out.
 * <p>
 * Implementations are not required to be thread-safe. A session is owned by a
 * single extraction run.
 * 
 * @version $Id$
 */
public interface IGraphSession {

    /**
     * Execute a query.
     * 
     * @param query
     *            The query text.
     * @param params
     *            The named parameters of the query (may be empty, but not
     *            <code>null</code>).
     * 
     * @return The result. Records are pulled lazily from the result.
     * 
     * @throws GraphQueryException
     *             if the database can not be reached or the query fails.
     */
    IQueryResult run(String query, Map<String, Object> params);

}
