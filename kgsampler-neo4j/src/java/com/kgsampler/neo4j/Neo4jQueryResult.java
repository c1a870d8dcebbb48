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

import org.neo4j.driver.Result;
import org.neo4j.driver.exceptions.Neo4jException;

import com.kgsampler.query.GraphQueryException;
import com.kgsampler.query.IQueryRecord;
import com.kgsampler.query.IQueryResult;

/**
 * Adapts a Neo4j {@link Result}. The result streams its records from the
 * server, so a backend failure may surface on any call.
 * 
 * @version $Id$
 */
class Neo4jQueryResult implements IQueryResult {

    private final Result result;

    Neo4jQueryResult(final Result result) {

        this.result = result;

    }

    public boolean hasNext() {

        try {
            return result.hasNext();
        } catch (Neo4jException ex) {
            throw new GraphQueryException("Could not read result", ex);
        }

    }

    public IQueryRecord next() {

        try {
            return new Neo4jQueryRecord(result.next());
        } catch (Neo4jException ex) {
            throw new GraphQueryException("Could not read result", ex);
        }

    }

    public void remove() {

        throw new UnsupportedOperationException();

    }

}
