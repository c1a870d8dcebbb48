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

import org.neo4j.driver.Record;
import org.neo4j.driver.Value;

import com.kgsampler.query.IQueryRecord;
import com.kgsampler.query.MissingFieldException;

/**
 * Adapts a Neo4j {@link Record}. String values are returned as is; any other
 * non-null value is returned in its string form.
 * 
 * @version $Id$
 */
class Neo4jQueryRecord implements IQueryRecord {

    private final Record record;

    Neo4jQueryRecord(final Record record) {

        this.record = record;

    }

    public boolean containsKey(final String field) {

        return record.containsKey(field);

    }

    public String getString(final String field) {

        if (!record.containsKey(field))
            throw new MissingFieldException(field, record.keys());

        final Value v = record.get(field);

        if (v.isNull())
            return null;

        final Object o = v.asObject();

        return o instanceof String ? (String) o : String.valueOf(o);

    }

    public String toString() {

        return record.toString();

    }

}
