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

import com.kgsampler.query.IQuerySource;
import com.kgsampler.query.QueryResource;

/**
 * The Cypher queries of a {@link Dataset}. The query texts are loaded when the
 * source is created and do not change afterwards.
 * 
 * @version $Id$
 */
public class DatasetQuerySource implements IQuerySource {

    private final Dataset dataset;

    private final String statementQuery;

    private final String labelQuery;

    public DatasetQuerySource(final Dataset dataset) {

        if (dataset == null)
            throw new IllegalArgumentException();

        this.dataset = dataset;

        this.statementQuery = QueryResource.load(dataset
                .getStatementQueryResource());

        final String labelResource = dataset.getLabelQueryResource();

        this.labelQuery = labelResource == null ? null : QueryResource
                .load(labelResource);

    }

    public String getName() {
        return dataset.getCommand();
    }

    public String getStatementQuery() {
        return statementQuery;
    }

    public String getLabelQuery() {
        return labelQuery;
    }

    public boolean isPaged() {
        return dataset.isPaged();
    }

}
