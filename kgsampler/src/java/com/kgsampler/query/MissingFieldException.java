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

import java.util.Collection;

/**
 * Thrown when a record does not have a column which the query contract
 * requires. This indicates a mismatch between a query text and the code which
 * consumes its results.
 * 
 * @version $Id$
 */
public class MissingFieldException extends GraphQueryException {

    private static final long serialVersionUID = -1747826354890152233L;

    private final String field;

    /**
     * @param field
     *            The name of the missing column.
     * @param keys
     *            The columns which the record does have.
     */
    public MissingFieldException(final String field,
            final Collection<String> keys) {

        super("Record has no field '" + field + "': fields=" + keys);

        this.field = field;

    }

    /**
     * The name of the missing column.
     */
    public String getField() {

        return field;

    }

}
