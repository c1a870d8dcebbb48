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

/**
 * One row of an {@link IQueryResult}, exposing its columns by name.
 * 
 * @version $Id$
 */
public interface IQueryRecord {

    /**
     * Return <code>true</code> iff the record has a column with that name.
     */
    boolean containsKey(String field);

    /**
     * Return the value of the named column as a string.
     * 
     * @param field
     *            The column name.
     * 
     * @return The value -or- <code>null</code> if the column is present but
     *         its value is null.
     * 
     * @throws MissingFieldException
     *             if the record has no such column.
     */
    String getString(String field);

}
