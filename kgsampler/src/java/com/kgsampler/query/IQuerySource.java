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
 * The queries which define one extraction target. An extraction depends only
 * on this capability, never on a particular target.
 * 
 * @version $Id$
 */
public interface IQuerySource {

    /**
     * A short name for the extraction target (used in log messages).
     */
    String getName();

    /**
     * The query producing the statements to be extracted. Its records have the
     * columns <code>subj</code>, <code>pred</code> and <code>obj</code>. When
     * {@link #isPaged()} the query takes the parameters <code>skip</code> and
     * <code>limit</code>.
     */
    String getStatementQuery();

    /**
     * The query producing the label of one entity -or- <code>null</code> if
     * entities are not labeled for this target. It takes the parameter
     * <code>uri</code> and its records have the columns <code>label</code>,
     * <code>description</code> and <code>depiction</code>.
     */
    String getLabelQuery();

    /**
     * <code>true</code> iff the statement query is executed page by page.
     * Otherwise it runs once and its result is streamed in full.
     */
    boolean isPaged();

}
