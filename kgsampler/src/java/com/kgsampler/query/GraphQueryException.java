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
 * Thrown when the graph database can not be reached, refuses the credentials
 * or fails to execute a query. These failures are fatal to an extraction run
 * and are never retried.
 * 
 * @version $Id$
 */
public class GraphQueryException extends RuntimeException {

    private static final long serialVersionUID = 4011583219547436021L;

    public GraphQueryException(final String msg) {

        super(msg);

    }

    public GraphQueryException(final String msg, final Throwable cause) {

        super(msg, cause);

    }

}
