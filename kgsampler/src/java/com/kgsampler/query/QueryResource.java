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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Loads query texts from the classpath. A query text is read once and then held
 * as an immutable string for the life of the run.
 * 
 * @version $Id$
 */
public class QueryResource {

    private QueryResource() {

    }

    /**
     * Read a query text (UTF-8).
     * 
     * @param resourceName
     *            The absolute name of a classpath resource, e.g.
     *            <code>/com/kgsampler/neo4j/query/label.query</code>.
     * 
     * @return The query text.
     * 
     * @throws IllegalArgumentException
     *             if there is no such resource.
     * @throws RuntimeException
     *             if the resource can not be read.
     */
    public static String load(final String resourceName) {

        if (resourceName == null)
            throw new IllegalArgumentException();

        final InputStream is = QueryResource.class
                .getResourceAsStream(resourceName);

        if (is == null)
            throw new IllegalArgumentException("No such query: "
                    + resourceName);

        try {

            try {

                final ByteArrayOutputStream baos = new ByteArrayOutputStream();

                final byte[] buf = new byte[4096];

                int n;

                while ((n = is.read(buf)) != -1) {

                    baos.write(buf, 0, n);

                }

                return new String(baos.toByteArray(), StandardCharsets.UTF_8);

            } finally {

                is.close();

            }

        } catch (IOException ex) {

            throw new RuntimeException("Could not read query: "
                    + resourceName, ex);

        }

    }

}
