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
package com.kgsampler.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;

import junit.framework.TestCase;

/**
 * Base class for tests which write files. Each test gets a fresh temporary
 * directory which is removed afterwards.
 * 
 * @version $Id$
 */
abstract public class AbstractOutputTestCase extends TestCase {

    protected File tmpDir;

    public AbstractOutputTestCase() {
    }

    public AbstractOutputTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {

        super.setUp();

        tmpDir = File.createTempFile(getClass().getSimpleName() + "-"
                + getName(), "");

        if (!tmpDir.delete() || !tmpDir.mkdir())
            throw new IOException("Could not create: " + tmpDir);

    }

    protected void tearDown() throws Exception {

        if (tmpDir != null)
            recursiveDelete(tmpDir);

        tmpDir = null;

        super.tearDown();

    }

    private static void recursiveDelete(final File f) {

        final File[] children = f.listFiles();

        if (children != null) {

            for (File c : children) {

                recursiveDelete(c);

            }

        }

        if (!f.delete())
            f.deleteOnExit();

    }

    /**
     * Read the lines of a gzip compressed UTF-8 file.
     */
    protected static List<String> readLines(final File file)
            throws IOException {

        final BufferedReader r = new BufferedReader(new InputStreamReader(
                new GZIPInputStream(new FileInputStream(file)),
                StandardCharsets.UTF_8));

        try {

            final List<String> lines = new ArrayList<String>();

            String line;

            while ((line = r.readLine()) != null) {

                lines.add(line);

            }

            return lines;

        } finally {

            r.close();

        }

    }

    /**
     * The rows written onto an in-memory {@link TSVWriter}.
     */
    protected static List<String> lines(final StringWriter w) {

        final List<String> lines = new ArrayList<String>();

        final String s = w.toString();

        if (s.length() == 0)
            return lines;

        for (String line : s.split("\n", -1)) {

            lines.add(line);

        }

        // the trailing newline yields an empty last element.
        assertEquals("", lines.remove(lines.size() - 1));

        return lines;

    }

}
