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

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.Writer;

/**
 * Writes rows of tab separated values. This is the counterpart of a delimited
 * data reader: each row is one line, columns are separated by a tab and the
 * line is terminated by a newline.
 * <p>
 * A column whose text contains a tab, a double quote, a carriage return or a
 * newline is enclosed in double quotes and any embedded double quotes are
 * doubled. A <code>null</code> column is written as the empty string.
 * <p>
 * Note: Rows are written in full or not at all from the perspective of the
 * caller, but the underlying {@link Writer} decides when bytes reach the disk.
 * 
 * @version $Id$
 */
public class TSVWriter implements Closeable, Flushable {

    public static final char DELIMITER = '\t';

    public static final char QUOTE = '"';

    private final Writer w;

    /**
     * The #of rows written.
     */
    private long nrows = 0L;

    public TSVWriter(final Writer w) {

        if (w == null)
            throw new IllegalArgumentException();

        this.w = w;

    }

    /**
     * Write one row.
     * 
     * @param cols
     *            The column values. Each is written using its
     *            {@link Object#toString()} form.
     * 
     * @throws IOException
     */
    public void writeRow(final Object... cols) throws IOException {

        final StringBuilder sb = new StringBuilder();

        for (int i = 0; i < cols.length; i++) {

            if (i > 0)
                sb.append(DELIMITER);

            if (cols[i] != null)
                appendColumn(sb, cols[i].toString());

        }

        sb.append('\n');

        w.write(sb.toString());

        nrows++;

    }

    /**
     * The #of rows written so far.
     */
    public long getRowCount() {

        return nrows;

    }

    private static void appendColumn(final StringBuilder sb, final String s) {

        if (!needsQuoting(s)) {

            sb.append(s);

            return;

        }

        sb.append(QUOTE);

        for (int i = 0; i < s.length(); i++) {

            final char c = s.charAt(i);

            if (c == QUOTE)
                sb.append(QUOTE);

            sb.append(c);

        }

        sb.append(QUOTE);

    }

    private static boolean needsQuoting(final String s) {

        for (int i = 0; i < s.length(); i++) {

            switch (s.charAt(i)) {
            case DELIMITER:
            case QUOTE:
            case '\r':
            case '\n':
                return true;
            }

        }

        return false;

    }

    public void flush() throws IOException {

        w.flush();

    }

    public void close() throws IOException {

        w.close();

    }

}
