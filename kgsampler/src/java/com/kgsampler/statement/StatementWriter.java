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
package com.kgsampler.statement;

import java.io.IOException;
import java.io.Writer;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.rio.ntriples.NTriplesUtil;

import com.kgsampler.index.EntityIndex;
import com.kgsampler.io.TSVWriter;

/**
 * Writes extracted statements in two forms: a row of entity identifiers in a
 * tab separated table and a self-describing N-Triples line. The identifiers
 * are resolved against the {@link EntityIndex} in the order subject, predicate,
 * object. The subject and the object are relevant entities, the predicate is
 * not.
 * <p>
 * Statements are not de-duplicated. A statement written twice produces two
 * rows in each form.
 * <p>
 * Every term must be an IRI which N-Triples can carry inside an IRI reference
 * (see {@link #isIRIRef(String)}). Non-ASCII characters are written as
 * unicode escapes.
 * 
 * @version $Id$
 */
public class StatementWriter {

    private final EntityIndex index;

    private final TSVWriter tsv;

    private final Writer nt;

    /**
     * The #of statements written.
     */
    private long nwritten = 0L;

    /**
     * @param index
     *            The index used to resolve entity identifiers.
     * @param tsv
     *            The table receiving the identifier rows.
     * @param nt
     *            The stream receiving the N-Triples lines.
     */
    public StatementWriter(final EntityIndex index, final TSVWriter tsv,
            final Writer nt) {

        if (index == null)
            throw new IllegalArgumentException();

        if (tsv == null)
            throw new IllegalArgumentException();

        if (nt == null)
            throw new IllegalArgumentException();

        this.index = index;
        this.tsv = tsv;
        this.nt = nt;

    }

    public void write(final Statement stmt) throws IOException {

        write(stmt.getSubject(), stmt.getPredicate(), stmt.getObject());

    }

    /**
     * Write one statement.
     * 
     * @throws IOException
     */
    public void write(final Resource s, final URI p, final Value o)
            throws IOException {

        checkIRI(s);
        checkIRI(p);
        checkIRI(o);

        final int sid = index.resolve(s.stringValue(), true/* relevant */);

        final int pid = index.resolve(p.stringValue(), false/* relevant */);

        final int oid = index.resolve(o.stringValue(), true/* relevant */);

        tsv.writeRow(sid, pid, oid);

        final StringBuilder sb = new StringBuilder();

        sb.append(NTriplesUtil.toNTriplesString(s));
        sb.append(' ');
        sb.append(NTriplesUtil.toNTriplesString(p));
        sb.append(' ');
        sb.append(NTriplesUtil.toNTriplesString(o));
        sb.append(" .\n");

        nt.write(sb.toString());

        nwritten++;

    }

    /**
     * The #of statements written.
     */
    public long getStatementCount() {

        return nwritten;

    }

    /**
     * @throws IllegalArgumentException
     *             unless the value is a URI accepted by {@link #isIRIRef(String)}.
     */
    private static void checkIRI(final Value v) {

        if (!(v instanceof URI))
            throw new IllegalArgumentException("Not a URI: " + v);

        if (!isIRIRef(v.stringValue()))
            throw new IllegalArgumentException("Not an IRI reference: <" + v
                    + ">");

    }

    /**
     * Return <code>true</code> iff the string is an absolute IRI which may be
     * written inside an N-Triples IRI reference. The scheme must be present and
     * none of the characters <code>\x00-\x20 &lt; &gt; " { } | ^ ` \</code> may
     * appear.
     */
    public static boolean isIRIRef(final String s) {

        if (s == null)
            return false;

        final int colon = s.indexOf(':');

        if (colon < 1 || !Character.isLetter(s.charAt(0)))
            return false;

        for (int i = 0; i < s.length(); i++) {

            final char c = s.charAt(i);

            if (c <= 0x20)
                return false;

            switch (c) {
            case '<':
            case '>':
            case '"':
            case '{':
            case '}':
            case '|':
            case '^':
            case '`':
            case '\\':
                return false;
            }

        }

        return true;

    }

}
