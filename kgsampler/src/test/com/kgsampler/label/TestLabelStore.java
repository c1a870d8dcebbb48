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
package com.kgsampler.label;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;

import com.kgsampler.index.EntityIndex;
import com.kgsampler.io.AbstractOutputTestCase;
import com.kgsampler.io.TSVWriter;

/**
 * Test suite for {@link LabelStore}.
 * 
 * @version $Id$
 */
public class TestLabelStore extends AbstractOutputTestCase {

    private EntityIndex index;

    private StringWriter labelsOut;

    public TestLabelStore() {
    }

    public TestLabelStore(String name) {
        super(name);
    }

    protected void setUp() throws Exception {

        super.setUp();

        index = new EntityIndex(new TSVWriter(new StringWriter()),
                new TSVWriter(new StringWriter()));

        labelsOut = new StringWriter();

    }

    public void test_writeLabel_once() throws IOException {

        final LabelStore store = new LabelStore(index, new TSVWriter(
                labelsOut), true);

        final int id = index.resolve("http://dbpedia.org/resource/Berlin", true);

        assertFalse(store.hasLabel(id));

        assertTrue(store.writeLabel(id, "Berlin", "Capital of Germany",
                "http://img/berlin.png"));

        assertTrue(store.hasLabel(id));

        // a second write is ignored, the first content persists.
        assertFalse(store.writeLabel(id, "Other", "Other", null));

        assertEquals(Arrays.asList("0\tBerlin\tCapital of Germany\thttp://img/berlin.png"),
                lines(labelsOut));

        assertEquals(1, store.size());

    }

    public void test_without_depiction() throws IOException {

        final LabelStore store = new LabelStore(index, new TSVWriter(
                labelsOut), false);

        index.resolve("http://x/A", true);

        final int id = index.resolve("http://x/B", true);

        store.writeLabel(id, new Label("B", null, "http://img/b.png"));

        assertEquals(Arrays.asList("1\tB\t"), lines(labelsOut));

    }

    public void test_markUnlabeled() throws IOException {

        final LabelStore store = new LabelStore(index, new TSVWriter(
                labelsOut), true);

        final int id = index.resolve("http://x/A", true);

        store.markUnlabeled(id);

        assertTrue(store.hasLabel(id));

        assertEquals(0, store.size());

        // the entity is done, a later label is ignored.
        assertFalse(store.writeLabel(id, "A", "a", null));

        assertEquals(0, lines(labelsOut).size());

    }

    public void test_hasLabel_by_uri() throws IOException {

        final LabelStore store = new LabelStore(index, new TSVWriter(
                labelsOut), true);

        final int id = index.resolve("http://x/A", true);

        assertFalse(store.hasLabel("http://x/A"));

        store.writeLabel(id, "A", "a", null);

        assertTrue(store.hasLabel("http://x/A"));

        try {
            store.hasLabel("http://x/never-indexed");
            fail("Expecting: " + IllegalStateException.class);
        } catch (IllegalStateException ex) {
            // expected
        }

    }

}
