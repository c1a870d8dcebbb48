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

import java.io.File;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import junit.framework.TestCase;

/**
 * Test suite for {@link ExtractorConfig}.
 * 
 * @version $Id$
 */
public class TestExtractorConfig extends TestCase {

    public TestExtractorConfig() {
    }

    public TestExtractorConfig(String name) {
        super(name);
    }

    private static final Map<String, String> NO_ENV = Collections.emptyMap();

    public void test_defaults() {

        final ExtractorConfig c = ExtractorConfig.parse(
                new String[] { "dbpedia1m" }, NO_ENV);

        assertEquals(Dataset.DBPEDIA_1M, c.getDataset());
        assertEquals("localhost", c.getHost());
        assertEquals(7687, c.getPort());
        assertEquals("neo4j", c.getUsername());
        assertEquals("neo4j", c.getPassword());
        assertEquals("INFO", c.getLogLevel());
        assertEquals("neo4j://localhost:7687", c.getUri());

        assertEquals(new File(new File(System.getProperty("user.dir"), "data"),
                "dbpedia1m"), c.getDataDir());

    }

    public void test_environment() {

        final Map<String, String> env = new HashMap<String, String>();
        env.put(ExtractorConfig.ENV_HOSTNAME, "graph.example.org");
        env.put(ExtractorConfig.ENV_BOLT_PORT, "17687");
        env.put(ExtractorConfig.ENV_USERNAME, "reader");
        env.put(ExtractorConfig.ENV_PASSWORD, "secret");
        env.put(ExtractorConfig.ENV_LOG_LEVEL, "DEBUG");

        final ExtractorConfig c = ExtractorConfig.parse(
                new String[] { "sample1m" }, env);

        assertEquals("graph.example.org", c.getHost());
        assertEquals(17687, c.getPort());
        assertEquals("reader", c.getUsername());
        assertEquals("secret", c.getPassword());
        assertEquals("DEBUG", c.getLogLevel());

        // the password is not shown.
        assertFalse(c.toString().contains("secret"));

    }

    /**
     * Command line options win over the environment.
     */
    public void test_options_override_environment() {

        final Map<String, String> env = new HashMap<String, String>();
        env.put(ExtractorConfig.ENV_HOSTNAME, "graph.example.org");
        env.put(ExtractorConfig.ENV_BOLT_PORT, "17687");

        final ExtractorConfig c = ExtractorConfig.parse(new String[] {
                "dbpedia250k", "--host", "db", "--port", "7688",
                "--data-dir", "/tmp/kg", "--username", "u", "--password",
                "p" }, env);

        assertEquals(Dataset.DBPEDIA_250K, c.getDataset());
        assertEquals("db", c.getHost());
        assertEquals(7688, c.getPort());
        assertEquals(new File("/tmp/kg"), c.getDataDir());
        assertEquals("u", c.getUsername());
        assertEquals("p", c.getPassword());

    }

    public void test_invalid() {

        final String[][] bad = new String[][] {//
                new String[] {},//
                new String[] { "nosuchdataset" },//
                new String[] { "dbpedia1m", "--port", "http" },//
                new String[] { "dbpedia1m", "--port", "70000" },//
                new String[] { "dbpedia1m", "--host" },//
                new String[] { "dbpedia1m", "--verbose", "true" },//
        };

        for (String[] args : bad) {

            try {
                ExtractorConfig.parse(args, NO_ENV);
                fail("Expecting: " + IllegalArgumentException.class);
            } catch (IllegalArgumentException ex) {
                // expected
            }

        }

    }

    public void test_usage_lists_datasets() {

        final String usage = ExtractorConfig.getUsage();

        for (Dataset d : Dataset.values()) {

            assertTrue(usage, usage.contains(d.getCommand()));

        }

    }

}
