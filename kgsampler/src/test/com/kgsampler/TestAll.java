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
package com.kgsampler;

import junit.framework.Test;
import junit.framework.TestCase;
import junit.framework.TestSuite;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

/**
 * Aggregates test suites into increasing dependency order.
 * 
 * @version $Id$
 */
public class TestAll extends TestCase {

    public TestAll() {
    }

    public TestAll(String arg0) {
        super(arg0);
    }

    /**
     * Returns a test that will run each of the implementation specific test
     * suites in turn.
     */
    public static Test suite()
    {

        /*
         * log4j defaults to DEBUG which will produce simply huge amounts of
         * logging information when running the unit tests. Therefore we
         * explicitly set the default logging level to WARN if it is DEBUG.
         */
        {

            final Logger log = Logger.getRootLogger();

            if (log.getLevel() != null && log.getLevel().equals(Level.DEBUG)) {

                log.setLevel(Level.WARN);

                log.warn("Defaulting debugging level to WARN for the unit tests");

            }

        }

        final TestSuite suite = new TestSuite("kgsampler");

        suite.addTestSuite(com.kgsampler.query.TestQueryResource.class);

        suite.addTestSuite(com.kgsampler.io.TestTSVWriter.class);
        suite.addTestSuite(com.kgsampler.io.TestExtractionOutput.class);

        suite.addTestSuite(com.kgsampler.index.TestEntityIndex.class);
        suite.addTestSuite(com.kgsampler.label.TestLabelStore.class);
        suite.addTestSuite(com.kgsampler.statement.TestStatementWriter.class);

        suite.addTestSuite(com.kgsampler.fetch.TestPagedStatementIterator.class);
        suite.addTestSuite(com.kgsampler.fetch.TestSingleQueryStatementIterator.class);

        suite.addTestSuite(com.kgsampler.extract.TestExtractor.class);

        return suite;

    }

}
