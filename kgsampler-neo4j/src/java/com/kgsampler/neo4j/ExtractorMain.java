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

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.Neo4jException;

import com.kgsampler.extract.ExtractionResult;
import com.kgsampler.extract.Extractor;
import com.kgsampler.query.GraphQueryException;

/**
 * Command line entry point. Extracts one dataset from a Neo4j instance into a
 * data directory. The process exits with status ONE (1) if the extraction
 * fails.
 * 
 * @see ExtractorConfig#getUsage()
 * 
 * @version $Id$
 */
public class ExtractorMain {

    private static final Logger log = Logger.getLogger(ExtractorMain.class);

    public static void main(final String[] args) {

        final ExtractorConfig config;
        try {
            config = ExtractorConfig.parse(args, System.getenv());
        } catch (IllegalArgumentException ex) {
            System.err.println(ex.getMessage());
            System.err.println(ExtractorConfig.getUsage());
            System.exit(1);
            return;
        }

        Logger.getRootLogger().setLevel(
                Level.toLevel(config.getLogLevel(), Level.INFO));

        try {

            final ExtractionResult result = extract(config);

            if (log.isInfoEnabled())
                log.info(result);

        } catch (Throwable t) {

            log.error("Extraction failed: " + config, t);

            System.exit(1);

        }

    }

    /**
     * Connect to Neo4j and run the extraction described by the configuration.
     */
    public static ExtractionResult extract(final ExtractorConfig config)
            throws Exception {

        if (log.isInfoEnabled())
            log.info(config);

        final Dataset dataset = config.getDataset();

        final DatasetQuerySource querySource = new DatasetQuerySource(dataset);

        final Driver driver;
        try {
            driver = GraphDatabase.driver(config.getUri(),
                    AuthTokens.basic(config.getUsername(), config.getPassword()));
        } catch (Neo4jException ex) {
            throw new GraphQueryException("Could not connect: "
                    + config.getUri(), ex);
        }

        try {

            final Session session = driver.session(SessionConfig
                    .forDatabase(ExtractorConfig.DATABASE));

            try {

                final Extractor extractor = new Extractor(config.getDataDir(),
                        new Neo4jGraphSession(session), querySource,
                        dataset.getProperties());

                return extractor.run();

            } finally {

                session.close();

            }

        } finally {

            driver.close();

        }

    }

}
