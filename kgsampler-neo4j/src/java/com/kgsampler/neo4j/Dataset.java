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

import java.util.Properties;

import com.kgsampler.extract.Extractor;
import com.kgsampler.io.ExtractionOutput;

/**
 * The extraction targets. Each names the classpath resource holding its
 * statement query and the way its output is laid out. The paged targets label
 * their entities, the single query sample does not.
 * 
 * @version $Id$
 */
public enum Dataset {

    DBPEDIA_35M("dbpedia35m", "dbpedia35m_statements.query", true, true,
            1000000),

    DBPEDIA_1M("dbpedia1m", "dbpedia1m_statements.query", true, true,
            1000000),

    DBPEDIA_500K("dbpedia500k", "dbpedia500k_statements.query", true, true,
            1000000),

    DBPEDIA_250K("dbpedia250k", "dbpedia250k_statements.query", true, true,
            1000000),

    DBPEDIA_A240("dbpediaA240", "dbpediaA240_statements.query", true, true,
            1000000),

    SAMPLE_1M("sample1m", "sample1m_statements.query", false, false, 100000);

    /**
     * The classpath location of the query texts.
     */
    public static final String QUERY_PATH = "/com/kgsampler/neo4j/query/";

    /**
     * The label query shared by the targets which label their entities.
     */
    public static final String LABEL_QUERY = "label.query";

    private final String command;

    private final String statementQuery;

    private final boolean paged;

    private final boolean labeled;

    private final int progressInterval;

    private Dataset(final String command, final String statementQuery,
            final boolean paged, final boolean labeled,
            final int progressInterval) {

        this.command = command;
        this.statementQuery = statementQuery;
        this.paged = paged;
        this.labeled = labeled;
        this.progressInterval = progressInterval;

    }

    /**
     * The name under which the target is selected on the command line.
     */
    public String getCommand() {
        return command;
    }

    /**
     * The classpath resource of the statement query.
     */
    public String getStatementQueryResource() {
        return QUERY_PATH + statementQuery;
    }

    /**
     * The classpath resource of the label query -or- <code>null</code> if the
     * target does not label its entities.
     */
    public String getLabelQueryResource() {
        return labeled ? QUERY_PATH + LABEL_QUERY : null;
    }

    public boolean isPaged() {
        return paged;
    }

    public boolean isLabeled() {
        return labeled;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    /**
     * The {@link Extractor.Options} for this target.
     */
    public Properties getProperties() {

        final Properties p = new Properties();

        p.setProperty(Extractor.Options.PROGRESS_INTERVAL, ""
                + getProgressInterval());

        if (labeled) {

            p.setProperty(Extractor.Options.LABELS_FILE,
                    ExtractionOutput.LABELS_FILE);

            p.setProperty(Extractor.Options.WRITE_DEPICTION, "true");

        } else {

            p.setProperty(Extractor.Options.LABELS_FILE,
                    ExtractionOutput.INDEX_LABELS_FILE);

            p.setProperty(Extractor.Options.WRITE_DEPICTION, "false");

        }

        return p;

    }

    /**
     * Return the target selected by a command name.
     * 
     * @throws IllegalArgumentException
     *             if no target has that name.
     */
    public static Dataset forCommand(final String command) {

        for (Dataset d : values()) {

            if (d.command.equals(command))
                return d;

        }

        throw new IllegalArgumentException("Unknown dataset: " + command);

    }

}
