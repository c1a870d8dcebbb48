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
package com.kgsampler.extract;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.Properties;

import org.apache.log4j.Logger;
import org.openrdf.model.Statement;
import org.openrdf.model.Value;

import com.kgsampler.fetch.PagedStatementIterator;
import com.kgsampler.fetch.SingleQueryStatementIterator;
import com.kgsampler.index.EntityIndex;
import com.kgsampler.io.ExtractionOutput;
import com.kgsampler.label.Label;
import com.kgsampler.label.LabelStore;
import com.kgsampler.query.IGraphSession;
import com.kgsampler.query.IQueryRecord;
import com.kgsampler.query.IQueryResult;
import com.kgsampler.query.IQuerySource;
import com.kgsampler.statement.StatementWriter;

/**
 * Extracts a subgraph from the knowledge graph and writes it into a data
 * directory. The statements are pulled one at a time from the statement query
 * of an {@link IQuerySource}. Each statement is written and, when the source
 * labels entities, the subject and the object are labeled the first time they
 * are seen.
 * <p>
 * An extractor runs once: {@link RunState#Idle} to {@link RunState#Running}
 * and then to {@link RunState#Completed} or {@link RunState#Failed}. The five
 * output streams are closed on both exits. A new run requires a new
 * extractor.
 * <p>
 * Note: Everything happens on the caller's thread. The identifier assignment
 * and the exactly-once writes depend on this.
 * <p>
 * Note: The label lookups run on the same {@link IGraphSession} as the
 * statement query while a page is still being read. A client whose session
 * allows one open result at a time (the Neo4j driver) buffers the rest of
 * that page in memory before the lookup runs, so the memory demand grows with
 * {@link Options#PAGE_SIZE}. Lower the page size if this is a problem.
 *
 * @version $Id$
 */
public class Extractor {

    private static final Logger log = Logger.getLogger(Extractor.class);

    /**
     * The life cycle of an {@link Extractor}.
     */
    public static enum RunState {
        Idle, Running, Completed, Failed;
    }

    /**
     * Options understood by the {@link Extractor}. Options are specified as
     * property values to the {@link Extractor} constructor.
     */
    public static interface Options {

        /**
         * The #of records requested per page when the statement query is
         * paged (default {@value #DEFAULT_PAGE_SIZE}).
         */
        String PAGE_SIZE = Extractor.class.getName() + ".pageSize";

        String DEFAULT_PAGE_SIZE = ""
                + PagedStatementIterator.DEFAULT_PAGE_SIZE;

        /**
         * A progress message is logged each time this many statements have
         * been loaded (default {@value #DEFAULT_PROGRESS_INTERVAL}).
         */
        String PROGRESS_INTERVAL = Extractor.class.getName()
                + ".progressInterval";

        String DEFAULT_PROGRESS_INTERVAL = "1000000";

        /**
         * The name of the labels file in the data directory (default
         * {@value #DEFAULT_LABELS_FILE}).
         */
        String LABELS_FILE = Extractor.class.getName() + ".labelsFile";

        String DEFAULT_LABELS_FILE = ExtractionOutput.LABELS_FILE;

        /**
         * When <code>true</code> the label rows carry the depiction column
         * (default {@value #DEFAULT_WRITE_DEPICTION}).
         */
        String WRITE_DEPICTION = Extractor.class.getName() + ".writeDepiction";

        String DEFAULT_WRITE_DEPICTION = "true";

    }

    public static final String LABEL = "label";

    public static final String DESCRIPTION = "description";

    public static final String DEPICTION = "depiction";

    public static final String URI = "uri";

    private final File dataDir;

    private final IGraphSession session;

    private final IQuerySource querySource;

    private final int pageSize;

    private final int progressInterval;

    private final String labelsFile;

    private final boolean writeDepiction;

    private volatile RunState state = RunState.Idle;

    /**
     * @param dataDir
     *            The directory receiving the output files. It is created if it
     *            does not exist.
     * @param session
     *            The session against the graph database.
     * @param querySource
     *            The queries defining the extraction target.
     * @param properties
     *            See {@link Options}.
     */
    public Extractor(final File dataDir, final IGraphSession session,
            final IQuerySource querySource, final Properties properties) {

        if (dataDir == null)
            throw new IllegalArgumentException();

        if (session == null)
            throw new IllegalArgumentException();

        if (querySource == null)
            throw new IllegalArgumentException();

        if (properties == null)
            throw new IllegalArgumentException();

        this.dataDir = dataDir;
        this.session = session;
        this.querySource = querySource;

        this.pageSize = getPositiveInt(properties, Options.PAGE_SIZE,
                Options.DEFAULT_PAGE_SIZE);

        this.progressInterval = getPositiveInt(properties,
                Options.PROGRESS_INTERVAL, Options.DEFAULT_PROGRESS_INTERVAL);

        this.labelsFile = properties.getProperty(Options.LABELS_FILE,
                Options.DEFAULT_LABELS_FILE);

        this.writeDepiction = Boolean.parseBoolean(properties.getProperty(
                Options.WRITE_DEPICTION, Options.DEFAULT_WRITE_DEPICTION));

        if (log.isInfoEnabled())
            log.info("source=" + querySource.getName() + ", dataDir="
                    + dataDir + ", paged=" + querySource.isPaged()
                    + ", pageSize=" + pageSize + ", progressInterval="
                    + progressInterval + ", labelsFile=" + labelsFile);

    }

    private static int getPositiveInt(final Properties properties,
            final String name, final String def) {

        final String s = properties.getProperty(name, def);

        final int v;
        try {
            v = Integer.parseInt(s.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + "=" + s, ex);
        }

        if (v <= 0)
            throw new IllegalArgumentException(name + "=" + s);

        return v;

    }

    public RunState getState() {

        return state;

    }

    /**
     * Run the extraction.
     * 
     * @return The counts for the run.
     * 
     * @throws IOException
     *             if an output file could not be written.
     * @throws com.kgsampler.query.GraphQueryException
     *             if a query failed or returned a malformed record.
     * @throws IllegalStateException
     *             if this extractor has already been run.
     */
    public ExtractionResult run() throws IOException {

        synchronized (this) {

            if (state != RunState.Idle)
                throw new IllegalStateException("state=" + state);

            state = RunState.Running;

        }

        try {

            final ExtractionResult result = doRun();

            state = RunState.Completed;

            return result;

        } catch (IOException ex) {

            state = RunState.Failed;

            throw ex;

        } catch (RuntimeException ex) {

            state = RunState.Failed;

            throw ex;

        } catch (Error err) {

            state = RunState.Failed;

            throw err;

        }

    }

    private ExtractionResult doRun() throws IOException {

        final ExtractionOutput out = ExtractionOutput.open(dataDir, labelsFile);

        try {

            final EntityIndex index = new EntityIndex(out.getIndex(),
                    out.getRelevantEntities());

            final LabelStore labels = new LabelStore(index, out.getLabels(),
                    writeDepiction);

            final StatementWriter writer = new StatementWriter(index,
                    out.getStatementsTsv(), out.getStatementsNt());

            final boolean labeling = querySource.getLabelQuery() != null;

            final Iterator<Statement> itr = fetchStatements();

            long n = 0L;

            while (itr.hasNext()) {

                final Statement stmt = itr.next();

                writer.write(stmt);

                if (labeling) {

                    label(index, labels, stmt.getSubject());

                    label(index, labels, stmt.getObject());

                }

                n++;

                if (n % progressInterval == 0 && log.isInfoEnabled()) {

                    log.info("Loaded " + n + " statements.");

                }

            }

            out.close();

            if (log.isInfoEnabled())
                log.info("Successfully loaded " + n + " statements.");

            return new ExtractionResult(n, index.size(),
                    index.getRelevantCount(), labels.size());

        } finally {

            if (out.isOpen()) {

                try {

                    out.close();

                } catch (IOException ex) {

                    // do not mask the exception which is already propagating.
                    log.error("Could not close output: " + dataDir, ex);

                }

            }

        }

    }

    /**
     * Return the statements of the statement query.
     */
    protected Iterator<Statement> fetchStatements() {

        if (querySource.isPaged()) {

            return new PagedStatementIterator(session,
                    querySource.getStatementQuery(), pageSize);

        }

        return new SingleQueryStatementIterator(session,
                querySource.getStatementQuery());

    }

    private void label(final EntityIndex index, final LabelStore labels,
            final Value entity) throws IOException {

        final String uri = entity.stringValue();

        final int id = index.get(uri);

        if (id == EntityIndex.NULL)
            throw new IllegalStateException("Entity was not indexed: " + uri);

        if (labels.hasLabel(id))
            return;

        final Label label = fetchLabel(uri);

        if (label == null) {

            if (log.isDebugEnabled())
                log.debug("No label: " + uri);

            labels.markUnlabeled(id);

        } else {

            labels.writeLabel(id, label);

        }

    }

    /**
     * Fetch the label of an entity.
     * 
     * @param uri
     *            The URI of the entity.
     * 
     * @return The label from the first record of the label query -or-
     *         <code>null</code> if the query produced no record.
     */
    protected Label fetchLabel(final String uri) {

        final IQueryResult result = session.run(querySource.getLabelQuery(),
                Collections.<String, Object> singletonMap(URI, uri));

        if (!result.hasNext())
            return null;

        final IQueryRecord record = result.next();

        return new Label(record.getString(LABEL),
                record.getString(DESCRIPTION), record.getString(DEPICTION));

    }

}
