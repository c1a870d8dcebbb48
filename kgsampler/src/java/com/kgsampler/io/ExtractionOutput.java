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

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPOutputStream;

import org.apache.log4j.Logger;

/**
 * The five output streams of an extraction run, acquired and released as one
 * unit. Every stream is UTF-8 text inside gzip.
 * <ul>
 * <li>{@value #INDEX_FILE}: <code>(id, uri)</code> for each distinct entity</li>
 * <li>{@value #RELEVANT_ENTITIES_FILE}: <code>(id)</code> for each entity seen
 * as a subject or object</li>
 * <li>the labels file: <code>(id, label, description[, depiction])</code></li>
 * <li>{@value #STATEMENTS_TSV_FILE}:
 * <code>(subjectId, predicateId, objectId)</code></li>
 * <li>{@value #STATEMENTS_NT_FILE}: one N-Triples line per statement</li>
 * </ul>
 * {@link #close()} closes every stream, even when closing one of them fails.
 * 
 * @version $Id$
 */
public class ExtractionOutput implements Closeable {

    private static final Logger log = Logger.getLogger(ExtractionOutput.class);

    public static final String INDEX_FILE = "index.tsv.gz";

    public static final String RELEVANT_ENTITIES_FILE = "relevant_entities.tsv.gz";

    public static final String STATEMENTS_TSV_FILE = "statements.tsv.gz";

    public static final String STATEMENTS_NT_FILE = "statements.nt.gz";

    /**
     * The labels file name used by the paged extractors.
     */
    public static final String LABELS_FILE = "labels.tsv.gz";

    /**
     * The labels file name used by the single query sampler.
     */
    public static final String INDEX_LABELS_FILE = "index_labels.tsv.gz";

    private static final int BUF_SIZE = 64 * 1024;

    private final File dir;

    private final TSVWriter index;

    private final TSVWriter relevantEntities;

    private final TSVWriter labels;

    private final TSVWriter statementsTsv;

    private final Writer statementsNt;

    private boolean open = true;

    private ExtractionOutput(final File dir, final TSVWriter index,
            final TSVWriter relevantEntities, final TSVWriter labels,
            final TSVWriter statementsTsv, final Writer statementsNt) {

        this.dir = dir;
        this.index = index;
        this.relevantEntities = relevantEntities;
        this.labels = labels;
        this.statementsTsv = statementsTsv;
        this.statementsNt = statementsNt;

    }

    /**
     * Open the five output streams in a directory. The directory is created if
     * it does not exist and existing files are truncated. If any stream can not
     * be opened then the streams which were already opened are closed before
     * the exception is thrown.
     * 
     * @param dir
     *            The target directory.
     * @param labelsFileName
     *            The name of the labels file, e.g. {@value #LABELS_FILE}.
     * 
     * @throws IOException
     */
    public static ExtractionOutput open(final File dir,
            final String labelsFileName) throws IOException {

        if (dir == null)
            throw new IllegalArgumentException();

        if (labelsFileName == null)
            throw new IllegalArgumentException();

        if (!dir.exists()) {

            if (!dir.mkdirs() && !dir.isDirectory())
                throw new IOException("Could not create directory: " + dir);

            if (log.isInfoEnabled())
                log.info("Created data directory: " + dir);

        }

        if (!dir.isDirectory())
            throw new IOException("Not a directory: " + dir);

        final Writer[] opened = new Writer[5];
        
        final String[] names = new String[] { INDEX_FILE,
                RELEVANT_ENTITIES_FILE, labelsFileName, STATEMENTS_TSV_FILE,
                STATEMENTS_NT_FILE };

        try {

            for (int i = 0; i < names.length; i++) {

                opened[i] = openGzip(new File(dir, names[i]));

            }

        } catch (IOException ex) {

            for (Writer w : opened) {

                if (w == null)
                    continue;

                try {
                    w.close();
                } catch (IOException ex2) {
                    ex.addSuppressed(ex2);
                }

            }

            throw ex;

        }

        return new ExtractionOutput(dir, new TSVWriter(opened[0]),
                new TSVWriter(opened[1]), new TSVWriter(opened[2]),
                new TSVWriter(opened[3]), opened[4]);

    }

    private static Writer openGzip(final File file) throws IOException {

        final OutputStream os = new FileOutputStream(file);

        try {

            return new BufferedWriter(new OutputStreamWriter(
                    new GZIPOutputStream(os, BUF_SIZE), StandardCharsets.UTF_8),
                    BUF_SIZE);

        } catch (IOException ex) {

            os.close();

            throw ex;

        }

    }

    /**
     * The directory holding the output files.
     */
    public File getDirectory() {

        return dir;

    }

    public TSVWriter getIndex() {
        return index;
    }

    public TSVWriter getRelevantEntities() {
        return relevantEntities;
    }

    public TSVWriter getLabels() {
        return labels;
    }

    public TSVWriter getStatementsTsv() {
        return statementsTsv;
    }

    public Writer getStatementsNt() {
        return statementsNt;
    }

    /**
     * <code>true</code> until {@link #close()} is invoked.
     */
    public boolean isOpen() {

        return open;

    }

    /**
     * Flush and close all five streams. Every stream is closed even if an
     * earlier one fails. The first failure is thrown and any later failures are
     * attached to it as suppressed exceptions. Closing an already closed output
     * is a NOP.
     */
    public void close() throws IOException {

        if (!open)
            return;

        open = false;

        final Closeable[] all = new Closeable[] { index, relevantEntities,
                labels, statementsTsv, statementsNt };

        IOException cause = null;

        for (Closeable c : all) {

            try {

                c.close();

            } catch (IOException ex) {

                if (cause == null) {
                    cause = ex;
                } else {
                    cause.addSuppressed(ex);
                }

            }

        }

        if (cause != null)
            throw cause;

    }

}
