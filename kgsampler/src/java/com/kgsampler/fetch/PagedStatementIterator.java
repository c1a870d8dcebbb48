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
package com.kgsampler.fetch;

import java.util.HashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import com.kgsampler.query.IGraphSession;
import com.kgsampler.query.IQueryResult;

/**
 * Visits the statements of a query which is executed one page at a time. The
 * query is run with the parameters {@value #SKIP} and {@value #LIMIT}. Once a
 * page has been drained the skip is advanced by the page size and the next
 * page is requested. The iteration ends with the first page whose probe finds
 * no record.
 * <p>
 * Pages are not prefetched, so the order of the statements is the order of the
 * records within each page, page by page.
 * 
 * @version $Id$
 */
public class PagedStatementIterator extends AbstractStatementIterator {

    private static final Logger log = Logger
            .getLogger(PagedStatementIterator.class);

    public static final String SKIP = "skip";

    public static final String LIMIT = "limit";

    /**
     * The default #of records per page.
     */
    public static final int DEFAULT_PAGE_SIZE = 1000000;

    private final int pageSize;

    /**
     * The skip of the current page.
     */
    private long skip = 0L;

    /**
     * The current page and <code>null</code> until the first page is
     * requested.
     */
    private IQueryResult page = null;

    /**
     * The #of non-empty pages.
     */
    private int npages = 0;

    private boolean exhausted = false;

    public PagedStatementIterator(final IGraphSession session,
            final String query) {

        this(session, query, DEFAULT_PAGE_SIZE);

    }

    /**
     * @param session
     *            The session used to run the query.
     * @param query
     *            The statement query.
     * @param pageSize
     *            The #of records per page.
     */
    public PagedStatementIterator(final IGraphSession session,
            final String query, final int pageSize) {

        super(session, query);

        if (pageSize <= 0)
            throw new IllegalArgumentException();

        this.pageSize = pageSize;

    }

    protected IQueryResult current() {

        if (exhausted)
            return null;

        if (page != null && page.hasNext())
            return page;

        if (page != null) {

            // the current page is drained.
            skip += pageSize;

        }

        page = session.run(query, params());

        if (!page.hasNext()) {

            if (log.isDebugEnabled())
                log.debug("No more records: skip=" + skip);

            exhausted = true;

            page = null;

            return null;

        }

        npages++;

        if (log.isDebugEnabled())
            log.debug("Fetched page: skip=" + skip + ", limit=" + pageSize);

        return page;

    }

    private Map<String, Object> params() {

        final Map<String, Object> params = new HashMap<String, Object>();

        params.put(SKIP, skip);

        params.put(LIMIT, pageSize);

        return params;

    }

    /**
     * The #of pages which produced at least one record so far.
     */
    public int getPageCount() {

        return npages;

    }

    public int getPageSize() {

        return pageSize;

    }

}
