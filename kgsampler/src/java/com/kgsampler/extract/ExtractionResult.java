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

/**
 * The counts reported by a completed extraction run.
 * 
 * @version $Id$
 */
public class ExtractionResult {

    private final long statementCount;

    private final int entityCount;

    private final int relevantEntityCount;

    private final int labelCount;

    public ExtractionResult(final long statementCount, final int entityCount,
            final int relevantEntityCount, final int labelCount) {

        this.statementCount = statementCount;
        this.entityCount = entityCount;
        this.relevantEntityCount = relevantEntityCount;
        this.labelCount = labelCount;

    }

    /**
     * The #of statements written (duplicates included).
     */
    public long getStatementCount() {
        return statementCount;
    }

    /**
     * The #of distinct entities indexed.
     */
    public int getEntityCount() {
        return entityCount;
    }

    /**
     * The #of entities written to the relevant entities table.
     */
    public int getRelevantEntityCount() {
        return relevantEntityCount;
    }

    /**
     * The #of label rows written.
     */
    public int getLabelCount() {
        return labelCount;
    }

    public String toString() {

        return "ExtractionResult{statements=" + statementCount + ",entities="
                + entityCount + ",relevantEntities=" + relevantEntityCount
                + ",labels=" + labelCount + "}";

    }

}
