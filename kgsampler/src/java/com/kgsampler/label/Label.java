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

/**
 * The human readable label of an entity. Any of the fields may be
 * <code>null</code>.
 * 
 * @version $Id$
 */
public class Label {

    private final String label;

    private final String description;

    private final String depiction;

    /**
     * @param label
     *            The label text.
     * @param description
     *            The description text.
     * @param depiction
     *            A reference to a depiction of the entity (typically the URL of
     *            an image).
     */
    public Label(final String label, final String description,
            final String depiction) {

        this.label = label;
        this.description = description;
        this.depiction = depiction;

    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    public String getDepiction() {
        return depiction;
    }

    public String toString() {

        return "Label{label=" + label + ",description=" + description
                + ",depiction=" + depiction + "}";

    }

}
