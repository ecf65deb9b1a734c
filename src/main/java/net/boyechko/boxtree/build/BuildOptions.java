/*
 * CSS-BoxTree - Formatting structure construction for CSS 2.1 layout
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.boxtree.build;

/** Options for a box tree build. Immutable; use {@link #builder()} or {@link #defaults()}. */
public final class BuildOptions {
    static final String COLLAPSE_OUTSIDE_MARKERS_PROPERTY = "boxtree.collapseOutsideMarkers";
    static final String COLLAPSE_OUTSIDE_MARKERS_ENV = "BOXTREE_COLLAPSE_OUTSIDE_MARKERS";
    static final String VERIFY_INVARIANTS_PROPERTY = "boxtree.verifyInvariants";
    static final String VERIFY_INVARIANTS_ENV = "BOXTREE_VERIFY_INVARIANTS";

    private final boolean collapseOutsideMarkers;
    private final boolean verifyInvariants;

    private BuildOptions(Builder builder) {
        this.collapseOutsideMarkers = builder.collapseOutsideMarkers;
        this.verifyInvariants = builder.verifyInvariants;
    }

    /** Options read from system properties, then the environment, falling back to false. */
    public static BuildOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Whether white-space processing also rewrites the text of outside list markers. */
    public boolean collapseOutsideMarkers() {
        return collapseOutsideMarkers;
    }

    /** Whether the service checks structural invariants between stages. */
    public boolean verifyInvariants() {
        return verifyInvariants;
    }

    @Override
    public String toString() {
        return "BuildOptions[collapseOutsideMarkers="
                + collapseOutsideMarkers
                + ", verifyInvariants="
                + verifyInvariants
                + "]";
    }

    public static class Builder {
        private boolean collapseOutsideMarkers =
                resolveFlag(COLLAPSE_OUTSIDE_MARKERS_PROPERTY, COLLAPSE_OUTSIDE_MARKERS_ENV);
        private boolean verifyInvariants =
                resolveFlag(VERIFY_INVARIANTS_PROPERTY, VERIFY_INVARIANTS_ENV);

        public Builder withCollapseOutsideMarkers(boolean collapseOutsideMarkers) {
            this.collapseOutsideMarkers = collapseOutsideMarkers;
            return this;
        }

        public Builder withVerifyInvariants(boolean verifyInvariants) {
            this.verifyInvariants = verifyInvariants;
            return this;
        }

        public BuildOptions build() {
            return new BuildOptions(this);
        }
    }

    static boolean resolveFlag(String property, String envVar) {
        // 1. JVM flag, e.g. -Dboxtree.verifyInvariants=true
        String sysProp = System.getProperty(property);
        if (sysProp != null) return Boolean.parseBoolean(sysProp.trim());

        // 2. Environment variable, e.g. BOXTREE_VERIFY_INVARIANTS=true
        String env = System.getenv(envVar);
        if (env != null) return Boolean.parseBoolean(env.trim());

        return false;
    }
}
