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
import java.util.Map;

/**
 * The settings of one command line invocation. Each connection setting is
 * taken from its command line option, else from its environment variable,
 * else from its default.
 * 
 * @version $Id$
 */
public class ExtractorConfig {

    public static final String ENV_HOSTNAME = "NEO4J_HOSTNAME";

    public static final String ENV_BOLT_PORT = "NEO4J_BOLT_PORT";

    public static final String ENV_USERNAME = "NEO4J_USERNAME";

    public static final String ENV_PASSWORD = "NEO4J_PASSWORD";

    public static final String ENV_LOG_LEVEL = "LOG_LEVEL";

    public static final String DEFAULT_HOSTNAME = "localhost";

    public static final int DEFAULT_BOLT_PORT = 7687;

    public static final String DEFAULT_USERNAME = "neo4j";

    public static final String DEFAULT_PASSWORD = "neo4j";

    public static final String DEFAULT_LOG_LEVEL = "INFO";

    /**
     * The database holding the knowledge graph.
     */
    public static final String DATABASE = "neo4j";

    private final Dataset dataset;

    private final File dataDir;

    private final String host;

    private final int port;

    private final String username;

    private final String password;

    private final String logLevel;

    ExtractorConfig(final Dataset dataset, final File dataDir,
            final String host, final int port, final String username,
            final String password, final String logLevel) {

        this.dataset = dataset;
        this.dataDir = dataDir;
        this.host = host;
        this.port = port;
        this.username = username;
        this.password = password;
        this.logLevel = logLevel;

    }

    /**
     * Parse the command line.
     * 
     * @param args
     *            <code>dataset [--data-dir dir] [--host host] [--port port]
     *            [--username user] [--password password]</code>
     * @param env
     *            The environment variables.
     * 
     * @throws IllegalArgumentException
     *             if the command line is not valid.
     */
    public static ExtractorConfig parse(final String[] args,
            final Map<String, String> env) {

        if (args.length == 0)
            throw new IllegalArgumentException("No dataset given");

        final Dataset dataset = Dataset.forCommand(args[0]);

        String dataDir = null;
        String host = env.get(ENV_HOSTNAME);
        String port = env.get(ENV_BOLT_PORT);
        String username = env.get(ENV_USERNAME);
        String password = env.get(ENV_PASSWORD);

        for (int i = 1; i < args.length; i += 2) {

            final String opt = args[i];

            if (i + 1 >= args.length)
                throw new IllegalArgumentException("No value for " + opt);

            final String val = args[i + 1];

            if (opt.equals("--data-dir")) {
                dataDir = val;
            } else if (opt.equals("--host")) {
                host = val;
            } else if (opt.equals("--port")) {
                port = val;
            } else if (opt.equals("--username")) {
                username = val;
            } else if (opt.equals("--password")) {
                password = val;
            } else {
                throw new IllegalArgumentException("Unknown option: " + opt);
            }

        }

        final File dir = dataDir != null ? new File(dataDir)
                : defaultDataDir(dataset);

        final String logLevel = env.get(ENV_LOG_LEVEL);

        return new ExtractorConfig(dataset, dir,
                host != null ? host : DEFAULT_HOSTNAME,
                port != null ? parsePort(port) : DEFAULT_BOLT_PORT,
                username != null ? username : DEFAULT_USERNAME,
                password != null ? password : DEFAULT_PASSWORD,
                logLevel != null ? logLevel : DEFAULT_LOG_LEVEL);

    }

    /**
     * The default data directory: <code>data/&lt;dataset&gt;</code> below the
     * working directory.
     */
    public static File defaultDataDir(final Dataset dataset) {

        return new File(new File(System.getProperty("user.dir"), "data"),
                dataset.getCommand());

    }

    private static int parsePort(final String s) {

        final int port;
        try {
            port = Integer.parseInt(s.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Not a port: " + s, ex);
        }

        if (port <= 0 || port > 65535)
            throw new IllegalArgumentException("Not a port: " + s);

        return port;

    }

    /**
     * The usage message.
     */
    public static String getUsage() {

        final StringBuilder sb = new StringBuilder();

        sb.append("Usage: ExtractorMain <dataset> [--data-dir dir] [--host host]"
                + " [--port port] [--username user] [--password password]\n");

        sb.append("Datasets:");

        for (Dataset d : Dataset.values()) {

            sb.append(' ').append(d.getCommand());

        }

        sb.append('\n');

        sb.append("Environment: " + ENV_HOSTNAME + ", " + ENV_BOLT_PORT + ", "
                + ENV_USERNAME + ", " + ENV_PASSWORD + ", " + ENV_LOG_LEVEL);

        return sb.toString();

    }

    public Dataset getDataset() {
        return dataset;
    }

    public File getDataDir() {
        return dataDir;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getLogLevel() {
        return logLevel;
    }

    /**
     * The URI of the Neo4j instance.
     */
    public String getUri() {

        return "neo4j://" + host + ":" + port;

    }

    /**
     * Note: the password is not shown.
     */
    public String toString() {

        return "ExtractorConfig{dataset=" + dataset.getCommand() + ",dataDir="
                + dataDir + ",uri=" + getUri() + ",username=" + username + "}";

    }

}
