/* 
 * Copyright (C) 2018-present BC Cancer Genome Sciences Centre
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package ncbitaxonomy.db;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.HashMap;
import ncbitaxonomy.TaxonomyException;
import ncbitaxonomy.tree.Ancestry;
import ncbitaxonomy.tree.AncestryIndexer;
import ncbitaxonomy.tree.MalformedTaxonomyException;
import ncbitaxonomy.tree.NodeStore;
import ncbitaxonomy.tree.TaxonNode;
import ncbitaxonomy.tree.Taxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores an indexed taxonomy in the {@code taxonomy} table of a JDBC database
 * (H2 by default) and loads it back.
 *
 * @author Ka Ming Nip
 */
public class TaxonomyDatabase {
    private static final Logger LOG = LoggerFactory.getLogger(TaxonomyDatabase.class);

    public static final String URL_ENV = "NCBI_TAXONOMY_DB";
    public static final String DEFAULT_URL = "jdbc:h2:file:./taxonomy";

    private static final String CREATE_TABLE =
            "CREATE TABLE IF NOT EXISTS taxonomy ("
            + "id INTEGER PRIMARY KEY, "
            + "ancestry VARCHAR, "
            + "name VARCHAR NOT NULL UNIQUE, "
            + "rank VARCHAR)";
    private static final String CREATE_NAME_INDEX =
            "CREATE UNIQUE INDEX IF NOT EXISTS taxonomy_name_idx ON taxonomy(name)";
    private static final String INSERT =
            "INSERT INTO taxonomy (id, ancestry, name, rank) VALUES (?, ?, ?, ?)";
    private static final String SELECT_ALL =
            "SELECT id, ancestry, name, rank FROM taxonomy";
    private static final int BATCH_SIZE = 10000;

    private final String jdbcUrl;

    public TaxonomyDatabase(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    /**
     * @param url JDBC URL given on the command line, may be null
     * @return {@code url}, else the value of {@link #URL_ENV}, else {@link #DEFAULT_URL}
     */
    public static String resolveUrl(String url) {
        if (url != null) {
            return url;
        }

        String env = System.getenv(URL_ENV);
        if (env != null && !env.isEmpty()) {
            return env;
        }

        return DEFAULT_URL;
    }

    public String getUrl() {
        return jdbcUrl;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    public void createSchema() throws IOException {
        try (Connection conn = connect();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE);
            stmt.execute(CREATE_NAME_INDEX);
        }
        catch (SQLException e) {
            throw new IOException("Failed to create taxonomy table in " + jdbcUrl, e);
        }
    }

    /**
     * Replaces the content of the table with {@code taxonomy} in a single
     * transaction; on failure the previous content is kept.
     */
    public void save(Taxonomy taxonomy) throws IOException {
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);

            try (Statement stmt = conn.createStatement();
                 PreparedStatement insert = conn.prepareStatement(INSERT)) {
                stmt.execute(CREATE_TABLE);
                stmt.execute(CREATE_NAME_INDEX);
                stmt.executeUpdate("DELETE FROM taxonomy");

                int pending = 0;
                for (TaxonNode node : taxonomy.nodes()) {
                    insert.setInt(1, node.id);
                    if (node.getAncestry().isEmpty()) {
                        insert.setNull(2, Types.VARCHAR);
                    }
                    else {
                        insert.setString(2, node.getAncestry().encode());
                    }
                    insert.setString(3, node.name);
                    if (node.rank == null) {
                        insert.setNull(4, Types.VARCHAR);
                    }
                    else {
                        insert.setString(4, node.rank);
                    }
                    insert.addBatch();

                    if (++pending == BATCH_SIZE) {
                        insert.executeBatch();
                        pending = 0;
                    }
                }

                if (pending > 0) {
                    insert.executeBatch();
                }

                conn.commit();
            }
            catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
        catch (SQLException e) {
            throw new IOException("Failed to save taxonomy to " + jdbcUrl, e);
        }

        LOG.info("Saved {} taxa to {}", taxonomy.size(), jdbcUrl);
    }

    /**
     * @return number of rows in the taxonomy table, 0 if the table does not exist
     */
    public int countRows() throws IOException {
        try (Connection conn = connect();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE);
            try (ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM taxonomy")) {
                rs.next();
                return rs.getInt(1);
            }
        }
        catch (SQLException e) {
            throw new IOException("Failed to count taxa in " + jdbcUrl, e);
        }
    }

    /**
     * Rebuilds the taxonomy from stored rows. The parent of each taxon is the
     * last id of its stored ancestry; the tree is re-indexed and every stored
     * ancestry must match the derived one.
     *
     * @throws MalformedTaxonomyException if the rows do not form a tree or a stored ancestry is inconsistent
     */
    public Taxonomy load() throws IOException, TaxonomyException {
        NodeStore store = new NodeStore();
        HashMap<Integer, Ancestry> storedAncestries = new HashMap<>();

        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(SELECT_ALL)) {
            while (rs.next()) {
                int id = rs.getInt(1);
                Ancestry ancestry;
                try {
                    ancestry = Ancestry.decode(rs.getString(2));
                }
                catch (NumberFormatException e) {
                    throw new MalformedTaxonomyException(id, "taxon " + id + " has an unreadable ancestry: " + rs.getString(2));
                }
                int parentId = ancestry.isEmpty() ? TaxonNode.NO_PARENT : ancestry.last();
                store.insert(id, rs.getString(3), rs.getString(4), parentId);
                storedAncestries.put(id, ancestry);
            }
        }
        catch (SQLException e) {
            throw new IOException("Failed to load taxonomy from " + jdbcUrl, e);
        }

        LOG.info("Loaded {} taxa from {}", store.size(), jdbcUrl);

        Taxonomy taxonomy = AncestryIndexer.index(store);

        for (TaxonNode node : taxonomy.nodes()) {
            Ancestry stored = storedAncestries.get(node.id);
            if (!node.getAncestry().equals(stored)) {
                throw new MalformedTaxonomyException(node.id, "stored ancestry of taxon " + node.id
                        + " (" + stored + ") does not match its lineage (" + node.getAncestry() + ")");
            }
        }

        return taxonomy;
    }
}
