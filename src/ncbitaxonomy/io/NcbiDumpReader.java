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
package ncbitaxonomy.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.regex.Pattern;
import static ncbitaxonomy.io.Constants.DMP_FIELD_SEPARATOR;
import static ncbitaxonomy.io.Constants.DMP_LINE_TERMINATOR;
import static ncbitaxonomy.io.Constants.NAMES_DMP;
import static ncbitaxonomy.io.Constants.NODES_DMP;
import static ncbitaxonomy.util.FileUtils.getTextFileReader;
import ncbitaxonomy.TaxonomyException;
import ncbitaxonomy.tree.NodeStore;
import ncbitaxonomy.tree.TaxonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@code nodes.dmp} and {@code names.dmp} from an NCBI Taxonomy dump
 * into a {@link NodeStore}. Only scientific names are kept; where NCBI gives a
 * disambiguating unique name for a homonym, the unique name is used.
 *
 * @author Ka Ming Nip
 */
public class NcbiDumpReader {
    private static final Logger LOG = LoggerFactory.getLogger(NcbiDumpReader.class);
    private static final Pattern FIELD_SEPARATOR_PATTERN = Pattern.compile(Pattern.quote(DMP_FIELD_SEPARATOR));
    private static final String SCIENTIFIC_NAME = "scientific name";

    /**
     * @param dir     directory holding the dump files
     * @param prefix  string prepended to the names of {@code nodes.dmp} and {@code names.dmp}, may be empty
     */
    public static NodeStore readDirectory(String dir, String prefix) throws IOException, TaxonomyException {
        File nodes = new File(dir, prefix + NODES_DMP);
        if (!nodes.isFile()) {
            throw new IOException("NCBI Taxonomy " + prefix + NODES_DMP + " file not found in " + dir);
        }

        File names = new File(dir, prefix + NAMES_DMP);
        if (!names.isFile()) {
            throw new IOException("NCBI Taxonomy " + prefix + NAMES_DMP + " file not found in " + dir);
        }

        return read(nodes.getPath(), names.getPath());
    }

    public static NodeStore read(String nodesPath, String namesPath) throws IOException, TaxonomyException {
        HashMap<Integer, Integer> parents = new HashMap<>();
        HashMap<Integer, String> ranks = new HashMap<>();

        try (BufferedReader br = getTextFileReader(nodesPath)) {
            long lineNumber = 0;
            for (String line; (line = br.readLine()) != null; ) {
                ++lineNumber;
                if (line.isEmpty()) {
                    continue;
                }

                String[] fields = split(line);
                if (fields.length < 3) {
                    throw new FileFormatException(nodesPath, lineNumber, "expected at least 3 fields");
                }

                int id = parseId(fields[0], nodesPath, lineNumber);
                int parentId = parseId(fields[1], nodesPath, lineNumber);
                if (parents.put(id, parentId == id ? TaxonNode.NO_PARENT : parentId) != null) {
                    throw new FileFormatException(nodesPath, lineNumber, "taxon " + id + " listed more than once");
                }
                ranks.put(id, fields[2].intern());
            }
        }

        LOG.info("Read {} nodes from {}", parents.size(), nodesPath);

        NodeStore store = new NodeStore(parents.size());

        try (BufferedReader br = getTextFileReader(namesPath)) {
            long lineNumber = 0;
            for (String line; (line = br.readLine()) != null; ) {
                ++lineNumber;
                if (line.isEmpty()) {
                    continue;
                }

                String[] fields = split(line);
                if (fields.length < 4) {
                    throw new FileFormatException(namesPath, lineNumber, "expected 4 fields");
                }

                if (!fields[3].startsWith(SCIENTIFIC_NAME)) {
                    continue;
                }

                int id = parseId(fields[0], namesPath, lineNumber);
                Integer parentId = parents.get(id);
                if (parentId == null) {
                    throw new FileFormatException(namesPath, lineNumber, "taxon " + id + " is not in " + nodesPath);
                }

                String name = fields[2].isEmpty() ? fields[1] : fields[2];
                store.insert(id, name, ranks.get(id), parentId);
            }
        }

        if (store.size() != parents.size()) {
            for (Integer id : parents.keySet()) {
                if (!store.containsId(id)) {
                    throw new FileFormatException("taxon " + id + " has no scientific name in " + namesPath);
                }
            }
        }

        LOG.info("Read {} scientific names from {}", store.size(), namesPath);

        return store;
    }

    private static String[] split(String line) {
        if (line.endsWith(DMP_LINE_TERMINATOR)) {
            line = line.substring(0, line.length() - DMP_LINE_TERMINATOR.length());
        }
        return FIELD_SEPARATOR_PATTERN.split(line, -1);
    }

    private static int parseId(String field, String path, long lineNumber) throws FileFormatException {
        try {
            return Integer.parseInt(field.trim());
        }
        catch (NumberFormatException e) {
            throw new FileFormatException(path, lineNumber, "invalid taxon id `" + field + "`");
        }
    }
}
