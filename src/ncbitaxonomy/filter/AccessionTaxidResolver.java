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
package ncbitaxonomy.filter;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.HashMap;
import ncbitaxonomy.io.FastaRecord;
import ncbitaxonomy.io.FileFormatException;
import ncbitaxonomy.tree.TaxonNode;
import ncbitaxonomy.tree.Taxonomy;
import static ncbitaxonomy.util.FileUtils.getTextFileReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves records by accession through an NCBI {@code accession2taxid} table
 * (columns: accession, accession.version, taxid, gi) or a two-column
 * accession/taxid table. Accessions are matched without their version suffix.
 *
 * @author Ka Ming Nip
 */
public class AccessionTaxidResolver implements TaxonResolver {
    private static final Logger LOG = LoggerFactory.getLogger(AccessionTaxidResolver.class);

    private final Taxonomy taxonomy;
    private final HashMap<String, Integer> accessionToTaxid;

    public AccessionTaxidResolver(Taxonomy taxonomy, HashMap<String, Integer> accessionToTaxid) {
        this.taxonomy = taxonomy;
        this.accessionToTaxid = accessionToTaxid;
    }

    public static AccessionTaxidResolver read(Taxonomy taxonomy, String path) throws IOException {
        HashMap<String, Integer> map = new HashMap<>();

        try (BufferedReader br = getTextFileReader(path)) {
            long lineNumber = 0;
            for (String line; (line = br.readLine()) != null; ) {
                ++lineNumber;
                if (line.isEmpty() || (lineNumber == 1 && line.startsWith("accession"))) {
                    continue;
                }

                String[] fields = line.split("\t");
                if (fields.length < 2) {
                    throw new FileFormatException(path, lineNumber, "expected at least 2 tab-separated columns");
                }

                String taxidField = fields.length >= 3 ? fields[2] : fields[1];
                try {
                    map.put(stripVersion(fields[0]), Integer.parseInt(taxidField.trim()));
                }
                catch (NumberFormatException e) {
                    throw new FileFormatException(path, lineNumber, "invalid taxon id `" + taxidField + "`");
                }
            }
        }

        LOG.info("Read {} accessions from {}", map.size(), path);

        return new AccessionTaxidResolver(taxonomy, map);
    }

    static String stripVersion(String accession) {
        int dot = accession.lastIndexOf('.');
        return dot > 0 ? accession.substring(0, dot) : accession;
    }

    @Override
    public TaxonNode resolve(FastaRecord record) {
        Integer taxid = accessionToTaxid.get(stripVersion(record.name));
        return taxid == null ? null : taxonomy.findNode(taxid);
    }
}
