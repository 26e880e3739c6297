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

/**
 * Layout of a read classification report.
 *
 * @author Ka Ming Nip
 */
public enum ReportFormat {
    /**
     * Kraken2 per-read output: {@code C/U, read id, taxid or "name (taxid N)", ...}.
     * A read listed more than once is accepted only if every entry is accepted.
     */
    KRAKEN2,
    /**
     * Centrifuge per-read output: {@code readID, seqID, taxID, score, ...} after a header line.
     * A read is accepted if any of its best-scoring assignments is accepted.
     */
    CENTRIFUGE
}
