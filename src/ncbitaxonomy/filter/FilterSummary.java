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
 * Record counts of one filtering run over one input.
 *
 * @author Ka Ming Nip
 */
public class FilterSummary {
    private final String source;
    long numRead = 0;
    long numWritten = 0;
    long numExcluded = 0;
    long numUnresolved = 0;
    long numUnmapped = 0;
    long numMalformed = 0;

    public FilterSummary(String source) {
        this.source = source;
    }

    public String getSource() {
        return source;
    }

    public long getNumRead() {
        return numRead;
    }

    public long getNumWritten() {
        return numWritten;
    }

    /** records dropped because of their accession class */
    public long getNumExcluded() {
        return numExcluded;
    }

    /** records whose taxon could not be determined */
    public long getNumUnresolved() {
        return numUnresolved;
    }

    /** reads missing from the classification report and skipped */
    public long getNumUnmapped() {
        return numUnmapped;
    }

    /** records skipped because they could not be parsed */
    public long getNumMalformed() {
        return numMalformed;
    }

    /** records whose taxon is outside the target subtree */
    public long getNumRejected() {
        return numRead - numWritten - numExcluded - numUnresolved - numUnmapped - numMalformed;
    }

    @Override
    public String toString() {
        return numWritten + " records written out of " + numRead + " total records";
    }
}
