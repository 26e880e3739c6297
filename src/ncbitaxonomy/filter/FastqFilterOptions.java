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
 *
 * @author Ka Ming Nip
 */
public class FastqFilterOptions {
    private final ReportFormat reportFormat;
    private final UnmappedReadPolicy unmappedReadPolicy;
    private final String outputDir;
    private final boolean toStdout;

    /**
     * @param reportFormat        layout of the classification report
     * @param unmappedReadPolicy  handling of reads missing from the report
     * @param outputDir           directory for filtered files, or null to write next to each input
     * @param toStdout            write the single input's records to standard output
     */
    public FastqFilterOptions(ReportFormat reportFormat, UnmappedReadPolicy unmappedReadPolicy,
            String outputDir, boolean toStdout) {
        this.reportFormat = reportFormat;
        this.unmappedReadPolicy = unmappedReadPolicy;
        this.outputDir = outputDir;
        this.toStdout = toStdout;
    }

    public ReportFormat getReportFormat() {
        return reportFormat;
    }

    public UnmappedReadPolicy getUnmappedReadPolicy() {
        return unmappedReadPolicy;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public boolean isToStdout() {
        return toStdout;
    }
}
