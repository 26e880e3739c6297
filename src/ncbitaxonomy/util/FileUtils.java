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
package ncbitaxonomy.util;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.zip.GZIPInputStream;
import static ncbitaxonomy.io.Constants.BUFFER_SIZE;
import static ncbitaxonomy.io.Constants.FILTERED_INFIX;
import static ncbitaxonomy.io.Constants.GZIP_EXT;
import ncbitaxonomy.io.FastGZIPOutputStream;

/**
 *
 * @author Ka Ming Nip
 */
public class FileUtils {

    public static BufferedReader getTextFileReader(String path) throws IOException {
        if (path.toLowerCase().endsWith(GZIP_EXT)) {
            return new BufferedReader(new InputStreamReader(new GZIPInputStream(new FileInputStream(path), BUFFER_SIZE), StandardCharsets.UTF_8), BUFFER_SIZE);
        }
        else {
            return new BufferedReader(new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8), BUFFER_SIZE);
        }
    }

    public static Writer getTextFileWriter(String path) throws IOException {
        if (path.toLowerCase().endsWith(GZIP_EXT)) {
            return new BufferedWriter(
                        new OutputStreamWriter(
                            new FastGZIPOutputStream(
                                new FileOutputStream(path),
                                BUFFER_SIZE),
                            StandardCharsets.UTF_8),
                        BUFFER_SIZE);
        }
        else {
            return new BufferedWriter(new OutputStreamWriter(new FileOutputStream(path), StandardCharsets.UTF_8), BUFFER_SIZE);
        }
    }

    /**
     * Closing the returned writer flushes but does not close {@code stdout}.
     */
    public static Writer getStdoutWriter(OutputStream stdout) {
        return new BufferedWriter(
                new OutputStreamWriter(
                    new FilterOutputStream(stdout) {
                        @Override
                        public void write(byte[] b, int off, int len) throws IOException {
                            out.write(b, off, len);
                        }

                        @Override
                        public void close() throws IOException {
                            flush();
                        }
                    },
                    StandardCharsets.UTF_8),
                BUFFER_SIZE);
    }

    /**
     * Inserts {@code filtered} after the first dot-separated component of a file name,
     * e.g. {@code reads_1.fastq.gz} becomes {@code reads_1.filtered.fastq.gz}.
     */
    public static String getFilteredFileName(String fileName) {
        int dot = fileName.indexOf('.');
        if (dot < 0) {
            return fileName + "." + FILTERED_INFIX;
        }

        return fileName.substring(0, dot) + "." + FILTERED_INFIX + fileName.substring(dot);
    }

    public static void mkdirs(String dir) throws IOException {
        Files.createDirectories(Paths.get(dir));
    }

    public static void deleteIfExists(String p) throws IOException {
        Files.deleteIfExists(Paths.get(p));
    }

    public static void checkReadable(String path) throws IOException {
        File f = new File(path);
        if (!f.isFile() || !f.canRead()) {
            throw new IOException("Cannot read file `" + path + "`");
        }
    }
}
