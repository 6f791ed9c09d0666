package io.github.yok.ciflink.codec;

import io.github.yok.ciflink.model.Category;
import io.github.yok.ciflink.model.DataBlock;
import io.github.yok.ciflink.model.DataContainer;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FilenameUtils;

/**
 * Reads a CSV directory written by {@link CsvCategoryExporter}.
 *
 * <p>
 * The directory either holds one sub-directory per block, or CSV files directly, in which case it
 * is read as a single block named after the directory. Within a block, categories follow
 * {@code category-ordering.txt}; files it does not list are appended in name order.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvCategoryReader {

    /**
     * Reads a CSV directory.
     *
     * @param dir root directory
     * @return records
     * @throws IOException if a file cannot be read or is malformed
     */
    public DataContainer read(File dir) throws IOException {
        if (!dir.isDirectory()) {
            throw new IOException("Not a directory: " + dir);
        }
        DataContainer container = new DataContainer();
        if (csvFiles(dir).isEmpty()) {
            File[] blockDirs = dir.listFiles(File::isDirectory);
            if (blockDirs != null) {
                Arrays.sort(blockDirs);
                for (File blockDir : blockDirs) {
                    container.addBlock(readBlock(blockDir));
                }
            }
        } else {
            container.addBlock(readBlock(dir));
        }
        return container;
    }

    private DataBlock readBlock(File blockDir) throws IOException {
        DataBlock block = new DataBlock(blockDir.getName());
        List<String> order = new ArrayList<>(CategoryOrderingFile.read(blockDir));
        for (File csv : csvFiles(blockDir)) {
            String name = FilenameUtils.getBaseName(csv.getName());
            if (!order.contains(name)) {
                order.add(name);
            }
        }
        for (String name : order) {
            File csv = new File(blockDir, name + ".csv");
            if (!csv.isFile()) {
                log.warn("{} lists {} but {} does not exist", CategoryOrderingFile.FILE_NAME,
                        name, csv.getAbsolutePath());
                continue;
            }
            block.addCategory(readCategory(name, csv));
        }
        log.info("Read CSV block {} ({} categories)", block.getName(),
                block.getCategoryNames().size());
        return block;
    }

    private Category readCategory(String name, File csv) throws IOException {
        CSVFormat fmt = CsvCategoryExporter.FORMAT.builder().setHeader(new String[0])
                .setSkipHeaderRecord(true).get();
        try (BufferedReader reader = Files.newBufferedReader(csv.toPath(), StandardCharsets.UTF_8);
                CSVParser parser = CSVParser.builder().setReader(reader).setFormat(fmt).get()) {
            List<String> headers = parser.getHeaderNames();
            List<List<String>> columns = new ArrayList<>();
            for (int i = 0; i < headers.size(); i++) {
                columns.add(new ArrayList<>());
            }
            for (CSVRecord record : parser) {
                if (record.size() != headers.size()) {
                    throw new IOException(csv.getName() + " line " + record.getRecordNumber()
                            + " has " + record.size() + " values, expected " + headers.size());
                }
                for (int i = 0; i < headers.size(); i++) {
                    columns.get(i).add(record.get(i));
                }
            }
            Category category = new Category(name);
            for (int i = 0; i < headers.size(); i++) {
                category.addItem(headers.get(i), columns.get(i));
            }
            return category;
        }
    }

    private static List<File> csvFiles(File dir) {
        File[] files = dir.listFiles(
                (d, n) -> DataFormat.CSV.matches(FilenameUtils.getExtension(n)));
        List<File> result = new ArrayList<>();
        if (files != null) {
            result.addAll(Arrays.asList(files));
        }
        result.sort(null);
        return result;
    }
}
