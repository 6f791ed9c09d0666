package io.github.yok.ciflink.codec;

import io.github.yok.ciflink.model.Category;
import io.github.yok.ciflink.model.DataBlock;
import io.github.yok.ciflink.model.DataContainer;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.apache.commons.io.FileUtils;

/**
 * Exports records as CSV: one directory per block, one UTF-8 file per category.
 *
 * <pre>
 * out/
 *   1ABC/
 *     category-ordering.txt
 *     entity.csv
 *     entity_poly.csv
 * </pre>
 *
 * <p>
 * Each file has a header row with the item names. Values are written verbatim, null tokens
 * included.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvCategoryExporter {

    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder().setQuoteMode(QuoteMode.MINIMAL)
            .setRecordSeparator("\n").get();

    /**
     * Exports a container.
     *
     * @param container records
     * @param outputDir root directory; created if missing
     * @throws IOException if a file cannot be written
     */
    public void export(DataContainer container, File outputDir) throws IOException {
        for (DataBlock block : container.getBlocks()) {
            File blockDir = new File(outputDir, block.getName());
            FileUtils.forceMkdir(blockDir);
            for (Category category : block.getCategories()) {
                writeCategory(category, new File(blockDir, category.getName() + ".csv"));
            }
            CategoryOrderingFile.write(blockDir, block.getCategoryNames());
            log.info("Exported block {} to {} ({} categories)", block.getName(),
                    blockDir.getAbsolutePath(), block.getCategoryNames().size());
        }
    }

    private void writeCategory(Category category, File csvFile) throws IOException {
        List<String> items = category.getItemNames();
        CSVFormat fmt = FORMAT.builder().setHeader(items.toArray(new String[0])).get();
        try (Writer w =
                new OutputStreamWriter(new FileOutputStream(csvFile), StandardCharsets.UTF_8);
                CSVPrinter printer = new CSVPrinter(w, fmt)) {
            for (int r = 0; r < category.getRowCount(); r++) {
                List<String> values = new ArrayList<>(items.size());
                for (String item : items) {
                    values.add(category.getValue(r, item));
                }
                printer.printRecord(values);
            }
        }
    }
}
