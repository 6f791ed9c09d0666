package io.github.yok.ciflink.codec;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Utility class for the {@code category-ordering.txt} file of a CSV block directory.
 *
 * <p>
 * The file lists the category names of the block, one per line, in block order. It lets a CSV
 * import restore the order in which categories were exported.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class CategoryOrderingFile {

    public static final String FILE_NAME = "category-ordering.txt";

    private CategoryOrderingFile() {
        throw new AssertionError("CategoryOrderingFile must not be instantiated.");
    }

    /**
     * Writes the category list to {@code category-ordering.txt} under {@code dir}.
     *
     * @param dir block directory
     * @param categories ordered category names
     * @throws IOException if the file cannot be written
     */
    public static void write(File dir, List<String> categories) throws IOException {
        File orderFile = new File(dir, FILE_NAME);
        String content = String.join(System.lineSeparator(), categories);
        FileUtils.writeStringToFile(orderFile, content, StandardCharsets.UTF_8);
        log.debug("Generated {}: {}", FILE_NAME, orderFile.getAbsolutePath());
    }

    /**
     * Reads the category list. Blank lines are ignored.
     *
     * @param dir block directory
     * @return ordered category names, or an empty list if the file does not exist
     * @throws IOException if the file cannot be read
     */
    public static List<String> read(File dir) throws IOException {
        File orderFile = new File(dir, FILE_NAME);
        List<String> result = new ArrayList<>();
        if (!orderFile.isFile()) {
            return result;
        }
        for (String line : FileUtils.readLines(orderFile, StandardCharsets.UTF_8)) {
            if (StringUtils.isNotBlank(line)) {
                result.add(line.trim());
            }
        }
        return result;
    }
}
