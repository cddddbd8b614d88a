package work.stepweave.engine.transform;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import work.stepweave.engine.error.TransformException;
import work.stepweave.engine.model.TransformSpec.CsvParse;

/**
 * CSV/TSV with a header row into a list of row maps, via commons-csv.
 */
final class DelimitedParser {
    private static final char[] CANDIDATE_DELIMITERS = {',', '\t', ';', '|'};

    private DelimitedParser() {}

    static List<Map<String, Object>> parse(String text, CsvParse spec) {
        var data = text.strip();
        char delimiter = spec.delimiter() != null ? spec.delimiter() : detectDelimiter(data);
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setDelimiter(delimiter)
            .setHeader()
            .setSkipHeaderRecord(true)
            .setAllowMissingColumnNames(true)
            .build();
        List<Map<String, Object>> rows = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(new StringReader(data), format)) {
            List<String> headers = parser.getHeaderNames();
            int row = 0;
            for (CSVRecord record : parser) {
                row++;
                if (spec.strictValidation() && record.size() != headers.size()) {
                    throw new TransformException(spec.method(),
                        "Row " + row + " has " + record.size() + " fields, expected " + headers.size());
                }
                Map<String, Object> values = new LinkedHashMap<>();
                for (int i = 0; i < headers.size(); i++) {
                    values.put(headers.get(i), i < record.size() ? record.get(i) : "");
                }
                rows.add(values);
            }
        } catch (IOException | IllegalArgumentException | IllegalStateException ex) {
            throw new TransformException(spec.method(), "Error parsing CSV: " + ex.getMessage(), ex);
        }
        return rows;
    }

    /**
     * Most frequent of {@code , \t ; |} in the first 1000 characters; comma when none occurs.
     */
    static char detectDelimiter(String data) {
        var sample = data.length() > 1000 ? data.substring(0, 1000) : data;
        char best = ',';
        long bestCount = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            long count = sample.chars().filter(c -> c == candidate).count();
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }
}
