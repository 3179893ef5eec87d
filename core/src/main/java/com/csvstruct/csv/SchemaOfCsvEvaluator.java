package com.csvstruct.csv;

import com.csvstruct.config.SessionConf;
import com.csvstruct.exception.SchemaInferenceException;
import com.csvstruct.types.DataType;
import com.csvstruct.types.StructType;

import java.io.IOException;
import java.util.Map;

/**
 * Infers the schema of a single CSV record and renders it as DDL.
 *
 * <pre>
 *   new SchemaOfCsvEvaluator(Map.of()).evaluate("1,abc");   // STRUCT&lt;_c0: INT, _c1: STRING&gt;
 * </pre>
 */
public class SchemaOfCsvEvaluator {

    private final CsvOptions options;
    private final CsvTokenizer tokenizer;
    private final CsvInferSchema inferSchema;

    public SchemaOfCsvEvaluator(Map<String, String> options) {
        this(new CsvOptions(options, true, SessionConf.active().sessionTimeZone()));
    }

    public SchemaOfCsvEvaluator(CsvOptions options) {
        this.options = options;
        this.tokenizer = options.newTokenizer();
        this.inferSchema = new CsvInferSchema(options);
    }

    /**
     * Infers the schema of the record.
     *
     * @param csv the sample record
     * @return the schema in DDL form
     * @throws SchemaInferenceException if the sample holds no record or cannot be tokenized
     */
    public String evaluate(String csv) {
        return infer(csv).sql();
    }

    /**
     * Infers the schema of the record.
     *
     * @param csv the sample record
     * @return the schema
     * @throws SchemaInferenceException if the sample holds no record or cannot be tokenized
     */
    public StructType infer(String csv) {
        if (csv == null || csv.isEmpty()) {
            throw new SchemaInferenceException("Parsed CSV record should not be null");
        }
        String[] tokens;
        try {
            tokens = tokenizer.parseLine(csv);
        } catch (IOException e) {
            throw new SchemaInferenceException("Cannot tokenize CSV sample '" + csv + "': " + e.getMessage(), e);
        }
        if (tokens == null) {
            throw new SchemaInferenceException("Parsed CSV record should not be null");
        }
        for (int i = 0; i < tokens.length; i++) {
            if (tokens[i] != null && options.ignoreTrailingWhiteSpaceInRead()) {
                tokens[i] = tokens[i].stripTrailing();
            }
        }
        DataType[] types = inferSchema.inferRowType(inferSchema.startType(tokens.length), tokens);
        return inferSchema.toStructType(types);
    }

    public CsvOptions options() {
        return options;
    }
}
