package com.chicu.homeprice.ml.dataset;

import java.util.List;

/**
 * В датасете нет обязательных колонок. Обучение не запускается.
 */
public class SchemaException extends DatasetException {

    private final List<String> missingColumns;

    public SchemaException(List<String> missingColumns) {
        super("dataset is missing required columns: " + missingColumns);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
