package com.spreadsheet.formula.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the "formula" prefix, e.g.
 * formula.sheet.default-rows=1000
 * formula.sheet.default-cols=26
 */
@ConfigurationProperties(prefix = "formula")
public class FormulaEngineProperties {

    private final SheetDefaults sheet = new SheetDefaults();

    public SheetDefaults getSheet() {
        return sheet;
    }

    /**
     * Bounds given to new sheets when the request does not say otherwise.
     */
    public static class SheetDefaults {
        private int defaultRows = 1000;
        private int defaultCols = 26;

        public int getDefaultRows() {
            return defaultRows;
        }

        public void setDefaultRows(int defaultRows) {
            this.defaultRows = defaultRows;
        }

        public int getDefaultCols() {
            return defaultCols;
        }

        public void setDefaultCols(int defaultCols) {
            this.defaultCols = defaultCols;
        }
    }
}
